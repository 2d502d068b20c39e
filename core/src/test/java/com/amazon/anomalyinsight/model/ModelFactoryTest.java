/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalyinsight.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.anomalyinsight.config.ModelConfig;
import com.amazon.anomalyinsight.config.ModelType;

public class ModelFactoryTest {

    @ParameterizedTest
    @EnumSource(ModelType.class)
    public void testModelTypeMatchesConfig(ModelType type) {
        IAnomalyModel model = ModelFactory.createModel(new ModelConfig(type));
        assertEquals(type, model.getModelType());
    }

    @Test
    public void testMissingTypeFallsBackToStatistical() {
        assertTrue(ModelFactory.createModel(new ModelConfig()) instanceof StatisticalModel);
    }

    @Test
    public void testParameters() {
        ModelConfig config = new ModelConfig(ModelType.ISOLATION_FOREST)
                .withParameter(ModelConfig.ISOLATION_TREE_COUNT, 25)
                .withParameter(ModelConfig.SAMPLE_SIZE, "64")
                .withParameter(ModelConfig.MAX_DEPTH, 6L);
        IsolationForestModel forest = (IsolationForestModel) ModelFactory.createModel(config);
        assertEquals(25, forest.getNumberOfTrees());
        assertEquals(64, forest.getSampleSize());
        assertEquals(6, forest.getMaxDepth());

        SequenceModel sequence = ModelFactory.sequence(new ModelConfig(ModelType.SEQUENCE)
                .withParameter(ModelConfig.LSTM_UNITS, 4).withParameter(ModelConfig.LEARNING_RATE, "0.1"));
        assertEquals(4, sequence.getHiddenUnits());
        assertEquals(0.1, sequence.getLearningRate(), 1e-12);
        assertEquals(SequenceModel.DEFAULT_SEQUENCE_LENGTH, sequence.getSequenceLength());
    }

    @Test
    public void testEnsembleMembersShareParameters() {
        ModelConfig config = new ModelConfig(ModelType.ENSEMBLE).withParameter(ModelConfig.CLUSTER_COUNT, 2);
        EnsembleModel ensemble = (EnsembleModel) ModelFactory.createModel(config);
        assertEquals(2, ensemble.getClustering().getNumberOfClusters());
        assertEquals(IsolationForestModel.DEFAULT_NUMBER_OF_TREES, ensemble.getIsolationForest().getNumberOfTrees());
    }

    @Test
    public void testSeededModelsAreReproducible() {
        ModelConfig config = new ModelConfig(ModelType.ISOLATION_FOREST).withParameter(ModelConfig.RANDOM_SEED, 99);
        double[][] rows = ModelTestData.normalColumn(8, 200, 0, 1);
        IAnomalyModel first = ModelFactory.createModel(config);
        IAnomalyModel second = ModelFactory.createModel(config);
        first.initialize();
        second.initialize();
        first.train(rows);
        second.train(rows);
        assertEquals(first.predict(new double[] { 2.5 }), second.predict(new double[] { 2.5 }));
    }

    @Test
    public void testInvalidParameter() {
        ModelConfig config = new ModelConfig(ModelType.CLUSTERING).withParameter(ModelConfig.CLUSTER_COUNT, 0);
        assertThrows(IllegalArgumentException.class, () -> ModelFactory.createModel(config));
    }
}
