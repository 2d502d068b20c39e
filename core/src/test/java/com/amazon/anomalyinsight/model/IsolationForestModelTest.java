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

import static com.amazon.anomalyinsight.model.ModelTestData.normalColumn;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.anomalyinsight.CommonUtils;
import com.amazon.anomalyinsight.config.ModelType;

public class IsolationForestModelTest {

    private IsolationForestModel model;

    @BeforeEach
    public void setUp() {
        model = IsolationForestModel.builder().randomSeed(42L).build();
        model.initialize();
    }

    @Test
    public void testOutlierScoresHigherThanInlier() {
        model.train(normalColumn(11, 100, 50, 5));
        double inlier = model.predict(new double[] { 52 });
        double outlier = model.predict(new double[] { 200 });
        assertTrue(inlier < outlier);
        assertTrue(model.getAveragePathLength(new double[] { 52 }) > model.getAveragePathLength(new double[] { 200 }));
    }

    @Test
    public void testScoreIsNormalizedByTrainingSize() {
        model.train(normalColumn(1, 2000, 50, 5));
        for (double value : new double[] { 52, 35, 80 }) {
            double[] query = new double[] { value };
            double expected = Math.pow(2, -model.getAveragePathLength(query) / CommonUtils.averagePathLength(2000));
            assertEquals(expected, model.predict(query), 1e-12);
        }
        double[] inlier = new double[] { 52 };
        double perTreeNormalizer = CommonUtils.averagePathLength(IsolationForestModel.DEFAULT_SAMPLE_SIZE);
        assertTrue(model.predict(inlier) > Math.pow(2, -model.getAveragePathLength(inlier) / perTreeNormalizer));
    }

    @Test
    public void testScoresAreInUnitInterval() {
        model.train(normalColumn(12, 500, 0, 1));
        Random random = new Random(0);
        for (int i = 0; i < 200; i++) {
            double score = model.predict(new double[] { 20 * random.nextGaussian() });
            assertTrue(score >= 0 && score <= 1);
        }
    }

    @Test
    public void testUntrainedModel() {
        assertFalse(model.isTrained());
        assertEquals(0, model.predict(new double[] { 1 }));
        assertEquals(0, model.getDimensions());
        assertEquals(0, model.getModelMetrics().getTrainingDataSize());
        assertEquals(0, model.getFeatureImportance().length);
        assertThrows(IllegalStateException.class, () -> model.toState());
    }

    @Test
    public void testTrainRequiresInitialize() {
        IsolationForestModel fresh = new IsolationForestModel();
        assertThrows(IllegalStateException.class, () -> fresh.train(normalColumn(1, 10, 0, 1)));
    }

    @Test
    public void testDimensionMismatch() {
        model.train(normalColumn(13, 50, 0, 1));
        assertEquals(1, model.getDimensions());
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> model.predict(new double[] { 1, 2 }));
        assertEquals("expected 1 features but received 2", error.getMessage());
        assertThrows(IllegalArgumentException.class,
                () -> model.train(new double[][] { { 1 }, { 1, 2 } }));
    }

    @Test
    public void testNonFiniteRowsAreIgnored() {
        double[][] rows = normalColumn(14, 100, 0, 1);
        rows[3] = new double[] { Double.NaN };
        rows[7] = new double[] { Double.NEGATIVE_INFINITY };
        model.train(rows);
        assertEquals(98, model.getModelMetrics().getTrainingDataSize());
    }

    @Test
    public void testSingleRowDoesNotTrain() {
        model.train(new double[][] { { 1 } });
        assertFalse(model.isTrained());
    }

    @Test
    public void testMetrics() {
        model.train(normalColumn(15, 100, 0, 1));
        ModelMetrics metrics = model.getModelMetrics();
        assertThat(metrics.getAccuracy(), closeTo(0.751, 1e-9));
        assertThat(metrics.getPrecision(), closeTo(0.781, 1e-9));
        assertThat(metrics.getFalsePositiveRate(), closeTo(0.05 - 100 / 15000.0 * 0.02, 1e-9));
        assertTrue(metrics.getF1Score() > 0);
        assertTrue(metrics.getLastTrained() > 0);
        assertEquals(ModelType.ISOLATION_FOREST, model.getModelType());
    }

    @Test
    public void testFeatureImportance() {
        double[][] rows = new double[200][];
        Random random = new Random(3);
        for (int i = 0; i < rows.length; i++) {
            // the second feature is constant and can never be cut
            rows[i] = new double[] { random.nextGaussian(), 7.0 };
        }
        model.train(rows);
        double[] importance = model.getFeatureImportance();
        assertEquals(2, importance.length);
        assertEquals(1.0, importance[0], 1e-9);
        assertEquals(0.0, importance[1], 1e-9);
    }

    @Test
    public void testSaveAndLoad(@TempDir Path directory) throws Exception {
        model.train(normalColumn(16, 300, 10, 2));
        Path file = directory.resolve("forest.json");
        model.save(file);

        IsolationForestModel restored = new IsolationForestModel();
        restored.load(file);
        assertTrue(restored.isTrained());
        for (double value : new double[] { -5, 0, 10, 11.5, 30, 100 }) {
            assertEquals(model.predict(new double[] { value }), restored.predict(new double[] { value }), 1e-12);
        }
        assertEquals(300, restored.getModelMetrics().getTrainingDataSize());
    }

    @Test
    public void testSaveRequiresTraining(@TempDir Path directory) {
        assertThrows(IllegalStateException.class, () -> model.save(directory.resolve("none.json")));
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> IsolationForestModel.builder().numberOfTrees(0).build());
        assertThrows(IllegalArgumentException.class, () -> IsolationForestModel.builder().sampleSize(1).build());
        assertThrows(IllegalArgumentException.class, () -> IsolationForestModel.builder().maxDepth(0).build());
    }
}
