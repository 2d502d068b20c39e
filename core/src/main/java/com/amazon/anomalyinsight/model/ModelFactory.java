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

import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyinsight.config.ModelConfig;
import com.amazon.anomalyinsight.config.ModelType;

/**
 * Builds models from their configuration. A configuration without a type gets
 * the statistical fallback.
 */
public class ModelFactory {

    private static final Logger logger = LogManager.getLogger(ModelFactory.class);

    private ModelFactory() {
    }

    public static IAnomalyModel createModel(ModelConfig config) {
        checkNotNull(config, "config must not be null");
        ModelType type = config.getType();
        if (type == null) {
            logger.warn("Model configuration has no type, using {}", ModelType.STATISTICAL);
            return new StatisticalModel();
        }
        switch (type) {
        case ISOLATION_FOREST:
            return isolationForest(config);
        case CLUSTERING:
            return clustering(config);
        case SEQUENCE:
            return sequence(config);
        case ENSEMBLE:
            return new EnsembleModel(isolationForest(config), sequence(config), clustering(config));
        case STATISTICAL:
        default:
            return new StatisticalModel();
        }
    }

    static IsolationForestModel isolationForest(ModelConfig config) {
        IsolationForestModel.Builder<?> builder = IsolationForestModel.builder()
                .numberOfTrees(config.getIntParameter(ModelConfig.ISOLATION_TREE_COUNT,
                        IsolationForestModel.DEFAULT_NUMBER_OF_TREES))
                .sampleSize(config.getIntParameter(ModelConfig.SAMPLE_SIZE, IsolationForestModel.DEFAULT_SAMPLE_SIZE))
                .maxDepth(config.getIntParameter(ModelConfig.MAX_DEPTH, IsolationForestModel.DEFAULT_MAX_DEPTH));
        seed(config).ifPresent(builder::randomSeed);
        return builder.build();
    }

    static ClusteringModel clustering(ModelConfig config) {
        ClusteringModel.Builder<?> builder = ClusteringModel.builder()
                .numberOfClusters(
                        config.getIntParameter(ModelConfig.CLUSTER_COUNT, ClusteringModel.DEFAULT_NUMBER_OF_CLUSTERS))
                .maxIterations(
                        config.getIntParameter(ModelConfig.MAX_ITERATIONS, ClusteringModel.DEFAULT_MAX_ITERATIONS))
                .anomalyThreshold(config.getDoubleParameter(ModelConfig.ANOMALY_THRESHOLD,
                        ClusteringModel.DEFAULT_ANOMALY_THRESHOLD));
        seed(config).ifPresent(builder::randomSeed);
        return builder.build();
    }

    static SequenceModel sequence(ModelConfig config) {
        SequenceModel.Builder<?> builder = SequenceModel.builder()
                .hiddenUnits(config.getIntParameter(ModelConfig.LSTM_UNITS, SequenceModel.DEFAULT_HIDDEN_UNITS))
                .sequenceLength(
                        config.getIntParameter(ModelConfig.SEQUENCE_LENGTH, SequenceModel.DEFAULT_SEQUENCE_LENGTH))
                .epochs(config.getIntParameter(ModelConfig.EPOCHS, SequenceModel.DEFAULT_EPOCHS))
                .learningRate(
                        config.getDoubleParameter(ModelConfig.LEARNING_RATE, SequenceModel.DEFAULT_LEARNING_RATE));
        seed(config).ifPresent(builder::randomSeed);
        return builder.build();
    }

    private static Optional<Long> seed(ModelConfig config) {
        return config.getLongParameter(ModelConfig.RANDOM_SEED);
    }
}
