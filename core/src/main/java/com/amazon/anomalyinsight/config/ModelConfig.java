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

package com.amazon.anomalyinsight.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Data;

/**
 * Configuration of a single model instance. Parameters are free form so that
 * the same document can configure every model type; the names understood by
 * the models are the constants of this class.
 */
@Data
public class ModelConfig {

    public static final String ISOLATION_TREE_COUNT = "isolationTreeCount";
    public static final String MAX_DEPTH = "maxDepth";
    public static final String SAMPLE_SIZE = "sampleSize";
    public static final String CLUSTER_COUNT = "clusterCount";
    public static final String MAX_ITERATIONS = "maxIterations";
    public static final String ANOMALY_THRESHOLD = "anomalyThreshold";
    public static final String LSTM_UNITS = "lstmUnits";
    public static final String SEQUENCE_LENGTH = "sequenceLength";
    public static final String EPOCHS = "epochs";
    public static final String LEARNING_RATE = "learningRate";
    public static final String RANDOM_SEED = "randomSeed";

    public static final double DEFAULT_THRESHOLD = 0.6;

    private ModelType type;

    private Map<String, Object> parameters = new HashMap<>();

    /**
     * per model score threshold in [0,1]; informational, the detector applies its
     * global thresholds
     */
    private double threshold = DEFAULT_THRESHOLD;

    private boolean autoTune = true;

    public ModelConfig() {
    }

    public ModelConfig(ModelType type) {
        this.type = type;
    }

    public ModelConfig(ModelType type, Map<String, Object> parameters) {
        this.type = type;
        this.parameters = new HashMap<>(parameters);
    }

    public ModelConfig withParameter(String name, Object value) {
        parameters.put(name, value);
        return this;
    }

    public int getIntParameter(String name, int defaultValue) {
        Object value = parameters == null ? null : parameters.get(name);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        } else if (value instanceof String) {
            return Integer.parseInt((String) value);
        }
        return defaultValue;
    }

    public double getDoubleParameter(String name, double defaultValue) {
        Object value = parameters == null ? null : parameters.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        } else if (value instanceof String) {
            return Double.parseDouble((String) value);
        }
        return defaultValue;
    }

    public Optional<Long> getLongParameter(String name) {
        Object value = parameters == null ? null : parameters.get(name);
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        } else if (value instanceof String) {
            return Optional.of(Long.parseLong((String) value));
        }
        return Optional.empty();
    }
}
