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

package com.amazon.anomalyinsight.parkservices.config;

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.amazon.anomalyinsight.config.ModelConfig;
import com.amazon.anomalyinsight.config.ModelType;

/**
 * Configuration of an anomaly detector. Every section has working defaults, so
 * a document only needs to name the values it changes.
 */
@Data
public class DetectorConfig {

    private List<ModelConfig> models = new ArrayList<>();

    private Thresholds thresholds = new Thresholds();

    private AutoTuning autoTuning = new AutoTuning();

    private Performance performance = new Performance();

    private Baseline baseline = new Baseline();

    /**
     * @return a configuration with a single ensemble model and default values
     *         everywhere else
     */
    public static DetectorConfig defaultConfig() {
        DetectorConfig config = new DetectorConfig();
        ModelConfig ensemble = new ModelConfig(ModelType.ENSEMBLE).withParameter(ModelConfig.ISOLATION_TREE_COUNT, 100)
                .withParameter(ModelConfig.LSTM_UNITS, 50).withParameter(ModelConfig.CLUSTER_COUNT, 5);
        ensemble.setThreshold(ModelConfig.DEFAULT_THRESHOLD);
        config.getModels().add(ensemble);
        return config;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public void validate() {
        checkArgument(models != null && !models.isEmpty(), "at least one model must be configured");
        for (ModelConfig model : models) {
            checkArgument(model != null, "model configurations must not be null");
            checkArgument(model.getThreshold() >= 0 && model.getThreshold() <= 1,
                    "model threshold must be in [0,1]");
        }
        checkArgument(thresholds != null && autoTuning != null && performance != null && baseline != null,
                "configuration sections must not be null");
        checkArgument(thresholds.anomalyScore >= 0 && thresholds.anomalyScore <= 100,
                "anomalyScore threshold must be in [0,100]");
        checkArgument(thresholds.confidence >= 0 && thresholds.confidence <= 1,
                "confidence threshold must be in [0,1]");
        checkArgument(autoTuning.feedbackWindow > 0, "feedbackWindow must be greater than 0");
        checkArgument(autoTuning.minSamples > 0, "minSamples must be greater than 0");
        checkArgument(autoTuning.adjustmentRate >= 0, "adjustmentRate must not be negative");
        checkArgument(performance.maxLatency > 0, "maxLatency must be greater than 0");
        checkArgument(performance.batchSize > 0, "batchSize must be greater than 0");
        checkArgument(performance.queueCapacity > 0, "queueCapacity must be greater than 0");
        checkArgument(performance.threadPoolSize > 0, "threadPoolSize must be greater than 0");
        checkArgument(baseline.minDataPoints > 0, "minDataPoints must be greater than 0");
        checkArgument(baseline.maxHistorySize >= baseline.minDataPoints,
                "maxHistorySize must be at least minDataPoints");
        checkArgument(baseline.retentionDays > 0, "retentionDays must be greater than 0");
        checkArgument(baseline.cleanupIntervalMinutes > 0, "cleanupIntervalMinutes must be greater than 0");
        try {
            baseline.toZoneId();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid zoneId " + baseline.zoneId, e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {

        public static final double DEFAULT_ANOMALY_SCORE = 70;

        public static final double DEFAULT_CONFIDENCE = 0.7;

        /**
         * minimum final score in [0,100]
         */
        private double anomalyScore = DEFAULT_ANOMALY_SCORE;

        /**
         * minimum confidence in [0,1]
         */
        private double confidence = DEFAULT_CONFIDENCE;
    }

    @Data
    public static class AutoTuning {

        private boolean enabled = true;

        /**
         * minutes
         */
        private int feedbackWindow = 60;

        private int minSamples = 50;

        private double adjustmentRate = 0.1;

        public Duration feedbackWindowDuration() {
            return Duration.ofMinutes(feedbackWindow);
        }
    }

    @Data
    public static class Performance {

        /**
         * milliseconds; slower detections are logged
         */
        private long maxLatency = 100;

        private int batchSize = 100;

        private boolean parallelProcessing = true;

        private int queueCapacity = 10_000;

        private int threadPoolSize = Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Baseline {

        private int minDataPoints = 100;

        private int maxHistorySize = 50_000;

        private int retentionDays = 7;

        private int cleanupIntervalMinutes = 5;

        private String zoneId = "UTC";

        public ZoneId toZoneId() {
            return ZoneId.of(zoneId);
        }
    }
}
