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

package com.amazon.anomalyinsight.parkservices.threshold;

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;
import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyinsight.parkservices.config.DetectorConfig;

/**
 * Raises the detector thresholds when feedback shows too many false positives.
 * Feedback is buffered until {@code minSamples} entries are present; from then
 * on every new entry evaluates the false positive rate over the entries that
 * are younger than the feedback window and discards the older ones. Thresholds
 * only ever move up.
 */
public class ThresholdAutoTuner {

    private static final Logger logger = LogManager.getLogger(ThresholdAutoTuner.class);

    public static final double TARGET_FALSE_POSITIVE_RATE = 0.05;

    public static final double MAX_ANOMALY_SCORE = 100;

    public static final double MAX_CONFIDENCE = 1;

    private final boolean enabled;

    private final long feedbackWindowMillis;

    private final int minSamples;

    private final double adjustmentRate;

    private final Clock clock;

    private final List<Feedback> buffer = new ArrayList<>();

    private double anomalyScoreThreshold;

    private double confidenceThreshold;

    private double falsePositiveRate;

    public ThresholdAutoTuner(DetectorConfig.AutoTuning autoTuning, DetectorConfig.Thresholds thresholds,
            Clock clock) {
        checkNotNull(autoTuning, "autoTuning must not be null");
        checkNotNull(thresholds, "thresholds must not be null");
        checkArgument(autoTuning.getMinSamples() > 0, "minSamples must be greater than 0");
        this.enabled = autoTuning.isEnabled();
        this.feedbackWindowMillis = autoTuning.feedbackWindowDuration().toMillis();
        this.minSamples = autoTuning.getMinSamples();
        this.adjustmentRate = autoTuning.getAdjustmentRate();
        this.anomalyScoreThreshold = thresholds.getAnomalyScore();
        this.confidenceThreshold = thresholds.getConfidence();
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    /**
     * @param feedback a label for a reported anomaly
     * @return the adjustment made because of this feedback, if any
     */
    public synchronized Optional<ThresholdAdjustment> addFeedback(Feedback feedback) {
        checkNotNull(feedback, "feedback must not be null");
        buffer.add(feedback);
        if (buffer.size() < minSamples) {
            return Optional.empty();
        }
        long now = clock.millis();
        buffer.removeIf(f -> now - f.getTimestamp() >= feedbackWindowMillis);
        if (!enabled || buffer.isEmpty()) {
            return Optional.empty();
        }

        long falsePositives = buffer.stream().filter(f -> !f.isActualAnomaly()).count();
        falsePositiveRate = (double) falsePositives / buffer.size();
        if (falsePositiveRate <= TARGET_FALSE_POSITIVE_RATE) {
            return Optional.empty();
        }

        double previousScore = anomalyScoreThreshold;
        double previousConfidence = confidenceThreshold;
        anomalyScoreThreshold = Math.min(MAX_ANOMALY_SCORE, anomalyScoreThreshold * (1 + adjustmentRate));
        confidenceThreshold = Math.min(MAX_CONFIDENCE, confidenceThreshold * (1 + adjustmentRate));
        if (anomalyScoreThreshold == previousScore && confidenceThreshold == previousConfidence) {
            return Optional.empty();
        }
        logger.info("Raised thresholds to score {} and confidence {}, false positive rate {}",
                anomalyScoreThreshold, confidenceThreshold, falsePositiveRate);
        return Optional.of(new ThresholdAdjustment(previousScore, anomalyScoreThreshold, previousConfidence,
                confidenceThreshold, falsePositiveRate, ThresholdAdjustment.HIGH_FALSE_POSITIVE_RATE, now));
    }

    /**
     * @return a copy of the current thresholds
     */
    public synchronized DetectorConfig.Thresholds getThresholds() {
        return new DetectorConfig.Thresholds(anomalyScoreThreshold, confidenceThreshold);
    }

    /**
     * @return the rate computed by the most recent evaluation, 0 before the first
     */
    public synchronized double getFalsePositiveRate() {
        return falsePositiveRate;
    }

    public synchronized int getBufferedFeedbackCount() {
        return buffer.size();
    }
}
