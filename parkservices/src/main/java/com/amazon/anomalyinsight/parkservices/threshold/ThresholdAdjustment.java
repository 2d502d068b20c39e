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

import lombok.Getter;

/**
 * A change of the detector thresholds made by auto-tuning.
 */
@Getter
public class ThresholdAdjustment {

    public static final String HIGH_FALSE_POSITIVE_RATE = "high_false_positive_rate";

    private final double previousAnomalyScore;

    private final double newAnomalyScore;

    private final double previousConfidence;

    private final double newConfidence;

    /**
     * the rate that triggered the change
     */
    private final double falsePositiveRate;

    private final String reason;

    private final long timestamp;

    public ThresholdAdjustment(double previousAnomalyScore, double newAnomalyScore, double previousConfidence,
            double newConfidence, double falsePositiveRate, String reason, long timestamp) {
        this.previousAnomalyScore = previousAnomalyScore;
        this.newAnomalyScore = newAnomalyScore;
        this.previousConfidence = previousConfidence;
        this.newConfidence = newConfidence;
        this.falsePositiveRate = falsePositiveRate;
        this.reason = reason;
        this.timestamp = timestamp;
    }
}
