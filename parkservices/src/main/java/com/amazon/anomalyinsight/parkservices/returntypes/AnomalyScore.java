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

package com.amazon.anomalyinsight.parkservices.returntypes;

import lombok.Getter;

import com.amazon.anomalyinsight.config.Severity;

/**
 * The fused result of all models for one data point.
 */
@Getter
public class AnomalyScore {

    /**
     * in [0,100]
     */
    private final double score;

    /**
     * in [0,1]; lower when the models disagree
     */
    private final double confidence;

    private final Severity severity;

    private final long timestamp;

    public AnomalyScore(double score, double confidence, Severity severity, long timestamp) {
        this.score = score;
        this.confidence = confidence;
        this.severity = severity;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return String.format("AnomalyScore(score=%.2f, confidence=%.3f, severity=%s)", score, confidence, severity);
    }
}
