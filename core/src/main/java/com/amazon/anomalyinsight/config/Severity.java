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

/**
 * Severity of an error and of a detected anomaly.
 */
public enum Severity {

    LOW(1), MEDIUM(2), HIGH(3), CRITICAL(4);

    private final int numericValue;

    Severity(int numericValue) {
        this.numericValue = numericValue;
    }

    public int getNumericValue() {
        return numericValue;
    }

    /**
     * Buckets an anomaly score in [0,100].
     *
     * @param score the anomaly score
     * @return CRITICAL at 90 and above, HIGH at 75, MEDIUM at 50, LOW otherwise
     */
    public static Severity fromScore(double score) {
        if (score >= 90) {
            return CRITICAL;
        } else if (score >= 75) {
            return HIGH;
        } else if (score >= 50) {
            return MEDIUM;
        }
        return LOW;
    }

    public String getLabel() {
        return name().toLowerCase();
    }
}
