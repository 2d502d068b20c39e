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

package com.amazon.anomalyinsight.parkservices.explanation;

/**
 * The kinds of evidence the explainer looks for.
 */
public enum FactorType {

    STATISTICAL_DEVIATION("Statistical Deviation"),

    TEMPORAL_PATTERN("Temporal Pattern"),

    MODEL_CONSENSUS("Model Consensus"),

    RAPID_CHANGE("Rapid Change"),

    HIGH_SEVERITY_LOG("High Severity Log"),

    HIGH_LATENCY("High Latency"),

    FAILED_OPERATION("Failed Operation"),

    ERROR_SEVERITY("Error Severity"),

    FAILED_USER_ACTION("Failed User Action"),

    CONTEXT_INDICATORS("Context Indicators");

    private final String displayName;

    FactorType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return the name used in template keys, for example
     *         {@code statistical_deviation}
     */
    public String getKey() {
        return name().toLowerCase();
    }
}
