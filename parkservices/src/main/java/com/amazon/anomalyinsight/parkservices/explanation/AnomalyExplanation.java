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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Why a data point was flagged: a one line reason, the contributing factors by
 * descending impact, and what to do about it.
 */
@Getter
public class AnomalyExplanation {

    private final String reason;

    private final List<ExplanationFactor> factors;

    private final List<String> suggestions;

    private final double confidence;

    public AnomalyExplanation(String reason, List<ExplanationFactor> factors, List<String> suggestions,
            double confidence) {
        this.reason = reason;
        this.factors = Collections.unmodifiableList(new ArrayList<>(factors));
        this.suggestions = Collections.unmodifiableList(new ArrayList<>(suggestions));
        this.confidence = confidence;
    }
}
