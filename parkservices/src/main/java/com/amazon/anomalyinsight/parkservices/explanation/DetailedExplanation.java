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

@Getter
public class DetailedExplanation {

    private final AnomalyExplanation explanation;

    private final List<VisualExplanationData> visualData;

    private final double confidence;

    /**
     * other plausible causes, most generic first
     */
    private final List<String> alternativeExplanations;

    public DetailedExplanation(AnomalyExplanation explanation, List<VisualExplanationData> visualData,
            double confidence, List<String> alternativeExplanations) {
        this.explanation = explanation;
        this.visualData = Collections.unmodifiableList(new ArrayList<>(visualData));
        this.confidence = confidence;
        this.alternativeExplanations = Collections.unmodifiableList(new ArrayList<>(alternativeExplanations));
    }
}
