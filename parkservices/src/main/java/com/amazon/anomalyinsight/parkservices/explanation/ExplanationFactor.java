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

import com.amazon.anomalyinsight.CommonUtils;

/**
 * One reason that contributed to a data point being flagged.
 */
@Getter
public class ExplanationFactor {

    private final FactorType type;

    /**
     * contribution in [0,1]
     */
    private final double impact;

    private final String description;

    private final List<String> evidence;

    /**
     * how much the explainer trusts this factor, in [0,1]
     */
    private final double confidence;

    public ExplanationFactor(FactorType type, double impact, String description, List<String> evidence,
            double confidence) {
        this.type = type;
        this.impact = CommonUtils.clamp(impact, 0, 1);
        this.description = description;
        this.evidence = Collections.unmodifiableList(new ArrayList<>(evidence));
        this.confidence = CommonUtils.clamp(confidence, 0, 1);
    }

    public String getName() {
        return type.getDisplayName();
    }

    @Override
    public String toString() {
        return String.format("%s(%.2f): %s", getName(), impact, description);
    }
}
