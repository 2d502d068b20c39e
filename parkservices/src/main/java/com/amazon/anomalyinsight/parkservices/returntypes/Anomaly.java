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

import java.util.Optional;

import lombok.Getter;

import com.amazon.anomalyinsight.baseline.BaselineData;
import com.amazon.anomalyinsight.config.DataType;
import com.amazon.anomalyinsight.data.MonitoringData;
import com.amazon.anomalyinsight.parkservices.explanation.AnomalyExplanation;

/**
 * A data point that crossed the detector thresholds, with the score that put it
 * there and the explanation of why.
 */
public class Anomaly {

    @Getter
    private final String id;

    @Getter
    private final DataType type;

    @Getter
    private final AnomalyScore score;

    @Getter
    private final MonitoringData data;

    @Getter
    private final AnomalyExplanation explanation;

    private final BaselineData baseline;

    public Anomaly(String id, DataType type, AnomalyScore score, MonitoringData data, AnomalyExplanation explanation,
            BaselineData baseline) {
        this.id = id;
        this.type = type;
        this.score = score;
        this.data = data;
        this.explanation = explanation;
        this.baseline = baseline;
    }

    /**
     * @return the baseline of the data point's key at detection time, empty when
     *         the key had none yet
     */
    public Optional<BaselineData> getBaseline() {
        return Optional.ofNullable(baseline);
    }
}
