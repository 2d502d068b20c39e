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

package com.amazon.anomalyinsight.data;

import java.util.Map;
import java.util.Optional;

import lombok.Getter;

import com.amazon.anomalyinsight.config.DataType;

@Getter
public class MetricData extends MonitoringData {

    private final double value;

    /**
     * the preceding sample of the same metric, when the producer knows it
     */
    private final Double previousValue;

    public MetricData(long timestamp, String source, double value) {
        this(timestamp, source, value, null, null, null);
    }

    public MetricData(long timestamp, String source, double value, Map<String, String> tags) {
        this(timestamp, source, value, null, tags, null);
    }

    public MetricData(long timestamp, String source, double value, Double previousValue, Map<String, String> tags,
            Map<String, Object> metadata) {
        super(timestamp, source, tags, metadata);
        this.value = value;
        this.previousValue = previousValue;
    }

    public Optional<Double> getPreviousValueIfPresent() {
        return Optional.ofNullable(previousValue);
    }

    @Override
    public DataType getDataType() {
        return DataType.METRIC;
    }

    @Override
    public double getPrimaryValue() {
        return value;
    }

    @Override
    public double[] getFeatures() {
        return new double[] { value };
    }
}
