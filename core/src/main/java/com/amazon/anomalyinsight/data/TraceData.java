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

import lombok.Getter;

import com.amazon.anomalyinsight.CommonUtils;
import com.amazon.anomalyinsight.config.DataType;
import com.amazon.anomalyinsight.config.TraceStatus;

@Getter
public class TraceData extends MonitoringData {

    private final String traceId;

    private final String spanId;

    private final String operation;

    /**
     * milliseconds
     */
    private final double duration;

    private final TraceStatus status;

    public TraceData(long timestamp, String source, String traceId, String spanId, String operation, double duration,
            TraceStatus status) {
        this(timestamp, source, traceId, spanId, operation, duration, status, null, null);
    }

    public TraceData(long timestamp, String source, String traceId, String spanId, String operation, double duration,
            TraceStatus status, Map<String, String> tags, Map<String, Object> metadata) {
        super(timestamp, source, tags, metadata);
        this.traceId = traceId;
        this.spanId = spanId;
        this.operation = operation;
        this.duration = duration;
        this.status = CommonUtils.checkNotNull(status, "status must not be null");
    }

    @Override
    public DataType getDataType() {
        return DataType.TRACE;
    }

    @Override
    public double getPrimaryValue() {
        return duration;
    }

    @Override
    public double[] getFeatures() {
        return new double[] { duration, status.getNumericValue() };
    }
}
