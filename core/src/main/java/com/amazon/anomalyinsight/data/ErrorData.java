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
import com.amazon.anomalyinsight.config.Severity;

@Getter
public class ErrorData extends MonitoringData {

    private final String errorType;

    private final String message;

    private final String stackTrace;

    private final Severity severity;

    public ErrorData(long timestamp, String source, String errorType, String message, Severity severity) {
        this(timestamp, source, errorType, message, null, severity, null, null);
    }

    public ErrorData(long timestamp, String source, String errorType, String message, String stackTrace,
            Severity severity, Map<String, String> tags, Map<String, Object> metadata) {
        super(timestamp, source, tags, metadata);
        this.errorType = errorType;
        this.message = message == null ? "" : message;
        this.stackTrace = stackTrace;
        this.severity = CommonUtils.checkNotNull(severity, "severity must not be null");
    }

    @Override
    public DataType getDataType() {
        return DataType.ERROR;
    }

    @Override
    public double getPrimaryValue() {
        return severity.getNumericValue();
    }

    @Override
    public double[] getFeatures() {
        return new double[] { severity.getNumericValue(), stackTrace == null ? 0 : stackTrace.length() };
    }
}
