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
import com.amazon.anomalyinsight.config.LogLevel;

@Getter
public class LogData extends MonitoringData {

    private final LogLevel level;

    private final String message;

    private final String stackTrace;

    public LogData(long timestamp, String source, LogLevel level, String message) {
        this(timestamp, source, level, message, null, null, null);
    }

    public LogData(long timestamp, String source, LogLevel level, String message, String stackTrace,
            Map<String, String> tags, Map<String, Object> metadata) {
        super(timestamp, source, tags, metadata);
        this.level = CommonUtils.checkNotNull(level, "level must not be null");
        this.message = message == null ? "" : message;
        this.stackTrace = stackTrace;
    }

    @Override
    public DataType getDataType() {
        return DataType.LOG;
    }

    @Override
    public double getPrimaryValue() {
        return level.getNumericValue();
    }

    @Override
    public double[] getFeatures() {
        return new double[] { level.getNumericValue(), message.length() };
    }
}
