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

import com.amazon.anomalyinsight.config.DataType;

/**
 * A user interaction such as a click, a page view or a form submission.
 */
@Getter
public class BehaviorData extends MonitoringData {

    private final String userId;

    private final String sessionId;

    private final String action;

    private final String page;

    /**
     * milliseconds, null when the action has no duration
     */
    private final Double duration;

    private final boolean success;

    public BehaviorData(long timestamp, String source, String sessionId, String action, String page, Double duration,
            boolean success) {
        this(timestamp, source, null, sessionId, action, page, duration, success, null, null);
    }

    public BehaviorData(long timestamp, String source, String userId, String sessionId, String action, String page,
            Double duration, boolean success, Map<String, String> tags, Map<String, Object> metadata) {
        super(timestamp, source, tags, metadata);
        this.userId = userId;
        this.sessionId = sessionId;
        this.action = action;
        this.page = page;
        this.duration = duration;
        this.success = success;
    }

    @Override
    public DataType getDataType() {
        return DataType.BEHAVIOR;
    }

    @Override
    public double getPrimaryValue() {
        return duration == null ? 0 : duration;
    }

    @Override
    public double[] getFeatures() {
        return new double[] { getPrimaryValue(), success ? 1 : 0 };
    }
}
