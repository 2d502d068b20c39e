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

package com.amazon.anomalyinsight.parkservices.threshold;

import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Getter;

import com.amazon.anomalyinsight.config.Severity;

/**
 * A label for a previously reported anomaly, supplied by a person or an
 * automated process.
 */
public class Feedback {

    @Getter
    private final String anomalyId;

    @Getter
    private final boolean actualAnomaly;

    /**
     * epoch milliseconds at which the feedback was given
     */
    @Getter
    private final long timestamp;

    private final String userId;

    private final Severity severity;

    private final String comment;

    public Feedback(String anomalyId, boolean actualAnomaly, long timestamp) {
        this(anomalyId, actualAnomaly, timestamp, null, null, null);
    }

    public Feedback(String anomalyId, boolean actualAnomaly, long timestamp, String userId, Severity severity,
            String comment) {
        this.anomalyId = checkNotNull(anomalyId, "anomalyId must not be null");
        this.actualAnomaly = actualAnomaly;
        this.timestamp = timestamp;
        this.userId = userId;
        this.severity = severity;
        this.comment = comment;
    }

    public Optional<String> getUserId() {
        return Optional.ofNullable(userId);
    }

    public Optional<Severity> getSeverity() {
        return Optional.ofNullable(severity);
    }

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }
}
