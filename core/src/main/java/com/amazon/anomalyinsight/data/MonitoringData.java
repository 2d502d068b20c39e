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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import lombok.Getter;

import com.amazon.anomalyinsight.config.DataType;

/**
 * A single observation coming out of the monitoring pipeline. Every variant
 * knows its scalar primary value, which is what baselines are built over, and
 * its feature vector, which is what models score.
 */
@Getter
public abstract class MonitoringData {

    /**
     * epoch milliseconds
     */
    private final long timestamp;

    private final String source;

    private final Map<String, String> tags;

    private final Map<String, Object> metadata;

    protected MonitoringData(long timestamp, String source, Map<String, String> tags, Map<String, Object> metadata) {
        this.timestamp = timestamp;
        this.source = source;
        this.tags = tags == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(tags));
        this.metadata = metadata == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    public abstract DataType getDataType();

    /**
     * @return the scalar tracked by the baseline of this observation
     */
    public abstract double getPrimaryValue();

    /**
     * @return a fresh feature vector; the timestamp is not a feature
     */
    public abstract double[] getFeatures();

    public boolean hasValidPrimaryValue() {
        return Double.isFinite(getPrimaryValue());
    }
}
