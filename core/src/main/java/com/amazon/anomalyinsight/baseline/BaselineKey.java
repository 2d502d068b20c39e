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

package com.amazon.anomalyinsight.baseline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.amazon.anomalyinsight.config.DataType;
import com.amazon.anomalyinsight.data.MonitoringData;

/**
 * Derives the key that partitions observations into independent series. The
 * key is {@code type:source} followed, when any relevant tag is present, by
 * {@code :tag:value,tag:value} with the tags sorted.
 */
public final class BaselineKey {

    public static final List<String> RELEVANT_TAGS = Collections
            .unmodifiableList(Arrays.asList("service", "endpoint", "environment", "region"));

    public static final String UNKNOWN_SOURCE = "unknown";

    private BaselineKey() {
    }

    public static String of(MonitoringData data) {
        return of(data.getDataType(), data.getSource(), data.getTags());
    }

    public static String of(DataType type, String source, Map<String, String> tags) {
        StringBuilder builder = new StringBuilder();
        builder.append(type.getLabel()).append(':');
        builder.append(source == null || source.isEmpty() ? UNKNOWN_SOURCE : source);

        if (tags != null && !tags.isEmpty()) {
            List<String> parts = new ArrayList<>();
            for (String tag : RELEVANT_TAGS) {
                String value = tags.get(tag);
                if (value != null && !value.isEmpty()) {
                    parts.add(tag + ":" + value);
                }
            }
            if (!parts.isEmpty()) {
                Collections.sort(parts);
                builder.append(':').append(String.join(",", parts));
            }
        }
        return builder.toString();
    }
}
