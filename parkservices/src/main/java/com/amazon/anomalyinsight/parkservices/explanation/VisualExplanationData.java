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

/**
 * Data for a chart that shows an anomaly in context. Rendering is up to the
 * consumer.
 */
@Getter
public class VisualExplanationData {

    public enum ChartType {
        LINE, BAR, SCATTER, HEATMAP
    }

    private final ChartType chartType;

    private final List<ChartPoint> data;

    private final List<ChartPoint> highlights;

    private final List<String> annotations;

    public VisualExplanationData(ChartType chartType, List<ChartPoint> data, List<ChartPoint> highlights,
            List<String> annotations) {
        this.chartType = chartType;
        this.data = Collections.unmodifiableList(new ArrayList<>(data));
        this.highlights = Collections.unmodifiableList(new ArrayList<>(highlights));
        this.annotations = Collections.unmodifiableList(new ArrayList<>(annotations));
    }

    /**
     * A labeled value; time series points carry a timestamp, distribution bars
     * carry a label.
     */
    @Getter
    public static class ChartPoint {

        private final String label;

        private final long timestamp;

        private final double value;

        public ChartPoint(String label, long timestamp, double value) {
            this.label = label;
            this.timestamp = timestamp;
            this.value = value;
        }

        public static ChartPoint at(long timestamp, double value) {
            return new ChartPoint(null, timestamp, value);
        }

        public static ChartPoint labeled(String label, double value) {
            return new ChartPoint(label, 0, value);
        }
    }
}
