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

import lombok.Getter;

/**
 * Summary of what a {@link BaselineManager} currently holds. The oldest and
 * newest update times are 0 when there is no baseline.
 */
@Getter
public class BaselineStats {

    private final int totalBaselines;

    private final int timeSeriesCount;

    private final double avgDataPoints;

    private final long oldestBaseline;

    private final long newestBaseline;

    public BaselineStats(int totalBaselines, int timeSeriesCount, double avgDataPoints, long oldestBaseline,
            long newestBaseline) {
        this.totalBaselines = totalBaselines;
        this.timeSeriesCount = timeSeriesCount;
        this.avgDataPoints = avgDataPoints;
        this.oldestBaseline = oldestBaseline;
        this.newestBaseline = newestBaseline;
    }
}
