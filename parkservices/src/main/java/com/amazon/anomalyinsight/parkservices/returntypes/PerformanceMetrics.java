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

package com.amazon.anomalyinsight.parkservices.returntypes;

import lombok.Getter;

/**
 * A snapshot of the detector's processing statistics.
 */
@Getter
public class PerformanceMetrics {

    /**
     * duration of the most recent detection in milliseconds
     */
    private final double processingTime;

    private final double averageProcessingTime;

    /**
     * items per second of the most recent batch
     */
    private final double throughput;

    /**
     * heap in use in bytes when the snapshot was taken
     */
    private final long memoryUsage;

    private final double falsePositiveRate;

    private final long processedCount;

    private final long anomalyCount;

    public PerformanceMetrics(double processingTime, double averageProcessingTime, double throughput,
            long memoryUsage, double falsePositiveRate, long processedCount, long anomalyCount) {
        this.processingTime = processingTime;
        this.averageProcessingTime = averageProcessingTime;
        this.throughput = throughput;
        this.memoryUsage = memoryUsage;
        this.falsePositiveRate = falsePositiveRate;
        this.processedCount = processedCount;
        this.anomalyCount = anomalyCount;
    }
}
