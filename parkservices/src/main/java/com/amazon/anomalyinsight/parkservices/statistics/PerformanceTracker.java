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

package com.amazon.anomalyinsight.parkservices.statistics;

import java.util.concurrent.TimeUnit;

import com.amazon.anomalyinsight.parkservices.returntypes.PerformanceMetrics;

/**
 * Accumulates detection timings and counts for {@link PerformanceMetrics}
 * snapshots. Thread safe.
 */
public class PerformanceTracker {

    private long processedCount;

    private long anomalyCount;

    private double lastProcessingMillis;

    private double totalProcessingMillis;

    private double throughput;

    private double falsePositiveRate;

    public synchronized void recordProcessing(long nanos) {
        lastProcessingMillis = nanos / (double) TimeUnit.MILLISECONDS.toNanos(1);
        totalProcessingMillis += lastProcessingMillis;
        processedCount++;
    }

    public synchronized void recordAnomaly() {
        anomalyCount++;
    }

    /**
     * @param items number of items processed
     * @param nanos elapsed time for all of them
     */
    public synchronized void recordThroughput(int items, long nanos) {
        if (items > 0 && nanos > 0) {
            throughput = items / (nanos / (double) TimeUnit.SECONDS.toNanos(1));
        }
    }

    public synchronized void recordFalsePositiveRate(double falsePositiveRate) {
        this.falsePositiveRate = falsePositiveRate;
    }

    public synchronized PerformanceMetrics snapshot() {
        Runtime runtime = Runtime.getRuntime();
        double average = processedCount == 0 ? 0 : totalProcessingMillis / processedCount;
        return new PerformanceMetrics(lastProcessingMillis, average, throughput,
                runtime.totalMemory() - runtime.freeMemory(), falsePositiveRate, processedCount, anomalyCount);
    }
}
