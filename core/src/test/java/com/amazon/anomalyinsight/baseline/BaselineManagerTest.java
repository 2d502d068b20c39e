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

import static com.amazon.anomalyinsight.testutils.MonitoringDataGenerator.DEFAULT_START_MILLIS;
import static com.amazon.anomalyinsight.testutils.MonitoringDataGenerator.ONE_DAY_MILLIS;
import static com.amazon.anomalyinsight.testutils.MonitoringDataGenerator.ONE_HOUR_MILLIS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyinsight.data.MetricData;
import com.amazon.anomalyinsight.data.MonitoringData;
import com.amazon.anomalyinsight.testutils.MonitoringDataGenerator;

public class BaselineManagerTest {

    private static final long NOW = DEFAULT_START_MILLIS + 30 * ONE_DAY_MILLIS;

    private Clock clock;

    private BaselineManager manager;

    @BeforeEach
    public void setUp() {
        clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        manager = BaselineManager.builder().clock(clock).build();
        manager.initialize();
    }

    private static List<MonitoringData> metrics(String source, double[] values, long start, long step) {
        List<MonitoringData> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricData(start + i * step, source, values[i]));
        }
        return points;
    }

    private static List<MonitoringData> recent(String source, double[] values) {
        return metrics(source, values, NOW - ONE_DAY_MILLIS, 60_000L);
    }

    @Test
    public void testBaselineFromTwoHundredPoints() {
        double[] values = new MonitoringDataGenerator(42).normalValues(200, 100, 1);
        assertEquals(1, manager.updateBaselines(recent("api", values)));

        BaselineData baseline = manager.getBaseline(new MetricData(NOW, "api", 0)).get();
        assertEquals(200, baseline.getSampleSize());
        assertThat(baseline.getMean(), closeTo(100, 0.5));
        assertThat(baseline.getStdDev(), closeTo(1, 0.3));
        assertEquals(NOW, baseline.getLastUpdated());
        assertEquals("metric:api", baseline.getKey());
    }

    @Test
    public void testNoBaselineBelowMinimum() {
        double[] values = new MonitoringDataGenerator(1).normalValues(99, 100, 1);
        assertEquals(0, manager.updateBaselines(recent("api", values)));
        assertFalse(manager.getBaseline(new MetricData(NOW, "api", 0)).isPresent());

        assertEquals(1, manager.updateBaselines(recent("api", new double[] { 100 })));
        assertEquals(100, manager.getBaseline(new MetricData(NOW, "api", 0)).get().getSampleSize());
    }

    @Test
    public void testNonFinitePointsAreDropped() {
        List<MonitoringData> points = recent("api", new MonitoringDataGenerator(2).normalValues(100, 10, 1));
        points.add(new MetricData(NOW, "api", Double.NaN));
        points.add(new MetricData(NOW, "api", Double.POSITIVE_INFINITY));
        manager.updateBaselines(points);
        assertEquals(100, manager.getBaseline(new MetricData(NOW, "api", 0)).get().getSampleSize());
    }

    @Test
    public void testUninitializedManagerIgnoresPoints() {
        BaselineManager fresh = new BaselineManager();
        assertEquals(0, fresh.updateBaselines(recent("api", new double[150])));
        assertFalse(fresh.getBaseline(new MetricData(NOW, "api", 0)).isPresent());
    }

    @Test
    public void testRelevantTagsSeparateSeries() {
        Map<String, String> a = new HashMap<>();
        a.put("service", "a");
        Map<String, String> b = new HashMap<>();
        b.put("service", "b");
        List<MonitoringData> points = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            points.add(new MetricData(NOW - i, "latency", 10, a));
            points.add(new MetricData(NOW - i, "latency", 50, b));
        }
        assertEquals(2, manager.updateBaselines(points));
        assertEquals(10, manager.getBaseline(new MetricData(NOW, "latency", 0, a)).get().getMean(), 1e-9);
        assertEquals(50, manager.getBaseline(new MetricData(NOW, "latency", 0, b)).get().getMean(), 1e-9);
        assertFalse(manager.getBaseline(new MetricData(NOW, "latency", 0)).isPresent());
    }

    @Test
    public void testHistoryIsCappedOldestFirst() {
        BaselineManager capped = BaselineManager.builder().clock(clock).maxHistorySize(150).build();
        capped.initialize();
        double[] values = new double[200];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        // supplied newest first; the series is kept in time order
        List<MonitoringData> points = recent("api", values);
        Collections.reverse(points);
        capped.updateBaselines(points);

        BaselineData baseline = capped.getBaseline(new MetricData(NOW, "api", 0)).get();
        assertEquals(150, baseline.getSampleSize());
        assertEquals(50, baseline.getMin(), 1e-9);
        List<TimeSeriesPoint> series = capped.getTimeSeries("metric:api");
        assertEquals(50, series.get(0).getValue(), 1e-9);
        assertEquals(199, series.get(series.size() - 1).getValue(), 1e-9);
    }

    @Test
    public void testIsAnomalous() {
        manager.updateBaselines(recent("api", new MonitoringDataGenerator(42).normalValues(200, 100, 1)));
        BaselineData baseline = manager.getBaseline(new MetricData(NOW, "api", 0)).get();

        DeviationCheck high = manager.isAnomalous(150, baseline);
        assertTrue(high.isAnomaly());
        assertEquals(1.0, high.getScore(), 1e-9);
        assertThat(high.getReason(), startsWith("High z-score ("));

        DeviationCheck normal = manager.isAnomalous(baseline.getPercentiles().getP50(), baseline);
        assertFalse(normal.isAnomaly());
        assertEquals("Normal", normal.getReason());

        DeviationCheck below = manager.isAnomalous(baseline.getPercentiles().getP10() - 0.01, baseline);
        assertTrue(below.isAnomaly());
        assertEquals("Below 10th percentile", below.getReason());

        DeviationCheck above = manager.isAnomalous(baseline.getPercentiles().getP90() + 0.01, baseline);
        assertTrue(above.isAnomaly());
        assertEquals("Above 90th percentile", above.getReason());

        DeviationCheck strict = manager.isAnomalous(103, baseline, 5);
        assertEquals("Above 90th percentile", strict.getReason());

        DeviationCheck none = manager.isAnomalous(1, null);
        assertFalse(none.isAnomaly());
        assertEquals("No baseline available", none.getReason());
    }

    @Test
    public void testZeroDeviationIsTreatedAsOne() {
        double[] values = new double[100];
        Arrays.fill(values, 5);
        manager.updateBaselines(recent("flat", values));
        BaselineData baseline = manager.getBaseline(new MetricData(NOW, "flat", 0)).get();
        assertEquals(0, baseline.getStdDev());
        assertEquals(2, baseline.zScore(7), 1e-9);
    }

    @Test
    public void testCleanupEvictsExpiredPoints() {
        double[] values = new MonitoringDataGenerator(3).normalValues(100, 10, 1);
        manager.updateBaselines(metrics("old", values, NOW - 10 * ONE_DAY_MILLIS, 1000L));
        List<MonitoringData> mixed = metrics("mixed", values, NOW - 8 * ONE_DAY_MILLIS, 1000L);
        mixed.addAll(metrics("mixed", values, NOW - ONE_HOUR_MILLIS, 1000L));
        manager.updateBaselines(mixed);
        assertEquals(2, manager.getBaselineStats().getTimeSeriesCount());

        assertEquals(200, manager.cleanup());
        BaselineStats stats = manager.getBaselineStats();
        assertEquals(1, stats.getTimeSeriesCount());
        assertEquals(100, stats.getAvgDataPoints(), 1e-9);
        assertFalse(manager.getBaseline("metric:old").isPresent());
        assertTrue(manager.getBaseline("metric:mixed").isPresent());
        assertEquals(100, manager.getTimeSeries("metric:mixed").size());

        assertEquals(0, manager.cleanup());
    }

    @Test
    public void testStatsAndRecalculation() {
        BaselineStats empty = manager.getBaselineStats();
        assertEquals(0, empty.getTotalBaselines());
        assertEquals(0, empty.getOldestBaseline());

        manager.updateBaselines(recent("a", new MonitoringDataGenerator(4).normalValues(120, 10, 1)));
        manager.updateBaselines(recent("b", new MonitoringDataGenerator(5).normalValues(100, 10, 1)));
        manager.updateBaselines(recent("c", new MonitoringDataGenerator(6).normalValues(20, 10, 1)));

        BaselineStats stats = manager.getBaselineStats();
        assertEquals(2, stats.getTotalBaselines());
        assertEquals(3, stats.getTimeSeriesCount());
        assertEquals(80, stats.getAvgDataPoints(), 1e-9);
        assertEquals(NOW, stats.getOldestBaseline());
        assertEquals(NOW, stats.getNewestBaseline());

        assertEquals(2, manager.recalculateAll());
        assertEquals(2, manager.getAllBaselines().size());
        assertThrows(UnsupportedOperationException.class, () -> manager.getAllBaselines().clear());
    }

    @Test
    public void testConcurrentWritersToOneKey() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                double[] values = new MonitoringDataGenerator(t + 10).normalValues(100, 100, 5);
                List<MonitoringData> points = recent("shared", values);
                futures.add(executor.submit(() -> manager.updateBaselines(points)));
            }
            for (Future<Integer> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(400, manager.getBaseline(new MetricData(NOW, "shared", 0)).get().getSampleSize());
    }

    @Test
    public void testShutdownClearsState() {
        manager.updateBaselines(recent("api", new MonitoringDataGenerator(8).normalValues(100, 10, 1)));
        manager.shutdown();
        assertFalse(manager.isInitialized());
        assertFalse(manager.getBaseline(new MetricData(NOW, "api", 0)).isPresent());
        assertEquals(0, manager.getBaselineStats().getTimeSeriesCount());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> BaselineManager.builder().minDataPoints(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> BaselineManager.builder().minDataPoints(100).maxHistorySize(50).build());
    }
}
