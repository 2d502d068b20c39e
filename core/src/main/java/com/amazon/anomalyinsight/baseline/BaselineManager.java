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

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;
import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyinsight.data.MonitoringData;

/**
 * Owns the per key time series and the baselines derived from them. Writers to
 * the same key are serialized on that key's entry; readers see the last
 * published {@link BaselineData} without locking.
 */
public class BaselineManager {

    private static final Logger logger = LogManager.getLogger(BaselineManager.class);

    public static final int DEFAULT_MIN_DATA_POINTS = 100;

    public static final int DEFAULT_MAX_HISTORY_SIZE = 50_000;

    public static final Duration DEFAULT_RETENTION = Duration.ofDays(7);

    public static final double DEFAULT_SENSITIVITY = 2.0;

    @Getter
    private final int minDataPoints;

    @Getter
    private final int maxHistorySize;

    @Getter
    private final Duration retention;

    @Getter
    private final ZoneId zoneId;

    private final Clock clock;

    private final BaselineStatistics statistics;

    private final ConcurrentHashMap<String, SeriesEntry> series = new ConcurrentHashMap<>();

    private volatile boolean initialized;

    public BaselineManager() {
        this(new Builder<>());
    }

    protected BaselineManager(Builder<?> builder) {
        checkArgument(builder.minDataPoints > 0, "minDataPoints must be greater than 0");
        checkArgument(builder.maxHistorySize >= builder.minDataPoints,
                "maxHistorySize must be at least minDataPoints");
        checkArgument(!builder.retention.isNegative() && !builder.retention.isZero(), "retention must be positive");
        this.minDataPoints = builder.minDataPoints;
        this.maxHistorySize = builder.maxHistorySize;
        this.retention = builder.retention;
        this.zoneId = checkNotNull(builder.zoneId, "zoneId must not be null");
        this.clock = checkNotNull(builder.clock, "clock must not be null");
        this.statistics = new BaselineStatistics(zoneId);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Clears all series and makes the manager ready to accept points.
     */
    public void initialize() {
        series.clear();
        initialized = true;
        logger.info("Baseline manager initialized with minDataPoints {} and maxHistorySize {}", minDataPoints,
                maxHistorySize);
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Appends points to their series and recomputes the baseline of every touched
     * series that has enough points. Points with a non finite primary value are
     * dropped.
     *
     * @param points observations in any order
     * @return the number of baselines recomputed
     */
    public int updateBaselines(Collection<? extends MonitoringData> points) {
        if (!initialized) {
            logger.debug("Ignoring {} points, baseline manager is not initialized", points.size());
            return 0;
        }
        Map<String, List<TimeSeriesPoint>> grouped = new LinkedHashMap<>();
        int dropped = 0;
        for (MonitoringData data : points) {
            if (data == null || !data.hasValidPrimaryValue()) {
                dropped++;
                continue;
            }
            grouped.computeIfAbsent(BaselineKey.of(data), k -> new ArrayList<>()).add(new TimeSeriesPoint(
                    data.getTimestamp(), data.getPrimaryValue(), data.getSource(), data.getDataType()));
        }
        if (dropped > 0) {
            logger.debug("Dropped {} points without a finite value", dropped);
        }

        int updated = 0;
        for (Map.Entry<String, List<TimeSeriesPoint>> group : grouped.entrySet()) {
            if (append(group.getKey(), group.getValue())) {
                updated++;
            }
        }
        return updated;
    }

    private boolean append(String key, List<TimeSeriesPoint> points) {
        while (true) {
            SeriesEntry entry = series.computeIfAbsent(key, k -> new SeriesEntry());
            synchronized (entry) {
                if (entry.retired) {
                    continue;
                }
                entry.points.addAll(points);
                entry.points.sort(Comparator.comparingLong(TimeSeriesPoint::getTimestamp));
                trim(entry);
                return recompute(key, entry);
            }
        }
    }

    // callers hold the entry lock
    private boolean recompute(String key, SeriesEntry entry) {
        if (entry.points.size() < minDataPoints) {
            return false;
        }
        entry.baseline = statistics.compute(key, entry.points, clock.millis());
        return true;
    }

    private void trim(SeriesEntry entry) {
        int excess = entry.points.size() - maxHistorySize;
        if (excess > 0) {
            entry.points.subList(0, excess).clear();
        }
    }

    /**
     * @param data an observation
     * @return the baseline of the observation's series, empty when the series has
     *         not reached the minimum number of points
     */
    public Optional<BaselineData> getBaseline(MonitoringData data) {
        if (!initialized || data == null) {
            return Optional.empty();
        }
        return getBaseline(BaselineKey.of(data));
    }

    public Optional<BaselineData> getBaseline(String key) {
        SeriesEntry entry = series.get(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.baseline);
    }

    /**
     * Recomputes every series that has enough points.
     *
     * @return the number of baselines recomputed
     */
    public int recalculateAll() {
        int count = 0;
        for (Map.Entry<String, SeriesEntry> e : series.entrySet()) {
            SeriesEntry entry = e.getValue();
            synchronized (entry) {
                if (!entry.retired && recompute(e.getKey(), entry)) {
                    count++;
                }
            }
        }
        logger.info("Recalculated {} baselines", count);
        return count;
    }

    public Map<String, BaselineData> getAllBaselines() {
        Map<String, BaselineData> result = new HashMap<>();
        series.forEach((key, entry) -> {
            BaselineData baseline = entry.baseline;
            if (baseline != null) {
                result.put(key, baseline);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    public BaselineStats getBaselineStats() {
        int baselines = 0;
        long totalPoints = 0;
        long oldest = Long.MAX_VALUE;
        long newest = Long.MIN_VALUE;
        int seriesCount = 0;
        for (SeriesEntry entry : series.values()) {
            synchronized (entry) {
                if (entry.retired) {
                    continue;
                }
                seriesCount++;
                totalPoints += entry.points.size();
            }
            BaselineData baseline = entry.baseline;
            if (baseline != null) {
                baselines++;
                oldest = Math.min(oldest, baseline.getLastUpdated());
                newest = Math.max(newest, baseline.getLastUpdated());
            }
        }
        double average = seriesCount == 0 ? 0 : (double) totalPoints / seriesCount;
        return new BaselineStats(baselines, seriesCount, average, baselines == 0 ? 0 : oldest,
                baselines == 0 ? 0 : newest);
    }

    public DeviationCheck isAnomalous(double value, BaselineData baseline) {
        return isAnomalous(value, baseline, DEFAULT_SENSITIVITY);
    }

    /**
     * Flags a value that lies more than {@code sensitivity} standard deviations
     * from the mean or outside the 10th to 90th percentile band.
     *
     * @param value       the value to check
     * @param baseline    the baseline, may be null
     * @param sensitivity z-score above which the value is anomalous
     * @return the verdict with a score in [0,1] and a short reason
     */
    public DeviationCheck isAnomalous(double value, BaselineData baseline, double sensitivity) {
        if (baseline == null) {
            return new DeviationCheck(false, 0, "No baseline available");
        }
        double zScore = baseline.zScore(value);
        boolean zScoreAnomaly = zScore > sensitivity;
        boolean below = value < baseline.getPercentiles().getP10();
        boolean above = value > baseline.getPercentiles().getP90();
        double score = Math.min(1.0, zScore / 3.0);

        String reason;
        if (zScoreAnomaly) {
            reason = String.format(Locale.ROOT, "High z-score (%.2f)", zScore);
        } else if (below) {
            reason = "Below 10th percentile";
        } else if (above) {
            reason = "Above 90th percentile";
        } else {
            reason = "Normal";
        }
        return new DeviationCheck(zScoreAnomaly || below || above, score, reason);
    }

    /**
     * Drops points older than the retention window and enforces the history cap.
     * Series left without points are removed together with their baseline.
     *
     * @return the number of points evicted
     */
    public int cleanup() {
        long cutoff = clock.millis() - retention.toMillis();
        int evicted = 0;
        int removedSeries = 0;
        for (Map.Entry<String, SeriesEntry> e : series.entrySet()) {
            SeriesEntry entry = e.getValue();
            synchronized (entry) {
                if (entry.retired) {
                    continue;
                }
                int before = entry.points.size();
                entry.points.removeIf(p -> p.getTimestamp() < cutoff);
                trim(entry);
                evicted += before - entry.points.size();
                if (entry.points.isEmpty()) {
                    entry.retired = true;
                    entry.baseline = null;
                    series.remove(e.getKey(), entry);
                    removedSeries++;
                }
            }
        }
        if (evicted > 0) {
            logger.info("Baseline cleanup evicted {} points and removed {} series", evicted, removedSeries);
        }
        return evicted;
    }

    /**
     * @param key a series key
     * @return a copy of the series in ascending time order
     */
    public List<TimeSeriesPoint> getTimeSeries(String key) {
        SeriesEntry entry = series.get(key);
        if (entry == null) {
            return Collections.emptyList();
        }
        synchronized (entry) {
            return new ArrayList<>(entry.points);
        }
    }

    public List<String> getKeys() {
        return new ArrayList<>(series.keySet());
    }

    /**
     * Replaces the series of a key, used when restoring saved state.
     */
    public void restoreSeries(String key, List<TimeSeriesPoint> points) {
        SeriesEntry entry = new SeriesEntry();
        entry.points.addAll(points);
        entry.points.sort(Comparator.comparingLong(TimeSeriesPoint::getTimestamp));
        synchronized (entry) {
            trim(entry);
            recompute(key, entry);
        }
        SeriesEntry previous = series.put(key, entry);
        if (previous != null) {
            synchronized (previous) {
                previous.retired = true;
            }
        }
    }

    public void shutdown() {
        initialized = false;
        series.clear();
        logger.info("Baseline manager shut down");
    }

    private static class SeriesEntry {
        private final List<TimeSeriesPoint> points = new ArrayList<>();
        private volatile BaselineData baseline;
        private boolean retired;
    }

    public static class Builder<T extends Builder<T>> {

        private int minDataPoints = DEFAULT_MIN_DATA_POINTS;
        private int maxHistorySize = DEFAULT_MAX_HISTORY_SIZE;
        private Duration retention = DEFAULT_RETENTION;
        private ZoneId zoneId = ZoneId.of("UTC");
        private Clock clock = Clock.systemUTC();

        public T minDataPoints(int minDataPoints) {
            this.minDataPoints = minDataPoints;
            return (T) this;
        }

        public T maxHistorySize(int maxHistorySize) {
            this.maxHistorySize = maxHistorySize;
            return (T) this;
        }

        public T retention(Duration retention) {
            this.retention = retention;
            return (T) this;
        }

        public T zoneId(ZoneId zoneId) {
            this.zoneId = zoneId;
            return (T) this;
        }

        public T clock(Clock clock) {
            this.clock = clock;
            return (T) this;
        }

        public BaselineManager build() {
            return new BaselineManager(this);
        }
    }
}
