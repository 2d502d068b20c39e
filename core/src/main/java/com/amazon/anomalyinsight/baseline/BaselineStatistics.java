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

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.amazon.anomalyinsight.CommonUtils;
import com.amazon.anomalyinsight.config.SeasonalPeriod;

/**
 * Computes {@link BaselineData} from a sorted series. All methods are pure.
 */
public class BaselineStatistics {

    /**
     * patterns at or below this strength are not reported
     */
    public static final double MIN_SEASONAL_STRENGTH = 0.1;

    public static final int MIN_TREND_POINTS = 10;

    public static final int MIN_WEEKS = 4;

    private final ZoneId zoneId;

    public BaselineStatistics(ZoneId zoneId) {
        this.zoneId = CommonUtils.checkNotNull(zoneId, "zoneId must not be null");
    }

    /**
     * @param key         the series key
     * @param points      points in ascending timestamp order, at least one
     * @param lastUpdated the time to stamp the baseline with
     * @return the baseline of the points
     */
    public BaselineData compute(String key, List<TimeSeriesPoint> points, long lastUpdated) {
        checkArgument(!points.isEmpty(), "cannot compute a baseline of an empty series");
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        double mean = CommonUtils.mean(values);
        double stdDev = CommonUtils.standardDeviation(values);
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);

        return new BaselineData(key, mean, stdDev, sorted[0], sorted[sorted.length - 1], Percentiles.of(sorted),
                seasonalPatterns(points), trend(values), lastUpdated, values.length);
    }

    public List<SeasonalPattern> seasonalPatterns(List<TimeSeriesPoint> points) {
        List<SeasonalPattern> patterns = new ArrayList<>();
        if (points.size() >= SeasonalPeriod.HOURLY.getMinimumPoints()) {
            addIfStrong(patterns, SeasonalPeriod.HOURLY, bucketAverages(points, 24, SeasonalPeriod.HOURLY));
        }
        if (points.size() >= SeasonalPeriod.DAILY.getMinimumPoints()) {
            addIfStrong(patterns, SeasonalPeriod.DAILY, bucketAverages(points, 7, SeasonalPeriod.DAILY));
        }
        if (points.size() >= SeasonalPeriod.WEEKLY.getMinimumPoints()) {
            double[] weekly = weeklyAverages(points);
            if (weekly.length >= MIN_WEEKS) {
                addIfStrong(patterns, SeasonalPeriod.WEEKLY, weekly);
            }
        }
        return patterns;
    }

    /**
     * @param timestamp epoch milliseconds
     * @param period    HOURLY or DAILY
     * @return hour of day in [0,24) or day of week in [0,7) with Sunday as 0
     */
    public int bucketOf(long timestamp, SeasonalPeriod period) {
        ZonedDateTime time = Instant.ofEpochMilli(timestamp).atZone(zoneId);
        if (period == SeasonalPeriod.HOURLY) {
            return time.getHour();
        }
        return time.getDayOfWeek().getValue() % 7;
    }

    double[] bucketAverages(List<TimeSeriesPoint> points, int buckets, SeasonalPeriod period) {
        double[] sums = new double[buckets];
        int[] counts = new int[buckets];
        for (TimeSeriesPoint point : points) {
            int bucket = bucketOf(point.getTimestamp(), period);
            sums[bucket] += point.getValue();
            counts[bucket]++;
        }
        double[] averages = new double[buckets];
        for (int i = 0; i < buckets; i++) {
            averages[i] = counts[i] > 0 ? sums[i] / counts[i] : 0;
        }
        return averages;
    }

    double[] weeklyAverages(List<TimeSeriesPoint> points) {
        Map<LocalDate, double[]> weeks = new TreeMap<>();
        for (TimeSeriesPoint point : points) {
            LocalDate weekStart = Instant.ofEpochMilli(point.getTimestamp()).atZone(zoneId).toLocalDate()
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
            double[] sumAndCount = weeks.computeIfAbsent(weekStart, k -> new double[2]);
            sumAndCount[0] += point.getValue();
            sumAndCount[1]++;
        }
        return weeks.values().stream().mapToDouble(s -> s[0] / s[1]).toArray();
    }

    /**
     * @param averages bucket averages
     * @return standard deviation over mean of the averages in [0,1], 0 when the
     *         mean is not positive
     */
    public static double strength(double[] averages) {
        double mean = CommonUtils.mean(averages);
        if (mean <= 0) {
            return 0;
        }
        return Math.min(1.0, CommonUtils.standardDeviation(averages) / mean);
    }

    private static void addIfStrong(List<SeasonalPattern> patterns, SeasonalPeriod period, double[] averages) {
        double strength = strength(averages);
        if (strength > MIN_SEASONAL_STRENGTH) {
            patterns.add(new SeasonalPattern(period, averages, strength));
        }
    }

    /**
     * Ordinary least squares of value against index.
     *
     * @param values series values in time order
     * @return the fitted trend, flat for fewer than ten values
     */
    public static TrendData trend(double[] values) {
        int n = values.length;
        if (n < MIN_TREND_POINTS) {
            return TrendData.flat(CommonUtils.mean(values));
        }
        double meanX = (n - 1) / 2.0;
        double meanY = CommonUtils.mean(values);
        double sxx = 0;
        double sxy = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            double dy = values[i] - meanY;
            sxx += dx * dx;
            sxy += dx * dy;
            syy += dy * dy;
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        double rSquared = syy > 0 ? (sxy * sxy) / (sxx * syy) : 0;
        return new TrendData(slope, intercept, rSquared);
    }
}
