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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.anomalyinsight.config.SeasonalPeriod;

/**
 * An immutable statistical summary of one series. A new instance replaces the
 * old one whenever the series is recomputed.
 */
@Getter
public class BaselineData {

    private final String key;

    private final double mean;

    private final double stdDev;

    private final double min;

    private final double max;

    private final Percentiles percentiles;

    private final List<SeasonalPattern> seasonalPatterns;

    private final TrendData trendData;

    private final long lastUpdated;

    private final int sampleSize;

    public BaselineData(String key, double mean, double stdDev, double min, double max, Percentiles percentiles,
            List<SeasonalPattern> seasonalPatterns, TrendData trendData, long lastUpdated, int sampleSize) {
        this.key = key;
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
        this.percentiles = percentiles;
        this.seasonalPatterns = seasonalPatterns == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(seasonalPatterns));
        this.trendData = trendData;
        this.lastUpdated = lastUpdated;
        this.sampleSize = sampleSize;
    }

    public Optional<SeasonalPattern> getSeasonalPattern(SeasonalPeriod period) {
        return seasonalPatterns.stream().filter(p -> p.getPeriod() == period).findFirst();
    }

    /**
     * @param value a value of the series
     * @return the number of standard deviations between the value and the mean;
     *         a zero deviation is treated as one
     */
    public double zScore(double value) {
        double deviation = stdDev > 0 ? stdDev : 1.0;
        return Math.abs(value - mean) / deviation;
    }

    /**
     * Approximate rank of a value: (i+1)/(n+1) for the first percentile in
     * ascending order at or above the value, and 1 when the value exceeds all of
     * them.
     *
     * @param value a value of the series
     * @return a position in (0,1]
     */
    public double percentilePosition(double value) {
        double[] values = percentiles.toArray();
        for (int i = 0; i < values.length; i++) {
            if (value <= values[i]) {
                return (i + 1.0) / (values.length + 1.0);
            }
        }
        return 1.0;
    }
}
