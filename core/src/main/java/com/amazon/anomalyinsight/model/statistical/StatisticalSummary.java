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

package com.amazon.anomalyinsight.model.statistical;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.anomalyinsight.CommonUtils;

/**
 * Location and spread of a single column: mean, population standard deviation
 * and the quartiles.
 */
@Getter
public class StatisticalSummary {

    public static final double IQR_MULTIPLIER = 1.5;

    private final double mean;

    private final double stdDev;

    private final double q1;

    private final double q3;

    private final int dimensions;

    private final int trainingSize;

    public StatisticalSummary(double mean, double stdDev, double q1, double q3, int dimensions, int trainingSize) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.q1 = q1;
        this.q3 = q3;
        this.dimensions = dimensions;
        this.trainingSize = trainingSize;
    }

    public static StatisticalSummary of(double[] column, int dimensions) {
        double[] sorted = Arrays.copyOf(column, column.length);
        Arrays.sort(sorted);
        return new StatisticalSummary(CommonUtils.mean(column), CommonUtils.standardDeviation(column),
                CommonUtils.percentile(sorted, 25), CommonUtils.percentile(sorted, 75), dimensions, column.length);
    }

    public double getIqr() {
        return q3 - q1;
    }

    /**
     * @return the z-score term, {@code min(1, |v-mean|/stdDev/3)}
     */
    public double zScoreComponent(double value) {
        if (stdDev <= 0) {
            return value == mean ? 0 : 1;
        }
        return Math.min(1.0, Math.abs(value - mean) / stdDev / 3.0);
    }

    public boolean isOutlier(double value) {
        double iqr = getIqr();
        return value < q1 - IQR_MULTIPLIER * iqr || value > q3 + IQR_MULTIPLIER * iqr;
    }

    public double score(double value) {
        return (zScoreComponent(value) + (isOutlier(value) ? 1 : 0)) / 2.0;
    }
}
