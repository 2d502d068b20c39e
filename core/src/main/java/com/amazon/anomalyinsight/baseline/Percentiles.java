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

import static com.amazon.anomalyinsight.CommonUtils.percentile;

import lombok.Getter;

@Getter
public class Percentiles {

    private final double p10;
    private final double p25;
    private final double p50;
    private final double p75;
    private final double p90;
    private final double p95;
    private final double p99;

    public Percentiles(double p10, double p25, double p50, double p75, double p90, double p95, double p99) {
        this.p10 = p10;
        this.p25 = p25;
        this.p50 = p50;
        this.p75 = p75;
        this.p90 = p90;
        this.p95 = p95;
        this.p99 = p99;
    }

    /**
     * @param sorted ascending values, at least one
     * @return the interpolated percentiles of the values
     */
    public static Percentiles of(double[] sorted) {
        return new Percentiles(percentile(sorted, 10), percentile(sorted, 25), percentile(sorted, 50),
                percentile(sorted, 75), percentile(sorted, 90), percentile(sorted, 95), percentile(sorted, 99));
    }

    /**
     * @return p10 through p99 in ascending order of rank
     */
    public double[] toArray() {
        return new double[] { p10, p25, p50, p75, p90, p95, p99 };
    }

    public double getInterquartileRange() {
        return p75 - p25;
    }
}
