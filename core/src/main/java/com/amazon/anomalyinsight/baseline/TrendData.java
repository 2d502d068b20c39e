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

import com.amazon.anomalyinsight.config.TrendDirection;

/**
 * Least squares line over (index, value). The correlation is R squared.
 */
@Getter
public class TrendData {

    public static final double SLOPE_THRESHOLD = 0.01;

    private final double slope;

    private final double intercept;

    private final double correlation;

    private final TrendDirection direction;

    public TrendData(double slope, double intercept, double correlation) {
        this.slope = slope;
        this.intercept = intercept;
        this.correlation = correlation;
        if (Math.abs(slope) <= SLOPE_THRESHOLD) {
            this.direction = TrendDirection.STABLE;
        } else {
            this.direction = slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }
    }

    public static TrendData flat(double level) {
        return new TrendData(0, level, 0);
    }
}
