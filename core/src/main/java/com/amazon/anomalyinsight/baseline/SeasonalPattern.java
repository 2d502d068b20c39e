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

import java.util.Arrays;

import lombok.Getter;

import com.amazon.anomalyinsight.config.SeasonalPeriod;

/**
 * Average value per bucket of a period, with the relative spread of those
 * averages as the strength of the pattern.
 */
public class SeasonalPattern {

    @Getter
    private final SeasonalPeriod period;

    private final double[] pattern;

    @Getter
    private final double strength;

    public SeasonalPattern(SeasonalPeriod period, double[] pattern, double strength) {
        this.period = period;
        this.pattern = Arrays.copyOf(pattern, pattern.length);
        this.strength = strength;
    }

    public double[] getPattern() {
        return Arrays.copyOf(pattern, pattern.length);
    }

    public int size() {
        return pattern.length;
    }

    /**
     * @param bucket index of the bucket
     * @return the average of the bucket, 0 when the index is out of range
     */
    public double getExpectedValue(int bucket) {
        if (bucket < 0 || bucket >= pattern.length) {
            return 0;
        }
        return pattern[bucket];
    }
}
