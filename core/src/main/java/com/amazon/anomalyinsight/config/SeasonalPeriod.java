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

package com.amazon.anomalyinsight.config;

/**
 * Periods over which seasonal patterns are extracted.
 */
public enum SeasonalPeriod {
    /**
     * 24 hour-of-day buckets
     */
    HOURLY(168),
    /**
     * 7 day-of-week buckets, index 0 is Sunday
     */
    DAILY(168),
    /**
     * one bucket per calendar week
     */
    WEEKLY(672);

    private final int minimumPoints;

    SeasonalPeriod(int minimumPoints) {
        this.minimumPoints = minimumPoints;
    }

    /**
     * @return the number of points needed before the period is examined
     */
    public int getMinimumPoints() {
        return minimumPoints;
    }
}
