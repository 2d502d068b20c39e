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

package com.amazon.anomalyinsight;

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    /** The Euler-Mascheroni constant used by the average path length. */
    public static final double EULER_CONSTANT = 0.5772156649;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * The expected path length of an unsuccessful search in a binary search tree
     * built over n points. This normalizes isolation depths.
     *
     * @param n number of points
     * @return c(n), which is 0 for n at most 1 and 1 for n equal to 2
     */
    public static double averagePathLength(double n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        return 2 * (Math.log(n - 1) + EULER_CONSTANT) - 2 * (n - 1) / n;
    }

    public static boolean isFinite(double[] point) {
        if (point == null) {
            return false;
        }
        for (double value : point) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    public static double clamp(double value, double lower, double upper) {
        if (Double.isNaN(value)) {
            return lower;
        }
        return Math.max(lower, Math.min(upper, value));
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * @param values the population
     * @return the population variance, 0 for an empty array
     */
    public static double variance(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / values.length;
    }

    public static double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Percentile with linear interpolation between the two closest order
     * statistics, at fractional index {@code p/100 * (n-1)}.
     *
     * @param sorted     values in ascending order
     * @param percentile a value in [0,100]
     * @return the interpolated percentile
     */
    public static double percentile(double[] sorted, double percentile) {
        checkArgument(sorted.length > 0, "cannot compute a percentile of no values");
        checkArgument(percentile >= 0 && percentile <= 100, "percentile must be in [0,100]");
        double index = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (index - lower);
    }

    public static double squaredDistance(double[] a, double[] b) {
        checkArgument(a.length == b.length, "incorrect lengths");
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    public static double euclideanDistance(double[] a, double[] b) {
        return Math.sqrt(squaredDistance(a, b));
    }
}
