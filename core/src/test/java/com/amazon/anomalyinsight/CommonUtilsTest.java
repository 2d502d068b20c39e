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

import static com.amazon.anomalyinsight.CommonUtils.averagePathLength;
import static com.amazon.anomalyinsight.CommonUtils.checkArgument;
import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;
import static com.amazon.anomalyinsight.CommonUtils.checkState;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertThrows(IllegalArgumentException.class, () -> checkArgument(false, "bad"));
        assertDoesNotThrow(() -> checkArgument(true, "good"));
        assertThrows(IllegalStateException.class, () -> checkState(false, "bad"));
        assertThrows(NullPointerException.class, () -> checkNotNull(null, "null"));
        assertEquals("x", checkNotNull("x", "null"));
    }

    @Test
    public void testAveragePathLength() {
        assertEquals(0, averagePathLength(0));
        assertEquals(0, averagePathLength(1));
        assertEquals(1, averagePathLength(2));
        double expected = 2 * (Math.log(255) + 0.5772156649) - 2 * 255.0 / 256;
        assertEquals(expected, averagePathLength(256), 1e-12);
    }

    @Test
    public void testPercentileInterpolates() {
        double[] sorted = { 1, 2, 3, 4 };
        assertEquals(2.5, CommonUtils.percentile(sorted, 50), 1e-12);
        assertEquals(1.3, CommonUtils.percentile(sorted, 10), 1e-12);
        assertEquals(4, CommonUtils.percentile(sorted, 100), 1e-12);
        assertEquals(7, CommonUtils.percentile(new double[] { 7 }, 90), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.percentile(new double[0], 50));
    }

    @Test
    public void testMoments() {
        double[] values = { 2, 4, 4, 4, 5, 5, 7, 9 };
        assertEquals(5, CommonUtils.mean(values), 1e-12);
        assertEquals(4, CommonUtils.variance(values), 1e-12);
        assertEquals(2, CommonUtils.standardDeviation(values), 1e-12);
        assertEquals(0, CommonUtils.mean(new double[0]));
    }

    @Test
    public void testFiniteAndClamp() {
        assertTrue(CommonUtils.isFinite(new double[] { 1, 2 }));
        assertFalse(CommonUtils.isFinite(new double[] { 1, Double.NaN }));
        assertFalse(CommonUtils.isFinite(new double[] { Double.POSITIVE_INFINITY }));
        assertFalse(CommonUtils.isFinite(null));
        assertEquals(1, CommonUtils.clamp(3, 0, 1));
        assertEquals(0, CommonUtils.clamp(Double.NaN, 0, 1));
        assertEquals(5, CommonUtils.euclideanDistance(new double[] { 0, 0 }, new double[] { 3, 4 }), 1e-12);
    }
}
