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

package com.amazon.anomalyinsight.testutils;

import lombok.Getter;

/**
 * A univariate series with timestamps and the indices at which the generator
 * switched into its anomalous regime.
 */
@Getter
public class LabeledSeries {

    private final long[] timestamps;

    private final double[] values;

    private final int[] anomalyIndices;

    public LabeledSeries(long[] timestamps, double[] values, int[] anomalyIndices) {
        this.timestamps = timestamps;
        this.values = values;
        this.anomalyIndices = anomalyIndices;
    }

    public int size() {
        return values.length;
    }

    public boolean isAnomaly(int index) {
        for (int i : anomalyIndices) {
            if (i == index) {
                return true;
            }
        }
        return false;
    }
}
