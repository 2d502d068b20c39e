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

package com.amazon.anomalyinsight.model.forest;

/**
 * A Cut divides space into two half-spaces along one dimension. Points whose
 * coordinate is strictly less than the cut value go left, the rest go right.
 */
public class Cut {

    private final int dimension;
    private final double value;

    /**
     * Create a new Cut with the given dimension and value.
     *
     * @param dimension The 0-based index of the dimension that the cut is made in.
     * @param value     The spatial value of the cut.
     */
    public Cut(int dimension, double value) {
        this.dimension = dimension;
        this.value = value;
    }

    /**
     * @param point A point that we are testing in relation to the cut
     * @param cut   A Cut instance.
     * @return true if the coordinate of the point in the cut dimension is less
     *         than the cut value
     */
    public static boolean isLeftOf(double[] point, Cut cut) {
        return point[cut.getDimension()] < cut.getValue();
    }

    public int getDimension() {
        return dimension;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", dimension, value);
    }
}
