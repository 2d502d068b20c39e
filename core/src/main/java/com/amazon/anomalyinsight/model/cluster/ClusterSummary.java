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

package com.amazon.anomalyinsight.model.cluster;

import java.util.Arrays;

import lombok.Getter;

public class ClusterSummary {

    @Getter
    private final int id;

    private final double[] centroid;

    /**
     * mean squared distance of the members to the centroid
     */
    @Getter
    private final double variance;

    @Getter
    private final int size;

    public ClusterSummary(int id, double[] centroid, double variance, int size) {
        this.id = id;
        this.centroid = Arrays.copyOf(centroid, centroid.length);
        this.variance = variance;
        this.size = size;
    }

    public double[] getCentroid() {
        return Arrays.copyOf(centroid, centroid.length);
    }
}
