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

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;
import static com.amazon.anomalyinsight.CommonUtils.euclideanDistance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Getter;

/**
 * Immutable result of k-means training: centroids with the variance and size
 * of each cluster, plus quality measures of the partition.
 */
public class ClusterSet {

    public static final double MIN_VARIANCE = 0.1;

    public static final double EMPTY_CLUSTER_VARIANCE = 1.0;

    private final double[][] centroids;

    private final double[] variances;

    private final int[] sizes;

    @Getter
    private final double inertia;

    @Getter
    private final double silhouette;

    @Getter
    private final int iterations;

    @Getter
    private final int trainingSize;

    public ClusterSet(double[][] centroids, double[] variances, int[] sizes, double inertia, double silhouette,
            int iterations, int trainingSize) {
        checkArgument(centroids.length > 0, "at least one centroid is required");
        checkArgument(centroids.length == variances.length && centroids.length == sizes.length,
                "incorrect lengths");
        this.centroids = new double[centroids.length][];
        for (int i = 0; i < centroids.length; i++) {
            this.centroids[i] = Arrays.copyOf(centroids[i], centroids[i].length);
        }
        this.variances = Arrays.copyOf(variances, variances.length);
        this.sizes = Arrays.copyOf(sizes, sizes.length);
        this.inertia = inertia;
        this.silhouette = silhouette;
        this.iterations = iterations;
        this.trainingSize = trainingSize;
    }

    public int getNumberOfClusters() {
        return centroids.length;
    }

    public int getDimensions() {
        return centroids[0].length;
    }

    public double[] getCentroid(int cluster) {
        return Arrays.copyOf(centroids[cluster], centroids[cluster].length);
    }

    public double getVariance(int cluster) {
        return variances[cluster];
    }

    public int getSize(int cluster) {
        return sizes[cluster];
    }

    public ClusterAssignment assign(double[] point) {
        int nearest = -1;
        double nearestDistance = Double.MAX_VALUE;
        double secondDistance = Double.MAX_VALUE;
        for (int i = 0; i < centroids.length; i++) {
            double distance = euclideanDistance(point, centroids[i]);
            if (distance < nearestDistance) {
                secondDistance = nearestDistance;
                nearestDistance = distance;
                nearest = i;
            } else if (distance < secondDistance) {
                secondDistance = distance;
            }
        }
        double confidence;
        if (centroids.length == 1 || secondDistance <= 0) {
            confidence = 1.0;
        } else {
            confidence = (secondDistance - nearestDistance) / secondDistance;
        }
        return new ClusterAssignment(nearest, nearestDistance, confidence);
    }

    public List<ClusterSummary> summaries() {
        List<ClusterSummary> result = new ArrayList<>(centroids.length);
        for (int i = 0; i < centroids.length; i++) {
            result.add(new ClusterSummary(i, centroids[i], variances[i], sizes[i]));
        }
        return result;
    }
}
