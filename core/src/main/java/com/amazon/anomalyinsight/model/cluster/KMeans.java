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
import static com.amazon.anomalyinsight.CommonUtils.squaredDistance;

import java.util.Arrays;
import java.util.Random;

/**
 * Lloyd's algorithm with k-means++ seeding.
 */
public class KMeans {

    public static final double CONVERGENCE_TOLERANCE = 1e-6;

    /**
     * silhouette is estimated over at most this many rows
     */
    public static final int SILHOUETTE_SAMPLE_SIZE = 200;

    private final int numberOfClusters;

    private final int maxIterations;

    private final Random random;

    public KMeans(int numberOfClusters, int maxIterations, Random random) {
        checkArgument(numberOfClusters > 0, "numberOfClusters must be greater than 0");
        checkArgument(maxIterations > 0, "maxIterations must be greater than 0");
        this.numberOfClusters = numberOfClusters;
        this.maxIterations = maxIterations;
        this.random = random;
    }

    /**
     * @param rows training rows of equal length, at least as many as clusters
     * @return the clustering
     */
    public ClusterSet fit(double[][] rows) {
        checkArgument(rows.length >= numberOfClusters, "fewer rows than clusters");
        double[][] centroids = seed(rows);
        int[] assignment = new int[rows.length];
        int iterations = 0;
        boolean converged = false;
        while (!converged && iterations < maxIterations) {
            iterations++;
            assign(rows, centroids, assignment);
            double maxShift = 0;
            double[][] updated = means(rows, centroids, assignment);
            for (int c = 0; c < centroids.length; c++) {
                maxShift = Math.max(maxShift, euclideanDistance(centroids[c], updated[c]));
            }
            centroids = updated;
            converged = maxShift <= CONVERGENCE_TOLERANCE;
        }
        assign(rows, centroids, assignment);

        double[] sums = new double[centroids.length];
        int[] sizes = new int[centroids.length];
        double inertia = 0;
        for (int i = 0; i < rows.length; i++) {
            double distance = squaredDistance(rows[i], centroids[assignment[i]]);
            sums[assignment[i]] += distance;
            sizes[assignment[i]]++;
            inertia += distance;
        }
        double[] variances = new double[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            variances[c] = sizes[c] == 0 ? ClusterSet.EMPTY_CLUSTER_VARIANCE
                    : Math.max(ClusterSet.MIN_VARIANCE, sums[c] / sizes[c]);
        }
        return new ClusterSet(centroids, variances, sizes, inertia, silhouette(rows, assignment, centroids.length),
                iterations, rows.length);
    }

    /**
     * k-means++: the first centroid is a uniformly random row, each further
     * centroid is a row drawn with probability proportional to its squared
     * distance to the closest centroid chosen so far.
     */
    double[][] seed(double[][] rows) {
        double[][] centroids = new double[numberOfClusters][];
        centroids[0] = Arrays.copyOf(rows[random.nextInt(rows.length)], rows[0].length);
        double[] weights = new double[rows.length];
        for (int c = 1; c < numberOfClusters; c++) {
            double total = 0;
            for (int i = 0; i < rows.length; i++) {
                double nearest = Double.MAX_VALUE;
                for (int j = 0; j < c; j++) {
                    nearest = Math.min(nearest, squaredDistance(rows[i], centroids[j]));
                }
                weights[i] = nearest;
                total += nearest;
            }
            int chosen;
            if (total <= 0) {
                chosen = random.nextInt(rows.length);
            } else {
                double target = random.nextDouble() * total;
                chosen = rows.length - 1;
                double cumulative = 0;
                for (int i = 0; i < rows.length; i++) {
                    cumulative += weights[i];
                    if (cumulative >= target) {
                        chosen = i;
                        break;
                    }
                }
            }
            centroids[c] = Arrays.copyOf(rows[chosen], rows[chosen].length);
        }
        return centroids;
    }

    static void assign(double[][] rows, double[][] centroids, int[] assignment) {
        for (int i = 0; i < rows.length; i++) {
            int best = 0;
            double bestDistance = Double.MAX_VALUE;
            for (int c = 0; c < centroids.length; c++) {
                double distance = squaredDistance(rows[i], centroids[c]);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = c;
                }
            }
            assignment[i] = best;
        }
    }

    // an empty cluster keeps its previous centroid
    static double[][] means(double[][] rows, double[][] centroids, int[] assignment) {
        int dimensions = rows[0].length;
        double[][] sums = new double[centroids.length][dimensions];
        int[] counts = new int[centroids.length];
        for (int i = 0; i < rows.length; i++) {
            counts[assignment[i]]++;
            for (int d = 0; d < dimensions; d++) {
                sums[assignment[i]][d] += rows[i][d];
            }
        }
        double[][] result = new double[centroids.length][];
        for (int c = 0; c < centroids.length; c++) {
            if (counts[c] == 0) {
                result[c] = Arrays.copyOf(centroids[c], dimensions);
            } else {
                result[c] = new double[dimensions];
                for (int d = 0; d < dimensions; d++) {
                    result[c][d] = sums[c][d] / counts[c];
                }
            }
        }
        return result;
    }

    /**
     * Mean silhouette coefficient over an evenly spaced subset of the rows.
     */
    static double silhouette(double[][] rows, int[] assignment, int numberOfClusters) {
        if (numberOfClusters < 2) {
            return 0;
        }
        int step = Math.max(1, rows.length / SILHOUETTE_SAMPLE_SIZE);
        double total = 0;
        int counted = 0;
        for (int i = 0; i < rows.length; i += step) {
            double[] sum = new double[numberOfClusters];
            int[] count = new int[numberOfClusters];
            for (int j = 0; j < rows.length; j += step) {
                if (i != j) {
                    sum[assignment[j]] += euclideanDistance(rows[i], rows[j]);
                    count[assignment[j]]++;
                }
            }
            int own = assignment[i];
            if (count[own] == 0) {
                continue;
            }
            double a = sum[own] / count[own];
            double b = Double.MAX_VALUE;
            for (int c = 0; c < numberOfClusters; c++) {
                if (c != own && count[c] > 0) {
                    b = Math.min(b, sum[c] / count[c]);
                }
            }
            if (b == Double.MAX_VALUE) {
                continue;
            }
            double denominator = Math.max(a, b);
            total += denominator == 0 ? 0 : (b - a) / denominator;
            counted++;
        }
        return counted == 0 ? 0 : total / counted;
    }
}
