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

package com.amazon.anomalyinsight.model;

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.anomalyinsight.config.ModelType;
import com.amazon.anomalyinsight.model.cluster.ClusterAssignment;
import com.amazon.anomalyinsight.model.cluster.ClusterSet;
import com.amazon.anomalyinsight.model.cluster.ClusterSummary;
import com.amazon.anomalyinsight.model.cluster.KMeans;
import com.amazon.anomalyinsight.state.StateSerDe;
import com.amazon.anomalyinsight.state.cluster.ClusterSetMapper;
import com.amazon.anomalyinsight.state.cluster.ClusterSetState;

/**
 * Scores a point by its distance to the nearest k-means centroid, in units of
 * that cluster's standard deviation.
 */
@Getter
public class ClusteringModel extends AbstractAnomalyModel<ClusterSet, ClusterSetState> {

    public static final int DEFAULT_NUMBER_OF_CLUSTERS = 5;

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    /**
     * normalized distances at this value map to the top of the score range
     */
    public static final double DEFAULT_ANOMALY_THRESHOLD = 2.0;

    /**
     * slope of the logistic squashing around 0.5
     */
    public static final double SIGMOID_STEEPNESS = 3.0;

    private final int numberOfClusters;

    private final int maxIterations;

    private final double anomalyThreshold;

    public ClusteringModel() {
        this(new Builder<>());
    }

    protected ClusteringModel(Builder<?> builder) {
        super(builder.randomSeed);
        checkArgument(builder.numberOfClusters > 0, "numberOfClusters must be greater than 0");
        checkArgument(builder.maxIterations > 0, "maxIterations must be greater than 0");
        checkArgument(builder.anomalyThreshold > 0, "anomalyThreshold must be positive");
        this.numberOfClusters = builder.numberOfClusters;
        this.maxIterations = builder.maxIterations;
        this.anomalyThreshold = builder.anomalyThreshold;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    @Override
    public ModelType getModelType() {
        return ModelType.CLUSTERING;
    }

    /**
     * @param rows number of training rows
     * @return {@code min(numberOfClusters, max(2, floor(sqrt(rows/2))))}
     */
    public int effectiveNumberOfClusters(int rows) {
        return Math.min(numberOfClusters, Math.max(2, (int) Math.floor(Math.sqrt(rows / 2.0))));
    }

    @Override
    protected ClusterSet fit(double[][] rows) {
        int k = effectiveNumberOfClusters(rows.length);
        if (rows.length < k) {
            return null;
        }
        return new KMeans(k, maxIterations, newRandom()).fit(rows);
    }

    @Override
    protected double score(ClusterSet clusters, double[] features) {
        ClusterAssignment assignment = clusters.assign(features);
        double normalized = assignment.getDistance() / Math.sqrt(clusters.getVariance(assignment.getClusterId()));
        double distance = Math.min(1.0, normalized / anomalyThreshold);
        return 1.0 / (1.0 + Math.exp(-SIGMOID_STEEPNESS * (distance - 0.5)));
    }

    @Override
    protected int dimensionsOf(ClusterSet clusters) {
        return clusters.getDimensions();
    }

    @Override
    protected ModelMetrics estimateMetrics(ClusterSet clusters, long trainedAt) {
        int n = clusters.getTrainingSize();
        double separation = Math.max(0, clusters.getSilhouette());
        double accuracy = Math.min(0.90, 0.70 + 0.20 * separation);
        double precision = Math.min(0.88, 0.72 + 0.16 * separation);
        double recall = Math.min(0.85, 0.75 + n / 10000.0 * 0.1);
        double falsePositiveRate = Math.max(0.03, 0.08 - 0.05 * separation);
        return new ModelMetrics(accuracy, precision, recall, falsePositiveRate, trainedAt, n);
    }

    @Override
    protected StateSerDe<ClusterSet, ClusterSetState> getStateSerDe() {
        return new StateSerDe<>(new ClusterSetMapper(), ClusterSetState.class);
    }

    public List<ClusterSummary> getClusterInfo() {
        return getTrained().map(ClusterSet::summaries).orElse(Collections.emptyList());
    }

    /**
     * @param features a row of the trained dimension
     * @return the nearest cluster, empty while untrained
     */
    public Optional<ClusterAssignment> predictCluster(double[] features) {
        return getTrained().map(clusters -> {
            checkArgument(features.length == clusters.getDimensions(), "incorrect dimension");
            return clusters.assign(features);
        });
    }

    public double getInertia() {
        return getTrained().map(ClusterSet::getInertia).orElse(0.0);
    }

    public double getSilhouetteScore() {
        return getTrained().map(ClusterSet::getSilhouette).orElse(0.0);
    }

    public static class Builder<T extends Builder<T>> {

        private int numberOfClusters = DEFAULT_NUMBER_OF_CLUSTERS;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double anomalyThreshold = DEFAULT_ANOMALY_THRESHOLD;
        private Optional<Long> randomSeed = Optional.empty();

        public T numberOfClusters(int numberOfClusters) {
            this.numberOfClusters = numberOfClusters;
            return (T) this;
        }

        public T maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return (T) this;
        }

        public T anomalyThreshold(double anomalyThreshold) {
            this.anomalyThreshold = anomalyThreshold;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public ClusteringModel build() {
            return new ClusteringModel(this);
        }
    }
}
