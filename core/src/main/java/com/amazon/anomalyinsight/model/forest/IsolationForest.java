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

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import lombok.Getter;

import com.amazon.anomalyinsight.CommonUtils;

/**
 * An immutable collection of isolation trees. The score of a point is
 * {@code 2^(-E[h(x)]/c(n))} where {@code E[h(x)]} is the average path length
 * over the trees and {@code n} is the number of training rows.
 */
@Getter
public class IsolationForest {

    private final List<IsolationTree> trees;

    private final int sampleSize;

    private final int dimensions;

    private final int trainingSize;

    public IsolationForest(List<IsolationTree> trees, int sampleSize, int dimensions, int trainingSize) {
        checkArgument(!trees.isEmpty(), "a forest needs at least one tree");
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        this.sampleSize = sampleSize;
        this.dimensions = dimensions;
        this.trainingSize = trainingSize;
    }

    /**
     * @param rows          training rows of equal length
     * @param numberOfTrees trees to grow
     * @param sampleSize    maximum rows per tree
     * @param maxDepth      maximum tree depth
     * @param random        randomness for sampling and cuts
     * @return the forest
     */
    public static IsolationForest build(double[][] rows, int numberOfTrees, int sampleSize, int maxDepth,
            Random random) {
        checkArgument(rows.length > 1, "need at least two rows");
        int effectiveSampleSize = Math.min(sampleSize, rows.length);
        int[] permutation = new int[rows.length];
        for (int i = 0; i < permutation.length; i++) {
            permutation[i] = i;
        }
        List<IsolationTree> trees = new ArrayList<>(numberOfTrees);
        for (int t = 0; t < numberOfTrees; t++) {
            // partial Fisher-Yates shuffle; the first effectiveSampleSize entries are the sample
            for (int i = 0; i < effectiveSampleSize; i++) {
                int j = i + random.nextInt(permutation.length - i);
                int swap = permutation[i];
                permutation[i] = permutation[j];
                permutation[j] = swap;
            }
            int[] sample = new int[effectiveSampleSize];
            System.arraycopy(permutation, 0, sample, 0, effectiveSampleSize);
            trees.add(IsolationTree.build(rows, sample, maxDepth, random));
        }
        return new IsolationForest(trees, effectiveSampleSize, rows[0].length, rows.length);
    }

    public double meanPathLength(double[] point) {
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.pathLength(point);
        }
        return sum / trees.size();
    }

    /**
     * @param point the query point
     * @return the anomaly score in [0,1], higher is more anomalous
     */
    public double score(double[] point) {
        double normalizer = CommonUtils.averagePathLength(trainingSize);
        if (normalizer <= 0) {
            return 0;
        }
        double score = Math.pow(2, -meanPathLength(point) / normalizer);
        return Math.max(0, Math.min(1, score));
    }

    /**
     * @return for each dimension, the fraction of all cuts made in it
     */
    public double[] featureImportance() {
        int[] counts = new int[dimensions];
        for (IsolationTree tree : trees) {
            tree.countCuts(counts);
        }
        int total = 0;
        for (int count : counts) {
            total += count;
        }
        double[] importance = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            importance[i] = total == 0 ? 0 : (double) counts[i] / total;
        }
        return importance;
    }
}
