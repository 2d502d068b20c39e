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

import static com.amazon.anomalyinsight.CommonUtils.averagePathLength;
import static com.amazon.anomalyinsight.CommonUtils.checkArgument;

import java.util.Random;

/**
 * A binary tree of random axis parallel cuts built over a sample of the
 * training data. Anomalies are isolated close to the root.
 */
public class IsolationTree {

    private final Node root;

    public IsolationTree(Node root) {
        this.root = root;
    }

    public Node getRoot() {
        return root;
    }

    public int getSize() {
        return root.getSize();
    }

    /**
     * Builds a tree over the rows selected by {@code indices}.
     *
     * @param rows     the training rows
     * @param indices  the rows in the sample
     * @param maxDepth depth at which nodes become leaves
     * @param random   source of the random cuts
     * @return the tree
     */
    public static IsolationTree build(double[][] rows, int[] indices, int maxDepth, Random random) {
        checkArgument(indices.length > 0, "cannot build a tree over no points");
        return new IsolationTree(buildNode(rows, indices, 0, maxDepth, random));
    }

    private static Node buildNode(double[][] rows, int[] indices, int depth, int maxDepth, Random random) {
        int size = indices.length;
        if (depth >= maxDepth || size <= 1) {
            return Node.leaf(size);
        }
        int dimension = random.nextInt(rows[indices[0]].length);
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (int index : indices) {
            min = Math.min(min, rows[index][dimension]);
            max = Math.max(max, rows[index][dimension]);
        }
        if (min == max) {
            return Node.leaf(size);
        }
        Cut cut = new Cut(dimension, min + random.nextDouble() * (max - min));

        int leftCount = 0;
        for (int index : indices) {
            if (Cut.isLeftOf(rows[index], cut)) {
                leftCount++;
            }
        }
        int[] leftIndices = new int[leftCount];
        int[] rightIndices = new int[size - leftCount];
        int l = 0;
        int r = 0;
        for (int index : indices) {
            if (Cut.isLeftOf(rows[index], cut)) {
                leftIndices[l++] = index;
            } else {
                rightIndices[r++] = index;
            }
        }
        Node left = leftCount > 0 ? buildNode(rows, leftIndices, depth + 1, maxDepth, random) : null;
        Node right = size - leftCount > 0 ? buildNode(rows, rightIndices, depth + 1, maxDepth, random) : null;
        return new Node(cut, left, right, size);
    }

    /**
     * The depth at which the point leaves the tree plus the expected remaining
     * depth of the points it shares a leaf with. A missing coordinate stops the
     * descent at the current node.
     *
     * @param point the query point
     * @return the isolation path length
     */
    public double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            double value = point[node.getCut().getDimension()];
            if (Double.isNaN(value)) {
                return depth + averagePathLength(node.getSize());
            }
            Node next = Cut.isLeftOf(point, node.getCut()) ? node.getLeft() : node.getRight();
            if (next == null) {
                return depth + 1 + averagePathLength(Math.max(1, node.getSize() / 2));
            }
            node = next;
            depth++;
        }
        return depth + averagePathLength(node.getSize());
    }

    /**
     * Adds the number of cuts per dimension of this tree to {@code counts}.
     */
    public void countCuts(int[] counts) {
        countCuts(root, counts);
    }

    private static void countCuts(Node node, int[] counts) {
        if (node == null || node.isLeaf()) {
            return;
        }
        counts[node.getCut().getDimension()]++;
        countCuts(node.getLeft(), counts);
        countCuts(node.getRight(), counts);
    }
}
