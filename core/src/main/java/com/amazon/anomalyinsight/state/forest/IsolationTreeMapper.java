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

package com.amazon.anomalyinsight.state.forest;

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

import com.amazon.anomalyinsight.model.forest.Cut;
import com.amazon.anomalyinsight.model.forest.IsolationTree;
import com.amazon.anomalyinsight.model.forest.Node;
import com.amazon.anomalyinsight.state.IStateMapper;

public class IsolationTreeMapper implements IStateMapper<IsolationTree, IsolationTreeState> {

    public static final int NULL = -1;

    @Override
    public IsolationTreeState toState(IsolationTree tree) {
        List<Node> nodes = new ArrayList<>();
        collect(tree.getRoot(), nodes);
        int n = nodes.size();
        IsolationTreeState state = new IsolationTreeState();
        int[] dimensions = new int[n];
        double[] values = new double[n];
        int[] sizes = new int[n];
        int[] left = new int[n];
        int[] right = new int[n];

        // pre-order positions of every node, matched by identity
        IdentityHashMap<Node, Integer> index = new IdentityHashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(nodes.get(i), i);
        }
        for (int i = 0; i < n; i++) {
            Node node = nodes.get(i);
            sizes[i] = node.getSize();
            if (node.isLeaf()) {
                dimensions[i] = NULL;
                left[i] = NULL;
                right[i] = NULL;
            } else {
                dimensions[i] = node.getCut().getDimension();
                values[i] = node.getCut().getValue();
                left[i] = node.getLeft() == null ? NULL : index.get(node.getLeft());
                right[i] = node.getRight() == null ? NULL : index.get(node.getRight());
            }
        }
        state.setCutDimensions(dimensions);
        state.setCutValues(values);
        state.setSizes(sizes);
        state.setLeftChildren(left);
        state.setRightChildren(right);
        return state;
    }

    private static void collect(Node node, List<Node> nodes) {
        if (node == null) {
            return;
        }
        nodes.add(node);
        collect(node.getLeft(), nodes);
        collect(node.getRight(), nodes);
    }

    @Override
    public IsolationTree toModel(IsolationTreeState state) {
        int n = state.getSizes().length;
        checkArgument(n > 0, "a tree has at least one node");
        checkArgument(state.getCutDimensions().length == n && state.getCutValues().length == n
                && state.getLeftChildren().length == n && state.getRightChildren().length == n,
                "incorrect lengths");
        return new IsolationTree(build(state, 0));
    }

    private static Node build(IsolationTreeState state, int i) {
        if (i == NULL) {
            return null;
        }
        int dimension = state.getCutDimensions()[i];
        if (dimension < 0) {
            return Node.leaf(state.getSizes()[i]);
        }
        checkArgument(state.getLeftChildren()[i] != i && state.getRightChildren()[i] != i, "cyclic tree state");
        return new Node(new Cut(dimension, state.getCutValues()[i]), build(state, state.getLeftChildren()[i]),
                build(state, state.getRightChildren()[i]), state.getSizes()[i]);
    }
}
