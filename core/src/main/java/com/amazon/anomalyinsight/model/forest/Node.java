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

import lombok.Getter;

/**
 * A node of an isolation tree. Internal nodes carry a cut and at least one
 * child; a child is null when the cut sent no training point to that side.
 * Leaves carry only the number of training points that reached them.
 */
@Getter
public class Node {

    private final Cut cut;

    private final Node left;

    private final Node right;

    private final int size;

    public Node(Cut cut, Node left, Node right, int size) {
        this.cut = cut;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    public static Node leaf(int size) {
        return new Node(null, null, null, size);
    }

    public boolean isLeaf() {
        return cut == null;
    }
}
