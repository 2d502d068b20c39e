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

import lombok.Getter;

/**
 * The nearest cluster of a point. The confidence is the relative gap between
 * the nearest and the second nearest centroid, 1 when there is only one.
 */
@Getter
public class ClusterAssignment {

    private final int clusterId;

    private final double distance;

    private final double confidence;

    public ClusterAssignment(int clusterId, double distance, double confidence) {
        this.clusterId = clusterId;
        this.distance = distance;
        this.confidence = confidence;
    }
}
