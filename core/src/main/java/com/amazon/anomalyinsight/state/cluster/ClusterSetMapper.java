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

package com.amazon.anomalyinsight.state.cluster;

import com.amazon.anomalyinsight.model.cluster.ClusterSet;
import com.amazon.anomalyinsight.state.IStateMapper;

public class ClusterSetMapper implements IStateMapper<ClusterSet, ClusterSetState> {

    @Override
    public ClusterSetState toState(ClusterSet model) {
        int k = model.getNumberOfClusters();
        double[][] centroids = new double[k][];
        double[] variances = new double[k];
        int[] sizes = new int[k];
        for (int i = 0; i < k; i++) {
            centroids[i] = model.getCentroid(i);
            variances[i] = model.getVariance(i);
            sizes[i] = model.getSize(i);
        }
        ClusterSetState state = new ClusterSetState();
        state.setCentroids(centroids);
        state.setVariances(variances);
        state.setSizes(sizes);
        state.setInertia(model.getInertia());
        state.setSilhouette(model.getSilhouette());
        state.setIterations(model.getIterations());
        state.setTrainingSize(model.getTrainingSize());
        return state;
    }

    @Override
    public ClusterSet toModel(ClusterSetState state) {
        return new ClusterSet(state.getCentroids(), state.getVariances(), state.getSizes(), state.getInertia(),
                state.getSilhouette(), state.getIterations(), state.getTrainingSize());
    }
}
