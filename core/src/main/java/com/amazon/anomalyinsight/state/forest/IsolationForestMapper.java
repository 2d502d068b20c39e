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

import java.util.ArrayList;
import java.util.List;

import com.amazon.anomalyinsight.model.forest.IsolationForest;
import com.amazon.anomalyinsight.model.forest.IsolationTree;
import com.amazon.anomalyinsight.state.IStateMapper;

public class IsolationForestMapper implements IStateMapper<IsolationForest, IsolationForestState> {

    @Override
    public IsolationForestState toState(IsolationForest forest) {
        IsolationTreeMapper treeMapper = new IsolationTreeMapper();
        List<IsolationTreeState> trees = new ArrayList<>();
        for (IsolationTree tree : forest.getTrees()) {
            trees.add(treeMapper.toState(tree));
        }
        IsolationForestState state = new IsolationForestState();
        state.setSampleSize(forest.getSampleSize());
        state.setDimensions(forest.getDimensions());
        state.setTrainingSize(forest.getTrainingSize());
        state.setTrees(trees);
        return state;
    }

    @Override
    public IsolationForest toModel(IsolationForestState state) {
        IsolationTreeMapper treeMapper = new IsolationTreeMapper();
        List<IsolationTree> trees = new ArrayList<>();
        for (IsolationTreeState treeState : state.getTrees()) {
            trees.add(treeMapper.toModel(treeState));
        }
        return new IsolationForest(trees, state.getSampleSize(), state.getDimensions(), state.getTrainingSize());
    }
}
