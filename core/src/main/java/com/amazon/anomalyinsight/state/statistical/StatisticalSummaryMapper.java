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

package com.amazon.anomalyinsight.state.statistical;

import com.amazon.anomalyinsight.model.statistical.StatisticalSummary;
import com.amazon.anomalyinsight.state.IStateMapper;

public class StatisticalSummaryMapper implements IStateMapper<StatisticalSummary, StatisticalSummaryState> {

    @Override
    public StatisticalSummaryState toState(StatisticalSummary model) {
        StatisticalSummaryState state = new StatisticalSummaryState();
        state.setMean(model.getMean());
        state.setStdDev(model.getStdDev());
        state.setQ1(model.getQ1());
        state.setQ3(model.getQ3());
        state.setDimensions(model.getDimensions());
        state.setTrainingSize(model.getTrainingSize());
        return state;
    }

    @Override
    public StatisticalSummary toModel(StatisticalSummaryState state) {
        return new StatisticalSummary(state.getMean(), state.getStdDev(), state.getQ1(), state.getQ3(),
                state.getDimensions(), state.getTrainingSize());
    }
}
