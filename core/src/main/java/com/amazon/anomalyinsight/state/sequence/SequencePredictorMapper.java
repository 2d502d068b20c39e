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

package com.amazon.anomalyinsight.state.sequence;

import com.amazon.anomalyinsight.model.sequence.RecurrentNetwork;
import com.amazon.anomalyinsight.model.sequence.SequencePredictor;
import com.amazon.anomalyinsight.state.IStateMapper;

public class SequencePredictorMapper implements IStateMapper<SequencePredictor, SequencePredictorState> {

    @Override
    public SequencePredictorState toState(SequencePredictor model) {
        RecurrentNetwork network = model.getNetwork();
        SequencePredictorState state = new SequencePredictorState();
        state.setInputWeights(network.getInputWeights());
        state.setRecurrentWeights(network.getRecurrentWeights());
        state.setHiddenBias(network.getHiddenBias());
        state.setOutputWeights(network.getOutputWeights());
        state.setOutputBias(network.getOutputBias());
        state.setMin(model.getMin());
        state.setRange(model.getRange());
        state.setContext(model.getContext());
        state.setResidualDeviation(model.getResidualDeviation());
        state.setDimensions(model.getDimensions());
        state.setTrainingSize(model.getTrainingSize());
        return state;
    }

    @Override
    public SequencePredictor toModel(SequencePredictorState state) {
        RecurrentNetwork network = new RecurrentNetwork(state.getInputWeights(), state.getRecurrentWeights(),
                state.getHiddenBias(), state.getOutputWeights(), state.getOutputBias());
        return new SequencePredictor(network, state.getMin(), state.getRange(), state.getContext(),
                state.getResidualDeviation(), state.getDimensions(), state.getTrainingSize());
    }
}
