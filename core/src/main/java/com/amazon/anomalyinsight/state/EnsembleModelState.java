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

package com.amazon.anomalyinsight.state;

import static com.amazon.anomalyinsight.state.Version.V1_0;

import lombok.Data;

import com.amazon.anomalyinsight.state.cluster.ClusterSetState;
import com.amazon.anomalyinsight.state.forest.IsolationForestState;
import com.amazon.anomalyinsight.state.sequence.SequencePredictorState;

/**
 * Saved form of an ensemble; a member that was not trained is null.
 */
@Data
public class EnsembleModelState {

    private String version = V1_0;

    private IsolationForestState isolationForest;

    private SequencePredictorState sequence;

    private ClusterSetState clustering;
}
