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

import static com.amazon.anomalyinsight.state.Version.V1_0;

import java.util.List;

import lombok.Data;

@Data
public class IsolationForestState {

    private String version = V1_0;

    private int sampleSize;

    private int dimensions;

    private int trainingSize;

    private List<IsolationTreeState> trees;
}
