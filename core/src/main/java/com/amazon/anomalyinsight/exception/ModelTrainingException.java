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

package com.amazon.anomalyinsight.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when one or more models fail to train. The models that failed keep
 * their previously trained state.
 */
public class ModelTrainingException extends AnomalyDetectionException {

    private final List<String> failedModels;

    public ModelTrainingException(String modelId, String message, Throwable cause) {
        super(modelId, message, cause);
        this.failedModels = Collections.singletonList(modelId);
    }

    public ModelTrainingException(List<String> failedModels, String message, Throwable cause) {
        super(null, message, cause);
        this.failedModels = Collections.unmodifiableList(new ArrayList<>(failedModels));
    }

    public List<String> getFailedModels() {
        return failedModels;
    }
}
