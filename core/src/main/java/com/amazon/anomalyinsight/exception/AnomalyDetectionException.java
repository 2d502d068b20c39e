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

/**
 * Base exception for failures inside the anomaly detection engine.
 */
public class AnomalyDetectionException extends RuntimeException {

    private final String modelId;

    public AnomalyDetectionException(String message) {
        super(message);
        this.modelId = null;
    }

    public AnomalyDetectionException(String modelId, String message) {
        super(message);
        this.modelId = modelId;
    }

    public AnomalyDetectionException(String modelId, String message, Throwable cause) {
        super(message, cause);
        this.modelId = modelId;
    }

    /**
     * @return id of the model the failure is attributed to, null if none
     */
    public String getModelId() {
        return modelId;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (modelId != null) {
            sb.append("Model ").append(modelId).append(": ");
        }
        sb.append(getMessage());
        return sb.toString();
    }
}
