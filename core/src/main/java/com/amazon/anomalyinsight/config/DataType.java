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

package com.amazon.anomalyinsight.config;

/**
 * The kinds of monitoring data the engine understands.
 */
public enum DataType {

    METRIC("metric"),

    LOG("log"),

    TRACE("trace"),

    ERROR("error"),

    /**
     * user interaction events, such as clicks and page views
     */
    BEHAVIOR("behavior");

    private final String label;

    DataType(String label) {
        this.label = label;
    }

    /**
     * @return the lower case name used in baseline keys and messages
     */
    public String getLabel() {
        return label;
    }
}
