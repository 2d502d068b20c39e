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
 * The closed set of model variants the factory can build.
 */
public enum ModelType {

    /**
     * random isolation trees; short isolation paths indicate outliers
     */
    ISOLATION_FOREST,
    /**
     * distance to the nearest k-means++ centroid
     */
    CLUSTERING,
    /**
     * z-score and interquartile range over the first feature
     */
    STATISTICAL,
    /**
     * a small recurrent network predicting the next value of the first feature
     */
    SEQUENCE,
    /**
     * weighted combination of ISOLATION_FOREST, SEQUENCE and CLUSTERING
     */
    ENSEMBLE;
}
