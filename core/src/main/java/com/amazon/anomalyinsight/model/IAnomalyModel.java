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

package com.amazon.anomalyinsight.model;

import java.io.IOException;
import java.nio.file.Path;

import com.amazon.anomalyinsight.config.ModelType;

/**
 * The contract shared by every anomaly model. Implementations are safe for
 * concurrent {@link #predict} calls, including while {@link #train} runs; a
 * prediction sees either the previous or the new trained state, never a mix.
 */
public interface IAnomalyModel {

    /**
     * Prepares the model for training. Must be called before {@link #train}.
     */
    void initialize();

    /**
     * Trains on the rows, replacing any earlier trained state on success. Rows
     * with non finite values are ignored.
     *
     * @param samples rows of equal length
     * @throws IllegalStateException    if the model is not initialized
     * @throws IllegalArgumentException if the rows differ in length
     */
    void train(double[][] samples);

    /**
     * @param features a row of the trained dimension
     * @return anomaly score in [0,1]; 0 while untrained
     * @throws IllegalArgumentException if the dimension differs from the trained
     *                                  one
     */
    double predict(double[] features);

    ModelMetrics getModelMetrics();

    ModelType getModelType();

    boolean isTrained();

    /**
     * @return the number of features the model was trained on, 0 if untrained
     */
    int getDimensions();

    /**
     * Writes the trained state as JSON.
     *
     * @param path destination file
     * @throws IOException           on write failure
     * @throws IllegalStateException if the model is not trained
     */
    void save(Path path) throws IOException;

    /**
     * Replaces the trained state with one written by {@link #save} of a model of
     * the same type.
     *
     * @param path source file
     * @throws IOException on read or parse failure
     */
    void load(Path path) throws IOException;
}
