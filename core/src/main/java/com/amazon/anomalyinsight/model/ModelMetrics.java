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

import java.util.List;

import lombok.Getter;

/**
 * Quality estimates a model reports about itself after training. These are
 * heuristics that grow with the amount of training data, not measured values.
 */
@Getter
public class ModelMetrics {

    private final double accuracy;

    private final double precision;

    private final double recall;

    private final double f1Score;

    private final double falsePositiveRate;

    /**
     * epoch milliseconds, 0 if never trained
     */
    private final long lastTrained;

    private final int trainingDataSize;

    public ModelMetrics(double accuracy, double precision, double recall, double falsePositiveRate,
            long lastTrained, int trainingDataSize) {
        this.accuracy = accuracy;
        this.precision = precision;
        this.recall = recall;
        this.f1Score = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0;
        this.falsePositiveRate = falsePositiveRate;
        this.lastTrained = lastTrained;
        this.trainingDataSize = trainingDataSize;
    }

    public static ModelMetrics untrained() {
        return new ModelMetrics(0, 0, 0, 0, 0, 0);
    }

    /**
     * @param metrics metrics of several models
     * @return the component wise average, with the latest training time and the
     *         largest training size
     */
    public static ModelMetrics average(List<ModelMetrics> metrics) {
        if (metrics.isEmpty()) {
            return untrained();
        }
        double accuracy = 0;
        double precision = 0;
        double recall = 0;
        double falsePositiveRate = 0;
        long lastTrained = 0;
        int size = 0;
        for (ModelMetrics m : metrics) {
            accuracy += m.accuracy;
            precision += m.precision;
            recall += m.recall;
            falsePositiveRate += m.falsePositiveRate;
            lastTrained = Math.max(lastTrained, m.lastTrained);
            size = Math.max(size, m.trainingDataSize);
        }
        int n = metrics.size();
        return new ModelMetrics(accuracy / n, precision / n, recall / n, falsePositiveRate / n, lastTrained, size);
    }
}
