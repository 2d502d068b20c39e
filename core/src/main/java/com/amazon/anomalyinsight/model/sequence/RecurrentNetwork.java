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

package com.amazon.anomalyinsight.model.sequence;

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;

import java.util.Arrays;
import java.util.Random;

import lombok.Getter;

/**
 * A single layer Elman network that reads a window of scaled values and
 * predicts the next one. Weights are mutable only while training; once
 * {@link SequencePredictor#train} returns it is read only.
 */
public class RecurrentNetwork {

    /**
     * gradients are clipped to this L2 norm per window
     */
    public static final double GRADIENT_CLIP = 1.0;

    @Getter
    private final int hiddenUnits;

    // input to hidden, hidden to hidden, hidden bias, hidden to output, output bias
    final double[] inputWeights;
    final double[][] recurrentWeights;
    final double[] hiddenBias;
    final double[] outputWeights;
    double outputBias;

    public RecurrentNetwork(int hiddenUnits, Random random) {
        checkArgument(hiddenUnits > 0, "hiddenUnits must be greater than 0");
        this.hiddenUnits = hiddenUnits;
        double scale = 1.0 / Math.sqrt(hiddenUnits);
        inputWeights = new double[hiddenUnits];
        recurrentWeights = new double[hiddenUnits][hiddenUnits];
        hiddenBias = new double[hiddenUnits];
        outputWeights = new double[hiddenUnits];
        for (int i = 0; i < hiddenUnits; i++) {
            inputWeights[i] = (2 * random.nextDouble() - 1) * scale;
            outputWeights[i] = (2 * random.nextDouble() - 1) * scale;
            for (int j = 0; j < hiddenUnits; j++) {
                recurrentWeights[i][j] = (2 * random.nextDouble() - 1) * scale;
            }
        }
    }

    public RecurrentNetwork(double[] inputWeights, double[][] recurrentWeights, double[] hiddenBias,
            double[] outputWeights, double outputBias) {
        int hidden = inputWeights.length;
        checkArgument(recurrentWeights.length == hidden && hiddenBias.length == hidden
                && outputWeights.length == hidden, "incorrect lengths");
        this.hiddenUnits = hidden;
        this.inputWeights = Arrays.copyOf(inputWeights, hidden);
        this.recurrentWeights = new double[hidden][];
        for (int i = 0; i < hidden; i++) {
            checkArgument(recurrentWeights[i].length == hidden, "incorrect lengths");
            this.recurrentWeights[i] = Arrays.copyOf(recurrentWeights[i], hidden);
        }
        this.hiddenBias = Arrays.copyOf(hiddenBias, hidden);
        this.outputWeights = Arrays.copyOf(outputWeights, hidden);
        this.outputBias = outputBias;
    }

    /**
     * @param window scaled inputs, oldest first
     * @return the predicted next scaled value
     */
    public double predict(double[] window) {
        double[] hidden = new double[hiddenUnits];
        for (double x : window) {
            hidden = step(hidden, x);
        }
        return output(hidden);
    }

    double[] step(double[] previous, double x) {
        double[] next = new double[hiddenUnits];
        for (int i = 0; i < hiddenUnits; i++) {
            double z = inputWeights[i] * x + hiddenBias[i];
            for (int j = 0; j < hiddenUnits; j++) {
                z += recurrentWeights[i][j] * previous[j];
            }
            next[i] = Math.tanh(z);
        }
        return next;
    }

    double output(double[] hidden) {
        double y = outputBias;
        for (int i = 0; i < hiddenUnits; i++) {
            y += outputWeights[i] * hidden[i];
        }
        return y;
    }

    /**
     * One step of stochastic gradient descent with back propagation through time
     * over a single window.
     *
     * @param window       scaled inputs, oldest first
     * @param target       the scaled value following the window
     * @param learningRate step size
     * @return the squared error before the update
     */
    double trainWindow(double[] window, double target, double learningRate) {
        int steps = window.length;
        double[][] hidden = new double[steps + 1][];
        hidden[0] = new double[hiddenUnits];
        for (int t = 0; t < steps; t++) {
            hidden[t + 1] = step(hidden[t], window[t]);
        }
        double error = output(hidden[steps]) - target;

        double[] gradInput = new double[hiddenUnits];
        double[][] gradRecurrent = new double[hiddenUnits][hiddenUnits];
        double[] gradBias = new double[hiddenUnits];
        double[] gradOutput = new double[hiddenUnits];
        double gradOutputBias = error;
        double[] dh = new double[hiddenUnits];
        for (int i = 0; i < hiddenUnits; i++) {
            gradOutput[i] = error * hidden[steps][i];
            dh[i] = error * outputWeights[i];
        }
        for (int t = steps; t >= 1; t--) {
            double[] dz = new double[hiddenUnits];
            for (int i = 0; i < hiddenUnits; i++) {
                dz[i] = dh[i] * (1 - hidden[t][i] * hidden[t][i]);
                gradInput[i] += dz[i] * window[t - 1];
                gradBias[i] += dz[i];
                for (int j = 0; j < hiddenUnits; j++) {
                    gradRecurrent[i][j] += dz[i] * hidden[t - 1][j];
                }
            }
            double[] previous = new double[hiddenUnits];
            for (int j = 0; j < hiddenUnits; j++) {
                for (int i = 0; i < hiddenUnits; i++) {
                    previous[j] += recurrentWeights[i][j] * dz[i];
                }
            }
            dh = previous;
        }

        double norm = gradOutputBias * gradOutputBias;
        for (int i = 0; i < hiddenUnits; i++) {
            norm += gradInput[i] * gradInput[i] + gradBias[i] * gradBias[i] + gradOutput[i] * gradOutput[i];
            for (int j = 0; j < hiddenUnits; j++) {
                norm += gradRecurrent[i][j] * gradRecurrent[i][j];
            }
        }
        norm = Math.sqrt(norm);
        double factor = learningRate * (norm > GRADIENT_CLIP ? GRADIENT_CLIP / norm : 1.0);

        outputBias -= factor * gradOutputBias;
        for (int i = 0; i < hiddenUnits; i++) {
            inputWeights[i] -= factor * gradInput[i];
            hiddenBias[i] -= factor * gradBias[i];
            outputWeights[i] -= factor * gradOutput[i];
            for (int j = 0; j < hiddenUnits; j++) {
                recurrentWeights[i][j] -= factor * gradRecurrent[i][j];
            }
        }
        return error * error;
    }

    public double[] getInputWeights() {
        return Arrays.copyOf(inputWeights, hiddenUnits);
    }

    public double[][] getRecurrentWeights() {
        double[][] copy = new double[hiddenUnits][];
        for (int i = 0; i < hiddenUnits; i++) {
            copy[i] = Arrays.copyOf(recurrentWeights[i], hiddenUnits);
        }
        return copy;
    }

    public double[] getHiddenBias() {
        return Arrays.copyOf(hiddenBias, hiddenUnits);
    }

    public double[] getOutputWeights() {
        return Arrays.copyOf(outputWeights, hiddenUnits);
    }

    public double getOutputBias() {
        return outputBias;
    }
}
