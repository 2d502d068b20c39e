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
 * A trained {@link RecurrentNetwork} together with the scaling of its input,
 * the last training window used as context for single value queries, and the
 * typical size of its prediction error.
 */
public class SequencePredictor {

    /**
     * floor of the residual deviation in scaled units
     */
    public static final double MIN_RESIDUAL_DEVIATION = 0.01;

    private final RecurrentNetwork network;

    @Getter
    private final double min;

    @Getter
    private final double range;

    private final double[] context;

    @Getter
    private final double residualDeviation;

    @Getter
    private final int dimensions;

    @Getter
    private final int trainingSize;

    public SequencePredictor(RecurrentNetwork network, double min, double range, double[] context,
            double residualDeviation, int dimensions, int trainingSize) {
        checkArgument(range > 0, "range must be positive");
        this.network = network;
        this.min = min;
        this.range = range;
        this.context = Arrays.copyOf(context, context.length);
        this.residualDeviation = Math.max(MIN_RESIDUAL_DEVIATION, residualDeviation);
        this.dimensions = dimensions;
        this.trainingSize = trainingSize;
    }

    /**
     * @param column         the series, oldest first
     * @param dimensions     width of the rows the column was taken from
     * @param hiddenUnits    size of the recurrent layer
     * @param sequenceLength length of the input windows
     * @param epochs         passes over the windows
     * @param learningRate   step size
     * @param maxWindows     only the most recent windows are used
     * @param random         weight initialization
     * @return the trained predictor
     */
    public static SequencePredictor train(double[] column, int dimensions, int hiddenUnits, int sequenceLength,
            int epochs, double learningRate, int maxWindows, Random random) {
        checkArgument(column.length > sequenceLength, "need more values than the sequence length");
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double value : column) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double range = max > min ? max - min : 1.0;
        double[] scaled = new double[column.length];
        for (int i = 0; i < column.length; i++) {
            scaled[i] = (column[i] - min) / range;
        }

        RecurrentNetwork network = new RecurrentNetwork(hiddenUnits, random);
        int first = Math.max(sequenceLength, scaled.length - maxWindows);
        for (int epoch = 0; epoch < epochs; epoch++) {
            for (int t = first; t < scaled.length; t++) {
                network.trainWindow(Arrays.copyOfRange(scaled, t - sequenceLength, t), scaled[t], learningRate);
            }
        }

        double squares = 0;
        for (int t = first; t < scaled.length; t++) {
            double error = network.predict(Arrays.copyOfRange(scaled, t - sequenceLength, t)) - scaled[t];
            squares += error * error;
        }
        double residual = Math.sqrt(squares / (scaled.length - first));
        double[] context = Arrays.copyOfRange(scaled, scaled.length - sequenceLength, scaled.length);
        return new SequencePredictor(network, min, range, context, residual, dimensions, column.length);
    }

    public double scale(double value) {
        return (value - min) / range;
    }

    /**
     * @param value the value expected to follow the training series
     * @return prediction error in residual deviations over 3, capped at 1
     */
    public double score(double value) {
        return errorScore(network.predict(context), scale(value));
    }

    /**
     * @param sequence raw values, oldest first; the last value is scored against
     *                 the window before it
     * @return the score of the last value
     */
    public double scoreSequence(double[] sequence) {
        checkArgument(sequence.length >= 2, "a sequence needs at least two values");
        int end = sequence.length - 1;
        int start = Math.max(0, end - context.length);
        double[] window = new double[end - start];
        for (int i = start; i < end; i++) {
            window[i - start] = scale(sequence[i]);
        }
        return errorScore(network.predict(window), scale(sequence[end]));
    }

    private double errorScore(double predicted, double actual) {
        return Math.min(1.0, Math.abs(actual - predicted) / residualDeviation / 3.0);
    }

    public double predictNext() {
        return min + network.predict(context) * range;
    }

    public RecurrentNetwork getNetwork() {
        return network;
    }

    public double[] getContext() {
        return Arrays.copyOf(context, context.length);
    }

    public int getSequenceLength() {
        return context.length;
    }
}
