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

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;
import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Getter;

import com.amazon.anomalyinsight.CommonUtils;
import com.amazon.anomalyinsight.config.ModelType;
import com.amazon.anomalyinsight.model.sequence.SequencePredictor;
import com.amazon.anomalyinsight.state.StateSerDe;
import com.amazon.anomalyinsight.state.sequence.SequencePredictorMapper;
import com.amazon.anomalyinsight.state.sequence.SequencePredictorState;

/**
 * Learns to predict the next value of the first feature from the preceding
 * window with a small recurrent network. A value scores high when it is far
 * from what the network expects after the end of the training series.
 * Training rows must be in time order.
 */
@Getter
public class SequenceModel extends AbstractAnomalyModel<SequencePredictor, SequencePredictorState> {

    public static final int DEFAULT_HIDDEN_UNITS = 16;

    public static final int DEFAULT_SEQUENCE_LENGTH = 10;

    public static final int DEFAULT_EPOCHS = 5;

    public static final double DEFAULT_LEARNING_RATE = 0.05;

    /**
     * training uses at most this many of the most recent windows
     */
    public static final int DEFAULT_MAX_TRAINING_WINDOWS = 1000;

    private final int hiddenUnits;

    private final int sequenceLength;

    private final int epochs;

    private final double learningRate;

    private final int maxTrainingWindows;

    public SequenceModel() {
        this(new Builder<>());
    }

    protected SequenceModel(Builder<?> builder) {
        super(builder.randomSeed);
        checkArgument(builder.hiddenUnits > 0, "hiddenUnits must be greater than 0");
        checkArgument(builder.sequenceLength > 0, "sequenceLength must be greater than 0");
        checkArgument(builder.epochs > 0, "epochs must be greater than 0");
        checkArgument(builder.learningRate > 0, "learningRate must be positive");
        checkArgument(builder.maxTrainingWindows > 0, "maxTrainingWindows must be greater than 0");
        this.hiddenUnits = builder.hiddenUnits;
        this.sequenceLength = builder.sequenceLength;
        this.epochs = builder.epochs;
        this.learningRate = builder.learningRate;
        this.maxTrainingWindows = builder.maxTrainingWindows;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    @Override
    public ModelType getModelType() {
        return ModelType.SEQUENCE;
    }

    @Override
    protected SequencePredictor fit(double[][] rows) {
        if (rows.length <= sequenceLength) {
            return null;
        }
        double[] column = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            column[i] = rows[i][0];
        }
        return SequencePredictor.train(column, rows[0].length, hiddenUnits, sequenceLength, epochs, learningRate,
                maxTrainingWindows, newRandom());
    }

    @Override
    protected double score(SequencePredictor predictor, double[] features) {
        return predictor.score(features[0]);
    }

    /**
     * Scores the last value of an explicit window instead of the training tail.
     *
     * @param sequence values of the first feature, oldest first, at least two
     * @return anomaly score in [0,1]; 0 while untrained
     */
    public double predictSequence(double[] sequence) {
        checkNotNull(sequence, "sequence must not be null");
        if (!CommonUtils.isFinite(sequence)) {
            return 0;
        }
        return getTrained().map(p -> CommonUtils.clamp(p.scoreSequence(sequence), 0, 1)).orElse(0.0);
    }

    @Override
    protected int dimensionsOf(SequencePredictor predictor) {
        return predictor.getDimensions();
    }

    @Override
    protected ModelMetrics estimateMetrics(SequencePredictor predictor, long trainedAt) {
        int n = predictor.getTrainingSize();
        // residual deviation is in units of the training range
        double fit = Math.max(0, 1 - predictor.getResidualDeviation());
        double accuracy = Math.min(0.90, 0.60 + 0.30 * fit);
        double precision = Math.min(0.85, 0.60 + 0.25 * fit);
        double recall = Math.min(0.85, 0.70 + n / 10000.0 * 0.1);
        double falsePositiveRate = Math.max(0.05, 0.15 - 0.10 * fit);
        return new ModelMetrics(accuracy, precision, recall, falsePositiveRate, trainedAt, n);
    }

    @Override
    protected StateSerDe<SequencePredictor, SequencePredictorState> getStateSerDe() {
        return new StateSerDe<>(new SequencePredictorMapper(), SequencePredictorState.class);
    }

    public static class Builder<T extends Builder<T>> {

        private int hiddenUnits = DEFAULT_HIDDEN_UNITS;
        private int sequenceLength = DEFAULT_SEQUENCE_LENGTH;
        private int epochs = DEFAULT_EPOCHS;
        private double learningRate = DEFAULT_LEARNING_RATE;
        private int maxTrainingWindows = DEFAULT_MAX_TRAINING_WINDOWS;
        private Optional<Long> randomSeed = Optional.empty();

        public T hiddenUnits(int hiddenUnits) {
            this.hiddenUnits = hiddenUnits;
            return (T) this;
        }

        public T sequenceLength(int sequenceLength) {
            this.sequenceLength = sequenceLength;
            return (T) this;
        }

        public T epochs(int epochs) {
            this.epochs = epochs;
            return (T) this;
        }

        public T learningRate(double learningRate) {
            this.learningRate = learningRate;
            return (T) this;
        }

        public T maxTrainingWindows(int maxTrainingWindows) {
            this.maxTrainingWindows = maxTrainingWindows;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public SequenceModel build() {
            return new SequenceModel(this);
        }
    }
}
