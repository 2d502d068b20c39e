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
import static com.amazon.anomalyinsight.CommonUtils.checkState;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyinsight.CommonUtils;
import com.amazon.anomalyinsight.state.StateSerDe;

/**
 * Base class that keeps the trained state of a model as an immutable snapshot.
 * Training builds a new snapshot under a lock and publishes it with a single
 * volatile write, so predictions never wait for training.
 *
 * @param <T> the immutable trained state
 * @param <S> the serializable form of {@code T}
 */
public abstract class AbstractAnomalyModel<T, S> implements IAnomalyModel {

    private static final Logger logger = LogManager.getLogger(AbstractAnomalyModel.class);

    private final Object trainingLock = new Object();

    protected final Optional<Long> randomSeed;

    private volatile boolean initialized;

    private volatile T trained;

    private volatile ModelMetrics modelMetrics = ModelMetrics.untrained();

    protected AbstractAnomalyModel(Optional<Long> randomSeed) {
        this.randomSeed = checkNotNull(randomSeed, "randomSeed must not be null");
    }

    @Override
    public void initialize() {
        initialized = true;
    }

    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public void train(double[][] samples) {
        checkState(initialized, "Model not initialized");
        checkNotNull(samples, "samples must not be null");
        double[][] rows = finiteRows(samples);
        synchronized (trainingLock) {
            if (rows.length == 0) {
                logger.warn("{} received no usable rows, keeping previous state", getModelType());
                return;
            }
            T next = fit(rows);
            if (next == null) {
                logger.info("{} needs more than {} rows to train, keeping previous state", getModelType(),
                        rows.length);
                return;
            }
            modelMetrics = estimateMetrics(next, System.currentTimeMillis());
            trained = next;
        }
        logger.debug("{} trained on {} rows", getModelType(), rows.length);
    }

    private static double[][] finiteRows(double[][] samples) {
        List<double[]> rows = new ArrayList<>(samples.length);
        int dimensions = -1;
        for (double[] row : samples) {
            if (!CommonUtils.isFinite(row)) {
                continue;
            }
            if (dimensions < 0) {
                dimensions = row.length;
            }
            checkArgument(row.length == dimensions && dimensions > 0, "rows must have the same positive length");
            rows.add(row);
        }
        return rows.toArray(new double[0][]);
    }

    @Override
    public double predict(double[] features) {
        checkNotNull(features, "features must not be null");
        T snapshot = trained;
        if (snapshot == null) {
            return 0;
        }
        int dimensions = dimensionsOf(snapshot);
        if (features.length != dimensions) {
            throw new IllegalArgumentException(
                    String.format("expected %d features but received %d", dimensions, features.length));
        }
        return CommonUtils.clamp(score(snapshot, features), 0, 1);
    }

    @Override
    public ModelMetrics getModelMetrics() {
        return modelMetrics;
    }

    @Override
    public boolean isTrained() {
        return trained != null;
    }

    @Override
    public int getDimensions() {
        T snapshot = trained;
        return snapshot == null ? 0 : dimensionsOf(snapshot);
    }

    @Override
    public void save(Path path) throws IOException {
        T snapshot = trained;
        checkState(snapshot != null, "Model not trained");
        getStateSerDe().write(snapshot, path);
        logger.info("Saved {} to {}", getModelType(), path);
    }

    @Override
    public void load(Path path) throws IOException {
        install(getStateSerDe().read(path));
        logger.info("Loaded {} from {}", getModelType(), path);
    }

    /**
     * @return the serialized form of the current trained state
     * @throws IllegalStateException if the model is not trained
     */
    public S toState() {
        T snapshot = trained;
        checkState(snapshot != null, "Model not trained");
        return getStateSerDe().getMapper().toState(snapshot);
    }

    public void fromState(S state) {
        install(getStateSerDe().getMapper().toModel(state));
    }

    private void install(T snapshot) {
        checkNotNull(snapshot, "state must not be null");
        synchronized (trainingLock) {
            modelMetrics = estimateMetrics(snapshot, System.currentTimeMillis());
            trained = snapshot;
            initialized = true;
        }
    }

    /**
     * @return the current trained state, empty while untrained
     */
    protected Optional<T> getTrained() {
        return Optional.ofNullable(trained);
    }

    protected Random newRandom() {
        return randomSeed.map(Random::new).orElseGet(Random::new);
    }

    /**
     * @param rows finite rows of equal length, at least one
     * @return the trained state, or null when the rows are not enough to train
     */
    protected abstract T fit(double[][] rows);

    protected abstract double score(T snapshot, double[] features);

    protected abstract int dimensionsOf(T snapshot);

    protected abstract ModelMetrics estimateMetrics(T snapshot, long trainedAt);

    protected abstract StateSerDe<T, S> getStateSerDe();
}
