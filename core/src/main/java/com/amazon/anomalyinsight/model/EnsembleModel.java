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

import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyinsight.CommonUtils;
import com.amazon.anomalyinsight.config.ModelType;
import com.amazon.anomalyinsight.exception.ModelTrainingException;
import com.amazon.anomalyinsight.state.EnsembleModelState;
import com.amazon.anomalyinsight.state.StateSerDe;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Weighted combination of an isolation forest, a sequence model and a
 * clustering model. Weights are renormalized over the members that are
 * trained, so a member that could not train does not drag the score down.
 */
public class EnsembleModel implements IAnomalyModel {

    private static final Logger logger = LogManager.getLogger(EnsembleModel.class);

    public static final double ISOLATION_FOREST_WEIGHT = 0.4;

    public static final double SEQUENCE_WEIGHT = 0.4;

    public static final double CLUSTERING_WEIGHT = 0.2;

    private final IsolationForestModel isolationForest;

    private final SequenceModel sequence;

    private final ClusteringModel clustering;

    private final ObjectMapper objectMapper = StateSerDe.defaultObjectMapper();

    public EnsembleModel(IsolationForestModel isolationForest, SequenceModel sequence, ClusteringModel clustering) {
        this.isolationForest = checkNotNull(isolationForest, "isolationForest must not be null");
        this.sequence = checkNotNull(sequence, "sequence must not be null");
        this.clustering = checkNotNull(clustering, "clustering must not be null");
    }

    @Override
    public void initialize() {
        isolationForest.initialize();
        sequence.initialize();
        clustering.initialize();
    }

    /**
     * Trains every member. Members that fail keep their previous state and are
     * reported together once all members were attempted.
     */
    @Override
    public void train(double[][] samples) {
        List<String> failed = new ArrayList<>();
        RuntimeException first = null;
        for (IAnomalyModel member : members()) {
            try {
                member.train(samples);
            } catch (IllegalStateException | IllegalArgumentException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.error("Ensemble member {} failed to train", member.getModelType(), e);
                failed.add(member.getModelType().name());
                if (first == null) {
                    first = e;
                }
            }
        }
        if (!failed.isEmpty()) {
            throw new ModelTrainingException(failed, "Ensemble members failed to train: " + failed, first);
        }
    }

    @Override
    public double predict(double[] features) {
        double weighted = 0;
        double weights = 0;
        double[] memberWeights = { ISOLATION_FOREST_WEIGHT, SEQUENCE_WEIGHT, CLUSTERING_WEIGHT };
        List<IAnomalyModel> members = members();
        for (int i = 0; i < members.size(); i++) {
            IAnomalyModel member = members.get(i);
            if (member.isTrained()) {
                weighted += memberWeights[i] * member.predict(features);
                weights += memberWeights[i];
            }
        }
        return weights == 0 ? 0 : CommonUtils.clamp(weighted / weights, 0, 1);
    }

    @Override
    public ModelMetrics getModelMetrics() {
        List<ModelMetrics> metrics = new ArrayList<>();
        for (IAnomalyModel member : members()) {
            if (member.isTrained()) {
                metrics.add(member.getModelMetrics());
            }
        }
        return ModelMetrics.average(metrics);
    }

    @Override
    public ModelType getModelType() {
        return ModelType.ENSEMBLE;
    }

    @Override
    public boolean isTrained() {
        return isolationForest.isTrained() || sequence.isTrained() || clustering.isTrained();
    }

    @Override
    public int getDimensions() {
        for (IAnomalyModel member : members()) {
            if (member.isTrained()) {
                return member.getDimensions();
            }
        }
        return 0;
    }

    @Override
    public void save(Path path) throws IOException {
        CommonUtils.checkState(isTrained(), "Model not trained");
        EnsembleModelState state = new EnsembleModelState();
        if (isolationForest.isTrained()) {
            state.setIsolationForest(isolationForest.toState());
        }
        if (sequence.isTrained()) {
            state.setSequence(sequence.toState());
        }
        if (clustering.isTrained()) {
            state.setClustering(clustering.toState());
        }
        Files.write(path, objectMapper.writeValueAsBytes(state));
        logger.info("Saved ensemble to {}", path);
    }

    @Override
    public void load(Path path) throws IOException {
        EnsembleModelState state = objectMapper.readValue(Files.readAllBytes(path), EnsembleModelState.class);
        if (state.getIsolationForest() != null) {
            isolationForest.fromState(state.getIsolationForest());
        }
        if (state.getSequence() != null) {
            sequence.fromState(state.getSequence());
        }
        if (state.getClustering() != null) {
            clustering.fromState(state.getClustering());
        }
        logger.info("Loaded ensemble from {}", path);
    }

    public IsolationForestModel getIsolationForest() {
        return isolationForest;
    }

    public SequenceModel getSequence() {
        return sequence;
    }

    public ClusteringModel getClustering() {
        return clustering;
    }

    private List<IAnomalyModel> members() {
        List<IAnomalyModel> members = new ArrayList<>(3);
        members.add(isolationForest);
        members.add(sequence);
        members.add(clustering);
        return members;
    }
}
