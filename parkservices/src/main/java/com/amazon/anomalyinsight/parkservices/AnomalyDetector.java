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

package com.amazon.anomalyinsight.parkservices;

import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;
import static com.amazon.anomalyinsight.CommonUtils.checkState;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyinsight.CommonUtils;
import com.amazon.anomalyinsight.baseline.BaselineData;
import com.amazon.anomalyinsight.baseline.BaselineManager;
import com.amazon.anomalyinsight.config.ModelConfig;
import com.amazon.anomalyinsight.config.Severity;
import com.amazon.anomalyinsight.data.MonitoringData;
import com.amazon.anomalyinsight.exception.ModelTrainingException;
import com.amazon.anomalyinsight.model.IAnomalyModel;
import com.amazon.anomalyinsight.model.ModelFactory;
import com.amazon.anomalyinsight.model.ModelMetrics;
import com.amazon.anomalyinsight.parkservices.config.DetectorConfig;
import com.amazon.anomalyinsight.parkservices.executor.AbstractBatchExecutor;
import com.amazon.anomalyinsight.parkservices.executor.ParallelBatchExecutor;
import com.amazon.anomalyinsight.parkservices.executor.ProcessingQueue;
import com.amazon.anomalyinsight.parkservices.executor.SequentialBatchExecutor;
import com.amazon.anomalyinsight.parkservices.explanation.AnomalyExplainer;
import com.amazon.anomalyinsight.parkservices.explanation.AnomalyExplanation;
import com.amazon.anomalyinsight.parkservices.returntypes.Anomaly;
import com.amazon.anomalyinsight.parkservices.returntypes.AnomalyScore;
import com.amazon.anomalyinsight.parkservices.returntypes.PerformanceMetrics;
import com.amazon.anomalyinsight.parkservices.statistics.PerformanceTracker;
import com.amazon.anomalyinsight.parkservices.threshold.Feedback;
import com.amazon.anomalyinsight.parkservices.threshold.ThresholdAdjustment;
import com.amazon.anomalyinsight.parkservices.threshold.ThresholdAutoTuner;

/**
 * Detects anomalies in monitoring data by combining the scores of the
 * configured models with the baseline of each series, and explains what it
 * flags.
 *
 * <p>
 * A detector must be initialized before use. Detection is thread safe and may
 * run concurrently with training; a model being retrained keeps scoring with
 * its previous state until the new one is ready. Points can be scored
 * synchronously with {@link #detect}, in ordered batches with
 * {@link #detectBatch}, or asynchronously through the bounded queue behind
 * {@link #submit}.
 *
 * <p>
 * The final score is the mean model score scaled to [0,100], raised when the
 * value is more than three standard deviations from the series baseline. An
 * {@link Anomaly} is reported when both the score and the confidence reach the
 * current thresholds, which feedback on reported anomalies may raise over time.
 */
public class AnomalyDetector {

    private static final Logger logger = LogManager.getLogger(AnomalyDetector.class);

    public static final double AMPLIFICATION_Z_SCORE = 3.0;

    public static final double AMPLIFICATION_FACTOR = 0.1;

    public static final String NOT_INITIALIZED = "Detector not initialized. Call initialize() first.";

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private static final int ID_SUFFIX_LENGTH = 9;

    private final DetectorConfig config;

    private final Clock clock;

    private final Function<ModelConfig, IAnomalyModel> modelFactory;

    private final BaselineManager baselineManager;

    private final AnomalyExplainer explainer;

    private final ThresholdAutoTuner autoTuner;

    private final PerformanceTracker performanceTracker = new PerformanceTracker();

    private final List<IDetectorListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();

    private final Object trainingLock = new Object();

    private final AtomicInteger activeDetections = new AtomicInteger();

    // detection and training hold the read lock, releasing resources needs the write lock
    private final ReentrantReadWriteLock workLock = new ReentrantReadWriteLock();

    private volatile DetectorState lifecycle = DetectorState.UNINITIALIZED;

    private volatile boolean training;

    private volatile Map<String, IAnomalyModel> models = Collections.emptyMap();

    private ProcessingQueue<MonitoringData, Optional<Anomaly>> processingQueue;

    private ScheduledExecutorService maintenance;

    private AbstractBatchExecutor batchExecutor;

    public AnomalyDetector(DetectorConfig config) {
        this(builder().config(config));
    }

    protected AnomalyDetector(Builder<?> builder) {
        checkNotNull(builder.config, "config must not be null");
        builder.config.validate();
        this.config = builder.config;
        this.clock = checkNotNull(builder.clock, "clock must not be null");
        this.modelFactory = checkNotNull(builder.modelFactory, "modelFactory must not be null");
        DetectorConfig.Baseline baseline = config.getBaseline();
        this.baselineManager = BaselineManager.builder().minDataPoints(baseline.getMinDataPoints())
                .maxHistorySize(baseline.getMaxHistorySize()).retention(Duration.ofDays(baseline.getRetentionDays()))
                .zoneId(baseline.toZoneId()).clock(clock).build();
        this.explainer = new AnomalyExplainer(baseline.toZoneId());
        this.autoTuner = new ThresholdAutoTuner(config.getAutoTuning(), config.getThresholds(), clock);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Creates and initializes the models and the baseline manager, then starts
     * the processing queue and the periodic baseline cleanup.
     *
     * @throws IllegalStateException if the detector was already initialized
     */
    public void initialize() {
        synchronized (lifecycleLock) {
            checkState(lifecycle == DetectorState.UNINITIALIZED, "Detector already initialized");
            Map<String, IAnomalyModel> created = new LinkedHashMap<>();
            List<ModelConfig> modelConfigs = config.getModels();
            for (int i = 0; i < modelConfigs.size(); i++) {
                ModelConfig modelConfig = modelConfigs.get(i);
                IAnomalyModel model = checkNotNull(modelFactory.apply(modelConfig), "model factory returned null");
                model.initialize();
                created.put(model.getModelType().name().toLowerCase(Locale.ROOT) + "_" + i, model);
            }
            models = Collections.unmodifiableMap(created);
            baselineManager.initialize();

            DetectorConfig.Performance performance = config.getPerformance();
            batchExecutor = performance.isParallelProcessing()
                    ? new ParallelBatchExecutor(performance.getThreadPoolSize())
                    : new SequentialBatchExecutor();
            processingQueue = new ProcessingQueue<>(performance.getQueueCapacity(), performance.getBatchSize(),
                    this::detectItem);
            processingQueue.start();

            long cleanupMinutes = config.getBaseline().getCleanupIntervalMinutes();
            maintenance = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "anomaly-baseline-cleanup");
                thread.setDaemon(true);
                return thread;
            });
            maintenance.scheduleWithFixedDelay(this::cleanupBaselines, cleanupMinutes, cleanupMinutes,
                    TimeUnit.MINUTES);
            lifecycle = DetectorState.READY;
            logger.info("Anomaly detector initialized with models {}", models.keySet());
        }
    }

    /**
     * @param data a point to score
     * @return the anomaly, or empty when the point is invalid or below the
     *         thresholds
     * @throws IllegalStateException if the detector is not ready
     */
    public Optional<Anomaly> detect(MonitoringData data) {
        workLock.readLock().lock();
        try {
            checkState(lifecycle == DetectorState.READY, NOT_INITIALIZED);
            checkNotNull(data, "data must not be null");
            return detectItem(data);
        } finally {
            workLock.readLock().unlock();
        }
    }

    /**
     * Scores the points in chunks of {@code performance.batchSize}.
     *
     * @param points points to score
     * @return one result per point, in input order
     */
    public List<Optional<Anomaly>> detectBatch(List<? extends MonitoringData> points) {
        workLock.readLock().lock();
        try {
            checkState(lifecycle == DetectorState.READY, NOT_INITIALIZED);
            checkNotNull(points, "points must not be null");
            long start = System.nanoTime();
            int batchSize = config.getPerformance().getBatchSize();
            List<Optional<Anomaly>> results = new ArrayList<>(points.size());
            for (int from = 0; from < points.size(); from += batchSize) {
                int to = Math.min(points.size(), from + batchSize);
                List<MonitoringData> chunk = new ArrayList<>(points.subList(from, to));
                results.addAll(batchExecutor.execute(chunk, this::detectItem));
            }
            performanceTracker.recordThroughput(points.size(), System.nanoTime() - start);
            return results;
        } finally {
            workLock.readLock().unlock();
        }
    }

    /**
     * Queues a point for asynchronous detection.
     *
     * @param data a point to score
     * @return a future completed once the point was scored
     * @throws java.util.concurrent.RejectedExecutionException if the queue is full
     */
    public CompletableFuture<Optional<Anomaly>> submit(MonitoringData data) {
        checkState(lifecycle == DetectorState.READY, NOT_INITIALIZED);
        checkNotNull(data, "data must not be null");
        return processingQueue.submit(data);
    }

    Optional<Anomaly> detectItem(MonitoringData data) {
        if (data == null || !data.hasValidPrimaryValue()) {
            return Optional.empty();
        }
        double[] features = data.getFeatures();
        if (!CommonUtils.isFinite(features)) {
            logger.debug("Skipping point from {} with non finite features", data.getSource());
            return Optional.empty();
        }
        activeDetections.incrementAndGet();
        long start = System.nanoTime();
        try {
            Optional<BaselineData> baseline = baselineManager.getBaseline(data);
            Map<String, Double> modelScores = scoreModels(features);
            AnomalyScore score = fuse(data, modelScores, baseline.orElse(null));
            DetectorConfig.Thresholds thresholds = autoTuner.getThresholds();
            if (score.getScore() < thresholds.getAnomalyScore()
                    || score.getConfidence() < thresholds.getConfidence()) {
                return Optional.empty();
            }
            AnomalyExplanation explanation = explainer.explain(data, score, baseline.orElse(null), modelScores);
            Anomaly anomaly = new Anomaly(newAnomalyId(), data.getDataType(), score, data, explanation,
                    baseline.orElse(null));
            performanceTracker.recordAnomaly();
            logger.debug("Anomaly {} from {} with score {}", anomaly.getId(), data.getSource(), score.getScore());
            notifyListeners(listener -> listener.onAnomaly(anomaly));
            return Optional.of(anomaly);
        } finally {
            long elapsed = System.nanoTime() - start;
            performanceTracker.recordProcessing(elapsed);
            if (TimeUnit.NANOSECONDS.toMillis(elapsed) > config.getPerformance().getMaxLatency()) {
                logger.debug("Detection for {} took {} ms", data.getSource(),
                        TimeUnit.NANOSECONDS.toMillis(elapsed));
            }
            activeDetections.decrementAndGet();
        }
    }

    private Map<String, Double> scoreModels(double[] features) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Map.Entry<String, IAnomalyModel> entry : models.entrySet()) {
            double score;
            try {
                score = entry.getValue().predict(features);
            } catch (RuntimeException e) {
                logger.warn("Model {} failed to score, using 0", entry.getKey(), e);
                score = 0;
            }
            scores.put(entry.getKey(), score);
        }
        return scores;
    }

    AnomalyScore fuse(MonitoringData data, Map<String, Double> modelScores, BaselineData baseline) {
        double[] scores = new double[modelScores.size()];
        int i = 0;
        for (double value : modelScores.values()) {
            scores[i++] = value;
        }
        double ensemble = scores.length == 0 ? 0 : CommonUtils.mean(scores);
        double variance = scores.length == 0 ? 0 : CommonUtils.variance(scores);
        double confidence = Math.max(0, 1 - Math.sqrt(variance) / 100);

        double adjusted = ensemble;
        if (baseline != null) {
            double z = baseline.zScore(data.getPrimaryValue());
            if (z > AMPLIFICATION_Z_SCORE) {
                adjusted = Math.min(1, ensemble * (1 + z * AMPLIFICATION_FACTOR));
            }
        }
        double finalScore = CommonUtils.clamp(adjusted * 100, 0, 100);
        return new AnomalyScore(finalScore, confidence, Severity.fromScore(finalScore), data.getTimestamp());
    }

    /**
     * Trains every model on the valid points and then adds the points to the
     * baselines. Points whose feature length differs from the most common one are
     * ignored.
     *
     * @param points historical observations
     * @throws ModelTrainingException after all models were attempted, if any
     *                                failed; baselines are updated regardless
     */
    public void train(List<? extends MonitoringData> points) {
        workLock.readLock().lock();
        try {
            trainModels(points);
        } finally {
            workLock.readLock().unlock();
        }
    }

    private void trainModels(List<? extends MonitoringData> points) {
        checkState(lifecycle == DetectorState.READY, NOT_INITIALIZED);
        checkNotNull(points, "points must not be null");
        double[][] samples = extractSamples(points);
        if (samples.length == 0) {
            logger.warn("No valid points among {} training points", points.size());
            return;
        }

        List<String> failed = new ArrayList<>();
        RuntimeException firstFailure = null;
        synchronized (trainingLock) {
            training = true;
            try {
                logger.info("Training {} models on {} points", models.size(), samples.length);
                for (Map.Entry<String, IAnomalyModel> entry : models.entrySet()) {
                    try {
                        entry.getValue().train(samples);
                    } catch (RuntimeException e) {
                        logger.error("Training failed for model {}", entry.getKey(), e);
                        failed.add(entry.getKey());
                        if (firstFailure == null) {
                            firstFailure = e;
                        }
                    }
                }
                baselineManager.updateBaselines(points);
            } finally {
                training = false;
            }
        }
        if (!failed.isEmpty()) {
            throw new ModelTrainingException(failed, "Training failed for models " + failed, firstFailure);
        }
        int sampleCount = samples.length;
        notifyListeners(listener -> listener.onModelsTrained(sampleCount));
    }

    static double[][] extractSamples(List<? extends MonitoringData> points) {
        List<double[]> rows = new ArrayList<>(points.size());
        Map<Integer, Integer> lengths = new HashMap<>();
        for (MonitoringData data : points) {
            if (data == null || !data.hasValidPrimaryValue()) {
                continue;
            }
            double[] features = data.getFeatures();
            if (!CommonUtils.isFinite(features)) {
                continue;
            }
            rows.add(features);
            lengths.merge(features.length, 1, Integer::sum);
        }
        int dominant = 0;
        int count = -1;
        for (Map.Entry<Integer, Integer> entry : lengths.entrySet()) {
            if (entry.getValue() > count) {
                dominant = entry.getKey();
                count = entry.getValue();
            }
        }
        int dimension = dominant;
        return rows.stream().filter(row -> row.length == dimension).toArray(double[][]::new);
    }

    /**
     * Records whether a reported anomaly was real and, if the false positive rate
     * is too high, raises the thresholds.
     *
     * @param feedback the label
     * @return the adjustment made, if any; failures are logged and yield empty
     */
    public Optional<ThresholdAdjustment> provideFeedback(Feedback feedback) {
        checkNotNull(feedback, "feedback must not be null");
        Optional<ThresholdAdjustment> adjustment;
        try {
            adjustment = autoTuner.addFeedback(feedback);
        } catch (RuntimeException e) {
            logger.error("Failed to process feedback for anomaly {}", feedback.getAnomalyId(), e);
            return Optional.empty();
        }
        adjustment.ifPresent(a -> {
            performanceTracker.recordFalsePositiveRate(a.getFalsePositiveRate());
            notifyListeners(listener -> listener.onThresholdsAdjusted(a));
        });
        return adjustment;
    }

    private void notifyListeners(Consumer<IDetectorListener> event) {
        for (IDetectorListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed", listener, e);
            }
        }
    }

    private void cleanupBaselines() {
        try {
            int removed = baselineManager.cleanup();
            if (removed > 0) {
                logger.info("Removed {} expired baseline series", removed);
            }
        } catch (RuntimeException e) {
            logger.error("Baseline cleanup failed", e);
        }
    }

    private String newAnomalyId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder id = new StringBuilder("anomaly_").append(clock.millis()).append('_');
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            id.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return id.toString();
    }

    public void addListener(IDetectorListener listener) {
        listeners.add(checkNotNull(listener, "listener must not be null"));
    }

    public void removeListener(IDetectorListener listener) {
        listeners.remove(listener);
    }

    /**
     * @return a copy of the thresholds currently applied
     */
    public DetectorConfig.Thresholds getThresholds() {
        return autoTuner.getThresholds();
    }

    public PerformanceMetrics getPerformanceMetrics() {
        performanceTracker.recordFalsePositiveRate(autoTuner.getFalsePositiveRate());
        return performanceTracker.snapshot();
    }

    /**
     * @return metrics of each model by id, in configuration order
     */
    public Map<String, ModelMetrics> getModelMetrics() {
        Map<String, ModelMetrics> metrics = new LinkedHashMap<>();
        models.forEach((id, model) -> metrics.put(id, model.getModelMetrics()));
        return metrics;
    }

    public DetectorState getState() {
        DetectorState state = lifecycle;
        if (state != DetectorState.READY) {
            return state;
        }
        if (training) {
            return DetectorState.TRAINING;
        }
        return activeDetections.get() > 0 ? DetectorState.DETECTING : DetectorState.READY;
    }

    public BaselineManager getBaselineManager() {
        return baselineManager;
    }

    public DetectorConfig getConfig() {
        return config;
    }

    /**
     * Stops accepting work, processes everything already queued, waits for
     * running detections and training to finish and then releases the models and
     * baselines. Calling it again has no effect.
     *
     * @throws IllegalStateException if called from within a detection, for
     *                               instance by a listener
     */
    public void shutdown() {
        checkState(workLock.getReadHoldCount() == 0, "shutdown cannot be called while detecting or training");
        synchronized (lifecycleLock) {
            if (lifecycle == DetectorState.STOPPED || lifecycle == DetectorState.SHUTTING_DOWN) {
                return;
            }
            if (lifecycle == DetectorState.UNINITIALIZED) {
                lifecycle = DetectorState.STOPPED;
                return;
            }
            lifecycle = DetectorState.SHUTTING_DOWN;
            logger.info("Shutting down anomaly detector");
            processingQueue.shutdown();
            maintenance.shutdownNow();
            workLock.writeLock().lock();
            try {
                batchExecutor.shutdown();
                baselineManager.shutdown();
                models = Collections.emptyMap();
                lifecycle = DetectorState.STOPPED;
            } finally {
                workLock.writeLock().unlock();
            }
            logger.info("Anomaly detector stopped");
        }
    }

    public static class Builder<T extends Builder<T>> {

        private DetectorConfig config = DetectorConfig.defaultConfig();

        private Clock clock = Clock.systemUTC();

        private Function<ModelConfig, IAnomalyModel> modelFactory = ModelFactory::createModel;

        public T config(DetectorConfig config) {
            this.config = config;
            return (T) this;
        }

        public T clock(Clock clock) {
            this.clock = clock;
            return (T) this;
        }

        /**
         * @param modelFactory creates the model for each configured entry
         */
        public T modelFactory(Function<ModelConfig, IAnomalyModel> modelFactory) {
            this.modelFactory = modelFactory;
            return (T) this;
        }

        public AnomalyDetector build() {
            return new AnomalyDetector(this);
        }
    }
}
