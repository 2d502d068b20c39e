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

package com.amazon.anomalyinsight.parkservices.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.function.Consumer;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.anomalyinsight.config.ModelConfig;
import com.amazon.anomalyinsight.config.ModelType;

public class DetectorConfigTest {

    private final DetectorConfigReader reader = new DetectorConfigReader();

    @Test
    public void testDefaultConfig() {
        DetectorConfig config = DetectorConfig.defaultConfig();
        config.validate();

        assertEquals(1, config.getModels().size());
        ModelConfig model = config.getModels().get(0);
        assertEquals(ModelType.ENSEMBLE, model.getType());
        assertEquals(100, model.getIntParameter(ModelConfig.ISOLATION_TREE_COUNT, 0));
        assertEquals(50, model.getIntParameter(ModelConfig.LSTM_UNITS, 0));
        assertEquals(5, model.getIntParameter(ModelConfig.CLUSTER_COUNT, 0));
        assertEquals(0.6, model.getThreshold());

        assertEquals(70, config.getThresholds().getAnomalyScore());
        assertEquals(0.7, config.getThresholds().getConfidence());
        assertTrue(config.getAutoTuning().isEnabled());
        assertEquals(60, config.getAutoTuning().getFeedbackWindow());
        assertEquals(50, config.getAutoTuning().getMinSamples());
        assertEquals(0.1, config.getAutoTuning().getAdjustmentRate());
        assertEquals(100, config.getPerformance().getMaxLatency());
        assertEquals(100, config.getPerformance().getBatchSize());
        assertTrue(config.getPerformance().isParallelProcessing());
        assertEquals(10_000, config.getPerformance().getQueueCapacity());
        assertEquals(100, config.getBaseline().getMinDataPoints());
        assertEquals(50_000, config.getBaseline().getMaxHistorySize());
        assertEquals(7, config.getBaseline().getRetentionDays());
        assertEquals(5, config.getBaseline().getCleanupIntervalMinutes());
        assertEquals(ZoneId.of("UTC"), config.getBaseline().toZoneId());
    }

    @Test
    public void testReadFromClasspath() throws IOException {
        DetectorConfig config;
        try (InputStream inputStream = getClass().getResourceAsStream("/detector-config.json")) {
            config = reader.read(inputStream);
        }

        assertEquals(2, config.getModels().size());
        ModelConfig forest = config.getModels().get(0);
        assertEquals(ModelType.ISOLATION_FOREST, forest.getType());
        assertEquals(50, forest.getIntParameter(ModelConfig.ISOLATION_TREE_COUNT, 0));
        assertEquals(42L, forest.getLongParameter(ModelConfig.RANDOM_SEED).get());
        assertFalse(forest.isAutoTune());
        assertEquals(ModelType.STATISTICAL, config.getModels().get(1).getType());
        assertEquals(ModelConfig.DEFAULT_THRESHOLD, config.getModels().get(1).getThreshold());

        assertEquals(60, config.getThresholds().getAnomalyScore());
        assertFalse(config.getAutoTuning().isEnabled());
        assertEquals(30, config.getAutoTuning().feedbackWindowDuration().toMinutes());
        assertFalse(config.getPerformance().isParallelProcessing());
        assertEquals(2, config.getPerformance().getThreadPoolSize());
        assertEquals(ZoneId.of("Europe/Berlin"), config.getBaseline().toZoneId());
    }

    @Test
    public void testPartialDocumentKeepsDefaults() throws IOException {
        DetectorConfig config = reader
                .read("{\"models\": [{\"type\": \"Clustering\"}], \"thresholds\": {\"anomalyScore\": 80}}");

        assertEquals(ModelType.CLUSTERING, config.getModels().get(0).getType());
        assertEquals(80, config.getThresholds().getAnomalyScore());
        assertEquals(DetectorConfig.Thresholds.DEFAULT_CONFIDENCE, config.getThresholds().getConfidence());
        assertEquals(new DetectorConfig.Performance(), config.getPerformance());
    }

    @Test
    public void testWriteThenRead(@TempDir Path directory) throws IOException {
        DetectorConfig config = DetectorConfig.defaultConfig();
        config.getBaseline().setZoneId("America/New_York");
        Path file = directory.resolve("detector.json");
        Files.write(file, reader.write(config).getBytes(StandardCharsets.UTF_8));

        assertEquals(config, reader.read(file));
    }

    @Test
    public void testUnknownPropertyFails() {
        assertThrows(IOException.class,
                () -> reader.read("{\"models\": [{\"type\": \"statistical\"}], \"colour\": 1}"));
    }

    @Test
    public void testEmptyModelListFails() {
        assertThrows(IllegalArgumentException.class, () -> reader.read("{}"));
    }

    static Stream<Arguments> invalidConfigs() {
        return Stream.of(
                Arguments.of("anomalyScore above 100",
                        (Consumer<DetectorConfig>) c -> c.getThresholds().setAnomalyScore(101)),
                Arguments.of("negative confidence",
                        (Consumer<DetectorConfig>) c -> c.getThresholds().setConfidence(-0.1)),
                Arguments.of("zero batch size", (Consumer<DetectorConfig>) c -> c.getPerformance().setBatchSize(0)),
                Arguments.of("zero queue capacity",
                        (Consumer<DetectorConfig>) c -> c.getPerformance().setQueueCapacity(0)),
                Arguments.of("zero min samples", (Consumer<DetectorConfig>) c -> c.getAutoTuning().setMinSamples(0)),
                Arguments.of("history smaller than minimum",
                        (Consumer<DetectorConfig>) c -> c.getBaseline().setMaxHistorySize(10)),
                Arguments.of("unknown zone", (Consumer<DetectorConfig>) c -> c.getBaseline().setZoneId("Mars/Base")),
                Arguments.of("model threshold above 1",
                        (Consumer<DetectorConfig>) c -> c.getModels().get(0).setThreshold(1.5)),
                Arguments.of("missing section", (Consumer<DetectorConfig>) c -> c.setPerformance(null)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("invalidConfigs")
    public void testValidation(String name, Consumer<DetectorConfig> change) {
        DetectorConfig config = DetectorConfig.defaultConfig();
        change.accept(config);
        assertThrows(IllegalArgumentException.class, config::validate);
    }
}
