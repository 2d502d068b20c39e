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

package com.amazon.anomalyinsight.parkservices.explanation;

import static com.amazon.anomalyinsight.testutils.MonitoringDataGenerator.DEFAULT_START_MILLIS;
import static com.amazon.anomalyinsight.testutils.MonitoringDataGenerator.ONE_HOUR_MILLIS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyinsight.baseline.BaselineData;
import com.amazon.anomalyinsight.baseline.Percentiles;
import com.amazon.anomalyinsight.config.LogLevel;
import com.amazon.anomalyinsight.config.Severity;
import com.amazon.anomalyinsight.config.TraceStatus;
import com.amazon.anomalyinsight.data.LogData;
import com.amazon.anomalyinsight.data.MetricData;
import com.amazon.anomalyinsight.data.MonitoringData;
import com.amazon.anomalyinsight.data.TraceData;
import com.amazon.anomalyinsight.parkservices.returntypes.AnomalyScore;

public class AnomalyExplainerTest {

    private static final long NOON = DEFAULT_START_MILLIS + 12 * ONE_HOUR_MILLIS;

    private static final long THREE_AM = DEFAULT_START_MILLIS + 3 * ONE_HOUR_MILLIS;

    private AnomalyExplainer explainer;

    private BaselineData baseline;

    @BeforeEach
    public void setUp() {
        explainer = new AnomalyExplainer(ZoneId.of("UTC"));
        baseline = baseline(500);
    }

    private static BaselineData baseline(int sampleSize) {
        return new BaselineData("metric:api", 100, 10, 70, 130, new Percentiles(87, 93, 100, 107, 113, 116, 123),
                Collections.emptyList(), null, NOON, sampleSize);
    }

    private static Map<String, Double> agreeingScores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("isolation_forest_0", 0.9);
        scores.put("clustering_1", 0.8);
        return scores;
    }

    private static List<FactorType> types(AnomalyExplanation explanation) {
        return explanation.getFactors().stream().map(ExplanationFactor::getType).collect(Collectors.toList());
    }

    @Test
    public void testMetricExplanation() {
        MetricData data = new MetricData(NOON, "api", 160, 100.0, Collections.singletonMap("status", "timeout"),
                null);
        AnomalyScore score = new AnomalyScore(95, 0.9, Severity.CRITICAL, NOON);

        AnomalyExplanation explanation = explainer.explain(data, score, baseline, agreeingScores());

        assertThat(types(explanation), contains(FactorType.STATISTICAL_DEVIATION, FactorType.MODEL_CONSENSUS,
                FactorType.RAPID_CHANGE, FactorType.CONTEXT_INDICATORS));
        ExplanationFactor top = explanation.getFactors().get(0);
        assertEquals(1.0, top.getImpact());
        assertEquals(0.9, top.getConfidence());
        assertEquals("Statistical Deviation", top.getName());
        assertThat(top.getEvidence(), hasItem("Z-score: 6.00"));
        assertThat(explanation.getFactors().get(1).getImpact(), closeTo(0.72, 1e-9));
        assertThat(explanation.getFactors().get(2).getImpact(), closeTo(0.6, 1e-9));
        assertThat(explanation.getFactors().get(3).getImpact(), closeTo(0.171, 1e-9));

        assertEquals("Metric shows critical statistical deviation (95.0/100): "
                + "Value is 6.0 standard deviations from the normal range", explanation.getReason());
        assertEquals(5, explanation.getSuggestions().size());
        assertEquals("Immediate investigation required - potential system impact",
                explanation.getSuggestions().get(0));
        assertThat(explanation.getSuggestions(), hasItem("Compare with historical data to identify pattern changes"));
        assertThat(explanation.getSuggestions(), hasItem("Monitor related metrics for cascading effects"));
        assertThat(explanation.getConfidence(), closeTo(0.9 * 0.85, 1e-9));
    }

    @Test
    public void testFactorsAreSortedAndCapped() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("error", "critical");
        tags.put("alert", "on");
        MetricData data = new MetricData(THREE_AM, "api", 400, 100.0, tags, null);
        AnomalyScore score = new AnomalyScore(100, 1, Severity.CRITICAL, THREE_AM);

        AnomalyExplanation explanation = explainer.explain(data, score, baseline, agreeingScores());

        List<ExplanationFactor> factors = explanation.getFactors();
        assertEquals(AnomalyExplainer.MAX_FACTORS, factors.size());
        for (int i = 1; i < factors.size(); i++) {
            assertThat(factors.get(i).getImpact(), lessThanOrEqualTo(factors.get(i - 1).getImpact()));
        }
        for (ExplanationFactor factor : factors) {
            assertTrue(factor.getImpact() > AnomalyExplainer.MIN_IMPACT && factor.getImpact() <= 1);
        }
    }

    @Test
    public void testLogExplanationWithoutBaseline() {
        LogData data = new LogData(THREE_AM, "auth-service", LogLevel.ERROR, "connection refused");
        AnomalyScore score = new AnomalyScore(80, 0.8, Severity.HIGH, THREE_AM);

        AnomalyExplanation explanation = explainer.explain(data, score, null, Collections.emptyMap());

        assertThat(types(explanation), contains(FactorType.HIGH_SEVERITY_LOG, FactorType.TEMPORAL_PATTERN));
        assertThat(explanation.getFactors().get(0).getImpact(), closeTo(0.64, 1e-9));
        ExplanationFactor temporal = explanation.getFactors().get(1);
        assertEquals(0.3, temporal.getImpact());
        assertEquals("Anomaly occurred during unusual hours", temporal.getDescription());
        assertThat(temporal.getEvidence(), hasItem("Time: 03:00:00"));
        assertThat(explanation.getReason(), startsWith("high severity log anomaly detected (80.0/100)"));
        assertThat(explanation.getSuggestions(), contains("Investigate within the next hour",
                "Review system logs and metrics", "Review application logs for error details",
                "Check for scheduled operations or unusual load patterns", "Set up alerts for similar patterns"));
        assertThat(explanation.getConfidence(), closeTo(0.8 * 0.5 * (0.6 + 0.4 * 2 / 3.0), 1e-9));
    }

    @Test
    public void testFailedSlowTrace() {
        TraceData data = new TraceData(NOON, "checkout", "trace-1", "span-1", "charge", 8000, TraceStatus.TIMEOUT);
        AnomalyScore score = new AnomalyScore(85, 1.0, Severity.HIGH, NOON);

        AnomalyExplanation explanation = explainer.explain(data, score, null, Collections.emptyMap());

        assertThat(types(explanation), contains(FactorType.HIGH_LATENCY, FactorType.FAILED_OPERATION));
        assertThat(explanation.getFactors().get(0).getImpact(), closeTo(0.8, 1e-9));
        assertEquals("Performance anomaly detected (85.0/100): Operation took 8000ms to complete",
                explanation.getReason());
        assertThat(explanation.getSuggestions(), hasItem("Investigate database and network performance"));
        assertThat(explanation.getSuggestions(), hasItem("Check error logs and system dependencies"));
    }

    @Test
    public void testNoFactorsGivesUnclearReason() {
        MetricData data = new MetricData(NOON, "api", 101);
        AnomalyScore score = new AnomalyScore(72, 0.9, Severity.MEDIUM, NOON);

        AnomalyExplanation explanation = explainer.explain(data, score, null, Collections.emptyMap());

        assertTrue(explanation.getFactors().isEmpty());
        assertEquals("Anomaly detected with 72.0/100 score, but cause is unclear", explanation.getReason());
        assertThat(explanation.getConfidence(), closeTo(0.9 * 0.5 * 0.6, 1e-9));
    }

    @Test
    public void testSuggestionsAreUnique() {
        MetricData data = new MetricData(NOON, "api", 160, 100.0, null, null);
        AnomalyScore score = new AnomalyScore(95, 0.9, Severity.CRITICAL, NOON);

        List<String> suggestions = explainer.explain(data, score, baseline, agreeingScores()).getSuggestions();

        assertEquals(suggestions.size(), new HashSet<>(suggestions).size());
        assertThat(suggestions.size(), lessThanOrEqualTo(AnomalyExplainer.MAX_SUGGESTIONS));
    }

    @Test
    public void testCustomTemplate() {
        ExplanationTemplates templates = new ExplanationTemplates();
        templates.put("metric", FactorType.STATISTICAL_DEVIATION.getKey(), "[{{severity}}] {{confidence}}%");
        AnomalyExplainer custom = new AnomalyExplainer(ZoneId.of("UTC"), templates);
        MetricData data = new MetricData(NOON, "api", 160);

        AnomalyExplanation explanation = custom.explain(data, new AnomalyScore(95, 0.9, Severity.CRITICAL, NOON),
                baseline, Collections.emptyMap());

        assertEquals("[critical] 90%", explanation.getReason());
    }

    @Test
    public void testFailureGivesFallback() {
        BaselineData broken = mock(BaselineData.class);
        when(broken.zScore(anyDouble())).thenThrow(new IllegalStateException("corrupt baseline"));
        MetricData data = new MetricData(NOON, "api", 160);

        AnomalyExplanation explanation = explainer.explain(data, new AnomalyScore(95, 0.9, Severity.CRITICAL, NOON),
                broken, Collections.emptyMap());

        assertEquals("Anomaly detected with score 95.0/100", explanation.getReason());
        assertEquals(1, explanation.getFactors().size());
        assertEquals(1.0, explanation.getFactors().get(0).getImpact());
        assertThat(explanation.getSuggestions(), contains("Investigate the underlying cause",
                "Check for system issues"));
    }

    @Test
    public void testDetailedExplanation() {
        List<MonitoringData> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(new MetricData(NOON - (10 - i) * 60_000L, "api", 100 + i));
        }
        MetricData data = new MetricData(NOON, "api", 160);
        AnomalyScore score = new AnomalyScore(95, 0.6, Severity.CRITICAL, NOON);

        DetailedExplanation detailed = explainer.explainDetailed(data, score, baseline(50), agreeingScores(),
                history);

        List<VisualExplanationData> charts = detailed.getVisualData();
        assertEquals(2, charts.size());
        VisualExplanationData line = charts.get(0);
        assertEquals(VisualExplanationData.ChartType.LINE, line.getChartType());
        assertEquals(10, line.getData().size());
        assertEquals(160, line.getHighlights().get(0).getValue());
        VisualExplanationData bar = charts.get(1);
        assertEquals(VisualExplanationData.ChartType.BAR, bar.getChartType());
        assertEquals(6, bar.getData().size());
        assertEquals("Current", bar.getData().get(5).getLabel());
        assertEquals(Collections.singletonList("Current value compared to baseline distribution"),
                bar.getAnnotations());

        assertThat(detailed.getAlternativeExplanations(), contains("Data quality issue or measurement error",
                "Expected variation due to external factors", "System change or configuration update"));
        assertEquals(detailed.getExplanation().getConfidence(), detailed.getConfidence());
    }

    @Test
    public void testDetailedExplanationWithoutHistoryOrBaseline() {
        LogData data = new LogData(NOON, "auth-service", LogLevel.CRITICAL, "disk full");

        DetailedExplanation detailed = explainer.explainDetailed(data,
                new AnomalyScore(90, 0.9, Severity.CRITICAL, NOON), null, Collections.emptyMap(), null);

        assertTrue(detailed.getVisualData().isEmpty());
        assertEquals(AnomalyExplainer.MAX_ALTERNATIVES, detailed.getAlternativeExplanations().size());
    }
}
