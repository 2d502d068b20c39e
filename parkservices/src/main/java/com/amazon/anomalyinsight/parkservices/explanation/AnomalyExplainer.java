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

import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyinsight.CommonUtils;
import com.amazon.anomalyinsight.baseline.BaselineData;
import com.amazon.anomalyinsight.baseline.BaselineStatistics;
import com.amazon.anomalyinsight.baseline.SeasonalPattern;
import com.amazon.anomalyinsight.config.DataType;
import com.amazon.anomalyinsight.config.SeasonalPeriod;
import com.amazon.anomalyinsight.config.Severity;
import com.amazon.anomalyinsight.data.BehaviorData;
import com.amazon.anomalyinsight.data.ErrorData;
import com.amazon.anomalyinsight.data.LogData;
import com.amazon.anomalyinsight.data.MetricData;
import com.amazon.anomalyinsight.data.MonitoringData;
import com.amazon.anomalyinsight.data.TraceData;
import com.amazon.anomalyinsight.parkservices.returntypes.AnomalyScore;

/**
 * Turns an anomaly score into ranked factors, a one line reason and
 * suggestions. The explainer is stateless apart from its templates and may be
 * shared between threads.
 */
public class AnomalyExplainer {

    private static final Logger logger = LogManager.getLogger(AnomalyExplainer.class);

    public static final int MAX_FACTORS = 5;

    public static final int MAX_SUGGESTIONS = 5;

    public static final int MAX_ALTERNATIVES = 3;

    /**
     * factors at or below this impact are dropped
     */
    public static final double MIN_IMPACT = 0.1;

    public static final double MIN_PATTERN_STRENGTH = 0.3;

    public static final double MIN_PATTERN_DEVIATION = 0.5;

    public static final double RAPID_CHANGE_RATE = 0.5;

    public static final double HIGH_LATENCY_MILLIS = 5000;

    public static final int EARLIEST_USUAL_HOUR = 6;

    public static final int LATEST_USUAL_HOUR = 22;

    public static final double MIN_CONFIDENCE = 0.1;

    public static final double MAX_CONFIDENCE = 0.95;

    static final List<String> PROBLEM_WORDS = Collections
            .unmodifiableList(java.util.Arrays.asList("error", "timeout", "failure", "critical", "alert"));

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private static final int MAX_MESSAGE_EVIDENCE = 100;

    private final ZoneId zoneId;

    private final BaselineStatistics calendar;

    private final ExplanationTemplates templates;

    public AnomalyExplainer() {
        this(ZoneId.of("UTC"));
    }

    public AnomalyExplainer(ZoneId zoneId) {
        this(zoneId, new ExplanationTemplates());
    }

    public AnomalyExplainer(ZoneId zoneId, ExplanationTemplates templates) {
        this.zoneId = checkNotNull(zoneId, "zoneId must not be null");
        this.calendar = new BaselineStatistics(zoneId);
        this.templates = checkNotNull(templates, "templates must not be null");
    }

    /**
     * @param data        the flagged data point
     * @param score       its fused score
     * @param baseline    the baseline of the point's key, or null if there is none
     * @param modelScores score in [0,1] per model id
     * @return the explanation; a generic one if the analysis fails
     */
    public AnomalyExplanation explain(MonitoringData data, AnomalyScore score, BaselineData baseline,
            Map<String, Double> modelScores) {
        checkNotNull(data, "data must not be null");
        checkNotNull(score, "score must not be null");
        checkNotNull(modelScores, "modelScores must not be null");
        try {
            List<ExplanationFactor> factors = analyzeFactors(data, score, baseline, modelScores);
            String reason = primaryReason(data, factors, score);
            List<String> suggestions = suggestions(data, factors, score);
            return new AnomalyExplanation(reason, factors, suggestions,
                    explanationConfidence(factors.size(), score, baseline));
        } catch (RuntimeException e) {
            logger.error("Failed to explain anomaly with score {}", score.getScore(), e);
            return fallback(score);
        }
    }

    /**
     * {@link #explain} plus chart data, an overall confidence and alternative
     * causes.
     *
     * @param history earlier points of the same series, oldest first; may be
     *                empty
     */
    public DetailedExplanation explainDetailed(MonitoringData data, AnomalyScore score, BaselineData baseline,
            Map<String, Double> modelScores, List<? extends MonitoringData> history) {
        AnomalyExplanation explanation = explain(data, score, baseline, modelScores);
        List<VisualExplanationData> visualData = visualData(data, baseline,
                history == null ? Collections.emptyList() : history);
        return new DetailedExplanation(explanation, visualData,
                explanationConfidence(explanation.getFactors().size(), score, baseline),
                alternatives(data, score, baseline));
    }

    List<ExplanationFactor> analyzeFactors(MonitoringData data, AnomalyScore score, BaselineData baseline,
            Map<String, Double> modelScores) {
        List<ExplanationFactor> factors = new ArrayList<>();
        if (baseline != null) {
            factors.add(statisticalDeviation(data.getPrimaryValue(), baseline, score));
        }
        factors.add(temporalPattern(data, baseline, score));
        modelConsensus(modelScores, score).ifPresent(factors::add);
        factors.addAll(typeSpecificFactors(data, score, baseline));
        contextIndicators(data, score).ifPresent(factors::add);

        List<ExplanationFactor> result = new ArrayList<>();
        for (ExplanationFactor factor : factors) {
            if (factor.getImpact() > MIN_IMPACT) {
                result.add(factor);
            }
        }
        result.sort(Comparator.comparingDouble(ExplanationFactor::getImpact).reversed());
        return result.size() > MAX_FACTORS ? new ArrayList<>(result.subList(0, MAX_FACTORS)) : result;
    }

    ExplanationFactor statisticalDeviation(double value, BaselineData baseline, AnomalyScore score) {
        double multiplier = score.getSeverity() == Severity.CRITICAL ? 1.2
                : score.getSeverity() == Severity.HIGH ? 1.1 : 1.0;
        double z = baseline.zScore(value);
        double position = baseline.percentilePosition(value);
        List<String> evidence = new ArrayList<>();
        double impact;
        String description;
        if (z > 3) {
            impact = 0.9 * multiplier;
            description = format("Value is %.1f standard deviations from the normal range", z);
            evidence.add(format("Z-score: %.2f", z));
            evidence.add(format("Normal range: %.2f - %.2f", baseline.getMean() - 2 * baseline.getStdDev(),
                    baseline.getMean() + 2 * baseline.getStdDev()));
        } else if (z > 2) {
            impact = 0.7 * multiplier;
            description = format("Value significantly exceeds normal variation (%.1f sigma)", z);
            evidence.add(format("Z-score: %.2f", z));
        } else if (position < 0.05 || position > 0.95) {
            impact = 0.6 * multiplier;
            description = format("Value is in the extreme %s range (%.1fth percentile)",
                    position < 0.5 ? "low" : "high", position * 100);
            evidence.add(format("Percentile position: %.1f%%", position * 100));
        } else {
            impact = Math.min(0.5, z / 3) * multiplier;
            description = "Value shows moderate deviation from baseline";
        }
        evidence.add(format("Current value: %.2f", value));
        evidence.add(format("Baseline mean: %.2f", baseline.getMean()));
        double confidence = baseline.getSampleSize() > 100 ? 0.9 : Math.min(0.8, baseline.getSampleSize() / 100.0);
        return new ExplanationFactor(FactorType.STATISTICAL_DEVIATION, impact, description, evidence, confidence);
    }

    ExplanationFactor temporalPattern(MonitoringData data, BaselineData baseline, AnomalyScore score) {
        List<String> evidence = new ArrayList<>();
        double impact = 0;
        String description = null;
        if (baseline != null) {
            for (SeasonalPattern pattern : baseline.getSeasonalPatterns()) {
                if (pattern.getStrength() <= MIN_PATTERN_STRENGTH || pattern.getPeriod() == SeasonalPeriod.WEEKLY) {
                    continue;
                }
                int bucket = calendar.bucketOf(data.getTimestamp(), pattern.getPeriod());
                double expected = pattern.getExpectedValue(bucket);
                String patternName;
                if (pattern.getPeriod() == SeasonalPeriod.HOURLY) {
                    patternName = "hourly pattern";
                    evidence.add(format("Expected for hour %d: %.2f", bucket, expected));
                } else {
                    patternName = "weekly pattern";
                    evidence.add(format("Expected for %s: %.2f", dayName(data.getTimestamp()), expected));
                }
                if (expected > 0) {
                    double deviation = Math.abs(data.getPrimaryValue() - expected) / expected;
                    if (deviation > MIN_PATTERN_DEVIATION) {
                        impact = Math.max(impact, pattern.getStrength() * 0.8 * score.getScore() / 100);
                        description = "Value deviates significantly from expected " + patternName;
                        evidence.add(format("Pattern strength: %.1f%%", pattern.getStrength() * 100));
                        evidence.add(format("Deviation: %.1f%%", deviation * 100));
                    }
                }
            }
        }
        ZonedDateTime time = Instant.ofEpochMilli(data.getTimestamp()).atZone(zoneId);
        if (time.getHour() < EARLIEST_USUAL_HOUR || time.getHour() > LATEST_USUAL_HOUR) {
            impact = Math.max(impact, 0.3);
            if (description == null) {
                description = "Anomaly occurred during unusual hours";
            }
            evidence.add("Time: " + TIME_FORMAT.format(time));
        }
        boolean hasPatterns = baseline != null && !baseline.getSeasonalPatterns().isEmpty();
        return new ExplanationFactor(FactorType.TEMPORAL_PATTERN, impact,
                description == null ? "Normal temporal pattern" : description, evidence, hasPatterns ? 0.8 : 0.4);
    }

    Optional<ExplanationFactor> modelConsensus(Map<String, Double> modelScores, AnomalyScore score) {
        if (modelScores.isEmpty()) {
            return Optional.empty();
        }
        double[] scores = new double[modelScores.size()];
        int i = 0;
        for (double value : modelScores.values()) {
            scores[i++] = value;
        }
        double mean = CommonUtils.mean(scores);
        double deviation = CommonUtils.standardDeviation(scores);
        double consensus = mean > 0 ? 1 - deviation / mean : 1;

        double impact;
        String description;
        if (consensus > 0.8) {
            impact = 0.8;
            description = "Multiple detection models agree on anomaly";
        } else if (consensus > 0.6) {
            impact = 0.6;
            description = "Moderate agreement between detection models";
        } else {
            impact = 0.3;
            description = "Mixed signals from different detection models";
        }
        List<String> evidence = new ArrayList<>();
        evidence.add(format("Model consensus: %.1f%%", consensus * 100));
        int listed = 0;
        for (Map.Entry<String, Double> entry : modelScores.entrySet()) {
            if (listed++ >= 3) {
                break;
            }
            evidence.add(format("%s: %.1f", entry.getKey(), entry.getValue() * 100));
        }
        return Optional.of(new ExplanationFactor(FactorType.MODEL_CONSENSUS, impact * score.getConfidence(),
                description, evidence, scores.length >= 2 ? 0.9 : 0.5));
    }

    List<ExplanationFactor> typeSpecificFactors(MonitoringData data, AnomalyScore score, BaselineData baseline) {
        List<ExplanationFactor> factors = new ArrayList<>();
        switch (data.getDataType()) {
        case METRIC:
            rapidChange((MetricData) data, score, baseline != null).ifPresent(factors::add);
            break;
        case LOG:
            highSeverityLog((LogData) data, score).ifPresent(factors::add);
            break;
        case TRACE:
            TraceData trace = (TraceData) data;
            if (trace.getDuration() > HIGH_LATENCY_MILLIS) {
                factors.add(new ExplanationFactor(FactorType.HIGH_LATENCY,
                        Math.min(0.9, trace.getDuration() / 10000) * score.getConfidence(),
                        format("Operation took %.0fms to complete", trace.getDuration()),
                        list(format("Duration: %.0fms", trace.getDuration()), "Operation: " + trace.getOperation(),
                                "Status: " + label(trace.getStatus())),
                        0.85));
            }
            if (trace.getStatus() != null && trace.getStatus().isFailure()) {
                factors.add(new ExplanationFactor(FactorType.FAILED_OPERATION, 0.8,
                        "Operation failed with status: " + label(trace.getStatus()),
                        list("Status: " + label(trace.getStatus()), "Operation: " + trace.getOperation(),
                                "Trace ID: " + trace.getTraceId()),
                        0.95));
            }
            break;
        case ERROR:
            ErrorData error = (ErrorData) data;
            double boost = score.getSeverity() == Severity.CRITICAL ? 1.2 : 1.0;
            factors.add(new ExplanationFactor(FactorType.ERROR_SEVERITY,
                    error.getSeverity().getNumericValue() / 4.0 * boost,
                    error.getSeverity().getLabel().toUpperCase(Locale.ROOT) + " severity error occurred",
                    list("Error type: " + error.getErrorType(), "Severity: " + error.getSeverity().getLabel(),
                            "Message: " + truncate(error.getMessage())),
                    0.9));
            break;
        case BEHAVIOR:
            BehaviorData behavior = (BehaviorData) data;
            if (!behavior.isSuccess()) {
                factors.add(new ExplanationFactor(FactorType.FAILED_USER_ACTION, 0.7 * score.getScore() / 100,
                        "User action \"" + behavior.getAction() + "\" failed",
                        list("Action: " + behavior.getAction(), "Page: " + behavior.getPage(), "Success: false",
                                format("Duration: %.0fms", behavior.getPrimaryValue())),
                        0.8));
            }
            break;
        default:
            break;
        }
        return factors;
    }

    private Optional<ExplanationFactor> rapidChange(MetricData metric, AnomalyScore score, boolean hasBaseline) {
        Optional<Double> previous = metric.getPreviousValueIfPresent();
        if (!previous.isPresent()) {
            return Optional.empty();
        }
        double prior = previous.get();
        double rate = Math.abs((metric.getValue() - prior) / (prior == 0 ? 1 : prior));
        if (rate <= RAPID_CHANGE_RATE) {
            return Optional.empty();
        }
        double severityFactor = score.getSeverity() == Severity.CRITICAL ? 1.0 : 0.8;
        return Optional.of(new ExplanationFactor(FactorType.RAPID_CHANGE, Math.min(0.8, rate) * severityFactor,
                format("Metric changed by %.1f%% from previous value", rate * 100),
                list(format("Current: %s", metric.getValue()), format("Previous: %s", prior),
                        format("Change rate: %.1f%%", rate * 100)),
                hasBaseline ? 0.9 : 0.7));
    }

    private Optional<ExplanationFactor> highSeverityLog(LogData log, AnomalyScore score) {
        if (log.getLevel() == null || log.getLevel().getNumericValue() < 4) {
            return Optional.empty();
        }
        String level = log.getLevel().name().toLowerCase(Locale.ROOT);
        return Optional.of(new ExplanationFactor(FactorType.HIGH_SEVERITY_LOG,
                log.getLevel().getNumericValue() / 5.0 * Math.max(0.5, score.getConfidence()),
                level.toUpperCase(Locale.ROOT) + " level log detected",
                list("Log level: " + level, "Message: " + truncate(log.getMessage()), "Source: " + log.getSource()),
                0.95));
    }

    Optional<ExplanationFactor> contextIndicators(MonitoringData data, AnomalyScore score) {
        List<String> evidence = new ArrayList<>();
        int problems = 0;
        for (Map.Entry<String, String> tag : data.getTags().entrySet()) {
            evidence.add(tag.getKey() + ": " + tag.getValue());
            if (suggestsProblem(tag.getKey()) || suggestsProblem(tag.getValue())) {
                problems++;
            }
        }
        if (problems == 0) {
            return Optional.empty();
        }
        double weight = score.getConfidence() * score.getScore() / 100;
        return Optional.of(new ExplanationFactor(FactorType.CONTEXT_INDICATORS, Math.min(0.6, problems * 0.2) * weight,
                "Contextual data suggests problematic conditions",
                evidence.size() > 5 ? evidence.subList(0, 5) : evidence, 0.7));
    }

    private static boolean suggestsProblem(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String word : PROBLEM_WORDS) {
            if (lower.contains(word)) {
                return true;
            }
        }
        return false;
    }

    String primaryReason(MonitoringData data, List<ExplanationFactor> factors, AnomalyScore score) {
        if (factors.isEmpty()) {
            return format("Anomaly detected with %.1f/100 score, but cause is unclear", score.getScore());
        }
        ExplanationFactor top = factors.get(0);
        String template = templates.lookup(data.getDataType(), top.getType());
        return ExplanationTemplates.render(template, score.getScore(), score.getSeverity(), top.getDescription(),
                score.getConfidence());
    }

    List<String> suggestions(MonitoringData data, List<ExplanationFactor> factors, AnomalyScore score) {
        Set<String> suggestions = new LinkedHashSet<>();
        if (score.getSeverity() == Severity.CRITICAL) {
            suggestions.add("Immediate investigation required - potential system impact");
            suggestions.add("Check system health and recent deployments");
        } else if (score.getSeverity() == Severity.HIGH) {
            suggestions.add("Investigate within the next hour");
            suggestions.add("Review system logs and metrics");
        }
        for (ExplanationFactor factor : factors.subList(0, Math.min(2, factors.size()))) {
            switch (factor.getType()) {
            case STATISTICAL_DEVIATION:
                suggestions.add("Compare with historical data to identify pattern changes");
                break;
            case TEMPORAL_PATTERN:
                suggestions.add("Check for scheduled operations or unusual load patterns");
                break;
            case HIGH_LATENCY:
                suggestions.add("Investigate database and network performance");
                break;
            case FAILED_OPERATION:
                suggestions.add("Check error logs and system dependencies");
                break;
            case HIGH_SEVERITY_LOG:
                suggestions.add("Review application logs for error details");
                break;
            default:
                break;
            }
        }
        if (data.getDataType() == DataType.METRIC) {
            suggestions.add("Monitor related metrics for cascading effects");
        } else if (data.getDataType() == DataType.ERROR) {
            suggestions.add("Check if error is recurring and affects multiple users");
        } else if (data.getDataType() == DataType.BEHAVIOR) {
            suggestions.add("Analyze user journey and identify friction points");
        }
        suggestions.add("Set up alerts for similar patterns");
        suggestions.add("Consider updating baseline if this represents new normal");

        List<String> result = new ArrayList<>(suggestions);
        return result.size() > MAX_SUGGESTIONS ? new ArrayList<>(result.subList(0, MAX_SUGGESTIONS)) : result;
    }

    /**
     * score confidence, reduced without a baseline or with a small one, and
     * reduced when fewer than three factors were found
     */
    static double explanationConfidence(int factorCount, AnomalyScore score, BaselineData baseline) {
        double confidence = score.getConfidence();
        if (baseline != null) {
            confidence *= 0.7 + 0.3 * Math.min(1, baseline.getSampleSize() / 1000.0);
        } else {
            confidence *= 0.5;
        }
        confidence *= 0.6 + 0.4 * Math.min(1, factorCount / 3.0);
        return CommonUtils.clamp(confidence, MIN_CONFIDENCE, MAX_CONFIDENCE);
    }

    List<VisualExplanationData> visualData(MonitoringData data, BaselineData baseline,
            List<? extends MonitoringData> history) {
        List<VisualExplanationData> charts = new ArrayList<>();
        VisualExplanationData.ChartPoint current = VisualExplanationData.ChartPoint.at(data.getTimestamp(),
                data.getPrimaryValue());
        if (!history.isEmpty()) {
            List<VisualExplanationData.ChartPoint> series = new ArrayList<>(history.size());
            for (MonitoringData point : history) {
                series.add(VisualExplanationData.ChartPoint.at(point.getTimestamp(), point.getPrimaryValue()));
            }
            charts.add(new VisualExplanationData(VisualExplanationData.ChartType.LINE, series, list(current),
                    list("Current anomalous point highlighted in red")));
        }
        if (baseline != null) {
            VisualExplanationData.ChartPoint currentBar = VisualExplanationData.ChartPoint.labeled("Current",
                    data.getPrimaryValue());
            List<VisualExplanationData.ChartPoint> bars = list(
                    VisualExplanationData.ChartPoint.labeled("Min", baseline.getMin()),
                    VisualExplanationData.ChartPoint.labeled("P25", baseline.getPercentiles().getP25()),
                    VisualExplanationData.ChartPoint.labeled("Mean", baseline.getMean()),
                    VisualExplanationData.ChartPoint.labeled("P75", baseline.getPercentiles().getP75()),
                    VisualExplanationData.ChartPoint.labeled("Max", baseline.getMax()), currentBar);
            charts.add(new VisualExplanationData(VisualExplanationData.ChartType.BAR, bars, list(currentBar),
                    list("Current value compared to baseline distribution")));
        }
        return charts;
    }

    List<String> alternatives(MonitoringData data, AnomalyScore score, BaselineData baseline) {
        List<String> alternatives = new ArrayList<>();
        alternatives.add("Data quality issue or measurement error");
        alternatives.add("Expected variation due to external factors");
        alternatives.add("System change or configuration update");
        if (baseline != null && baseline.getSampleSize() < 100) {
            alternatives.add("Insufficient baseline data for accurate detection");
        }
        if (data.getDataType() == DataType.METRIC) {
            alternatives.add("Normal business cycle variation");
        } else if (data.getDataType() == DataType.LOG) {
            alternatives.add("Temporary increase in log verbosity");
        }
        if (score.getConfidence() < 0.7) {
            alternatives.add("Low confidence detection - may be false positive");
        }
        return new ArrayList<>(alternatives.subList(0, Math.min(MAX_ALTERNATIVES, alternatives.size())));
    }

    private AnomalyExplanation fallback(AnomalyScore score) {
        ExplanationFactor factor = new ExplanationFactor(FactorType.STATISTICAL_DEVIATION, 1.0,
                "The value significantly deviates from expected patterns", Collections.emptyList(), 0.5);
        return new AnomalyExplanation(format("Anomaly detected with score %.1f/100", score.getScore()),
                Collections.singletonList(factor),
                list("Investigate the underlying cause", "Check for system issues"), MIN_CONFIDENCE);
    }

    private String dayName(long timestamp) {
        return Instant.ofEpochMilli(timestamp).atZone(zoneId).getDayOfWeek().getDisplayName(TextStyle.FULL,
                Locale.ENGLISH);
    }

    private static String label(Enum<?> value) {
        return value == null ? "unknown" : value.name().toLowerCase(Locale.ROOT);
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_MESSAGE_EVIDENCE ? text.substring(0, MAX_MESSAGE_EVIDENCE) + "..." : text;
    }

    private static String format(String pattern, Object... arguments) {
        return String.format(Locale.ROOT, pattern, arguments);
    }

    @SafeVarargs
    private static <T> List<T> list(T... items) {
        List<T> result = new ArrayList<>(items.length);
        Collections.addAll(result, items);
        return result;
    }
}
