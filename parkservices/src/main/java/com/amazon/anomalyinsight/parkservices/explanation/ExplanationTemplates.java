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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.amazon.anomalyinsight.config.DataType;
import com.amazon.anomalyinsight.config.Severity;

/**
 * Sentence templates for the primary reason of an explanation. A template is
 * looked up by data type and top factor, then by factor alone, then the
 * generic default is used. Placeholders are {@code {{score}}},
 * {@code {{severity}}}, {@code {{factor}}} and {@code {{confidence}}}.
 */
public class ExplanationTemplates {

    public static final String GENERIC = "generic";

    public static final String DEFAULT = "default";

    private final Map<String, String> templates = new HashMap<>();

    public ExplanationTemplates() {
        put(GENERIC, DEFAULT, "{{severity}} anomaly ({{score}}/100, {{confidence}}% confidence): {{factor}}");
        put(DataType.METRIC.getLabel(), FactorType.STATISTICAL_DEVIATION.getKey(),
                "Metric shows {{severity}} statistical deviation ({{score}}/100): {{factor}}");
        put(DataType.LOG.getLabel(), FactorType.HIGH_SEVERITY_LOG.getKey(),
                "{{severity}} severity log anomaly detected ({{score}}/100): {{factor}}");
        put(DataType.TRACE.getLabel(), FactorType.HIGH_LATENCY.getKey(),
                "Performance anomaly detected ({{score}}/100): {{factor}}");
        put(DataType.ERROR.getLabel(), FactorType.ERROR_SEVERITY.getKey(),
                "Error anomaly detected ({{score}}/100): {{factor}}");
        put(DataType.BEHAVIOR.getLabel(), FactorType.FAILED_USER_ACTION.getKey(),
                "User behavior anomaly ({{score}}/100): {{factor}}");
    }

    /**
     * Adds or replaces a template.
     *
     * @param scope    a data type label or {@link #GENERIC}
     * @param factor   a factor key or {@link #DEFAULT}
     * @param template the sentence with placeholders
     */
    public void put(String scope, String factor, String template) {
        templates.put(scope + "_" + factor, template);
    }

    public Optional<String> get(String scope, String factor) {
        return Optional.ofNullable(templates.get(scope + "_" + factor));
    }

    /**
     * @return the most specific template for the pair
     */
    public String lookup(DataType type, FactorType factor) {
        return get(type.getLabel(), factor.getKey()).orElseGet(
                () -> get(GENERIC, factor.getKey()).orElseGet(() -> templates.get(GENERIC + "_" + DEFAULT)));
    }

    public static String render(String template, double score, Severity severity, String factorDescription,
            double confidence) {
        return template.replace("{{score}}", String.format(Locale.ROOT, "%.1f", score))
                .replace("{{severity}}", severity.getLabel()).replace("{{factor}}", factorDescription)
                .replace("{{confidence}}", String.format(Locale.ROOT, "%.0f", confidence * 100));
    }
}
