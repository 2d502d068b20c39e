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

package com.amazon.anomalyinsight.data;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.amazon.anomalyinsight.baseline.BaselineKey;
import com.amazon.anomalyinsight.config.DataType;
import com.amazon.anomalyinsight.config.LogLevel;
import com.amazon.anomalyinsight.config.Severity;
import com.amazon.anomalyinsight.config.TraceStatus;

public class MonitoringDataTest {

    @Test
    public void testFeatureVectors() {
        assertArrayEquals(new double[] { 42 }, new MetricData(0L, "cpu", 42).getFeatures());
        assertArrayEquals(new double[] { 4, 5 }, new LogData(0L, "app", LogLevel.ERROR, "hello").getFeatures());
        assertArrayEquals(new double[] { 120, 3 },
                new TraceData(0L, "svc", "t", "s", "op", 120, TraceStatus.TIMEOUT).getFeatures());
        assertArrayEquals(new double[] { 4, 0 },
                new ErrorData(0L, "svc", "NPE", "boom", Severity.CRITICAL).getFeatures());
        assertArrayEquals(new double[] { 0, 0 },
                new BehaviorData(0L, "web", "session", "click", "/home", null, false).getFeatures());
        assertArrayEquals(new double[] { 250, 1 },
                new BehaviorData(0L, "web", "session", "click", "/home", 250.0, true).getFeatures());
    }

    @Test
    public void testPrimaryValues() {
        assertEquals(5, new LogData(0L, "app", LogLevel.CRITICAL, "x").getPrimaryValue());
        assertEquals(1, new ErrorData(0L, "svc", "E", "m", Severity.LOW).getPrimaryValue());
        assertEquals(DataType.TRACE, new TraceData(0L, "svc", "t", "s", "op", 1, TraceStatus.SUCCESS).getDataType());
        assertFalse(new MetricData(0L, "cpu", Double.NaN).hasValidPrimaryValue());
        assertTrue(new MetricData(0L, "cpu", 1).hasValidPrimaryValue());
    }

    @Test
    public void testTagsAreCopied() {
        Map<String, String> tags = new HashMap<>();
        tags.put("service", "api");
        MetricData data = new MetricData(0L, "cpu", 1, tags);
        tags.put("service", "changed");
        assertEquals("api", data.getTags().get("service"));
        assertThrows(UnsupportedOperationException.class, () -> data.getTags().put("a", "b"));
    }

    @Test
    public void testBaselineKey() {
        Map<String, String> tags = new HashMap<>();
        tags.put("service", "api");
        tags.put("region", "us-east-1");
        tags.put("host", "ignored");
        assertEquals("metric:cpu:region:us-east-1,service:api", BaselineKey.of(new MetricData(0L, "cpu", 1, tags)));
        assertEquals("metric:cpu", BaselineKey.of(new MetricData(0L, "cpu", 1)));
        assertEquals("log:unknown", BaselineKey.of(new LogData(0L, null, LogLevel.INFO, "x")));

        Map<String, String> other = new HashMap<>(tags);
        other.put("host", "different");
        assertEquals(BaselineKey.of(new MetricData(0L, "cpu", 1, tags)),
                BaselineKey.of(new MetricData(5L, "cpu", 2, other)));
        other.put("environment", "prod");
        assertNotEquals(BaselineKey.of(new MetricData(0L, "cpu", 1, tags)),
                BaselineKey.of(new MetricData(5L, "cpu", 2, other)));
    }

    @Test
    public void testSeverityFromScore() {
        assertEquals(Severity.CRITICAL, Severity.fromScore(90));
        assertEquals(Severity.HIGH, Severity.fromScore(75));
        assertEquals(Severity.MEDIUM, Severity.fromScore(50));
        assertEquals(Severity.LOW, Severity.fromScore(49.9));
    }
}
