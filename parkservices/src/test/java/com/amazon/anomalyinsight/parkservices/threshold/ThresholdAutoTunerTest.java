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

package com.amazon.anomalyinsight.parkservices.threshold;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyinsight.parkservices.config.DetectorConfig;

public class ThresholdAutoTunerTest {

    private static final long START = 1_704_067_200_000L;

    private MutableClock clock;

    private DetectorConfig.AutoTuning autoTuning;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(START);
        autoTuning = new DetectorConfig.AutoTuning();
        autoTuning.setMinSamples(5);
    }

    private ThresholdAutoTuner tuner(double score, double confidence) {
        return new ThresholdAutoTuner(autoTuning, new DetectorConfig.Thresholds(score, confidence), clock);
    }

    private Feedback feedback(int index, boolean actualAnomaly) {
        return new Feedback("anomaly_" + index, actualAnomaly, clock.millis());
    }

    @Test
    public void testNoAdjustmentBelowMinSamples() {
        ThresholdAutoTuner tuner = tuner(70, 0.7);
        for (int i = 0; i < 4; i++) {
            assertFalse(tuner.addFeedback(feedback(i, false)).isPresent());
        }
        assertEquals(4, tuner.getBufferedFeedbackCount());
        assertEquals(70, tuner.getThresholds().getAnomalyScore());
        assertEquals(0, tuner.getFalsePositiveRate());
    }

    @Test
    public void testFalsePositivesRaiseThresholds() {
        ThresholdAutoTuner tuner = tuner(70, 0.7);
        Optional<ThresholdAdjustment> adjustment = Optional.empty();
        for (int i = 0; i < 5; i++) {
            adjustment = tuner.addFeedback(feedback(i, false));
        }

        assertTrue(adjustment.isPresent());
        ThresholdAdjustment result = adjustment.get();
        assertEquals(70, result.getPreviousAnomalyScore());
        assertThat(result.getNewAnomalyScore(), closeTo(77, 1e-9));
        assertEquals(0.7, result.getPreviousConfidence());
        assertThat(result.getNewConfidence(), closeTo(0.77, 1e-9));
        assertEquals(1.0, result.getFalsePositiveRate());
        assertEquals(ThresholdAdjustment.HIGH_FALSE_POSITIVE_RATE, result.getReason());
        assertEquals(START, result.getTimestamp());
        assertThat(tuner.getThresholds().getAnomalyScore(), closeTo(77, 1e-9));
    }

    @Test
    public void testLowFalsePositiveRateKeepsThresholds() {
        ThresholdAutoTuner tuner = tuner(70, 0.7);
        for (int i = 0; i < 30; i++) {
            assertFalse(tuner.addFeedback(feedback(i, i != 29)).isPresent());
        }
        assertThat(tuner.getFalsePositiveRate(), closeTo(1 / 30.0, 1e-9));
        assertEquals(70, tuner.getThresholds().getAnomalyScore());
    }

    @Test
    public void testStaleFeedbackIsDiscarded() {
        ThresholdAutoTuner tuner = tuner(70, 0.7);
        for (int i = 0; i < 4; i++) {
            tuner.addFeedback(feedback(i, true));
        }
        clock.advance(61, TimeUnit.MINUTES);

        Optional<ThresholdAdjustment> adjustment = tuner.addFeedback(feedback(4, false));

        assertEquals(1, tuner.getBufferedFeedbackCount());
        assertTrue(adjustment.isPresent());
        assertEquals(1.0, adjustment.get().getFalsePositiveRate());
    }

    @Test
    public void testDisabledTunerNeverAdjusts() {
        autoTuning.setEnabled(false);
        ThresholdAutoTuner tuner = tuner(70, 0.7);
        for (int i = 0; i < 20; i++) {
            assertFalse(tuner.addFeedback(feedback(i, false)).isPresent());
        }
        assertEquals(70, tuner.getThresholds().getAnomalyScore());
        assertEquals(0.7, tuner.getThresholds().getConfidence());
    }

    @Test
    public void testThresholdsAreClamped() {
        ThresholdAutoTuner tuner = tuner(95, 0.95);
        Optional<ThresholdAdjustment> adjustment = Optional.empty();
        for (int i = 0; i < 5; i++) {
            adjustment = tuner.addFeedback(feedback(i, false));
        }
        assertTrue(adjustment.isPresent());
        assertEquals(100, adjustment.get().getNewAnomalyScore());
        assertEquals(1, adjustment.get().getNewConfidence());

        assertFalse(tuner.addFeedback(feedback(5, false)).isPresent());
        assertEquals(100, tuner.getThresholds().getAnomalyScore());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(NullPointerException.class,
                () -> new ThresholdAutoTuner(null, new DetectorConfig.Thresholds(), clock));
        autoTuning.setMinSamples(0);
        assertThrows(IllegalArgumentException.class, () -> tuner(70, 0.7));
    }

    static class MutableClock extends Clock {

        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long amount, TimeUnit unit) {
            millis += unit.toMillis(amount);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }
}
