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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyinsight.model.sequence.SequencePredictor;
import com.amazon.anomalyinsight.testutils.MonitoringDataGenerator;

public class SequenceModelTest {

    private SequenceModel model;

    private double[] series;

    @BeforeEach
    public void setUp() {
        model = SequenceModel.builder().hiddenUnits(8).sequenceLength(12).epochs(3).randomSeed(17L).build();
        model.initialize();
        series = new MonitoringDataGenerator(9).dailySeasonal(300, 10, 2, 0.1).getValues();
    }

    @Test
    public void testExpectedValueScoresLow() {
        model.train(ModelTestData.column(series));
        assertTrue(model.isTrained());
        SequencePredictor predictor = model.getTrained().get();
        double expected = predictor.predictNext();
        assertTrue(model.predict(new double[] { expected }) < 1e-6);
        assertEquals(1.0, model.predict(new double[] { 1000 }), 1e-12);
    }

    @Test
    public void testPredictSequence() {
        model.train(ModelTestData.column(series));
        double[] window = new double[13];
        System.arraycopy(series, 100, window, 0, 13);
        double typical = model.predictSequence(window);
        window[12] = 1000;
        assertEquals(1.0, model.predictSequence(window), 1e-12);
        assertTrue(typical < 1.0);

        window[3] = Double.NaN;
        assertEquals(0, model.predictSequence(window));
        assertThrows(IllegalArgumentException.class, () -> model.predictSequence(new double[] { 1 }));
    }

    @Test
    public void testNeedsMoreRowsThanSequenceLength() {
        model.train(ModelTestData.column(new double[12]));
        assertFalse(model.isTrained());
        assertEquals(0, model.predict(new double[] { 5 }));
        assertEquals(0, model.predictSequence(new double[] { 1, 2, 3 }));
    }

    @Test
    public void testScaling() {
        model.train(ModelTestData.column(series));
        SequencePredictor predictor = model.getTrained().get();
        assertEquals(12, predictor.getSequenceLength());
        assertTrue(predictor.getRange() > 0);
        assertEquals(0, predictor.scale(predictor.getMin()), 1e-12);
        assertTrue(predictor.getResidualDeviation() >= SequencePredictor.MIN_RESIDUAL_DEVIATION);
        assertEquals(300, model.getModelMetrics().getTrainingDataSize());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> SequenceModel.builder().hiddenUnits(0).build());
        assertThrows(IllegalArgumentException.class, () -> SequenceModel.builder().learningRate(0).build());
        assertThrows(IllegalArgumentException.class, () -> SequenceModel.builder().sequenceLength(0).build());
    }
}
