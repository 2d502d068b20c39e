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

import com.amazon.anomalyinsight.parkservices.returntypes.Anomaly;
import com.amazon.anomalyinsight.parkservices.threshold.ThresholdAdjustment;

/**
 * Receives detector events. Callbacks run on the thread that produced the
 * event; an exception thrown by a listener is logged and otherwise ignored.
 */
public interface IDetectorListener {

    default void onAnomaly(Anomaly anomaly) {
    }

    default void onThresholdsAdjusted(ThresholdAdjustment adjustment) {
    }

    /**
     * @param sampleCount number of valid points the models were trained on
     */
    default void onModelsTrained(int sampleCount) {
    }
}
