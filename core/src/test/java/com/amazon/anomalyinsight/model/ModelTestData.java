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

import com.amazon.anomalyinsight.testutils.MonitoringDataGenerator;

final class ModelTestData {

    private ModelTestData() {
    }

    static double[][] column(double[] values) {
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[] { values[i] };
        }
        return rows;
    }

    static double[][] normalColumn(long seed, int size, double mu, double sigma) {
        return column(new MonitoringDataGenerator(seed).normalValues(size, mu, sigma));
    }
}
