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

package com.amazon.anomalyinsight.testutils;

import java.util.Arrays;

/**
 * Deterministic synthetic series for exercising baselines, models and the
 * detector. Every method takes an explicit seed so test outcomes do not depend
 * on the run.
 */
public class MonitoringDataGenerator {

    public static final long ONE_HOUR_MILLIS = 3_600_000L;

    public static final long ONE_DAY_MILLIS = 24 * ONE_HOUR_MILLIS;

    /** 2024-01-01T00:00:00Z, a Monday. */
    public static final long DEFAULT_START_MILLIS = 1_704_067_200_000L;

    private final long seed;

    public MonitoringDataGenerator(long seed) {
        this.seed = seed;
    }

    /**
     * @param size   number of values
     * @param mu     mean
     * @param sigma  standard deviation
     * @return independent normal values
     */
    public double[] normalValues(int size, double mu, double sigma) {
        NormalDistribution dist = new NormalDistribution(seed);
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            result[i] = dist.nextDouble(mu, sigma);
        }
        return result;
    }

    /**
     * Rows drawn around each center in turn, {@code perCluster} rows per center.
     */
    public double[][] clusters(double[][] centers, double sigma, int perCluster) {
        NormalDistribution dist = new NormalDistribution(seed);
        double[][] result = new double[centers.length * perCluster][];
        int row = 0;
        for (double[] center : centers) {
            for (int i = 0; i < perCluster; i++) {
                double[] point = new double[center.length];
                for (int j = 0; j < center.length; j++) {
                    point[j] = dist.nextDouble(center[j], sigma);
                }
                result[row++] = point;
            }
        }
        return result;
    }

    /**
     * Hourly samples following a daily sine wave, starting at midnight UTC.
     *
     * @param size      number of hourly samples
     * @param level     mean level
     * @param amplitude half the peak-to-trough swing
     * @param sigma     noise standard deviation
     * @return the series with no anomaly labels
     */
    public LabeledSeries dailySeasonal(int size, double level, double amplitude, double sigma) {
        NormalDistribution dist = new NormalDistribution(seed);
        long[] timestamps = new long[size];
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            timestamps[i] = DEFAULT_START_MILLIS + i * ONE_HOUR_MILLIS;
            double phase = 2 * Math.PI * (i % 24) / 24.0;
            values[i] = level + amplitude * Math.sin(phase) + dist.nextDouble(0, sigma);
        }
        return new LabeledSeries(timestamps, values, new int[0]);
    }

    /**
     * A two regime series that moves between a base distribution and an anomaly
     * distribution with the given transition probabilities.
     */
    public LabeledSeries mixture(int size, long stepMillis, double baseMu, double baseSigma, double anomalyMu,
            double anomalySigma, double toAnomaly, double toBase) {
        NormalDistribution dist = new NormalDistribution(seed);
        long[] timestamps = new long[size];
        double[] values = new double[size];
        int[] anomalies = new int[size];
        int count = 0;
        boolean anomaly = false;
        for (int i = 0; i < size; i++) {
            timestamps[i] = DEFAULT_START_MILLIS + i * stepMillis;
            if (!anomaly) {
                values[i] = dist.nextDouble(baseMu, baseSigma);
                if (dist.getRandom().nextDouble() < toAnomaly) {
                    anomaly = true;
                }
            } else {
                values[i] = dist.nextDouble(anomalyMu, anomalySigma);
                anomalies[count++] = i;
                if (dist.getRandom().nextDouble() < toBase) {
                    anomaly = false;
                }
            }
        }
        return new LabeledSeries(timestamps, values, Arrays.copyOf(anomalies, count));
    }
}
