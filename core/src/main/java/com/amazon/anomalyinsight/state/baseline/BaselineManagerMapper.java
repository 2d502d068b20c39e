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

package com.amazon.anomalyinsight.state.baseline;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.amazon.anomalyinsight.baseline.BaselineManager;
import com.amazon.anomalyinsight.baseline.TimeSeriesPoint;
import com.amazon.anomalyinsight.config.DataType;
import com.amazon.anomalyinsight.state.IStateMapper;

/**
 * Saves the raw series of a {@link BaselineManager}; baselines are recomputed
 * from them when the manager is restored.
 */
@Getter
@Setter
public class BaselineManagerMapper implements IStateMapper<BaselineManager, BaselineManagerState> {

    /**
     * clock of restored managers
     */
    private Clock clock = Clock.systemUTC();

    @Override
    public BaselineManagerState toState(BaselineManager model) {
        BaselineManagerState state = new BaselineManagerState();
        state.setMinDataPoints(model.getMinDataPoints());
        state.setMaxHistorySize(model.getMaxHistorySize());
        state.setRetentionMillis(model.getRetention().toMillis());
        state.setZoneId(model.getZoneId().getId());
        List<TimeSeriesState> series = new ArrayList<>();
        for (String key : model.getKeys()) {
            List<TimeSeriesPoint> points = model.getTimeSeries(key);
            if (points.isEmpty()) {
                continue;
            }
            TimeSeriesState seriesState = new TimeSeriesState();
            seriesState.setKey(key);
            seriesState.setType(points.get(0).getType().name());
            seriesState.setSource(points.get(0).getSource());
            long[] timestamps = new long[points.size()];
            double[] values = new double[points.size()];
            for (int i = 0; i < timestamps.length; i++) {
                timestamps[i] = points.get(i).getTimestamp();
                values[i] = points.get(i).getValue();
            }
            seriesState.setTimestamps(timestamps);
            seriesState.setValues(values);
            series.add(seriesState);
        }
        state.setSeries(series);
        return state;
    }

    @Override
    public BaselineManager toModel(BaselineManagerState state) {
        BaselineManager manager = BaselineManager.builder().minDataPoints(state.getMinDataPoints())
                .maxHistorySize(state.getMaxHistorySize()).retention(Duration.ofMillis(state.getRetentionMillis()))
                .zoneId(ZoneId.of(state.getZoneId())).clock(clock).build();
        manager.initialize();
        if (state.getSeries() != null) {
            for (TimeSeriesState seriesState : state.getSeries()) {
                DataType type = DataType.valueOf(seriesState.getType());
                List<TimeSeriesPoint> points = new ArrayList<>(seriesState.getTimestamps().length);
                for (int i = 0; i < seriesState.getTimestamps().length; i++) {
                    points.add(new TimeSeriesPoint(seriesState.getTimestamps()[i], seriesState.getValues()[i],
                            seriesState.getSource(), type));
                }
                manager.restoreSeries(seriesState.getKey(), points);
            }
        }
        return manager;
    }
}
