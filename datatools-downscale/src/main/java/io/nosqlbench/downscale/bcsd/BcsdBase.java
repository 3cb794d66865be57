package io.nosqlbench.downscale.bcsd;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.downscale.climatology.Climatology;
import io.nosqlbench.downscale.grouping.SeriesGroups;
import io.nosqlbench.downscale.grouping.TimeGrouping;
import io.nosqlbench.downscale.quantile.QuantileMapperRegistry;
import io.nosqlbench.downscale.series.TimeSeries;
import io.nosqlbench.downscale.state.BcsdState;

import java.util.Set;
import java.util.function.DoubleBinaryOperator;

/// Shared state and steps of the BCSD models: the target climatology and the
/// per-group quantile maps, both keyed by the configured grouping.
///
/// @param <M> the concrete model type
public abstract class BcsdBase<M extends BcsdBase<M>> extends AbstractDownscaler<M> {

    static final String TARGET_CLIMATOLOGY = "target_climatology";
    static final String QUANTILE_MAPPERS = "quantile_mappers";

    protected volatile Climatology targetClimatology;
    protected volatile QuantileMapperRegistry quantileMappers;

    protected BcsdBase(BcsdConfig config) {
        super(config);
    }

    public Climatology getTargetClimatology() {
        return targetClimatology;
    }

    public QuantileMapperRegistry getQuantileMappers() {
        return quantileMappers;
    }

    /// Grouping used to fit and apply the quantile maps.
    protected TimeGrouping quantileGrouping() {
        return config.getGrouping();
    }

    /// Fits a new registry on the given training groups without storing it.
    protected QuantileMapperRegistry fitQuantileMappers(SeriesGroups trainingGroups) {
        QuantileMapperRegistry registry = new QuantileMapperRegistry(newQuantileMapper());
        registry.fitByGroup(trainingGroups);
        return registry;
    }

    /// Maps every sample through the quantile map of its group key, ranking it
    /// among the query samples of that key's context group.
    protected TimeSeries quantileMap(TimeSeries series) {
        TimeGrouping grouping = quantileGrouping();
        TimeSeries mapped = quantileMappers.transformByGroup(grouping.partition(series), grouping.contextGroups(series));
        checkAligned(series, mapped, "quantile mapping");
        return mapped;
    }

    /// Combines each sample with the climatology value of its group key.
    ///
    /// @throws io.nosqlbench.downscale.GroupKeyMismatchException if a key has no climatology
    protected static TimeSeries combineByGroup(TimeGrouping grouping, TimeSeries series,
                                               Climatology climatology, DoubleBinaryOperator op) {
        TimeSeries combined = grouping.partition(series).apply(group -> {
            double reference = climatology.get(group.key());
            double[] values = group.values();
            for (int i = 0; i < values.length; i++) {
                values[i] = op.applyAsDouble(values[i], reference);
            }
            return values;
        });
        checkAligned(series, combined, climatology.getLabel());
        return combined;
    }

    @Override
    protected void clearFitted() {
        targetClimatology = null;
        quantileMappers = null;
    }

    /// Restores the shared fitted fields from persisted state.
    ///
    /// @throws IllegalArgumentException if the state belongs to another model kind, or if
    ///         its climatology and quantile maps are not keyed by the configured grouping
    protected void restoreShared(BcsdState state, BcsdState.Kind expected) {
        if (state.kind() != expected) {
            throw new IllegalArgumentException(
                "Cannot restore " + modelName() + " from " + state.kind() + " state");
        }
        checkKeys(state.targetClimatology(), state.quantileMaps().keySet());
        targetClimatology = state.targetClimatology();
        quantileMappers = QuantileMapperRegistry.restore(newQuantileMapper(), state.quantileMaps());
    }

    /// Fails unless `climatology` has exactly `keys`, all valid for the quantile grouping.
    protected void checkKeys(Climatology climatology, Set<Integer> keys) {
        TimeGrouping grouping = quantileGrouping();
        for (int key : keys) {
            if (key < 1 || key > grouping.keyCount()) {
                throw new IllegalArgumentException(String.format(
                    "key %d is not a %s key", key, grouping.getGroupingType()));
            }
        }
        if (!climatology.asMap().keySet().equals(keys)) {
            throw new IllegalArgumentException(String.format(
                "%s keys %s do not match quantile map keys %s",
                climatology.getLabel(), climatology.asMap().keySet(), keys));
        }
    }

    /// Captures the fitted statistics for persistence.
    ///
    /// @return the complete fitted state
    /// @throws io.nosqlbench.downscale.NotFittedException if the model is not fitted
    public abstract BcsdState exportState();

    protected BcsdState.Builder stateBuilder(BcsdState.Kind kind) {
        checkFitted();
        return new BcsdState.Builder()
            .kind(kind)
            .config(config)
            .targetClimatology(targetClimatology)
            .quantileMaps(quantileMappers.getMaps());
    }
}
