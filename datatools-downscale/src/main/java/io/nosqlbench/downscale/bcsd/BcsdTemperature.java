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
import io.nosqlbench.downscale.climatology.ClimatologyCalculator;
import io.nosqlbench.downscale.grouping.TimeGrouping;
import io.nosqlbench.downscale.quantile.QuantileMapperRegistry;
import io.nosqlbench.downscale.series.SeriesIndexValidator;
import io.nosqlbench.downscale.series.TimeSeries;
import io.nosqlbench.downscale.state.BcsdState;
import io.nosqlbench.downscale.trend.TrendExtractor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// BCSD bias correction for temperature, preserving the query's own trend.
///
/// ## Fit
///
/// - source climatology and target climatology, keyed by the climatology grouping
///   (the primary grouping at monthly resolution, the climate trend grouping at daily)
/// - quantile maps per group of the target series, on the same keys
///
/// ## Predict
///
/// ```
///   query ─┬─► rolling mean within each calendar month ─► trend
///          │                                               │ − source climatology
///          │                                               ▼
///          └──────────────── − shift ◄──────────────────  shift
///                              │
///                              ▼
///                          detrended ─► quantile map ─► + shift ─► − target climatology
///                                                                   (when anomalies are requested)
/// ```
///
/// See [#decompose(TimeSeries)] for all intermediate series.
public final class BcsdTemperature extends BcsdBase<BcsdTemperature> {

    private static final Logger logger = LogManager.getLogger(BcsdTemperature.class);

    static final String SOURCE_CLIMATOLOGY = "source_climatology";

    private volatile Climatology sourceClimatology;

    public BcsdTemperature() {
        this(BcsdConfig.monthly());
    }

    public BcsdTemperature(BcsdConfig config) {
        super(config);
    }

    /// Rebuilds a fitted model from persisted state.
    ///
    /// @param state temperature state
    /// @return a fitted model
    /// @throws IllegalArgumentException if the state is not temperature state, or its
    ///         statistics are not keyed by the climatology grouping
    public static BcsdTemperature fromState(BcsdState state) {
        BcsdTemperature model = new BcsdTemperature(state.config());
        model.restoreShared(state, BcsdState.Kind.TEMPERATURE);
        model.checkKeys(state.sourceClimatology(), state.quantileMaps().keySet());
        model.sourceClimatology = state.sourceClimatology();
        model.markRestored();
        return model;
    }

    public Climatology getSourceClimatology() {
        return sourceClimatology;
    }

    private TimeGrouping climatologyGrouping() {
        return config.climatologyGrouping();
    }

    /// Quantile maps share the climatology keys: month, or the climate trend
    /// grouping at daily resolution.
    @Override
    protected TimeGrouping quantileGrouping() {
        return climatologyGrouping();
    }

    @Override
    protected void fitModel(TimeSeries source, TimeSeries target) {
        Climatology sourceClimo = ClimatologyCalculator.climatology(
            climatologyGrouping().fitGroups(source), "source climatology");
        Climatology targetClimo = ClimatologyCalculator.climatology(
            climatologyGrouping().fitGroups(target), "target climatology");
        QuantileMapperRegistry registry = fitQuantileMappers(quantileGrouping().fitGroups(target));

        sourceClimatology = sourceClimo;
        targetClimatology = targetClimo;
        quantileMappers = registry;
        logger.info("Fitted temperature model: {} quantile groups, {} climatology groups at {} resolution",
            registry.getMaps().size(), targetClimo.size(), resolution());
    }

    @Override
    protected TimeSeries predictModel(TimeSeries source) {
        return decomposeFitted(source).result();
    }

    /// Runs a prediction and returns every intermediate series.
    ///
    /// @param source the query series
    /// @return the decomposition, whose `result` equals [#predict(TimeSeries)]
    /// @throws io.nosqlbench.downscale.NotFittedException if the model has not been fitted
    public TemperatureDecomposition decompose(TimeSeries source) {
        checkFitted();
        Objects.requireNonNull(source, "source cannot be null");
        SeriesIndexValidator.checkResolution(source, resolution());
        return decomposeFitted(source);
    }

    private TemperatureDecomposition decomposeFitted(TimeSeries source) {
        TimeSeries trend = TrendExtractor.monthly(config.trend()).extract(source);
        checkAligned(source, trend, "trend extraction");

        TimeSeries shift = combineByGroup(climatologyGrouping(), trend, sourceClimatology, (value, mean) -> value - mean);
        TimeSeries detrended = source.minus(shift);
        TimeSeries mapped = quantileMap(detrended);
        TimeSeries restored = mapped.plus(shift);

        TimeSeries result = config.isReturnAnomalies()
            ? combineByGroup(climatologyGrouping(), restored, targetClimatology, (value, mean) -> value - mean)
            : restored;
        logger.debug("Corrected {} temperature samples", source.size());
        return new TemperatureDecomposition(trend, shift, detrended, mapped, restored, result);
    }

    @Override
    protected void clearFitted() {
        super.clearFitted();
        sourceClimatology = null;
    }

    @Override
    protected Map<String, Object> fittedAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TARGET_CLIMATOLOGY, targetClimatology);
        attributes.put(SOURCE_CLIMATOLOGY, sourceClimatology);
        attributes.put(QUANTILE_MAPPERS, quantileMappers);
        return attributes;
    }

    @Override
    public BcsdState exportState() {
        return stateBuilder(BcsdState.Kind.TEMPERATURE)
            .sourceClimatology(sourceClimatology)
            .build();
    }

    @Override
    protected BcsdTemperature self() {
        return this;
    }
}
