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

import io.nosqlbench.downscale.DomainValidityException;
import io.nosqlbench.downscale.climatology.Climatology;
import io.nosqlbench.downscale.climatology.ClimatologyCalculator;
import io.nosqlbench.downscale.grouping.SeriesGroups;
import io.nosqlbench.downscale.quantile.QuantileMapperRegistry;
import io.nosqlbench.downscale.series.TimeSeries;
import io.nosqlbench.downscale.state.BcsdState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/// BCSD bias correction for precipitation.
///
/// ## Fit
///
/// ```
///   target ──group──► climatology ──all > 0?──► quantile maps per group
///                                      │ no
///                                      ▼
///                           DomainValidityException, model stays UNFIT
/// ```
///
/// The quantile maps are fitted on the target series itself: each group's reference
/// distribution is the observed one.
///
/// ## Predict
///
/// ```
///   query ──quantile map by group──► mapped ──÷ target climatology──► ratio anomalies
/// ```
///
/// With `return_anomalies` off the mapped values are returned unchanged.
public final class BcsdPrecipitation extends BcsdBase<BcsdPrecipitation> {

    private static final Logger logger = LogManager.getLogger(BcsdPrecipitation.class);

    public BcsdPrecipitation() {
        this(BcsdConfig.monthly());
    }

    public BcsdPrecipitation(BcsdConfig config) {
        super(config);
    }

    /// Rebuilds a fitted model from persisted state.
    ///
    /// @param state precipitation state
    /// @return a fitted model
    /// @throws IllegalArgumentException if the state is not precipitation state, or its
    ///         statistics are not keyed by the configured grouping
    /// @throws DomainValidityException if a stored climatology mean is not positive
    public static BcsdPrecipitation fromState(BcsdState state) {
        BcsdPrecipitation model = new BcsdPrecipitation(state.config());
        model.restoreShared(state, BcsdState.Kind.PRECIPITATION);
        requirePositive(model.targetClimatology);
        model.markRestored();
        return model;
    }

    @Override
    protected void fitModel(TimeSeries source, TimeSeries target) {
        SeriesGroups groups = quantileGrouping().fitGroups(target);
        Climatology climatology = ClimatologyCalculator.climatology(groups, "target climatology");
        requirePositive(climatology);
        QuantileMapperRegistry registry = fitQuantileMappers(groups);

        targetClimatology = climatology;
        quantileMappers = registry;
        logger.info("Fitted precipitation model: {} groups at {} resolution",
            climatology.size(), resolution());
    }

    private static void requirePositive(Climatology climatology) {
        for (Map.Entry<Integer, Double> entry : climatology.asMap().entrySet()) {
            if (!(entry.getValue() > 0.0)) {
                throw new DomainValidityException(climatology.getLabel(), entry.getKey(), entry.getValue());
            }
        }
    }

    @Override
    protected TimeSeries predictModel(TimeSeries source) {
        TimeSeries mapped = quantileMap(source);
        if (!config.isReturnAnomalies()) {
            return mapped;
        }
        return combineByGroup(quantileGrouping(), mapped, targetClimatology, (value, mean) -> value / mean);
    }

    @Override
    protected Map<String, Object> fittedAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TARGET_CLIMATOLOGY, targetClimatology);
        attributes.put(QUANTILE_MAPPERS, quantileMappers);
        return attributes;
    }

    @Override
    public BcsdState exportState() {
        return stateBuilder(BcsdState.Kind.PRECIPITATION).build();
    }

    @Override
    protected BcsdPrecipitation self() {
        return this;
    }
}
