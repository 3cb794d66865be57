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

import io.nosqlbench.downscale.NotFittedException;
import io.nosqlbench.downscale.quantile.EmpiricalQuantileMapper;
import io.nosqlbench.downscale.quantile.QuantileMapper;
import io.nosqlbench.downscale.series.Resolution;
import io.nosqlbench.downscale.series.SeriesIndexValidator;
import io.nosqlbench.downscale.series.SeriesShapes;
import io.nosqlbench.downscale.series.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Estimator lifecycle shared by the BCSD models.
///
/// ## Lifecycle
///
/// ```
///   new model ─► UNFIT
///   fit(source, target)
///     ├─ validate both series at the configured resolution
///     ├─ discard previous fitted statistics
///     ├─ fitModel(...)   subclass computes and commits its statistics
///     └─ FITTED
///   predict(query)
///     ├─ checkFitted()   names every missing attribute
///     ├─ validate query
///     ├─ predictModel(...)
///     └─ check the output index equals the query index
/// ```
///
/// A failed fit leaves the model UNFIT with no partial statistics. Once fitted, the
/// model is read-only and concurrent predict calls are safe.
///
/// @param <M> the concrete model type returned from [#fit(TimeSeries, TimeSeries)]
public abstract class AbstractDownscaler<M extends AbstractDownscaler<M>> {

    private static final Logger logger = LogManager.getLogger(AbstractDownscaler.class);

    protected final BcsdConfig config;
    private volatile FitState state = FitState.UNFIT;

    protected AbstractDownscaler(BcsdConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /// Fits the model on paired training series.
    ///
    /// @param source the biased training series, e.g. a model simulation
    /// @param target the reference training series, e.g. observations
    /// @return this model, fitted
    /// @throws io.nosqlbench.downscale.MalformedSeriesException if either index is invalid
    public final M fit(TimeSeries source, TimeSeries target) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        SeriesIndexValidator.checkResolution(source, resolution());
        SeriesIndexValidator.checkResolution(target, resolution());

        state = FitState.UNFIT;
        clearFitted();
        logger.debug("Fitting {} on {} source and {} target samples",
            modelName(), source.size(), target.size());
        fitModel(source, target);
        state = FitState.FITTED;
        return self();
    }

    /// Corrects a query series.
    ///
    /// @param source the biased series to correct
    /// @return the corrected series, index-aligned with `source`
    /// @throws NotFittedException if the model has not been fitted
    public final TimeSeries predict(TimeSeries source) {
        checkFitted();
        Objects.requireNonNull(source, "source cannot be null");
        SeriesIndexValidator.checkResolution(source, resolution());
        TimeSeries result = predictModel(source);
        checkAligned(source, result, "prediction");
        return result;
    }

    /// Corrects a single-column matrix, given as `n×1` or `1×n`.
    ///
    /// @param index the timestamps of the samples
    /// @param data the sample matrix
    /// @return the corrected series
    public final TimeSeries predict(LocalDate[] index, double[][] data) {
        return predict(SeriesShapes.singleColumn(TimeSeries.DEFAULT_NAME, index, data));
    }

    public FitState getState() {
        return state;
    }

    public boolean isFitted() {
        return state == FitState.FITTED && missingAttributes().isEmpty();
    }

    public BcsdConfig getConfig() {
        return config;
    }

    public Resolution resolution() {
        return config.resolution();
    }

    /// Fails unless the model is fitted and every fitted attribute is present.
    ///
    /// @throws NotFittedException naming the missing attributes
    public final void checkFitted() {
        List<String> missing = missingAttributes();
        if (state != FitState.FITTED || !missing.isEmpty()) {
            throw new NotFittedException(modelName(), missing.isEmpty() ? List.copyOf(fittedAttributes().keySet()) : missing);
        }
    }

    private List<String> missingAttributes() {
        List<String> missing = new ArrayList<>();
        fittedAttributes().forEach((name, value) -> {
            if (value == null) {
                missing.add(name);
            }
        });
        return missing;
    }

    /// Marks a model restored from persisted statistics as fitted.
    protected final void markRestored() {
        state = FitState.FITTED;
        checkFitted();
    }

    /// Creates a fresh quantile mapper with the configured options.
    protected QuantileMapper newQuantileMapper() {
        return new EmpiricalQuantileMapper(config.getQuantileMapping());
    }

    /// Verifies that a reassembled series kept the index of its input.
    ///
    /// @throws IllegalStateException if a sample was lost, duplicated or moved
    protected static void checkAligned(TimeSeries input, TimeSeries output, String stage) {
        if (output.size() != input.size() || !output.hasSameIndex(input)) {
            throw new IllegalStateException(String.format(
                "%s output is misaligned: expected %d samples on the input index, got %d",
                stage, input.size(), output.size()));
        }
    }

    protected String modelName() {
        return getClass().getSimpleName();
    }

    /// Returns the fitted attributes by name, in a stable order, with null for absent ones.
    protected abstract Map<String, Object> fittedAttributes();

    /// Drops all fitted statistics.
    protected abstract void clearFitted();

    /// Computes the fitted statistics and stores them only once all are computed.
    protected abstract void fitModel(TimeSeries source, TimeSeries target);

    protected abstract TimeSeries predictModel(TimeSeries source);

    protected abstract M self();
}
