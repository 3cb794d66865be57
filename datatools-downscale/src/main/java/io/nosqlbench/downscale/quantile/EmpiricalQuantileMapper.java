package io.nosqlbench.downscale.quantile;

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

import org.apache.commons.math3.analysis.interpolation.LoessInterpolator;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/// Rank-based quantile mapper over empirical distributions.
///
/// ## Transform
///
/// ```
///   query ──► [detrend] ──► rank u_i in the query's own ECDF
///         ──► y_i = map.quantile(u_i)
///         ──► [extrapolate tails] ──► [restore trend] ──► output
/// ```
///
/// Ranking uses the query's own empirical CDF with ties averaged, so equal
/// query values always map to equal outputs. Missing (NaN) query values are
/// left out of the ranking and come back as NaN.
///
/// With `detrend`, a LOESS trend is fitted over the query in time order and
/// its deviation from its own mean is removed before ranking and added back
/// afterwards. The level of the query is left in place; only the slope is
/// shielded from the mapping.
public final class EmpiricalQuantileMapper implements QuantileMapper {

    private static final Logger logger = LogManager.getLogger(EmpiricalQuantileMapper.class);

    private final QuantileMapperOptions options;

    public EmpiricalQuantileMapper(QuantileMapperOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public QuantileMapperOptions getOptions() {
        return options;
    }

    @Override
    public int minSamples() {
        return options.getMinSamples();
    }

    @Override
    public QuantileMap fit(double[] reference) {
        Objects.requireNonNull(reference, "reference cannot be null");
        if (reference.length < options.getMinSamples()) {
            throw new IllegalArgumentException(String.format(
                "need at least %d reference samples, got %d", options.getMinSamples(), reference.length));
        }
        return switch (options.getMethod()) {
            case EMPIRICAL -> EmpiricalQuantileMap.fromData(reference, options.getQuantiles());
            case HISTOGRAM -> HistogramQuantileMap.fromData(reference, options.getBins());
        };
    }

    @Override
    public double[] transform(QuantileMap map, double[] query) {
        Objects.requireNonNull(map, "map cannot be null");
        Objects.requireNonNull(query, "query cannot be null");
        int[] present = IntStream.range(0, query.length).filter(i -> !Double.isNaN(query[i])).toArray();
        if (present.length == query.length) {
            return transformPresent(map, query, null);
        }

        double[] values = new double[present.length];
        double[] times = new double[present.length];
        for (int k = 0; k < present.length; k++) {
            values[k] = query[present[k]];
            times[k] = present[k];
        }
        double[] mapped = transformPresent(map, values, times);
        double[] out = new double[query.length];
        Arrays.fill(out, Double.NaN);
        for (int k = 0; k < present.length; k++) {
            out[present[k]] = mapped[k];
        }
        logger.debug("Passed {} missing values through quantile mapping", query.length - present.length);
        return out;
    }

    /// Maps a query without missing values. `times` are the sample positions used
    /// for detrending, or null for consecutive positions.
    private double[] transformPresent(QuantileMap map, double[] query, double[] times) {
        int n = query.length;
        if (n == 0) {
            return new double[0];
        }

        double[] anomaly = options.isDetrend() ? centeredTrend(query, times) : null;
        double[] x = query;
        if (anomaly != null) {
            x = new double[n];
            for (int i = 0; i < n; i++) {
                x[i] = query[i] - anomaly[i];
            }
        }

        EmpiricalQuantileMap ranks = EmpiricalQuantileMap.fromData(x, 0);
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = map.quantile(ranks.cdf(x[i]));
        }

        if (options.getExtrapolate() != QuantileMapperOptions.Extrapolation.NONE) {
            extrapolateTails(x, y);
        }

        if (anomaly != null) {
            for (int i = 0; i < n; i++) {
                y[i] += anomaly[i];
            }
        }
        return y;
    }

    /// LOESS trend minus its mean, or null when the query is too short to smooth.
    private double[] centeredTrend(double[] query, double[] times) {
        int n = query.length;
        double bandwidth = options.getLoessBandwidth();
        if (n * bandwidth < 2.0) {
            logger.warn("Skipping detrend: {} samples is too few for LOESS bandwidth {}", n, bandwidth);
            return null;
        }
        double[] t = times;
        if (t == null) {
            t = new double[n];
            for (int i = 0; i < n; i++) {
                t[i] = i;
            }
        }
        double[] trend = new LoessInterpolator(bandwidth, LoessInterpolator.DEFAULT_ROBUSTNESS_ITERS)
            .smooth(t, query);
        double mean = Arrays.stream(trend).average().orElse(0.0);
        for (int i = 0; i < n; i++) {
            trend[i] -= mean;
        }
        return trend;
    }

    /// Replaces the `endpoints` most extreme samples on each requested side.
    ///
    /// The replacement is anchored on the interior: a least-squares line through
    /// the next `endpoints` samples inward (or a unit-slope line through the
    /// innermost interior sample for `1to1`).
    private void extrapolateTails(double[] x, double[] y) {
        int n = x.length;
        int k = options.getEndpoints();
        if (n < 2 * k + 1) {
            logger.debug("Skipping tail extrapolation: {} samples for {} endpoints", n, k);
            return;
        }
        int[] order = IntStream.range(0, n).boxed()
            .sorted(Comparator.comparingDouble(i -> x[i]))
            .mapToInt(Integer::intValue)
            .toArray();

        QuantileMapperOptions.Extrapolation mode = options.getExtrapolate();
        if (mode.extendsLower()) {
            extendTail(x, y, order, 0, k, k, 2 * k, mode);
        }
        if (mode.extendsUpper()) {
            extendTail(x, y, order, n - k, n, n - 2 * k, n - k, mode);
        }
    }

    private void extendTail(double[] x, double[] y, int[] order,
                            int tailFrom, int tailTo, int fitFrom, int fitTo,
                            QuantileMapperOptions.Extrapolation mode) {
        if (mode == QuantileMapperOptions.Extrapolation.ONE_TO_ONE) {
            int anchor = tailFrom == 0 ? order[fitFrom] : order[fitTo - 1];
            for (int r = tailFrom; r < tailTo; r++) {
                int i = order[r];
                y[i] = y[anchor] + (x[i] - x[anchor]);
            }
            return;
        }

        SimpleRegression line = new SimpleRegression();
        for (int r = fitFrom; r < fitTo; r++) {
            line.addData(x[order[r]], y[order[r]]);
        }
        double slope = line.getSlope();
        if (Double.isNaN(slope)) {
            logger.debug("Skipping tail extrapolation: interior points have no spread");
            return;
        }
        double intercept = line.getIntercept();
        for (int r = tailFrom; r < tailTo; r++) {
            int i = order[r];
            y[i] = intercept + slope * x[i];
        }
    }

    @Override
    public String toString() {
        return "EmpiricalQuantileMapper[" + options + "]";
    }
}
