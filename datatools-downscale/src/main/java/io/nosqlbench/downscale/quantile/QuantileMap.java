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

/// Fitted empirical distribution of one group's reference data.
///
/// ## Purpose
///
/// A quantile map is the fitted half of a quantile-mapping transform: it holds
/// the reference (target) distribution and answers inverse-CDF lookups. The
/// query half is computed fresh at transform time from the query itself.
///
/// ```
///   query value ──► rank in query ECDF ──► u ∈ [0,1] ──► quantile(u) ──► mapped value
///                                                        (this type)
/// ```
///
/// ## Implementations
///
/// | Map Type | Representation |
/// |----------|----------------|
/// | [EmpiricalQuantileMap] | sorted reference quantiles at evenly spaced probabilities |
/// | [HistogramQuantileMap] | equal-width histogram with piecewise-linear CDF |
///
/// Implementations are immutable and safe to share across threads.
public interface QuantileMap {

    /// Returns the map type identifier used for serialization.
    String getMapType();

    /// Evaluates the fitted CDF at `x`.
    ///
    /// @param x the value
    /// @return the cumulative probability, in [0, 1]
    double cdf(double x);

    /// Evaluates the fitted inverse CDF at `u`.
    ///
    /// Probabilities outside [0, 1] are clamped.
    ///
    /// @param u the cumulative probability
    /// @return the reference value at that probability
    double quantile(double u);

    /// Returns the smallest reference value.
    double getMin();

    /// Returns the largest reference value.
    double getMax();

    /// Returns the number of reference samples the map was fitted from.
    int getSampleCount();
}
