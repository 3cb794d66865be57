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

/// Distribution-mapping primitive: fits a reference distribution and maps
/// query values onto it by rank.
///
/// ## Usage
///
/// ```java
/// QuantileMapper mapper = new EmpiricalQuantileMapper(QuantileMapperOptions.defaults());
/// QuantileMap map = mapper.fit(observedJanuaries);
/// double[] corrected = mapper.transform(map, simulatedJanuaries);
/// ```
///
/// Implementations hold configuration only; fitted state lives in the returned
/// [QuantileMap], so one mapper serves any number of groups.
///
/// @see QuantileMapperRegistry
public interface QuantileMapper {

    /// Fits a quantile map to reference data.
    ///
    /// @param reference the reference values, at least [#minSamples()] of them
    /// @return the fitted map
    QuantileMap fit(double[] reference);

    /// Maps each query value onto the fitted reference distribution.
    ///
    /// @param map a map produced by [#fit(double[])]
    /// @param query the values to map, in time order; NaN marks a missing value
    /// @return one mapped value per query value, in the same order, NaN where the query is NaN
    double[] transform(QuantileMap map, double[] query);

    /// Returns the smallest sample count that [#fit(double[])] accepts.
    default int minSamples() {
        return 1;
    }
}
