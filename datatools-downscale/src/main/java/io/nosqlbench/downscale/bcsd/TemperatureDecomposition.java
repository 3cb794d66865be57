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

import io.nosqlbench.downscale.series.TimeSeries;

/// Every intermediate series of a temperature prediction, all on the query index.
///
/// @param trend the monthly rolling-mean trend of the query
/// @param shift the trend minus the source climatology
/// @param detrended the query minus the shift
/// @param quantileMapped the detrended series after quantile mapping
/// @param shiftRestored the quantile-mapped series plus the shift
/// @param result the prediction: the shift-restored series, or its anomaly from the target climatology
public record TemperatureDecomposition(
    TimeSeries trend,
    TimeSeries shift,
    TimeSeries detrended,
    TimeSeries quantileMapped,
    TimeSeries shiftRestored,
    TimeSeries result
) {
}
