package io.nosqlbench.downscale.series;

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

import io.nosqlbench.downscale.MalformedSeriesException;

import java.util.Objects;

/// Verifies that a series index is gapless at a given resolution.
public final class SeriesIndexValidator {

    private SeriesIndexValidator() {
        // Utility class
    }

    /// Checks that every timestamp directly follows its predecessor at `resolution`.
    ///
    /// @param series the series to check
    /// @param resolution the expected sampling resolution
    /// @return the same series, for chaining
    /// @throws MalformedSeriesException if the series is empty or has a gap or repeat
    public static TimeSeries checkResolution(TimeSeries series, Resolution resolution) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(resolution, "resolution cannot be null");
        if (series.isEmpty()) {
            throw new MalformedSeriesException("series '" + series.getName() + "' is empty");
        }
        for (int i = 1; i < series.size(); i++) {
            if (!resolution.isSuccessor(series.dateAt(i - 1), series.dateAt(i))) {
                throw new MalformedSeriesException(String.format(
                    "series '%s' is not %s at position %d: %s follows %s",
                    series.getName(), resolution.name().toLowerCase(), i,
                    series.dateAt(i), series.dateAt(i - 1)));
            }
        }
        return series;
    }
}
