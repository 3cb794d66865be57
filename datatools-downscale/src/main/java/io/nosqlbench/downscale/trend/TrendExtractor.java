package io.nosqlbench.downscale.trend;

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

import io.nosqlbench.downscale.grouping.TimeGrouping;
import io.nosqlbench.downscale.series.TimeSeries;

import java.util.Objects;

/// Extracts a smooth long-term signal from a series.
///
/// The series is split by a recurring grouping (calendar month by default) and
/// a [RollingMean] runs along each group in time order, so every January is
/// smoothed against neighbouring Januaries only. The result has the same index
/// as the input.
public final class TrendExtractor {

    private final TimeGrouping grouping;
    private final RollingMean rollingMean;

    public TrendExtractor(TimeGrouping grouping, RollingMean rollingMean) {
        this.grouping = Objects.requireNonNull(grouping, "grouping cannot be null");
        this.rollingMean = Objects.requireNonNull(rollingMean, "rollingMean cannot be null");
    }

    /// Trend extractor over calendar months.
    public static TrendExtractor monthly(RollingMean rollingMean) {
        return new TrendExtractor(TimeGrouping.monthly(), rollingMean);
    }

    /// @param series the series to smooth
    /// @return the per-group rolling mean, index-aligned with `series`
    public TimeSeries extract(TimeSeries series) {
        return grouping.partition(series).apply(group -> rollingMean.apply(group.values()));
    }

    public TimeGrouping getGrouping() {
        return grouping;
    }

    public RollingMean getRollingMean() {
        return rollingMean;
    }
}
