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

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.Objects;

/// Single-column time series indexed by strictly increasing calendar dates.
///
/// ## Invariants
///
/// - the index and the values have the same length
/// - the index is strictly increasing (monotonic and duplicate free)
///
/// Gaplessness at a given [Resolution] is checked separately by
/// [SeriesIndexValidator], since the same series type carries both monthly and
/// daily data.
///
/// Instances are immutable; accessors return copies.
public final class TimeSeries {

    /// Default column name used when none is given.
    public static final String DEFAULT_NAME = "value";

    private final String name;
    private final LocalDate[] index;
    private final double[] values;

    /// Creates a series from parallel index and value arrays.
    ///
    /// @param name the column name
    /// @param index the timestamps, strictly increasing
    /// @param values the sample values
    /// @throws MalformedSeriesException if the index is not strictly increasing or the lengths differ
    public TimeSeries(String name, LocalDate[] index, double[] values) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(index, "index cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (index.length != values.length) {
            throw new MalformedSeriesException(String.format(
                "index has %d timestamps but there are %d values", index.length, values.length));
        }
        for (int i = 0; i < index.length; i++) {
            if (index[i] == null) {
                throw new MalformedSeriesException("null timestamp at position " + i);
            }
            if (i > 0 && !index[i - 1].isBefore(index[i])) {
                throw new MalformedSeriesException(String.format(
                    "index is not strictly increasing at position %d: %s follows %s",
                    i, index[i], index[i - 1]));
            }
        }
        this.name = name;
        this.index = index.clone();
        this.values = values.clone();
    }

    /// Creates a series with the default column name.
    public static TimeSeries of(LocalDate[] index, double[] values) {
        return new TimeSeries(DEFAULT_NAME, index, values);
    }

    /// Creates a monthly series stamped on the first day of each consecutive month.
    ///
    /// @param start the first month
    /// @param values one value per month
    /// @return the monthly series
    public static TimeSeries monthly(YearMonth start, double[] values) {
        LocalDate[] index = new LocalDate[values.length];
        for (int i = 0; i < values.length; i++) {
            index[i] = start.plusMonths(i).atDay(1);
        }
        return new TimeSeries(DEFAULT_NAME, index, values);
    }

    /// Creates a daily series covering consecutive days from `start`.
    ///
    /// @param start the first day
    /// @param values one value per day
    /// @return the daily series
    public static TimeSeries daily(LocalDate start, double[] values) {
        LocalDate[] index = new LocalDate[values.length];
        for (int i = 0; i < values.length; i++) {
            index[i] = start.plusDays(i);
        }
        return new TimeSeries(DEFAULT_NAME, index, values);
    }

    public String getName() {
        return name;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public LocalDate dateAt(int position) {
        return index[position];
    }

    public double valueAt(int position) {
        return values[position];
    }

    /// Returns a copy of the timestamp index.
    public LocalDate[] getIndex() {
        return index.clone();
    }

    /// Returns a copy of the values.
    public double[] getValues() {
        return values.clone();
    }

    /// Returns a series on the same index carrying new values.
    ///
    /// @param newValues one value per timestamp
    /// @return the new series
    public TimeSeries withValues(double[] newValues) {
        return new TimeSeries(name, index, newValues);
    }

    /// Returns whether `other` has exactly the same timestamps in the same order.
    public boolean hasSameIndex(TimeSeries other) {
        return Arrays.equals(index, other.index);
    }

    /// Elementwise `this - other` on a shared index.
    public TimeSeries minus(TimeSeries other) {
        requireSameIndex(other);
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] - other.values[i];
        }
        return withValues(out);
    }

    /// Elementwise `this + other` on a shared index.
    public TimeSeries plus(TimeSeries other) {
        requireSameIndex(other);
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] + other.values[i];
        }
        return withValues(out);
    }

    private void requireSameIndex(TimeSeries other) {
        if (!hasSameIndex(other)) {
            throw new IllegalStateException(String.format(
                "series are not index-aligned: %d vs %d samples", size(), other.size()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries)) return false;
        TimeSeries that = (TimeSeries) o;
        return name.equals(that.name) && Arrays.equals(index, that.index) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + Arrays.hashCode(index);
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    @Override
    public String toString() {
        if (values.length == 0) {
            return "TimeSeries[" + name + ", empty]";
        }
        return "TimeSeries[" + name + ", n=" + values.length + ", " + index[0] + " .. " + index[index.length - 1] + "]";
    }
}
