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
import java.util.Objects;

/// Orientation normalization for tabular input.
///
/// Callers that hold their data as a matrix may pass either a column
/// (`n x 1`) or a row (`1 x n`); both are normalized to a single-column
/// [TimeSeries]. Multi-column input must name the column to use.
public final class SeriesShapes {

    private SeriesShapes() {
        // Utility class
    }

    /// Normalizes an `n x 1` or `1 x n` matrix to a single-column series.
    ///
    /// @param name the column name for the result
    /// @param index the timestamps, one per sample
    /// @param data the sample matrix
    /// @return the single-column series
    /// @throws MalformedSeriesException if the matrix has more than one column, or its
    ///         sample count does not match the index
    public static TimeSeries singleColumn(String name, LocalDate[] index, double[][] data) {
        Objects.requireNonNull(index, "index cannot be null");
        Objects.requireNonNull(data, "data cannot be null");

        if (data.length == 1 && data[0].length == index.length && index.length != 1) {
            return new TimeSeries(name, index, data[0].clone());
        }
        if (data.length != index.length) {
            throw new MalformedSeriesException(String.format(
                "data shape (%d x %d) does not match an index of %d timestamps",
                data.length, data.length == 0 ? 0 : data[0].length, index.length));
        }
        double[] column = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            if (data[i].length != 1) {
                throw new MalformedSeriesException(String.format(
                    "expected a single column but row %d has %d columns; select a column explicitly",
                    i, data[i].length));
            }
            column[i] = data[i][0];
        }
        return new TimeSeries(name, index, column);
    }

    /// Selects one column out of a row-major `n x k` matrix.
    ///
    /// @param name the column name for the result
    /// @param index the timestamps, one per row
    /// @param data the sample matrix
    /// @param column the column to select
    /// @return the selected column as a series
    public static TimeSeries column(String name, LocalDate[] index, double[][] data, int column) {
        Objects.requireNonNull(index, "index cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        if (data.length != index.length) {
            throw new MalformedSeriesException(String.format(
                "data has %d rows but the index has %d timestamps", data.length, index.length));
        }
        double[] values = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            if (column < 0 || column >= data[i].length) {
                throw new MalformedSeriesException(String.format(
                    "column %d is out of range for row %d with %d columns", column, i, data[i].length));
            }
            values[i] = data[i][column];
        }
        return new TimeSeries(name, index, values);
    }
}
