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

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/// Centered moving average that shrinks at the edges.
///
/// For window `w` the value at position `i` averages positions
/// `i - w / 2 .. i + (w - 1) / 2`, clipped to the array. A position yields NaN
/// only when fewer than `minPeriods` non-NaN values fall inside its window.
///
/// ```
///   w = 9, minPeriods = 1
///   i = 0    ──► mean(x[0..4])
///   i = 10   ──► mean(x[6..14])
///   i = n-1  ──► mean(x[n-5..n-1])
/// ```
public final class RollingMean {

    /// Default window length, in samples.
    public static final int DEFAULT_WINDOW = 9;

    /// Default minimum number of valid samples per window.
    public static final int DEFAULT_MIN_PERIODS = 1;

    @SerializedName("window")
    private final int window;

    @SerializedName("min_periods")
    private final int minPeriods;

    public RollingMean(int window, int minPeriods) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1, got " + window);
        }
        if (minPeriods < 1 || minPeriods > window) {
            throw new IllegalArgumentException("minPeriods must be in [1, window], got " + minPeriods);
        }
        this.window = window;
        this.minPeriods = minPeriods;
    }

    public static RollingMean defaults() {
        return new RollingMean(DEFAULT_WINDOW, DEFAULT_MIN_PERIODS);
    }

    public int getWindow() {
        return window;
    }

    public int getMinPeriods() {
        return minPeriods;
    }

    /// @param values the samples, in time order
    /// @return the centered rolling mean, same length
    public double[] apply(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        int n = values.length;
        int before = window / 2;
        int after = (window - 1) / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - before);
            int to = Math.min(n - 1, i + after);
            double sum = 0.0;
            int valid = 0;
            for (int j = from; j <= to; j++) {
                if (!Double.isNaN(values[j])) {
                    sum += values[j];
                    valid++;
                }
            }
            out[i] = valid >= minPeriods ? sum / valid : Double.NaN;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RollingMean)) return false;
        RollingMean that = (RollingMean) o;
        return window == that.window && minPeriods == that.minPeriods;
    }

    @Override
    public int hashCode() {
        return 31 * window + minPeriods;
    }

    @Override
    public String toString() {
        return "RollingMean[window=" + window + ", minPeriods=" + minPeriods + "]";
    }
}
