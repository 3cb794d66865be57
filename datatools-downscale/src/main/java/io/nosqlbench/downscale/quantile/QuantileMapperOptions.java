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

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/// Options forwarded verbatim to every quantile mapper a model fits.
///
/// | Option | Default | Meaning |
/// |--------|---------|---------|
/// | `method` | `empirical` | how the reference distribution is stored |
/// | `quantiles` | 0 | stored quantiles for `empirical`; 0 keeps one per sample |
/// | `bins` | 100 | histogram bins for `histogram` |
/// | `extrapolate` | `none` | tail handling for query values beyond the reference range |
/// | `endpoints` | 10 | tail samples replaced when extrapolating |
/// | `detrend` | false | remove a LOESS trend from the query before ranking |
/// | `loess_bandwidth` | 0.3 | LOESS bandwidth, as a fraction of the query length |
/// | `min_samples` | 2 | smallest group that may be fitted |
public final class QuantileMapperOptions {

    /// How the fitted reference distribution is represented.
    public enum Method {
        /// Sorted reference quantiles, see [EmpiricalQuantileMap].
        @SerializedName("empirical")
        EMPIRICAL,
        /// Equal-width histogram, see [HistogramQuantileMap].
        @SerializedName("histogram")
        HISTOGRAM
    }

    /// Tail handling for the most extreme query samples.
    ///
    /// Plain quantile mapping pins the smallest and largest query values to the
    /// reference extremes. Extrapolation instead extends the interior mapping
    /// linearly into the tails.
    public enum Extrapolation {
        /// Keep the mapped values as they are.
        @SerializedName("none")
        NONE,
        /// Extend the lower tail along a line fitted to the neighbouring interior points.
        @SerializedName("min")
        MIN,
        /// Extend the upper tail along a line fitted to the neighbouring interior points.
        @SerializedName("max")
        MAX,
        /// Extend both tails along fitted lines.
        @SerializedName("both")
        BOTH,
        /// Extend both tails with unit slope from the innermost interior point.
        @SerializedName("1to1")
        ONE_TO_ONE;

        boolean extendsLower() {
            return this == MIN || this == BOTH || this == ONE_TO_ONE;
        }

        boolean extendsUpper() {
            return this == MAX || this == BOTH || this == ONE_TO_ONE;
        }
    }

    @SerializedName("method")
    private final Method method;

    @SerializedName("quantiles")
    private final int quantiles;

    @SerializedName("bins")
    private final int bins;

    @SerializedName("extrapolate")
    private final Extrapolation extrapolate;

    @SerializedName("endpoints")
    private final int endpoints;

    @SerializedName("detrend")
    private final boolean detrend;

    @SerializedName("loess_bandwidth")
    private final double loessBandwidth;

    @SerializedName("min_samples")
    private final int minSamples;

    // Gson entry point; options absent from the JSON keep their defaults
    private QuantileMapperOptions() {
        this(new Builder());
    }

    private QuantileMapperOptions(Builder builder) {
        this.method = builder.method;
        this.quantiles = builder.quantiles;
        this.bins = builder.bins;
        this.extrapolate = builder.extrapolate;
        this.endpoints = builder.endpoints;
        this.detrend = builder.detrend;
        this.loessBandwidth = builder.loessBandwidth;
        this.minSamples = builder.minSamples;
    }

    /// Returns the default options.
    public static QuantileMapperOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Method getMethod() {
        return method;
    }

    public int getQuantiles() {
        return quantiles;
    }

    public int getBins() {
        return bins;
    }

    public Extrapolation getExtrapolate() {
        return extrapolate;
    }

    public int getEndpoints() {
        return endpoints;
    }

    public boolean isDetrend() {
        return detrend;
    }

    public double getLoessBandwidth() {
        return loessBandwidth;
    }

    public int getMinSamples() {
        return minSamples;
    }

    /// Returns a builder initialized from these options.
    public Builder toBuilder() {
        return new Builder()
            .method(method)
            .quantiles(quantiles)
            .bins(bins)
            .extrapolate(extrapolate)
            .endpoints(endpoints)
            .detrend(detrend)
            .loessBandwidth(loessBandwidth)
            .minSamples(minSamples);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuantileMapperOptions)) return false;
        QuantileMapperOptions that = (QuantileMapperOptions) o;
        return quantiles == that.quantiles && bins == that.bins && endpoints == that.endpoints
            && detrend == that.detrend && Double.compare(loessBandwidth, that.loessBandwidth) == 0
            && minSamples == that.minSamples && method == that.method && extrapolate == that.extrapolate;
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, quantiles, bins, extrapolate, endpoints, detrend, loessBandwidth, minSamples);
    }

    @Override
    public String toString() {
        return "QuantileMapperOptions[method=" + method + ", quantiles=" + quantiles + ", bins=" + bins
            + ", extrapolate=" + extrapolate + ", endpoints=" + endpoints + ", detrend=" + detrend
            + ", loessBandwidth=" + loessBandwidth + ", minSamples=" + minSamples + "]";
    }

    /// Builder for [QuantileMapperOptions]; validates on [#build()].
    public static final class Builder {
        private Method method = Method.EMPIRICAL;
        private int quantiles = 0;
        private int bins = 100;
        private Extrapolation extrapolate = Extrapolation.NONE;
        private int endpoints = 10;
        private boolean detrend = false;
        private double loessBandwidth = 0.3;
        private int minSamples = 2;

        public Builder method(Method method) {
            this.method = Objects.requireNonNull(method, "method cannot be null");
            return this;
        }

        public Builder quantiles(int quantiles) {
            this.quantiles = quantiles;
            return this;
        }

        public Builder bins(int bins) {
            this.bins = bins;
            return this;
        }

        public Builder extrapolate(Extrapolation extrapolate) {
            this.extrapolate = Objects.requireNonNull(extrapolate, "extrapolate cannot be null");
            return this;
        }

        public Builder endpoints(int endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        public Builder detrend(boolean detrend) {
            this.detrend = detrend;
            return this;
        }

        public Builder loessBandwidth(double loessBandwidth) {
            this.loessBandwidth = loessBandwidth;
            return this;
        }

        public Builder minSamples(int minSamples) {
            this.minSamples = minSamples;
            return this;
        }

        public QuantileMapperOptions build() {
            if (quantiles < 0) {
                throw new IllegalArgumentException("quantiles must be non-negative, got " + quantiles);
            }
            if (bins < 1) {
                throw new IllegalArgumentException("bins must be at least 1, got " + bins);
            }
            if (endpoints < 1) {
                throw new IllegalArgumentException("endpoints must be at least 1, got " + endpoints);
            }
            if (!(loessBandwidth > 0.0 && loessBandwidth <= 1.0)) {
                throw new IllegalArgumentException("loessBandwidth must be in (0, 1], got " + loessBandwidth);
            }
            if (minSamples < 1) {
                throw new IllegalArgumentException("minSamples must be at least 1, got " + minSamples);
            }
            return new QuantileMapperOptions(this);
        }
    }
}
