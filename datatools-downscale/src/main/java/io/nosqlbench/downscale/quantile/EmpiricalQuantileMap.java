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
import io.nosqlbench.downscale.state.TypeName;

import java.util.Arrays;
import java.util.Objects;

/**
 * Quantile map storing reference quantiles at evenly spaced probabilities.
 *
 * <h2>Algorithm</h2>
 *
 * <p>Fitting sorts the reference data and records its value at {@code q}
 * probabilities {@code 0, 1/(q-1), ..., 1}, using linear interpolation between
 * order statistics. With {@code q} equal to the sample count every order
 * statistic is kept exactly.
 *
 * <p>Both lookups interpolate linearly between stored points. When several
 * stored quantiles are equal (tied reference values), {@link #cdf(double)}
 * returns the midpoint of their probabilities, so ties are ranked by their
 * average position.
 */
@TypeName(EmpiricalQuantileMap.MAP_TYPE)
public final class EmpiricalQuantileMap implements QuantileMap {

    public static final String MAP_TYPE = "empirical";

    @SerializedName("references")
    private final double[] references;

    @SerializedName("quantiles")
    private final double[] quantiles;

    @SerializedName("samples")
    private final int sampleCount;

    /**
     * Constructs a map from precomputed reference points.
     *
     * @param references cumulative probabilities, non-decreasing, within [0, 1]
     * @param quantiles reference values at those probabilities, non-decreasing
     * @param sampleCount number of samples the points were computed from
     */
    public EmpiricalQuantileMap(double[] references, double[] quantiles, int sampleCount) {
        Objects.requireNonNull(references, "references cannot be null");
        Objects.requireNonNull(quantiles, "quantiles cannot be null");
        if (references.length != quantiles.length) {
            throw new IllegalArgumentException("references and quantiles must have same length");
        }
        if (references.length < 2) {
            throw new IllegalArgumentException("Need at least 2 reference points");
        }
        for (int i = 1; i < references.length; i++) {
            if (references[i] < references[i - 1] || quantiles[i] < quantiles[i - 1]) {
                throw new IllegalArgumentException("reference points must be non-decreasing");
            }
        }
        if (references[0] < 0.0 || references[references.length - 1] > 1.0) {
            throw new IllegalArgumentException("references must lie within [0, 1]");
        }
        this.references = Arrays.copyOf(references, references.length);
        this.quantiles = Arrays.copyOf(quantiles, quantiles.length);
        this.sampleCount = sampleCount;
    }

    /**
     * Builds a quantile map from observed data.
     *
     * @param values the reference values, NaN not allowed
     * @param quantileCount number of stored quantiles; 0 or less keeps one per sample.
     *                      Capped at the sample count, and at least 2.
     * @return the fitted map
     */
    public static EmpiricalQuantileMap fromData(double[] values, int quantileCount) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }
        double[] sorted = values.clone();
        for (double v : sorted) {
            if (Double.isNaN(v)) {
                throw new IllegalArgumentException("values cannot contain NaN");
            }
        }
        Arrays.sort(sorted);

        int n = sorted.length;
        int q = quantileCount <= 0 ? n : Math.min(quantileCount, n);
        q = Math.max(q, 2);

        double[] references = new double[q];
        double[] quantiles = new double[q];
        for (int k = 0; k < q; k++) {
            references[k] = (double) k / (q - 1);
            quantiles[k] = percentile(sorted, references[k]);
        }
        references[q - 1] = 1.0;
        return new EmpiricalQuantileMap(references, quantiles, n);
    }

    /// Linear interpolation between order statistics at probability p.
    private static double percentile(double[] sorted, double p) {
        double pos = p * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = pos - lo;
        return sorted[lo] + frac * (sorted[hi] - sorted[lo]);
    }

    @Override
    public String getMapType() {
        return MAP_TYPE;
    }

    @Override
    public double cdf(double x) {
        int last = quantiles.length - 1;
        if (x < quantiles[0]) return references[0];
        if (x > quantiles[last]) return references[last];

        // first index with quantiles[lo] >= x
        int lo = 0;
        int hi = last + 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (quantiles[mid] < x) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        int first = lo;

        if (quantiles[first] == x) {
            int end = first;
            while (end < last && quantiles[end + 1] == x) {
                end++;
            }
            return 0.5 * (references[first] + references[end]);
        }

        int below = first - 1;
        double t = (x - quantiles[below]) / (quantiles[first] - quantiles[below]);
        return references[below] + t * (references[first] - references[below]);
    }

    @Override
    public double quantile(double u) {
        int last = references.length - 1;
        if (u <= references[0]) return quantiles[0];
        if (u >= references[last]) return quantiles[last];

        // last index with references[lo] <= u
        int lo = 0;
        int hi = last;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (references[mid] <= u) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        double refLo = references[lo];
        double refHi = references[lo + 1];
        if (refHi == refLo) {
            return quantiles[lo];
        }
        double t = (u - refLo) / (refHi - refLo);
        return quantiles[lo] + t * (quantiles[lo + 1] - quantiles[lo]);
    }

    @Override
    public double getMin() {
        return quantiles[0];
    }

    @Override
    public double getMax() {
        return quantiles[quantiles.length - 1];
    }

    @Override
    public int getSampleCount() {
        return sampleCount;
    }

    public double[] getReferences() {
        return Arrays.copyOf(references, references.length);
    }

    public double[] getQuantiles() {
        return Arrays.copyOf(quantiles, quantiles.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmpiricalQuantileMap)) return false;
        EmpiricalQuantileMap that = (EmpiricalQuantileMap) o;
        return sampleCount == that.sampleCount &&
               Arrays.equals(references, that.references) &&
               Arrays.equals(quantiles, that.quantiles);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(references);
        result = 31 * result + Arrays.hashCode(quantiles);
        return 31 * result + sampleCount;
    }

    @Override
    public String toString() {
        return "EmpiricalQuantileMap[quantiles=" + quantiles.length + ", samples=" + sampleCount
            + ", range=[" + getMin() + ", " + getMax() + "]]";
    }
}
