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
 * Quantile map based on an equal-width histogram of the reference data.
 *
 * <h2>Algorithm</h2>
 *
 * <p>The map builds a piecewise linear approximation of the CDF:
 * <ol>
 *   <li>Bin the reference data into a histogram</li>
 *   <li>Convert counts to a cumulative distribution at the bin edges</li>
 *   <li>For inverse lookups: binary search to find the bin, then linear interpolation</li>
 * </ol>
 *
 * <p>Compared with {@link EmpiricalQuantileMap} the stored size is bounded by the
 * bin count rather than the sample count, at the cost of binning resolution.
 */
@TypeName(HistogramQuantileMap.MAP_TYPE)
public final class HistogramQuantileMap implements QuantileMap {

    public static final String MAP_TYPE = "histogram";

    @SerializedName("bins")
    private final double[] binEdges;      // binCount + 1 edges

    @SerializedName("cdf")
    private final double[] cdf;           // binCount + 1 cumulative probabilities

    @SerializedName("samples")
    private final int sampleCount;

    /**
     * Constructs a histogram map from precomputed histogram data.
     *
     * @param binEdges the bin edges (length = binCount + 1)
     * @param cdf the cumulative distribution values at each edge (length = binCount + 1)
     * @param sampleCount number of samples the histogram was built from
     */
    public HistogramQuantileMap(double[] binEdges, double[] cdf, int sampleCount) {
        Objects.requireNonNull(binEdges, "binEdges cannot be null");
        Objects.requireNonNull(cdf, "cdf cannot be null");
        if (binEdges.length != cdf.length) {
            throw new IllegalArgumentException("binEdges and cdf must have same length");
        }
        if (binEdges.length < 2) {
            throw new IllegalArgumentException("Need at least 2 bin edges (1 bin)");
        }
        this.binEdges = Arrays.copyOf(binEdges, binEdges.length);
        this.cdf = Arrays.copyOf(cdf, cdf.length);
        this.sampleCount = sampleCount;
    }

    /**
     * Builds a histogram map from reference data.
     *
     * @param values the reference values
     * @param binCount the number of histogram bins
     * @return the fitted map
     */
    public static HistogramQuantileMap fromData(double[] values, int binCount) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }
        if (binCount < 1) {
            throw new IllegalArgumentException("binCount must be at least 1");
        }

        double min = values[0];
        double max = values[0];
        for (double v : values) {
            if (Double.isNaN(v)) {
                throw new IllegalArgumentException("values cannot contain NaN");
            }
            if (v < min) min = v;
            if (v > max) max = v;
        }

        // All values identical: a single zero-width bin
        if (max == min) {
            return new HistogramQuantileMap(new double[]{min, max}, new double[]{0.0, 1.0}, values.length);
        }

        double[] binEdges = new double[binCount + 1];
        int[] counts = new int[binCount];
        double binWidth = (max - min) / binCount;

        for (int i = 0; i <= binCount; i++) {
            binEdges[i] = min + i * binWidth;
        }
        binEdges[binCount] = max;

        for (double v : values) {
            int bin = (int) ((v - min) / binWidth);
            if (bin >= binCount) bin = binCount - 1;
            if (bin < 0) bin = 0;
            counts[bin]++;
        }

        double[] cdf = new double[binCount + 1];
        cdf[0] = 0.0;
        int cumulative = 0;
        for (int i = 0; i < binCount; i++) {
            cumulative += counts[i];
            cdf[i + 1] = (double) cumulative / values.length;
        }
        cdf[binCount] = 1.0;

        return new HistogramQuantileMap(binEdges, cdf, values.length);
    }

    @Override
    public String getMapType() {
        return MAP_TYPE;
    }

    @Override
    public double cdf(double x) {
        double min = getMin();
        double max = getMax();
        if (x <= min) return 0.0;
        if (x >= max) return 1.0;

        int count = getBinCount();
        double binWidth = (max - min) / count;
        int bin = (int) ((x - min) / binWidth);
        if (bin >= count) bin = count - 1;
        if (bin < 0) bin = 0;

        double edgeLo = binEdges[bin];
        double edgeHi = binEdges[bin + 1];
        double t = (x - edgeLo) / (edgeHi - edgeLo);

        return cdf[bin] + t * (cdf[bin + 1] - cdf[bin]);
    }

    @Override
    public double quantile(double u) {
        if (u <= 0.0) return getMin();
        if (u >= 1.0) return getMax();

        // Binary search to find the bin
        int lo = 0;
        int hi = getBinCount();
        while (lo < hi) {
            int mid = (lo + hi) / 2;
            if (cdf[mid + 1] < u) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        if (lo >= getBinCount()) {
            return getMax();
        }

        double cdfLo = cdf[lo];
        double cdfHi = cdf[lo + 1];
        double edgeLo = binEdges[lo];
        double edgeHi = binEdges[lo + 1];

        if (cdfHi == cdfLo) {
            return (edgeLo + edgeHi) / 2.0;
        }

        double t = (u - cdfLo) / (cdfHi - cdfLo);
        return edgeLo + t * (edgeHi - edgeLo);
    }

    public int getBinCount() {
        return binEdges.length - 1;
    }

    public double[] getBinEdges() {
        return Arrays.copyOf(binEdges, binEdges.length);
    }

    public double[] getCdf() {
        return Arrays.copyOf(cdf, cdf.length);
    }

    @Override
    public double getMin() {
        return binEdges[0];
    }

    @Override
    public double getMax() {
        return binEdges[binEdges.length - 1];
    }

    @Override
    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistogramQuantileMap)) return false;
        HistogramQuantileMap that = (HistogramQuantileMap) o;
        return sampleCount == that.sampleCount &&
               Arrays.equals(binEdges, that.binEdges) &&
               Arrays.equals(cdf, that.cdf);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(binEdges);
        result = 31 * result + Arrays.hashCode(cdf);
        return 31 * result + sampleCount;
    }

    @Override
    public String toString() {
        return "HistogramQuantileMap[bins=" + getBinCount() + ", range=[" + getMin() + ", " + getMax() + "]]";
    }
}
