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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.downscale.grouping.DayOfMonthGrouping;
import io.nosqlbench.downscale.grouping.MonthGrouping;
import io.nosqlbench.downscale.grouping.PaddedDayOfYearGrouping;
import io.nosqlbench.downscale.grouping.TimeGrouping;
import io.nosqlbench.downscale.quantile.QuantileMapperOptions;
import io.nosqlbench.downscale.series.Resolution;
import io.nosqlbench.downscale.state.DownscaleGsonConfig;
import io.nosqlbench.downscale.trend.RollingMean;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable configuration shared by the BCSD models.
 *
 * <h2>JSON Format</h2>
 *
 * <pre>{@code
 * {
 *   "grouping": { "type": "padded_day_of_year", "offset": 15 },
 *   "return_anomalies": true,
 *   "climate_trend_grouping": { "type": "day_of_month" },
 *   "trend_window": 9,
 *   "trend_min_periods": 1,
 *   "quantile_mapping": { "method": "empirical", "extrapolate": "none", ... }
 * }
 * }</pre>
 *
 * <p>The {@code grouping} selects the resolution: {@code month} for monthly data,
 * {@code padded_day_of_year} for daily data. {@code climate_trend_grouping} is only
 * consulted at daily resolution, where it keys the temperature climatologies and
 * temperature quantile maps. Trend positions with fewer than {@code trend_min_periods}
 * samples in their window are missing (NaN) and stay missing in the prediction.
 * The quantile mapping options are passed unchanged to every fitted mapper.
 *
 * <p>Instances loaded from JSON are validated the same way as built ones.
 */
public final class BcsdConfig {

    @SerializedName("grouping")
    private final TimeGrouping grouping;

    @SerializedName("return_anomalies")
    private final boolean returnAnomalies;

    @SerializedName("climate_trend_grouping")
    private final TimeGrouping climateTrendGrouping;

    @SerializedName("trend_window")
    private final int trendWindow;

    @SerializedName("trend_min_periods")
    private final int trendMinPeriods;

    @SerializedName("quantile_mapping")
    private final QuantileMapperOptions quantileMapping;

    // Gson entry point; fields absent from the JSON keep their defaults
    private BcsdConfig() {
        this(new Builder());
    }

    private BcsdConfig(Builder builder) {
        this.grouping = builder.grouping;
        this.returnAnomalies = builder.returnAnomalies;
        this.climateTrendGrouping = builder.climateTrendGrouping;
        this.trendWindow = builder.trendWindow;
        this.trendMinPeriods = builder.trendMinPeriods;
        this.quantileMapping = builder.quantileMapping;
    }

    /**
     * Monthly configuration: month grouping, anomalies returned, default mapping options.
     *
     * @return the monthly configuration
     */
    public static BcsdConfig monthly() {
        return builder().build();
    }

    /**
     * Daily configuration with ±15 day padded day-of-year windows.
     *
     * @return the daily configuration
     */
    public static BcsdConfig dailyPadded() {
        return builder()
            .grouping(TimeGrouping.paddedDayOfYear(PaddedDayOfYearGrouping.DEFAULT_OFFSET))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .grouping(grouping)
            .returnAnomalies(returnAnomalies)
            .climateTrendGrouping(climateTrendGrouping)
            .trendWindow(trendWindow)
            .trendMinPeriods(trendMinPeriods)
            .quantileMapping(quantileMapping);
    }

    /** Grouping used to fit and apply the quantile maps. */
    public TimeGrouping getGrouping() {
        return grouping;
    }

    public boolean isReturnAnomalies() {
        return returnAnomalies;
    }

    public TimeGrouping getClimateTrendGrouping() {
        return climateTrendGrouping;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public int getTrendMinPeriods() {
        return trendMinPeriods;
    }

    public QuantileMapperOptions getQuantileMapping() {
        return quantileMapping;
    }

    /**
     * Returns the resolution of the data this configuration accepts.
     *
     * @return the resolution of {@link #getGrouping()}
     */
    public Resolution resolution() {
        return grouping.resolution();
    }

    /**
     * Returns the grouping that keys the temperature climatologies and quantile maps: the climate trend
     * grouping at daily resolution, the primary grouping otherwise.
     *
     * @return the climatology grouping
     */
    public TimeGrouping climatologyGrouping() {
        return resolution() == Resolution.DAILY ? climateTrendGrouping : grouping;
    }

    /**
     * Returns the rolling mean used for temperature trend extraction.
     *
     * @return the rolling mean
     */
    public RollingMean trend() {
        return new RollingMean(trendWindow, trendMinPeriods);
    }

    /**
     * Parses a configuration from JSON.
     *
     * @param json the JSON text
     * @return the validated configuration
     * @throws IllegalArgumentException if the JSON is malformed or describes an invalid configuration
     */
    public static BcsdConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return validated(DownscaleGsonConfig.gson().fromJson(json, BcsdConfig.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid configuration JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a configuration from a reader.
     *
     * @param reader the source of JSON text
     * @return the validated configuration
     * @throws IllegalArgumentException if the JSON is malformed or describes an invalid configuration
     */
    public static BcsdConfig fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        try {
            return validated(DownscaleGsonConfig.gson().fromJson(reader, BcsdConfig.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid configuration JSON: " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return DownscaleGsonConfig.gson().toJson(this);
    }

    public void toJson(Writer writer) {
        DownscaleGsonConfig.gson().toJson(this, writer);
    }

    /**
     * Loads a configuration file.
     *
     * @param path the JSON file
     * @return the validated configuration
     * @throws IOException if the file cannot be read
     */
    public static BcsdConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    /**
     * Writes this configuration as JSON.
     *
     * @param path the destination file
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toJson(writer);
        }
    }

    /**
     * Runs the builder checks on an instance created by deserialization, which bypasses the builder.
     *
     * @param parsed the deserialized configuration
     * @return an equal, validated configuration
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static BcsdConfig validated(BcsdConfig parsed) {
        if (parsed == null) {
            throw new IllegalArgumentException("Configuration JSON is empty");
        }
        Builder builder = new Builder()
            .returnAnomalies(parsed.returnAnomalies)
            .trendWindow(parsed.trendWindow)
            .trendMinPeriods(parsed.trendMinPeriods);
        if (parsed.grouping != null) {
            builder.grouping(parsed.grouping);
        }
        if (parsed.climateTrendGrouping != null) {
            builder.climateTrendGrouping(parsed.climateTrendGrouping);
        }
        if (parsed.quantileMapping != null) {
            builder.quantileMapping(parsed.quantileMapping.toBuilder().build());
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BcsdConfig)) return false;
        BcsdConfig that = (BcsdConfig) o;
        return returnAnomalies == that.returnAnomalies
            && trendWindow == that.trendWindow
            && trendMinPeriods == that.trendMinPeriods
            && grouping.equals(that.grouping)
            && climateTrendGrouping.equals(that.climateTrendGrouping)
            && quantileMapping.equals(that.quantileMapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(grouping, returnAnomalies, climateTrendGrouping, trendWindow, trendMinPeriods, quantileMapping);
    }

    @Override
    public String toString() {
        return "BcsdConfig[grouping=" + grouping +
            ", returnAnomalies=" + returnAnomalies +
            ", climateTrendGrouping=" + climateTrendGrouping +
            ", trend=" + trendWindow + "/" + trendMinPeriods +
            ", quantileMapping=" + quantileMapping + "]";
    }

    /**
     * Builder for {@link BcsdConfig}. Defaults describe the monthly configuration.
     */
    public static final class Builder {
        private TimeGrouping grouping = TimeGrouping.monthly();
        private boolean returnAnomalies = true;
        private TimeGrouping climateTrendGrouping = TimeGrouping.dayOfMonth();
        private int trendWindow = RollingMean.DEFAULT_WINDOW;
        private int trendMinPeriods = RollingMean.DEFAULT_MIN_PERIODS;
        private QuantileMapperOptions quantileMapping = QuantileMapperOptions.defaults();

        private Builder() {
        }

        public Builder grouping(TimeGrouping grouping) {
            this.grouping = Objects.requireNonNull(grouping, "grouping cannot be null");
            return this;
        }

        public Builder returnAnomalies(boolean returnAnomalies) {
            this.returnAnomalies = returnAnomalies;
            return this;
        }

        public Builder climateTrendGrouping(TimeGrouping climateTrendGrouping) {
            this.climateTrendGrouping = Objects.requireNonNull(climateTrendGrouping, "climateTrendGrouping cannot be null");
            return this;
        }

        public Builder trendWindow(int trendWindow) {
            this.trendWindow = trendWindow;
            return this;
        }

        public Builder trendMinPeriods(int trendMinPeriods) {
            this.trendMinPeriods = trendMinPeriods;
            return this;
        }

        public Builder quantileMapping(QuantileMapperOptions quantileMapping) {
            this.quantileMapping = Objects.requireNonNull(quantileMapping, "quantileMapping cannot be null");
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if a grouping is not allowed in its role
         *         or the trend window is invalid
         */
        public BcsdConfig build() {
            if (!(grouping instanceof MonthGrouping) && !(grouping instanceof PaddedDayOfYearGrouping)) {
                throw new IllegalArgumentException(
                    "grouping must be month or padded_day_of_year, got " + grouping.getGroupingType());
            }
            if (!(climateTrendGrouping instanceof DayOfMonthGrouping) && !(climateTrendGrouping instanceof MonthGrouping)) {
                throw new IllegalArgumentException(
                    "climate trend grouping must be day_of_month or month, got " + climateTrendGrouping.getGroupingType());
            }
            new RollingMean(trendWindow, trendMinPeriods);
            return new BcsdConfig(this);
        }
    }
}
