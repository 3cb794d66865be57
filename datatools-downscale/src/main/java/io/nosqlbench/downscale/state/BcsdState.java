package io.nosqlbench.downscale.state;

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
import io.nosqlbench.downscale.bcsd.BcsdConfig;
import io.nosqlbench.downscale.climatology.Climatology;
import io.nosqlbench.downscale.quantile.QuantileMap;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// Complete fitted state of a BCSD model, as written between fit and predict.
///
/// ## JSON Schema
///
/// ```json
/// {
///   "version": 1,
///   "kind": "temperature",
///   "timestamp": "2025-01-07T10:30:00Z",
///   "checksum": "sha256:abc123...",
///   "config": { "grouping": { "type": "month" }, ... },
///   "target_climatology": { "label": "target climatology", "means": { "1": 2.5, ... } },
///   "source_climatology": { ... },
///   "quantile_maps": { "1": { "type": "empirical", ... }, ... }
/// }
/// ```
///
/// `source_climatology` is present for temperature models only. Nothing else is
/// needed to rebuild a fitted model.
///
/// @see ModelStateStore
public final class BcsdState {

    /// Current state format version.
    public static final int CURRENT_VERSION = 1;

    /// Which model produced the state.
    public enum Kind {
        @SerializedName("precipitation")
        PRECIPITATION,
        @SerializedName("temperature")
        TEMPERATURE
    }

    @SerializedName("version")
    private final int version;

    @SerializedName("kind")
    private final Kind kind;

    @SerializedName("timestamp")
    private final String timestamp;

    @SerializedName("checksum")
    private final String checksum;

    @SerializedName("config")
    private final BcsdConfig config;

    @SerializedName("target_climatology")
    private final Climatology targetClimatology;

    @SerializedName("source_climatology")
    private final Climatology sourceClimatology;

    @SerializedName("quantile_maps")
    private final SortedMap<Integer, QuantileMap> quantileMaps;

    private BcsdState(Builder builder) {
        this.version = CURRENT_VERSION;
        this.kind = builder.kind;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now().toString();
        this.checksum = builder.checksum;
        this.config = builder.config;
        this.targetClimatology = builder.targetClimatology;
        this.sourceClimatology = builder.sourceClimatology;
        this.quantileMaps = builder.quantileMaps;
    }

    public int version() {
        return version;
    }

    public Kind kind() {
        return kind;
    }

    public String timestamp() {
        return timestamp;
    }

    /// Returns the checksum recorded by [ModelStateStore#save], or null.
    public String checksum() {
        return checksum;
    }

    public BcsdConfig config() {
        return config;
    }

    public Climatology targetClimatology() {
        return targetClimatology;
    }

    /// Returns the source climatology, or null for precipitation state.
    public Climatology sourceClimatology() {
        return sourceClimatology;
    }

    public SortedMap<Integer, QuantileMap> quantileMaps() {
        return quantileMaps == null ? null : Collections.unmodifiableSortedMap(quantileMaps);
    }

    /// Returns a builder holding every field of this state.
    public Builder toBuilder() {
        Builder builder = new Builder()
            .kind(kind)
            .timestamp(timestamp)
            .checksum(checksum)
            .config(config)
            .targetClimatology(targetClimatology)
            .sourceClimatology(sourceClimatology);
        builder.quantileMaps = quantileMaps;
        return builder;
    }

    @Override
    public String toString() {
        return String.format("BcsdState[v%d, %s, groups=%d, %s]",
            version, kind, quantileMaps == null ? 0 : quantileMaps.size(), timestamp);
    }

    /// Builder for creating BcsdState instances.
    public static final class Builder {
        private Kind kind;
        private String timestamp;
        private String checksum;
        private BcsdConfig config;
        private Climatology targetClimatology;
        private Climatology sourceClimatology;
        private SortedMap<Integer, QuantileMap> quantileMaps;

        public Builder kind(Kind kind) {
            this.kind = Objects.requireNonNull(kind);
            return this;
        }

        /// Sets the timestamp (optional, defaults to current time).
        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /// Sets the checksum (optional).
        public Builder checksum(String checksum) {
            this.checksum = checksum;
            return this;
        }

        public Builder config(BcsdConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder targetClimatology(Climatology targetClimatology) {
            this.targetClimatology = targetClimatology;
            return this;
        }

        public Builder sourceClimatology(Climatology sourceClimatology) {
            this.sourceClimatology = sourceClimatology;
            return this;
        }

        public Builder quantileMaps(Map<Integer, QuantileMap> quantileMaps) {
            this.quantileMaps = new TreeMap<>(quantileMaps);
            return this;
        }

        /// Builds the state.
        ///
        /// @throws NullPointerException if kind, config, target climatology or quantile maps are missing
        /// @throws IllegalStateException if the source climatology presence does not match the kind
        public BcsdState build() {
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(config, "config is required");
            Objects.requireNonNull(targetClimatology, "targetClimatology is required");
            Objects.requireNonNull(quantileMaps, "quantileMaps is required");
            if ((kind == Kind.TEMPERATURE) != (sourceClimatology != null)) {
                throw new IllegalStateException(
                    "sourceClimatology is required for temperature state and not allowed for " + kind);
            }
            return new BcsdState(this);
        }
    }
}
