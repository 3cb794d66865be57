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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for configuration and fitted-state files.
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable state files |
/// | Serialize nulls | Disabled | Optional fields are omitted |
/// | HTML escaping | Disabled | Cleaner output |
/// | Quantile map adapter | Registered | Polymorphic [io.nosqlbench.downscale.quantile.QuantileMap] |
/// | Grouping adapter | Registered | Polymorphic [io.nosqlbench.downscale.grouping.TimeGrouping] |
///
/// The [Gson] instances are thread-safe and shared.
public final class DownscaleGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private static final Gson COMPACT = compactBuilder().create();

    private DownscaleGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns a shared single-line Gson instance, used for checksums.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with the downscale adapters and pretty printing.
    public static GsonBuilder builder() {
        return compactBuilder().setPrettyPrinting();
    }

    private static GsonBuilder compactBuilder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(TypeDiscriminatorAdapterFactory.quantileMaps())
            .registerTypeAdapterFactory(TypeDiscriminatorAdapterFactory.timeGroupings());
    }
}
