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

import com.google.gson.JsonParseException;
import io.nosqlbench.downscale.bcsd.BcsdConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/// Saves and loads fitted model state.
///
/// ## Atomic Writes
///
/// ```text
///   1. Serialize the state without its checksum
///   2. Compute the SHA-256 checksum of that JSON
///   3. Write the state with checksum to model.json.tmp
///   4. Rename the temp file to model.json (atomic on POSIX)
/// ```
///
/// An interrupted save never corrupts an existing state file. On load the version
/// is checked and, unless disabled, the checksum is recomputed and compared.
///
/// ## Usage
///
/// ```java
/// BcsdTemperature model = new BcsdTemperature(BcsdConfig.dailyPadded()).fit(source, target);
/// ModelStateStore.save(Path.of("tas.json"), model.exportState());
///
/// BcsdTemperature restored = BcsdTemperature.fromState(ModelStateStore.load(Path.of("tas.json")));
/// ```
///
/// @see BcsdState
/// @see DownscaleGsonConfig
public final class ModelStateStore {

    private static final Logger logger = LogManager.getLogger(ModelStateStore.class);

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String CHECKSUM_PREFIX = "sha256:";

    private ModelStateStore() {
        // Utility class
    }

    /// Saves model state to a file atomically, with a checksum.
    ///
    /// @param path the path to save the state to
    /// @param state the state to save
    /// @throws IOException if writing fails
    public static void save(Path path, BcsdState state) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(state, "state cannot be null");

        String json = toJson(state);

        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(json);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Saved {} to {}", state, path);
    }

    /// Loads model state, verifying version and checksum.
    ///
    /// @param path the state file
    /// @return the loaded state
    /// @throws IOException if reading fails
    /// @throws StateException if the state is invalid or corrupted
    public static BcsdState load(Path path) throws IOException, StateException {
        return load(path, true);
    }

    /// Loads model state with optional checksum verification.
    ///
    /// @param path the state file
    /// @param verifyChecksum whether to verify the checksum
    /// @return the loaded state
    /// @throws IOException if reading fails
    /// @throws StateException if the state is invalid or corrupted
    public static BcsdState load(Path path, boolean verifyChecksum) throws IOException, StateException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new StateException("State file not found: " + path);
        }
        return fromJson(Files.readString(path, StandardCharsets.UTF_8), verifyChecksum);
    }

    /// Serializes state with its checksum filled in.
    ///
    /// @param state the state to serialize
    /// @return the JSON text
    public static String toJson(BcsdState state) {
        String checksum = checksumOf(state);
        return DownscaleGsonConfig.gson().toJson(state.toBuilder().checksum(checksum).build());
    }

    /// Parses state JSON.
    ///
    /// @param json the JSON text
    /// @param verifyChecksum whether to verify the checksum
    /// @return the parsed state
    /// @throws StateException if the JSON is invalid, of another version or fails the checksum
    public static BcsdState fromJson(String json, boolean verifyChecksum) throws StateException {
        BcsdState state;
        try {
            state = DownscaleGsonConfig.gson().fromJson(json, BcsdState.class);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new StateException("Invalid state JSON: " + e.getMessage(), e);
        }

        if (state == null) {
            throw new StateException("State file is empty or null");
        }
        if (state.version() != BcsdState.CURRENT_VERSION) {
            throw new StateException(
                "Unsupported state version: " + state.version() +
                " (expected: " + BcsdState.CURRENT_VERSION + ")");
        }

        BcsdState rebuilt;
        try {
            rebuilt = state.toBuilder().config(BcsdConfig.validated(state.config())).build();
        } catch (NullPointerException | IllegalStateException | IllegalArgumentException e) {
            throw new StateException("Incomplete state: " + e.getMessage(), e);
        }

        if (verifyChecksum && state.checksum() != null) {
            String expected = checksumOf(rebuilt);
            if (!expected.equals(state.checksum())) {
                throw new StateException(
                    "State checksum mismatch: expected " + expected + " but found " + state.checksum());
            }
        }
        return rebuilt;
    }

    /// Checksums the compact JSON of a state with its checksum field cleared.
    private static String checksumOf(BcsdState state) {
        return computeChecksum(DownscaleGsonConfig.compactGson().toJson(state.toBuilder().checksum(null).build()));
    }

    private static String computeChecksum(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return CHECKSUM_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /// Exception thrown when state loading or validation fails.
    public static class StateException extends Exception {
        public StateException(String message) {
            super(message);
        }

        public StateException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
