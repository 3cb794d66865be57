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

import io.nosqlbench.downscale.DomainValidityException;
import io.nosqlbench.downscale.NotFittedException;
import io.nosqlbench.downscale.SyntheticClimate;
import io.nosqlbench.downscale.bcsd.BcsdConfig;
import io.nosqlbench.downscale.bcsd.BcsdPrecipitation;
import io.nosqlbench.downscale.bcsd.BcsdTemperature;
import io.nosqlbench.downscale.climatology.Climatology;
import io.nosqlbench.downscale.quantile.HistogramQuantileMap;
import io.nosqlbench.downscale.quantile.QuantileMap;
import io.nosqlbench.downscale.quantile.QuantileMapperOptions;
import io.nosqlbench.downscale.series.TimeSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ModelStateStoreTest {

    private static final LocalDate START = LocalDate.of(2014, 1, 1);
    private static final LocalDate END = LocalDate.of(2016, 12, 31);

    private static BcsdTemperature fittedTemperature() {
        return new BcsdTemperature(BcsdConfig.dailyPadded()).fit(
            SyntheticClimate.dailyTemperature(START, END, 12.0, 0.05, 1),
            SyntheticClimate.dailyTemperature(START, END, 10.0, 0.0, 2));
    }

    private static BcsdPrecipitation fittedPrecipitation(BcsdConfig config) {
        return new BcsdPrecipitation(config).fit(
            SyntheticClimate.monthlyPrecipitation(YearMonth.of(1990, 1), 120, 3.0, 3),
            SyntheticClimate.monthlyPrecipitation(YearMonth.of(1990, 1), 120, 2.0, 4));
    }

    @Test
    void temperatureStateRoundTrip(@TempDir Path tempDir) throws Exception {
        BcsdTemperature model = fittedTemperature();
        Path path = tempDir.resolve("tas.json");

        ModelStateStore.save(path, model.exportState());
        BcsdState loaded = ModelStateStore.load(path);
        BcsdTemperature restored = BcsdTemperature.fromState(loaded);

        assertEquals(BcsdState.CURRENT_VERSION, loaded.version());
        assertEquals(BcsdState.Kind.TEMPERATURE, loaded.kind());
        assertTrue(loaded.checksum().startsWith("sha256:"), loaded.checksum());
        assertEquals(model.getConfig(), restored.getConfig());
        assertEquals(model.getSourceClimatology(), restored.getSourceClimatology());
        assertEquals(model.getTargetClimatology(), restored.getTargetClimatology());
        assertEquals(model.getQuantileMappers().getMaps(), restored.getQuantileMappers().getMaps());
        assertTrue(restored.isFitted());

        TimeSeries query = SyntheticClimate.dailyTemperature(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31), 13.0, 0.05, 5);
        assertEquals(model.predict(query), restored.predict(query));
    }

    @Test
    void precipitationStateKeepsHistogramMaps(@TempDir Path tempDir) throws Exception {
        BcsdConfig config = BcsdConfig.monthly().toBuilder()
            .quantileMapping(QuantileMapperOptions.builder()
                .method(QuantileMapperOptions.Method.HISTOGRAM)
                .bins(8)
                .build())
            .build();
        BcsdPrecipitation model = fittedPrecipitation(config);
        Path path = tempDir.resolve("pr.json");

        ModelStateStore.save(path, model.exportState());
        BcsdPrecipitation restored = BcsdPrecipitation.fromState(ModelStateStore.load(path));

        assertInstanceOf(HistogramQuantileMap.class, restored.getQuantileMappers().get(1));
        assertNull(ModelStateStore.load(path).sourceClimatology());
        TimeSeries query = SyntheticClimate.monthlyPrecipitation(YearMonth.of(2000, 1), 24, 3.5, 6);
        assertEquals(model.predict(query), restored.predict(query));
    }

    @Test
    void checksumDetectsTampering(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("pr.json");
        ModelStateStore.save(path, fittedPrecipitation(BcsdConfig.monthly()).exportState());

        String content = Files.readString(path);
        Files.writeString(path, content.replace("\"target climatology\"", "\"tampered climatology\""));

        assertThrows(ModelStateStore.StateException.class, () -> ModelStateStore.load(path));
        BcsdState unchecked = ModelStateStore.load(path, false);
        assertEquals("tampered climatology", unchecked.targetClimatology().getLabel());
    }

    @Test
    void unsupportedVersionIsRejected(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("pr.json");
        ModelStateStore.save(path, fittedPrecipitation(BcsdConfig.monthly()).exportState());

        String content = Files.readString(path);
        Files.writeString(path, content.replace("\"version\": 1", "\"version\": 2"));

        assertThrows(ModelStateStore.StateException.class, () -> ModelStateStore.load(path, false));
    }

    @Test
    void loadNonExistentFileThrows(@TempDir Path tempDir) {
        assertThrows(ModelStateStore.StateException.class,
            () -> ModelStateStore.load(tempDir.resolve("missing.json")));
    }

    @Test
    void loadInvalidJsonThrows(@TempDir Path tempDir) throws IOException {
        Path invalid = tempDir.resolve("invalid.json");
        Files.writeString(invalid, "{ invalid json }");
        assertThrows(ModelStateStore.StateException.class, () -> ModelStateStore.load(invalid));
    }

    @Test
    void loadEmptyFileThrows(@TempDir Path tempDir) throws IOException {
        Path empty = tempDir.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(ModelStateStore.StateException.class, () -> ModelStateStore.load(empty));
    }

    @Test
    void incompleteStateIsRejected() {
        String json = "{ \"version\": 1, \"kind\": \"precipitation\", \"config\": { \"grouping\": { \"type\": \"month\" } } }";
        assertThrows(ModelStateStore.StateException.class, () -> ModelStateStore.fromJson(json, true));
    }

    @Test
    void stateOfOtherKindIsRejected() {
        BcsdState state = fittedPrecipitation(BcsdConfig.monthly()).exportState();
        assertThrows(IllegalArgumentException.class, () -> BcsdTemperature.fromState(state));
    }

    @Test
    void restoredPrecipitationNeedsPositiveClimatology(@TempDir Path tempDir) throws Exception {
        BcsdState state = fittedPrecipitation(BcsdConfig.monthly()).exportState();
        Map<Integer, Double> means = new TreeMap<>(state.targetClimatology().asMap());
        means.put(3, 0.0);
        Path path = tempDir.resolve("pr.json");
        ModelStateStore.save(path, state.toBuilder()
            .targetClimatology(new Climatology("target climatology", means))
            .build());

        BcsdState loaded = ModelStateStore.load(path);

        DomainValidityException e = assertThrows(DomainValidityException.class,
            () -> BcsdPrecipitation.fromState(loaded));
        assertEquals(3, e.getGroupKey());
    }

    @Test
    void restoredKeysMustFitTheGrouping() {
        BcsdState state = fittedPrecipitation(BcsdConfig.monthly()).exportState();

        SortedMap<Integer, QuantileMap> extraKey = new TreeMap<>(state.quantileMaps());
        extraKey.put(13, extraKey.get(1));
        Map<Integer, Double> extraMean = new TreeMap<>(state.targetClimatology().asMap());
        extraMean.put(13, 1.0);
        BcsdState outOfRange = state.toBuilder()
            .quantileMaps(extraKey)
            .targetClimatology(new Climatology("target climatology", extraMean))
            .build();
        assertThrows(IllegalArgumentException.class, () -> BcsdPrecipitation.fromState(outOfRange));

        SortedMap<Integer, QuantileMap> missingKey = new TreeMap<>(state.quantileMaps());
        missingKey.remove(12);
        BcsdState mismatched = state.toBuilder().quantileMaps(missingKey).build();
        assertThrows(IllegalArgumentException.class, () -> BcsdPrecipitation.fromState(mismatched));
    }

    @Test
    void restoredTemperatureClimatologiesShareKeys() {
        BcsdState state = fittedTemperature().exportState();
        Map<Integer, Double> means = new TreeMap<>(state.sourceClimatology().asMap());
        means.remove(31);
        BcsdState mismatched = state.toBuilder()
            .sourceClimatology(new Climatology("source climatology", means))
            .build();

        assertThrows(IllegalArgumentException.class, () -> BcsdTemperature.fromState(mismatched));
    }

    @Test
    void unfittedModelHasNoState() {
        assertThrows(NotFittedException.class, () -> new BcsdPrecipitation().exportState());
    }

    @Test
    void saveLeavesNoTempFile(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("pr.json");
        BcsdState state = fittedPrecipitation(BcsdConfig.monthly()).exportState();

        ModelStateStore.save(path, state);
        ModelStateStore.save(path, state);

        assertTrue(Files.exists(path));
        assertFalse(Files.exists(tempDir.resolve("pr.json.tmp")));
    }
}
