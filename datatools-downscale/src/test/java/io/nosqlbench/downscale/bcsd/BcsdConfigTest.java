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

import io.nosqlbench.downscale.grouping.DayOfMonthGrouping;
import io.nosqlbench.downscale.grouping.MonthGrouping;
import io.nosqlbench.downscale.grouping.PaddedDayOfYearGrouping;
import io.nosqlbench.downscale.grouping.TimeGrouping;
import io.nosqlbench.downscale.quantile.QuantileMapperOptions;
import io.nosqlbench.downscale.series.Resolution;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class BcsdConfigTest {

    @Test
    void monthlyDefaults() {
        BcsdConfig config = BcsdConfig.monthly();

        assertInstanceOf(MonthGrouping.class, config.getGrouping());
        assertEquals(Resolution.MONTHLY, config.resolution());
        assertTrue(config.isReturnAnomalies());
        assertInstanceOf(DayOfMonthGrouping.class, config.getClimateTrendGrouping());
        assertInstanceOf(MonthGrouping.class, config.climatologyGrouping());
        assertEquals(9, config.getTrendWindow());
        assertEquals(1, config.getTrendMinPeriods());
        assertEquals(QuantileMapperOptions.defaults(), config.getQuantileMapping());
    }

    @Test
    void dailyPaddedUsesDayOfMonthClimatologies() {
        BcsdConfig config = BcsdConfig.dailyPadded();

        assertEquals(Resolution.DAILY, config.resolution());
        PaddedDayOfYearGrouping grouping = assertInstanceOf(PaddedDayOfYearGrouping.class, config.getGrouping());
        assertEquals(15, grouping.getOffset());
        assertInstanceOf(DayOfMonthGrouping.class, config.climatologyGrouping());
    }

    @Test
    void rejectsGroupingsOutsideTheirRole() {
        assertThrows(IllegalArgumentException.class,
            () -> BcsdConfig.builder().grouping(TimeGrouping.dayOfMonth()).build());
        assertThrows(IllegalArgumentException.class,
            () -> BcsdConfig.builder().climateTrendGrouping(TimeGrouping.paddedDayOfYear(5)).build());
    }

    @Test
    void rejectsInvalidTrendWindow() {
        assertThrows(IllegalArgumentException.class, () -> BcsdConfig.builder().trendWindow(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> BcsdConfig.builder().trendWindow(3).trendMinPeriods(4).build());
    }

    @Test
    void jsonRoundTrip() {
        BcsdConfig original = BcsdConfig.dailyPadded().toBuilder()
            .returnAnomalies(false)
            .trendWindow(5)
            .quantileMapping(QuantileMapperOptions.builder()
                .extrapolate(QuantileMapperOptions.Extrapolation.ONE_TO_ONE)
                .detrend(true)
                .build())
            .build();

        String json = original.toJson();
        assertTrue(json.contains("\"type\": \"padded_day_of_year\""), json);
        assertTrue(json.contains("\"1to1\""), json);

        assertEquals(original, BcsdConfig.fromJson(json));
    }

    @Test
    void absentFieldsKeepDefaults() {
        String json = """
            {
              "grouping": { "type": "padded_day_of_year" },
              "quantile_mapping": { "extrapolate": "both" }
            }
            """;

        BcsdConfig config = BcsdConfig.fromJson(json);

        assertEquals(TimeGrouping.paddedDayOfYear(15), config.getGrouping());
        assertTrue(config.isReturnAnomalies());
        assertEquals(9, config.getTrendWindow());
        assertEquals(QuantileMapperOptions.Extrapolation.BOTH, config.getQuantileMapping().getExtrapolate());
        assertEquals(100, config.getQuantileMapping().getBins());
    }

    @Test
    void invalidJsonIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> BcsdConfig.fromJson("{ \"grouping\": { \"type\": \"weekly\" } }"));
        assertThrows(IllegalArgumentException.class,
            () -> BcsdConfig.fromJson("{ \"trend_window\": -3 }"));
        assertThrows(IllegalArgumentException.class,
            () -> BcsdConfig.fromJson("{ \"grouping\": { \"type\": \"day_of_month\" } }"));
        assertThrows(IllegalArgumentException.class, () -> BcsdConfig.fromJson(""));
    }

    @Test
    void fileRoundTrip(@TempDir Path tempDir) throws IOException {
        BcsdConfig original = BcsdConfig.monthly().toBuilder().returnAnomalies(false).build();
        Path path = tempDir.resolve("bcsd.json");

        original.save(path);

        assertEquals(original, BcsdConfig.load(path));
    }
}
