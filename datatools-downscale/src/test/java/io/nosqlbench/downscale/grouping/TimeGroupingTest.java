package io.nosqlbench.downscale.grouping;

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

import io.nosqlbench.downscale.series.Resolution;
import io.nosqlbench.downscale.series.TimeSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class TimeGroupingTest {

    @Test
    void monthGroupingKeysAreCalendarMonths() {
        TimeGrouping grouping = TimeGrouping.monthly();
        assertEquals(Resolution.MONTHLY, grouping.resolution());
        assertEquals(2, grouping.groupKey(LocalDate.of(2016, 2, 29)));
        assertEquals(12, grouping.groupKey(LocalDate.of(1999, 12, 1)));
    }

    @Test
    void dayOfMonthGroupingKeysAreDayNumbers() {
        TimeGrouping grouping = TimeGrouping.dayOfMonth();
        assertEquals(Resolution.DAILY, grouping.resolution());
        assertEquals(29, grouping.groupKey(LocalDate.of(2016, 2, 29)));
        assertEquals(31, grouping.groupKey(LocalDate.of(2016, 3, 31)));
    }

    @ParameterizedTest
    @CsvSource({
        "2015-03-01, 60",
        "2016-02-29, 60",
        "2016-03-01, 61",
        "2016-12-31, 366",
        "2015-12-31, 365"
    })
    void paddedKeysFollowCalendarDayOfYear(String date, int expectedKey) {
        TimeGrouping grouping = TimeGrouping.paddedDayOfYear(15);
        assertEquals(expectedKey, grouping.groupKey(LocalDate.parse(date)));
    }

    @Test
    void paddedWindowWrapsAtYearStart() {
        PaddedDayOfYearGrouping grouping = TimeGrouping.paddedDayOfYear(15);
        int[] window = grouping.windowDays(1);

        assertEquals(31, window.length);
        assertEquals(352, window[0]);
        assertEquals(366, window[14]);
        assertEquals(1, window[15]);
        assertEquals(16, window[30]);
    }

    @Test
    void paddedWindowWrapsAtYearEnd() {
        int[] window = TimeGrouping.paddedDayOfYear(15).windowDays(366);
        assertEquals(351, window[0]);
        assertEquals(366, window[15]);
        assertEquals(1, window[16]);
        assertEquals(15, window[30]);
    }

    @Test
    void paddedFitGroupsPoolNeighbouringDaysFromEveryYear() {
        TimeSeries series = TimeSeries.daily(LocalDate.of(2015, 1, 1), new double[731]);
        SeriesGroups groups = TimeGrouping.paddedDayOfYear(15).fitGroups(series);

        assertFalse(groups.isPartition());
        assertEquals(366, groups.groupCount());
        assertEquals(62, groups.get(60).size());
        // 2015 lacks day 366
        assertEquals(61, groups.get(366).size());
        assertEquals(61, groups.get(1).size());
    }

    @Test
    void overlappingGroupsCannotBeReassembled() {
        TimeSeries series = TimeSeries.daily(LocalDate.of(2015, 1, 1), new double[365]);
        SeriesGroups groups = TimeGrouping.paddedDayOfYear(2).fitGroups(series);
        assertThrows(IllegalStateException.class, () -> groups.apply(SeriesGroups.Group::values));
    }

    @Test
    void partitionCoversEverySampleOnce() {
        TimeSeries series = TimeSeries.monthly(YearMonth.of(2000, 5), new double[30]);
        SeriesGroups groups = TimeGrouping.monthly().partition(series);

        assertTrue(groups.isPartition());
        assertEquals(12, groups.groupCount());
        int total = 0;
        for (SeriesGroups.Group group : groups) {
            total += group.size();
            for (LocalDate date : group.dates()) {
                assertEquals(group.key(), date.getMonthValue());
            }
        }
        assertEquals(30, total);
    }

    @Test
    void paddedContextGroupsContainTheirPartitionGroup() {
        TimeGrouping grouping = TimeGrouping.paddedDayOfYear(3);
        TimeSeries series = TimeSeries.daily(LocalDate.of(2016, 1, 1), new double[366]);

        SeriesGroups partition = grouping.partition(series);
        SeriesGroups context = grouping.contextGroups(series);

        assertEquals(366, partition.groupCount());
        for (SeriesGroups.Group group : partition) {
            SeriesGroups.Group window = context.get(group.key());
            assertEquals(7, window.size(), "day " + group.key());
            int own = group.positions()[0];
            assertTrue(Arrays.stream(window.positions()).anyMatch(p -> p == own));
        }
    }

    @Test
    void simpleGroupingsRankWithinThePartition() {
        TimeSeries series = TimeSeries.monthly(YearMonth.of(2000, 1), new double[36]);
        SeriesGroups partition = TimeGrouping.monthly().partition(series);
        SeriesGroups context = TimeGrouping.monthly().contextGroups(series);

        assertEquals(partition.keys(), context.keys());
        for (int key : partition.keys()) {
            assertArrayEquals(partition.get(key).positions(), context.get(key).positions());
        }
    }

    @Test
    void keyCountsCoverEveryKey() {
        assertEquals(12, TimeGrouping.monthly().keyCount());
        assertEquals(31, TimeGrouping.dayOfMonth().keyCount());
        assertEquals(366, TimeGrouping.paddedDayOfYear(15).keyCount());
    }

    @Test
    void rejectsOversizedOffset() {
        assertThrows(IllegalArgumentException.class, () -> TimeGrouping.paddedDayOfYear(183));
        assertThrows(IllegalArgumentException.class, () -> TimeGrouping.paddedDayOfYear(-1));
    }
}
