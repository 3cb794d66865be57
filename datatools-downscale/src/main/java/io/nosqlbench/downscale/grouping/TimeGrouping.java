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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/// Strategy that assigns each timestamp to a recurring group key.
///
/// ## Variants
///
/// | Variant | Key | Fitting groups |
/// |---------|-----|----------------|
/// | [MonthGrouping] | month 1..12 | partition by month |
/// | [DayOfMonthGrouping] | day 1..31 | partition by day of month |
/// | [PaddedDayOfYearGrouping] | day of year 1..366 | ± offset day window around each day |
///
/// Every variant offers the same two capabilities, so callers never need to
/// know which one is active:
///
/// - [#fitGroups(TimeSeries)] yields the (key, samples) pairs used to fit
///   per-group statistics
/// - [#groupKey(LocalDate)] / [#partition(TimeSeries)] give the per-row key used
///   when transforming or predicting
///
/// For the simple variants both are the same partition. At transform time
/// [#contextGroups(TimeSeries)] says which query samples a group is ranked
/// against: the group itself, or the padded window around its day.
public sealed interface TimeGrouping permits MonthGrouping, DayOfMonthGrouping, PaddedDayOfYearGrouping {

    /// Returns the serialization type name of this variant.
    String getGroupingType();

    /// Returns the sampling resolution this grouping is meant for.
    Resolution resolution();

    /// Returns the group key for one timestamp. Deterministic for a given configuration.
    ///
    /// @param date the timestamp
    /// @return the group key
    int groupKey(LocalDate date);

    /// Returns the number of keys; every key lies in `1..keyCount()`.
    int keyCount();

    /// Partitions a series by [#groupKey(LocalDate)], each sample in exactly one group.
    ///
    /// @param series the series to partition
    /// @return the keyed partition
    default SeriesGroups partition(TimeSeries series) {
        SortedMap<Integer, List<Integer>> byKey = new TreeMap<>();
        for (int i = 0; i < series.size(); i++) {
            byKey.computeIfAbsent(groupKey(series.dateAt(i)), k -> new ArrayList<>()).add(i);
        }
        SortedMap<Integer, int[]> positions = new TreeMap<>();
        byKey.forEach((key, list) -> positions.put(key, list.stream().mapToInt(Integer::intValue).toArray()));
        return new SeriesGroups(series, positions, true);
    }

    /// Returns the groups used to fit per-group statistics.
    ///
    /// @param series the training series
    /// @return the keyed fitting groups
    default SeriesGroups fitGroups(TimeSeries series) {
        return partition(series);
    }

    /// Returns, per key, the samples that each partition group is ranked
    /// against when a fitted transform is applied. Every group of
    /// [#partition(TimeSeries)] is contained in the context group of its key.
    ///
    /// @param series the query series
    /// @return the keyed ranking context
    default SeriesGroups contextGroups(TimeSeries series) {
        return partition(series);
    }

    static MonthGrouping monthly() {
        return MonthGrouping.INSTANCE;
    }

    static DayOfMonthGrouping dayOfMonth() {
        return DayOfMonthGrouping.INSTANCE;
    }

    static PaddedDayOfYearGrouping paddedDayOfYear(int offset) {
        return new PaddedDayOfYearGrouping(offset);
    }
}
