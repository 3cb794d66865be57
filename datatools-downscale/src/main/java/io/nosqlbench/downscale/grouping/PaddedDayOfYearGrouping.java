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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.downscale.series.Resolution;
import io.nosqlbench.downscale.series.TimeSeries;
import io.nosqlbench.downscale.state.TypeName;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.SortedMap;
import java.util.TreeMap;

/// Day-of-year grouping whose fitting samples are drawn from a padded window.
///
/// ## Windows
///
/// Key `d` (1..366) is fitted from every sample whose day of year lies within
/// `offset` days of `d`, wrapping around the year boundary:
///
/// ```
///   offset = 15
///   key 1   ──► days 352..366, 1..16
///   key 100 ──► days 85..115
///   key 366 ──► days 351..366, 1..15
/// ```
///
/// Windows stabilize per-day estimates from short daily records and let leap
/// and non-leap years share statistics. Day 366 only exists in leap years but
/// its window is populated by the surrounding days of every year.
///
/// Per-row lookup at transform time uses the plain calendar day of year, and
/// each day's query samples are ranked against the query samples in its window.
@TypeName(PaddedDayOfYearGrouping.GROUPING_TYPE)
public final class PaddedDayOfYearGrouping implements TimeGrouping {

    public static final String GROUPING_TYPE = "padded_day_of_year";

    /// Default window half-width, in days.
    public static final int DEFAULT_OFFSET = 15;

    /// Number of day-of-year keys, leap day included.
    public static final int DAYS_IN_CYCLE = 366;

    @SerializedName("offset")
    private final int offset;

    // Gson entry point; a missing offset keeps the default
    private PaddedDayOfYearGrouping() {
        this(DEFAULT_OFFSET);
    }

    /// Creates a padded grouping with window half-width `offset`.
    ///
    /// @param offset days on each side of the target day, 0..182
    public PaddedDayOfYearGrouping(int offset) {
        if (offset < 0 || 2 * offset + 1 > DAYS_IN_CYCLE) {
            throw new IllegalArgumentException("offset must be in [0, 182], got " + offset);
        }
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String getGroupingType() {
        return GROUPING_TYPE;
    }

    @Override
    public Resolution resolution() {
        return Resolution.DAILY;
    }

    @Override
    public int groupKey(LocalDate date) {
        return date.getDayOfYear();
    }

    @Override
    public int keyCount() {
        return DAYS_IN_CYCLE;
    }

    /// Ranks each day's query samples within the same padded window used for
    /// fitting, so a single query year still gives `2 * offset + 1` samples per key.
    @Override
    public SeriesGroups contextGroups(TimeSeries series) {
        return fitGroups(series);
    }

    /// Returns the days of year that feed key `dayOfYear`, in window order.
    ///
    /// @param dayOfYear the key, 1..366
    /// @return `2 * offset + 1` days of year
    public int[] windowDays(int dayOfYear) {
        if (dayOfYear < 1 || dayOfYear > DAYS_IN_CYCLE) {
            throw new IllegalArgumentException("dayOfYear must be in [1, 366], got " + dayOfYear);
        }
        int[] days = new int[2 * offset + 1];
        for (int k = 0; k < days.length; k++) {
            int zeroBased = Math.floorMod(dayOfYear - 1 - offset + k, DAYS_IN_CYCLE);
            days[k] = zeroBased + 1;
        }
        return days;
    }

    /// Returns one window group per key 1..366. A sample belongs to up to
    /// `2 * offset + 1` groups. Keys whose window holds no sample are kept
    /// with an empty group so that fitting can report them.
    @Override
    public SeriesGroups fitGroups(TimeSeries series) {
        int[][] byDay = new int[DAYS_IN_CYCLE + 1][];
        int[] counts = new int[DAYS_IN_CYCLE + 1];
        for (int i = 0; i < series.size(); i++) {
            counts[series.dateAt(i).getDayOfYear()]++;
        }
        for (int d = 1; d <= DAYS_IN_CYCLE; d++) {
            byDay[d] = new int[counts[d]];
            counts[d] = 0;
        }
        for (int i = 0; i < series.size(); i++) {
            int d = series.dateAt(i).getDayOfYear();
            byDay[d][counts[d]++] = i;
        }

        SortedMap<Integer, int[]> positions = new TreeMap<>();
        for (int key = 1; key <= DAYS_IN_CYCLE; key++) {
            int total = 0;
            int[] window = windowDays(key);
            for (int d : window) {
                total += byDay[d].length;
            }
            int[] merged = new int[total];
            int at = 0;
            for (int d : window) {
                System.arraycopy(byDay[d], 0, merged, at, byDay[d].length);
                at += byDay[d].length;
            }
            Arrays.sort(merged);
            positions.put(key, merged);
        }
        return new SeriesGroups(series, positions, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PaddedDayOfYearGrouping)) return false;
        return offset == ((PaddedDayOfYearGrouping) o).offset;
    }

    @Override
    public int hashCode() {
        return 31 * GROUPING_TYPE.hashCode() + offset;
    }

    @Override
    public String toString() {
        return "PaddedDayOfYearGrouping[offset=" + offset + "]";
    }
}
