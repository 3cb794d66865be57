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

import io.nosqlbench.downscale.series.TimeSeries;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.SortedMap;

/// Arena view of a series partitioned into keyed groups.
///
/// ## Layout
///
/// The series is never copied per group. Each group holds the original
/// positions of its samples, so per-group results are scattered straight
/// back to those positions:
///
/// ```
///   series:   [ 0 ][ 1 ][ 2 ][ 3 ][ 4 ][ 5 ] ...
///   key 1 ──► positions {0, 12, 24}
///   key 2 ──► positions {1, 13, 25}
///            ...
///   apply(op) ──► out[pos] = op(group)[k]   for each group, each k
/// ```
///
/// ## Partitions vs windows
///
/// A *partition* assigns every sample to exactly one group and can be
/// reassembled with [#apply(GroupOperator)]. A *windowed* grouping (padded
/// day-of-year) lets one sample appear in several groups; it is valid for
/// fitting statistics but cannot be reassembled.
public final class SeriesGroups implements Iterable<SeriesGroups.Group> {

    private final TimeSeries series;
    private final SortedMap<Integer, int[]> positionsByKey;
    private final boolean partition;

    SeriesGroups(TimeSeries series, SortedMap<Integer, int[]> positionsByKey, boolean partition) {
        this.series = Objects.requireNonNull(series, "series cannot be null");
        this.positionsByKey = Collections.unmodifiableSortedMap(positionsByKey);
        this.partition = partition;
    }

    /// Returns the underlying series.
    public TimeSeries series() {
        return series;
    }

    /// Returns whether every sample belongs to exactly one group.
    public boolean isPartition() {
        return partition;
    }

    /// Returns the group keys in ascending order.
    public List<Integer> keys() {
        return new ArrayList<>(positionsByKey.keySet());
    }

    /// Returns the number of groups.
    public int groupCount() {
        return positionsByKey.size();
    }

    /// Returns the group for `key`, or null if no sample maps to it.
    public Group get(int key) {
        int[] positions = positionsByKey.get(key);
        return positions == null ? null : new Group(key, positions);
    }

    @Override
    public Iterator<Group> iterator() {
        Iterator<Map.Entry<Integer, int[]>> entries = positionsByKey.entrySet().iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return entries.hasNext();
            }

            @Override
            public Group next() {
                if (!entries.hasNext()) {
                    throw new NoSuchElementException();
                }
                Map.Entry<Integer, int[]> e = entries.next();
                return new Group(e.getKey(), e.getValue());
            }
        };
    }

    /// Applies `op` to every group and scatters the results back into time order.
    ///
    /// @param op the per-group operation, returning one value per group sample
    /// @return a series on the original index
    /// @throws IllegalStateException if these groups are not a partition, or if
    ///         the reassembled output does not cover every input position exactly once
    public TimeSeries apply(GroupOperator op) {
        if (!partition) {
            throw new IllegalStateException("overlapping groups cannot be reassembled into a series");
        }
        int n = series.size();
        double[] out = new double[n];
        boolean[] written = new boolean[n];
        int count = 0;
        for (Group group : this) {
            double[] result = op.apply(group);
            if (result.length != group.size()) {
                throw new IllegalStateException(String.format(
                    "group %d produced %d values for %d samples", group.key(), result.length, group.size()));
            }
            for (int k = 0; k < result.length; k++) {
                int pos = group.positions[k];
                if (written[pos]) {
                    throw new IllegalStateException("position " + pos + " written by more than one group");
                }
                written[pos] = true;
                out[pos] = result[k];
                count++;
            }
        }
        if (count != n) {
            throw new IllegalStateException(String.format(
                "reassembled %d of %d samples", count, n));
        }
        return series.withValues(out);
    }

    /// One keyed group: a view over sample positions in the parent series.
    public final class Group {
        private final int key;
        private final int[] positions;

        private Group(int key, int[] positions) {
            this.key = key;
            this.positions = positions;
        }

        public int key() {
            return key;
        }

        public int size() {
            return positions.length;
        }

        /// Returns the sample positions in ascending time order.
        public int[] positions() {
            return positions.clone();
        }

        /// Returns the sample values in ascending time order.
        public double[] values() {
            double[] out = new double[positions.length];
            for (int k = 0; k < positions.length; k++) {
                out[k] = series.valueAt(positions[k]);
            }
            return out;
        }

        /// Returns the sample timestamps in ascending order.
        public LocalDate[] dates() {
            LocalDate[] out = new LocalDate[positions.length];
            for (int k = 0; k < positions.length; k++) {
                out[k] = series.dateAt(positions[k]);
            }
            return out;
        }

        @Override
        public String toString() {
            return "Group[key=" + key + ", n=" + positions.length + "]";
        }
    }

    /// Per-group computation used by [#apply(GroupOperator)].
    @FunctionalInterface
    public interface GroupOperator {
        /// @param group the group to process
        /// @return one output value per group sample, in the group's time order
        double[] apply(Group group);
    }
}
