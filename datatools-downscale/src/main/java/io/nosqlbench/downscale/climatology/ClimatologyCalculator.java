package io.nosqlbench.downscale.climatology;

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

import io.nosqlbench.downscale.InsufficientDataException;
import io.nosqlbench.downscale.grouping.SeriesGroups;

import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// Computes the arithmetic mean of each group. No smoothing.
public final class ClimatologyCalculator {

    private ClimatologyCalculator() {
        // Utility class
    }

    /// @param groups the grouped training data
    /// @param label the label carried by the result, used in lookup errors
    /// @return the per-group means
    /// @throws InsufficientDataException if a group is empty
    public static Climatology climatology(SeriesGroups groups, String label) {
        Objects.requireNonNull(groups, "groups cannot be null");
        SortedMap<Integer, Double> means = new TreeMap<>();
        for (SeriesGroups.Group group : groups) {
            if (group.size() == 0) {
                throw new InsufficientDataException(group.key(), 0, 1);
            }
            double sum = 0.0;
            for (double v : group.values()) {
                sum += v;
            }
            means.put(group.key(), sum / group.size());
        }
        return new Climatology(label, means);
    }
}
