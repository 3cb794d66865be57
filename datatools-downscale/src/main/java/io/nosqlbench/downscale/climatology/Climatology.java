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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.downscale.GroupKeyMismatchException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// Per-group long-run mean of a training series, e.g. the mean of all Januaries.
///
/// Computed once at fit time and immutable afterwards.
public final class Climatology {

    @SerializedName("label")
    private final String label;

    @SerializedName("means")
    private final SortedMap<Integer, Double> means;

    /// Creates a climatology from per-group means.
    ///
    /// @param label a name for error messages, e.g. "target climatology"
    /// @param means the mean value by group key
    public Climatology(String label, Map<Integer, Double> means) {
        this.label = Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(means, "means cannot be null");
        if (means.isEmpty()) {
            throw new IllegalArgumentException("climatology needs at least one group");
        }
        this.means = new TreeMap<>(means);
    }

    public String getLabel() {
        return label;
    }

    /// Returns the climatological mean for `key`.
    ///
    /// @param key the group key
    /// @return the mean of the training samples in that group
    /// @throws GroupKeyMismatchException if the key was not present at fit time
    public double get(int key) {
        Double value = means.get(key);
        if (value == null) {
            throw new GroupKeyMismatchException(label, key);
        }
        return value;
    }

    public boolean contains(int key) {
        return means.containsKey(key);
    }

    public int size() {
        return means.size();
    }

    /// Returns an unmodifiable view of the means by key.
    public SortedMap<Integer, Double> asMap() {
        return Collections.unmodifiableSortedMap(means);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Climatology)) return false;
        Climatology that = (Climatology) o;
        return label.equals(that.label) && means.equals(that.means);
    }

    @Override
    public int hashCode() {
        return 31 * label.hashCode() + means.hashCode();
    }

    @Override
    public String toString() {
        return "Climatology[" + label + ", groups=" + means.size() + "]";
    }
}
