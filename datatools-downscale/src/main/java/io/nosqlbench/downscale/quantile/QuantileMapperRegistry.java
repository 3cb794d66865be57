package io.nosqlbench.downscale.quantile;

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

import io.nosqlbench.downscale.GroupKeyMismatchException;
import io.nosqlbench.downscale.InsufficientDataException;
import io.nosqlbench.downscale.grouping.SeriesGroups;
import io.nosqlbench.downscale.series.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// Holds one fitted [QuantileMap] per group key.
///
/// ## Lifecycle
///
/// ```
///   fitByGroup(training groups)  ──► one map per key, replacing any previous set
///   transformByGroup(query partition[, context]) ──► per-group mapping, scattered back to time order
/// ```
///
/// Fitting is all-or-nothing: the stored maps are replaced only after every
/// group has been fitted. Once fitted, the registry is read-only and may be
/// shared by concurrent transforms.
public final class QuantileMapperRegistry {

    private static final Logger logger = LogManager.getLogger(QuantileMapperRegistry.class);

    private final QuantileMapper mapper;
    private volatile SortedMap<Integer, QuantileMap> maps = Collections.emptySortedMap();

    public QuantileMapperRegistry(QuantileMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    /// Restores a registry from previously fitted maps.
    ///
    /// @param mapper the mapper used to transform
    /// @param fitted the fitted maps by group key
    /// @return a fitted registry
    public static QuantileMapperRegistry restore(QuantileMapper mapper, Map<Integer, QuantileMap> fitted) {
        QuantileMapperRegistry registry = new QuantileMapperRegistry(mapper);
        registry.maps = Collections.unmodifiableSortedMap(new TreeMap<>(fitted));
        return registry;
    }

    /// Fits one quantile map for every group.
    ///
    /// @param groups the training groups
    /// @throws InsufficientDataException if any group holds fewer samples than the mapper accepts
    public void fitByGroup(SeriesGroups groups) {
        Objects.requireNonNull(groups, "groups cannot be null");
        int required = mapper.minSamples();
        SortedMap<Integer, QuantileMap> fitted = new TreeMap<>();
        for (SeriesGroups.Group group : groups) {
            if (group.size() < required) {
                throw new InsufficientDataException(group.key(), group.size(), required);
            }
            fitted.put(group.key(), mapper.fit(group.values()));
            logger.debug("Fitted quantile map for group {} from {} samples", group.key(), group.size());
        }
        this.maps = Collections.unmodifiableSortedMap(fitted);
        logger.debug("Fitted {} quantile maps", fitted.size());
    }

    /// Applies each group's fitted map and reassembles the result in time order.
    ///
    /// @param groups a partition of the query series
    /// @return the mapped series, index-aligned with the query
    /// @throws GroupKeyMismatchException if a query group has no fitted map
    public TimeSeries transformByGroup(SeriesGroups groups) {
        return transformByGroup(groups, groups);
    }

    /// Applies each group's fitted map, ranking the group's samples within the
    /// context group of the same key, and reassembles the result in time order.
    ///
    /// @param groups a partition of the query series
    /// @param context per-key ranking samples; each contains the partition group of its key
    /// @return the mapped series, index-aligned with the query
    /// @throws GroupKeyMismatchException if a query group has no fitted map
    public TimeSeries transformByGroup(SeriesGroups groups, SeriesGroups context) {
        Objects.requireNonNull(groups, "groups cannot be null");
        Objects.requireNonNull(context, "context cannot be null");
        SortedMap<Integer, QuantileMap> fitted = this.maps;
        return groups.apply(group -> {
            QuantileMap map = fitted.get(group.key());
            if (map == null) {
                throw new GroupKeyMismatchException("quantile mapper", group.key());
            }
            if (context == groups) {
                return mapper.transform(map, group.values());
            }
            SeriesGroups.Group window = context.get(group.key());
            if (window == null) {
                throw new IllegalStateException("no ranking context for group " + group.key());
            }
            return select(window, mapper.transform(map, window.values()), group);
        });
    }

    /// Picks the mapped values of `group` out of the mapped values of its window.
    private static double[] select(SeriesGroups.Group window, double[] mappedWindow, SeriesGroups.Group group) {
        int[] from = window.positions();
        int[] wanted = group.positions();
        double[] out = new double[wanted.length];
        int j = 0;
        for (int k = 0; k < wanted.length; k++) {
            while (j < from.length && from[j] < wanted[k]) {
                j++;
            }
            if (j == from.length || from[j] != wanted[k]) {
                throw new IllegalStateException(String.format(
                    "sample %d of group %d is outside its ranking context", wanted[k], group.key()));
            }
            out[k] = mappedWindow[j];
        }
        return out;
    }

    public boolean isFitted() {
        return !maps.isEmpty();
    }

    /// Returns the fitted map for `key`, or null.
    public QuantileMap get(int key) {
        return maps.get(key);
    }

    /// Returns an unmodifiable view of the fitted maps by key.
    public SortedMap<Integer, QuantileMap> getMaps() {
        return maps;
    }

    public QuantileMapper getMapper() {
        return mapper;
    }

    @Override
    public String toString() {
        return "QuantileMapperRegistry[groups=" + maps.keySet() + "]";
    }
}
