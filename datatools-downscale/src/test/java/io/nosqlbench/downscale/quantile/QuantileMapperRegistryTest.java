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
import io.nosqlbench.downscale.grouping.TimeGrouping;
import io.nosqlbench.downscale.series.TimeSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class QuantileMapperRegistryTest {

    private static TimeSeries randomMonthly(YearMonth start, int months, long seed) {
        Random random = new Random(seed);
        double[] values = new double[months];
        for (int i = 0; i < months; i++) {
            values[i] = random.nextGaussian();
        }
        return TimeSeries.monthly(start, values);
    }

    private static QuantileMapperRegistry registry(int minSamples) {
        return new QuantileMapperRegistry(new EmpiricalQuantileMapper(
            QuantileMapperOptions.builder().minSamples(minSamples).build()));
    }

    @Test
    void fitsOneMapPerGroup() {
        QuantileMapperRegistry registry = registry(2);
        assertFalse(registry.isFitted());

        registry.fitByGroup(TimeGrouping.monthly().fitGroups(randomMonthly(YearMonth.of(2000, 1), 36, 1)));

        assertTrue(registry.isFitted());
        assertEquals(12, registry.getMaps().size());
        assertEquals(3, registry.get(7).getSampleCount());
    }

    @Test
    void trainingDataMapsOntoItself() {
        TimeSeries training = randomMonthly(YearMonth.of(2000, 1), 60, 2);
        QuantileMapperRegistry registry = registry(2);
        registry.fitByGroup(TimeGrouping.monthly().fitGroups(training));

        TimeSeries mapped = registry.transformByGroup(TimeGrouping.monthly().partition(training));

        assertTrue(mapped.hasSameIndex(training));
        assertArrayEquals(training.getValues(), mapped.getValues(), 1e-9);
    }

    @Test
    void paddedContextRanksEachDayWithinItsWindow() {
        TimeGrouping padded = TimeGrouping.paddedDayOfYear(2);
        Random random = new Random(5);
        double[] training = new double[3 * 365];
        for (int i = 0; i < training.length; i++) {
            training[i] = random.nextGaussian();
        }
        double[] queryValues = new double[365];
        for (int i = 0; i < queryValues.length; i++) {
            queryValues[i] = 10.0 * random.nextGaussian();
        }
        TimeSeries query = TimeSeries.daily(LocalDate.of(2005, 1, 1), queryValues);
        QuantileMapperRegistry registry = registry(2);
        registry.fitByGroup(padded.fitGroups(TimeSeries.daily(LocalDate.of(2001, 1, 1), training)));

        TimeSeries mapped = registry.transformByGroup(padded.partition(query), padded.contextGroups(query));

        for (int i : new int[]{0, 1, 100, 364}) {
            int key = query.dateAt(i).getDayOfYear();
            double[] window = padded.contextGroups(query).get(key).values();
            double u = EmpiricalQuantileMap.fromData(window, 0).cdf(query.valueAt(i));
            assertEquals(registry.get(key).quantile(u), mapped.valueAt(i), 1e-12, "day " + key);
        }
        assertEquals(4, padded.contextGroups(query).get(1).size());
    }

    @Test
    void contextWithoutTheGroupIsAnError() {
        TimeSeries training = randomMonthly(YearMonth.of(2000, 1), 36, 6);
        QuantileMapperRegistry registry = registry(2);
        registry.fitByGroup(TimeGrouping.monthly().fitGroups(training));
        TimeSeries query = randomMonthly(YearMonth.of(2003, 1), 24, 7);
        TimeSeries otherYear = randomMonthly(YearMonth.of(2005, 1), 12, 8);

        assertThrows(IllegalStateException.class, () -> registry.transformByGroup(
            TimeGrouping.monthly().partition(query), TimeGrouping.monthly().partition(otherYear)));
    }

    @Test
    void unseenGroupKeyIsRejected() {
        QuantileMapperRegistry registry = registry(1);
        registry.fitByGroup(TimeGrouping.monthly().fitGroups(randomMonthly(YearMonth.of(2000, 1), 6, 3)));

        TimeSeries query = randomMonthly(YearMonth.of(2000, 7), 6, 4);
        GroupKeyMismatchException e = assertThrows(GroupKeyMismatchException.class,
            () -> registry.transformByGroup(TimeGrouping.monthly().partition(query)));
        assertEquals(7, e.getGroupKey());
        assertTrue(e.getMessage().contains("group key 7"), e.getMessage());
    }

    @Test
    void insufficientGroupFailsWithoutReplacingMaps() {
        QuantileMapperRegistry registry = registry(3);
        registry.fitByGroup(TimeGrouping.monthly().fitGroups(randomMonthly(YearMonth.of(2000, 1), 36, 5)));
        var before = registry.getMaps();

        InsufficientDataException e = assertThrows(InsufficientDataException.class,
            () -> registry.fitByGroup(TimeGrouping.monthly().fitGroups(randomMonthly(YearMonth.of(2000, 1), 24, 6))));

        assertEquals(1, e.getGroupKey());
        assertEquals(2, e.getSampleCount());
        assertEquals(3, e.getRequired());
        assertSame(before, registry.getMaps());
    }

    @Test
    void restoredRegistryTransformsLikeTheOriginal() {
        TimeSeries training = randomMonthly(YearMonth.of(2000, 1), 48, 7);
        TimeSeries query = randomMonthly(YearMonth.of(2004, 1), 24, 8);
        QuantileMapperRegistry original = registry(2);
        original.fitByGroup(TimeGrouping.monthly().fitGroups(training));

        QuantileMapperRegistry restored = QuantileMapperRegistry.restore(original.getMapper(), original.getMaps());

        assertEquals(original.getMaps(), restored.getMaps());
        assertEquals(
            original.transformByGroup(TimeGrouping.monthly().partition(query)),
            restored.transformByGroup(TimeGrouping.monthly().partition(query)));
    }
}
