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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EmpiricalQuantileMapTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    void onePointPerSampleByDefault() {
        EmpiricalQuantileMap map = EmpiricalQuantileMap.fromData(new double[]{3, 1, 2, 4, 5}, 0);

        assertArrayEquals(new double[]{0.0, 0.25, 0.5, 0.75, 1.0}, map.getReferences(), TOLERANCE);
        assertArrayEquals(new double[]{1, 2, 3, 4, 5}, map.getQuantiles(), TOLERANCE);
        assertEquals(5, map.getSampleCount());
        assertEquals(1.0, map.getMin());
        assertEquals(5.0, map.getMax());
    }

    @Test
    void quantileInterpolatesBetweenReferencePoints() {
        EmpiricalQuantileMap map = EmpiricalQuantileMap.fromData(new double[]{1, 2, 3, 4, 5}, 0);

        assertEquals(3.0, map.quantile(0.5), TOLERANCE);
        assertEquals(1.5, map.quantile(0.125), TOLERANCE);
        assertEquals(1.0, map.quantile(-0.1), TOLERANCE);
        assertEquals(5.0, map.quantile(1.5), TOLERANCE);
    }

    @Test
    void cdfInterpolatesAndClamps() {
        EmpiricalQuantileMap map = EmpiricalQuantileMap.fromData(new double[]{1, 2, 3, 4, 5}, 0);

        assertEquals(0.375, map.cdf(2.5), TOLERANCE);
        assertEquals(0.0, map.cdf(-10.0), TOLERANCE);
        assertEquals(1.0, map.cdf(10.0), TOLERANCE);
    }

    @Test
    void tiedValuesGetTheAverageRank() {
        EmpiricalQuantileMap map = EmpiricalQuantileMap.fromData(new double[]{1, 2, 2, 2, 3}, 0);
        assertEquals(0.5, map.cdf(2.0), TOLERANCE);
    }

    @Test
    void quantileCountIsCappedBySampleCount() {
        double[] data = new double[100];
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }
        assertEquals(11, EmpiricalQuantileMap.fromData(data, 11).getReferences().length);
        assertEquals(3, EmpiricalQuantileMap.fromData(new double[]{1, 2, 3}, 50).getReferences().length);
        assertEquals(49.5, EmpiricalQuantileMap.fromData(data, 11).quantile(0.5), TOLERANCE);
    }

    @Test
    void singleSampleMapsEverythingToIt() {
        EmpiricalQuantileMap map = EmpiricalQuantileMap.fromData(new double[]{7.0}, 0);
        assertEquals(7.0, map.quantile(0.0));
        assertEquals(7.0, map.quantile(0.42));
        assertEquals(7.0, map.quantile(1.0));
    }

    @Test
    void rejectsNaNAndEmptyData() {
        assertThrows(IllegalArgumentException.class,
            () -> EmpiricalQuantileMap.fromData(new double[]{1.0, Double.NaN}, 0));
        assertThrows(IllegalArgumentException.class,
            () -> EmpiricalQuantileMap.fromData(new double[0], 0));
    }
}
