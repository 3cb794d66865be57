package io.nosqlbench.downscale.series;

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

import io.nosqlbench.downscale.MalformedSeriesException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SeriesIndexValidatorTest {

    @Test
    void acceptsGaplessMonthlySeries() {
        TimeSeries series = TimeSeries.monthly(YearMonth.of(1999, 6), new double[14]);
        assertSame(series, SeriesIndexValidator.checkResolution(series, Resolution.MONTHLY));
    }

    @Test
    void acceptsDailySeriesAcrossLeapDay() {
        TimeSeries series = TimeSeries.daily(LocalDate.of(2016, 2, 20), new double[20]);
        assertSame(series, SeriesIndexValidator.checkResolution(series, Resolution.DAILY));
    }

    @Test
    void rejectsMissingMonth() {
        LocalDate[] index = {LocalDate.of(2000, 1, 1), LocalDate.of(2000, 3, 1)};
        TimeSeries series = TimeSeries.of(index, new double[2]);
        assertThrows(MalformedSeriesException.class,
            () -> SeriesIndexValidator.checkResolution(series, Resolution.MONTHLY));
    }

    @Test
    void rejectsDailyDataAtMonthlyResolution() {
        TimeSeries series = TimeSeries.daily(LocalDate.of(2000, 1, 1), new double[3]);
        assertThrows(MalformedSeriesException.class,
            () -> SeriesIndexValidator.checkResolution(series, Resolution.MONTHLY));
    }

    @Test
    void rejectsMonthlyDataAtDailyResolution() {
        TimeSeries series = TimeSeries.monthly(YearMonth.of(2000, 1), new double[3]);
        assertThrows(MalformedSeriesException.class,
            () -> SeriesIndexValidator.checkResolution(series, Resolution.DAILY));
    }

    @Test
    void rejectsEmptySeries() {
        TimeSeries series = TimeSeries.of(new LocalDate[0], new double[0]);
        assertThrows(MalformedSeriesException.class,
            () -> SeriesIndexValidator.checkResolution(series, Resolution.DAILY));
    }
}
