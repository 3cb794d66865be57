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
import io.nosqlbench.downscale.state.TypeName;

import java.time.LocalDate;

/// Groups samples by calendar month, keys 1..12.
@TypeName(MonthGrouping.GROUPING_TYPE)
public final class MonthGrouping implements TimeGrouping {

    public static final String GROUPING_TYPE = "month";

    static final MonthGrouping INSTANCE = new MonthGrouping();

    MonthGrouping() {
    }

    @Override
    public String getGroupingType() {
        return GROUPING_TYPE;
    }

    @Override
    public Resolution resolution() {
        return Resolution.MONTHLY;
    }

    @Override
    public int groupKey(LocalDate date) {
        return date.getMonthValue();
    }

    @Override
    public int keyCount() {
        return 12;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MonthGrouping;
    }

    @Override
    public int hashCode() {
        return GROUPING_TYPE.hashCode();
    }

    @Override
    public String toString() {
        return "MonthGrouping";
    }
}
