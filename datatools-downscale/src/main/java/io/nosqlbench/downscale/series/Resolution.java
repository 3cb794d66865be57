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

import java.time.LocalDate;
import java.time.YearMonth;

/// Sampling resolution of a climate series.
public enum Resolution {

    /// One sample per calendar month.
    MONTHLY,

    /// One sample per calendar day, leap days included.
    DAILY;

    /// Returns whether `next` is the sample directly following `previous` at this resolution.
    ///
    /// @param previous the earlier timestamp
    /// @param next the later timestamp
    /// @return true if there is no gap and no repeat between the two
    public boolean isSuccessor(LocalDate previous, LocalDate next) {
        return switch (this) {
            case MONTHLY -> YearMonth.from(previous).plusMonths(1).equals(YearMonth.from(next));
            case DAILY -> previous.plusDays(1).equals(next);
        };
    }
}
