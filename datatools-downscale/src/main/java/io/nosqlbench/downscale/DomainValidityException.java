package io.nosqlbench.downscale;

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

/// Thrown when fitted statistics fall outside the physical domain of the variable,
/// such as a non-positive precipitation climatology.
public class DomainValidityException extends DownscaleException {

    private final int groupKey;
    private final double value;

    public DomainValidityException(String what, int groupKey, double value) {
        super(String.format("Invalid value in %s: group %d has %s, expected a strictly positive value",
            what, groupKey, value));
        this.groupKey = groupKey;
        this.value = value;
    }

    public int getGroupKey() {
        return groupKey;
    }

    public double getValue() {
        return value;
    }
}
