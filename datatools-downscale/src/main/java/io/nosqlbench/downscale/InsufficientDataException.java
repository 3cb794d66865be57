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

/// Thrown when a group holds too few samples to fit a stable statistic.
public class InsufficientDataException extends DownscaleException {

    private final int groupKey;
    private final int sampleCount;
    private final int required;

    public InsufficientDataException(int groupKey, int sampleCount, int required) {
        super(String.format("Insufficient data for group key %d: %d samples, at least %d required",
            groupKey, sampleCount, required));
        this.groupKey = groupKey;
        this.sampleCount = sampleCount;
        this.required = required;
    }

    public int getGroupKey() {
        return groupKey;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getRequired() {
        return required;
    }
}
