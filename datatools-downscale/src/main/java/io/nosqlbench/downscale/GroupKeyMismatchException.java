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

/// Thrown when a group key seen at prediction time has no fitted counterpart.
public class GroupKeyMismatchException extends DownscaleException {

    private final int groupKey;
    private final String lookup;

    public GroupKeyMismatchException(String lookup, int groupKey) {
        super(String.format("No %s fit for group key %d", lookup, groupKey));
        this.groupKey = groupKey;
        this.lookup = lookup;
    }

    public int getGroupKey() {
        return groupKey;
    }

    /// Returns the name of the fitted table that was missing the key,
    /// e.g. "mapper" or "target climatology".
    public String getLookup() {
        return lookup;
    }
}
