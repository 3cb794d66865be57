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

import java.util.List;

/// Thrown when a model is used for prediction before it has been fitted.
public class NotFittedException extends DownscaleException {

    private final String modelName;
    private final List<String> missingAttributes;

    public NotFittedException(String modelName, List<String> missingAttributes) {
        super(String.format("This %s instance is not fitted yet; missing fitted attributes %s. "
                + "Call fit with training data before predict.", modelName, missingAttributes));
        this.modelName = modelName;
        this.missingAttributes = List.copyOf(missingAttributes);
    }

    public String getModelName() {
        return modelName;
    }

    public List<String> getMissingAttributes() {
        return missingAttributes;
    }
}
