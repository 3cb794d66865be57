package io.nosqlbench.downscale.state;

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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the serialization type name for a polymorphic state type, such as a
 * {@link io.nosqlbench.downscale.quantile.QuantileMap} or a
 * {@link io.nosqlbench.downscale.grouping.TimeGrouping} variant.
 *
 * <h2>JSON Output</h2>
 *
 * <p>The annotated type name appears as a "type" field in serialized JSON:
 *
 * <pre>{@code
 * {
 *   "type": "padded_day_of_year",
 *   "offset": 15
 * }
 * }</pre>
 *
 * @see TypeDiscriminatorAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TypeName {
    /**
     * The type name used in JSON serialization. Lowercase with underscores,
     * unique within one base type.
     *
     * @return the type discriminator string
     */
    String value();
}
