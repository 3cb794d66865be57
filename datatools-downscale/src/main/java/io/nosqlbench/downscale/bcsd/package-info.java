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

/// # BCSD Models
///
/// Bias correction of a source series (e.g. a climate model run) against a target
/// series (e.g. station observations), in the BCSD style.
///
/// | Model | Anomaly | Climatologies | Trend handling |
/// |-------|---------|---------------|----------------|
/// | [io.nosqlbench.downscale.bcsd.BcsdPrecipitation] | ratio | target | none |
/// | [io.nosqlbench.downscale.bcsd.BcsdTemperature] | difference | source and target | monthly rolling mean removed, then restored |
///
/// ## Groupings by role
///
/// | Role | Monthly data | Daily data |
/// |------|--------------|------------|
/// | Precipitation quantile maps and climatology | month | padded day of year, each day ranked within its window |
/// | Temperature quantile maps and climatologies | month | climate trend grouping (day of month by default) |
/// | Trend extraction | month | month |
///
/// ## Usage
///
/// ```java
/// BcsdTemperature model = new BcsdTemperature(BcsdConfig.dailyPadded())
///     .fit(modelHistorical, observed);
/// TimeSeries anomalies = model.predict(modelFuture);
/// ```
package io.nosqlbench.downscale.bcsd;
