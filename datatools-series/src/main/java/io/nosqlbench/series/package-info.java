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

/// Single-column series engine.
///
/// ## Overview
///
/// A [Series] holds one homogeneous column, numeric or textual. [SeriesEngine] runs
/// reductions, order statistics, filters, conversions and text rewrites over it, each
/// split into contiguous chunks processed in parallel and recombined in chunk order.
///
/// ## Packages
///
/// - `exec` - chunk partitioning and the fan-out/fan-in executor
/// - `reduce` - sum, product, min, max, mean, variance, summaries
/// - `order` - parallel merge sort, median, percentile
/// - `filter` - predicate scan and compaction
/// - `convert` - text/number conversion
/// - `text` - literal and whole-word replacement, diagnostic queries
/// - `config` - engine settings and JSON
/// - `error` - failure types
///
/// ## Usage
///
/// ```java
/// SeriesEngine engine = SeriesEngine.withParallelism(4);
/// Series column = Series.ofStrings("1.5", "2.0", "3");
/// engine.convertToNumeric(column);
/// double median = engine.median(column);   // 2.0
/// ```
package io.nosqlbench.series;
