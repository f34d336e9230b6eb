package io.nosqlbench.series.reduce;

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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.series.config.SeriesGsonConfig;

/// Descriptive statistics of a numeric series, as produced by
/// [io.nosqlbench.series.SeriesEngine#describe(io.nosqlbench.series.Series)].
///
/// Variance and standard deviation are population measures.
///
/// ```json
/// {
///   "count": 8,
///   "sum": 40.0,
///   "mean": 5.0,
///   "min": 2.0,
///   "max": 9.0,
///   "variance": 4.0,
///   "std_dev": 2.0,
///   "median": 4.5
/// }
/// ```
public record SeriesSummary(
    @SerializedName("count") int count,
    @SerializedName("sum") double sum,
    @SerializedName("mean") double mean,
    @SerializedName("min") double min,
    @SerializedName("max") double max,
    @SerializedName("variance") double variance,
    @SerializedName("std_dev") double stdDev,
    @SerializedName("median") double median
) {

    /// Serializes this summary with the shared series Gson configuration.
    public String toJson() {
        return SeriesGsonConfig.gson().toJson(this);
    }

    /// Reads a summary previously written by [#toJson()].
    public static SeriesSummary fromJson(String json) {
        return SeriesGsonConfig.gson().fromJson(json, SeriesSummary.class);
    }
}
