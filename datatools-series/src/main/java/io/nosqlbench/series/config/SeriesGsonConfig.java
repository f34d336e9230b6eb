package io.nosqlbench.series.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for series engine JSON.
///
/// ## Purpose
///
/// Provides a configured [Gson] instance for reading and writing
/// [SeriesEngineConfig] files and [io.nosqlbench.series.reduce.SeriesSummary] snapshots.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable config files |
/// | HTML escaping | Disabled | Cleaner text output |
/// | Special floating point values | Allowed | Summaries of series containing NaN or Infinity |
///
/// ## Thread Safety
///
/// The [Gson] instance is thread-safe and shared.
public final class SeriesGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private SeriesGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the series defaults, minus pretty printing.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
