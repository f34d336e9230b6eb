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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Execution settings for the series engine.
 *
 * <h2>Parallelism</h2>
 *
 * <p>The worker count used for every chunked operation. A value of {@code 0} (the
 * default) means "use the hardware parallelism", which is looked up from
 * {@link Runtime#availableProcessors()} on every call through {@link #resolveParallelism()}
 * and never cached. Tests pin an explicit value, including {@code 1} for
 * sequential-equivalence checks.
 *
 * <h2>JSON Form</h2>
 *
 * <pre>{@code
 * {
 *   "parallelism": 4,
 *   "sort_threshold": 8192
 * }
 * }</pre>
 *
 * <p>Missing fields take their defaults.
 *
 * @see SeriesGsonConfig
 */
public final class SeriesEngineConfig {

    private static final Logger logger = LogManager.getLogger(SeriesEngineConfig.class);

    /** Parallelism value meaning "resolve from the runtime on each call". */
    public static final int AUTO_PARALLELISM = 0;

    /** Default range size below which merge sort falls back to a sequential sort. */
    public static final int DEFAULT_SORT_THRESHOLD = 8192;

    /** Smallest accepted sort threshold. */
    public static final int MIN_SORT_THRESHOLD = 2;

    @SerializedName("parallelism")
    private final int parallelism;

    @SerializedName("sort_threshold")
    private final int sortThreshold;

    private SeriesEngineConfig(int parallelism, int sortThreshold) {
        this.parallelism = parallelism;
        this.sortThreshold = sortThreshold;
    }

    /**
     * Returns a config with automatic parallelism and the default sort threshold.
     */
    public static SeriesEngineConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a config pinned to the given worker count.
     *
     * @param parallelism worker count, at least 1
     */
    public static SeriesEngineConfig withParallelism(int parallelism) {
        return builder().parallelism(parallelism).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the configured parallelism, {@link #AUTO_PARALLELISM} when unset.
     */
    public int parallelism() {
        return parallelism;
    }

    public int sortThreshold() {
        return sortThreshold;
    }

    /**
     * Returns the worker count to use for one call.
     *
     * @return the configured parallelism, or the current number of available processors
     */
    public int resolveParallelism() {
        if (parallelism != AUTO_PARALLELISM) {
            return parallelism;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Reads a config from JSON.
     *
     * @param reader JSON source
     * @return the validated config
     * @throws IllegalArgumentException if the JSON is malformed or holds invalid values
     */
    public static SeriesEngineConfig fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        Json json;
        try {
            json = SeriesGsonConfig.gson().fromJson(reader, Json.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid series engine config: " + e.getMessage(), e);
        }
        Builder builder = builder();
        if (json != null) {
            if (json.parallelism != null) builder.parallelism(json.parallelism);
            if (json.sortThreshold != null) builder.sortThreshold(json.sortThreshold);
        }
        return builder.build();
    }

    /**
     * Loads a config from a JSON file.
     *
     * @param path the file to read
     * @return the validated config
     * @throws IOException if the file cannot be read
     */
    public static SeriesEngineConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            SeriesEngineConfig config = fromJson(reader);
            logger.debug("Loaded series engine config from {}: {}", path, config);
            return config;
        }
    }

    /**
     * Writes this config to a JSON file, replacing any existing content.
     *
     * @param path the file to write
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            SeriesGsonConfig.gson().toJson(this, writer);
        }
    }

    public String toJson() {
        return SeriesGsonConfig.gson().toJson(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeriesEngineConfig)) return false;
        SeriesEngineConfig that = (SeriesEngineConfig) o;
        return parallelism == that.parallelism && sortThreshold == that.sortThreshold;
    }

    @Override
    public int hashCode() {
        return Objects.hash(parallelism, sortThreshold);
    }

    @Override
    public String toString() {
        return "SeriesEngineConfig[parallelism="
            + (parallelism == AUTO_PARALLELISM ? "auto" : String.valueOf(parallelism))
            + ", sortThreshold=" + sortThreshold + "]";
    }

    // Nullable mirror of the JSON so absent fields can fall back to defaults
    private static final class Json {
        @SerializedName("parallelism")
        Integer parallelism;

        @SerializedName("sort_threshold")
        Integer sortThreshold;
    }

    /**
     * Builder for {@link SeriesEngineConfig}.
     */
    public static final class Builder {
        private int parallelism = AUTO_PARALLELISM;
        private int sortThreshold = DEFAULT_SORT_THRESHOLD;

        private Builder() {
        }

        /**
         * Sets a fixed worker count, or {@link #AUTO_PARALLELISM} to follow the runtime.
         */
        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder sortThreshold(int sortThreshold) {
            this.sortThreshold = sortThreshold;
            return this;
        }

        /**
         * @throws IllegalArgumentException if parallelism is negative or the sort
         *         threshold is below {@link #MIN_SORT_THRESHOLD}
         */
        public SeriesEngineConfig build() {
            if (parallelism < 0) {
                throw new IllegalArgumentException("parallelism must be >= 0, got: " + parallelism);
            }
            if (sortThreshold < MIN_SORT_THRESHOLD) {
                throw new IllegalArgumentException(
                    "sortThreshold must be >= " + MIN_SORT_THRESHOLD + ", got: " + sortThreshold);
            }
            return new SeriesEngineConfig(parallelism, sortThreshold);
        }
    }
}
