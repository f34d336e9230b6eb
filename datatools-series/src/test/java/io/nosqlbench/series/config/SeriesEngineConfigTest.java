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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SeriesEngineConfigTest {

    @Test
    void defaults_autoParallelism() {
        SeriesEngineConfig config = SeriesEngineConfig.defaults();
        assertEquals(SeriesEngineConfig.AUTO_PARALLELISM, config.parallelism());
        assertEquals(SeriesEngineConfig.DEFAULT_SORT_THRESHOLD, config.sortThreshold());
        assertTrue(config.resolveParallelism() >= 1);
        assertEquals(Runtime.getRuntime().availableProcessors(), config.resolveParallelism());
    }

    @Test
    void withParallelism_pinsWorkerCount() {
        assertEquals(1, SeriesEngineConfig.withParallelism(1).resolveParallelism());
        assertEquals(6, SeriesEngineConfig.withParallelism(6).resolveParallelism());
    }

    @Test
    void builder_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> SeriesEngineConfig.builder().parallelism(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SeriesEngineConfig.builder().sortThreshold(1).build());
    }

    @Test
    void fromJson_partialFieldsTakeDefaults() {
        SeriesEngineConfig config = SeriesEngineConfig.fromJson(new StringReader("{\"parallelism\": 3}"));
        assertEquals(3, config.parallelism());
        assertEquals(SeriesEngineConfig.DEFAULT_SORT_THRESHOLD, config.sortThreshold());
    }

    @Test
    void fromJson_emptyDocument_isDefaults() {
        assertEquals(SeriesEngineConfig.defaults(), SeriesEngineConfig.fromJson(new StringReader("")));
    }

    @Test
    void fromJson_invalidValues_throw() {
        assertThrows(IllegalArgumentException.class,
            () -> SeriesEngineConfig.fromJson(new StringReader("{\"sort_threshold\": 0}")));
        assertThrows(IllegalArgumentException.class,
            () -> SeriesEngineConfig.fromJson(new StringReader("{\"parallelism\": \"many\"}")));
    }

    @Test
    void saveAndLoad_roundTrip(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("series-engine.json");
        SeriesEngineConfig written = SeriesEngineConfig.builder().parallelism(5).sortThreshold(1024).build();

        written.save(file);
        String json = Files.readString(file);
        assertTrue(json.contains("\"sort_threshold\": 1024"), json);

        assertEquals(written, SeriesEngineConfig.load(file));
    }

    @Test
    void load_missingFile_throwsIOException(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> SeriesEngineConfig.load(tempDir.resolve("absent.json")));
    }
}
