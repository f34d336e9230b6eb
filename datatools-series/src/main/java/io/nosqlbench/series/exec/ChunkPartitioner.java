package io.nosqlbench.series.exec;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Splits an index range into near-equal disjoint sub-ranges, one per worker.
///
/// ## Layout
///
/// ```text
///   L = 10, P = 4  ->  chunkSize = ceil(10 / 4) = 3
///
///   [0 1 2][3 4 5][6 7 8][9]
///    chunk0 chunk1 chunk2 chunk3
///
///   L = 3, P = 8   ->  chunkSize = 1, chunks 3..7 start past L and are dropped
/// ```
///
/// The returned chunks are ordered by start index, disjoint, and their union is exactly
/// `[0, L)`. A length of zero produces no chunks.
public final class ChunkPartitioner {

    private ChunkPartitioner() {
    }

    /// Partitions `[0, length)` for the given number of workers.
    ///
    /// @param length number of elements, at least 0
    /// @param workers number of workers, at least 1
    /// @return the chunks in ascending order; never more than `workers`
    /// @throws IllegalArgumentException if length is negative or workers is below 1
    public static List<Chunk> partition(int length, int workers) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0, got: " + length);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got: " + workers);
        }
        if (length == 0) {
            return Collections.emptyList();
        }

        int chunkSize = chunkSize(length, workers);
        List<Chunk> chunks = new ArrayList<>(Math.min(workers, length));
        for (int i = 0; i < workers; i++) {
            long start = (long) i * chunkSize;
            if (start >= length) {
                break;
            }
            int end = (int) Math.min(start + chunkSize, length);
            chunks.add(new Chunk(i, (int) start, end));
        }
        return chunks;
    }

    /// Returns `ceil(length / workers)`.
    public static int chunkSize(int length, int workers) {
        return (int) (((long) length + workers - 1) / workers);
    }
}
