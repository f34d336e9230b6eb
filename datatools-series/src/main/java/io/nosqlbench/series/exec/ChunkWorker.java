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

/// The worker half of a fan-out: a function over one chunk producing a private result.
///
/// Implementations read shared input freely but must confine writes to indexes inside
/// their own chunk, or to the result they return.
///
/// @param <R> the per-chunk partial result type
@FunctionalInterface
public interface ChunkWorker<R> {

    /// Processes one chunk.
    ///
    /// @param chunk the index range to process
    /// @return the partial result for this chunk
    R process(Chunk chunk);
}
