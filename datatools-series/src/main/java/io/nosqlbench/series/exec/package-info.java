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

/// Partitioning of an index range into per-worker chunks, and the executor that runs a
/// worker per chunk and returns the partial results in chunk order.
///
/// @see io.nosqlbench.series.exec.ChunkPartitioner
/// @see io.nosqlbench.series.exec.ChunkedExecutor
package io.nosqlbench.series.exec;
