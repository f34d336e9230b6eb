package io.nosqlbench.series.filter;

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

import io.nosqlbench.series.Series;
import io.nosqlbench.series.SeriesPredicate;
import io.nosqlbench.series.SeriesType;
import io.nosqlbench.series.exec.Chunk;
import io.nosqlbench.series.exec.ChunkedExecutor;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.DoublePredicate;
import java.util.function.Predicate;

/// Parallel predicate scan with in-order compaction.
///
/// ## Phases
///
/// ```text
///   scan     each worker tests its chunk, emits ascending global indexes   (parallel)
///   collect  concatenate chunk 0, chunk 1, ... in chunk order              (caller)
///   compact  copy retained elements into a fresh array, then swap it in    (caller)
/// ```
///
/// Collection follows chunk order rather than worker completion order, so the retained
/// elements keep their original relative order for every worker count.
///
/// ## Variant Mismatch
///
/// Applying a numeric predicate to a textual series, or the reverse, is a caller bug and
/// fails with [IllegalStateException] before any worker starts.
public final class ParallelFilter {

    private final ChunkedExecutor executor;

    public ParallelFilter(ChunkedExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /// Keeps only the elements matching the predicate.
    ///
    /// @param series the series to compact in place
    /// @param predicate condition of the same variant as the series
    /// @return the pre-compaction indexes of the retained elements, ascending
    /// @throws IllegalStateException if the predicate variant differs from the series variant
    public int[] filter(Series series, SeriesPredicate predicate) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(predicate, "predicate cannot be null");
        if (predicate.type() != series.type()) {
            throw new IllegalStateException(
                "Cannot apply a " + predicate.type() + " predicate to a " + series.type() + " series");
        }
        if (series.isEmpty()) {
            return new int[0];
        }

        List<int[]> partials;
        if (series.type() == SeriesType.FLOAT) {
            double[] values = series.floatBuffer();
            DoublePredicate condition = predicate.floatCondition();
            partials = executor.map(values.length, chunk -> scan(chunk, i -> condition.test(values[i])));
        } else {
            String[] values = series.stringBuffer();
            Predicate<String> condition = predicate.stringCondition();
            partials = executor.map(values.length, chunk -> scan(chunk, i -> condition.test(values[i])));
        }

        int[] matches = concat(partials);
        series.retainIndexes(matches);
        return matches;
    }

    /// Keeps only the numeric elements matching the condition.
    public int[] filterFloats(Series series, DoublePredicate condition) {
        return filter(series, SeriesPredicate.floats(condition));
    }

    /// Keeps only the text elements matching the condition.
    public int[] filterStrings(Series series, Predicate<String> condition) {
        return filter(series, SeriesPredicate.strings(condition));
    }

    private static int[] scan(Chunk chunk, IndexTest test) {
        int[] local = new int[chunk.length()];
        int count = 0;
        for (int i = chunk.start(); i < chunk.end(); i++) {
            if (test.matches(i)) {
                local[count++] = i;
            }
        }
        return count == local.length ? local : Arrays.copyOf(local, count);
    }

    private static int[] concat(List<int[]> partials) {
        int total = 0;
        for (int[] partial : partials) {
            total += partial.length;
        }
        int[] all = new int[total];
        int offset = 0;
        for (int[] partial : partials) {
            System.arraycopy(partial, 0, all, offset, partial.length);
            offset += partial.length;
        }
        return all;
    }

    @FunctionalInterface
    private interface IndexTest {
        boolean matches(int index);
    }
}
