package io.nosqlbench.series.convert;

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
import io.nosqlbench.series.error.ParseFailureException;
import io.nosqlbench.series.exec.Chunk;
import io.nosqlbench.series.exec.ChunkedExecutor;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Elementwise type conversion between textual and numeric series.
 *
 * <h2>Text to Numeric</h2>
 *
 * <pre>{@code
 *   worker k: parse chunk k into a private double[]      (never the shared series)
 *             on failure, report the failing global index and stop
 *   caller:   any failure?  -> throw for the lowest index, series untouched
 *             otherwise     -> concatenate buffers in chunk order, install, tag = FLOAT
 * }</pre>
 *
 * <p>Nothing is written into the series before every chunk has reported success. Workers
 * share one {@link AtomicInteger} holding the lowest failing index found so far; a worker
 * whose scan position passes it stops, since it could only find higher indexes. The
 * reported index is the minimum over the private per-chunk results.
 *
 * <h2>Numeric to Text</h2>
 *
 * <p>Infallible. Each worker formats its own index range of a freshly allocated array
 * with {@link NumericText#format(double)}; the ranges are disjoint.
 */
public final class ParallelConverter {

    private final ChunkedExecutor executor;

    public ParallelConverter(ChunkedExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Converts a textual series to numeric in place. No-op on a numeric series.
     *
     * @param series the series to convert
     * @throws ParseFailureException for the lowest index that does not parse; the series
     *         is then left exactly as it was
     */
    public void convertToNumeric(Series series) {
        Objects.requireNonNull(series, "series cannot be null");
        if (series.isNumeric()) {
            return;
        }
        String[] values = series.stringBuffer();
        AtomicInteger lowestFailure = new AtomicInteger(Integer.MAX_VALUE);
        List<ChunkParse> parts = executor.map(values.length, chunk -> parseChunk(values, chunk, lowestFailure));

        int failureIndex = -1;
        for (ChunkParse part : parts) {
            if (part.failureIndex() >= 0 && (failureIndex < 0 || part.failureIndex() < failureIndex)) {
                failureIndex = part.failureIndex();
            }
        }
        if (failureIndex >= 0) {
            throw new ParseFailureException(failureIndex, values[failureIndex]);
        }

        double[] converted = new double[values.length];
        for (ChunkParse part : parts) {
            if (part.values() == null) {
                throw new IllegalStateException("chunk " + part.chunk() + " stopped early without any failure");
            }
            System.arraycopy(part.values(), 0, converted, part.chunk().start(), part.values().length);
        }
        series.installFloats(converted);
    }

    /**
     * Converts a numeric series to text in place. No-op on a textual series.
     */
    public void convertToText(Series series) {
        Objects.requireNonNull(series, "series cannot be null");
        if (series.isText()) {
            return;
        }
        double[] values = series.floatBuffer();
        String[] converted = new String[values.length];
        executor.forEach(values.length, chunk -> {
            for (int i = chunk.start(); i < chunk.end(); i++) {
                converted[i] = NumericText.format(values[i]);
            }
        });
        series.installStrings(converted);
    }

    private static ChunkParse parseChunk(String[] values, Chunk chunk, AtomicInteger lowestFailure) {
        double[] local = new double[chunk.length()];
        for (int i = chunk.start(); i < chunk.end(); i++) {
            if (i > lowestFailure.get()) {
                return new ChunkParse(chunk, null, -1);
            }
            try {
                local[i - chunk.start()] = NumericText.parse(values[i]);
            } catch (NumberFormatException e) {
                lowestFailure.accumulateAndGet(i, Math::min);
                return new ChunkParse(chunk, null, i);
            }
        }
        return new ChunkParse(chunk, local, -1);
    }

    /// Private per-chunk outcome: parsed values, a first failing index, or neither when
    /// the worker stopped because a lower failure was already known.
    private record ChunkParse(Chunk chunk, double[] values, int failureIndex) {
    }
}
