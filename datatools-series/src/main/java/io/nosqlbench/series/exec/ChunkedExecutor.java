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

import io.nosqlbench.series.config.SeriesEngineConfig;
import io.nosqlbench.series.error.SeriesExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs chunk workers over a column in parallel and hands back their partial results.
 *
 * <h2>Execution Model</h2>
 *
 * <pre>{@code
 * ┌──────────────────────────────────────────────────────────────────┐
 * │ PARTITION   [0, L) -> chunk0, chunk1, ... chunkN  (contiguous)   │
 * └──────────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌──────────────────────────────────────────────────────────────────┐
 * │ FAN-OUT     fresh pool of `width` threads, one task per chunk    │
 * │             each task returns a private partial result           │
 * └──────────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌──────────────────────────────────────────────────────────────────┐
 * │ FAN-IN      caller blocks on every task, in chunk order          │
 * │             results list index == chunk index                    │
 * └──────────────────────────────────────────────────────────────────┘
 * }</pre>
 *
 * <p>The worker width is resolved from the {@link SeriesEngineConfig} on every call and a
 * new pool of that width is created and shut down within the call. Recursive tasks such
 * as the merge sort get a fresh {@link ForkJoinPool} of the same width instead. Completion
 * order of the workers is unspecified; the results are always returned in ascending chunk
 * order, so anything that depends on ordering is derived by the caller during the
 * sequential combine.
 *
 * <h2>Failures</h2>
 *
 * <p>If a worker throws an unchecked exception or an error, it is rethrown to the caller
 * as is. Before that, the pool is shut down: chunks not yet started are dropped, running
 * workers are interrupted, and the caller waits until every one of them has returned, so
 * no worker outlives the call. Interruption of the waiting thread and checked worker
 * failures surface as {@link SeriesExecutionException}.
 */
public final class ChunkedExecutor {

    private static final Logger logger = LogManager.getLogger(ChunkedExecutor.class);

    private final SeriesEngineConfig config;

    public ChunkedExecutor(SeriesEngineConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public SeriesEngineConfig config() {
        return config;
    }

    /**
     * Returns the worker width for a call starting now.
     */
    public int width() {
        return config.resolveParallelism();
    }

    /**
     * Partitions {@code [0, length)} and runs the worker once per chunk.
     *
     * @param length number of elements to cover
     * @param worker the per-chunk function
     * @param <R> partial result type
     * @return one result per chunk, in chunk order; empty when {@code length} is 0
     */
    public <R> List<R> map(int length, ChunkWorker<R> worker) {
        Objects.requireNonNull(worker, "worker cannot be null");
        int width = width();
        List<Chunk> chunks = ChunkPartitioner.partition(length, width);
        if (chunks.isEmpty()) {
            return Collections.emptyList();
        }
        logger.debug("Dispatching {} chunks of length {} over {} workers", chunks.size(), length, width);

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(width, chunks.size()), new WorkerThreadFactory());
        try {
            List<Future<R>> futures = new ArrayList<>(chunks.size());
            for (Chunk chunk : chunks) {
                futures.add(pool.submit(() -> worker.process(chunk)));
            }
            List<R> results = new ArrayList<>(chunks.size());
            for (Future<R> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            pool.shutdownNow();
            awaitTermination(pool);
        }
    }

    /**
     * Runs an action over every chunk of {@code [0, length)} for its side effects on
     * disjoint index ranges.
     *
     * @param length number of elements to cover
     * @param action the per-chunk action
     */
    public void forEach(int length, Consumer<Chunk> action) {
        Objects.requireNonNull(action, "action cannot be null");
        map(length, chunk -> {
            action.accept(chunk);
            return Boolean.TRUE;
        });
    }

    /**
     * Runs a recursive fork/join task in a fresh pool of the current width.
     *
     * @param task the root task
     * @param <R> task result type
     * @return the task result
     */
    public <R> R invoke(ForkJoinTask<R> task) {
        Objects.requireNonNull(task, "task cannot be null");
        int width = width();
        logger.debug("Invoking {} over {} workers", task.getClass().getSimpleName(), width);
        ForkJoinPool pool = new ForkJoinPool(width);
        try {
            return pool.invoke(task);
        } finally {
            pool.shutdownNow();
            awaitTermination(pool);
        }
    }

    private static <R> R await(Future<R> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SeriesExecutionException("Interrupted while waiting for chunk workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new SeriesExecutionException("Chunk worker failed", cause);
        }
    }

    /// Blocks until every worker of a shut down pool has returned. An interrupt arriving
    /// during the wait is deferred and restored afterwards.
    private static void awaitTermination(ExecutorService pool) {
        boolean interrupted = Thread.interrupted();
        while (!pool.isTerminated()) {
            try {
                pool.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_IDS = new AtomicInteger();
        private final int poolId = POOL_IDS.incrementAndGet();
        private final AtomicInteger threadIds = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "series-" + poolId + "-worker-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
