package io.nosqlbench.series.order;

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
import io.nosqlbench.series.SeriesType;
import io.nosqlbench.series.error.EmptySeriesException;
import io.nosqlbench.series.exec.ChunkedExecutor;

import java.util.Objects;

/**
 * Median and percentile over a sorted private copy of a numeric series.
 *
 * <p>The caller's series is never reordered. Each query sorts a fresh copy with
 * {@link ParallelMergeSort} in a pool of the executor's current width, then applies
 * index arithmetic to the sorted values.
 *
 * <h2>Percentile</h2>
 *
 * <p>Linear interpolation between closest ranks over the sorted copy of size {@code N}:
 * <pre>{@code
 *   idx    = (p / 100) * (N - 1)
 *   lower  = floor(idx),  upper = lower + 1,  weight = idx - lower
 *   result = upper >= N ? v[lower] : v[lower] * (1 - weight) + v[upper] * weight
 * }</pre>
 *
 * <p>So {@code p = 0} is the minimum, {@code p = 100} the maximum and {@code p = 50}
 * agrees with the median. Scaling the rank by {@code N} instead of {@code N - 1} would
 * break that last property: p50 of {@code [10, 20, 30, 40]} is 25 here, where a rank of
 * {@code (p / 100) * N} would give 30.
 */
public final class OrderStatistics {

    private final ChunkedExecutor executor;

    public OrderStatistics(ChunkedExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Returns a sorted copy of the series values.
     */
    public double[] sortedCopy(Series series) {
        return sortedValues(series, "sortedCopy");
    }

    /**
     * Returns the middle element for odd lengths, the mean of the two central elements
     * for even lengths.
     */
    public double median(Series series) {
        double[] sorted = sortedValues(series, "median");
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    /**
     * Returns the interpolated p-th percentile.
     *
     * @param series numeric, non-empty series
     * @param p percentile in {@code [0, 100]}
     * @throws IllegalArgumentException if {@code p} is outside {@code [0, 100]} or NaN
     */
    public double percentile(Series series, double p) {
        if (!(p >= 0.0 && p <= 100.0)) {
            throw new IllegalArgumentException("percentile must be in [0, 100], got: " + p);
        }
        return interpolate(sortedValues(series, "percentile"), p);
    }

    /**
     * Applies percentile interpolation to already sorted values.
     */
    static double interpolate(double[] sorted, double p) {
        int size = sorted.length;
        double index = (p / 100.0) * (size - 1);
        int lower = (int) Math.floor(index);
        int upper = lower + 1;
        double weight = index - lower;
        if (upper >= size || weight == 0.0) {
            return sorted[lower];
        }
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    private double[] sortedValues(Series series, String operation) {
        Objects.requireNonNull(series, "series cannot be null");
        series.requireType(SeriesType.FLOAT, operation);
        if (series.isEmpty()) {
            throw new EmptySeriesException(operation);
        }
        double[] copy = series.toFloatArray();
        executor.invoke(new ParallelMergeSort(copy, executor.config().sortThreshold()));
        return copy;
    }
}
