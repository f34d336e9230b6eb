package io.nosqlbench.series.reduce;

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

import java.util.List;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/**
 * Fan-out/fan-in reductions over a numeric series.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 *   values:   [ a0 a1 a2 | a3 a4 a5 | a6 a7 ]
 *                 ↓           ↓         ↓
 *   workers:  fold(id,a0..a2) fold(id,a3..a5) fold(id,a6,a7)     (parallel)
 *                 ↓           ↓         ↓
 *   combine:  p0 ⊕ p1 ⊕ p2                                        (caller thread)
 * }</pre>
 *
 * <p>Partials are private to their worker until the single combine. Because the operator
 * is associative and commutative the result does not depend on how the column was cut,
 * up to floating point rounding.
 *
 * <h2>Preconditions</h2>
 *
 * <ul>
 *   <li>textual series: {@link io.nosqlbench.series.error.WrongColumnTypeException}</li>
 *   <li>zero elements: {@link EmptySeriesException}</li>
 * </ul>
 *
 * <p>The type check comes first, so an empty textual series reports the wrong type.
 */
public final class ParallelReducer {

    private final ChunkedExecutor executor;

    public ParallelReducer(ChunkedExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Reduces the series with an ad hoc operator.
     *
     * @param series numeric, non-empty series
     * @param identity neutral element of {@code combine}
     * @param combine associative and commutative operator
     * @return the reduced value
     */
    public double reduce(Series series, double identity, DoubleBinaryOperator combine) {
        return reduce(series, Reduction.of("reduce", identity, combine));
    }

    /**
     * Reduces the series with the given reduction.
     */
    public double reduce(Series series, Reduction reduction) {
        Objects.requireNonNull(reduction, "reduction cannot be null");
        double[] values = numericValues(series, reduction.name());
        List<Double> partials = executor.map(values.length,
            chunk -> reduction.fold(values, chunk.start(), chunk.end()));

        DoubleBinaryOperator combine = reduction.combine();
        double result = reduction.identity();
        for (double partial : partials) {
            result = combine.applyAsDouble(result, partial);
        }
        return result;
    }

    public double sum(Series series) {
        return reduce(series, Reduction.SUM);
    }

    public double product(Series series) {
        return reduce(series, Reduction.PRODUCT);
    }

    /**
     * Returns the smallest value. NaN anywhere in the series yields NaN.
     */
    public double min(Series series) {
        return reduce(series, Reduction.MIN);
    }

    /**
     * Returns the largest value. NaN anywhere in the series yields NaN.
     */
    public double max(Series series) {
        return reduce(series, Reduction.MAX);
    }

    /**
     * Returns {@code sum / length}.
     */
    public double mean(Series series) {
        numericValues(series, "mean");
        return sum(series) / series.length();
    }

    /**
     * Returns the population variance (divisor {@code length}) around a freshly computed mean.
     */
    public double variance(Series series) {
        numericValues(series, "variance");
        return variance(series, mean(series));
    }

    /**
     * Returns the population variance (divisor {@code length}) around the supplied mean.
     *
     * @param series numeric, non-empty series
     * @param mean center of the squared deviations
     */
    public double variance(Series series, double mean) {
        Reduction squaredDeviations = Reduction.mapped("variance", 0.0, v -> {
            double diff = v - mean;
            return diff * diff;
        }, Double::sum);
        return reduce(series, squaredDeviations) / series.length();
    }

    /**
     * Returns the square root of {@link #variance(Series)}.
     */
    public double stdDev(Series series) {
        return Math.sqrt(variance(series));
    }

    private static double[] numericValues(Series series, String operation) {
        Objects.requireNonNull(series, "series cannot be null");
        series.requireType(SeriesType.FLOAT, operation);
        if (series.isEmpty()) {
            throw new EmptySeriesException(operation);
        }
        return series.floatBuffer();
    }
}
