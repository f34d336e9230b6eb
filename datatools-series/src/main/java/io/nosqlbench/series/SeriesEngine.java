package io.nosqlbench.series;

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
import io.nosqlbench.series.convert.ParallelConverter;
import io.nosqlbench.series.error.EmptySeriesException;
import io.nosqlbench.series.error.ParseFailureException;
import io.nosqlbench.series.error.WrongColumnTypeException;
import io.nosqlbench.series.exec.ChunkedExecutor;
import io.nosqlbench.series.filter.ParallelFilter;
import io.nosqlbench.series.order.OrderStatistics;
import io.nosqlbench.series.reduce.ParallelReducer;
import io.nosqlbench.series.reduce.SeriesSummary;
import io.nosqlbench.series.text.AuxiliaryQueries;
import io.nosqlbench.series.text.ParallelTextTransformer;

import java.util.List;
import java.util.Objects;
import java.util.function.DoublePredicate;
import java.util.function.Predicate;

/**
 * Entry point for chunk-parallel operations on a single {@link Series}.
 *
 * <h2>Operations</h2>
 *
 * <table>
 *   <caption>Series operations</caption>
 *   <tr><th>Group</th><th>Methods</th><th>Effect</th></tr>
 *   <tr><td>Reduction</td><td>reduceSum, reduceMean, reduceMin, reduceMax, reduceProduct,
 *       reduceVariance, describe</td><td>returns a scalar</td></tr>
 *   <tr><td>Order statistics</td><td>median, percentile, sortedCopy</td><td>returns a scalar or copy</td></tr>
 *   <tr><td>Filter</td><td>filter, filterFloats, filterStrings</td><td>compacts the series</td></tr>
 *   <tr><td>Conversion</td><td>convertToNumeric, convertToText</td><td>replaces the series values</td></tr>
 *   <tr><td>Text</td><td>replace, replaceWholeWord</td><td>rewrites text elements</td></tr>
 *   <tr><td>Diagnostics</td><td>countWord, nonNumericValues</td><td>returns a count or list</td></tr>
 * </table>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SeriesEngine engine = new SeriesEngine();
 * Series prices = Series.ofStrings("10", "20", "30", "40", "50");
 *
 * engine.convertToNumeric(prices);
 * int[] kept = engine.filterFloats(prices, v -> v > 15);   // {1, 2, 3, 4}
 * double mean = engine.reduceMean(prices);                 // 35.0
 * }</pre>
 *
 * <p>Every call blocks until all of its workers have finished. An engine holds no mutable
 * state and may be shared; the series passed to it may not be used concurrently.
 */
public final class SeriesEngine {

    private final SeriesEngineConfig config;
    private final ParallelReducer reducer;
    private final OrderStatistics orderStatistics;
    private final ParallelFilter filter;
    private final ParallelConverter converter;
    private final ParallelTextTransformer textTransformer;

    /**
     * Creates an engine using the hardware parallelism at each call.
     */
    public SeriesEngine() {
        this(SeriesEngineConfig.defaults());
    }

    public SeriesEngine(SeriesEngineConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        ChunkedExecutor executor = new ChunkedExecutor(config);
        this.reducer = new ParallelReducer(executor);
        this.orderStatistics = new OrderStatistics(executor);
        this.filter = new ParallelFilter(executor);
        this.converter = new ParallelConverter(executor);
        this.textTransformer = new ParallelTextTransformer(executor);
    }

    /**
     * Creates an engine pinned to a fixed worker count.
     *
     * @param parallelism worker count, at least 1
     */
    public static SeriesEngine withParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        return new SeriesEngine(SeriesEngineConfig.withParallelism(parallelism));
    }

    public SeriesEngineConfig config() {
        return config;
    }

    // Reductions

    /**
     * @throws WrongColumnTypeException if the series is textual
     * @throws EmptySeriesException if the series is empty
     */
    public double reduceSum(Series series) {
        return reducer.sum(series);
    }

    /**
     * @throws WrongColumnTypeException if the series is textual
     * @throws EmptySeriesException if the series is empty
     */
    public double reduceMean(Series series) {
        return reducer.mean(series);
    }

    public double reduceMin(Series series) {
        return reducer.min(series);
    }

    public double reduceMax(Series series) {
        return reducer.max(series);
    }

    public double reduceProduct(Series series) {
        return reducer.product(series);
    }

    /**
     * Population variance around the series mean.
     */
    public double reduceVariance(Series series) {
        return reducer.variance(series);
    }

    /**
     * Population variance around a mean the caller already has.
     */
    public double reduceVariance(Series series, double mean) {
        return reducer.variance(series, mean);
    }

    /**
     * Computes count, sum, mean, min, max, population variance, standard deviation and
     * median in one call.
     *
     * @throws WrongColumnTypeException if the series is textual
     * @throws EmptySeriesException if the series is empty
     */
    public SeriesSummary describe(Series series) {
        double sum = reducer.sum(series);
        double mean = sum / series.length();
        double variance = reducer.variance(series, mean);
        return new SeriesSummary(
            series.length(),
            sum,
            mean,
            reducer.min(series),
            reducer.max(series),
            variance,
            Math.sqrt(variance),
            orderStatistics.median(series));
    }

    // Order statistics

    public double median(Series series) {
        return orderStatistics.median(series);
    }

    /**
     * @param p percentile in {@code [0, 100]}
     */
    public double percentile(Series series, double p) {
        return orderStatistics.percentile(series, p);
    }

    public double[] sortedCopy(Series series) {
        return orderStatistics.sortedCopy(series);
    }

    // Filtering

    /**
     * Compacts the series to the matching elements.
     *
     * @return pre-compaction indexes of the retained elements
     * @throws IllegalStateException if the predicate variant differs from the series
     */
    public int[] filter(Series series, SeriesPredicate predicate) {
        return filter.filter(series, predicate);
    }

    public int[] filterFloats(Series series, DoublePredicate condition) {
        return filter.filterFloats(series, condition);
    }

    public int[] filterStrings(Series series, Predicate<String> condition) {
        return filter.filterStrings(series, condition);
    }

    // Conversion

    /**
     * @throws ParseFailureException for the lowest unparseable index; the series is unchanged
     */
    public void convertToNumeric(Series series) {
        converter.convertToNumeric(series);
    }

    public void convertToText(Series series) {
        converter.convertToText(series);
    }

    // Text

    public void replace(Series series, String target, String replacement) {
        textTransformer.replace(series, target, replacement);
    }

    public void replaceWholeWord(Series series, String word, String replacement) {
        textTransformer.replaceWholeWord(series, word, replacement);
    }

    // Diagnostics

    public long countWord(Series series, String word) {
        return AuxiliaryQueries.countWord(series, word);
    }

    public List<String> nonNumericValues(Series series) {
        return AuxiliaryQueries.nonNumericValues(series);
    }
}
