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
import io.nosqlbench.series.config.SeriesEngineConfig;
import io.nosqlbench.series.error.EmptySeriesException;
import io.nosqlbench.series.error.WrongColumnTypeException;
import io.nosqlbench.series.exec.ChunkedExecutor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class OrderStatisticsTest {

    private static OrderStatistics stats(int workers) {
        return new OrderStatistics(new ChunkedExecutor(SeriesEngineConfig.withParallelism(workers)));
    }

    @Test
    void median_evenLength_averagesCentralPair() {
        assertEquals(2.5, stats(2).median(Series.ofFloats(1, 2, 3, 4)));
    }

    @Test
    void median_oddLength_takesMiddle() {
        assertEquals(2.0, stats(2).median(Series.ofFloats(1, 2, 3)));
    }

    @Test
    void median_unsortedInput_leavesSeriesOrderAlone() {
        Series series = Series.ofFloats(9, 1, 5, 3, 7);
        assertEquals(5.0, stats(4).median(series));
        assertEquals(Series.ofFloats(9, 1, 5, 3, 7), series);
    }

    @Test
    void percentile_interpolatesBetweenRanks() {
        Series series = Series.ofFloats(10, 20, 30, 40);
        OrderStatistics stats = stats(3);
        assertEquals(25.0, stats.percentile(series, 50), 1e-12);
        assertEquals(17.5, stats.percentile(series, 25), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({"0,10", "100,40"})
    void percentile_boundsAreMinAndMax(double p, double expected) {
        assertEquals(expected, stats(2).percentile(Series.ofFloats(40, 10, 30, 20), p));
    }

    @Test
    void percentile_fiftyAgreesWithMedian() {
        Random random = new Random(11);
        for (int trial = 0; trial < 20; trial++) {
            double[] values = random.doubles(1 + random.nextInt(500)).toArray();
            Series series = Series.ofFloats(values);
            OrderStatistics stats = stats(1 + trial % 8);
            assertEquals(stats.median(series), stats.percentile(series, 50), 1e-12);
        }
    }

    @Test
    void percentile_singleElement() {
        assertEquals(7.0, stats(4).percentile(Series.ofFloats(7), 33));
    }

    @Test
    void percentile_outOfRange_throws() {
        Series series = Series.ofFloats(1, 2, 3);
        assertThrows(IllegalArgumentException.class, () -> stats(2).percentile(series, -0.1));
        assertThrows(IllegalArgumentException.class, () -> stats(2).percentile(series, 100.5));
        assertThrows(IllegalArgumentException.class, () -> stats(2).percentile(series, Double.NaN));
    }

    @Test
    void sortedCopy_largeInput_matchesArraysSort() {
        Random random = new Random(3);
        double[] values = new double[50_000];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextGaussian();
        }
        OrderStatistics stats = new OrderStatistics(new ChunkedExecutor(
            SeriesEngineConfig.builder().parallelism(4).sortThreshold(64).build()));

        double[] expected = values.clone();
        Arrays.sort(expected);
        assertArrayEquals(expected, stats.sortedCopy(Series.ofFloats(values)));
    }

    @Test
    void wrongTypeAndEmpty_throw() {
        assertThrows(WrongColumnTypeException.class, () -> stats(2).median(Series.ofStrings("1")));
        assertThrows(WrongColumnTypeException.class, () -> stats(2).percentile(Series.ofStrings("1"), 50));
        assertThrows(EmptySeriesException.class, () -> stats(2).median(Series.ofFloats()));
        assertThrows(EmptySeriesException.class, () -> stats(2).percentile(Series.ofFloats(), 50));
    }
}
