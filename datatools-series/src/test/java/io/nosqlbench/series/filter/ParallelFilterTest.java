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
import io.nosqlbench.series.config.SeriesEngineConfig;
import io.nosqlbench.series.exec.ChunkedExecutor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ParallelFilterTest {

    private static ParallelFilter filter(int workers) {
        return new ParallelFilter(new ChunkedExecutor(SeriesEngineConfig.withParallelism(workers)));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8})
    void filterFloats_keepsMatchesInOrder(int workers) {
        Series series = Series.ofFloats(10, 20, 30, 40, 50);

        int[] indexes = filter(workers).filterFloats(series, v -> v > 15);

        assertThat(indexes).containsExactly(1, 2, 3, 4);
        assertThat(series).isEqualTo(Series.ofFloats(20, 30, 40, 50));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 8})
    void filterStrings_keepsMatchesInOrder(int workers) {
        Series series = Series.ofStrings("apple", "kiwi", "avocado", "banana", "apricot");

        int[] indexes = filter(workers).filterStrings(series, s -> s.startsWith("a"));

        assertThat(indexes).containsExactly(0, 2, 4);
        assertThat(series.toStringArray()).containsExactly("apple", "avocado", "apricot");
    }

    @Test
    void filter_largeRandom_matchesSequentialScan() {
        Random random = new Random(99);
        double[] values = new double[10_007];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextDouble();
        }
        List<Integer> expectedIndexes = new ArrayList<>();
        List<Double> expectedValues = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0.3) {
                expectedIndexes.add(i);
                expectedValues.add(values[i]);
            }
        }

        for (int workers = 1; workers <= 8; workers++) {
            Series series = Series.ofFloats(values);
            int[] indexes = filter(workers).filterFloats(series, v -> v < 0.3);

            assertThat(indexes).containsExactly(expectedIndexes.stream().mapToInt(Integer::intValue).toArray());
            assertThat(series.toFloatArray()).containsExactly(
                expectedValues.stream().mapToDouble(Double::doubleValue).toArray());
        }
    }

    @Test
    void filter_noMatches_emptiesSeries() {
        Series series = Series.ofFloats(1, 2, 3);
        int[] indexes = filter(2).filterFloats(series, v -> v > 100);
        assertThat(indexes).isEmpty();
        assertThat(series.length()).isZero();
        assertThat(series.isNumeric()).isTrue();
    }

    @Test
    void filter_emptySeries_returnsEmptyIndexSet() {
        Series series = Series.ofStrings();
        assertThat(filter(4).filterStrings(series, s -> true)).isEmpty();
        assertThat(series.isEmpty()).isTrue();
    }

    @Test
    void filter_predicateVariantMismatch_isFatal() {
        Series numeric = Series.ofFloats(1, 2, 3);
        Series text = Series.ofStrings("a", "b");

        assertThatThrownBy(() -> filter(2).filter(numeric, SeriesPredicate.strings(s -> true)))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> filter(2).filterFloats(text, v -> true))
            .isInstanceOf(IllegalStateException.class);

        assertThat(numeric).isEqualTo(Series.ofFloats(1, 2, 3));
        assertThat(text).isEqualTo(Series.ofStrings("a", "b"));
    }

    @Test
    void filter_predicateFailure_leavesSeriesUnchanged() {
        Series series = Series.ofFloats(1, 2, 3, 4);
        assertThatThrownBy(() -> filter(2).filterFloats(series, v -> {
            if (v == 3) throw new ArithmeticException("boom");
            return true;
        })).isInstanceOf(ArithmeticException.class);
        assertThat(series).isEqualTo(Series.ofFloats(1, 2, 3, 4));
    }

    @Test
    void filter_predicateFailure_returnsOnlyAfterOtherChunksFinish() {
        Series series = Series.ofFloats(1, 2);
        CountDownLatch secondStarted = new CountDownLatch(1);
        AtomicBoolean secondFinished = new AtomicBoolean(false);

        assertThatThrownBy(() -> filter(2).filterFloats(series, v -> {
            if (v == 1) {
                try {
                    secondStarted.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new ArithmeticException("boom");
            }
            secondStarted.countDown();
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            secondFinished.set(true);
            return true;
        })).isInstanceOf(ArithmeticException.class);

        assertThat(secondFinished).isTrue();
        assertThat(series).isEqualTo(Series.ofFloats(1, 2));
    }
}
