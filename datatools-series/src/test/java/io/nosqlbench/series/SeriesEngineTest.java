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

import io.nosqlbench.series.error.EmptySeriesException;
import io.nosqlbench.series.error.ParseFailureException;
import io.nosqlbench.series.error.WrongColumnTypeException;
import io.nosqlbench.series.reduce.SeriesSummary;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class SeriesEngineTest {

    @Test
    void pipeline_convertFilterReduce() {
        SeriesEngine engine = SeriesEngine.withParallelism(3);
        Series series = Series.ofStrings("10", "20", "30", "40", "50");

        assertThat(engine.nonNumericValues(series)).isEmpty();
        engine.convertToNumeric(series);
        int[] kept = engine.filterFloats(series, v -> v > 15);

        assertThat(kept).containsExactly(1, 2, 3, 4);
        assertThat(engine.reduceSum(series)).isEqualTo(140.0);
        assertThat(engine.reduceMean(series)).isEqualTo(35.0);
        assertThat(engine.reduceMin(series)).isEqualTo(20.0);
        assertThat(engine.reduceMax(series)).isEqualTo(50.0);
        assertThat(engine.reduceProduct(series)).isEqualTo(1_200_000.0);
        assertThat(engine.median(series)).isEqualTo(35.0);
        assertThat(engine.percentile(series, 50)).isEqualTo(35.0);
    }

    @Test
    void describe_summarizesSeries() {
        SeriesEngine engine = SeriesEngine.withParallelism(4);
        SeriesSummary summary = engine.describe(Series.ofFloats(2, 4, 4, 4, 5, 5, 7, 9));

        assertThat(summary.count()).isEqualTo(8);
        assertThat(summary.sum()).isEqualTo(40.0);
        assertThat(summary.mean()).isEqualTo(5.0);
        assertThat(summary.min()).isEqualTo(2.0);
        assertThat(summary.max()).isEqualTo(9.0);
        assertThat(summary.variance()).isCloseTo(4.0, within(1e-12));
        assertThat(summary.stdDev()).isCloseTo(2.0, within(1e-12));
        assertThat(summary.median()).isEqualTo(4.5);
    }

    @Test
    void describe_jsonRoundTrip() {
        SeriesSummary summary = SeriesEngine.withParallelism(2).describe(Series.ofFloats(1, 2, 3));
        String json = summary.toJson();

        assertThat(json).contains("\"std_dev\"");
        assertThat(SeriesSummary.fromJson(json)).isEqualTo(summary);
    }

    @Test
    void describe_preconditions() {
        SeriesEngine engine = SeriesEngine.withParallelism(2);
        assertThatThrownBy(() -> engine.describe(Series.ofStrings("a")))
            .isInstanceOf(WrongColumnTypeException.class);
        assertThatThrownBy(() -> engine.describe(Series.ofFloats()))
            .isInstanceOf(EmptySeriesException.class);
    }

    @Test
    void variance_withSuppliedMean() {
        SeriesEngine engine = SeriesEngine.withParallelism(2);
        assertThat(engine.reduceVariance(Series.ofFloats(1, 3))).isEqualTo(1.0);
        assertThat(engine.reduceVariance(Series.ofFloats(1, 3), 0.0)).isEqualTo(5.0);
    }

    @Test
    void textOperations_andDiagnostics() {
        SeriesEngine engine = new SeriesEngine();
        Series series = Series.ofStrings("red fox", "red", "redder", "x");

        assertThat(engine.countWord(series, "red")).isEqualTo(2);
        assertThat(engine.nonNumericValues(series)).containsExactly("red fox", "red", "redder", "x");

        engine.replaceWholeWord(series, "red", "blue");
        assertThat(series.toStringArray()).containsExactly("blue fox", "blue", "redder", "x");

        engine.replace(series, "e", "E");
        assertThat(series.toStringArray()).containsExactly("bluE fox", "bluE", "rEddEr", "x");
    }

    @Test
    void conversionFailure_surfacesThroughEngine() {
        SeriesEngine engine = SeriesEngine.withParallelism(2);
        Series series = Series.ofStrings("1.5", "x", "3");

        assertThatThrownBy(() -> engine.convertToNumeric(series))
            .isInstanceOf(ParseFailureException.class)
            .hasMessageContaining("index 1");
        assertThat(series).isEqualTo(Series.ofStrings("1.5", "x", "3"));

        assertThat(engine.filter(series, SeriesPredicate.strings(s -> !s.equals("x"))))
            .containsExactly(0, 2);
        engine.convertToNumeric(series);
        engine.convertToText(series);
        assertThat(series.toStringArray()).containsExactly("1.5", "3");
    }

    @Test
    void sortedCopy_doesNotTouchSeries() {
        SeriesEngine engine = SeriesEngine.withParallelism(2);
        Series series = Series.ofFloats(3, 1, 2);
        assertThat(engine.sortedCopy(series)).containsExactly(1.0, 2.0, 3.0);
        assertThat(series.toFloatArray()).containsExactly(3.0, 1.0, 2.0);
    }

    @Test
    void withParallelism_rejectsZero() {
        assertThatThrownBy(() -> SeriesEngine.withParallelism(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
