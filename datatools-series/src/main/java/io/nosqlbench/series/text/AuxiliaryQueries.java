package io.nosqlbench.series.text;

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
import io.nosqlbench.series.convert.NumericText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/// Cheap single-pass diagnostic queries over a textual series.
///
/// Both queries are total across variants: on a numeric series they return an empty
/// result instead of failing.
public final class AuxiliaryQueries {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AuxiliaryQueries() {
    }

    /// Counts whitespace-separated tokens equal to `word` across all elements.
    ///
    /// @return the occurrence count, 0 for a numeric series
    public static long countWord(Series series, String word) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(word, "word cannot be null");
        if (!series.isText() || word.isEmpty()) {
            return 0;
        }
        long count = 0;
        for (String value : series.stringBuffer()) {
            for (String token : WHITESPACE.split(value)) {
                if (token.equals(word)) {
                    count++;
                }
            }
        }
        return count;
    }

    /// Returns the elements that would fail numeric conversion, in series order.
    ///
    /// @return the unparseable elements, empty for a numeric series
    public static List<String> nonNumericValues(Series series) {
        Objects.requireNonNull(series, "series cannot be null");
        if (!series.isText()) {
            return Collections.emptyList();
        }
        List<String> invalid = new ArrayList<>();
        for (String value : series.stringBuffer()) {
            if (!NumericText.isNumeric(value)) {
                invalid.add(value);
            }
        }
        return invalid;
    }
}
