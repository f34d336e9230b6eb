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

import java.util.Objects;
import java.util.function.DoublePredicate;
import java.util.function.Predicate;

/// A filter condition bound to one series variant.
///
/// The variant is carried explicitly so that a filter can reject a numeric condition
/// applied to a textual series (and the reverse) before any worker starts.
///
/// ```java
/// SeriesPredicate aboveFifteen = SeriesPredicate.floats(v -> v > 15);
/// SeriesPredicate nonBlank = SeriesPredicate.strings(s -> !s.isBlank());
/// ```
public final class SeriesPredicate {

    private final SeriesType type;
    private final DoublePredicate floatCondition;
    private final Predicate<String> stringCondition;

    private SeriesPredicate(SeriesType type, DoublePredicate floatCondition, Predicate<String> stringCondition) {
        this.type = type;
        this.floatCondition = floatCondition;
        this.stringCondition = stringCondition;
    }

    /// Creates a predicate over numeric values.
    public static SeriesPredicate floats(DoublePredicate condition) {
        Objects.requireNonNull(condition, "condition cannot be null");
        return new SeriesPredicate(SeriesType.FLOAT, condition, null);
    }

    /// Creates a predicate over text values.
    public static SeriesPredicate strings(Predicate<String> condition) {
        Objects.requireNonNull(condition, "condition cannot be null");
        return new SeriesPredicate(SeriesType.STRING, null, condition);
    }

    /// Returns the series variant this predicate applies to.
    public SeriesType type() {
        return type;
    }

    /// Returns the numeric condition, or null for a text predicate.
    public DoublePredicate floatCondition() {
        return floatCondition;
    }

    /// Returns the text condition, or null for a numeric predicate.
    public Predicate<String> stringCondition() {
        return stringCondition;
    }
}
