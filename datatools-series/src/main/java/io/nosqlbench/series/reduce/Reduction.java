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

import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/// An associative, commutative fold over numeric values.
///
/// Each worker starts from [#identity()] and folds its chunk with [#fold(double[], int, int)];
/// the per-chunk partials are then merged with [#combine()]. For plain reductions both
/// steps use the same operator. A mapped reduction transforms each element first, which
/// is how the sum of squared deviations for the variance is expressed.
///
/// ```java
/// Reduction sumOfSquares = Reduction.mapped("sumOfSquares", 0.0, v -> v * v, Double::sum);
/// ```
public final class Reduction {

    public static final Reduction SUM = of("sum", 0.0, Double::sum);
    public static final Reduction PRODUCT = of("product", 1.0, (a, b) -> a * b);
    public static final Reduction MIN = of("min", Double.POSITIVE_INFINITY, Math::min);
    public static final Reduction MAX = of("max", Double.NEGATIVE_INFINITY, Math::max);

    private final String name;
    private final double identity;
    private final DoubleUnaryOperator mapper;
    private final DoubleBinaryOperator combine;

    private Reduction(String name, double identity, DoubleUnaryOperator mapper, DoubleBinaryOperator combine) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.identity = identity;
        this.mapper = mapper;
        this.combine = Objects.requireNonNull(combine, "combine cannot be null");
    }

    /// Creates a reduction that folds the raw values.
    ///
    /// @param name operation name, used in error messages
    /// @param identity neutral element of `combine`
    /// @param combine associative and commutative operator
    public static Reduction of(String name, double identity, DoubleBinaryOperator combine) {
        return new Reduction(name, identity, null, combine);
    }

    /// Creates a reduction that folds `mapper(value)` for every value.
    ///
    /// @param name operation name, used in error messages
    /// @param identity neutral element of `combine`
    /// @param mapper per-element transform, must be pure
    /// @param combine associative and commutative operator
    public static Reduction mapped(String name, double identity, DoubleUnaryOperator mapper,
                                   DoubleBinaryOperator combine) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        return new Reduction(name, identity, mapper, combine);
    }

    public String name() {
        return name;
    }

    public double identity() {
        return identity;
    }

    public DoubleBinaryOperator combine() {
        return combine;
    }

    /// Folds `values[start, end)` sequentially, starting from the identity.
    public double fold(double[] values, int start, int end) {
        double partial = identity;
        if (mapper == null) {
            for (int i = start; i < end; i++) {
                partial = combine.applyAsDouble(partial, values[i]);
            }
        } else {
            for (int i = start; i < end; i++) {
                partial = combine.applyAsDouble(partial, mapper.applyAsDouble(values[i]));
            }
        }
        return partial;
    }

    @Override
    public String toString() {
        return "Reduction[" + name + "]";
    }
}
