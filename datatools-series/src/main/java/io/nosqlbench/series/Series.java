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

import io.nosqlbench.series.error.WrongColumnTypeException;

import java.util.Arrays;
import java.util.Objects;

/// A single homogeneous column of either numeric or textual values.
///
/// ## Representation
///
/// A series is a tagged union: exactly one of the `double[]` or `String[]` backing
/// arrays is active, as indicated by [#type()]. The inactive one is always empty.
///
/// ```text
///   type = FLOAT    floats  = [ 10.0, 20.0, 30.0 ]   strings = []
///   type = STRING   floats  = []                     strings = [ "a", "b" ]
/// ```
///
/// ## Ownership
///
/// A series is owned by its caller and is not thread-safe. Engine operations either
/// return scalar results or replace the backing array wholesale through
/// [#installFloats(double[])] / [#installStrings(String[])] once the replacement is
/// fully built. The raw buffer accessors exist for the engine's workers, which only
/// ever touch disjoint index ranges of them.
///
/// ## Usage
///
/// ```java
/// Series prices = Series.ofFloats(10, 20, 30, 40, 50);
/// Series labels = Series.ofStrings("1.5", "2.0", "3");
/// ```
public final class Series {

    private static final double[] NO_FLOATS = new double[0];
    private static final String[] NO_STRINGS = new String[0];

    private SeriesType type;
    private double[] floats;
    private String[] strings;

    private Series(SeriesType type, double[] floats, String[] strings) {
        this.type = type;
        this.floats = floats;
        this.strings = strings;
    }

    /// Creates a numeric series holding a copy of the given values.
    ///
    /// @param values the values, copied
    /// @return a new FLOAT series
    public static Series ofFloats(double... values) {
        Objects.requireNonNull(values, "values cannot be null");
        return new Series(SeriesType.FLOAT, values.clone(), NO_STRINGS);
    }

    /// Creates a textual series holding a copy of the given values.
    ///
    /// @param values the values, copied; no element may be null
    /// @return a new STRING series
    /// @throws NullPointerException if the array or any element is null
    public static Series ofStrings(String... values) {
        requireNoNullElements(values);
        return new Series(SeriesType.STRING, NO_FLOATS, values.clone());
    }

    /// Returns which representation is active.
    public SeriesType type() {
        return type;
    }

    public boolean isNumeric() {
        return type == SeriesType.FLOAT;
    }

    public boolean isText() {
        return type == SeriesType.STRING;
    }

    /// Returns the number of elements in the active representation.
    public int length() {
        return type == SeriesType.FLOAT ? floats.length : strings.length;
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /// Returns the numeric value at the given index.
    ///
    /// @throws WrongColumnTypeException if the series is textual
    public double getFloat(int index) {
        requireType(SeriesType.FLOAT, "getFloat");
        return floats[index];
    }

    /// Returns the text value at the given index.
    ///
    /// @throws WrongColumnTypeException if the series is numeric
    public String getString(int index) {
        requireType(SeriesType.STRING, "getString");
        return strings[index];
    }

    /// Returns a copy of the numeric values.
    ///
    /// @throws WrongColumnTypeException if the series is textual
    public double[] toFloatArray() {
        requireType(SeriesType.FLOAT, "toFloatArray");
        return floats.clone();
    }

    /// Returns a copy of the text values.
    ///
    /// @throws WrongColumnTypeException if the series is numeric
    public String[] toStringArray() {
        requireType(SeriesType.STRING, "toStringArray");
        return strings.clone();
    }

    /// Returns the live numeric backing array. Workers may read any index and write
    /// only within their own chunk.
    public double[] floatBuffer() {
        requireType(SeriesType.FLOAT, "floatBuffer");
        return floats;
    }

    /// Returns the live text backing array. Workers may read any index and write
    /// only within their own chunk.
    public String[] stringBuffer() {
        requireType(SeriesType.STRING, "stringBuffer");
        return strings;
    }

    /// Replaces the backing sequence with a fully built numeric array and flips the
    /// tag to FLOAT. The previous sequence, of either variant, is released.
    ///
    /// @param values the new values, taken without copying
    public void installFloats(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        this.floats = values;
        this.strings = NO_STRINGS;
        this.type = SeriesType.FLOAT;
    }

    /// Replaces the backing sequence with a fully built text array and flips the tag
    /// to STRING. The previous sequence, of either variant, is released.
    ///
    /// @param values the new values, taken without copying
    /// @throws NullPointerException if the array or any element is null; the series is
    ///     then left unchanged
    public void installStrings(String[] values) {
        requireNoNullElements(values);
        this.strings = values;
        this.floats = NO_FLOATS;
        this.type = SeriesType.STRING;
    }

    private static void requireNoNullElements(String[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        for (int i = 0; i < values.length; i++) {
            Objects.requireNonNull(values[i], "value at index " + i + " cannot be null");
        }
    }

    /// Compacts the series to the elements at the given indexes, in the order given.
    ///
    /// A fresh array is built from the retained elements and then swapped in, so the
    /// series is never observed half-compacted.
    ///
    /// @param indexes the indexes to keep
    /// @throws IndexOutOfBoundsException if any index is outside `[0, length())`
    public void retainIndexes(int[] indexes) {
        Objects.requireNonNull(indexes, "indexes cannot be null");
        int length = length();
        for (int idx : indexes) {
            Objects.checkIndex(idx, length);
        }
        if (type == SeriesType.FLOAT) {
            double[] retained = new double[indexes.length];
            for (int i = 0; i < indexes.length; i++) {
                retained[i] = floats[indexes[i]];
            }
            installFloats(retained);
        } else {
            String[] retained = new String[indexes.length];
            for (int i = 0; i < indexes.length; i++) {
                retained[i] = strings[indexes[i]];
            }
            installStrings(retained);
        }
    }

    /// Throws [WrongColumnTypeException] unless this series holds the required variant.
    ///
    /// @param required the variant the operation needs
    /// @param operation operation name used in the error message
    public void requireType(SeriesType required, String operation) {
        if (type != required) {
            throw new WrongColumnTypeException(operation, type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Series)) return false;
        Series other = (Series) o;
        if (type != other.type) return false;
        return type == SeriesType.FLOAT
            ? Arrays.equals(floats, other.floats)
            : Arrays.equals(strings, other.strings);
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + (type == SeriesType.FLOAT ? Arrays.hashCode(floats) : Arrays.hashCode(strings));
        return result;
    }

    @Override
    public String toString() {
        String values = type == SeriesType.FLOAT ? Arrays.toString(floats) : Arrays.toString(strings);
        return "Series[" + type + ", length=" + length() + ", values=" + values + "]";
    }
}
