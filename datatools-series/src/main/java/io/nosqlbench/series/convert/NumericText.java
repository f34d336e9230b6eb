package io.nosqlbench.series.convert;

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

import java.math.BigDecimal;
import java.util.Objects;

/// Text form of numeric series values.
///
/// ## Parsing
///
/// | Input | Result |
/// |-------|--------|
/// | `"3"`, `"-1.5"`, `"+2e10"`, `".5"` | the decimal value |
/// | `"NaN"`, `"nan"` | NaN |
/// | `"Inf"`, `"-inf"`, `"Infinity"` | an infinity |
/// | `""`, `" 3"`, `"3 "` | rejected |
/// | `"1.5d"`, `"2f"` | rejected (no Java type suffixes) |
/// | `"abc"`, `"1,5"` | rejected |
///
/// ## Formatting
///
/// The shortest decimal that reads back as the same `double`, in plain notation with no
/// trailing zeros: `2.0` becomes `"2"`, `1e20` becomes `"100000000000000000000"`.
/// `-0.0` keeps its sign as `"-0"`; non-finite values use `"NaN"`, `"Infinity"` and
/// `"-Infinity"`, all of which parse back.
public final class NumericText {

    private NumericText() {
    }

    /// Parses a series element as a number.
    ///
    /// @param text the element text
    /// @return the parsed value
    /// @throws NumberFormatException if the text is not a number under the rules above
    public static double parse(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        int length = text.length();
        if (length == 0) {
            throw new NumberFormatException("empty string");
        }
        if (Character.isWhitespace(text.charAt(0)) || Character.isWhitespace(text.charAt(length - 1))) {
            throw new NumberFormatException("surrounding whitespace in \"" + text + "\"");
        }

        char first = text.charAt(0);
        boolean negative = first == '-';
        String unsigned = (first == '+' || first == '-') ? text.substring(1) : text;
        if (unsigned.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        if (unsigned.equalsIgnoreCase("inf") || unsigned.equalsIgnoreCase("infinity")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }

        char last = text.charAt(length - 1);
        if (last == 'd' || last == 'D' || last == 'f' || last == 'F') {
            throw new NumberFormatException("type suffix in \"" + text + "\"");
        }
        return Double.parseDouble(text);
    }

    /// Returns whether [#parse(String)] accepts the text.
    public static boolean isNumeric(String text) {
        try {
            parse(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /// Formats a value as the shortest round-tripping plain decimal.
    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0.0) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }
        return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }
}
