package io.nosqlbench.series.error;

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

/// Exception thrown when a textual series cannot be converted to a numeric series.
///
/// The reported index is always the lowest global index among all elements that failed
/// to parse, regardless of which worker detected its failure first. When this exception
/// is thrown the series has not been modified.
public class ParseFailureException extends SeriesException {

    /// The global index of the first element that failed to parse.
    private final int index;

    /// The raw text of the element at [#index].
    private final String value;

    /// Creates a new ParseFailureException for the element at the given index.
    /// @param index the lowest failing global index
    /// @param value the text that could not be parsed
    public ParseFailureException(int index, String value) {
        super(String.format("Cannot parse value '%s' at index %d as a number", value, index));
        this.index = index;
        this.value = value;
    }

    /// Gets the global index of the first unparseable element.
    /// @return the failing index
    public int getIndex() {
        return index;
    }

    /// Gets the text that could not be parsed.
    /// @return the failing value
    public String getValue() {
        return value;
    }
}
