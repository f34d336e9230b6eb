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

import io.nosqlbench.series.SeriesType;

/// Thrown when an operation is invoked against a series of an incompatible variant,
/// for example a numeric reduction over a textual series.
public class WrongColumnTypeException extends SeriesException {

    private final String operation;
    private final SeriesType actualType;

    public WrongColumnTypeException(String operation, SeriesType actualType) {
        super(String.format("%s requires a %s series, but the series is %s",
            operation, expected(actualType), actualType));
        this.operation = operation;
        this.actualType = actualType;
    }

    private static SeriesType expected(SeriesType actualType) {
        return actualType == SeriesType.FLOAT ? SeriesType.STRING : SeriesType.FLOAT;
    }

    public String getOperation() {
        return operation;
    }

    public SeriesType getActualType() {
        return actualType;
    }
}
