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

/// Thrown when a reduction or order statistic is requested over zero elements.
public class EmptySeriesException extends SeriesException {

    private final String operation;

    public EmptySeriesException(String operation) {
        super(operation + " requires a non-empty series");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
