package io.nosqlbench.series.order;

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

import java.util.Arrays;
import java.util.concurrent.RecursiveAction;

/// Fork/join merge sort over a `double[]` range.
///
/// ```text
///   sort [lo, hi)
///     ├── hi - lo <= threshold  -> Arrays.sort(values, lo, hi)
///     └── otherwise
///           fork  sort [lo, mid)   ┐ in parallel
///           fork  sort [mid, hi)   ┘
///           merge [lo, mid) + [mid, hi) through scratch[lo, hi)
/// ```
///
/// The two halves of a split are disjoint ranges of both `values` and `scratch`, so no
/// two tasks ever write the same slot. Ordering follows [Double#compare], which places
/// `-0.0` before `0.0` and NaN after every other value.
public final class ParallelMergeSort extends RecursiveAction {

    private final double[] values;
    private final double[] scratch;
    private final int lo;
    private final int hi;
    private final int threshold;

    /// Creates the root task sorting all of `values` in place.
    ///
    /// @param values array to sort
    /// @param threshold range size at or below which a sequential sort is used
    public ParallelMergeSort(double[] values, int threshold) {
        this(values, new double[values.length], 0, values.length, threshold);
    }

    private ParallelMergeSort(double[] values, double[] scratch, int lo, int hi, int threshold) {
        if (threshold < 2) {
            throw new IllegalArgumentException("threshold must be >= 2, got: " + threshold);
        }
        this.values = values;
        this.scratch = scratch;
        this.lo = lo;
        this.hi = hi;
        this.threshold = threshold;
    }

    @Override
    protected void compute() {
        if (hi - lo <= threshold) {
            Arrays.sort(values, lo, hi);
            return;
        }
        int mid = (lo + hi) >>> 1;
        invokeAll(
            new ParallelMergeSort(values, scratch, lo, mid, threshold),
            new ParallelMergeSort(values, scratch, mid, hi, threshold));
        merge(mid);
    }

    private void merge(int mid) {
        // Already ordered across the split
        if (Double.compare(values[mid - 1], values[mid]) <= 0) {
            return;
        }
        System.arraycopy(values, lo, scratch, lo, hi - lo);
        int left = lo;
        int right = mid;
        int out = lo;
        while (left < mid && right < hi) {
            if (Double.compare(scratch[left], scratch[right]) <= 0) {
                values[out++] = scratch[left++];
            } else {
                values[out++] = scratch[right++];
            }
        }
        while (left < mid) {
            values[out++] = scratch[left++];
        }
        while (right < hi) {
            values[out++] = scratch[right++];
        }
    }
}
