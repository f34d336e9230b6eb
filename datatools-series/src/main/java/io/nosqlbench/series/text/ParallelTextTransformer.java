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
import io.nosqlbench.series.exec.ChunkedExecutor;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// In-place string rewriting over a textual series.
///
/// Each worker rewrites the elements of its own chunk directly in the series backing
/// array. Chunks are disjoint, so no element is written by two workers.
///
/// Both operations are no-ops on numeric series, on empty series and when the search
/// term is empty.
public final class ParallelTextTransformer {

    private final ChunkedExecutor executor;

    public ParallelTextTransformer(ChunkedExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /// Replaces every literal occurrence of `target` with `replacement`.
    public void replace(Series series, String target, String replacement) {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(replacement, "replacement cannot be null");
        if (target.isEmpty()) {
            return;
        }
        rewrite(series, value -> value.replace(target, replacement));
    }

    /// Replaces occurrences of `word` that stand as whole words, so `cat` is rewritten in
    /// `"the cat sat"` but not in `"concatenate"`.
    ///
    /// The term is quoted, so pattern metacharacters in it match literally, and the
    /// replacement is inserted literally. The pattern is compiled once before dispatch;
    /// a compiled [Pattern] is immutable and every worker creates its own [Matcher].
    public void replaceWholeWord(Series series, String word, String replacement) {
        Objects.requireNonNull(word, "word cannot be null");
        Objects.requireNonNull(replacement, "replacement cannot be null");
        if (word.isEmpty() || !applies(series)) {
            return;
        }
        Pattern pattern = wholeWordPattern(word);
        String literalReplacement = Matcher.quoteReplacement(replacement);
        rewrite(series, value -> pattern.matcher(value).replaceAll(literalReplacement));
    }

    /// Builds the boundary-anchored pattern for a whole-word search term.
    public static Pattern wholeWordPattern(String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b");
    }

    private void rewrite(Series series, UnaryOperator<String> rewriter) {
        if (!applies(series)) {
            return;
        }
        String[] values = series.stringBuffer();
        executor.forEach(values.length, chunk -> {
            for (int i = chunk.start(); i < chunk.end(); i++) {
                values[i] = rewriter.apply(values[i]);
            }
        });
    }

    private static boolean applies(Series series) {
        Objects.requireNonNull(series, "series cannot be null");
        return series.isText() && !series.isEmpty();
    }
}
