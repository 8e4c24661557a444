package ai.codegauge.analyzer;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/** Logical lines of code: lines that are neither blank nor comment-only. */
final class LineScanner {
    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    private final String lineCommentPrefix;

    LineScanner(String lineCommentPrefix) {
        this.lineCommentPrefix = lineCommentPrefix;
    }

    /** 0 for empty input, otherwise at least 1 so that downstream logarithms stay defined. */
    int countLinesOfCode(String source) {
        if (source.isEmpty()) {
            return 0;
        }
        int loc = 0;
        for (var line : LINE_SPLITTER.split(source)) {
            var stripped = CharMatcher.whitespace().trimFrom(line);
            if (!stripped.isEmpty() && !stripped.startsWith(lineCommentPrefix)) {
                loc++;
            }
        }
        return Math.max(loc, 1);
    }
}
