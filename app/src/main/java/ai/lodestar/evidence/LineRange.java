package ai.lodestar.evidence;

import ai.lodestar.exception.InvalidInputException;

/** Inclusive, 1-based line range. */
public record LineRange(int start, int end) {
    public LineRange {
        InvalidInputException.check(start >= 1, "start line must be >= 1: " + start);
        InvalidInputException.check(end >= start, "end line must be >= start line: " + start + "-" + end);
    }

    public static LineRange wholeContent(String content) {
        return new LineRange(1, lineCount(content));
    }

    /** Number of lines in {@code content}; an empty string counts as one line, a trailing newline adds one. */
    public static int lineCount(String content) {
        return content.split("\n", -1).length;
    }

    public String key() {
        return start + "-" + end;
    }
}
