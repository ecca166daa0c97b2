package com.questrail.fasttest.assertion;

import java.util.Objects;

/**
 * LineInfo
 * -----------------------------------------------------------------------------
 * Optional source-location tag attached to an assertion so that its failure
 * message points back at the line that declared it.
 *
 * <p>Rendered as {@code file:line function}, with the function omitted when
 * empty.</p>
 */
public record LineInfo(String file, String function, int line) {

    public LineInfo {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(function, "function");
        if (line < 0) {
            throw new IllegalArgumentException("line must be non-negative");
        }
    }

    public static LineInfo of(String file, int line) {
        return new LineInfo(file, "", line);
    }

    public static LineInfo of(String file, String function, int line) {
        return new LineInfo(file, function, line);
    }

    /**
     * Captures the location of the code calling this method.
     */
    public static LineInfo here() {
        return StackWalker.getInstance()
            .walk(frames -> frames.skip(1).findFirst())
            .map(frame -> new LineInfo(
                frame.getFileName() != null ? frame.getFileName() : "<unknown>",
                frame.getMethodName(),
                Math.max(0, frame.getLineNumber())))
            .orElseGet(() -> new LineInfo("<unknown>", "", 0));
    }

    @Override
    public String toString() {
        return function.isEmpty()
            ? file + ":" + line
            : file + ":" + line + " " + function;
    }
}
