package com.wp.verifier.model;

import java.util.Objects;

/**
 * A region of source text, used to map proof obligations back to the code they came from.
 */
public final class SourceSpan {

    public static final SourceSpan UNKNOWN = new SourceSpan("<unknown>", 0, 0, 0, 0);

    private final String origin;
    private final int beginLine;
    private final int beginColumn;
    private final int endLine;
    private final int endColumn;

    public SourceSpan(String origin, int beginLine, int beginColumn, int endLine, int endColumn) {
        this.origin = origin != null ? origin : "<unknown>";
        this.beginLine = beginLine;
        this.beginColumn = beginColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public static SourceSpan line(String origin, int line) {
        return new SourceSpan(origin, line, 1, line, 1);
    }

    public String getOrigin() {
        return origin;
    }

    public int getBeginLine() {
        return beginLine;
    }

    public int getBeginColumn() {
        return beginColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public boolean isKnown() {
        return beginLine > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return beginLine == that.beginLine && beginColumn == that.beginColumn
                && endLine == that.endLine && endColumn == that.endColumn
                && origin.equals(that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin, beginLine, beginColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return origin;
        }
        return origin + ":" + beginLine + ":" + beginColumn;
    }
}
