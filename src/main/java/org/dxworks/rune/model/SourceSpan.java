package org.dxworks.rune.model;

import java.util.Objects;

/**
 * A 0-based, end-exclusive range of document text. Spans may cover several lines
 * (multi-line signatures, whole blocks).
 */
public class SourceSpan {
    public int startLine;
    public int startColumn;
    public int endLine;
    public int endColumn;

    public SourceSpan() {
    }

    public SourceSpan(int startLine, int startColumn, int endLine, int endColumn) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public static SourceSpan onLine(int line, int startColumn, int endColumn) {
        return new SourceSpan(line, startColumn, line, endColumn);
    }

    public SourceSpan to(SourceSpan end) {
        return new SourceSpan(startLine, startColumn, end.endLine, end.endColumn);
    }

    public SourceSpan copy() {
        return new SourceSpan(startLine, startColumn, endLine, endColumn);
    }

    public boolean contains(SourcePosition position) {
        if (position.line < startLine || position.line > endLine) return false;
        if (position.line == startLine && position.column < startColumn) return false;
        return position.line != endLine || position.column < endColumn;
    }

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan other)) return false;
        return startLine == other.startLine && startColumn == other.startColumn
                && endLine == other.endLine && endColumn == other.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return (startLine + 1) + ":" + (startColumn + 1);
    }
}
