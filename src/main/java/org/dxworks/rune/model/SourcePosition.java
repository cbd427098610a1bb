package org.dxworks.rune.model;

import java.util.Objects;

/**
 * A 0-based line/column position inside a document.
 */
public class SourcePosition {
    public int line;
    public int column;

    public SourcePosition() {
    }

    public SourcePosition(int line, int column) {
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition other)) return false;
        return line == other.line && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        return (line + 1) + ":" + (column + 1);
    }
}
