package org.dxworks.rune.model;

public class Identifier {
    public String name;
    public SourceSpan span;

    public Identifier() {
    }

    public Identifier(String name, SourceSpan span) {
        this.name = name;
        this.span = span;
    }

    @Override
    public String toString() {
        return name;
    }
}
