package org.dxworks.rune.model;

public abstract class Step {
    public String kind;
    public int indent;
    public SourceSpan span;

    protected Step(String kind) {
        this.kind = kind;
    }
}
