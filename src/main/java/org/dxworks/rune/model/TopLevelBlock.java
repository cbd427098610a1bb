package org.dxworks.rune.model;

public abstract class TopLevelBlock {
    public String kind;
    public SourceSpan span;

    protected TopLevelBlock(String kind) {
        this.kind = kind;
    }
}
