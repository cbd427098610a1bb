package org.dxworks.rune.model;

/**
 * A named top-level definition ({@code [TYP]}, {@code [DTO]} or {@code [NON]})
 * with its optional free-text description.
 */
public abstract class Definition extends TopLevelBlock {
    public Identifier name;
    public String description;

    protected Definition(String kind, Identifier name) {
        super(kind);
        this.name = name;
    }
}
