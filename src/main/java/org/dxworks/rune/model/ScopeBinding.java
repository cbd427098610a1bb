package org.dxworks.rune.model;

import java.util.Objects;

/**
 * A value usable by a step. The notation names values after their type, so
 * {@code name} and {@code type} usually coincide.
 */
public class ScopeBinding {
    public static final String INPUT = "input";
    public static final String STEP = "step";
    public static final String CONSTRUCTOR = "constructor";

    public String name;
    public String type;
    public String origin;
    public SourceSpan span;

    public ScopeBinding(String name, String type, String origin, SourceSpan span) {
        this.name = name;
        this.type = type;
        this.origin = origin;
        this.span = span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopeBinding other)) return false;
        return Objects.equals(name, other.name) && Objects.equals(type, other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name.equals(type) ? name : name + ": " + type;
    }
}
