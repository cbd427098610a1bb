package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;

public class Case {
    public Identifier name;
    public SourceSpan span;
    public List<Step> steps = new ArrayList<>();

    public Case(Identifier name, SourceSpan span) {
        this.name = name;
        this.span = span;
    }
}
