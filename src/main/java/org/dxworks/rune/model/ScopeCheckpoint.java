package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;

/** The scope live from {@code line} onwards, until the next checkpoint. */
public class ScopeCheckpoint {
    public int line;
    public List<ScopeBinding> bindings = new ArrayList<>();

    public ScopeCheckpoint(int line, List<ScopeBinding> bindings) {
        this.line = line;
        this.bindings.addAll(bindings);
    }
}
