package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fault names attached to one call step. Several fault lines under the same step
 * merge into a single set.
 */
public class FaultSet {
    public List<Identifier> faults = new ArrayList<>();
    public SourceSpan span;

    public boolean contains(String fault) {
        return faults.stream().anyMatch(f -> f.name.equals(fault));
    }

    public List<String> names() {
        return faults.stream().map(f -> f.name).collect(Collectors.toList());
    }
}
