package org.dxworks.rune.analyzer.semantic;

import org.dxworks.rune.analyzer.AnalyzerHelper;
import org.dxworks.rune.model.ScopeBinding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Values usable at one point of a requirement, keyed by name. Because values are
 * named after their type, two producers of the same type share one key.
 */
class Scope {

    private final Map<String, ScopeBinding> bindings;

    Scope() {
        this.bindings = new LinkedHashMap<>();
    }

    private Scope(Map<String, ScopeBinding> bindings) {
        this.bindings = new LinkedHashMap<>(bindings);
    }

    /** Independent copy for a polymorphic case. */
    Scope fork() {
        return new Scope(bindings);
    }

    boolean contains(String name) {
        return bindings.containsKey(name);
    }

    Optional<ScopeBinding> get(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /** @return the binding this one replaced, if any */
    Optional<ScopeBinding> bind(ScopeBinding binding) {
        return Optional.ofNullable(bindings.put(binding.name, binding));
    }

    void bindIfAbsent(ScopeBinding binding) {
        bindings.putIfAbsent(binding.name, binding);
    }

    List<ScopeBinding> snapshot() {
        List<ScopeBinding> sorted = new ArrayList<>(bindings.values());
        sorted.sort(AnalyzerHelper.BINDING_COMPARATOR);
        return sorted;
    }
}
