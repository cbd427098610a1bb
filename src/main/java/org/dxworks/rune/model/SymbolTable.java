package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only registry of everything a document defines. Types and contracts
 * share one namespace; nouns have their own.
 */
public class SymbolTable {
    private final Map<String, Symbol> definitions = new LinkedHashMap<>();
    private final Map<String, Symbol> nouns = new LinkedHashMap<>();
    private final Map<String, RequirementBlock> requirements = new LinkedHashMap<>();
    private final Map<String, CallShape> callShapes = new LinkedHashMap<>();

    /**
     * Registers a symbol unless its name is already taken.
     *
     * @return the symbol registered first under that name, or empty when this one was added
     */
    public Optional<Symbol> register(Symbol symbol) {
        Map<String, Symbol> namespace = symbol.kind == SymbolKind.NOUN ? nouns : definitions;
        Symbol existing = namespace.putIfAbsent(symbol.name, symbol);
        return Optional.ofNullable(existing);
    }

    public Optional<RequirementBlock> registerRequirement(RequirementBlock requirement) {
        return Optional.ofNullable(requirements.putIfAbsent(requirement.name(), requirement));
    }

    /** Returns the shape registered first for the same call identity, registering this one if it is new. */
    public Optional<CallShape> registerCallShape(CallShape shape) {
        return Optional.ofNullable(callShapes.putIfAbsent(shape.callKey, shape));
    }

    /** Looks a name up among types and contracts first, then nouns. */
    public Optional<Symbol> lookup(String name) {
        Symbol symbol = definitions.get(name);
        if (symbol == null) {
            symbol = nouns.get(name);
        }
        return Optional.ofNullable(symbol);
    }

    public Optional<DataContractDefinition> contract(String name) {
        Symbol symbol = definitions.get(name);
        if (symbol != null && symbol.definition instanceof DataContractDefinition contract) {
            return Optional.of(contract);
        }
        return Optional.empty();
    }

    public Optional<TypeDefinition> type(String name) {
        Symbol symbol = definitions.get(name);
        if (symbol != null && symbol.definition instanceof TypeDefinition type) {
            return Optional.of(type);
        }
        return Optional.empty();
    }

    public List<Symbol> symbols() {
        List<Symbol> all = new ArrayList<>(definitions.values());
        all.addAll(nouns.values());
        return all;
    }

    public Collection<RequirementBlock> requirements() {
        return requirements.values();
    }
}
