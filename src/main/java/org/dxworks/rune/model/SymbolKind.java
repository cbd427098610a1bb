package org.dxworks.rune.model;

public enum SymbolKind {
    TYPE("type"),
    CONTRACT("contract"),
    NOUN("noun");

    private final String label;

    SymbolKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
