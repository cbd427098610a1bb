package org.dxworks.rune.model;

public class Symbol {
    public String name;
    public SymbolKind kind;
    public Definition definition;
    public int usages;

    public Symbol(String name, SymbolKind kind, Definition definition) {
        this.name = name;
        this.kind = kind;
        this.definition = definition;
    }

    public void markUsed() {
        usages++;
    }
}
