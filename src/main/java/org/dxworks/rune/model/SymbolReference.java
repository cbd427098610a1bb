package org.dxworks.rune.model;

/** One resolved use of a type, contract or noun. */
public class SymbolReference {
    public String name;
    public SymbolKind kind;
    public SourceSpan span;
    public SourceSpan definition;

    public SymbolReference(Symbol symbol, SourceSpan span) {
        this.name = symbol.name;
        this.kind = symbol.kind;
        this.span = span;
        this.definition = symbol.definition.name.span;
    }
}
