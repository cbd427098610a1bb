package org.dxworks.rune.analyzer.parser;

import org.dxworks.rune.model.SourceSpan;

public final class Token {
    public final TokenType type;
    public final String text;
    public final SourceSpan span;

    Token(TokenType type, String text, SourceSpan span) {
        this.type = type;
        this.text = text;
        this.span = span;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type == TokenType.END ? type.getDescription() : "'" + text + "'";
    }
}
