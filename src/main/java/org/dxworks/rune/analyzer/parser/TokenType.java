package org.dxworks.rune.analyzer.parser;

public enum TokenType {
    IDENTIFIER("identifier"),
    STRING("string literal"),
    LEFT_PAREN("'('"),
    RIGHT_PAREN("')'"),
    LEFT_BRACE("'{'"),
    RIGHT_BRACE("'}'"),
    LEFT_BRACKET("'['"),
    RIGHT_BRACKET("']'"),
    LESS("'<'"),
    GREATER("'>'"),
    COMMA("','"),
    PIPE("'|'"),
    COLON("':'"),
    DOUBLE_COLON("'::'"),
    DOT("'.'"),
    QUESTION("'?'"),
    UNKNOWN("unexpected character"),
    END("end of line");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
