package org.dxworks.rune.analyzer.line;

public enum LineCategory {
    BLANK,
    COMMENT,
    CONTINUATION,
    FAULT_LIST,
    DESCRIPTION,
    STRUCTURAL,
    UNCLASSIFIED
}
