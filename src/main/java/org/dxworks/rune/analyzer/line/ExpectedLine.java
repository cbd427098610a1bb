package org.dxworks.rune.analyzer.line;

/**
 * What the parser currently accepts besides structural lines. Passed to the
 * classifier so that prose and code at the same indentation can be told apart.
 */
public enum ExpectedLine {
    NONE,
    TYPE_DESCRIPTION,
    CONTRACT_DESCRIPTION,
    NOUN_DESCRIPTION,
    SIGNATURE_CONTINUATION;

    public boolean isDescription() {
        return this == TYPE_DESCRIPTION || this == CONTRACT_DESCRIPTION || this == NOUN_DESCRIPTION;
    }
}
