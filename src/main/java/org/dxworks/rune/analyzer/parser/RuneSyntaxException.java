package org.dxworks.rune.analyzer.parser;

import org.dxworks.rune.model.SourceSpan;

/**
 * Raised while parsing one signature or definition header. The structural parser
 * turns it into a diagnostic and carries on with the next line.
 */
public class RuneSyntaxException extends Exception {

    private final SourceSpan span;

    public RuneSyntaxException(String message, SourceSpan span) {
        super(message);
        this.span = span;
    }

    public SourceSpan getSpan() {
        return span;
    }
}
