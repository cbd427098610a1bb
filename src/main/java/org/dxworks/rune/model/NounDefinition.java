package org.dxworks.rune.model;

public class NounDefinition extends Definition {
    public NounDefinition(Identifier name) {
        super("noun", name);
    }
}
