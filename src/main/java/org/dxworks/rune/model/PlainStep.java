package org.dxworks.rune.model;

public class PlainStep extends CallStep {
    public PlainStep(Signature signature) {
        super("plain", signature);
    }
}
