package org.dxworks.rune.model;

/** {@code [RET] value}: designates a value already in scope as the block output. */
public class ReturnStep extends Step {
    public Identifier value;

    public ReturnStep(Identifier value) {
        super("return");
        this.value = value;
    }
}
