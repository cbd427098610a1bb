package org.dxworks.rune.model;

/** {@code [NEW] name}: instantiates a class-marked type and yields it. */
public class ConstructorStep extends Step {
    public Identifier className;

    public ConstructorStep(Identifier className) {
        super("constructor");
        this.className = className;
    }
}
