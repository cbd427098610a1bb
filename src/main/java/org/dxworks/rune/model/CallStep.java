package org.dxworks.rune.model;

/**
 * A step that calls {@code subject.verb(...)} or {@code subject::verb(...)} and may
 * carry the faults listed under it.
 */
public abstract class CallStep extends Step {
    public Signature signature;
    public FaultSet faults;

    protected CallStep(String kind, Signature signature) {
        super(kind);
        this.signature = signature;
    }
}
