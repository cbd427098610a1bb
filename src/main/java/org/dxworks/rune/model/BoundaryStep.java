package org.dxworks.rune.model;

public class BoundaryStep extends CallStep {
    public Boundary boundary;

    public BoundaryStep(Boundary boundary, Signature signature) {
        super("boundary", signature);
        this.boundary = boundary;
    }
}
