package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;

public class PolymorphicStep extends Step {
    public Signature signature;
    public List<Case> cases = new ArrayList<>();

    public PolymorphicStep(Signature signature) {
        super("polymorphic");
        this.signature = signature;
    }
}
