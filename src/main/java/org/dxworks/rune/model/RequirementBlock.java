package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;

public class RequirementBlock extends TopLevelBlock {
    public Signature signature;
    public Parameter input;   // null when the requirement takes no input
    public TypeExpression output;
    public List<Step> steps = new ArrayList<>();

    public RequirementBlock(Signature signature) {
        super("requirement");
        this.signature = signature;
        this.input = signature.parameters.isEmpty() ? null : signature.parameters.get(0);
        this.output = signature.returnType;
    }

    public String name() {
        return signature.functionName != null ? signature.functionName : signature.callKey();
    }
}
