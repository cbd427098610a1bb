package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The parameter and return shape first observed for a call identity.
 */
public class CallShape {
    public String callKey;
    public List<String> parameters = new ArrayList<>();
    public String returnType;
    public SourceSpan firstOccurrence;

    public CallShape(Signature signature) {
        this.callKey = signature.callKey();
        this.parameters.addAll(signature.parameterShapes());
        this.returnType = signature.returnType != null ? signature.returnType.text : null;
        this.firstOccurrence = signature.span;
    }

    public boolean matches(CallShape other) {
        return parameters.equals(other.parameters)
                && (returnType == null ? other.returnType == null : returnType.equals(other.returnType));
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", parameters) + "): " + returnType;
    }
}
