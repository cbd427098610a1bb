package org.dxworks.rune.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code subject SEP verb(parameters): returnType}. Requirement headers written
 * as a bare function name ({@code registerRecording(...)}) keep that name in
 * {@link #functionName} and carry the derived subject and verb.
 */
public class Signature {
    public static final String INSTANCE = ".";
    public static final String STATIC = "::";

    public Identifier subject;
    public String separator;
    public Identifier verb;
    public String functionName;
    public List<Parameter> parameters = new ArrayList<>();
    public TypeExpression returnType;
    public SourceSpan span;

    @JsonIgnore
    public boolean isStatic() {
        return STATIC.equals(separator);
    }

    /** Call identity used for consistency checks: subject, separator and verb. */
    public String callKey() {
        return subject.name + separator + verb.name;
    }

    public List<String> parameterShapes() {
        return parameters.stream().map(Parameter::shapeText).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        String params = parameters.stream().map(Parameter::toString).collect(Collectors.joining(", "));
        String head = functionName != null ? functionName : callKey();
        return head + "(" + params + ")" + (returnType != null ? ": " + returnType.text : "");
    }
}
