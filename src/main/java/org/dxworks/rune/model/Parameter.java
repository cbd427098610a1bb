package org.dxworks.rune.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class Parameter {
    public static final String NAME = "name";
    public static final String TYPED = "typed";
    public static final String CONTRACT_LITERAL = "contract_literal";

    public String kind;
    public Identifier name;                              // name and typed
    public TypeExpression type;                          // typed only
    public List<Identifier> properties = new ArrayList<>(); // contract literal only
    public SourceSpan span;

    public static Parameter bare(Identifier name) {
        Parameter parameter = new Parameter();
        parameter.kind = NAME;
        parameter.name = name;
        parameter.span = name.span;
        return parameter;
    }

    public static Parameter typed(Identifier name, TypeExpression type) {
        Parameter parameter = new Parameter();
        parameter.kind = TYPED;
        parameter.name = name;
        parameter.type = type;
        parameter.span = name.span.to(type.span);
        return parameter;
    }

    public static Parameter contractLiteral(List<Identifier> properties, SourceSpan span) {
        Parameter parameter = new Parameter();
        parameter.kind = CONTRACT_LITERAL;
        parameter.properties.addAll(properties);
        parameter.span = span;
        return parameter;
    }

    /** True for a bare name ending in {@code Dto}, which refers to a data contract. */
    @JsonIgnore
    public boolean isContractReference() {
        return NAME.equals(kind) && name.name.endsWith("Dto");
    }

    /** Text compared when checking repeated calls for a consistent shape. */
    public String shapeText() {
        return switch (kind) {
            case TYPED -> type.text;
            case CONTRACT_LITERAL -> "{" + properties.stream().map(p -> p.name).collect(Collectors.joining(", ")) + "}";
            default -> name.name;
        };
    }

    @Override
    public String toString() {
        return TYPED.equals(kind) ? name.name + ": " + type.text : shapeText();
    }
}
