package org.dxworks.rune.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed type expression. Two expressions are structurally equal when their
 * canonical {@link #text} is equal.
 */
public class TypeExpression {
    public static final String NAMED = "named";
    public static final String ARRAY = "array";
    public static final String GENERIC = "generic";
    public static final String TUPLE = "tuple";
    public static final String ENUM = "enum";
    public static final String UNION = "union";

    public String kind;
    public String name;                                  // named and generic only
    public List<TypeExpression> arguments = new ArrayList<>();
    public List<String> literals = new ArrayList<>();    // enum only, without quotes
    public String text;
    public SourceSpan span;

    private TypeExpression(String kind, SourceSpan span) {
        this.kind = kind;
        this.span = span;
    }

    public static TypeExpression named(String name, SourceSpan span) {
        TypeExpression expr = new TypeExpression(NAMED, span);
        expr.name = name;
        expr.text = name;
        return expr;
    }

    public static TypeExpression array(TypeExpression element, SourceSpan span) {
        TypeExpression expr = new TypeExpression(ARRAY, span);
        expr.arguments.add(element);
        expr.text = element.text + "[]";
        return expr;
    }

    public static TypeExpression generic(String name, List<TypeExpression> arguments, SourceSpan span) {
        TypeExpression expr = new TypeExpression(GENERIC, span);
        expr.name = name;
        expr.arguments.addAll(arguments);
        expr.text = name + "<" + join(arguments, ", ") + ">";
        return expr;
    }

    public static TypeExpression tuple(List<TypeExpression> elements, SourceSpan span) {
        TypeExpression expr = new TypeExpression(TUPLE, span);
        expr.arguments.addAll(elements);
        expr.text = "[" + join(elements, ", ") + "]";
        return expr;
    }

    public static TypeExpression enumeration(List<String> literals, SourceSpan span) {
        TypeExpression expr = new TypeExpression(ENUM, span);
        expr.literals.addAll(literals);
        expr.text = literals.stream().map(l -> "\"" + l + "\"").collect(Collectors.joining(" | "));
        return expr;
    }

    public static TypeExpression union(List<TypeExpression> members, SourceSpan span) {
        TypeExpression expr = new TypeExpression(UNION, span);
        expr.arguments.addAll(members);
        expr.text = join(members, " | ");
        return expr;
    }

    /** Union members, or this expression alone when it is not a union. */
    public List<TypeExpression> members() {
        return UNION.equals(kind) ? Collections.unmodifiableList(arguments) : List.of(this);
    }

    @JsonIgnore
    public boolean isNamed() {
        return NAMED.equals(kind);
    }

    @JsonIgnore
    public boolean isVoid() {
        return isNamed() && "void".equals(name);
    }

    private static String join(List<TypeExpression> expressions, String separator) {
        return expressions.stream().map(e -> e.text).collect(Collectors.joining(separator));
    }

    @Override
    public String toString() {
        return text;
    }
}
