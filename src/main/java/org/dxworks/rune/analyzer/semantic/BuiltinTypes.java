package org.dxworks.rune.analyzer.semantic;

import java.util.Map;
import java.util.Set;

public final class BuiltinTypes {

    private BuiltinTypes() {}

    public static final String CLASS = "Class";

    public static final Set<String> PRIMITIVES = Set.of(
            "string", "number", "boolean", "void", "Uint8Array", CLASS, "Primitive");

    /** Parametric built-ins and the number of type arguments each takes. */
    public static final Map<String, Integer> GENERIC_ARITY = Map.of(
            "Array", 1,
            "Set", 1,
            "Optional", 1,
            "Promise", 1,
            "Partial", 1,
            "Required", 1,
            "Record", 2,
            "Map", 2,
            "Pick", 2,
            "Omit", 2);

    public static boolean isPrimitive(String name) {
        return PRIMITIVES.contains(name);
    }

    public static boolean isGeneric(String name) {
        return GENERIC_ARITY.containsKey(name);
    }
}
