package org.dxworks.rune.model;

public class TypeDefinition extends Definition {
    public TypeExpression type;

    public TypeDefinition(Identifier name, TypeExpression type) {
        super("type", name);
        this.type = type;
    }
}
