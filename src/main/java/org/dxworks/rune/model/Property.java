package org.dxworks.rune.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One entry of a data contract. {@code url(s)} is an array of {@code url} bound
 * as {@code urls}; {@code metadata?} may be absent; {@code OtherDto} nests a contract.
 */
public class Property {
    public Identifier type;
    public String name;
    public boolean array;
    public boolean optional;
    public String pluralSuffix;
    public SourceSpan span;

    public Property(Identifier type, String pluralSuffix, boolean optional, SourceSpan span) {
        this.type = type;
        this.pluralSuffix = pluralSuffix;
        this.array = pluralSuffix != null;
        this.name = array ? type.name + pluralSuffix : type.name;
        this.optional = optional;
        this.span = span;
    }

    @JsonIgnore
    public boolean isContractReference() {
        return type.name.endsWith("Dto");
    }

    /** Canonical type text of the value this property binds. */
    public String typeText() {
        return array ? type.name + "[]" : type.name;
    }
}
