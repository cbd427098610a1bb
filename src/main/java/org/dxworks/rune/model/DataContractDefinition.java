package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;

public class DataContractDefinition extends Definition {
    public List<Property> properties = new ArrayList<>();

    public DataContractDefinition(Identifier name) {
        super("contract", name);
    }
}
