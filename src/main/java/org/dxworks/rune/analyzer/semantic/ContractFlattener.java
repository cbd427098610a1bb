package org.dxworks.rune.analyzer.semantic;

import org.dxworks.rune.model.DataContractDefinition;
import org.dxworks.rune.model.Property;
import org.dxworks.rune.model.ScopeBinding;
import org.dxworks.rune.model.SourceSpan;
import org.dxworks.rune.model.SymbolTable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Expands a data contract into the values it carries, descending into nested
 * contracts. The contracts on the current path form the visited set, so a
 * contract reused on separate branches is fine while a cycle is reported.
 * One flattener serves a whole document, so each cycle is reported once.
 */
class ContractFlattener {

    private final SymbolTable table;
    private final Set<Set<String>> reportedCycles = new HashSet<>();

    ContractFlattener(SymbolTable table) {
        this.table = table;
    }

    List<ScopeBinding> flatten(String contractName, String origin, SourceSpan span) throws ContractCycleException {
        List<ScopeBinding> bindings = new ArrayList<>();
        flatten(contractName, new LinkedHashSet<>(), origin, span, bindings);
        return bindings;
    }

    /** @return true the first time this cycle is seen, false for every later flattening that hits it */
    boolean firstReport(ContractCycleException cycle) {
        return reportedCycles.add(new HashSet<>(cycle.getPath()));
    }

    private void flatten(String contractName, LinkedHashSet<String> path, String origin, SourceSpan span,
                         List<ScopeBinding> out) throws ContractCycleException {
        if (path.contains(contractName)) {
            List<String> cycle = new ArrayList<>(path);
            cycle.add(contractName);
            throw new ContractCycleException(cycle.subList(cycle.indexOf(contractName), cycle.size()));
        }
        Optional<DataContractDefinition> contract = table.contract(contractName);
        if (contract.isEmpty()) {
            return; // unresolved, reported by the type checker
        }
        path.add(contractName);
        for (Property property : contract.get().properties) {
            if (property.isContractReference() && !property.array) {
                flatten(property.type.name, path, origin, span, out);
            } else {
                out.add(new ScopeBinding(property.name, property.typeText(), origin, span));
            }
        }
        path.remove(contractName);
    }
}
