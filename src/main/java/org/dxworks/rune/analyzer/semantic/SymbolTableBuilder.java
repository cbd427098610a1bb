package org.dxworks.rune.analyzer.semantic;

import org.dxworks.rune.analyzer.DiagnosticReporter;
import org.dxworks.rune.model.*;

import java.util.Optional;

/**
 * Registers every definition and requirement in document order. Usage counters
 * are left at zero; only the type checker counts uses.
 */
public class SymbolTableBuilder {

    public SymbolTable build(Document document, DiagnosticReporter reporter) {
        SymbolTable table = new SymbolTable();
        for (TopLevelBlock block : document.blocks) {
            if (block instanceof RequirementBlock requirement) {
                table.registerRequirement(requirement).ifPresent(first ->
                        reporter.report(DiagnosticCode.DUPLICATE_REQUIREMENT, requirement.signature.span,
                                "requirement " + requirement.name() + " is already defined",
                                first.signature.span));
            } else if (block instanceof Definition definition) {
                Symbol symbol = new Symbol(definition.name.name, kindOf(definition), definition);
                Optional<Symbol> existing = table.register(symbol);
                existing.ifPresent(first ->
                        reporter.report(DiagnosticCode.DUPLICATE_SYMBOL, definition.name.span,
                                first.kind.getLabel() + " '" + symbol.name + "' is already defined",
                                first.definition.name.span));
            }
        }
        return table;
    }

    private static SymbolKind kindOf(Definition definition) {
        if (definition instanceof TypeDefinition) return SymbolKind.TYPE;
        if (definition instanceof DataContractDefinition) return SymbolKind.CONTRACT;
        return SymbolKind.NOUN;
    }
}
