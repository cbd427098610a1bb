package org.dxworks.rune.analyzer.semantic;

import org.dxworks.rune.analyzer.AnalyzerHelper;
import org.dxworks.rune.analyzer.DiagnosticReporter;
import org.dxworks.rune.model.*;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves type expressions against the symbol table and the built-ins. Every
 * resolved name counts as a use of its symbol and is recorded as a reference.
 */
class TypeResolver {

    private final SymbolTable table;
    private final DiagnosticReporter reporter;
    private final List<SymbolReference> references;

    TypeResolver(SymbolTable table, DiagnosticReporter reporter, List<SymbolReference> references) {
        this.table = table;
        this.reporter = reporter;
        this.references = references;
    }

    /**
     * Resolves an expression, reporting names that resolve to nothing under
     * {@code unresolved} (an error, or a warning for step return types).
     */
    void resolve(TypeExpression expression, DiagnosticCode unresolved) {
        switch (expression.kind) {
            case TypeExpression.NAMED -> resolveName(expression.name, expression.span, unresolved);
            case TypeExpression.GENERIC -> {
                Integer arity = BuiltinTypes.GENERIC_ARITY.get(expression.name);
                if (arity == null) {
                    reporter.report(unresolved, expression.span,
                            "'" + expression.name + "' is not a built-in generic type");
                } else if (arity != expression.arguments.size()) {
                    reporter.report(DiagnosticCode.WRONG_TYPE_ARITY, expression.span,
                            expression.name + " takes " + arity + " type argument" + (arity == 1 ? "" : "s")
                                    + ", found " + expression.arguments.size());
                }
                expression.arguments.forEach(argument -> resolve(argument, unresolved));
            }
            case TypeExpression.ENUM -> {
                // string literals need no resolution
            }
            default -> expression.arguments.forEach(argument -> resolve(argument, unresolved));
        }
    }

    void resolveName(String name, SourceSpan span, DiagnosticCode unresolved) {
        if (BuiltinTypes.isPrimitive(name)) {
            return;
        }
        if (BuiltinTypes.isGeneric(name)) {
            int arity = BuiltinTypes.GENERIC_ARITY.get(name);
            reporter.report(DiagnosticCode.WRONG_TYPE_ARITY, span,
                    name + " takes " + arity + " type argument" + (arity == 1 ? "" : "s") + ", found 0");
            return;
        }
        if (reference(name, span).isEmpty()) {
            String message = unresolved == DiagnosticCode.UNRESOLVED_RETURN_TYPE
                    ? "return type '" + name + "' is not defined"
                    : "'" + name + "' is not defined";
            reporter.report(unresolved, span, message);
        }
    }

    /** Records a use of {@code name} when it names a symbol; silent otherwise. */
    Optional<Symbol> reference(String name, SourceSpan span) {
        Optional<Symbol> symbol = table.lookup(name);
        symbol.ifPresent(s -> {
            s.markUsed();
            references.add(new SymbolReference(s, span));
        });
        return symbol;
    }

    boolean isClassType(Symbol symbol) {
        return symbol.definition instanceof TypeDefinition type
                && type.type.isNamed()
                && BuiltinTypes.CLASS.equals(type.type.name);
    }

    /**
     * True when values of this type may cross a system boundary: data contracts,
     * primitives other than Class, enumerations, type definitions over those, and
     * arrays, tuples, generics or unions built from them. An undefined contract
     * name is left to the unresolved-reference check; any other undefined name
     * is a bare custom type and is not safe.
     */
    boolean isBoundarySafe(TypeExpression expression) {
        return isBoundarySafe(expression, new HashSet<>());
    }

    private boolean isBoundarySafe(TypeExpression expression, Set<String> visited) {
        if (TypeExpression.ENUM.equals(expression.kind)) {
            return true;
        }
        if (!expression.isNamed()) {
            return expression.arguments.stream().allMatch(argument -> isBoundarySafe(argument, visited));
        }
        String name = expression.name;
        if (BuiltinTypes.isPrimitive(name)) {
            return !BuiltinTypes.CLASS.equals(name);
        }
        Optional<Symbol> symbol = table.lookup(name);
        if (symbol.isEmpty()) {
            return AnalyzerHelper.isContractName(name);
        }
        Definition definition = symbol.get().definition;
        if (definition instanceof DataContractDefinition) {
            return true;
        }
        if (definition instanceof TypeDefinition type) {
            return !visited.add(name) || isBoundarySafe(type.type, visited);
        }
        return false;
    }
}
