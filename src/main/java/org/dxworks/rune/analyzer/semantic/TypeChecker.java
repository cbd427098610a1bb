package org.dxworks.rune.analyzer.semantic;

import org.dxworks.rune.RuneConfig;
import org.dxworks.rune.analyzer.DiagnosticReporter;
import org.dxworks.rune.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves every type and contract reference, enforces the boundary and
 * constructor rules, checks that repeated calls keep the shape of their first
 * occurrence and flags definitions nothing uses.
 */
public class TypeChecker {

    private final RuneConfig config;

    public TypeChecker(RuneConfig config) {
        this.config = config;
    }

    /** @return every resolved symbol reference, in document order */
    public List<SymbolReference> check(Document document, SymbolTable table, DiagnosticReporter reporter) {
        List<SymbolReference> references = new ArrayList<>();
        TypeResolver resolver = new TypeResolver(table, reporter, references);
        Run run = new Run(table, resolver, reporter);
        for (TopLevelBlock block : document.blocks) {
            if (block instanceof TypeDefinition type) {
                run.typeDefinition(type);
            } else if (block instanceof DataContractDefinition contract) {
                for (Property property : contract.properties) {
                    resolver.resolveName(property.type.name, property.type.span, DiagnosticCode.UNRESOLVED_REFERENCE);
                }
            } else if (block instanceof RequirementBlock requirement) {
                run.requirement(requirement);
            }
        }
        if (config.isReportUnusedSymbols()) {
            for (Symbol symbol : table.symbols()) {
                if (symbol.usages == 0) {
                    reporter.report(DiagnosticCode.UNUSED_SYMBOL, symbol.definition.name.span,
                            symbol.kind.getLabel() + " '" + symbol.name + "' is never used");
                }
            }
        }
        return references;
    }

    private static final class Run {
        private final SymbolTable table;
        private final TypeResolver resolver;
        private final DiagnosticReporter reporter;

        Run(SymbolTable table, TypeResolver resolver, DiagnosticReporter reporter) {
            this.table = table;
            this.resolver = resolver;
            this.reporter = reporter;
        }

        void typeDefinition(TypeDefinition definition) {
            TypeExpression type = definition.type;
            if (type.isNamed() && !BuiltinTypes.isPrimitive(type.name)) {
                Optional<Symbol> target = resolver.reference(type.name, type.span);
                if (target.isPresent()) {
                    reporter.report(DiagnosticCode.INVALID_TYPE_DEFINITION, type.span,
                            "type '" + definition.name.name + "' must be built from primitives, '"
                                    + type.name + "' is a " + target.get().kind.getLabel());
                    return;
                }
            } else if (TypeExpression.GENERIC.equals(type.kind) && !BuiltinTypes.isGeneric(type.name)) {
                reporter.report(DiagnosticCode.INVALID_TYPE_DEFINITION, type.span,
                        "type '" + definition.name.name + "' uses '" + type.name
                                + "', which is not a built-in generic type");
                type.arguments.forEach(argument -> resolver.resolve(argument, DiagnosticCode.UNRESOLVED_REFERENCE));
                return;
            }
            resolver.resolve(type, DiagnosticCode.UNRESOLVED_REFERENCE);
        }

        void requirement(RequirementBlock requirement) {
            Signature signature = requirement.signature;
            resolver.reference(signature.subject.name, signature.subject.span);
            Parameter input = requirement.input;
            for (Parameter parameter : signature.parameters) {
                if (parameter == input && Parameter.CONTRACT_LITERAL.equals(input.kind)) {
                    for (Identifier property : input.properties) {
                        resolver.resolveName(property.name, property.span, DiagnosticCode.UNRESOLVED_REFERENCE);
                    }
                } else {
                    parameter(parameter);
                }
            }
            resolver.resolve(requirement.output, DiagnosticCode.UNRESOLVED_REFERENCE);
            steps(requirement.steps);
        }

        private void steps(List<Step> steps) {
            for (Step step : steps) {
                if (step instanceof CallStep call) {
                    call(call.signature, call instanceof BoundaryStep boundary ? boundary.boundary : null);
                } else if (step instanceof ConstructorStep constructor) {
                    constructor(constructor.className);
                } else if (step instanceof ReturnStep ret) {
                    parameter(Parameter.bare(ret.value));
                } else if (step instanceof PolymorphicStep polymorphic) {
                    call(polymorphic.signature, null);
                    for (Case c : polymorphic.cases) {
                        steps(c.steps);
                    }
                }
            }
        }

        private void call(Signature signature, Boundary boundary) {
            resolver.reference(signature.subject.name, signature.subject.span);
            signature.parameters.forEach(this::parameter);
            resolver.resolve(signature.returnType, DiagnosticCode.UNRESOLVED_RETURN_TYPE);
            if (boundary != null) {
                checkBoundary(signature, boundary);
            }
            CallShape shape = new CallShape(signature);
            table.registerCallShape(shape).ifPresent(first -> {
                if (!first.matches(shape)) {
                    reporter.report(DiagnosticCode.SIGNATURE_MISMATCH, signature.span,
                            signature.callKey() + " was first used as " + first + ", here as " + shape,
                            first.firstOccurrence);
                }
            });
        }

        private void parameter(Parameter parameter) {
            switch (parameter.kind) {
                case Parameter.TYPED -> resolver.resolve(parameter.type, DiagnosticCode.UNRESOLVED_REFERENCE);
                case Parameter.CONTRACT_LITERAL -> parameter.properties
                        .forEach(property -> resolver.reference(property.name, property.span));
                default -> {
                    if (parameter.isContractReference()) {
                        resolver.resolveName(parameter.name.name, parameter.name.span,
                                DiagnosticCode.UNRESOLVED_REFERENCE);
                    } else {
                        resolver.reference(parameter.name.name, parameter.name.span);
                    }
                }
            }
        }

        private void constructor(Identifier className) {
            Optional<Symbol> symbol = resolver.reference(className.name, className.span);
            if (symbol.isEmpty()) {
                reporter.report(DiagnosticCode.UNRESOLVED_REFERENCE, className.span,
                        "class '" + className.name + "' is not defined");
            } else if (!resolver.isClassType(symbol.get())) {
                reporter.report(DiagnosticCode.NOT_A_CLASS_TYPE, className.span,
                        "[NEW] needs a type declared as Class, '" + className.name + "' is not");
            }
        }

        private void checkBoundary(Signature signature, Boundary boundary) {
            String edge = boundary.getDescription();
            for (Parameter parameter : signature.parameters) {
                for (TypeExpression type : typesOf(parameter)) {
                    if (!resolver.isBoundarySafe(type)) {
                        reporter.report(DiagnosticCode.BOUNDARY_CONSTRAINT, type.span,
                                "'" + type.text + "' cannot cross the " + edge
                                        + " boundary, only data contracts and primitives can");
                    }
                }
            }
            for (TypeExpression member : signature.returnType.members()) {
                if (!resolver.isBoundarySafe(member)) {
                    reporter.report(DiagnosticCode.BOUNDARY_CONSTRAINT, member.span,
                            "'" + member.text + "' cannot be returned across the " + edge
                                    + " boundary, only data contracts and primitives can");
                }
            }
        }

        private static List<TypeExpression> typesOf(Parameter parameter) {
            return switch (parameter.kind) {
                case Parameter.TYPED -> List.of(parameter.type);
                case Parameter.CONTRACT_LITERAL -> parameter.properties.stream()
                        .map(p -> TypeExpression.named(p.name, p.span))
                        .toList();
                default -> List.of(TypeExpression.named(parameter.name.name, parameter.name.span));
            };
        }
    }
}
