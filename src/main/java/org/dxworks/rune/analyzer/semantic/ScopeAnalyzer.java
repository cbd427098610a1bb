package org.dxworks.rune.analyzer.semantic;

import org.dxworks.rune.analyzer.AnalyzerHelper;
import org.dxworks.rune.analyzer.DiagnosticReporter;
import org.dxworks.rune.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replays each requirement's steps in order, tracking which values are in scope
 * and checking that the block yields what it declares. Scope never crosses
 * requirement boundaries and polymorphic cases work on forks that are dropped
 * when the case ends.
 */
public class ScopeAnalyzer {

    public List<RequirementScopes> analyze(Document document, SymbolTable table, DiagnosticReporter reporter) {
        List<RequirementScopes> result = new ArrayList<>();
        ContractFlattener flattener = new ContractFlattener(table);
        List<TopLevelBlock> blocks = document.blocks;
        for (int i = 0; i < blocks.size(); i++) {
            if (!(blocks.get(i) instanceof RequirementBlock requirement)) {
                continue;
            }
            int endLine = i + 1 < blocks.size() ? blocks.get(i + 1).span.startLine : document.lineCount;
            RequirementScopes scopes = new RequirementScopes(requirement.name(), requirement.span.startLine, endLine);
            new RequirementWalk(requirement, scopes, flattener, reporter).run();
            result.add(scopes);
        }
        return result;
    }

    private static final class RequirementWalk {
        private final RequirementBlock requirement;
        private final RequirementScopes scopes;
        private final ContractFlattener flattener;
        private final DiagnosticReporter reporter;

        RequirementWalk(RequirementBlock requirement, RequirementScopes scopes,
                        ContractFlattener flattener, DiagnosticReporter reporter) {
            this.requirement = requirement;
            this.scopes = scopes;
            this.flattener = flattener;
            this.reporter = reporter;
        }

        void run() {
            Scope scope = new Scope();
            if (!seed(scope)) {
                return;
            }
            checkpoint(requirement.span.startLine, scope);
            String yielded = walk(requirement.steps, scope);
            checkOutput(yielded);
            checkpoint(requirement.span.endLine + 1, scope);
        }

        /** @return false when the input contract is cyclic and the block is abandoned */
        private boolean seed(Scope scope) {
            List<Parameter> parameters = requirement.signature.parameters;
            if (parameters.size() > 1) {
                reporter.report(DiagnosticCode.INVALID_REQUIREMENT_INPUT, parameters.get(1).span,
                        "requirement takes a single input, found " + parameters.size() + " parameters");
            }
            Parameter input = requirement.input;
            if (input == null) {
                return true;
            }
            if (Parameter.CONTRACT_LITERAL.equals(input.kind)) {
                for (Identifier property : input.properties) {
                    scope.bindIfAbsent(new ScopeBinding(property.name, property.name, ScopeBinding.INPUT, property.span));
                }
            } else if (input.isContractReference()) {
                try {
                    flattener.flatten(input.name.name, ScopeBinding.INPUT, input.span).forEach(scope::bindIfAbsent);
                } catch (ContractCycleException e) {
                    if (flattener.firstReport(e)) {
                        reporter.report(DiagnosticCode.CONTRACT_CYCLE, input.span, e.getMessage());
                    }
                    return false;
                }
            } else {
                reporter.report(DiagnosticCode.INVALID_REQUIREMENT_INPUT, input.span,
                        "requirement input must be a data contract or an inline contract literal, found '"
                                + input + "'");
            }
            return true;
        }

        private String walk(List<Step> steps, Scope scope) {
            String yielded = null;
            for (Step step : steps) {
                checkpoint(step.span.startLine, scope);
                yielded = step(step, scope);
            }
            return yielded;
        }

        private String step(Step step, Scope scope) {
            if (step instanceof CallStep call) {
                checkCall(call.signature, scope);
                bindReturn(call.signature, scope);
                return call.signature.returnType.text;
            }
            if (step instanceof ConstructorStep constructor) {
                Identifier name = constructor.className;
                bind(scope, new ScopeBinding(name.name, name.name, ScopeBinding.CONSTRUCTOR, name.span));
                return name.name;
            }
            if (step instanceof ReturnStep ret) {
                return returned(ret.value, scope);
            }
            if (step instanceof PolymorphicStep polymorphic) {
                return polymorphic(polymorphic, scope);
            }
            throw new IllegalStateException("Unknown step kind: " + step.kind);
        }

        private String returned(Identifier value, Scope scope) {
            if (AnalyzerHelper.isContractName(value.name)) {
                return value.name;
            }
            Optional<ScopeBinding> binding = scope.get(value.name);
            if (binding.isEmpty()) {
                reporter.report(DiagnosticCode.OUT_OF_SCOPE, value.span,
                        "[RET] value '" + value.name + "' is not in scope");
                return value.name;
            }
            return binding.get().type;
        }

        private String polymorphic(PolymorphicStep step, Scope scope) {
            Signature signature = step.signature;
            checkCall(signature, scope);
            String declared = signature.returnType.text;
            for (Case c : step.cases) {
                Scope fork = scope.fork();
                checkpoint(c.span.startLine, fork);
                String yielded = walk(c.steps, fork);
                boolean satisfied = c.steps.isEmpty() ? signature.returnType.isVoid() : declared.equals(yielded);
                if (!satisfied) {
                    reporter.report(DiagnosticCode.CASE_OUTPUT_MISMATCH, c.name.span,
                            "case '" + c.name.name + "' yields '" + (yielded != null ? yielded : "nothing")
                                    + "' but [PLY] declares '" + declared + "'",
                            signature.returnType.span);
                }
            }
            bindReturn(signature, scope);
            return declared;
        }

        private void checkCall(Signature signature, Scope scope) {
            if (!signature.isStatic() && !scope.contains(signature.subject.name)) {
                reporter.report(DiagnosticCode.OUT_OF_SCOPE, signature.subject.span,
                        "subject '" + signature.subject.name + "' is not in scope");
            }
            for (Parameter parameter : signature.parameters) {
                switch (parameter.kind) {
                    case Parameter.NAME -> {
                        if (!parameter.isContractReference() && !scope.contains(parameter.name.name)) {
                            reporter.report(DiagnosticCode.OUT_OF_SCOPE, parameter.span,
                                    "parameter '" + parameter.name.name + "' is not in scope");
                        }
                    }
                    case Parameter.CONTRACT_LITERAL -> {
                        for (Identifier property : parameter.properties) {
                            if (!scope.contains(property.name)) {
                                reporter.report(DiagnosticCode.OUT_OF_SCOPE, property.span,
                                        "property '" + property.name + "' is not in scope");
                            }
                        }
                    }
                    default -> {
                        // typed parameters declare their own type
                    }
                }
            }
        }

        private void bindReturn(Signature signature, Scope scope) {
            for (TypeExpression member : signature.returnType.members()) {
                if (member.isVoid()) {
                    continue;
                }
                bind(scope, new ScopeBinding(member.text, member.text, ScopeBinding.STEP, member.span));
                if (member.isNamed() && AnalyzerHelper.isContractName(member.name)) {
                    try {
                        flattener.flatten(member.name, ScopeBinding.STEP, member.span).forEach(scope::bind);
                    } catch (ContractCycleException e) {
                        if (flattener.firstReport(e)) {
                            reporter.report(DiagnosticCode.CONTRACT_CYCLE, member.span, e.getMessage());
                        }
                    }
                }
            }
        }

        private void bind(Scope scope, ScopeBinding binding) {
            scope.bind(binding).ifPresent(previous ->
                    reporter.report(DiagnosticCode.SCOPE_COLLISION, binding.span,
                            "'" + binding.name + "' is bound again and shadows the earlier value",
                            previous.span));
        }

        private void checkOutput(String yielded) {
            TypeExpression output = requirement.output;
            List<Step> steps = requirement.steps;
            if (steps.isEmpty()) {
                if (!output.isVoid()) {
                    reporter.report(DiagnosticCode.UNSATISFIED_OUTPUT, requirement.signature.span,
                            "requirement has no steps but declares '" + output.text + "'", output.span);
                }
                return;
            }
            if (!output.text.equals(yielded)) {
                Step last = steps.get(steps.size() - 1);
                reporter.report(DiagnosticCode.UNSATISFIED_OUTPUT, last.span,
                        "final step yields '" + yielded + "' but requirement declares '" + output.text + "'",
                        output.span);
            }
        }

        private void checkpoint(int line, Scope scope) {
            scopes.checkpoints.add(new ScopeCheckpoint(line, scope.snapshot()));
        }
    }
}
