package org.dxworks.rune.model;

/**
 * Stable identifiers for every finding the analyzer can produce, each with the
 * severity it is reported with.
 */
public enum DiagnosticCode {
    // line classification and structure
    UNCLASSIFIED_LINE(Severity.ERROR),
    INDENTATION(Severity.ERROR),
    MALFORMED_SIGNATURE(Severity.ERROR),
    MALFORMED_DEFINITION(Severity.ERROR),
    MISPLACED_TAG(Severity.ERROR),
    FAULT_WITHOUT_STEP(Severity.ERROR),
    DUPLICATE_FAULT(Severity.ERROR),
    CASE_OUTSIDE_POLYMORPHIC(Severity.ERROR),
    EMPTY_POLYMORPHIC(Severity.ERROR),
    MISSING_CASE(Severity.ERROR),
    STEP_OUTSIDE_REQUIREMENT(Severity.ERROR),
    MISSING_DESCRIPTION(Severity.ERROR),
    INVALID_CONTRACT_NAME(Severity.ERROR),
    DUPLICATE_PROPERTY(Severity.ERROR),
    INVALID_BOUNDARY_PREFIX(Severity.ERROR),
    CONTINUATION_INDENTATION(Severity.ERROR),
    UNTERMINATED_SIGNATURE(Severity.ERROR),
    LINE_TOO_LONG(Severity.WARNING),
    MISSING_SEPARATOR(Severity.WARNING),

    // symbols
    DUPLICATE_SYMBOL(Severity.ERROR),
    DUPLICATE_REQUIREMENT(Severity.ERROR),

    // scope and flow
    CONTRACT_CYCLE(Severity.ERROR),
    OUT_OF_SCOPE(Severity.ERROR),
    SCOPE_COLLISION(Severity.WARNING),
    UNSATISFIED_OUTPUT(Severity.ERROR),
    CASE_OUTPUT_MISMATCH(Severity.ERROR),
    INVALID_REQUIREMENT_INPUT(Severity.ERROR),

    // types and consistency
    UNRESOLVED_REFERENCE(Severity.ERROR),
    UNRESOLVED_RETURN_TYPE(Severity.WARNING),
    INVALID_TYPE_DEFINITION(Severity.ERROR),
    WRONG_TYPE_ARITY(Severity.ERROR),
    NOT_A_CLASS_TYPE(Severity.ERROR),
    BOUNDARY_CONSTRAINT(Severity.ERROR),
    SIGNATURE_MISMATCH(Severity.ERROR),
    UNUSED_SYMBOL(Severity.WARNING);

    private final Severity severity;

    DiagnosticCode(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }

    /** Lower-case, hyphenated form used in rendered reports, e.g. {@code out-of-scope}. */
    public String getLabel() {
        return name().toLowerCase().replace('_', '-');
    }
}
