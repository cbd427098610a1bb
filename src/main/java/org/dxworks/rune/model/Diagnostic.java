package org.dxworks.rune.model;

import java.util.Objects;

public class Diagnostic {
    public Severity severity;
    public DiagnosticCode code;
    public SourceSpan range;
    public String message;
    public SourceSpan related; // first occurrence, for duplicates and mismatches

    public Diagnostic() {
    }

    public Diagnostic(DiagnosticCode code, SourceSpan range, String message, SourceSpan related) {
        this.severity = code.getSeverity();
        this.code = code;
        this.range = range;
        this.message = message;
        this.related = related;
    }

    public Diagnostic(DiagnosticCode code, SourceSpan range, String message) {
        this(code, range, message, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic other)) return false;
        return severity == other.severity && code == other.code
                && Objects.equals(range, other.range)
                && Objects.equals(message, other.message)
                && Objects.equals(related, other.related);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, code, range, message, related);
    }

    @Override
    public String toString() {
        return range + " " + severity.getLabel() + " [" + code.getLabel() + "] " + message;
    }
}
