package org.dxworks.rune.analyzer;

import org.dxworks.rune.model.Diagnostic;
import org.dxworks.rune.model.DiagnosticCode;
import org.dxworks.rune.model.SourceSpan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects findings from every analysis stage. Exact duplicates are dropped and
 * the result is sorted deterministically.
 */
public class DiagnosticReporter {

    private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();

    public void report(DiagnosticCode code, SourceSpan range, String message) {
        report(code, range, message, null);
    }

    public void report(DiagnosticCode code, SourceSpan range, String message, SourceSpan related) {
        diagnostics.add(new Diagnostic(code, range.copy(), message, related != null ? related.copy() : null));
    }

    public List<Diagnostic> diagnostics() {
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(AnalyzerHelper.DIAGNOSTIC_COMPARATOR);
        return sorted;
    }

    /**
     * Renders one line per diagnostic: {@code line:col severity [code] message},
     * with {@code (see line:col)} appended when a related location exists.
     */
    public static String render(List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(AnalyzerHelper.location(d.range))
              .append(' ').append(d.severity.getLabel())
              .append(" [").append(d.code.getLabel()).append("] ")
              .append(d.message);
            if (d.related != null) {
                sb.append(" (see ").append(AnalyzerHelper.location(d.related)).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
