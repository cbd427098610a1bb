package org.dxworks.rune.analyzer;

import org.dxworks.rune.model.Diagnostic;
import org.dxworks.rune.model.ScopeBinding;
import org.dxworks.rune.model.SourceSpan;

import java.util.Comparator;

public final class AnalyzerHelper {

    private AnalyzerHelper() {}

    /**
     * Orders spans by start line, then start column.
     */
    public static final Comparator<SourceSpan> SPAN_COMPARATOR = Comparator
            .comparingInt((SourceSpan s) -> s.startLine)
            .thenComparingInt(s -> s.startColumn);

    /**
     * Standard ordering for diagnostics: line, column, code label, message.
     * Keeps reports byte-identical across runs over the same text.
     */
    public static final Comparator<Diagnostic> DIAGNOSTIC_COMPARATOR = (a, b) -> {
        int spanCompare = SPAN_COMPARATOR.compare(a.range, b.range);
        if (spanCompare != 0) return spanCompare;

        int codeCompare = a.code.getLabel().compareTo(b.code.getLabel());
        if (codeCompare != 0) return codeCompare;

        if (a.message != null && b.message != null) {
            return a.message.compareTo(b.message);
        } else if (a.message != null) {
            return 1;
        } else if (b.message != null) {
            return -1;
        }
        return 0;
    };

    public static final Comparator<ScopeBinding> BINDING_COMPARATOR = Comparator
            .comparing((ScopeBinding b) -> b.name)
            .thenComparing(b -> b.type);

    /**
     * Collapse all whitespace to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static boolean isContractName(String name) {
        return name != null && name.endsWith("Dto");
    }

    /** 1-based {@code line:column} of a span start, as editors show it. */
    public static String location(SourceSpan span) {
        return (span.startLine + 1) + ":" + (span.startColumn + 1);
    }
}
