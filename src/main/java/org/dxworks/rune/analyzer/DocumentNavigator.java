package org.dxworks.rune.analyzer;

import org.dxworks.rune.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Answers editor queries (hover, go to definition, references, completion scope)
 * from a finished {@link DocumentAnalysis}.
 */
public class DocumentNavigator {

    private final DocumentAnalysis analysis;

    public DocumentNavigator(DocumentAnalysis analysis) {
        this.analysis = analysis;
    }

    /**
     * Description of the definition referenced at {@code position}, or of the
     * type, contract or noun definition enclosing it.
     */
    public Optional<String> describe(SourcePosition position) {
        Optional<Definition> referenced = referenceAt(position)
                .flatMap(reference -> analysis.symbolTable.lookup(reference.name))
                .map(symbol -> symbol.definition);
        if (referenced.isPresent()) {
            return Optional.ofNullable(referenced.get().description);
        }
        for (TopLevelBlock block : analysis.document.blocks) {
            if (block instanceof Definition definition && definition.span.containsLine(position.line)) {
                return Optional.ofNullable(definition.description);
            }
        }
        return Optional.empty();
    }

    /** Span of the definition name for the reference (or definition name) at {@code position}. */
    public Optional<SourceSpan> resolveDefinition(SourcePosition position) {
        Optional<SymbolReference> reference = referenceAt(position);
        if (reference.isPresent()) {
            return Optional.of(reference.get().definition);
        }
        return analysis.symbolTable.symbols().stream()
                .map(symbol -> symbol.definition.name.span)
                .filter(span -> span.contains(position))
                .findFirst();
    }

    /** Every use site of {@code symbolName}, in document order. */
    public List<SourceSpan> findReferences(String symbolName) {
        List<SourceSpan> spans = analysis.references.stream()
                .filter(reference -> reference.name.equals(symbolName))
                .map(reference -> reference.span)
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
        spans.sort(AnalyzerHelper.SPAN_COMPARATOR);
        return spans;
    }

    /** Values in scope at {@code position}, sorted by name; empty outside requirements. */
    public List<ScopeBinding> scopeAt(SourcePosition position) {
        for (RequirementScopes scopes : analysis.scopes) {
            if (scopes.covers(position.line)) {
                return scopes.checkpointAt(position.line)
                        .map(checkpoint -> Collections.unmodifiableList(checkpoint.bindings))
                        .orElse(List.of());
            }
        }
        return List.of();
    }

    private Optional<SymbolReference> referenceAt(SourcePosition position) {
        return analysis.references.stream()
                .filter(reference -> reference.span.contains(position))
                .findFirst();
    }
}
