package org.dxworks.rune.analyzer;

import org.dxworks.rune.RuneConfig;
import org.dxworks.rune.analyzer.parser.StructuralParser;
import org.dxworks.rune.analyzer.semantic.ScopeAnalyzer;
import org.dxworks.rune.analyzer.semantic.SymbolTableBuilder;
import org.dxworks.rune.analyzer.semantic.TypeChecker;
import org.dxworks.rune.model.Document;
import org.dxworks.rune.model.DocumentAnalysis;
import org.dxworks.rune.model.SymbolTable;

/**
 * Runs the whole pipeline over one document version: parse, register symbols,
 * check scopes, check types, then collect the diagnostics.
 *
 * <p>Analysis is pure and keeps no state between calls, so one instance can
 * serve several threads and a stale analysis can simply be dropped.
 */
public class DocumentAnalyzer {

    private final StructuralParser parser;
    private final SymbolTableBuilder symbolTableBuilder = new SymbolTableBuilder();
    private final ScopeAnalyzer scopeAnalyzer = new ScopeAnalyzer();
    private final TypeChecker typeChecker;

    public DocumentAnalyzer() {
        this(RuneConfig.defaults());
    }

    public DocumentAnalyzer(RuneConfig config) {
        this.parser = new StructuralParser(config);
        this.typeChecker = new TypeChecker(config);
    }

    public DocumentAnalysis analyze(String text) {
        DiagnosticReporter reporter = new DiagnosticReporter();
        Document document = parser.parse(text, reporter);
        SymbolTable table = symbolTableBuilder.build(document, reporter);

        DocumentAnalysis analysis = new DocumentAnalysis();
        analysis.document = document;
        analysis.symbolTable = table;
        analysis.scopes = scopeAnalyzer.analyze(document, table, reporter);
        analysis.references = typeChecker.check(document, table, reporter);
        analysis.diagnostics = reporter.diagnostics();
        return analysis;
    }
}
