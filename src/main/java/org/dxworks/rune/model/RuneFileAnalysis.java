package org.dxworks.rune.model;

import java.util.List;

/**
 * One JSON line of the batch output: the parsed document and its diagnostics.
 */
public class RuneFileAnalysis {
    public String kind = "file";
    public String filePath;
    public String language = "rune";
    public long errors;
    public long warnings;
    public Document document;
    public List<Diagnostic> diagnostics;

    public RuneFileAnalysis(String filePath, DocumentAnalysis analysis) {
        this.filePath = filePath;
        this.document = analysis.document;
        this.diagnostics = analysis.diagnostics;
        this.errors = analysis.errorCount();
        this.warnings = analysis.warningCount();
    }
}
