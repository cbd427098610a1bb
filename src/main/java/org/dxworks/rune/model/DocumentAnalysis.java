package org.dxworks.rune.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public class DocumentAnalysis {
    public Document document;
    public List<Diagnostic> diagnostics = new ArrayList<>();

    @JsonIgnore
    public SymbolTable symbolTable;
    @JsonIgnore
    public List<SymbolReference> references = new ArrayList<>();
    @JsonIgnore
    public List<RequirementScopes> scopes = new ArrayList<>();

    public long errorCount() {
        return diagnostics.stream().filter(d -> d.severity == Severity.ERROR).count();
    }

    public long warningCount() {
        return diagnostics.stream().filter(d -> d.severity == Severity.WARNING).count();
    }
}
