package org.dxworks.rune.analyzer.semantic;

import org.dxworks.rune.RuneConfig;
import org.dxworks.rune.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.rune.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class TypeCheckerTest {

    private static final RuneConfig QUIET = RuneConfig.with(80, 2, true, false);

    private static List<String> messages(DocumentAnalysis analysis, DiagnosticCode code) {
        return withCode(analysis, code).stream().map(d -> d.message).collect(Collectors.toList());
    }

    @Test
    void genericArity() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[TYP] ids: Array<string, string>",
                "    identifiers",
                "[TYP] list: Array",
                "    bare list",
                "[TYP] index: Map<string, number>",
                "    lookup table");

        assertEquals(List.of("Array takes 1 type argument, found 2", "Array takes 1 type argument, found 0"),
                messages(analysis, DiagnosticCode.WRONG_TYPE_ARITY));
        assertEquals(2, analysis.diagnostics.size());
    }

    @Test
    void typeDefinitionsAreBuiltFromPrimitives() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[TYP] id: string",
                "    identifier",
                "[TYP] alias: id",
                "    another name",
                "[TYP] boxed: Box<string>",
                "    wrapped value",
                "[TYP] pair: [id, number]",
                "    two values");

        assertEquals(List.of("type 'alias' must be built from primitives, 'id' is a type",
                        "type 'boxed' uses 'Box', which is not a built-in generic type"),
                messages(analysis, DiagnosticCode.INVALID_TYPE_DEFINITION));
        assertEquals(2, analysis.diagnostics.size());
    }

    @Test
    void unresolvedNames() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[DTO] RecordingDto: id, MissingDto",
                "    stored recording",
                "",
                "",
                "[REQ] recording.get({id}): RecordingDto",
                "    recording::load(id): blob",
                "    recording::wrap(blob): RecordingDto");

        assertEquals(List.of("'id' is not defined", "'MissingDto' is not defined", "'id' is not defined"),
                messages(analysis, DiagnosticCode.UNRESOLVED_REFERENCE));
        List<Diagnostic> returns = withCode(analysis, DiagnosticCode.UNRESOLVED_RETURN_TYPE);
        assertEquals(1, returns.size());
        assertEquals(Severity.WARNING, returns.get(0).severity);
        assertEquals("return type 'blob' is not defined", returns.get(0).message);
    }

    @Test
    void constructorNeedsAClassType() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[TYP] id: string",
                "    identifier",
                "[TYP] recording: Class",
                "    recording entity",
                "[TYP] name: string",
                "    display name",
                "",
                "",
                "[REQ] recording.create({id}): void",
                "    [NEW] recording",
                "    [NEW] name",
                "    [NEW] widget",
                "    recording.save(id): void");

        assertEquals(List.of("[NEW] needs a type declared as Class, 'name' is not"),
                messages(analysis, DiagnosticCode.NOT_A_CLASS_TYPE));
        assertEquals(List.of("class 'widget' is not defined"),
                messages(analysis, DiagnosticCode.UNRESOLVED_REFERENCE));
        assertEquals(2, analysis.diagnostics.size());
    }

    @Test
    void boundaryCallsCarryOnlyContractsAndPrimitives() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[TYP] id: string",
                "    identifier",
                "[TYP] status: \"draft\" | \"published\"",
                "    publication state",
                "[TYP] recording: Class",
                "    recording entity",
                "[DTO] RecordingDto: id, status",
                "    stored recording",
                "",
                "",
                "[REQ] recording.store({id, status}): void",
                "    [NEW] recording",
                "    db:storage::save(id, status, RecordingDto, data: Uint8Array): void",
                "    fs:storage::write(recording): void",
                "    mq:queue::read(id): recording");

        List<Diagnostic> violations = withCode(analysis, DiagnosticCode.BOUNDARY_CONSTRAINT);
        assertEquals(2, violations.size());
        assertEquals(13, violations.get(0).range.startLine);
        assertTrue(violations.get(0).message.startsWith("'recording' cannot cross the "));
        assertEquals(14, violations.get(1).range.startLine);
        assertTrue(violations.get(1).message.startsWith("'recording' cannot be returned across the "));
    }

    @Test
    void undefinedCustomTypeCannotCrossABoundary() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[TYP] id: string",
                "    recording identifier",
                "",
                "",
                "[REQ] recording.archive({id}): void",
                "    recording::create(id): recording",
                "    db:storage::save(recording): void");

        assertEquals(List.of("return type 'recording' is not defined"),
                messages(analysis, DiagnosticCode.UNRESOLVED_RETURN_TYPE));
        List<Diagnostic> violations = withCode(analysis, DiagnosticCode.BOUNDARY_CONSTRAINT);
        assertEquals(1, violations.size());
        assertEquals(SourceSpan.onLine(6, 21, 30), violations.get(0).range);
        assertEquals("'recording' cannot cross the database boundary, only data contracts and primitives can",
                violations.get(0).message);
        assertEquals(1, analysis.errorCount());
    }

    @Test
    void classPrimitiveCannotCrossABoundary() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[REQ] recording.store({}): void",
                "    db:storage::save(handle: Class): void");
        assertEquals(1, withCode(analysis, DiagnosticCode.BOUNDARY_CONSTRAINT).size());
    }

    @Test
    void repeatedCallsKeepTheirFirstShape() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[TYP] id: string",
                "    identifier",
                "[TYP] name: string",
                "    display name",
                "",
                "",
                "[REQ] recording.rename({id, name}): void",
                "    recording::touch(id): void",
                "    recording::touch(id): void",
                "    recording::touch(id, name): void",
                "    recording::touch(name): void");

        List<Diagnostic> mismatches = withCode(analysis, DiagnosticCode.SIGNATURE_MISMATCH);
        assertEquals(2, mismatches.size());
        Diagnostic first = mismatches.get(0);
        assertEquals("recording::touch was first used as (id): void, here as (id, name): void", first.message);
        assertEquals(SourceSpan.onLine(7, 4, 30), first.related);
        assertEquals(10, mismatches.get(1).range.startLine);
    }

    @Test
    void bareParameterIsItsOwnTypeWhenComparingShapes() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[TYP] name: string",
                "    display name",
                "[TYP] user: Class",
                "    user account",
                "",
                "",
                "[REQ] user.rename({name}): void",
                "    [NEW] user",
                "    user.save(name: string): void",
                "    user.save(name): void");

        List<Diagnostic> mismatches = withCode(analysis, DiagnosticCode.SIGNATURE_MISMATCH);
        assertEquals(1, mismatches.size());
        assertEquals(9, mismatches.get(0).range.startLine);
        assertEquals(8, mismatches.get(0).related.startLine);
    }

    @Test
    void unusedDefinitionsAreReportedWhenEnabled() {
        String[] lines = {
                "[TYP] id: string",
                "    identifier",
                "[TYP] spare: number",
                "    nobody needs this",
                "[NON] recording",
                "",
                "",
                "[REQ] recording.ping({id}): void"};

        DocumentAnalysis analysis = analyze(lines);
        List<Diagnostic> unused = withCode(analysis, DiagnosticCode.UNUSED_SYMBOL);
        assertEquals(List.of("type 'spare' is never used"),
                unused.stream().map(d -> d.message).collect(Collectors.toList()));
        assertEquals(Severity.WARNING, unused.get(0).severity);

        assertTrue(withCode(analyze(QUIET, lines), DiagnosticCode.UNUSED_SYMBOL).isEmpty());
    }

    @Test
    void referencesAreRecordedAndCounted() {
        DocumentAnalysis analysis = analyze(QUIET,
                "[TYP] id: string",
                "    identifier",
                "[DTO] RecordingDto: id",
                "    stored recording",
                "",
                "",
                "[REQ] recording.get({id}): RecordingDto",
                "    recording::load(id): RecordingDto");

        assertEquals(List.of(), analysis.diagnostics);
        assertEquals(3, analysis.symbolTable.lookup("id").get().usages);
        assertEquals(List.of(2, 6, 7), analysis.references.stream()
                .filter(r -> r.name.equals("id"))
                .map(r -> r.span.startLine)
                .collect(Collectors.toList()));
        assertEquals(SourceSpan.onLine(0, 6, 8), analysis.references.get(0).definition);
    }
}
