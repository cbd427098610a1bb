package org.dxworks.rune.analyzer;

import org.dxworks.rune.RuneConfig;
import org.dxworks.rune.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.rune.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class DocumentAnalyzerTest {

    private static final String[] REGISTRATION = {
            "[TYP] id: string",
            "    recording identifier",
            "[TYP] providerName: string",
            "    provider name",
            "[TYP] externalId: string",
            "    provider side identifier",
            "",
            "",
            "[REQ] recording.register({providerName, externalId}): id",
            "    id::create(providerName): id",
            "    [RET] id"};

    @Test
    void wellFormedDocumentHasNoDiagnostics() {
        DocumentAnalysis analysis = analyze(REGISTRATION);

        assertEquals(List.of(), analysis.diagnostics);
        assertEquals(4, analysis.document.blocks.size());
        RequirementBlock requirement = analysis.document.blocksOf(RequirementBlock.class).get(0);
        assertEquals(2, requirement.steps.size());
        assertEquals(11, analysis.document.lineCount);
    }

    @Test
    void returningTheWrongValue() {
        DocumentAnalysis analysis = analyze(
                "[TYP] id: string",
                "    recording identifier",
                "[TYP] providerName: string",
                "    provider name",
                "[TYP] externalId: string",
                "    provider side identifier",
                "[DTO] RecordingDto: id",
                "    registered recording",
                "",
                "",
                "[REQ] recording.register({providerName, externalId}): RecordingDto",
                "    id::create(providerName): id",
                "    [RET] id");

        assertEquals(List.of(DiagnosticCode.UNSATISFIED_OUTPUT), codes(analysis));
        Diagnostic diagnostic = analysis.diagnostics.get(0);
        assertEquals(12, diagnostic.range.startLine);
        assertEquals("final step yields 'id' but requirement declares 'RecordingDto'", diagnostic.message);
    }

    @Test
    void faultListBeforeAnyStep() {
        DocumentAnalysis analysis = analyze(
                "[TYP] id: string",
                "    recording identifier",
                "[DTO] GetRecordingDto: id",
                "    lookup request",
                "[DTO] RecordingDto: id",
                "    stored recording",
                "",
                "",
                "[REQ] recording.get(GetRecordingDto): RecordingDto",
                "      not-found",
                "    db:recording::load(id): RecordingDto",
                "      not-found");

        assertEquals(1, errors(analysis).size());
        assertEquals(1, analysis.errorCount());
        assertEquals(0, analysis.warningCount());
        assertEquals(DiagnosticCode.FAULT_WITHOUT_STEP, analysis.diagnostics.get(0).code);
        assertEquals(9, analysis.diagnostics.get(0).range.startLine);
        BoundaryStep load = (BoundaryStep) analysis.document.blocksOf(RequirementBlock.class).get(0).steps.get(0);
        assertEquals(List.of("not-found"), load.faults.names());
    }

    @Test
    void inconsistentCallShape() {
        DocumentAnalysis analysis = analyze(
                "[TYP] name: string",
                "    display name",
                "[TYP] email: string",
                "    contact address",
                "[TYP] age: number",
                "    age in years",
                "[TYP] user: Class",
                "    user account",
                "",
                "",
                "[REQ] user.register({name, email, age}): user",
                "    [NEW] user",
                "    user.save(name, email, age): void",
                "    user.save(name, email): void",
                "    [RET] user");

        assertEquals(List.of(DiagnosticCode.SIGNATURE_MISMATCH), codes(analysis));
        Diagnostic mismatch = analysis.diagnostics.get(0);
        assertEquals(13, mismatch.range.startLine);
        assertEquals(SourceSpan.onLine(12, 4, 37), mismatch.related);
        assertEquals("user.save was first used as (name, email, age): void, here as (name, email): void",
                mismatch.message);
    }

    @Test
    void classValueAcrossABoundary() {
        DocumentAnalysis analysis = analyze(
                "[TYP] id: string",
                "    recording identifier",
                "[TYP] recording: Class",
                "    recording entity",
                "[TYP] storage: Class",
                "    storage client",
                "",
                "",
                "[REQ] recording.archive({id}): void",
                "    [NEW] recording",
                "    [NEW] storage",
                "    db:storage.save(recording): void");

        assertEquals(List.of(DiagnosticCode.BOUNDARY_CONSTRAINT), codes(analysis));
        Diagnostic violation = analysis.diagnostics.get(0);
        assertEquals(SourceSpan.onLine(11, 20, 29), violation.range);
        assertEquals("'recording' cannot cross the database boundary, only data contracts and primitives can",
                violation.message);
    }

    @Test
    void contractCycle() {
        DocumentAnalysis analysis = analyze(
                "[TYP] id: string",
                "    identifier",
                "[DTO] ADto: id, BDto",
                "    first half",
                "[DTO] BDto: ADto",
                "    second half",
                "",
                "",
                "[REQ] cycle.run(ADto): void");

        assertEquals(List.of(DiagnosticCode.CONTRACT_CYCLE), codes(analysis));
        assertEquals("data contract cycle: ADto -> BDto -> ADto", analysis.diagnostics.get(0).message);
    }

    @Test
    void analysisIsDeterministic() {
        String text = doc(
                "[TYP] id: string",
                "[DTO] Broken: id, id",
                "    stray description",
                "[REQ] recording.get({id}): RecordingDto",
                "    recording.load(id, missing): RecordingDto",
                "      not-found not-found",
                "    ??? what",
                "  [CSE] nowhere");

        DocumentAnalyzer analyzer = new DocumentAnalyzer();
        DocumentAnalysis first = analyzer.analyze(text);
        DocumentAnalysis second = analyzer.analyze(text);

        assertFalse(first.diagnostics.isEmpty());
        assertEquals(first.diagnostics, second.diagnostics);
        assertEquals(DiagnosticReporter.render(first.diagnostics), DiagnosticReporter.render(second.diagnostics));
        for (int i = 1; i < first.diagnostics.size(); i++) {
            assertTrue(AnalyzerHelper.DIAGNOSTIC_COMPARATOR.compare(
                    first.diagnostics.get(i - 1), first.diagnostics.get(i)) <= 0);
        }
    }

    @Test
    void emptyDocument() {
        DocumentAnalysis analysis = new DocumentAnalyzer().analyze("");
        assertTrue(analysis.diagnostics.isEmpty());
        assertTrue(analysis.document.blocks.isEmpty());
    }

    @Test
    void renderFormat() {
        DocumentAnalysis analysis = analyze(RuneConfig.with(80, 2, true, false),
                "[TYP] id: string",
                "    identifier",
                "[TYP] id: number",
                "    again");

        assertEquals("3:7 error [duplicate-symbol] type 'id' is already defined (see 1:7)\n",
                DiagnosticReporter.render(analysis.diagnostics));
    }
}
