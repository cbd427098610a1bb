package org.dxworks.rune;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.rune.analyzer.DocumentAnalyzer;
import org.dxworks.rune.model.DocumentAnalysis;
import org.dxworks.rune.model.RuneFileAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class AppAnalyzeFileTest {

    @TempDir
    Path tempDir;

    @Test
    void fileAnalysisSerializesAsJson() throws IOException {
        RuneFileAnalysis analysis = App.analyzeFile(TestUtils.SAMPLES.resolve("polymorphic.rune"), new DocumentAnalyzer());
        JsonNode json = TestUtils.APPROVAL_MAPPER.readTree(TestUtils.APPROVAL_MAPPER.writeValueAsString(analysis));

        assertEquals("file", json.get("kind").asText());
        assertEquals("rune", json.get("language").asText());
        assertEquals(3, json.get("errors").asInt());
        assertEquals(0, json.get("warnings").asInt());
        assertEquals(3, json.get("diagnostics").size());

        JsonNode first = json.get("diagnostics").get(0);
        assertEquals("BOUNDARY_CONSTRAINT", first.get("code").asText());
        assertEquals("ERROR", first.get("severity").asText());
        assertEquals(14, first.get("range").get("startLine").asInt());

        JsonNode blocks = json.get("document").get("blocks");
        assertEquals(5, blocks.size());
        assertEquals("type", blocks.get(0).get("kind").asText());
        assertEquals("contract", blocks.get(3).get("kind").asText());
        JsonNode requirement = blocks.get(4);
        assertEquals("requirement", requirement.get("kind").asText());
        assertEquals("polymorphic", requirement.get("steps").get(1).get("kind").asText());
        assertEquals(3, requirement.get("steps").get(1).get("cases").size());
        assertFalse(json.has("symbolTable"));
    }

    @Test
    void analyzerFailureBecomesAnErrorRecord() throws IOException {
        Path file = tempDir.resolve("recording.rune");
        Files.writeString(file, "[NON] recording\n");
        DocumentAnalyzer failing = new DocumentAnalyzer() {
            @Override
            public DocumentAnalysis analyze(String text) {
                throw new IllegalStateException("analyzer crashed");
            }
        };

        StringWriter out = new StringWriter();
        AtomicLong errors = new AtomicLong();
        AtomicLong warnings = new AtomicLong();
        try (BufferedWriter writer = new BufferedWriter(out)) {
            assertFalse(App.writeFileRecord(file, failing, writer, errors, warnings));
            assertTrue(App.writeFileRecord(file, new DocumentAnalyzer(), writer, errors, warnings));
        }

        List<String> records = out.toString().lines().toList();
        assertEquals(2, records.size());
        JsonNode error = TestUtils.APPROVAL_MAPPER.readTree(records.get(0));
        assertEquals("error", error.get("kind").asText());
        assertEquals(file.toString(), error.get("file").asText());
        assertEquals("analyzer crashed", error.get("error").asText());
        assertEquals("file", TestUtils.APPROVAL_MAPPER.readTree(records.get(1)).get("kind").asText());
    }

    @Test
    void collectsRuneFilesSorted() throws IOException {
        Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("nested/b.rune"), "[NON] recording\n");
        Files.writeString(tempDir.resolve("a.rune"), "[NON] recording\n");
        Files.writeString(tempDir.resolve("notes.md"), "# notes\n");

        List<Path> files = App.collectRuneFiles(tempDir, 100);
        assertEquals(List.of(tempDir.resolve("a.rune"), tempDir.resolve("nested/b.rune")), files);
    }

    @Test
    void oversizedFilesAreSkipped() throws IOException {
        Files.writeString(tempDir.resolve("big.rune"), "[NON] a\n[NON] b\n[NON] c\n");
        assertTrue(App.collectRuneFiles(tempDir, 2).isEmpty());
        assertEquals(1, App.collectRuneFiles(tempDir.resolve("big.rune"), 3).size());
    }

    @Test
    void detectsRuneFilesByExtension() {
        assertTrue(RuneFileDetector.isRuneFile(Path.of("docs/recording.rune")));
        assertTrue(RuneFileDetector.isRuneFile(Path.of("RECORDING.RUNE")));
        assertFalse(RuneFileDetector.isRuneFile(Path.of("recording.md")));
    }
}
