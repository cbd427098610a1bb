package org.dxworks.rune.analyzer;

import org.dxworks.rune.model.DocumentAnalysis;
import org.dxworks.rune.model.ScopeBinding;
import org.dxworks.rune.model.SourcePosition;
import org.dxworks.rune.model.SourceSpan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.dxworks.rune.TestUtils.analyze;
import static org.junit.jupiter.api.Assertions.*;

class DocumentNavigatorTest {

    private DocumentNavigator navigator;

    @BeforeEach
    void setUp() {
        DocumentAnalysis analysis = analyze(
                "[TYP] id: string",
                "    recording identifier",
                "[DTO] RecordingDto: id",
                "    recording as returned to clients",
                "",
                "",
                "[REQ] recording.get({id}): RecordingDto",
                "    recording::load(id): RecordingDto",
                "      not-found",
                "    [RET] RecordingDto");
        assertEquals(List.of(), analysis.diagnostics);
        navigator = new DocumentNavigator(analysis);
    }

    private static SourcePosition at(int line, int column) {
        return new SourcePosition(line, column);
    }

    private static List<String> names(List<ScopeBinding> bindings) {
        return bindings.stream().map(b -> b.name).collect(Collectors.toList());
    }

    @Test
    void describeReference() {
        assertEquals(Optional.of("recording as returned to clients"), navigator.describe(at(7, 26)));
        assertEquals(Optional.of("recording identifier"), navigator.describe(at(7, 21)));
    }

    @Test
    void describeInsideDefinition() {
        assertEquals(Optional.of("recording identifier"), navigator.describe(at(1, 6)));
        assertEquals(Optional.empty(), navigator.describe(at(6, 8)));
    }

    @Test
    void resolveDefinition() {
        assertEquals(Optional.of(SourceSpan.onLine(2, 6, 18)), navigator.resolveDefinition(at(7, 26)));
        assertEquals(Optional.of(SourceSpan.onLine(0, 6, 8)), navigator.resolveDefinition(at(0, 7)));
        assertEquals(Optional.empty(), navigator.resolveDefinition(at(6, 1)));
    }

    @Test
    void findReferences() {
        assertEquals(List.of(SourceSpan.onLine(2, 20, 22), SourceSpan.onLine(6, 21, 23), SourceSpan.onLine(7, 20, 22)),
                navigator.findReferences("id"));
        assertEquals(List.of(SourceSpan.onLine(6, 27, 39), SourceSpan.onLine(7, 25, 37), SourceSpan.onLine(9, 10, 22)),
                navigator.findReferences("RecordingDto"));
        assertTrue(navigator.findReferences("missing").isEmpty());
    }

    @Test
    void scopeAt() {
        assertEquals(List.of("id"), names(navigator.scopeAt(at(6, 0))));
        assertEquals(List.of("id"), names(navigator.scopeAt(at(7, 4))));
        assertEquals(List.of("RecordingDto", "id"), names(navigator.scopeAt(at(9, 4))));
        assertTrue(navigator.scopeAt(at(1, 0)).isEmpty());
    }
}
