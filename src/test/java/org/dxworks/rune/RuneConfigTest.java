package org.dxworks.rune;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RuneConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        RuneConfig config = RuneConfig.load(tempDir.resolve("rune-config.yml"));
        assertEquals(80, config.getMaxLineLength());
        assertEquals(2, config.getRequirementSeparatorLines());
        assertTrue(config.isRequireTypeDescriptions());
        assertTrue(config.isReportUnusedSymbols());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void valuesAreReadFromYaml() throws IOException {
        Path file = tempDir.resolve("rune-config.yml");
        Files.writeString(file, "maxLineLength: 100\n"
                + "requirementSeparatorLines: 1\n"
                + "requireTypeDescriptions: false\n"
                + "reportUnusedSymbols: false\n"
                + "maxFileLines: 500\n");

        RuneConfig config = RuneConfig.load(file);
        assertEquals(100, config.getMaxLineLength());
        assertEquals(1, config.getRequirementSeparatorLines());
        assertFalse(config.isRequireTypeDescriptions());
        assertFalse(config.isReportUnusedSymbols());
        assertEquals(500, config.getMaxFileLines());
    }

    @Test
    void absentAndInvalidValuesFallBackToDefaults() throws IOException {
        Path file = tempDir.resolve("rune-config.yml");
        Files.writeString(file, "maxLineLength: 0\nrequirementSeparatorLines: -3\n");

        RuneConfig config = RuneConfig.load(file);
        assertEquals(80, config.getMaxLineLength());
        assertEquals(2, config.getRequirementSeparatorLines());
        assertTrue(config.isReportUnusedSymbols());
    }

    @Test
    void unreadableFileGivesDefaults() throws IOException {
        Path file = tempDir.resolve("rune-config.yml");
        Files.writeString(file, "maxLineLength: [not, a, number\n");

        RuneConfig config = RuneConfig.load(file);
        assertEquals(80, config.getMaxLineLength());
    }
}
