package org.dxworks.rune;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class RuneConfig {

    private static final String CONFIG_FILE_NAME = "rune-config.yml";
    private static final int DEFAULT_MAX_LINE_LENGTH = 80;
    private static final int DEFAULT_REQUIREMENT_SEPARATOR_LINES = 2;
    private static final boolean DEFAULT_REQUIRE_TYPE_DESCRIPTIONS = true;
    private static final boolean DEFAULT_REPORT_UNUSED_SYMBOLS = true;
    private static final int DEFAULT_MAX_FILE_LINES = 20000;

    private final int maxLineLength;
    private final int requirementSeparatorLines;
    private final boolean requireTypeDescriptions;
    private final boolean reportUnusedSymbols;
    private final int maxFileLines;

    private RuneConfig(int maxLineLength, int requirementSeparatorLines, boolean requireTypeDescriptions,
                       boolean reportUnusedSymbols, int maxFileLines) {
        this.maxLineLength = maxLineLength;
        this.requirementSeparatorLines = requirementSeparatorLines;
        this.requireTypeDescriptions = requireTypeDescriptions;
        this.reportUnusedSymbols = reportUnusedSymbols;
        this.maxFileLines = maxFileLines;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public int getRequirementSeparatorLines() {
        return requirementSeparatorLines;
    }

    public boolean isRequireTypeDescriptions() {
        return requireTypeDescriptions;
    }

    public boolean isReportUnusedSymbols() {
        return reportUnusedSymbols;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public static RuneConfig defaults() {
        return new RuneConfig(DEFAULT_MAX_LINE_LENGTH, DEFAULT_REQUIREMENT_SEPARATOR_LINES,
                DEFAULT_REQUIRE_TYPE_DESCRIPTIONS, DEFAULT_REPORT_UNUSED_SYMBOLS, DEFAULT_MAX_FILE_LINES);
    }

    public static RuneConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static RuneConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new RuneConfig(
                        positiveOr(yamlConfig.maxLineLength, DEFAULT_MAX_LINE_LENGTH),
                        yamlConfig.requirementSeparatorLines != null && yamlConfig.requirementSeparatorLines >= 0
                                ? yamlConfig.requirementSeparatorLines
                                : DEFAULT_REQUIREMENT_SEPARATOR_LINES,
                        yamlConfig.requireTypeDescriptions != null
                                ? yamlConfig.requireTypeDescriptions
                                : DEFAULT_REQUIRE_TYPE_DESCRIPTIONS,
                        yamlConfig.reportUnusedSymbols != null
                                ? yamlConfig.reportUnusedSymbols
                                : DEFAULT_REPORT_UNUSED_SYMBOLS,
                        positiveOr(yamlConfig.maxFileLines, DEFAULT_MAX_FILE_LINES));
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static RuneConfig with(int maxLineLength, int requirementSeparatorLines,
                                  boolean requireTypeDescriptions, boolean reportUnusedSymbols) {
        return new RuneConfig(
                maxLineLength > 0 ? maxLineLength : DEFAULT_MAX_LINE_LENGTH,
                Math.max(requirementSeparatorLines, 0),
                requireTypeDescriptions,
                reportUnusedSymbols,
                DEFAULT_MAX_FILE_LINES);
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static class YamlConfig {
        public Integer maxLineLength;
        public Integer requirementSeparatorLines;
        public Boolean requireTypeDescriptions;
        public Boolean reportUnusedSymbols;
        public Integer maxFileLines;
    }
}
