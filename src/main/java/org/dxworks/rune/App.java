package org.dxworks.rune;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.rune.analyzer.DocumentAnalyzer;
import org.dxworks.rune.model.RuneFileAnalysis;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar rune-analyzer.jar <input> <output-file>");
            System.err.println("  <input>:       Path to a .rune file or a directory containing them");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting rune analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        RuneConfig config = RuneConfig.load();
        DocumentAnalyzer analyzer = new DocumentAnalyzer(config);
        List<Path> files = collectRuneFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " rune files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger failureCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);
        AtomicLong diagnosticErrors = new AtomicLong(0);
        AtomicLong diagnosticWarnings = new AtomicLong(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // documents are independent, so they are analysed in parallel
            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing " + file.getFileName());
                }

                if (writeFileRecord(file, analyzer, writer, diagnosticErrors, diagnosticWarnings)) {
                    successCount.incrementAndGet();
                } else {
                    failureCount.incrementAndGet();
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", failureCount.get());
            doneInfo.put("diagnostic_errors", diagnosticErrors.get());
            doneInfo.put("diagnostic_warnings", diagnosticWarnings.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " files");
        if (failureCount.get() > 0) {
            System.out.println("Failed files: " + failureCount.get());
        }
        System.out.println("Diagnostics: " + diagnosticErrors.get() + " errors, "
                + diagnosticWarnings.get() + " warnings");
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));

        if (diagnosticErrors.get() > 0 || failureCount.get() > 0) {
            System.exit(1);
        }
    }

    /**
     * Analyzes one file and appends its record to {@code writer}. Any failure becomes an
     * {@code error} record so the remaining files are still analyzed.
     *
     * @return true when the file was analyzed
     */
    static boolean writeFileRecord(Path file, DocumentAnalyzer analyzer, BufferedWriter writer,
                                   AtomicLong diagnosticErrors, AtomicLong diagnosticWarnings) {
        try {
            RuneFileAnalysis analysis = analyzeFile(file, analyzer);
            diagnosticErrors.addAndGet(analysis.errors);
            diagnosticWarnings.addAndGet(analysis.warnings);

            synchronized (writer) {
                writer.write(MAPPER.writeValueAsString(analysis));
                writer.newLine();
                writer.flush();
            }
            return true;
        } catch (Exception e) {
            Map<String, String> error = new LinkedHashMap<>();
            error.put("kind", "error");
            error.put("file", file.toString());
            error.put("error", String.valueOf(e.getMessage()));

            try {
                synchronized (writer) {
                    writer.write(MAPPER.writeValueAsString(error));
                    writer.newLine();
                    writer.flush();
                }
            } catch (IOException ioException) {
                System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
            }

            synchronized (System.err) {
                System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
            }
            return false;
        }
    }

    static List<Path> collectRuneFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(RuneFileDetector::isRuneFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (RuneFileDetector.isRuneFile(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable files are kept so that the read failure is reported per file
            return true;
        }
    }

    public static RuneFileAnalysis analyzeFile(Path filePath) throws IOException {
        return analyzeFile(filePath, new DocumentAnalyzer(RuneConfig.load()));
    }

    public static RuneFileAnalysis analyzeFile(Path filePath, DocumentAnalyzer analyzer) throws IOException {
        String source = Files.readString(filePath, StandardCharsets.UTF_8);
        return new RuneFileAnalysis(filePath.toString(), analyzer.analyze(source));
    }
}
