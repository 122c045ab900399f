package org.dxworks.adocframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.adocframe.analyzer.OutlineAnalyzer;
import org.dxworks.adocframe.converter.ConverterOptions;
import org.dxworks.adocframe.converter.HtmlDocumentConverter;
import org.dxworks.adocframe.model.Document;
import org.dxworks.adocframe.model.outline.DocumentOutline;
import org.dxworks.adocframe.parser.AsciiDocParser;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final AsciiDocParser PARSER = new AsciiDocParser();
    private static final OutlineAnalyzer ANALYZER = new OutlineAnalyzer();
    private static final HtmlDocumentConverter CONVERTER = new HtmlDocumentConverter();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar adocframe.jar <input> <output-file> [html-dir]");
            System.err.println("  <input>:       Path to an AsciiDoc file or a directory of them");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.err.println("  [html-dir]:    Optional directory for rendered HTML");
            System.err.println("Recognised extensions: .adoc, .asciidoc, .asc, .ad");
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
        Path htmlDir = args.length > 2 ? Paths.get(args[2]) : null;
        if (htmlDir != null) {
            Files.createDirectories(htmlDir);
        }

        System.out.println("Starting AsciiDoc analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        AdocframeConfig config = AdocframeConfig.load();
        List<Path> files = collectAsciiDocFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " AsciiDoc files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Parsing " + file.getFileName());
                }

                try {
                    Document document = PARSER.parseFile(file, config.toParserOptions());
                    DocumentOutline outline = ANALYZER.analyze(file.toString(), document);
                    if (htmlDir != null) {
                        writeHtml(document, htmlTarget(input, file, htmlDir), config);
                    }

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(outline));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error parsing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        if (htmlDir != null) {
            System.out.println("HTML written to: " + htmlDir.toAbsolutePath());
        }
        System.out.println("=".repeat(60));
    }

    static List<Path> collectAsciiDocFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(AsciiDocFiles::isAsciiDoc)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (AsciiDocFiles.isAsciiDoc(input) && withinMaxLines(input, maxFileLines)) {
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
            // unreadable files are reported by the parse step
            return true;
        }
    }

    /**
     * Mirrors the file's position under the input directory, so equally named documents in
     * different folders do not overwrite each other.
     */
    static Path htmlTarget(Path input, Path file, Path htmlDir) {
        Path relative = Files.isDirectory(input) ? input.relativize(file) : file.getFileName();
        return htmlDir.resolve(relative).resolveSibling(AsciiDocFiles.htmlFileName(file));
    }

    private static void writeHtml(Document document, Path target, AdocframeConfig config) throws IOException {
        ConverterOptions options = ConverterOptions.defaults().prettyPrint(config.isPrettyPrintHtml());
        String html = CONVERTER.convert(document, options);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, html, Charset.forName(options.getOutputEncoding()));
    }

    public static DocumentOutline analyzeFile(Path filePath) throws IOException {
        return analyzeFile(filePath, AdocframeConfig.load());
    }

    public static DocumentOutline analyzeFile(Path filePath, AdocframeConfig config) throws IOException {
        Document document = PARSER.parseFile(filePath, config.toParserOptions());
        return ANALYZER.analyze(filePath.toString(), document);
    }
}
