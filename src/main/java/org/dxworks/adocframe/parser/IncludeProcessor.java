package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.IncludeMacro;
import org.dxworks.adocframe.model.Section;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Expands {@code include::path[...]} directives.
 * <p>
 * The included file is read as UTF-8, narrowed by {@code lines} and then {@code tags},
 * indented by {@code indent}, parsed in a child context that shares the including
 * document's attributes and footnotes, and finally shifted by {@code leveloffset}.
 * Including a file that is already in the include chain is always an error, even for an
 * optional include.
 */
public class IncludeProcessor {

    private static final Logger LOGGER = Logger.getLogger(IncludeProcessor.class.getName());

    private static final Pattern TAG_START = Pattern.compile("^//\\s*tag::([^\\[]+)\\[\\]$");
    private static final Pattern TAG_END = Pattern.compile("^//\\s*end::([^\\[]+)\\[\\]$");

    private final AsciiDocParser parser;
    private final ParseContext parent;

    public IncludeProcessor(AsciiDocParser parser) {
        this(parser, new ParseContext(new AsciiDocTokenizer("")));
    }

    public IncludeProcessor(AsciiDocParser parser, ParseContext parent) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    /**
     * Returns the blocks of the included file; empty when an optional file is missing.
     *
     * @throws ParseException when a required file is missing or unreadable, when the
     *                        include is circular, or when the include depth limit is exceeded
     */
    public List<DocumentElement> processInclude(IncludeMacro macro, Path basePath, List<Path> includeStack) {
        IncludeResult result = resolve(macro, basePath, includeStack);
        if (result.isFailed()) {
            throw new ParseException(result.getMessage(), 0, 0);
        }
        return result.getElements();
    }

    /**
     * Like {@link #processInclude}, but a missing or unreadable required file is reported
     * as a failed result. Circular includes and the depth limit still throw.
     */
    public IncludeResult resolve(IncludeMacro macro, Path basePath, List<Path> includeStack) {
        Objects.requireNonNull(macro, "macro");
        List<Path> stack = includeStack == null ? List.of() : includeStack;
        Path resolved = resolveIncludePath(macro.getFilePath(), basePath);

        if (wouldCreateCircularReference(resolved, stack)) {
            String chain = stack.stream().map(IncludeProcessor::fileName).collect(Collectors.joining(" -> "));
            String file = fileName(resolved);
            throw new ParseException("Circular include detected: " + chain + " -> " + file
                    + ". File '" + file + "' is already being processed in the include chain.", 0, 0);
        }

        int depth = parent.getIncludeDepth() + 1;
        int maxDepth = parent.getOptions().getMaxIncludeDepth();
        if (depth > maxDepth) {
            throw new ParseException("Maximum include depth of " + maxDepth + " exceeded while including " + resolved, 0, 0);
        }

        if (!Files.isRegularFile(resolved)) {
            if (macro.isOptional()) {
                LOGGER.fine(() -> "Skipping missing optional include " + resolved);
                return IncludeResult.resolved(List.of());
            }
            return IncludeResult.failed("Include file not found: " + resolved);
        }

        String content;
        try {
            content = Files.readString(resolved, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Could not read include " + resolved, e);
            if (macro.isOptional()) {
                return IncludeResult.resolved(List.of());
            }
            return IncludeResult.failed("Error reading include file '" + resolved + "': " + e.getMessage());
        }

        content = filterLines(content, macro.getLines());
        content = filterTags(content, macro.getTags());
        content = indent(content, macro.getIndent());

        List<Path> childStack = new ArrayList<>(stack);
        childStack.add(resolved);
        LOGGER.fine(() -> "Including " + resolved + " at depth " + depth);
        List<DocumentElement> elements = parseIncludedContent(content, resolved, childStack);
        return IncludeResult.resolved(applyLevelOffset(elements, macro.getLevelOffset()));
    }

    /**
     * Resolves {@code filePath} against {@code basePath}, which may be a directory or a
     * file whose directory is used. A null base means the working directory.
     */
    public Path resolveIncludePath(String filePath, Path basePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path cannot be null or empty");
        }
        Path path = Path.of(filePath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        Path base = basePath == null ? Path.of("").toAbsolutePath() : basePath.toAbsolutePath();
        if (Files.isRegularFile(base)) {
            base = base.getParent();
        }
        return base.resolve(path).normalize();
    }

    /**
     * Paths are compared after normalisation and ignoring case.
     */
    public boolean wouldCreateCircularReference(Path file, List<Path> includeStack) {
        if (file == null || includeStack == null) {
            return false;
        }
        String normalized = ParseContext.normalize(file).toString();
        return includeStack.stream()
                .map(path -> ParseContext.normalize(path).toString())
                .anyMatch(normalized::equalsIgnoreCase);
    }

    private List<DocumentElement> parseIncludedContent(String content, Path file, List<Path> includeStack) {
        if (content.isEmpty()) {
            return List.of();
        }
        ParseContext child = parent.forInclude(new AsciiDocTokenizer(content), file, includeStack);
        return parser.parseBlocks(child);
    }

    /**
     * Keeps the lines named by a selection such as {@code 1..3,7} or {@code 5..-1}; ranges are
     * separated by commas or semicolons and {@code -1} or an empty end means the last line.
     */
    static String filterLines(String content, String ranges) {
        if (ranges == null || ranges.isBlank()) {
            return content;
        }
        List<String> lines = content.lines().collect(Collectors.toList());
        List<String> selected = new ArrayList<>();
        for (String range : ranges.split("[,;]")) {
            String trimmed = range.trim();
            if (trimmed.contains("..")) {
                String[] bounds = trimmed.split("\\.\\.", -1);
                int start = lineNumber(bounds[0], lines.size());
                int end = bounds[1].isBlank() ? lines.size() : lineNumber(bounds[1], lines.size());
                if (start > 0 && end > 0 && start <= end) {
                    for (int i = start - 1; i < end && i < lines.size(); i++) {
                        selected.add(lines.get(i));
                    }
                }
            } else {
                int line = lineNumber(trimmed, lines.size());
                if (line > 0 && line <= lines.size()) {
                    selected.add(lines.get(line - 1));
                }
            }
        }
        return String.join("\n", selected);
    }

    private static int lineNumber(String value, int totalLines) {
        String trimmed = value.trim();
        if (trimmed.equals("-1")) {
            return totalLines;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Keeps the lines inside {@code // tag::name[]} ... {@code // end::name[]} regions for
     * any of the comma separated tag names. The marker lines are dropped.
     */
    static String filterTags(String content, String tags) {
        if (tags == null || tags.isBlank()) {
            return content;
        }
        Set<String> wanted = Arrays.stream(tags.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .collect(Collectors.toSet());
        Set<String> open = new HashSet<>();
        List<String> selected = new ArrayList<>();

        for (String line : content.lines().collect(Collectors.toList())) {
            String trimmed = line.trim();
            Matcher start = TAG_START.matcher(trimmed);
            if (start.matches()) {
                open.add(start.group(1).trim());
                continue;
            }
            Matcher end = TAG_END.matcher(trimmed);
            if (end.matches()) {
                open.remove(end.group(1).trim());
                continue;
            }
            if (open.stream().anyMatch(wanted::contains)) {
                selected.add(line);
            }
        }
        return String.join("\n", selected);
    }

    static String indent(String content, String indentWidth) {
        if (indentWidth == null || indentWidth.isBlank()) {
            return content;
        }
        int width;
        try {
            width = Integer.parseInt(indentWidth.trim());
        } catch (NumberFormatException e) {
            return content;
        }
        if (width <= 0) {
            return content;
        }
        String padding = " ".repeat(width);
        return content.lines()
                .map(line -> line.isBlank() ? line : padding + line)
                .collect(Collectors.joining("\n"));
    }

    private static List<DocumentElement> applyLevelOffset(List<DocumentElement> elements, String levelOffset) {
        if (levelOffset == null || levelOffset.isBlank()) {
            return elements;
        }
        int offset;
        try {
            offset = Integer.parseInt(levelOffset.trim());
        } catch (NumberFormatException e) {
            return elements;
        }
        List<DocumentElement> shifted = new ArrayList<>();
        for (DocumentElement element : elements) {
            shifted.add(shift(element, offset));
        }
        return shifted;
    }

    private static DocumentElement shift(DocumentElement element, int offset) {
        if (!(element instanceof Section section)) {
            return element;
        }
        Section target = section.isContainer()
                ? Section.container()
                : new Section(section.getTitle(), Math.max(1, section.getLevel() + offset));
        target.setId(section.getId());
        target.getAttributes().putAll(section.getAttributes());
        for (DocumentElement child : new ArrayList<>(section.getChildren())) {
            target.addChild(shift(child, offset));
        }
        return target;
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
