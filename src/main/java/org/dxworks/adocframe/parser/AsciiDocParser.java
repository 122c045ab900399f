package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.Admonition;
import org.dxworks.adocframe.model.AdmonitionType;
import org.dxworks.adocframe.model.BlockQuote;
import org.dxworks.adocframe.model.CodeBlock;
import org.dxworks.adocframe.model.CompoundBlock;
import org.dxworks.adocframe.model.DescriptionList;
import org.dxworks.adocframe.model.DescriptionListItem;
import org.dxworks.adocframe.model.Document;
import org.dxworks.adocframe.model.DocumentAttributes;
import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.DocumentHeader;
import org.dxworks.adocframe.model.Example;
import org.dxworks.adocframe.model.IncludeMacro;
import org.dxworks.adocframe.model.ListBlock;
import org.dxworks.adocframe.model.ListItem;
import org.dxworks.adocframe.model.ListType;
import org.dxworks.adocframe.model.Listing;
import org.dxworks.adocframe.model.Literal;
import org.dxworks.adocframe.model.Macro;
import org.dxworks.adocframe.model.MacroType;
import org.dxworks.adocframe.model.Open;
import org.dxworks.adocframe.model.Paragraph;
import org.dxworks.adocframe.model.Passthrough;
import org.dxworks.adocframe.model.Section;
import org.dxworks.adocframe.model.Sidebar;
import org.dxworks.adocframe.model.Table;
import org.dxworks.adocframe.model.TableCell;
import org.dxworks.adocframe.model.TableHeader;
import org.dxworks.adocframe.model.TableOfContents;
import org.dxworks.adocframe.model.TableRow;
import org.dxworks.adocframe.model.Text;
import org.dxworks.adocframe.model.Verse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser from AsciiDoc source to a {@link Document}.
 * <p>
 * Every parse routine consumes exactly the tokens of its construct and leaves the context
 * on the first token it did not consume. A parser holds no per-document state and may be
 * shared; each call to {@code parse} works on its own {@link ParseContext}.
 */
public class AsciiDocParser {

    private static final Logger LOGGER = Logger.getLogger(AsciiDocParser.class.getName());

    private static final Pattern SOURCE_STYLE = Pattern.compile("^source(?:,\\s*(\\w+))?", Pattern.CASE_INSENSITIVE);

    private static final Set<TokenType> TEXT_BLOCK_TERMINATORS = EnumSet.of(
            TokenType.EMPTY_LINE, TokenType.HEADER, TokenType.LIST_ITEM, TokenType.ATTRIBUTE_LINE,
            TokenType.ATTRIBUTE_BLOCK_LINE, TokenType.VERSE_ATTRIBUTE, TokenType.LITERAL_ATTRIBUTE,
            TokenType.LISTING_ATTRIBUTE, TokenType.PASSTHROUGH_ATTRIBUTE);

    public Document parse(String input) {
        return parse(input, ParserOptions.defaults());
    }

    public Document parse(String input, ParserOptions options) {
        if (input == null || input.isEmpty()) {
            throw new IllegalArgumentException("Input cannot be null or empty");
        }
        ParserOptions parserOptions = options == null ? ParserOptions.defaults() : options;
        return parseDocument(new ParseContext(new AsciiDocTokenizer(input), parserOptions, null));
    }

    public Document parseFile(Path file) throws IOException {
        return parseFile(file, ParserOptions.defaults());
    }

    /**
     * Parses a UTF-8 file, dropping a leading byte order mark. Includes resolve against the
     * file's directory and the file itself opens the include chain.
     */
    public Document parseFile(Path file, ParserOptions options) throws IOException {
        Path absolute = file.toAbsolutePath().normalize();
        String content = Files.readString(absolute, StandardCharsets.UTF_8);
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        if (content.isEmpty()) {
            throw new IllegalArgumentException("File is empty: " + file);
        }
        ParserOptions parserOptions = options == null ? ParserOptions.defaults() : options;
        if (parserOptions.getBasePath() == null) {
            parserOptions = parserOptions.basePath(absolute.getParent());
        }
        return parseDocument(new ParseContext(new AsciiDocTokenizer(content), parserOptions, absolute));
    }

    /**
     * Parses the first block of {@code input}, or returns null for null or empty input.
     */
    public DocumentElement parseElement(String input) {
        if (input == null || input.isEmpty()) {
            return null;
        }
        ParseContext context = new ParseContext(new AsciiDocTokenizer(input));
        skipBlankLines(context);
        return parseElement(context);
    }

    /**
     * Parses the block at the context's current token. Returns null for tokens that
     * produce no element (blank lines, attribute entries, tokens no block starts with);
     * those tokens are consumed.
     */
    public DocumentElement parseElement(ParseContext context) {
        Token token = context.getCurrentToken();
        return switch (token.getType()) {
            case HEADER -> parseSection(context);
            case LIST_ITEM -> parseList(context);
            case DESCRIPTION_LIST_ITEM -> parseDescriptionList(context);
            case TABLE_DELIMITER -> parseTable(context, false, null);
            case BLOCK_QUOTE_DELIMITER -> parseBlockQuote(context, "", "");
            case SIDEBAR_DELIMITER -> parseCompound(context, new Sidebar(), TokenType.SIDEBAR_DELIMITER);
            case EXAMPLE_DELIMITER -> parseCompound(context, new Example(), TokenType.EXAMPLE_DELIMITER);
            case OPEN_DELIMITER -> parseCompound(context, new Open(), TokenType.OPEN_DELIMITER);
            case VERSE_DELIMITER -> parseVerse(context, TokenType.VERSE_DELIMITER, null, null);
            case VERSE_ATTRIBUTE -> parseVerseAttribute(context);
            case LITERAL_DELIMITER -> parseLiteral(context);
            case LITERAL_ATTRIBUTE -> parseLiteralAttribute(context);
            case LISTING_ATTRIBUTE -> parseListingAttribute(context);
            case PASSTHROUGH_DELIMITER -> parsePassthrough(context);
            case PASSTHROUGH_ATTRIBUTE -> parsePassthroughAttribute(context);
            case CODE_BLOCK_DELIMITER -> parseCodeBlock(context, null);
            case ATTRIBUTE_LINE -> parseAttributeLine(context);
            case ATTRIBUTE_BLOCK_LINE -> parseAttributeBlockElement(context);
            case ADMONITION_BLOCK -> parseAdmonition(context);
            case TABLE_OF_CONTENTS -> parseTableOfContents(context);
            case BLOCK_MACRO -> parseBlockMacro(context);
            case TEXT -> parseParagraph(context);
            case NEW_LINE, EMPTY_LINE, TABLE_ROW, UNKNOWN -> skip(context);
            case END_OF_FILE -> null;
        };
    }

    /**
     * Parses blocks until the end of the context's input. Used for document bodies and for
     * the content of included files.
     */
    public List<DocumentElement> parseBlocks(ParseContext context) {
        List<DocumentElement> blocks = new ArrayList<>();
        while (!context.isAtEnd()) {
            DocumentElement block = parseNextBlock(context);
            if (block != null) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    private Document parseDocument(ParseContext context) {
        Document document = new Document();
        context.pushElement(document);

        skipBlankLines(context);
        String title = null;
        Token first = context.getCurrentToken();
        if (first.is(TokenType.HEADER)) {
            Matcher header = AsciiDocTokenizer.HEADER.matcher(first.getValue());
            if (header.matches() && header.group(1).length() == 1) {
                title = header.group(2).trim();
                context.advance();
            }
        }

        for (DocumentElement block : parseBlocks(context)) {
            document.addChild(block);
        }
        context.popElement();

        DocumentAttributes attributes = context.getGlobalAttributes();
        document.getAttributes().putAll(attributes);
        if (title == null) {
            title = attributes.getAttribute("doctitle");
        }
        DocumentHeader header = new DocumentHeader(title,
                attributes.getAttribute("author"),
                attributes.getAttribute("email"),
                attributes.getAttribute("revnumber"),
                attributes.getAttribute("revdate"));
        header.getAttributes().putAll(attributes);
        document.setHeader(header);

        new TableOfContentsBuilder().resolve(document);
        return document;
    }

    private DocumentElement parseNextBlock(ParseContext context) {
        Token before = context.getCurrentToken();
        DocumentElement element = parseElement(context);
        if (context.getCurrentToken() == before) {
            context.advance();
        }
        return element;
    }

    private DocumentElement skip(ParseContext context) {
        context.advance();
        return null;
    }

    private Section parseSection(ParseContext context) {
        Matcher match = matchOrFail(AsciiDocTokenizer.HEADER, context, "header");
        Section section = new Section(match.group(2).trim(), match.group(1).length());
        section.setId(AnchorIds.fromTitle(section.getTitle()));
        context.advance();
        return section;
    }

    private ListBlock parseList(ParseContext context) {
        Matcher first = matchOrFail(AsciiDocTokenizer.LIST_ITEM, context, "list item");
        String marker = first.group(1);
        ListBlock list = marker.endsWith(".")
                ? new ListBlock(ListType.ORDERED, startNumber(marker))
                : new ListBlock(ListType.UNORDERED);

        while (context.getCurrentToken().is(TokenType.LIST_ITEM)) {
            list.addChild(parseListItem(context));
            skipBlankLines(context);
        }
        return list;
    }

    private ListItem parseListItem(ParseContext context) {
        Matcher match = matchOrFail(AsciiDocTokenizer.LIST_ITEM, context, "list item");
        String marker = match.group(1);
        String checkbox = match.group(2);
        String text = match.group(3).trim();
        int level = marker.startsWith("*") ? marker.length() : 1;
        context.advance();

        if (checkbox == null || checkbox.isEmpty()) {
            return new ListItem(text, level);
        }
        String state = checkbox.trim();
        state = state.substring(1, state.length() - 1).trim();
        return new ListItem(text, level, true, state.equalsIgnoreCase("x"));
    }

    private static int startNumber(String marker) {
        try {
            return Integer.parseInt(marker.substring(0, marker.length() - 1));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private DescriptionList parseDescriptionList(ParseContext context) {
        DescriptionList list = new DescriptionList();
        while (context.getCurrentToken().is(TokenType.DESCRIPTION_LIST_ITEM)) {
            Matcher match = matchOrFail(AsciiDocTokenizer.DESCRIPTION_LIST_ITEM, context, "description list item");
            list.addChild(new DescriptionListItem(match.group(1).trim(), match.group(2).trim()));
            context.advance();
            skipBlankLines(context);
        }
        return list;
    }

    private Table parseTable(ParseContext context, boolean headerRow, String title) {
        context.advance();
        Table table = new Table();
        table.setTitle(title);
        boolean expectHeader = headerRow;

        while (!context.isAtEnd() && !context.getCurrentToken().is(TokenType.TABLE_DELIMITER)) {
            Token token = context.getCurrentToken();
            if (token.is(TokenType.TABLE_ROW)) {
                List<String> cells = splitRow(token.getValue());
                if (expectHeader) {
                    TableHeader header = new TableHeader();
                    cells.forEach(cell -> header.addCell(new TableCell(cell, true)));
                    table.setHeader(header);
                    expectHeader = false;
                } else {
                    TableRow row = new TableRow();
                    cells.forEach(cell -> row.addCell(new TableCell(cell)));
                    table.addRow(row);
                }
            }
            context.advance();
        }
        context.accept(TokenType.TABLE_DELIMITER);
        return table;
    }

    static List<String> splitRow(String row) {
        String content = row.startsWith("|") ? row.substring(1) : row;
        List<String> cells = new ArrayList<>();
        for (String cell : content.split("\\|", -1)) {
            String trimmed = cell.trim();
            if (!trimmed.isEmpty()) {
                cells.add(trimmed);
            }
        }
        return cells;
    }

    private BlockQuote parseBlockQuote(ParseContext context, String defaultAttribution, String cite) {
        String attribution = defaultAttribution;
        List<String> lines = new ArrayList<>();
        for (String line : readRawBlock(context, TokenType.BLOCK_QUOTE_DELIMITER).split("\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.startsWith("-- ")) {
                attribution = trimmed.substring(3).trim();
            } else {
                lines.add(line);
            }
        }
        return new BlockQuote(String.join("\n", lines).trim(), attribution, cite);
    }

    private <T extends CompoundBlock> T parseCompound(ParseContext context, T block, TokenType closing) {
        context.advance();
        context.pushElement(block);
        try {
            while (!context.isAtEnd() && !context.getCurrentToken().is(closing)) {
                DocumentElement child = parseNextBlock(context);
                if (child != null) {
                    block.addChild(child);
                }
            }
        } finally {
            context.popElement();
        }
        context.accept(closing);
        return block;
    }

    private Verse parseVerse(ParseContext context, TokenType closing, String author, String citation) {
        String content = readRawBlock(context, closing);
        return new Verse(content, null, author, citation);
    }

    private Verse parseVerseAttribute(ParseContext context) {
        Matcher match = matchOrFail(AsciiDocTokenizer.VERSE_ATTRIBUTE, context, "verse attribute");
        String author = match.group(1) == null ? null : match.group(1).trim();
        String citation = match.group(2) == null ? null : match.group(2).trim();
        context.advance();
        skipBlankLines(context);

        if (context.getCurrentToken().is(TokenType.BLOCK_QUOTE_DELIMITER)) {
            return parseVerse(context, TokenType.BLOCK_QUOTE_DELIMITER, author, citation);
        }
        return new Verse("", null, author, citation);
    }

    private Literal parseLiteral(ParseContext context) {
        return new Literal(trimNewlines(readRawBlock(context, TokenType.LITERAL_DELIMITER)));
    }

    private Literal parseLiteralAttribute(ParseContext context) {
        context.advance();
        skipBlankLines(context);
        Token token = context.getCurrentToken();
        if (token.is(TokenType.LITERAL_DELIMITER)) {
            return parseLiteral(context);
        }
        if (token.is(TokenType.TEXT)) {
            return new Literal(trimNewlines(readTextBlock(context)));
        }
        return new Literal("");
    }

    private Listing parseListingAttribute(ParseContext context) {
        context.advance();
        skipBlankLines(context);
        Token token = context.getCurrentToken();
        if (token.is(TokenType.CODE_BLOCK_DELIMITER)) {
            String language = delimiterLanguage(token);
            return new Listing(trimNewlines(readRawBlock(context, TokenType.CODE_BLOCK_DELIMITER)), null, language);
        }
        if (token.is(TokenType.TEXT)) {
            return new Listing(trimNewlines(readTextBlock(context)));
        }
        return new Listing("");
    }

    private Passthrough parsePassthrough(ParseContext context) {
        return new Passthrough(readRawBlock(context, TokenType.PASSTHROUGH_DELIMITER));
    }

    private Passthrough parsePassthroughAttribute(ParseContext context) {
        context.advance();
        skipBlankLines(context);
        Token token = context.getCurrentToken();
        if (token.is(TokenType.PASSTHROUGH_DELIMITER)) {
            return parsePassthrough(context);
        }
        if (token.is(TokenType.TEXT)) {
            return new Passthrough(readTextBlock(context));
        }
        return new Passthrough("");
    }

    private CodeBlock parseCodeBlock(ParseContext context, String language) {
        String blockLanguage = language != null ? language : delimiterLanguage(context.getCurrentToken());
        return new CodeBlock(trimNewlines(readRawBlock(context, TokenType.CODE_BLOCK_DELIMITER)), blockLanguage);
    }

    private static String delimiterLanguage(Token delimiter) {
        Matcher match = AsciiDocTokenizer.CODE_BLOCK_DELIMITER.matcher(delimiter.getValue());
        return match.matches() ? match.group(1) : null;
    }

    /**
     * Reads the lines between the current opening delimiter and the next token of type
     * {@code closing}, or the end of input. Lines keep their indentation and interior
     * blank lines are kept; the line breaks right after the opener and right before the
     * closer are not part of the content.
     */
    private String readRawBlock(ParseContext context, TokenType closing) {
        context.advance();
        context.accept(TokenType.NEW_LINE);

        StringBuilder content = new StringBuilder();
        while (!context.isAtEnd() && !context.getCurrentToken().is(closing)) {
            appendToken(content, context.getCurrentToken());
            context.advance();
        }
        context.accept(closing);

        if (content.length() > 0 && content.charAt(content.length() - 1) == '\n') {
            content.setLength(content.length() - 1);
        }
        return content.toString();
    }

    /**
     * Reads undelimited lines up to a blank line, the end of input or a token that starts
     * another block.
     */
    private String readTextBlock(ParseContext context) {
        StringBuilder content = new StringBuilder();
        boolean lineEnded = false;
        while (!context.isAtEnd() && !TEXT_BLOCK_TERMINATORS.contains(context.getCurrentToken().getType())) {
            Token token = context.getCurrentToken();
            if (token.is(TokenType.NEW_LINE)) {
                if (lineEnded) {
                    break;
                }
                lineEnded = true;
            } else {
                lineEnded = false;
            }
            appendToken(content, token);
            context.advance();
        }
        return content.toString();
    }

    private static void appendToken(StringBuilder content, Token token) {
        if (token.is(TokenType.NEW_LINE)) {
            content.append('\n');
        } else {
            content.append(" ".repeat(Math.max(0, token.getColumn() - 1))).append(token.getValue());
        }
    }

    private static String trimNewlines(String content) {
        int start = 0;
        int end = content.length();
        while (start < end && isLineBreak(content.charAt(start))) {
            start++;
        }
        while (end > start && isLineBreak(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(start, end);
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    private DocumentElement parseAttributeLine(ParseContext context) {
        Matcher match = AsciiDocTokenizer.ATTRIBUTE_LINE.matcher(context.getCurrentToken().getValue());
        if (match.matches()) {
            String name = match.group(1).trim();
            String value = match.group(3).trim();
            if (!match.group(2).isEmpty()) {
                value = "false";
            } else if (value.isEmpty()) {
                value = "true";
            }
            context.getGlobalAttributes().setAttribute(name, value);
        }
        context.advance();
        return null;
    }

    /**
     * A {@code [...]} line applies to the block that follows it. The style decides how
     * that block is read: {@code [source,lang]} before {@code ----}, a style before
     * {@code --}, an admonition label before {@code ====} or a paragraph, {@code [quote]}
     * before {@code ____}, {@code %header} before a table. With nothing after it the line
     * is kept as paragraph text.
     */
    private DocumentElement parseAttributeBlockElement(ParseContext context) {
        Matcher match = matchOrFail(AsciiDocTokenizer.ATTRIBUTE_BLOCK, context, "attribute block");
        String raw = match.group(1);
        BlockAttributes attributes = BlockAttributes.parse(raw);
        context.advance();
        skipBlankLines(context);

        Token next = context.getCurrentToken();
        String style = attributes.getStyle();
        DocumentElement element;
        if (next.is(TokenType.END_OF_FILE)) {
            Paragraph paragraph = new Paragraph();
            paragraph.addChild(new Text(raw));
            return paragraph;
        } else if (next.is(TokenType.CODE_BLOCK_DELIMITER) && SOURCE_STYLE.matcher(raw).find()) {
            Matcher source = SOURCE_STYLE.matcher(raw);
            String language = source.find() ? source.group(1) : null;
            element = parseCodeBlock(context, language);
        } else if (next.is(TokenType.OPEN_DELIMITER) && style != null && !style.isEmpty()) {
            element = parseCompound(context, new Open(attributes.getTitle(), style), TokenType.OPEN_DELIMITER);
        } else if (next.is(TokenType.TABLE_DELIMITER)) {
            element = parseTable(context, attributes.hasOption("header"), attributes.getTitle());
        } else if (next.is(TokenType.BLOCK_QUOTE_DELIMITER) && attributes.hasStyle("quote")) {
            element = parseBlockQuote(context, attributes.get("2", ""), attributes.get("3", ""));
        } else if (next.is(TokenType.SIDEBAR_DELIMITER)) {
            element = parseCompound(context, new Sidebar(attributes.getTitle()), TokenType.SIDEBAR_DELIMITER);
        } else if (next.is(TokenType.EXAMPLE_DELIMITER)) {
            element = AdmonitionType.fromLabel(style)
                    .<DocumentElement>map(type -> parseAdmonitionBlock(context, type, attributes.getTitle()))
                    .orElseGet(() -> parseCompound(context, new Example(attributes.getTitle()), TokenType.EXAMPLE_DELIMITER));
        } else if (next.is(TokenType.TEXT)) {
            element = AdmonitionType.fromLabel(style)
                    .<DocumentElement>map(type -> admonitionParagraph(context, type, attributes.getTitle()))
                    .orElseGet(() -> parseParagraph(context));
        } else {
            element = parseElement(context);
        }

        if (element != null) {
            attributes.copyTo(element.getAttributes());
            if (element instanceof Section section && attributes.getId() != null) {
                section.setId(attributes.getId());
            }
        }
        return element;
    }

    private Admonition parseAdmonitionBlock(ParseContext context, AdmonitionType type, String title) {
        Example body = parseCompound(context, new Example(), TokenType.EXAMPLE_DELIMITER);
        List<String> paragraphs = new ArrayList<>();
        for (DocumentElement child : body.getChildren()) {
            if (child instanceof Paragraph paragraph) {
                paragraphs.add(paragraph.getText());
            }
        }
        return new Admonition(type, String.join("\n", paragraphs), title);
    }

    private Admonition admonitionParagraph(ParseContext context, AdmonitionType type, String title) {
        String text = context.getCurrentToken().getValue().trim();
        context.advance();
        return new Admonition(type, text, title);
    }

    private Admonition parseAdmonition(ParseContext context) {
        Matcher match = matchOrFail(AsciiDocTokenizer.ADMONITION, context, "admonition");
        Token token = context.getCurrentToken();
        AdmonitionType type = AdmonitionType.fromLabel(match.group(1))
                .orElseThrow(() -> ParseException.at(token, "Unknown admonition type: " + match.group(1)));
        context.advance();
        return new Admonition(type, match.group(2).trim());
    }

    private TableOfContents parseTableOfContents(ParseContext context) {
        Matcher match = matchOrFail(AsciiDocTokenizer.TABLE_OF_CONTENTS, context, "table of contents");
        Map<String, String> parameters = MacroParameters.parse(match.group(1).trim());
        String title = parameters.getOrDefault("title", TableOfContents.DEFAULT_TITLE);
        int maxDepth;
        try {
            maxDepth = Integer.parseInt(parameters.getOrDefault("levels", String.valueOf(TableOfContents.DEFAULT_MAX_DEPTH)).trim());
        } catch (NumberFormatException e) {
            maxDepth = TableOfContents.DEFAULT_MAX_DEPTH;
        }
        context.advance();
        return new TableOfContents(title, maxDepth);
    }

    private DocumentElement parseBlockMacro(ParseContext context) {
        Matcher match = matchOrFail(AsciiDocTokenizer.BLOCK_MACRO, context, "block macro");
        String name = match.group(1).trim();
        String target = match.group(2).trim();
        Map<String, String> parameters = MacroParameters.parse(match.group(3).trim());
        context.advance();
        return createMacroElement(name, target, parameters, MacroType.BLOCK, context);
    }

    DocumentElement createMacroElement(String name, String target, Map<String, String> parameters,
                                       MacroType macroType, ParseContext context) {
        Macro macro = Macros.create(name, target, parameters, macroType);
        if (macro instanceof IncludeMacro include && context != null) {
            return expandInclude(include, context);
        }
        return macro;
    }

    private DocumentElement expandInclude(IncludeMacro include, ParseContext context) {
        IncludeProcessor processor = new IncludeProcessor(this, context);
        IncludeResult result = processor.resolve(include, includeBase(context), context.getIncludeStack());

        if (result.isFailed()) {
            LOGGER.log(Level.WARNING, "Keeping include directive for {0}: {1}",
                    new Object[]{include.getFilePath(), result.getMessage()});
            return include;
        }

        List<DocumentElement> elements = result.getElements();
        if (elements.isEmpty()) {
            LOGGER.fine(() -> "Include of " + include.getFilePath() + " produced no content");
            return include;
        }
        if (elements.size() == 1) {
            return elements.get(0);
        }
        Section container = Section.container();
        elements.forEach(container::addChild);
        return container;
    }

    private static Path includeBase(ParseContext context) {
        return context.getCurrentFilePath() != null
                ? context.getCurrentFilePath()
                : context.getOptions().getBasePath();
    }

    private Paragraph parseParagraph(ParseContext context) {
        String text = context.getCurrentToken().getValue().trim();
        Paragraph paragraph = new Paragraph();
        for (DocumentElement inline : new InlineParser(context.getFootnotes()).parse(text)) {
            paragraph.addChild(inline);
        }
        context.advance();
        return paragraph;
    }

    private static void skipBlankLines(ParseContext context) {
        while (context.getCurrentToken().isBlank()) {
            context.advance();
        }
    }

    private static Matcher matchOrFail(Pattern pattern, ParseContext context, String construct) {
        Token token = context.getCurrentToken();
        Matcher match = pattern.matcher(token.getValue());
        if (!match.matches()) {
            throw ParseException.at(token, "Invalid " + construct + " format: " + token.getValue());
        }
        return match;
    }
}
