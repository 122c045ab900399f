package org.dxworks.adocframe.parser;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits AsciiDoc source into line-classified tokens.
 * <p>
 * A line that starts at column 1 is trimmed and tested against {@link #RULES} top to
 * bottom; the first matching rule decides its type. The patterns overlap, so the order of
 * the list is part of the grammar. An indented line is returned as TEXT with its
 * indentation recorded in the token column. Tokens are produced lazily, one per call.
 */
public class AsciiDocTokenizer {

    static final Pattern HEADER = Pattern.compile("^(=+)\\s+(.+)$");
    static final Pattern LIST_ITEM = Pattern.compile("^(\\*+|\\d+\\.)\\s+(\\[[ xX]\\]\\s+)?(.+)$");
    static final Pattern TABLE_DELIMITER = Pattern.compile("^\\|===+$");
    static final Pattern TABLE_ROW = Pattern.compile("^\\|(.*)$");
    static final Pattern BLOCK_QUOTE_DELIMITER = Pattern.compile("^_{4,}$");
    static final Pattern SIDEBAR_DELIMITER = Pattern.compile("^\\*{4,}$");
    static final Pattern EXAMPLE_DELIMITER = Pattern.compile("^={4,}$");
    static final Pattern ATTRIBUTE_LINE = Pattern.compile("^:([^:!]+)(!?):\\s*(.*)$");
    static final Pattern ATTRIBUTE_BLOCK = Pattern.compile("^\\[([^\\]]+)\\]$");
    static final Pattern CODE_BLOCK_DELIMITER = Pattern.compile("^----(\\w+)?$");
    static final Pattern ADMONITION = Pattern.compile("^(NOTE|TIP|IMPORTANT|WARNING|CAUTION):\\s*(.*)$");
    static final Pattern TABLE_OF_CONTENTS = Pattern.compile("^toc::\\s*\\[([^\\]]*)\\]$");
    static final Pattern BLOCK_MACRO = Pattern.compile("^(\\w+)::([^\\[]*)\\[([^\\]]*)\\]$");
    static final Pattern OPEN_DELIMITER = Pattern.compile("^--$");
    static final Pattern LITERAL_DELIMITER = Pattern.compile("^\\.{4,}$");
    static final Pattern PASSTHROUGH_DELIMITER = Pattern.compile("^\\+{4,}$");
    static final Pattern DESCRIPTION_LIST_ITEM = Pattern.compile("^([^:\\[\\]]+)::\\s*(.*)$");

    static final Pattern VERSE_ATTRIBUTE = Pattern.compile("^\\[verse(?:,\\s*([^,\\]]+))?(?:,\\s*([^\\]]+))?\\]$");
    static final Pattern LITERAL_ATTRIBUTE = Pattern.compile("^\\[literal\\]$");
    static final Pattern LISTING_ATTRIBUTE = Pattern.compile("^\\[listing\\]$");
    static final Pattern PASSTHROUGH_ATTRIBUTE = Pattern.compile("^\\[pass\\]$");

    private static final List<Rule> RULES = List.of(
            new Rule(HEADER, TokenType.HEADER),
            new Rule(LIST_ITEM, TokenType.LIST_ITEM),
            new Rule(TABLE_DELIMITER, TokenType.TABLE_DELIMITER),
            new Rule(TABLE_ROW, TokenType.TABLE_ROW),
            new Rule(BLOCK_QUOTE_DELIMITER, TokenType.BLOCK_QUOTE_DELIMITER),
            new Rule(SIDEBAR_DELIMITER, TokenType.SIDEBAR_DELIMITER),
            new Rule(EXAMPLE_DELIMITER, TokenType.EXAMPLE_DELIMITER),
            new Rule(ATTRIBUTE_LINE, TokenType.ATTRIBUTE_LINE),
            new Rule(ATTRIBUTE_BLOCK, TokenType.ATTRIBUTE_BLOCK_LINE),
            new Rule(CODE_BLOCK_DELIMITER, TokenType.CODE_BLOCK_DELIMITER),
            new Rule(ADMONITION, TokenType.ADMONITION_BLOCK),
            new Rule(TABLE_OF_CONTENTS, TokenType.TABLE_OF_CONTENTS),
            new Rule(BLOCK_MACRO, TokenType.BLOCK_MACRO),
            new Rule(OPEN_DELIMITER, TokenType.OPEN_DELIMITER),
            new Rule(LITERAL_DELIMITER, TokenType.LITERAL_DELIMITER),
            new Rule(PASSTHROUGH_DELIMITER, TokenType.PASSTHROUGH_DELIMITER),
            new Rule(DESCRIPTION_LIST_ITEM, TokenType.DESCRIPTION_LIST_ITEM)
    );

    private String input;
    private int position;
    private int line;
    private int column;

    public AsciiDocTokenizer() {
    }

    public AsciiDocTokenizer(String input) {
        reset(input);
    }

    public void reset(String input) {
        this.input = Objects.requireNonNull(input, "input");
        this.position = 0;
        this.line = 1;
        this.column = 1;
    }

    public boolean hasMoreTokens() {
        return input != null && position < input.length();
    }

    /**
     * Resets the tokenizer to {@code input} and returns its tokens lazily. The sequence
     * always ends with exactly one END_OF_FILE token. The returned iterable is single-use:
     * it shares this tokenizer's cursor.
     */
    public Iterable<Token> tokenize(String input) {
        reset(input);
        return () -> new Iterator<>() {
            private boolean finished;

            @Override
            public boolean hasNext() {
                return !finished;
            }

            @Override
            public Token next() {
                if (finished) {
                    throw new NoSuchElementException();
                }
                Token token = nextToken();
                if (token.is(TokenType.END_OF_FILE)) {
                    finished = true;
                }
                return token;
            }
        };
    }

    public Token nextToken() {
        if (input == null) {
            throw new IllegalStateException("Tokenizer has no input; call reset first");
        }
        if (!hasMoreTokens()) {
            return endOfFile();
        }

        skipWhitespace();
        if (!hasMoreTokens()) {
            return endOfFile();
        }

        if (input.charAt(position) == '\n') {
            return readNewLine();
        }

        if (isAtStartOfLine()) {
            int startPosition = position;
            int startColumn = column;
            String lineContent = readLine().trim();
            if (lineContent.isEmpty()) {
                return new Token(TokenType.EMPTY_LINE, lineContent, line, startColumn, startPosition);
            }
            return new Token(classify(lineContent), lineContent, line, startColumn, startPosition);
        }

        return readText();
    }

    static TokenType classify(String lineContent) {
        for (Rule rule : RULES) {
            if (rule.pattern.matcher(lineContent).matches()) {
                if (rule.type == TokenType.ATTRIBUTE_BLOCK_LINE) {
                    return refineAttributeBlock(lineContent);
                }
                return rule.type;
            }
        }
        return TokenType.TEXT;
    }

    private static TokenType refineAttributeBlock(String lineContent) {
        if (VERSE_ATTRIBUTE.matcher(lineContent).matches()) {
            return TokenType.VERSE_ATTRIBUTE;
        }
        if (LITERAL_ATTRIBUTE.matcher(lineContent).matches()) {
            return TokenType.LITERAL_ATTRIBUTE;
        }
        if (LISTING_ATTRIBUTE.matcher(lineContent).matches()) {
            return TokenType.LISTING_ATTRIBUTE;
        }
        if (PASSTHROUGH_ATTRIBUTE.matcher(lineContent).matches()) {
            return TokenType.PASSTHROUGH_ATTRIBUTE;
        }
        return TokenType.ATTRIBUTE_BLOCK_LINE;
    }

    private boolean isAtStartOfLine() {
        return column == 1 || (position > 0 && input.charAt(position - 1) == '\n');
    }

    private Token readNewLine() {
        Token token = new Token(TokenType.NEW_LINE, "\n", line, column, position);
        position++;
        line++;
        column = 1;
        return token;
    }

    private Token readText() {
        int startPosition = position;
        int startColumn = column;
        String value = readLine();
        if (value.endsWith("\r")) {
            value = value.substring(0, value.length() - 1);
        }
        return new Token(TokenType.TEXT, value, line, startColumn, startPosition);
    }

    private String readLine() {
        int start = position;
        while (hasMoreTokens() && input.charAt(position) != '\n') {
            position++;
            column++;
        }
        return input.substring(start, position);
    }

    private void skipWhitespace() {
        while (hasMoreTokens()) {
            char c = input.charAt(position);
            if (c == '\n' || !Character.isWhitespace(c)) {
                return;
            }
            position++;
            column++;
        }
    }

    private Token endOfFile() {
        return new Token(TokenType.END_OF_FILE, "", line, column, position);
    }

    private static class Rule {
        private final Pattern pattern;
        private final TokenType type;

        private Rule(Pattern pattern, TokenType type) {
            this.pattern = pattern;
            this.type = type;
        }
    }
}
