package org.dxworks.adocframe.parser;

/**
 * One classified unit of input: a whole source line, a line break, or end of input.
 * Line-start tokens carry the trimmed line; {@code column} is 1-based and records where
 * the token's text started, so an indented line keeps its indentation there.
 */
public class Token {

    private final TokenType type;
    private final String value;
    private final int line;
    private final int column;
    private final int position;

    public Token(TokenType type, String value, int line, int column, int position) {
        this.type = type;
        this.value = value == null ? "" : value;
        this.line = line;
        this.column = column;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getPosition() {
        return position;
    }

    public int getLength() {
        return value.length();
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isBlank() {
        return type == TokenType.NEW_LINE || type == TokenType.EMPTY_LINE;
    }

    @Override
    public String toString() {
        return type + "('" + value.replace("\n", "\\n") + "' @" + line + ":" + column + ")";
    }
}
