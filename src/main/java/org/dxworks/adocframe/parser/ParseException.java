package org.dxworks.adocframe.parser;

/**
 * Raised when the input cannot be turned into a document tree. Line and column are
 * 1-based; include failures, which are not tied to a source position, use 0,0.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    static ParseException at(Token token, String message) {
        return new ParseException(message, token.getLine(), token.getColumn());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
