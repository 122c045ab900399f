package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.DocumentAttributes;
import org.dxworks.adocframe.model.DocumentElement;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Cursor over a token stream plus the state one parse shares across nested includes:
 * the global attribute table, the footnote registry and the options. The element stack,
 * current file and include chain belong to the context itself.
 */
public class ParseContext {

    private final AsciiDocTokenizer tokenizer;
    private final DocumentAttributes globalAttributes;
    private final FootnoteRegistry footnotes;
    private final ParserOptions options;
    private final Deque<DocumentElement> elementStack = new ArrayDeque<>();
    private final Path currentFilePath;
    private final List<Path> includeStack;
    private final int includeDepth;
    private Token currentToken;

    public ParseContext(AsciiDocTokenizer tokenizer) {
        this(tokenizer, ParserOptions.defaults(), null);
    }

    public ParseContext(AsciiDocTokenizer tokenizer, ParserOptions options, Path currentFilePath) {
        this(tokenizer, new DocumentAttributes(), new FootnoteRegistry(), options, currentFilePath,
                currentFilePath == null ? List.of() : List.of(normalize(currentFilePath)), 0);
    }

    private ParseContext(AsciiDocTokenizer tokenizer, DocumentAttributes globalAttributes, FootnoteRegistry footnotes,
                         ParserOptions options, Path currentFilePath, List<Path> includeStack, int includeDepth) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.globalAttributes = globalAttributes;
        this.footnotes = footnotes;
        this.options = options == null ? ParserOptions.defaults() : options;
        this.currentFilePath = currentFilePath;
        this.includeStack = Collections.unmodifiableList(new ArrayList<>(includeStack));
        this.includeDepth = includeDepth;
        this.currentToken = tokenizer.nextToken();
    }

    /**
     * A context for the content of {@code file}, included from this one. Attributes,
     * footnotes and options stay shared; the include chain is {@code includeStack}.
     */
    public ParseContext forInclude(AsciiDocTokenizer includeTokenizer, Path file, List<Path> includeStack) {
        return new ParseContext(includeTokenizer, globalAttributes, footnotes, options, file, includeStack, includeDepth + 1);
    }

    public Token getCurrentToken() {
        return currentToken;
    }

    public Token advance() {
        if (!currentToken.is(TokenType.END_OF_FILE)) {
            currentToken = tokenizer.nextToken();
        }
        return currentToken;
    }

    /**
     * Consumes the current token if it has the given type.
     */
    public boolean accept(TokenType type) {
        if (currentToken.is(type)) {
            advance();
            return true;
        }
        return false;
    }

    public Token expect(TokenType type) {
        Token token = currentToken;
        if (!token.is(type)) {
            throw new ParseException("Expected " + type + " but found " + token.getType()
                    + " at line " + token.getLine() + ", column " + token.getColumn(),
                    token.getLine(), token.getColumn());
        }
        advance();
        return token;
    }

    public boolean isAtEnd() {
        return currentToken.is(TokenType.END_OF_FILE);
    }

    public void pushElement(DocumentElement element) {
        elementStack.push(Objects.requireNonNull(element, "element"));
    }

    public DocumentElement popElement() {
        return elementStack.pop();
    }

    public DocumentElement peekElement() {
        return elementStack.peek();
    }

    public int getElementDepth() {
        return elementStack.size();
    }

    public DocumentAttributes getGlobalAttributes() {
        return globalAttributes;
    }

    public FootnoteRegistry getFootnotes() {
        return footnotes;
    }

    public ParserOptions getOptions() {
        return options;
    }

    public Path getCurrentFilePath() {
        return currentFilePath;
    }

    public List<Path> getIncludeStack() {
        return includeStack;
    }

    public int getIncludeDepth() {
        return includeDepth;
    }

    static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
