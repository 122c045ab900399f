package org.dxworks.adocframe.parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AsciiDocTokenizerTest {

    @Test
    void classifies_lines_in_rule_order() {
        assertEquals(TokenType.HEADER, AsciiDocTokenizer.classify("== Section"));
        assertEquals(TokenType.LIST_ITEM, AsciiDocTokenizer.classify("* item"));
        assertEquals(TokenType.LIST_ITEM, AsciiDocTokenizer.classify("12. item"));
        assertEquals(TokenType.TABLE_DELIMITER, AsciiDocTokenizer.classify("|==="));
        assertEquals(TokenType.TABLE_ROW, AsciiDocTokenizer.classify("|a |b"));
        assertEquals(TokenType.BLOCK_QUOTE_DELIMITER, AsciiDocTokenizer.classify("____"));
        assertEquals(TokenType.SIDEBAR_DELIMITER, AsciiDocTokenizer.classify("****"));
        assertEquals(TokenType.EXAMPLE_DELIMITER, AsciiDocTokenizer.classify("===="));
        assertEquals(TokenType.ATTRIBUTE_LINE, AsciiDocTokenizer.classify(":toc: left"));
        assertEquals(TokenType.ATTRIBUTE_BLOCK_LINE, AsciiDocTokenizer.classify("[source,java]"));
        assertEquals(TokenType.CODE_BLOCK_DELIMITER, AsciiDocTokenizer.classify("----"));
        assertEquals(TokenType.CODE_BLOCK_DELIMITER, AsciiDocTokenizer.classify("----java"));
        assertEquals(TokenType.ADMONITION_BLOCK, AsciiDocTokenizer.classify("WARNING: hot"));
        assertEquals(TokenType.TABLE_OF_CONTENTS, AsciiDocTokenizer.classify("toc::[]"));
        assertEquals(TokenType.BLOCK_MACRO, AsciiDocTokenizer.classify("image::a.png[]"));
        assertEquals(TokenType.OPEN_DELIMITER, AsciiDocTokenizer.classify("--"));
        assertEquals(TokenType.LITERAL_DELIMITER, AsciiDocTokenizer.classify("...."));
        assertEquals(TokenType.PASSTHROUGH_DELIMITER, AsciiDocTokenizer.classify("++++"));
        assertEquals(TokenType.DESCRIPTION_LIST_ITEM, AsciiDocTokenizer.classify("CPU:: The brain"));
        assertEquals(TokenType.TEXT, AsciiDocTokenizer.classify("Just words."));
    }

    @Test
    void refines_style_only_attribute_blocks() {
        assertEquals(TokenType.VERSE_ATTRIBUTE, AsciiDocTokenizer.classify("[verse, Carl Sandburg, Fog]"));
        assertEquals(TokenType.LITERAL_ATTRIBUTE, AsciiDocTokenizer.classify("[literal]"));
        assertEquals(TokenType.LISTING_ATTRIBUTE, AsciiDocTokenizer.classify("[listing]"));
        assertEquals(TokenType.PASSTHROUGH_ATTRIBUTE, AsciiDocTokenizer.classify("[pass]"));
        assertEquals(TokenType.ATTRIBUTE_BLOCK_LINE, AsciiDocTokenizer.classify("[quote, Someone]"));
    }

    @Test
    void header_wins_over_example_delimiter_only_with_a_title() {
        assertEquals(TokenType.HEADER, AsciiDocTokenizer.classify("==== Deep"));
        assertEquals(TokenType.EXAMPLE_DELIMITER, AsciiDocTokenizer.classify("====="));
    }

    @Test
    void emits_newlines_between_lines_and_a_single_end_of_file() {
        List<Token> tokens = collect("= Title\n\nText");

        assertEquals(List.of(TokenType.HEADER, TokenType.NEW_LINE, TokenType.NEW_LINE, TokenType.TEXT, TokenType.END_OF_FILE),
                types(tokens));
        assertEquals("= Title", tokens.get(0).getValue());
        assertEquals(3, tokens.get(3).getLine());
        assertEquals(1, tokens.get(3).getColumn());
    }

    @Test
    void indented_lines_are_text_with_their_column() {
        List<Token> tokens = collect("----\n  indented * not a list\n----");

        Token indented = tokens.get(2);
        assertEquals(TokenType.TEXT, indented.getType());
        assertEquals("indented * not a list", indented.getValue());
        assertEquals(3, indented.getColumn());
    }

    @Test
    void strips_carriage_returns_from_windows_line_endings() {
        List<Token> tokens = collect("== Title\r\n  body\r\n");

        assertEquals("== Title", tokens.get(0).getValue());
        assertEquals(TokenType.HEADER, tokens.get(0).getType());
        assertEquals("body", tokens.get(2).getValue());
    }

    @Test
    void keeps_returning_end_of_file() {
        AsciiDocTokenizer tokenizer = new AsciiDocTokenizer("x");
        assertEquals(TokenType.TEXT, tokenizer.nextToken().getType());
        assertEquals(TokenType.END_OF_FILE, tokenizer.nextToken().getType());
        assertEquals(TokenType.END_OF_FILE, tokenizer.nextToken().getType());
        assertFalse(tokenizer.hasMoreTokens());
    }

    @Test
    void empty_input_is_only_end_of_file() {
        assertEquals(List.of(TokenType.END_OF_FILE), types(collect("")));
    }

    @Test
    void rejects_null_input() {
        assertThrows(NullPointerException.class, () -> new AsciiDocTokenizer().reset(null));
        assertThrows(IllegalStateException.class, () -> new AsciiDocTokenizer().nextToken());
    }

    private static List<Token> collect(String input) {
        List<Token> tokens = new ArrayList<>();
        new AsciiDocTokenizer().tokenize(input).forEach(tokens::add);
        return tokens;
    }

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> types = new ArrayList<>();
        tokens.forEach(token -> types.add(token.getType()));
        return types;
    }
}
