package org.dxworks.adocframe.parser;

public enum TokenType {
    END_OF_FILE,
    NEW_LINE,
    TEXT,
    HEADER,
    LIST_ITEM,
    DESCRIPTION_LIST_ITEM,
    // a line holding only whitespace; the tokenizer reports blank lines as consecutive NEW_LINE tokens
    EMPTY_LINE,
    CODE_BLOCK_DELIMITER,
    TABLE_DELIMITER,
    TABLE_ROW,
    BLOCK_QUOTE_DELIMITER,
    SIDEBAR_DELIMITER,
    EXAMPLE_DELIMITER,
    OPEN_DELIMITER,
    // not produced by the tokenizer: ____ is always BLOCK_QUOTE_DELIMITER and verse blocks are opened through [verse]
    VERSE_DELIMITER,
    LITERAL_DELIMITER,
    PASSTHROUGH_DELIMITER,
    ATTRIBUTE_LINE,
    ATTRIBUTE_BLOCK_LINE,
    VERSE_ATTRIBUTE,
    LITERAL_ATTRIBUTE,
    LISTING_ATTRIBUTE,
    PASSTHROUGH_ATTRIBUTE,
    ADMONITION_BLOCK,
    TABLE_OF_CONTENTS,
    BLOCK_MACRO,
    UNKNOWN
}
