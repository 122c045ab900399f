package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.Admonition;
import org.dxworks.adocframe.model.AdmonitionType;
import org.dxworks.adocframe.model.BlockQuote;
import org.dxworks.adocframe.model.CodeBlock;
import org.dxworks.adocframe.model.DescriptionList;
import org.dxworks.adocframe.model.Document;
import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.Emphasis;
import org.dxworks.adocframe.model.Example;
import org.dxworks.adocframe.model.Footnote;
import org.dxworks.adocframe.model.ImageMacro;
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
import org.dxworks.adocframe.model.Strong;
import org.dxworks.adocframe.model.Table;
import org.dxworks.adocframe.model.TableCell;
import org.dxworks.adocframe.model.TableOfContents;
import org.dxworks.adocframe.model.TableOfContentsEntry;
import org.dxworks.adocframe.model.Text;
import org.dxworks.adocframe.model.Verse;
import org.dxworks.adocframe.model.VideoMacro;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AsciiDocParserTest {

    private final AsciiDocParser parser = new AsciiDocParser();

    @Test
    void rejects_null_and_empty_input() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(null));
        assertThrows(IllegalArgumentException.class, () -> parser.parse(""));
    }

    @Test
    void first_single_equals_header_is_the_document_title() {
        Document document = parser.parse("= My Title  \n\nSome text.");

        assertEquals("My Title", document.getHeader().getTitle());
        assertEquals(1, document.getChildren().size());
        assertInstanceOf(Paragraph.class, document.getChildren().get(0));
    }

    @Test
    void deeper_headers_become_sections_with_the_equals_count_as_level() {
        Document document = parser.parse("= Doc\n\n== Two\n\n=== Three");

        Section two = (Section) document.getChildren().get(0);
        Section three = (Section) document.getChildren().get(1);
        assertEquals("Two", two.getTitle());
        assertEquals(2, two.getLevel());
        assertEquals("two", two.getId());
        assertEquals(3, three.getLevel());
    }

    @Test
    void document_without_title_header_has_no_title() {
        Document document = parser.parse("== First\n\nText");

        assertNull(document.getHeader().getTitle());
        assertEquals(2, ((Section) document.getChildren().get(0)).getLevel());
    }

    @Test
    void section_ids_are_derived_from_titles() {
        Section section = (Section) parser.parseElement("== Getting Started (Quick)");

        assertEquals("getting-started-quick", section.getId());
    }

    @Test
    void block_id_overrides_the_derived_section_id() {
        Document document = parser.parse("[#custom-id]\n== Title");

        assertEquals("custom-id", ((Section) document.getChildren().get(0)).getId());
    }

    @Test
    void attribute_lines_set_document_attributes() {
        Document document = parser.parse(":version:   1.0  \n:draft:\n:hidden!:\n\nBody");

        assertEquals("1.0", document.getAttributes().getAttribute("version"));
        assertEquals("true", document.getAttributes().getAttribute("draft"));
        assertEquals("false", document.getAttributes().getAttribute("hidden"));
        assertEquals(1, document.getChildren().size());
    }

    @Test
    void header_is_built_from_attributes() {
        Document document = parser.parse(":doctitle: From Attributes\n:author: Jane Doe\n:email: jane@example.com\n:revnumber: 2.0\n:revdate: 2024-01-01\n\nText");

        assertEquals("From Attributes", document.getHeader().getTitle());
        assertEquals("Jane Doe", document.getHeader().getAuthor());
        assertEquals("jane@example.com", document.getHeader().getEmail());
        assertEquals("2.0", document.getHeader().getRevision());
        assertEquals("2024-01-01", document.getHeader().getDate());
        assertEquals("Jane Doe", document.getHeader().getAttributes().getAttribute("author"));
    }

    @Test
    void text_is_kept_unescaped_in_the_tree() {
        Paragraph paragraph = (Paragraph) parser.parse("Fish & <chips> \"quoted\"").getChildren().get(0);

        assertEquals("Fish & <chips> \"quoted\"", paragraph.getText());
    }

    @Test
    void inline_markup_is_split_into_ordered_nodes() {
        Paragraph paragraph = (Paragraph) parser.parse("A *B* C _D_ E").getChildren().get(0);
        List<DocumentElement> inlines = paragraph.getChildren();

        assertEquals(5, inlines.size());
        assertEquals("A ", ((Text) inlines.get(0)).getContent());
        assertEquals("B", ((Strong) inlines.get(1)).getText());
        assertEquals(" C ", ((Text) inlines.get(2)).getContent());
        assertEquals("D", ((Emphasis) inlines.get(3)).getText());
        assertEquals(" E", ((Text) inlines.get(4)).getContent());
    }

    @Test
    void checkbox_list_items() {
        ListBlock list = (ListBlock) parser.parse("* [x] Done\n* [ ] Todo\n* Plain").getChildren().get(0);
        List<ListItem> items = list.getItems();

        assertEquals(ListType.UNORDERED, list.getType());
        assertEquals(3, items.size());
        assertTrue(items.get(0).isCheckbox());
        assertTrue(items.get(0).isChecked());
        assertEquals("Done", items.get(0).getText());
        assertTrue(items.get(1).isCheckbox());
        assertFalse(items.get(1).isChecked());
        assertEquals("Todo", items.get(1).getText());
        assertFalse(items.get(2).isCheckbox());
    }

    @Test
    void ordered_list_keeps_its_start_number_and_items_across_blank_lines() {
        ListBlock list = (ListBlock) parser.parse("3. three\n\n4. four").getChildren().get(0);

        assertEquals(ListType.ORDERED, list.getType());
        assertEquals(3, list.getStartNumber());
        assertEquals(2, list.getItems().size());
    }

    @Test
    void nested_unordered_items_record_their_level() {
        ListBlock list = (ListBlock) parser.parse("* one\n** nested\n* two").getChildren().get(0);

        assertEquals(List.of(1, 2, 1), list.getItems().stream().map(ListItem::getLevel).toList());
    }

    @Test
    void description_list() {
        DescriptionList list = (DescriptionList) parser.parse("CPU:: The brain\nRAM:: Short-term memory").getChildren().get(0);

        assertEquals(ListType.DEFINITION, list.getType());
        assertEquals(2, list.getItems().size());
        assertEquals("CPU", list.getItems().get(0).getTerm());
        assertEquals("The brain", list.getItems().get(0).getDescription());
    }

    @Test
    void table_row_without_trailing_pipe_has_one_cell_per_value() {
        Table table = (Table) parser.parse("|===\n|A |B |C\n|===").getChildren().get(0);

        assertNull(table.getHeader());
        assertEquals(1, table.getRows().size());
        List<TableCell> cells = table.getRows().get(0).getCells();
        assertEquals(List.of("A", "B", "C"), cells.stream().map(TableCell::getContent).toList());
    }

    @Test
    void header_option_turns_first_row_into_table_header() {
        Table table = (Table) parser.parse("[%header]\n|===\n|Name |Value\n|a |1\n|===").getChildren().get(0);

        assertNotNull(table.getHeader());
        assertEquals(2, table.getHeader().getCells().size());
        assertTrue(table.getHeader().getCells().get(0).isHeader());
        assertEquals(1, table.getRows().size());
    }

    @Test
    void table_title_and_named_header_option() {
        Table table = (Table) parser.parse("[options=header, title=Prices]\n|===\n|Item |Cost\n|===").getChildren().get(0);

        assertNotNull(table.getHeader());
        assertEquals("Prices", table.getTitle());
        assertTrue(table.getRows().isEmpty());
    }

    @Test
    void unterminated_block_quote_keeps_its_content() {
        BlockQuote quote = (BlockQuote) parser.parse("____\nunterminated").getChildren().get(0);

        assertEquals("unterminated", quote.getContent());
    }

    @Test
    void block_quote_attribution_from_dash_line() {
        BlockQuote quote = (BlockQuote) parser.parse("____\nWords matter.\n-- Someone Wise\n____").getChildren().get(0);

        assertEquals("Words matter.", quote.getContent());
        assertEquals("Someone Wise", quote.getAttribution());
    }

    @Test
    void quote_style_supplies_attribution_and_cite() {
        BlockQuote quote = (BlockQuote) parser.parse("[quote, Ada Lovelace, Notes]\n____\nThe engine.\n____").getChildren().get(0);

        assertEquals("Ada Lovelace", quote.getAttribution());
        assertEquals("Notes", quote.getCite());
        assertEquals("quote", quote.getAttributes().getAttribute("style"));
    }

    @Test
    void source_block_takes_language_from_style() {
        CodeBlock code = (CodeBlock) parser.parse("[source,java]\n----\nint x = 1;\n\nint y = 2;\n----").getChildren().get(0);

        assertEquals("java", code.getLanguage());
        assertEquals("int x = 1;\n\nint y = 2;", code.getContent());
    }

    @Test
    void code_delimiter_suffix_names_the_language() {
        CodeBlock code = (CodeBlock) parser.parse("----python\nprint('hi')\n----").getChildren().get(0);

        assertEquals("python", code.getLanguage());
        assertEquals("print('hi')", code.getContent());
    }

    @Test
    void literal_block_keeps_indentation() {
        Literal literal = (Literal) parser.parse("....\n  keep   spacing\n....").getChildren().get(0);

        assertEquals("  keep   spacing", literal.getContent());
    }

    @Test
    void literal_and_listing_styles_apply_to_the_next_paragraph() {
        Document document = parser.parse("[literal]\nliteral text\n\n[listing]\nlisting text");

        assertEquals("literal text", ((Literal) document.getChildren().get(0)).getContent());
        assertEquals("listing text", ((Listing) document.getChildren().get(1)).getContent());
    }

    @Test
    void passthrough_content_is_raw() {
        Passthrough passthrough = (Passthrough) parser.parse("++++\n<b>raw</b>\n++++").getChildren().get(0);

        assertEquals("<b>raw</b>", passthrough.getContent());
    }

    @Test
    void verse_with_author_and_citation() {
        Verse verse = (Verse) parser.parse("[verse, Carl Sandburg, Fog]\n____\nThe fog comes\non little cat feet.\n____").getChildren().get(0);

        assertEquals("Carl Sandburg", verse.getAuthor());
        assertEquals("Fog", verse.getCitation());
        assertEquals("The fog comes\non little cat feet.", verse.getContent());
    }

    @Test
    void sidebar_contains_nested_blocks() {
        Sidebar sidebar = (Sidebar) parser.parse("****\nInside.\n\n* a\n****\n\nAfter.").getChildren().get(0);

        assertEquals(2, sidebar.getChildren().size());
        assertInstanceOf(Paragraph.class, sidebar.getChildren().get(0));
        assertInstanceOf(ListBlock.class, sidebar.getChildren().get(1));
    }

    @Test
    void example_takes_title_from_attributes() {
        Example example = (Example) parser.parse("[title=Demo]\n====\nShown.\n====").getChildren().get(0);

        assertEquals("Demo", example.getTitle());
        assertEquals(1, example.getChildren().size());
    }

    @Test
    void styled_open_block_masquerades() {
        Open open = (Open) parser.parse("[sidebar]\n--\nText\n--").getChildren().get(0);

        assertEquals("sidebar", open.getMasqueradeType());
        assertEquals(1, open.getChildren().size());
    }

    @Test
    void admonition_forms() {
        Document document = parser.parse("TIP: Use it\n\n[WARNING]\nDanger here\n\n[NOTE]\n====\nFirst.\n\nSecond.\n====");

        Admonition tip = (Admonition) document.getChildren().get(0);
        Admonition warning = (Admonition) document.getChildren().get(1);
        Admonition note = (Admonition) document.getChildren().get(2);
        assertEquals(AdmonitionType.TIP, tip.getType());
        assertEquals("Use it", tip.getContent());
        assertEquals(AdmonitionType.WARNING, warning.getType());
        assertEquals("Danger here", warning.getContent());
        assertEquals(AdmonitionType.NOTE, note.getType());
        assertEquals("First.\nSecond.", note.getContent());
    }

    @Test
    void table_of_contents_lists_sections_up_to_its_depth() {
        Document document = parser.parse("= Doc\n\ntoc::[levels=3]\n\n== A\n\n=== A1\n\n==== A1a\n\n== B");

        TableOfContents toc = (TableOfContents) document.getChildren().get(0);
        assertEquals(TableOfContents.DEFAULT_TITLE, toc.getTitle());
        assertEquals(3, toc.getMaxDepth());
        List<TableOfContentsEntry> entries = toc.getEntries();
        assertEquals(2, entries.size());
        assertEquals("A", entries.get(0).getTitle());
        assertEquals("a", entries.get(0).getAnchorId());
        assertEquals(1, entries.get(0).getEntries().size());
        assertEquals("A1", entries.get(0).getEntries().get(0).getTitle());
        assertTrue(entries.get(0).getEntries().get(0).getEntries().isEmpty());
        assertEquals("B", entries.get(1).getTitle());
    }

    @Test
    void block_macros() {
        Document document = parser.parse("image::a.png[Alt text, width=200]\n\nvideo::intro.webm[width=640]\n\nchart::data.csv[line]");

        ImageMacro image = (ImageMacro) document.getChildren().get(0);
        assertEquals("a.png", image.getSource());
        assertEquals("Alt text", image.getAlt());
        assertEquals(Integer.valueOf(200), image.getWidth());

        VideoMacro video = (VideoMacro) document.getChildren().get(1);
        assertEquals(Integer.valueOf(640), video.getWidth());
        assertEquals("webm", video.getVideoFormat());

        Macro chart = (Macro) document.getChildren().get(2);
        assertEquals("chart", chart.getName());
        assertEquals("data.csv", chart.getTarget());
        assertEquals(MacroType.BLOCK, chart.getMacroType());
    }

    @Test
    void footnotes_are_numbered_across_the_document() {
        Document document = parser.parse("One.footnote:[First]\n\nTwo.footnote:[Second]");

        Footnote first = (Footnote) document.getChildren().get(0).getChildren().get(1);
        Footnote second = (Footnote) document.getChildren().get(1).getChildren().get(1);
        assertEquals("1", first.getReferenceLabel());
        assertEquals("2", second.getReferenceLabel());
    }

    @Test
    void attribute_block_at_end_of_input_is_kept_as_text() {
        Paragraph paragraph = (Paragraph) parser.parse("[something]").getChildren().get(0);

        assertEquals("something", paragraph.getText());
    }

    @Test
    void parse_element_returns_null_for_empty_input() {
        assertNull(parser.parseElement(""));
        assertNull(parser.parseElement((String) null));
        assertInstanceOf(Section.class, parser.parseElement("\n\n== Later"));
    }

    @Test
    void expect_reports_position_of_unexpected_token() {
        ParseContext context = new ParseContext(new AsciiDocTokenizer("plain text"));

        ParseException error = assertThrows(ParseException.class, () -> context.expect(TokenType.HEADER));
        assertEquals(1, error.getLine());
        assertEquals(1, error.getColumn());
        assertTrue(error.getMessage().contains("Expected HEADER but found TEXT"));
    }

    @Test
    void parents_are_linked_while_parsing() {
        Document document = parser.parse("****\nInside.\n****");

        DocumentElement sidebar = document.getChildren().get(0);
        assertEquals(document, sidebar.getParent());
        assertEquals(sidebar, sidebar.getChildren().get(0).getParent());
    }
}
