package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.Anchor;
import org.dxworks.adocframe.model.CrossReference;
import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.Footnote;
import org.dxworks.adocframe.model.Highlight;
import org.dxworks.adocframe.model.Image;
import org.dxworks.adocframe.model.ImageMacro;
import org.dxworks.adocframe.model.InlineCode;
import org.dxworks.adocframe.model.Link;
import org.dxworks.adocframe.model.Macro;
import org.dxworks.adocframe.model.MacroType;
import org.dxworks.adocframe.model.Strong;
import org.dxworks.adocframe.model.Subscript;
import org.dxworks.adocframe.model.Superscript;
import org.dxworks.adocframe.model.Text;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InlineParserTest {

    private final InlineParser inlineParser = new InlineParser();

    @Test
    void plain_text_is_a_single_text_node() {
        List<DocumentElement> nodes = inlineParser.parse("nothing special here");

        assertEquals(1, nodes.size());
        assertEquals("nothing special here", ((Text) nodes.get(0)).getContent());
    }

    @Test
    void empty_text_has_no_nodes() {
        assertTrue(inlineParser.parse("").isEmpty());
        assertTrue(inlineParser.parse(null).isEmpty());
    }

    @Test
    void unconstrained_strong_wins_over_constrained() {
        List<DocumentElement> nodes = inlineParser.parse("**bold**face");

        assertEquals("bold", ((Strong) nodes.get(0)).getText());
        assertEquals("face", ((Text) nodes.get(1)).getContent());
    }

    @Test
    void matched_content_is_not_parsed_again() {
        List<DocumentElement> nodes = inlineParser.parse("*_x_*");

        assertEquals(1, nodes.size());
        assertEquals("_x_", ((Strong) nodes.get(0)).getText());
    }

    @Test
    void formatting_marks() {
        List<DocumentElement> nodes = inlineParser.parse("#hi# E=mc^2^ H~2~O `code`");

        assertEquals("hi", ((Highlight) nodes.get(0)).getText());
        assertEquals("2", ((Superscript) nodes.get(2)).getText());
        assertEquals("2", ((Subscript) nodes.get(4)).getText());
        assertEquals("code", ((InlineCode) nodes.get(6)).getContent());
    }

    @Test
    void links_use_the_url_when_text_is_missing() {
        List<DocumentElement> nodes = inlineParser.parse("See https://example.com[Example] or https://asciidoc.org");

        Link named = (Link) nodes.get(1);
        Link bare = (Link) nodes.get(3);
        assertEquals("https://example.com", named.getUrl());
        assertEquals("Example", named.getText());
        assertEquals("https://asciidoc.org", bare.getText());
    }

    @Test
    void inline_image() {
        Image image = (Image) inlineParser.parse("image::logo.png[Logo]").get(0);

        assertEquals("logo.png", image.getSrc());
        assertEquals("Logo", image.getAlt());
    }

    @Test
    void anchors_and_cross_references() {
        List<DocumentElement> nodes = inlineParser.parse("[[intro,Intro]]Read <<intro,the intro>> and <<usage>>");

        Anchor anchor = (Anchor) nodes.get(0);
        assertEquals("intro", anchor.getId());
        assertEquals("Intro", anchor.getLabel());
        CrossReference withText = (CrossReference) nodes.get(2);
        assertEquals("intro", withText.getTargetId());
        assertEquals("the intro", withText.getLinkText());
        CrossReference bare = (CrossReference) nodes.get(4);
        assertEquals("usage", bare.getTargetId());
        assertEquals("", bare.getLinkText());
    }

    @Test
    void anchor_with_blank_id_stays_text() {
        List<DocumentElement> nodes = inlineParser.parse("[[ ]]");

        assertEquals("[[ ]]", ((Text) nodes.get(0)).getContent());
    }

    @Test
    void named_footnote_reference_shares_the_definition_label() {
        FootnoteRegistry registry = new FootnoteRegistry();
        InlineParser parser = new InlineParser(registry);

        Footnote anonymous = (Footnote) parser.parse("footnote:[Plain note]").get(0);
        Footnote definition = (Footnote) parser.parse("footnote:disclaimer[Use at your own risk]").get(0);
        Footnote reference = (Footnote) parser.parse("footnote:disclaimer[]").get(0);

        assertEquals("1", anonymous.getReferenceLabel());
        assertEquals("_footnotedef_1", anonymous.getId());
        assertEquals("2", definition.getReferenceLabel());
        assertFalse(definition.isReference());
        assertEquals("2", reference.getReferenceLabel());
        assertTrue(reference.isReference());
        assertEquals(2, registry.size());
    }

    @Test
    void reference_before_definition_keeps_one_label() {
        FootnoteRegistry registry = new FootnoteRegistry();

        assertEquals("1", registry.reference("later"));
        assertEquals("1", registry.define("later"));
        assertTrue(registry.isKnown("later"));
        assertEquals("2", registry.define(null));
    }

    @Test
    void other_inline_macros() {
        List<DocumentElement> nodes = inlineParser.parse("Press kbd:[Ctrl+C] now");

        Macro macro = (Macro) nodes.get(1);
        assertEquals("kbd", macro.getName());
        assertEquals("", macro.getTarget());
        assertEquals("Ctrl+C", macro.getParameters().get("alt"));
        assertEquals(MacroType.INLINE, macro.getMacroType());
    }

    @Test
    void inline_image_macro_with_single_colon() {
        DocumentElement node = inlineParser.parse("image:icon.svg[Icon, width=16]").get(0);

        ImageMacro image = assertInstanceOf(ImageMacro.class, node);
        assertEquals("icon.svg", image.getSource());
        assertEquals(Integer.valueOf(16), image.getWidth());
    }
}
