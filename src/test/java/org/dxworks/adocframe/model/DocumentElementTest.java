package org.dxworks.adocframe.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocumentElementTest {

    @Test
    void adding_a_child_sets_its_parent() {
        Sidebar sidebar = new Sidebar();
        Paragraph paragraph = new Paragraph("text");

        sidebar.addChild(paragraph);

        assertSame(sidebar, paragraph.getParent());
        assertEquals(1, sidebar.getChildren().size());
    }

    @Test
    void re_adding_a_child_moves_it_to_the_new_parent() {
        Sidebar first = new Sidebar();
        Example second = new Example();
        Paragraph paragraph = new Paragraph("text");
        first.addChild(paragraph);

        second.addChild(paragraph);

        assertTrue(first.getChildren().isEmpty());
        assertSame(second, paragraph.getParent());
    }

    @Test
    void removing_a_child_clears_its_parent() {
        Sidebar sidebar = new Sidebar();
        Paragraph paragraph = new Paragraph("text");
        sidebar.addChild(paragraph);

        assertTrue(sidebar.removeChild(paragraph));
        assertNull(paragraph.getParent());
        assertFalse(sidebar.removeChild(paragraph));
    }

    @Test
    void move_children_keeps_order() {
        Sidebar source = new Sidebar();
        Example target = new Example();
        Paragraph one = new Paragraph("one");
        Paragraph two = new Paragraph("two");
        source.addChild(one);
        source.addChild(two);

        source.moveChildrenTo(target);

        assertTrue(source.getChildren().isEmpty());
        assertSame(one, target.getChildren().get(0));
        assertSame(two, target.getChildren().get(1));
        assertSame(target, two.getParent());
    }

    @Test
    void an_element_cannot_contain_itself() {
        Sidebar sidebar = new Sidebar();

        assertThrows(IllegalArgumentException.class, () -> sidebar.addChild(sidebar));
        assertThrows(NullPointerException.class, () -> sidebar.addChild(null));
    }

    @Test
    void children_are_read_only_from_outside() {
        Sidebar sidebar = new Sidebar();

        assertThrows(UnsupportedOperationException.class, () -> sidebar.getChildren().add(new Paragraph("x")));
    }

    @Test
    void element_type_is_fixed_per_kind() {
        assertEquals("section", new Section("Title", 2).getElementType());
        assertEquals("paragraph", new Paragraph().getElementType());
    }

    @Test
    void section_levels_cannot_be_negative() {
        assertThrows(IllegalArgumentException.class, () -> new Section("Title", -1));
        assertTrue(Section.container().isContainer());
    }

    @Test
    void paragraph_text_falls_back_to_inline_children() {
        Paragraph paragraph = new Paragraph();
        paragraph.addChild(new Text("Hello "));
        paragraph.addChild(new Strong("world"));

        assertEquals("Hello world", paragraph.getText());
        assertThrows(IllegalArgumentException.class, () -> new Paragraph(null));
    }

    @Test
    void attributes_follow_attribute_line_conventions() {
        DocumentAttributes attributes = new DocumentAttributes();
        attributes.setAttribute("toc", "yes");
        attributes.setAttribute("draft", "false");

        assertTrue(attributes.isEnabled("toc"));
        assertFalse(attributes.isEnabled("draft"));
        assertFalse(attributes.isEnabled("missing"));
        assertEquals("fallback", attributes.getAttribute("missing", "fallback"));
        assertThrows(IllegalArgumentException.class, () -> attributes.setAttribute(" ", "x"));
    }

    @Test
    void admonition_labels() {
        assertEquals(AdmonitionType.CAUTION, AdmonitionType.fromLabel("caution").orElseThrow());
        assertTrue(AdmonitionType.fromLabel("DANGER").isEmpty());
        assertEquals("important", AdmonitionType.IMPORTANT.cssClass());
    }
}
