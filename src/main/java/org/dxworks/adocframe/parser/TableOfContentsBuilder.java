package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.Document;
import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.Section;
import org.dxworks.adocframe.model.TableOfContents;
import org.dxworks.adocframe.model.TableOfContentsEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fills the {@code toc::[]} blocks of a parsed document with its section titles.
 * Runs once the whole document is known, so a TOC can list sections that follow it.
 */
class TableOfContentsBuilder {

    void resolve(Document document) {
        List<Section> sections = new ArrayList<>();
        List<TableOfContents> tocs = new ArrayList<>();
        collect(document, sections, tocs);
        for (TableOfContents toc : tocs) {
            if (toc.getEntries().isEmpty()) {
                populate(toc, sections);
            }
        }
    }

    private static void collect(DocumentElement element, List<Section> sections, List<TableOfContents> tocs) {
        for (DocumentElement child : element.getChildren()) {
            if (child instanceof Section section && !section.isContainer()) {
                sections.add(section);
            } else if (child instanceof TableOfContents toc) {
                tocs.add(toc);
            }
            collect(child, sections, tocs);
        }
    }

    private static void populate(TableOfContents toc, List<Section> sections) {
        Deque<TableOfContentsEntry> stack = new ArrayDeque<>();
        for (Section section : sections) {
            if (section.getTitle().isEmpty() || section.getLevel() > toc.getMaxDepth()) {
                continue;
            }
            String anchorId = section.getId() != null ? section.getId() : AnchorIds.fromTitle(section.getTitle());
            TableOfContentsEntry entry = new TableOfContentsEntry(section.getTitle(), section.getLevel(), anchorId);

            while (!stack.isEmpty() && stack.peek().getLevel() >= section.getLevel()) {
                stack.pop();
            }
            if (stack.isEmpty()) {
                toc.addEntry(entry);
            } else {
                stack.peek().addEntry(entry);
            }
            stack.push(entry);
        }
    }
}
