package org.dxworks.adocframe.analyzer;

import org.dxworks.adocframe.model.AbstractDocumentVisitor;
import org.dxworks.adocframe.model.Admonition;
import org.dxworks.adocframe.model.BlockQuote;
import org.dxworks.adocframe.model.CodeBlock;
import org.dxworks.adocframe.model.CompoundBlock;
import org.dxworks.adocframe.model.DescriptionList;
import org.dxworks.adocframe.model.Document;
import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.DocumentHeader;
import org.dxworks.adocframe.model.Example;
import org.dxworks.adocframe.model.Image;
import org.dxworks.adocframe.model.ImageMacro;
import org.dxworks.adocframe.model.IncludeMacro;
import org.dxworks.adocframe.model.ListBlock;
import org.dxworks.adocframe.model.ListItem;
import org.dxworks.adocframe.model.ListType;
import org.dxworks.adocframe.model.Listing;
import org.dxworks.adocframe.model.Literal;
import org.dxworks.adocframe.model.Macro;
import org.dxworks.adocframe.model.Open;
import org.dxworks.adocframe.model.Paragraph;
import org.dxworks.adocframe.model.Passthrough;
import org.dxworks.adocframe.model.Section;
import org.dxworks.adocframe.model.Sidebar;
import org.dxworks.adocframe.model.Table;
import org.dxworks.adocframe.model.TableOfContents;
import org.dxworks.adocframe.model.TableRow;
import org.dxworks.adocframe.model.Verse;
import org.dxworks.adocframe.model.VideoMacro;
import org.dxworks.adocframe.model.outline.DocumentOutline;
import org.dxworks.adocframe.model.outline.OutlineElement;
import org.dxworks.adocframe.model.outline.OutlineSection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds a {@link DocumentOutline} from a parsed document: the section hierarchy plus the
 * kind of every block inside each section. Inline content is not reported.
 */
public class OutlineAnalyzer {

    public DocumentOutline analyze(String filePath, Document document) {
        Objects.requireNonNull(document, "document");
        DocumentOutline outline = new DocumentOutline();
        outline.filePath = filePath;

        DocumentHeader header = document.getHeader();
        if (header != null) {
            outline.title = blankToNull(header.getTitle());
            outline.author = blankToNull(header.getAuthor());
        }
        if (!document.getAttributes().isEmpty()) {
            outline.attributes = new TreeMap<>(document.getAttributes().asMap());
        }

        List<OutlineSection> sections = new ArrayList<>();
        OutlineVisitor visitor = new OutlineVisitor(sections);
        document.accept(visitor);

        outline.preamble = visitor.preamble;
        outline.sections = sections;
        return outline;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static class OutlineVisitor extends AbstractDocumentVisitor {
        private final List<OutlineSection> sections;
        private final List<OutlineSection> sectionStack = new ArrayList<>();
        private final List<OutlineElement> elementStack = new ArrayList<>();
        private OutlineSection preamble;

        OutlineVisitor(List<OutlineSection> sections) {
            this.sections = sections;
        }

        @Override
        public void visit(Section section) {
            if (section.isContainer()) {
                // blocks of a multi-block include belong to the enclosing section
                visitChildren(section);
                return;
            }
            addSectionToHierarchy(createSection(section));
            visitChildren(section);
        }

        @Override
        public void visit(Paragraph paragraph) {
            DocumentElement image = getStandaloneImage(paragraph);
            if (image != null) {
                addElementToCurrentContext(createImageElement(image));
            } else {
                addElementToCurrentContext(createElement("paragraph", null));
            }
        }

        @Override
        public void visit(ListBlock list) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("style", list.getType() == ListType.ORDERED ? "ordered" : "unordered");
            if (list.getType() == ListType.ORDERED && list.getStartNumber() != 1) {
                properties.put("start", list.getStartNumber());
            }
            withElementContext(createElement("list", properties), () -> visitChildren(list));
        }

        @Override
        public void visit(ListItem listItem) {
            Map<String, Object> properties = null;
            if (listItem.getLevel() > 1 || listItem.isCheckbox()) {
                properties = new HashMap<>();
                if (listItem.getLevel() > 1) {
                    properties.put("level", listItem.getLevel());
                }
                if (listItem.isCheckbox()) {
                    properties.put("checked", listItem.isChecked());
                }
            }
            addElementToCurrentContext(createElement("list_item", properties));
        }

        @Override
        public void visit(DescriptionList descriptionList) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("items", descriptionList.getItems().size());
            addElementToCurrentContext(createElement("description_list", properties));
        }

        @Override
        public void visit(Table table) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("rows", table.getRows().size());
            properties.put("columns", columnCount(table));
            if (table.getHeader() != null) {
                properties.put("header", true);
            }
            putIfPresent(properties, "title", table.getTitle());
            addElementToCurrentContext(createElement("table", properties));
        }

        @Override
        public void visit(CodeBlock codeBlock) {
            addElementToCurrentContext(createElement("code_block", language(codeBlock.getLanguage())));
        }

        @Override
        public void visit(Listing listing) {
            addElementToCurrentContext(createElement("listing", language(listing.getLanguage())));
        }

        @Override
        public void visit(Literal literal) {
            addElementToCurrentContext(createElement("literal", null));
        }

        @Override
        public void visit(Verse verse) {
            Map<String, Object> properties = new HashMap<>();
            putIfPresent(properties, "author", verse.getAuthor());
            putIfPresent(properties, "citation", verse.getCitation());
            addElementToCurrentContext(createElement("verse", nullIfEmpty(properties)));
        }

        @Override
        public void visit(Passthrough passthrough) {
            addElementToCurrentContext(createElement("passthrough", null));
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            Map<String, Object> properties = new HashMap<>();
            putIfPresent(properties, "attribution", blockQuote.getAttribution());
            putIfPresent(properties, "cite", blockQuote.getCite());
            addElementToCurrentContext(createElement("block_quote", nullIfEmpty(properties)));
        }

        @Override
        public void visit(Sidebar sidebar) {
            compound("sidebar", sidebar, null);
        }

        @Override
        public void visit(Example example) {
            compound("example", example, null);
        }

        @Override
        public void visit(Open open) {
            compound("open", open, open.getMasqueradeType());
        }

        @Override
        public void visit(Admonition admonition) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("kind", admonition.getType().cssClass());
            putIfPresent(properties, "title", admonition.getTitle());
            addElementToCurrentContext(createElement("admonition", properties));
        }

        @Override
        public void visit(TableOfContents toc) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("levels", toc.getMaxDepth());
            properties.put("entries", toc.getEntries().size());
            addElementToCurrentContext(createElement("toc", properties));
        }

        @Override
        public void visit(Macro macro) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("name", macro.getName());
            putIfPresent(properties, "target", macro.getTarget());
            addElementToCurrentContext(createElement("macro", properties));
        }

        @Override
        public void visit(ImageMacro imageMacro) {
            addElementToCurrentContext(createImageElement(imageMacro));
        }

        @Override
        public void visit(VideoMacro videoMacro) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("target", videoMacro.getSource());
            putIfPresent(properties, "format", videoMacro.getVideoFormat());
            addElementToCurrentContext(createElement("video", properties));
        }

        @Override
        public void visit(IncludeMacro includeMacro) {
            // only unresolved includes survive parsing
            Map<String, Object> properties = new HashMap<>();
            properties.put("target", includeMacro.getFilePath());
            if (includeMacro.isOptional()) {
                properties.put("optional", true);
            }
            addElementToCurrentContext(createElement("include", properties));
        }

        private void compound(String type, CompoundBlock block, String masquerade) {
            Map<String, Object> properties = new HashMap<>();
            putIfPresent(properties, "title", block.getTitle());
            putIfPresent(properties, "style", masquerade);
            withElementContext(createElement(type, nullIfEmpty(properties)), () -> visitChildren(block));
        }

        private OutlineSection getCurrentSection() {
            if (!sectionStack.isEmpty()) {
                return sectionStack.get(sectionStack.size() - 1);
            }
            if (preamble == null) {
                preamble = new OutlineSection();
                preamble.heading = null;
                preamble.level = 0;
            }
            return preamble;
        }

        private void addElementToCurrentContext(OutlineElement element) {
            if (!elementStack.isEmpty()) {
                OutlineElement parent = elementStack.get(elementStack.size() - 1);
                if (parent.children == null) {
                    parent.children = new ArrayList<>();
                }
                parent.children.add(element);
                return;
            }
            getCurrentSection().elements.add(element);
        }

        private void withElementContext(OutlineElement element, Runnable visitorAction) {
            addElementToCurrentContext(element);
            elementStack.add(element);
            try {
                visitorAction.run();
            } finally {
                elementStack.remove(elementStack.size() - 1);
            }
        }

        private void addSectionToHierarchy(OutlineSection section) {
            while (!sectionStack.isEmpty() && sectionStack.get(sectionStack.size() - 1).level >= section.level) {
                sectionStack.remove(sectionStack.size() - 1);
            }

            if (sectionStack.isEmpty()) {
                sections.add(section);
            } else {
                sectionStack.get(sectionStack.size() - 1).subsections.add(section);
            }

            sectionStack.add(section);
        }

        private OutlineSection createSection(Section section) {
            OutlineSection outlineSection = new OutlineSection();
            outlineSection.heading = section.getTitle();
            outlineSection.level = section.getLevel();
            outlineSection.id = blankToNull(section.getId());
            return outlineSection;
        }

        private DocumentElement getStandaloneImage(Paragraph paragraph) {
            List<DocumentElement> children = paragraph.getChildren();
            if (children.size() != 1) {
                return null;
            }
            DocumentElement only = children.get(0);
            return only instanceof Image || only instanceof ImageMacro ? only : null;
        }

        private OutlineElement createImageElement(DocumentElement image) {
            Map<String, Object> properties = new HashMap<>();
            if (image instanceof ImageMacro macro) {
                properties.put("target", macro.getSource());
                putIfPresent(properties, "altText", macro.getAlt());
            } else if (image instanceof Image inline) {
                properties.put("target", inline.getSrc());
                putIfPresent(properties, "altText", inline.getAlt());
            }
            return createElement("image", properties);
        }

        private OutlineElement createElement(String type, Map<String, Object> properties) {
            OutlineElement element = new OutlineElement();
            element.type = type;
            element.properties = properties;
            element.children = null;
            return element;
        }

        private static int columnCount(Table table) {
            int columns = table.getHeader() == null ? 0 : table.getHeader().getCells().size();
            for (TableRow row : table.getRows()) {
                columns = Math.max(columns, row.getCells().size());
            }
            return columns;
        }

        private static Map<String, Object> language(String language) {
            if (language == null || language.isBlank()) {
                return null;
            }
            Map<String, Object> properties = new HashMap<>();
            properties.put("language", language);
            return properties;
        }

        private static void putIfPresent(Map<String, Object> properties, String key, String value) {
            if (value != null && !value.isBlank()) {
                properties.put(key, value);
            }
        }

        private static Map<String, Object> nullIfEmpty(Map<String, Object> properties) {
            return properties.isEmpty() ? null : properties;
        }
    }
}
