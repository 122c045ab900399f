package org.dxworks.adocframe.converter;

import org.dxworks.adocframe.model.Admonition;
import org.dxworks.adocframe.model.Anchor;
import org.dxworks.adocframe.model.BlockQuote;
import org.dxworks.adocframe.model.CodeBlock;
import org.dxworks.adocframe.model.CrossReference;
import org.dxworks.adocframe.model.DescriptionList;
import org.dxworks.adocframe.model.DescriptionListItem;
import org.dxworks.adocframe.model.Document;
import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.DocumentHeader;
import org.dxworks.adocframe.model.DocumentVisitor;
import org.dxworks.adocframe.model.Emphasis;
import org.dxworks.adocframe.model.Example;
import org.dxworks.adocframe.model.Footnote;
import org.dxworks.adocframe.model.Highlight;
import org.dxworks.adocframe.model.Image;
import org.dxworks.adocframe.model.ImageMacro;
import org.dxworks.adocframe.model.IncludeMacro;
import org.dxworks.adocframe.model.InlineCode;
import org.dxworks.adocframe.model.Link;
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
import org.dxworks.adocframe.model.Subscript;
import org.dxworks.adocframe.model.Superscript;
import org.dxworks.adocframe.model.Table;
import org.dxworks.adocframe.model.TableCell;
import org.dxworks.adocframe.model.TableHeader;
import org.dxworks.adocframe.model.TableOfContents;
import org.dxworks.adocframe.model.TableOfContentsEntry;
import org.dxworks.adocframe.model.TableRow;
import org.dxworks.adocframe.model.Text;
import org.dxworks.adocframe.model.Verse;
import org.dxworks.adocframe.model.VideoMacro;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a parsed {@link Document} as HTML5.
 * <p>
 * Block elements end with a line break; inline elements are written without one. Text is
 * escaped on output only, except for passthrough content, which is written as is.
 */
public class HtmlDocumentConverter {

    static final String DEFAULT_TITLE = "AsciiDoc Document";

    private static final String STYLESHEET_RESOURCE = "default-style.css";

    public String convert(Document document) {
        return convert(document, ConverterOptions.defaults());
    }

    public String convert(Document document, ConverterOptions options) {
        Objects.requireNonNull(document, "document");
        ConverterContext context = new ConverterContext(document, options == null ? ConverterOptions.defaults() : options);
        HtmlVisitor visitor = new HtmlVisitor(context);
        visitor.render(document);
        String body = visitor.html.toString();
        return context.getOptions().isStandalone() ? wrap(body, document, context.getOptions()) : body;
    }

    private static String wrap(String body, Document document, ConverterOptions options) {
        String title = escape(document.getHeader() != null && document.getHeader().getTitle() != null
                ? document.getHeader().getTitle()
                : DEFAULT_TITLE);
        String charset = escape(options.getOutputEncoding());
        if (!options.isPrettyPrint()) {
            return "<!DOCTYPE html><html><head><meta charset=\"" + charset + "\"><title>" + title
                    + "</title></head><body>" + body + "</body></html>";
        }
        String style = StylesheetHolder.STYLESHEET.lines()
                .map(line -> "        " + line)
                .collect(Collectors.joining("\n"));
        return "<!DOCTYPE html>\n"
                + "<html>\n"
                + "<head>\n"
                + "    <meta charset=\"" + charset + "\">\n"
                + "    <title>" + title + "</title>\n"
                + "    <style>\n"
                + style + "\n"
                + "    </style>\n"
                + "</head>\n"
                + "<body>\n"
                + body
                + "</body>\n"
                + "</html>\n";
    }

    static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static class StylesheetHolder {
        private static final String STYLESHEET = load();

        private static String load() {
            try (InputStream in = HtmlDocumentConverter.class.getResourceAsStream(STYLESHEET_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing resource " + STYLESHEET_RESOURCE);
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    private static class HtmlVisitor implements DocumentVisitor {

        private final ConverterContext context;
        private final StringBuilder html = new StringBuilder();

        private HtmlVisitor(ConverterContext context) {
            this.context = context;
        }

        private void render(DocumentElement element) {
            context.pushElement(element);
            try {
                element.accept(this);
            } finally {
                context.popElement();
            }
        }

        private void renderChildren(DocumentElement element) {
            for (DocumentElement child : element.getChildren()) {
                render(child);
            }
        }

        private void titleDiv(String title) {
            if (hasText(title)) {
                html.append("<div class=\"title\">").append(escape(title)).append("</div>\n");
            }
        }

        @Override
        public void visit(Document document) {
            header(document.getHeader());
            renderChildren(document);
            footnotes();
        }

        private void header(DocumentHeader header) {
            if (header == null) {
                return;
            }
            if (hasText(header.getTitle())) {
                html.append("<h1>").append(escape(header.getTitle())).append("</h1>\n");
            }
            if (hasText(header.getAuthor())) {
                html.append("<div class=\"author\">").append(escape(header.getAuthor())).append("</div>\n");
            }
            if (hasText(header.getEmail())) {
                html.append("<div class=\"email\"><a href=\"mailto:").append(escape(header.getEmail())).append("\">")
                        .append(escape(header.getEmail())).append("</a></div>\n");
            }
            if (hasText(header.getRevision()) || hasText(header.getDate())) {
                String revision = hasText(header.getRevision()) && hasText(header.getDate())
                        ? header.getRevision() + ", " + header.getDate()
                        : hasText(header.getRevision()) ? header.getRevision() : header.getDate();
                html.append("<div class=\"revision\">").append(escape(revision)).append("</div>\n");
            }
        }

        private void footnotes() {
            List<Footnote> definitions = context.getFootnotes();
            if (definitions.isEmpty()) {
                return;
            }
            html.append("<div id=\"footnotes\">\n<hr>\n");
            for (Footnote footnote : definitions) {
                String label = escape(footnote.getReferenceLabel());
                html.append("<div class=\"footnote\" id=\"_footnotedef_").append(label).append("\">\n")
                        .append("<a href=\"#_footnoteref_").append(label).append("\">").append(label).append("</a>. ")
                        .append(escape(footnote.getText())).append("\n</div>\n");
            }
            html.append("</div>\n");
        }

        @Override
        public void visit(Section section) {
            if (!section.getTitle().isEmpty()) {
                int level = Math.min(6, section.getLevel() + 1);
                html.append("<h").append(level);
                if (hasText(section.getId())) {
                    html.append(" id=\"").append(escape(section.getId())).append("\"");
                }
                html.append(">").append(escape(section.getTitle())).append("</h").append(level).append(">\n");
            }
            renderChildren(section);
        }

        @Override
        public void visit(Paragraph paragraph) {
            html.append("<p>");
            if (paragraph.getChildren().isEmpty()) {
                html.append(escape(paragraph.getText()));
            } else {
                renderChildren(paragraph);
            }
            html.append("</p>\n");
        }

        /**
         * Items deeper than the first one open a nested {@code ul} inside the previous item.
         */
        @Override
        public void visit(ListBlock list) {
            String tag = list.getType() == ListType.ORDERED ? "ol" : "ul";
            html.append("<").append(tag);
            if (list.getType() == ListType.ORDERED && list.getStartNumber() > 1) {
                html.append(" start=\"").append(list.getStartNumber()).append("\"");
            }
            html.append(">\n");

            List<ListItem> items = list.getItems();
            int baseLevel = items.isEmpty() ? 1 : items.get(0).getLevel();
            int depth = 1;
            boolean itemOpen = false;
            for (ListItem item : items) {
                int level = Math.max(1, item.getLevel() - baseLevel + 1);
                if (level > depth && itemOpen) {
                    html.append("\n");
                    for (; depth < level; depth++) {
                        html.append("<ul>\n");
                    }
                } else {
                    if (itemOpen) {
                        html.append("</li>\n");
                    }
                    for (; depth > level; depth--) {
                        html.append("</ul>\n</li>\n");
                    }
                }
                html.append("<li>");
                render(item);
                itemOpen = true;
            }
            if (itemOpen) {
                html.append("</li>\n");
            }
            for (; depth > 1; depth--) {
                html.append("</ul>\n</li>\n");
            }
            html.append("</").append(tag).append(">\n");
        }

        @Override
        public void visit(ListItem listItem) {
            if (listItem.isCheckbox()) {
                html.append("<input type=\"checkbox\" disabled").append(listItem.isChecked() ? " checked" : "").append("> ");
            }
            html.append(escape(listItem.getText()));
            renderChildren(listItem);
        }

        @Override
        public void visit(DescriptionList descriptionList) {
            html.append("<dl>\n");
            renderChildren(descriptionList);
            html.append("</dl>\n");
        }

        @Override
        public void visit(DescriptionListItem item) {
            html.append("<dt>").append(escape(item.getTerm())).append("</dt>\n");
            html.append("<dd>").append(escape(item.getDescription())).append("</dd>\n");
        }

        @Override
        public void visit(Table table) {
            html.append("<table class=\"tableblock frame-all grid-all\">\n");
            if (hasText(table.getTitle())) {
                html.append("<caption class=\"title\">").append(escape(table.getTitle())).append("</caption>\n");
            }
            if (table.getHeader() != null) {
                html.append("<thead>\n");
                render(table.getHeader());
                html.append("</thead>\n");
            }
            List<TableRow> rows = table.getRows();
            if (!rows.isEmpty()) {
                html.append("<tbody>\n");
                rows.forEach(this::render);
                html.append("</tbody>\n");
            }
            html.append("</table>\n");
        }

        @Override
        public void visit(TableHeader tableHeader) {
            html.append("<tr>");
            for (TableCell cell : tableHeader.getCells()) {
                cell(cell, true);
            }
            html.append("</tr>\n");
        }

        @Override
        public void visit(TableRow tableRow) {
            html.append("<tr>");
            for (TableCell cell : tableRow.getCells()) {
                cell(cell, tableRow.isHeader());
            }
            html.append("</tr>\n");
        }

        @Override
        public void visit(TableCell tableCell) {
            cell(tableCell, false);
        }

        private void cell(TableCell cell, boolean headerRow) {
            String tag = headerRow || cell.isHeader() ? "th" : "td";
            html.append("<").append(tag);
            if (cell.getColSpan() > 1) {
                html.append(" colspan=\"").append(cell.getColSpan()).append("\"");
            }
            if (cell.getRowSpan() > 1) {
                html.append(" rowspan=\"").append(cell.getRowSpan()).append("\"");
            }
            if (hasText(cell.getAlignment())) {
                html.append(" class=\"halign-").append(escape(cell.getAlignment())).append("\"");
            }
            html.append(">").append(escape(cell.getContent())).append("</").append(tag).append(">");
        }

        @Override
        public void visit(CodeBlock codeBlock) {
            html.append("<pre><code");
            if (hasText(codeBlock.getLanguage())) {
                html.append(" class=\"language-").append(escape(codeBlock.getLanguage())).append("\"");
            }
            html.append(">").append(escape(codeBlock.getContent())).append("</code></pre>\n");
        }

        @Override
        public void visit(Listing listing) {
            html.append("<div class=\"listingblock\">\n");
            titleDiv(listing.getTitle());
            html.append("<div class=\"content\">\n");
            if (hasText(listing.getLanguage())) {
                html.append("<pre><code class=\"language-").append(escape(listing.getLanguage())).append("\">")
                        .append(escape(listing.getContent())).append("</code></pre>\n");
            } else {
                html.append("<pre>").append(escape(listing.getContent())).append("</pre>\n");
            }
            html.append("</div>\n</div>\n");
        }

        @Override
        public void visit(Literal literal) {
            html.append("<div class=\"literalblock\">\n");
            titleDiv(literal.getTitle());
            html.append("<div class=\"content\">\n<pre>").append(escape(literal.getContent())).append("</pre>\n</div>\n</div>\n");
        }

        @Override
        public void visit(Verse verse) {
            html.append("<div class=\"verseblock\">\n");
            titleDiv(verse.getTitle());
            html.append("<pre class=\"content\">").append(escape(verse.getContent())).append("</pre>\n");
            if (hasText(verse.getAuthor()) || hasText(verse.getCitation())) {
                html.append("<div class=\"attribution\">\n");
                if (hasText(verse.getAuthor())) {
                    html.append("&#8212; ").append(escape(verse.getAuthor())).append("\n");
                }
                if (hasText(verse.getCitation())) {
                    html.append("<cite>").append(escape(verse.getCitation())).append("</cite>\n");
                }
                html.append("</div>\n");
            }
            html.append("</div>\n");
        }

        @Override
        public void visit(Passthrough passthrough) {
            html.append(passthrough.getContent());
            if (!passthrough.getContent().isEmpty() && !passthrough.getContent().endsWith("\n")) {
                html.append("\n");
            }
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            html.append("<blockquote>\n");
            String[] lines = blockQuote.getContent().split("\n");
            if (lines.length == 1) {
                html.append("<p>").append(escape(blockQuote.getContent())).append("</p>\n");
            } else {
                for (String line : lines) {
                    if (!line.isBlank()) {
                        html.append("<p>").append(escape(line.trim())).append("</p>\n");
                    }
                }
            }
            if (hasText(blockQuote.getAttribution())) {
                html.append("<cite>").append(escape(blockQuote.getAttribution()));
                if (hasText(blockQuote.getCite())) {
                    html.append(", <em>").append(escape(blockQuote.getCite())).append("</em>");
                }
                html.append("</cite>\n");
            }
            html.append("</blockquote>\n");
        }

        @Override
        public void visit(Sidebar sidebar) {
            compound("sidebarblock", sidebar.getTitle(), sidebar);
        }

        @Override
        public void visit(Example example) {
            compound("exampleblock", example.getTitle(), example);
        }

        @Override
        public void visit(Open open) {
            String cssClass = hasText(open.getMasqueradeType())
                    ? "openblock " + open.getMasqueradeType()
                    : "openblock";
            compound(cssClass, open.getTitle(), open);
        }

        private void compound(String cssClass, String title, DocumentElement block) {
            html.append("<div class=\"").append(escape(cssClass)).append("\">\n");
            titleDiv(title);
            html.append("<div class=\"content\">\n");
            renderChildren(block);
            html.append("</div>\n</div>\n");
        }

        @Override
        public void visit(Admonition admonition) {
            html.append("<div class=\"admonitionblock ").append(admonition.getType().cssClass()).append("\">\n")
                    .append("<table>\n<tr>\n")
                    .append("<td class=\"icon\"><div class=\"title\">").append(admonition.getType().name()).append("</div></td>\n")
                    .append("<td class=\"content\">\n");
            titleDiv(admonition.getTitle());
            html.append("<div class=\"paragraph\"><p>").append(escape(admonition.getContent())).append("</p></div>\n")
                    .append("</td>\n</tr>\n</table>\n</div>\n");
        }

        @Override
        public void visit(Anchor anchor) {
            html.append("<a id=\"").append(escape(anchor.getId())).append("\">");
            if (hasText(anchor.getLabel())) {
                html.append(escape(anchor.getLabel()));
            }
            html.append("</a>");
        }

        @Override
        public void visit(CrossReference crossReference) {
            String text = hasText(crossReference.getLinkText()) ? crossReference.getLinkText() : crossReference.getTargetId();
            html.append("<a href=\"#").append(escape(crossReference.getTargetId())).append("\" class=\"xref\">")
                    .append(escape(text)).append("</a>");
        }

        /**
         * Definitions and references both link to the definition at the end of the document;
         * the first definition with a label also carries the back-link target.
         */
        @Override
        public void visit(Footnote footnote) {
            String label = escape(footnote.getReferenceLabel());
            html.append("<a href=\"#_footnotedef_").append(label).append("\" class=\"footnote\"");
            if (!footnote.isReference() && context.addFootnote(footnote)) {
                html.append(" id=\"_footnoteref_").append(label).append("\"");
            }
            if (footnote.isReference() && hasText(footnote.getText())) {
                html.append(" title=\"").append(escape(footnote.getText())).append("\"");
            }
            html.append("><sup>").append(label).append("</sup></a>");
        }

        @Override
        public void visit(TableOfContents toc) {
            html.append("<div class=\"toc\">\n");
            if (hasText(toc.getTitle())) {
                html.append("<div class=\"toc-title\">").append(escape(toc.getTitle())).append("</div>\n");
            }
            if (!toc.getEntries().isEmpty()) {
                html.append("<ul>\n");
                toc.getEntries().forEach(this::render);
                html.append("</ul>\n");
            }
            html.append("</div>\n");
        }

        @Override
        public void visit(TableOfContentsEntry entry) {
            html.append("<li><a href=\"#").append(escape(entry.getAnchorId())).append("\">")
                    .append(escape(entry.getTitle())).append("</a>");
            if (!entry.getEntries().isEmpty()) {
                html.append("\n<ul>\n");
                entry.getEntries().forEach(this::render);
                html.append("</ul>\n");
            }
            html.append("</li>\n");
        }

        @Override
        public void visit(Macro macro) {
            html.append("<span class=\"macro ").append(escape(macro.getName())).append("\"")
                    .append(" data-macro=\"").append(escape(macro.getName())).append("\"")
                    .append(" data-target=\"").append(escape(macro.getTarget())).append("\"");
            for (Map.Entry<String, String> parameter : macro.getParameters().entrySet()) {
                html.append(" data-").append(escape(parameter.getKey())).append("=\"").append(escape(parameter.getValue())).append("\"");
            }
            String parameters = macro.getParameters().entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining(","));
            html.append(">").append(escape(macro.getName())).append("::").append(escape(macro.getTarget()))
                    .append("[").append(escape(parameters)).append("]</span>");
            endBlockMacro(macro);
        }

        @Override
        public void visit(ImageMacro imageMacro) {
            if (hasText(imageMacro.getLink())) {
                html.append("<a href=\"").append(escape(imageMacro.getLink())).append("\">");
            }
            html.append("<img src=\"").append(escape(imageMacro.getSource())).append("\"")
                    .append(" alt=\"").append(escape(imageMacro.getAlt())).append("\"");
            if (hasText(imageMacro.getTitle())) {
                html.append(" title=\"").append(escape(imageMacro.getTitle())).append("\"");
            }
            if (imageMacro.getWidth() != null) {
                html.append(" width=\"").append(imageMacro.getWidth()).append("\"");
            }
            if (imageMacro.getHeight() != null) {
                html.append(" height=\"").append(imageMacro.getHeight()).append("\"");
            }
            if (hasText(imageMacro.getAlign())) {
                html.append(" class=\"align-").append(escape(imageMacro.getAlign())).append("\"");
            }
            html.append("/>");
            if (hasText(imageMacro.getLink())) {
                html.append("</a>");
            }
            endBlockMacro(imageMacro);
        }

        @Override
        public void visit(VideoMacro videoMacro) {
            html.append("<video");
            if (videoMacro.getWidth() != null) {
                html.append(" width=\"").append(videoMacro.getWidth()).append("\"");
            }
            if (videoMacro.getHeight() != null) {
                html.append(" height=\"").append(videoMacro.getHeight()).append("\"");
            }
            if (videoMacro.isControls()) {
                html.append(" controls");
            }
            if (videoMacro.isAutoPlay()) {
                html.append(" autoplay");
            }
            if (videoMacro.isLoop()) {
                html.append(" loop");
            }
            if (videoMacro.isMuted()) {
                html.append(" muted");
            }
            if (hasText(videoMacro.getPoster())) {
                html.append(" poster=\"").append(escape(videoMacro.getPoster())).append("\"");
            }
            html.append("><source src=\"").append(escape(videoMacro.getSource())).append("\" type=\"video/")
                    .append(escape(videoMacro.getVideoFormat())).append("\">")
                    .append("Your browser does not support the video tag.</video>");
            if (hasText(videoMacro.getTitle())) {
                html.append("\n<div class=\"video-title\">").append(escape(videoMacro.getTitle())).append("</div>");
            }
            endBlockMacro(videoMacro);
        }

        @Override
        public void visit(IncludeMacro includeMacro) {
            html.append("<!-- Include: ").append(escape(includeMacro.getFilePath()));
            if (hasText(includeMacro.getLines())) {
                html.append(" (lines: ").append(escape(includeMacro.getLines())).append(")");
            }
            if (hasText(includeMacro.getTags())) {
                html.append(" (tags: ").append(escape(includeMacro.getTags())).append(")");
            }
            html.append(" -->");
            endBlockMacro(includeMacro);
        }

        private void endBlockMacro(Macro macro) {
            if (macro.getMacroType() == MacroType.BLOCK) {
                html.append("\n");
            }
        }

        @Override
        public void visit(Text text) {
            html.append(escape(text.getContent()));
        }

        @Override
        public void visit(Emphasis emphasis) {
            html.append("<em>").append(escape(emphasis.getText())).append("</em>");
        }

        @Override
        public void visit(Strong strong) {
            html.append("<strong>").append(escape(strong.getText())).append("</strong>");
        }

        @Override
        public void visit(Highlight highlight) {
            html.append("<mark>").append(escape(highlight.getText())).append("</mark>");
        }

        @Override
        public void visit(Superscript superscript) {
            html.append("<sup>").append(escape(superscript.getText())).append("</sup>");
        }

        @Override
        public void visit(Subscript subscript) {
            html.append("<sub>").append(escape(subscript.getText())).append("</sub>");
        }

        @Override
        public void visit(InlineCode inlineCode) {
            html.append("<code>").append(escape(inlineCode.getContent())).append("</code>");
        }

        @Override
        public void visit(Link link) {
            html.append("<a href=\"").append(escape(link.getUrl())).append("\"");
            if (hasText(link.getTitle())) {
                html.append(" title=\"").append(escape(link.getTitle())).append("\"");
            }
            html.append(">").append(escape(link.getText())).append("</a>");
        }

        @Override
        public void visit(Image image) {
            html.append("<img src=\"").append(escape(image.getSrc())).append("\" alt=\"").append(escape(image.getAlt())).append("\"");
            if (hasText(image.getTitle())) {
                html.append(" title=\"").append(escape(image.getTitle())).append("\"");
            }
            html.append("/>");
        }
    }
}
