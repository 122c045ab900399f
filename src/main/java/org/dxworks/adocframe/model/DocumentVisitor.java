package org.dxworks.adocframe.model;

/**
 * One callback per node kind. Every {@link DocumentElement} subtype dispatches to its own
 * overload, so adding a node kind means adding a method here and handling it in every
 * visitor.
 */
public interface DocumentVisitor {

    void visit(Document document);

    void visit(Section section);

    void visit(Paragraph paragraph);

    void visit(ListBlock list);

    void visit(ListItem listItem);

    void visit(DescriptionList descriptionList);

    void visit(DescriptionListItem item);

    void visit(Table table);

    void visit(TableHeader tableHeader);

    void visit(TableRow tableRow);

    void visit(TableCell tableCell);

    void visit(CodeBlock codeBlock);

    void visit(Listing listing);

    void visit(Literal literal);

    void visit(Verse verse);

    void visit(Passthrough passthrough);

    void visit(BlockQuote blockQuote);

    void visit(Sidebar sidebar);

    void visit(Example example);

    void visit(Open open);

    void visit(Admonition admonition);

    void visit(Anchor anchor);

    void visit(CrossReference crossReference);

    void visit(Footnote footnote);

    void visit(TableOfContents toc);

    void visit(TableOfContentsEntry entry);

    void visit(Macro macro);

    void visit(ImageMacro imageMacro);

    void visit(VideoMacro videoMacro);

    void visit(IncludeMacro includeMacro);

    void visit(Text text);

    void visit(Emphasis emphasis);

    void visit(Strong strong);

    void visit(Highlight highlight);

    void visit(Superscript superscript);

    void visit(Subscript subscript);

    void visit(InlineCode inlineCode);

    void visit(Link link);

    void visit(Image image);
}
