package org.dxworks.adocframe.model;

/**
 * Visitor that walks the whole tree in document order. Override the callbacks of
 * interest and call {@link #visitChildren(DocumentElement)} to keep descending.
 */
public abstract class AbstractDocumentVisitor implements DocumentVisitor {

    protected void visitChildren(DocumentElement parent) {
        for (DocumentElement child : parent.getChildren()) {
            child.accept(this);
        }
    }

    @Override
    public void visit(Document document) {
        visitChildren(document);
    }

    @Override
    public void visit(Section section) {
        visitChildren(section);
    }

    @Override
    public void visit(Paragraph paragraph) {
        visitChildren(paragraph);
    }

    @Override
    public void visit(ListBlock list) {
        visitChildren(list);
    }

    @Override
    public void visit(ListItem listItem) {
        visitChildren(listItem);
    }

    @Override
    public void visit(DescriptionList descriptionList) {
        visitChildren(descriptionList);
    }

    @Override
    public void visit(DescriptionListItem item) {
        visitChildren(item);
    }

    @Override
    public void visit(Table table) {
        visitChildren(table);
    }

    @Override
    public void visit(TableHeader tableHeader) {
        visitChildren(tableHeader);
    }

    @Override
    public void visit(TableRow tableRow) {
        visitChildren(tableRow);
    }

    @Override
    public void visit(TableCell tableCell) {
        visitChildren(tableCell);
    }

    @Override
    public void visit(CodeBlock codeBlock) {
        visitChildren(codeBlock);
    }

    @Override
    public void visit(Listing listing) {
        visitChildren(listing);
    }

    @Override
    public void visit(Literal literal) {
        visitChildren(literal);
    }

    @Override
    public void visit(Verse verse) {
        visitChildren(verse);
    }

    @Override
    public void visit(Passthrough passthrough) {
        visitChildren(passthrough);
    }

    @Override
    public void visit(BlockQuote blockQuote) {
        visitChildren(blockQuote);
    }

    @Override
    public void visit(Sidebar sidebar) {
        visitChildren(sidebar);
    }

    @Override
    public void visit(Example example) {
        visitChildren(example);
    }

    @Override
    public void visit(Open open) {
        visitChildren(open);
    }

    @Override
    public void visit(Admonition admonition) {
        visitChildren(admonition);
    }

    @Override
    public void visit(Anchor anchor) {
        visitChildren(anchor);
    }

    @Override
    public void visit(CrossReference crossReference) {
        visitChildren(crossReference);
    }

    @Override
    public void visit(Footnote footnote) {
        visitChildren(footnote);
    }

    @Override
    public void visit(TableOfContents toc) {
        visitChildren(toc);
    }

    @Override
    public void visit(TableOfContentsEntry entry) {
        visitChildren(entry);
    }

    @Override
    public void visit(Macro macro) {
        visitChildren(macro);
    }

    @Override
    public void visit(ImageMacro imageMacro) {
        visitChildren(imageMacro);
    }

    @Override
    public void visit(VideoMacro videoMacro) {
        visitChildren(videoMacro);
    }

    @Override
    public void visit(IncludeMacro includeMacro) {
        visitChildren(includeMacro);
    }

    @Override
    public void visit(Text text) {
        visitChildren(text);
    }

    @Override
    public void visit(Emphasis emphasis) {
        visitChildren(emphasis);
    }

    @Override
    public void visit(Strong strong) {
        visitChildren(strong);
    }

    @Override
    public void visit(Highlight highlight) {
        visitChildren(highlight);
    }

    @Override
    public void visit(Superscript superscript) {
        visitChildren(superscript);
    }

    @Override
    public void visit(Subscript subscript) {
        visitChildren(subscript);
    }

    @Override
    public void visit(InlineCode inlineCode) {
        visitChildren(inlineCode);
    }

    @Override
    public void visit(Link link) {
        visitChildren(link);
    }

    @Override
    public void visit(Image image) {
        visitChildren(image);
    }
}
