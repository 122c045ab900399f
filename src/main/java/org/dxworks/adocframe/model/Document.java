package org.dxworks.adocframe.model;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed document. Top-level blocks are the document's children.
 */
public class Document extends DocumentElement {

    private DocumentHeader header;

    public Document() {
        this(new DocumentHeader());
    }

    public Document(DocumentHeader header) {
        super("document");
        this.header = Objects.requireNonNull(header, "header");
    }

    public DocumentHeader getHeader() {
        return header;
    }

    public void setHeader(DocumentHeader header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    public List<DocumentElement> getElements() {
        return getChildren();
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
