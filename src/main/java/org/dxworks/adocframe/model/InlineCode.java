package org.dxworks.adocframe.model;

public class InlineCode extends DocumentElement {

    private final String content;

    public InlineCode(String content) {
        super("inlinecode");
        this.content = content == null ? "" : content;
    }

    public String getContent() {
        return content;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
