package org.dxworks.adocframe.model;

public class Text extends DocumentElement {

    private final String content;

    public Text(String content) {
        super("text");
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
