package org.dxworks.adocframe.model;

public class Literal extends DocumentElement {

    private final String content;
    private final String title;

    public Literal(String content) {
        this(content, null);
    }

    public Literal(String content, String title) {
        super("literal");
        this.content = content == null ? "" : content;
        this.title = title;
    }

    public String getContent() {
        return content;
    }

    public String getTitle() {
        return title;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
