package org.dxworks.adocframe.model;

import java.util.Objects;

public class Admonition extends DocumentElement {

    private final AdmonitionType type;
    private final String content;
    private final String title;

    public Admonition(AdmonitionType type, String content) {
        this(type, content, null);
    }

    public Admonition(AdmonitionType type, String content, String title) {
        super("admonition");
        this.type = Objects.requireNonNull(type, "type");
        this.content = content == null ? "" : content;
        this.title = title;
    }

    public AdmonitionType getType() {
        return type;
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
