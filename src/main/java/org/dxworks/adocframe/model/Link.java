package org.dxworks.adocframe.model;

public class Link extends DocumentElement {

    private final String url;
    private final String text;
    private final String title;

    public Link(String url, String text) {
        this(url, text, null);
    }

    public Link(String url, String text, String title) {
        super("link");
        this.url = url;
        this.text = text == null || text.isEmpty() ? url : text;
        this.title = title;
    }

    public String getUrl() {
        return url;
    }

    public String getText() {
        return text;
    }

    public String getTitle() {
        return title;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
