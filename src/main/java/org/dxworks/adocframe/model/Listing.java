package org.dxworks.adocframe.model;

public class Listing extends DocumentElement {

    private final String content;
    private final String title;
    private final String language;

    public Listing(String content) {
        this(content, null, null);
    }

    public Listing(String content, String title, String language) {
        super("listing");
        this.content = content == null ? "" : content;
        this.title = title;
        this.language = language;
    }

    public String getContent() {
        return content;
    }

    public String getTitle() {
        return title;
    }

    public String getLanguage() {
        return language;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
