package org.dxworks.adocframe.model;

public class Verse extends DocumentElement {

    private final String content;
    private final String title;
    private final String author;
    private final String citation;

    public Verse(String content, String title, String author, String citation) {
        super("verse");
        this.content = content == null ? "" : content;
        this.title = title;
        this.author = author;
        this.citation = citation;
    }

    public String getContent() {
        return content;
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public String getCitation() {
        return citation;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
