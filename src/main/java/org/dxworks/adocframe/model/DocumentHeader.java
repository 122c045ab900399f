package org.dxworks.adocframe.model;

public class DocumentHeader {

    private final String title;
    private final String author;
    private final String email;
    private final String revision;
    private final String date;
    private final DocumentAttributes attributes = new DocumentAttributes();

    public DocumentHeader() {
        this(null, null, null, null, null);
    }

    public DocumentHeader(String title) {
        this(title, null, null, null, null);
    }

    public DocumentHeader(String title, String author, String email, String revision, String date) {
        this.title = title;
        this.author = author;
        this.email = email;
        this.revision = revision;
        this.date = date;
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public String getEmail() {
        return email;
    }

    public String getRevision() {
        return revision;
    }

    public String getDate() {
        return date;
    }

    public DocumentAttributes getAttributes() {
        return attributes;
    }

    public DocumentHeader withTitle(String newTitle) {
        return new DocumentHeader(newTitle, author, email, revision, date);
    }
}
