package org.dxworks.adocframe.model;

public class Image extends DocumentElement {

    private final String src;
    private final String alt;
    private final String title;

    public Image(String src, String alt) {
        this(src, alt, null);
    }

    public Image(String src, String alt, String title) {
        super("image");
        this.src = src;
        this.alt = alt == null ? "" : alt;
        this.title = title;
    }

    public String getSrc() {
        return src;
    }

    public String getAlt() {
        return alt;
    }

    public String getTitle() {
        return title;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
