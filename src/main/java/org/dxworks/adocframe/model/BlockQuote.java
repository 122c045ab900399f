package org.dxworks.adocframe.model;

public class BlockQuote extends DocumentElement {

    private final String content;
    private final String attribution;
    private final String cite;

    public BlockQuote(String content, String attribution, String cite) {
        super("blockquote");
        this.content = content == null ? "" : content;
        this.attribution = attribution == null ? "" : attribution;
        this.cite = cite == null ? "" : cite;
    }

    public String getContent() {
        return content;
    }

    public String getAttribution() {
        return attribution;
    }

    public String getCite() {
        return cite;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
