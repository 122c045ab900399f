package org.dxworks.adocframe.model;

/**
 * Raw content that is emitted without escaping or any further processing.
 */
public class Passthrough extends DocumentElement {

    private final String content;
    private final String title;
    private final String substitutions;

    public Passthrough(String content) {
        this(content, null, null);
    }

    public Passthrough(String content, String title, String substitutions) {
        super("passthrough");
        this.content = content == null ? "" : content;
        this.title = title;
        this.substitutions = substitutions;
    }

    public String getContent() {
        return content;
    }

    public String getTitle() {
        return title;
    }

    public String getSubstitutions() {
        return substitutions;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
