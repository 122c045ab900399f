package org.dxworks.adocframe.model;

/**
 * A footnote definition, or a reference back to an earlier definition with the same id.
 */
public class Footnote extends DocumentElement {

    private final String id;
    private final String text;
    private final String referenceLabel;
    private final boolean reference;

    public Footnote(String id, String text, String referenceLabel, boolean reference) {
        super("footnote");
        this.id = id;
        this.text = text == null ? "" : text;
        this.referenceLabel = referenceLabel;
        this.reference = reference;
    }

    public String getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public String getReferenceLabel() {
        return referenceLabel;
    }

    public boolean isReference() {
        return reference;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
