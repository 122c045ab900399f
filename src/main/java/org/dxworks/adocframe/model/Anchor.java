package org.dxworks.adocframe.model;

public class Anchor extends DocumentElement {

    private final String id;
    private final String label;

    public Anchor(String id, String label) {
        super("anchor");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Anchor id cannot be null or blank");
        }
        this.id = id;
        this.label = label == null ? "" : label;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
