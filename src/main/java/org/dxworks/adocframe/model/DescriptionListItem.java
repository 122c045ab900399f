package org.dxworks.adocframe.model;

public class DescriptionListItem extends DocumentElement {

    private final String term;
    private final String description;

    public DescriptionListItem(String term, String description) {
        super("dlistitem");
        this.term = term == null ? "" : term;
        this.description = description == null ? "" : description;
    }

    public String getTerm() {
        return term;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
