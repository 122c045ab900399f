package org.dxworks.adocframe.model;

public class CrossReference extends DocumentElement {

    private final String targetId;
    private final String linkText;

    public CrossReference(String targetId, String linkText) {
        super("xref");
        this.targetId = targetId == null ? "" : targetId;
        this.linkText = linkText == null ? "" : linkText;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getLinkText() {
        return linkText;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
