package org.dxworks.adocframe.model;

import java.util.List;

public class DescriptionList extends DocumentElement {

    public DescriptionList() {
        super("dlist");
    }

    public ListType getType() {
        return ListType.DEFINITION;
    }

    public List<DescriptionListItem> getItems() {
        return childrenOfType(DescriptionListItem.class);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
