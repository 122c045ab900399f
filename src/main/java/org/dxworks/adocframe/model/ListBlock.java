package org.dxworks.adocframe.model;

import java.util.List;

public class ListBlock extends DocumentElement {

    private final ListType type;
    private final int startNumber;

    public ListBlock(ListType type) {
        this(type, 1);
    }

    public ListBlock(ListType type, int startNumber) {
        super("list");
        this.type = type;
        this.startNumber = startNumber;
    }

    public ListType getType() {
        return type;
    }

    public int getStartNumber() {
        return startNumber;
    }

    public List<ListItem> getItems() {
        return childrenOfType(ListItem.class);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
