package org.dxworks.adocframe.model;

import java.util.List;

public class TableHeader extends DocumentElement {

    public TableHeader() {
        super("tableheader");
    }

    public void addCell(TableCell cell) {
        addChild(cell);
    }

    public List<TableCell> getCells() {
        return childrenOfType(TableCell.class);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
