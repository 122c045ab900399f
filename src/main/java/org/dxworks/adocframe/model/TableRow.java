package org.dxworks.adocframe.model;

import java.util.List;

public class TableRow extends DocumentElement {

    private final boolean header;

    public TableRow() {
        this(false);
    }

    public TableRow(boolean header) {
        super("tablerow");
        this.header = header;
    }

    public boolean isHeader() {
        return header;
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
