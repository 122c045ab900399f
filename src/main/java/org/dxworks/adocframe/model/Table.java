package org.dxworks.adocframe.model;

import java.util.List;

/**
 * A table. Body rows are children; the optional header row is kept apart and is only
 * set when the table opts into a header through its {@code options} attribute.
 */
public class Table extends DocumentElement {

    private TableHeader header;
    private String title;

    public Table() {
        super("table");
    }

    public TableHeader getHeader() {
        return header;
    }

    public void setHeader(TableHeader header) {
        if (this.header != null) {
            removeChild(this.header);
        }
        this.header = header;
        if (header != null) {
            addChild(header);
        }
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public void addRow(TableRow row) {
        addChild(row);
    }

    public List<TableRow> getRows() {
        return childrenOfType(TableRow.class);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
