package org.dxworks.adocframe.model;

public class TableCell extends DocumentElement {

    private final String content;
    private final boolean header;
    private int colSpan = 1;
    private int rowSpan = 1;
    private String alignment;

    public TableCell(String content) {
        this(content, false);
    }

    public TableCell(String content, boolean header) {
        super("tablecell");
        this.content = content == null ? "" : content;
        this.header = header;
    }

    public String getContent() {
        return content;
    }

    public boolean isHeader() {
        return header;
    }

    public int getColSpan() {
        return colSpan;
    }

    public void setColSpan(int colSpan) {
        this.colSpan = Math.max(1, colSpan);
    }

    public int getRowSpan() {
        return rowSpan;
    }

    public void setRowSpan(int rowSpan) {
        this.rowSpan = Math.max(1, rowSpan);
    }

    public String getAlignment() {
        return alignment;
    }

    // left, center or right
    public void setAlignment(String alignment) {
        this.alignment = alignment;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
