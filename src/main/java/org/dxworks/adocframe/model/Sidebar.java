package org.dxworks.adocframe.model;

public class Sidebar extends CompoundBlock {

    public Sidebar() {
        this(null);
    }

    public Sidebar(String title) {
        super("sidebar", title);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
