package org.dxworks.adocframe.model;

public class Example extends CompoundBlock {

    public Example() {
        this(null);
    }

    public Example(String title) {
        super("example", title);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
