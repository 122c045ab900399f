package org.dxworks.adocframe.model;

public class Subscript extends FormattedText {

    public Subscript(String text) {
        super("subscript", text);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
