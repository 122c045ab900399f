package org.dxworks.adocframe.model;

public class Superscript extends FormattedText {

    public Superscript(String text) {
        super("superscript", text);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
