package org.dxworks.adocframe.model;

public class Emphasis extends FormattedText {

    public Emphasis(String text) {
        super("emphasis", text);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
