package org.dxworks.adocframe.model;

public class Strong extends FormattedText {

    public Strong(String text) {
        super("strong", text);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
