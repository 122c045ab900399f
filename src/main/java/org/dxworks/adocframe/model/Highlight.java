package org.dxworks.adocframe.model;

public class Highlight extends FormattedText {

    public Highlight(String text) {
        super("highlight", text);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
