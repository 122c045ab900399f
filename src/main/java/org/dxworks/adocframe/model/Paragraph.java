package org.dxworks.adocframe.model;

public class Paragraph extends DocumentElement {

    private final String plainText;

    public Paragraph() {
        super("paragraph");
        this.plainText = null;
    }

    public Paragraph(String text) {
        super("paragraph");
        if (text == null) {
            throw new IllegalArgumentException("Paragraph text cannot be null");
        }
        this.plainText = text;
    }

    /**
     * The paragraph's text: the plain-text fallback when one was given, otherwise the
     * concatenated text of its inline children.
     */
    public String getText() {
        if (plainText != null) {
            return plainText;
        }
        StringBuilder text = new StringBuilder();
        for (DocumentElement child : getChildren()) {
            text.append(textOf(child));
        }
        return text.toString();
    }

    private static String textOf(DocumentElement element) {
        if (element instanceof Text text) {
            return text.getContent();
        }
        if (element instanceof FormattedText formatted) {
            return formatted.getText();
        }
        if (element instanceof InlineCode code) {
            return code.getContent();
        }
        if (element instanceof Link link) {
            return link.getText();
        }
        if (element instanceof Image image) {
            return image.getAlt();
        }
        return "";
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
