package org.dxworks.adocframe.model;

/**
 * Inline span whose only payload is its text (strong, emphasis, highlight, super/subscript).
 */
public abstract class FormattedText extends DocumentElement {

    private final String text;

    protected FormattedText(String elementType, String text) {
        super(elementType);
        this.text = text == null ? "" : text;
    }

    public String getText() {
        return text;
    }
}
