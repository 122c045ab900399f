package org.dxworks.adocframe.model;

/**
 * Delimited block whose body is parsed as nested blocks.
 */
public abstract class CompoundBlock extends DocumentElement {

    private final String title;

    protected CompoundBlock(String elementType, String title) {
        super(elementType);
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
