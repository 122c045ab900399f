package org.dxworks.adocframe.model;

public class Open extends CompoundBlock {

    private final String masqueradeType;

    public Open() {
        this(null, null);
    }

    /**
     * @param masqueradeType the block style an open block stands in for, e.g. {@code sidebar}
     *                       for {@code [sidebar]} followed by {@code --}; null for a plain open block
     */
    public Open(String title, String masqueradeType) {
        super("open", title);
        this.masqueradeType = masqueradeType;
    }

    public String getMasqueradeType() {
        return masqueradeType;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
