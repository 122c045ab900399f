package org.dxworks.adocframe.model;

public class ListItem extends DocumentElement {

    private final String text;
    private final int level;
    private final boolean checkbox;
    private final boolean checked;

    public ListItem(String text, int level) {
        this(text, level, false, false);
    }

    public ListItem(String text, int level, boolean checkbox, boolean checked) {
        super("listitem");
        this.text = text == null ? "" : text;
        this.level = level;
        this.checkbox = checkbox;
        this.checked = checkbox && checked;
    }

    public String getText() {
        return text;
    }

    public int getLevel() {
        return level;
    }

    public boolean isCheckbox() {
        return checkbox;
    }

    public boolean isChecked() {
        return checked;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
