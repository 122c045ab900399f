package org.dxworks.adocframe.model;

/**
 * A titled section. Level 0 with an empty title marks the untitled container that
 * wraps the blocks of a multi-block include.
 */
public class Section extends DocumentElement {

    private final String title;
    private final int level;
    private String id;

    public Section(String title, int level) {
        super("section");
        if (level < 0) {
            throw new IllegalArgumentException("Section level cannot be negative: " + level);
        }
        this.title = title == null ? "" : title;
        this.level = level;
    }

    public static Section container() {
        return new Section("", 0);
    }

    public String getTitle() {
        return title;
    }

    public int getLevel() {
        return level;
    }

    public boolean isContainer() {
        return level == 0 && title.isEmpty();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
