package org.dxworks.adocframe.model;

import java.util.List;

public class TableOfContentsEntry extends DocumentElement {

    private final String title;
    private final int level;
    private final String anchorId;

    public TableOfContentsEntry(String title, int level, String anchorId) {
        super("tocentry");
        this.title = title;
        this.level = level;
        this.anchorId = anchorId;
    }

    public String getTitle() {
        return title;
    }

    public int getLevel() {
        return level;
    }

    public String getAnchorId() {
        return anchorId;
    }

    public void addEntry(TableOfContentsEntry entry) {
        addChild(entry);
    }

    public List<TableOfContentsEntry> getEntries() {
        return childrenOfType(TableOfContentsEntry.class);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
