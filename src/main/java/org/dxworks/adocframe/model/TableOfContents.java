package org.dxworks.adocframe.model;

import java.util.List;

public class TableOfContents extends DocumentElement {

    public static final String DEFAULT_TITLE = "Table of Contents";
    public static final int DEFAULT_MAX_DEPTH = 3;

    private final String title;
    private final int maxDepth;

    public TableOfContents(String title, int maxDepth) {
        super("toc");
        this.title = title;
        this.maxDepth = maxDepth;
    }

    public String getTitle() {
        return title;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void addEntry(TableOfContentsEntry entry) {
        addChild(entry);
    }

    // top-level entries only, deeper ones hang off their parent entry
    public List<TableOfContentsEntry> getEntries() {
        return childrenOfType(TableOfContentsEntry.class);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
