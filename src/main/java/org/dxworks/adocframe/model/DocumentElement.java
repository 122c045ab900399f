package org.dxworks.adocframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base node of the parsed document tree.
 * <p>
 * Every node owns its children exclusively. {@link #addChild(DocumentElement)} sets the
 * child's parent and, when the child already belongs to another node, detaches it from
 * that node first, so a node is never reachable from two parents. The parent link is a
 * plain back reference and is kept in sync by {@code addChild} / {@code removeChild} only.
 */
public abstract class DocumentElement {

    private final String elementType;
    private final DocumentAttributes attributes = new DocumentAttributes();
    private final List<DocumentElement> children = new ArrayList<>();
    private DocumentElement parent;

    protected DocumentElement(String elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    public String getElementType() {
        return elementType;
    }

    public DocumentAttributes getAttributes() {
        return attributes;
    }

    public DocumentElement getParent() {
        return parent;
    }

    public List<DocumentElement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(DocumentElement child) {
        Objects.requireNonNull(child, "child");
        if (child == this) {
            throw new IllegalArgumentException("An element cannot be its own child");
        }
        if (child.parent != null) {
            child.parent.removeChild(child);
        }
        child.parent = this;
        children.add(child);
    }

    public boolean removeChild(DocumentElement child) {
        Objects.requireNonNull(child, "child");
        if (children.remove(child)) {
            child.parent = null;
            return true;
        }
        return false;
    }

    /**
     * Moves every child of this node, in order, to {@code target}.
     */
    public void moveChildrenTo(DocumentElement target) {
        for (DocumentElement child : new ArrayList<>(children)) {
            target.addChild(child);
        }
    }

    protected <T extends DocumentElement> List<T> childrenOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (DocumentElement child : children) {
            if (type.isInstance(child)) {
                result.add(type.cast(child));
            }
        }
        return result;
    }

    public abstract void accept(DocumentVisitor visitor);
}
