package org.dxworks.adocframe.parser;

import java.util.HashMap;
import java.util.Map;

/**
 * Numbers the footnotes of one document. Labels run 1, 2, 3... in order of first
 * appearance; a footnote id keeps the label it was first given, so a reference and its
 * definition always agree regardless of which comes first. Shared by every include
 * context of a parse.
 */
public class FootnoteRegistry {

    private final Map<String, Integer> labelsById = new HashMap<>();
    private int counter;

    public String define(String id) {
        if (id == null || id.isEmpty()) {
            return String.valueOf(++counter);
        }
        return labelFor(id);
    }

    public String reference(String id) {
        return labelFor(id);
    }

    public boolean isKnown(String id) {
        return labelsById.containsKey(id);
    }

    public int size() {
        return counter;
    }

    private String labelFor(String id) {
        return String.valueOf(labelsById.computeIfAbsent(id, key -> ++counter));
    }
}
