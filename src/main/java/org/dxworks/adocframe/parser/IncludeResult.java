package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.DocumentElement;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of resolving one include directive: the parsed blocks of the included file, or
 * the reason a required file could not be read.
 */
public final class IncludeResult {

    private final List<DocumentElement> elements;
    private final String message;

    private IncludeResult(List<DocumentElement> elements, String message) {
        this.elements = elements;
        this.message = message;
    }

    public static IncludeResult resolved(List<DocumentElement> elements) {
        return new IncludeResult(Collections.unmodifiableList(elements), null);
    }

    public static IncludeResult failed(String message) {
        return new IncludeResult(Collections.emptyList(), Objects.requireNonNull(message, "message"));
    }

    public boolean isFailed() {
        return message != null;
    }

    public List<DocumentElement> getElements() {
        return elements;
    }

    public String getMessage() {
        return message;
    }
}
