package org.dxworks.adocframe.converter;

import org.dxworks.adocframe.model.Document;
import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.Footnote;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * State of one conversion: the elements being rendered, outermost last, and the footnote
 * definitions met so far, keyed by label.
 */
public class ConverterContext {

    private final Document document;
    private final ConverterOptions options;
    private final Deque<DocumentElement> elementStack = new ArrayDeque<>();
    private final Map<String, Footnote> footnotes = new LinkedHashMap<>();

    public ConverterContext(Document document, ConverterOptions options) {
        this.document = Objects.requireNonNull(document, "document");
        this.options = Objects.requireNonNull(options, "options");
    }

    public Document getDocument() {
        return document;
    }

    public ConverterOptions getOptions() {
        return options;
    }

    public void pushElement(DocumentElement element) {
        elementStack.push(Objects.requireNonNull(element, "element"));
    }

    public DocumentElement popElement() {
        if (elementStack.isEmpty()) {
            throw new IllegalStateException("Cannot pop from empty element stack");
        }
        return elementStack.pop();
    }

    public DocumentElement getCurrentElement() {
        return elementStack.peek();
    }

    /**
     * Records a footnote definition. Returns false when a definition with the same label
     * was already recorded.
     */
    public boolean addFootnote(Footnote footnote) {
        return footnotes.putIfAbsent(footnote.getReferenceLabel(), footnote) == null;
    }

    public List<Footnote> getFootnotes() {
        return Collections.unmodifiableList(new ArrayList<>(footnotes.values()));
    }
}
