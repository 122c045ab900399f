package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.Anchor;
import org.dxworks.adocframe.model.CrossReference;
import org.dxworks.adocframe.model.DocumentElement;
import org.dxworks.adocframe.model.Emphasis;
import org.dxworks.adocframe.model.Footnote;
import org.dxworks.adocframe.model.Highlight;
import org.dxworks.adocframe.model.Image;
import org.dxworks.adocframe.model.InlineCode;
import org.dxworks.adocframe.model.Link;
import org.dxworks.adocframe.model.MacroType;
import org.dxworks.adocframe.model.Strong;
import org.dxworks.adocframe.model.Subscript;
import org.dxworks.adocframe.model.Superscript;
import org.dxworks.adocframe.model.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a line of text into inline nodes.
 * <p>
 * At each step every {@link Kind} is searched from the current position and the earliest
 * match wins; when two kinds match at the same index the one declared first wins. Text
 * between matches becomes {@link Text}. Matched content is not parsed again, so
 * {@code *_x_*} yields a Strong whose text is {@code _x_}.
 */
public class InlineParser {

    enum Kind {
        STRONG_UNCONSTRAINED("\\*\\*(.+?)\\*\\*"),
        EMPHASIS_UNCONSTRAINED("__(.+?)__"),
        STRONG("\\*([^*]+)\\*"),
        EMPHASIS("_([^_]+)_"),
        HIGHLIGHT("#([^#]+)#"),
        SUPERSCRIPT("\\^([^\\^]+)\\^"),
        SUBSCRIPT("~([^~]+)~"),
        INLINE_CODE("`([^`]+)`"),
        LINK("(https?://[^\\s\\[\\]]+)(\\[([^\\]]*)\\])?"),
        IMAGE("image::([^\\[]+)\\[([^\\]]*)\\]"),
        ANCHOR("\\[\\[([^\\]]+)\\]\\]"),
        CROSS_REFERENCE("<<([^,>]+?)(?:,(.+?))?>>"),
        FOOTNOTE("footnote:([^:\\[\\]]*?)\\[([^\\]]*)\\]"),
        INLINE_MACRO("(\\w+):([^\\[]*)\\[([^\\]]*)\\]");

        private final Pattern pattern;

        Kind(String regex) {
            this.pattern = Pattern.compile(regex);
        }
    }

    private final FootnoteRegistry footnotes;

    public InlineParser() {
        this(new FootnoteRegistry());
    }

    public InlineParser(FootnoteRegistry footnotes) {
        this.footnotes = footnotes;
    }

    public List<DocumentElement> parse(String text) {
        List<DocumentElement> elements = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return elements;
        }

        int position = 0;
        while (position < text.length()) {
            Match next = findNext(text, position);
            if (next == null) {
                elements.add(new Text(text.substring(position)));
                break;
            }
            if (next.matcher.start() > position) {
                elements.add(new Text(text.substring(position, next.matcher.start())));
            }
            elements.add(create(next.kind, next.matcher));
            position = next.matcher.end();
        }
        return elements;
    }

    private static Match findNext(String text, int from) {
        Match earliest = null;
        for (Kind kind : Kind.values()) {
            Matcher matcher = kind.pattern.matcher(text);
            if (matcher.find(from) && (earliest == null || matcher.start() < earliest.matcher.start())) {
                earliest = new Match(kind, matcher);
            }
        }
        return earliest;
    }

    private DocumentElement create(Kind kind, Matcher m) {
        return switch (kind) {
            case STRONG_UNCONSTRAINED, STRONG -> new Strong(m.group(1));
            case EMPHASIS_UNCONSTRAINED, EMPHASIS -> new Emphasis(m.group(1));
            case HIGHLIGHT -> new Highlight(m.group(1));
            case SUPERSCRIPT -> new Superscript(m.group(1));
            case SUBSCRIPT -> new Subscript(m.group(1));
            case INLINE_CODE -> new InlineCode(m.group(1));
            case LINK -> link(m);
            case IMAGE -> new Image(m.group(1), m.group(2));
            case ANCHOR -> anchor(m);
            case CROSS_REFERENCE -> crossReference(m);
            case FOOTNOTE -> footnote(m.group(1).trim(), m.group(2).trim());
            case INLINE_MACRO -> Macros.create(m.group(1).trim(), m.group(2).trim(),
                    MacroParameters.parse(m.group(3).trim()), MacroType.INLINE);
        };
    }

    private static DocumentElement link(Matcher m) {
        String url = m.group(1);
        String text = m.group(3);
        return new Link(url, text == null || text.isEmpty() ? url : text);
    }

    private static DocumentElement anchor(Matcher m) {
        String[] parts = m.group(1).split(",", 2);
        String id = parts[0].trim();
        if (id.isEmpty()) {
            return new Text(m.group());
        }
        return new Anchor(id, parts.length > 1 ? parts[1].trim() : "");
    }

    private static DocumentElement crossReference(Matcher m) {
        String linkText = m.group(2);
        return new CrossReference(m.group(1).trim(), linkText == null ? "" : linkText.trim());
    }

    /**
     * {@code footnote:[text]} is anonymous, {@code footnote:id[text]} defines a named
     * footnote and {@code footnote:id[]} refers back to it.
     */
    private Footnote footnote(String id, String text) {
        if (id.isEmpty()) {
            String label = footnotes.define(null);
            return new Footnote("_footnotedef_" + label, text, label, false);
        }
        if (text.isEmpty()) {
            return new Footnote(id, "", footnotes.reference(id), true);
        }
        return new Footnote(id, text, footnotes.define(id), false);
    }

    private static class Match {
        private final Kind kind;
        private final Matcher matcher;

        private Match(Kind kind, Matcher matcher) {
            this.kind = kind;
            this.matcher = matcher;
        }
    }
}
