package org.dxworks.adocframe.parser;

import org.dxworks.adocframe.model.DocumentAttributes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The content of a block attribute line such as {@code [source#main.lead%header, java, title="Main"]}.
 * The first positional entry is the style with optional {@code #id}, {@code .role} and
 * {@code %option} shorthands; further positional entries are numbered from 2.
 */
class BlockAttributes {

    private final String raw;
    private String style;
    private String id;
    private final List<String> roles = new ArrayList<>();
    private final List<String> options = new ArrayList<>();
    private final Map<String, String> named = new LinkedHashMap<>();

    private BlockAttributes(String raw) {
        this.raw = raw;
    }

    static BlockAttributes parse(String raw) {
        BlockAttributes attributes = new BlockAttributes(raw);
        List<String> parts = MacroParameters.split(raw);
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i).trim();
            int equals = part.indexOf('=');
            if (equals > 0) {
                attributes.addNamed(part.substring(0, equals).trim(), MacroParameters.unquote(part.substring(equals + 1).trim()));
            } else if (i == 0) {
                attributes.parseStyle(part);
            } else if (!part.isEmpty()) {
                attributes.named.put(String.valueOf(i + 1), MacroParameters.unquote(part));
            }
        }
        return attributes;
    }

    private void addNamed(String key, String value) {
        switch (key) {
            case "id" -> id = value;
            case "role" -> roles.addAll(splitList(value, ' '));
            case "options", "opts" -> options.addAll(splitList(value, ','));
            default -> named.put(key, value);
        }
    }

    private void parseStyle(String shorthand) {
        int end = firstMarker(shorthand, 0);
        if (end > 0) {
            style = shorthand.substring(0, end).trim();
        }
        while (end < shorthand.length()) {
            char marker = shorthand.charAt(end);
            int next = firstMarker(shorthand, end + 1);
            String value = shorthand.substring(end + 1, next).trim();
            if (!value.isEmpty()) {
                switch (marker) {
                    case '#' -> id = value;
                    case '.' -> roles.add(value);
                    default -> options.add(value);
                }
            }
            end = next;
        }
    }

    private static int firstMarker(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '#' || c == '.' || c == '%') {
                return i;
            }
        }
        return text.length();
    }

    private static List<String> splitList(String value, char separator) {
        List<String> values = new ArrayList<>();
        for (String item : value.split(separator == ' ' ? "\\s+" : ",")) {
            if (!item.isBlank()) {
                values.add(item.trim());
            }
        }
        return values;
    }

    String getRaw() {
        return raw;
    }

    String getStyle() {
        return style;
    }

    boolean hasStyle(String expected) {
        return style != null && style.equalsIgnoreCase(expected);
    }

    String getId() {
        return id;
    }

    String getTitle() {
        return named.get("title");
    }

    String get(String key, String defaultValue) {
        return named.getOrDefault(key, defaultValue);
    }

    boolean hasOption(String option) {
        return options.stream().anyMatch(o -> o.toLowerCase(Locale.ROOT).equals(option));
    }

    void copyTo(DocumentAttributes target) {
        if (style != null && !style.isEmpty()) {
            target.setAttribute("style", style);
        }
        if (id != null) {
            target.setAttribute("id", id);
        }
        if (!roles.isEmpty()) {
            target.setAttribute("role", String.join(" ", roles));
        }
        if (!options.isEmpty()) {
            target.setAttribute("options", String.join(",", options));
        }
        named.forEach(target::setAttribute);
    }
}
