package org.dxworks.adocframe.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the bracketed part of a macro, {@code image::a.png[Alt text, width=200, title="A, B"]}.
 */
public final class MacroParameters {

    private MacroParameters() {
    }

    public static Map<String, String> parse(String raw) {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return parameters;
        }

        List<String> parts = split(raw);
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i).trim();
            int equals = part.indexOf('=');
            if (equals > 0) {
                String key = part.substring(0, equals).trim();
                String value = unquote(part.substring(equals + 1).trim());
                parameters.put(key, value);
            } else if (i == 0) {
                String value = unquote(part);
                parameters.put("alt", value);
                parameters.put("title", value);
            } else {
                parameters.put("param" + i, unquote(part));
            }
        }
        return parameters;
    }

    /**
     * Splits on commas that are not inside single or double quotes.
     */
    public static List<String> split(String raw) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (char c : raw.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (c == ',') {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
