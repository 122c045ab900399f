package org.dxworks.adocframe.parser;

import java.util.Locale;

public final class AnchorIds {

    private AnchorIds() {
    }

    /**
     * Derives a link target from a title: lower case, spaces to dashes, quotes and
     * brackets dropped. {@code "Getting Started (Quick)"} becomes {@code getting-started-quick}.
     */
    public static String fromTitle(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        StringBuilder id = new StringBuilder();
        for (char c : title.trim().toLowerCase(Locale.ROOT).toCharArray()) {
            switch (c) {
                case ' ' -> id.append('-');
                case '\'', '"', '(', ')', '[', ']', '{', '}' -> {
                }
                default -> id.append(c);
            }
        }
        return id.toString();
    }
}
