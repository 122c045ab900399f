package org.dxworks.adocframe.model;

import java.util.Locale;
import java.util.Optional;

public enum AdmonitionType {
    NOTE,
    TIP,
    IMPORTANT,
    WARNING,
    CAUTION;

    public static Optional<AdmonitionType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (AdmonitionType type : values()) {
            if (type.name().equalsIgnoreCase(label.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String cssClass() {
        return name().toLowerCase(Locale.ROOT);
    }
}
