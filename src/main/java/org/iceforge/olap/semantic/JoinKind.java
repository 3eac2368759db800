package org.iceforge.olap.semantic;

import java.util.Locale;
import java.util.Optional;

public enum JoinKind {
    INNER,
    LEFT;

    public static Optional<JoinKind> parse(String name) {
        if (name == null) {
            return Optional.of(LEFT);
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (JoinKind k : values()) {
            if (k.name().equals(normalized)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
