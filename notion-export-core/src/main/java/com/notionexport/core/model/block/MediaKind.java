package com.notionexport.core.model.block;

import java.util.Locale;
import java.util.Optional;

/**
 * Media block kinds, named after their API type.
 */
public enum MediaKind {
    IMAGE,
    FILE,
    PDF,
    VIDEO,
    AUDIO;

    /**
     * Returns the API type name, e.g. {@code "pdf"}.
     *
     * @return lower-case type name
     */
    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a kind by API type name.
     *
     * @param type block type
     * @return matching kind, or empty for non-media types
     */
    public static Optional<MediaKind> fromType(String type) {
        for (MediaKind kind : values()) {
            if (kind.typeName().equals(type)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
