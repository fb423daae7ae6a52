package com.notionexport.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonical identity of a page, database or block.
 *
 * <p>Always 36 characters, lower-case, hyphenated 8-4-4-4-12. Use
 * {@link com.notionexport.core.identity.IdentityNormalizer} to obtain one from user input.
 *
 * @param value canonical hyphenated id
 */
public record NodeIdentity(String value) implements Comparable<NodeIdentity> {

    private static final Pattern CANONICAL =
        Pattern.compile("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    /**
     * Compact constructor with validation.
     */
    public NodeIdentity {
        Objects.requireNonNull(value, "value must not be null");
        if (!CANONICAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a canonical identity: " + value);
        }
    }

    /**
     * Returns the id without hyphens, as used in notion.so URLs.
     *
     * @return 32 hex characters
     */
    public String compact() {
        return value.replace("-", "");
    }

    @Override
    public int compareTo(NodeIdentity other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
