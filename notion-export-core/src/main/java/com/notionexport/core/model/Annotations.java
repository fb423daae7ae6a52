package com.notionexport.core.model;

/**
 * Inline style flags attached to a {@link RichSpan}.
 *
 * @param bold bold text
 * @param italic italic text
 * @param strikethrough struck-through text
 * @param underline underlined text
 * @param code inline code
 */
public record Annotations(
    boolean bold,
    boolean italic,
    boolean strikethrough,
    boolean underline,
    boolean code
) {
    private static final Annotations PLAIN = new Annotations(false, false, false, false, false);

    /**
     * Returns annotations with every flag cleared.
     *
     * @return plain annotations
     */
    public static Annotations plain() {
        return PLAIN;
    }
}
