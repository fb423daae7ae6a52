package com.notionexport.core.model;

import java.util.Objects;

/**
 * Atomic run of rich text.
 *
 * @param plainText text content, never null
 * @param annotations style flags
 * @param href optional hyperlink target (may point at another page)
 * @param mentionedPage page referenced by a page mention, or null
 */
public record RichSpan(
    String plainText,
    Annotations annotations,
    String href,
    NodeIdentity mentionedPage
) {
    /**
     * Compact constructor with validation.
     */
    public RichSpan {
        if (plainText == null) {
            plainText = "";
        }
        if (annotations == null) {
            annotations = Annotations.plain();
        }
    }

    /**
     * Creates an unstyled span without link.
     *
     * @param text span text
     * @return plain span
     */
    public static RichSpan text(String text) {
        return new RichSpan(text, Annotations.plain(), null, null);
    }

    /**
     * Creates a styled span without link.
     *
     * @param text span text
     * @param annotations style flags
     * @return styled span
     */
    public static RichSpan styled(String text, Annotations annotations) {
        return new RichSpan(text, Objects.requireNonNull(annotations), null, null);
    }

    /**
     * Creates an unstyled hyperlink span.
     *
     * @param text span text
     * @param href link target
     * @return link span
     */
    public static RichSpan link(String text, String href) {
        return new RichSpan(text, Annotations.plain(), href, null);
    }
}
