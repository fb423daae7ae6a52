package com.notionexport.core.markdown;

import com.notionexport.core.model.NodeIdentity;

import java.util.regex.Pattern;

/**
 * Syntax of the link targets left in rendered Markdown until every page's filename is known.
 *
 * <p>A placeholder reads {@code {PAGE:<canonical id>}} and only ever appears as the target of
 * a Markdown link, e.g. {@code [Roadmap]({PAGE:0f1e2d3c-...})}.
 */
public final class LinkPlaceholder {

    /**
     * Matches a placeholder; group 1 is the canonical id.
     */
    public static final Pattern PATTERN = Pattern.compile(
        "\\{PAGE:([0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12})\\}");

    private static final String PREFIX = "{PAGE:";
    private static final String SUFFIX = "}";

    private LinkPlaceholder() {
        // Utility class
    }

    public static String of(NodeIdentity id) {
        return PREFIX + id.value() + SUFFIX;
    }

    /**
     * Returns whether the text still contains an unresolved placeholder.
     *
     * @param markdown rendered text
     * @return true if a placeholder is present
     */
    public static boolean containsAny(String markdown) {
        return PATTERN.matcher(markdown).find();
    }
}
