package com.notionexport.core.identity;

import com.notionexport.core.exception.InvalidIdentityException;
import com.notionexport.core.model.NodeIdentity;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class that turns page URLs and raw ids into {@link NodeIdentity} values.
 *
 * <p>Accepted inputs:
 * <ul>
 *   <li>a full URL containing a 32-hex id, e.g. {@code https://www.notion.so/Roadmap-0f1e...}</li>
 *   <li>a bare 32-hex id</li>
 *   <li>a hyphenated 36-character id, in any case</li>
 * </ul>
 *
 * <p>A hyphenated match anywhere in the input wins. Otherwise all hyphens are removed and the
 * last 32 characters of the first run of at least 32 hex characters are re-hyphenated
 * 8-4-4-4-12. Taking the tail keeps title slugs that end in hex letters ({@code My-Page-...})
 * out of the id.
 */
public final class IdentityNormalizer {

    private static final Pattern HYPHENATED = Pattern.compile(
        "([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})");
    private static final Pattern COMPACT = Pattern.compile("[0-9a-fA-F]{32,}");

    private IdentityNormalizer() {
        // Utility class
    }

    /**
     * Normalizes the input to a canonical identity.
     *
     * @param value URL or id
     * @return canonical identity
     * @throws InvalidIdentityException if no id can be found
     */
    public static NodeIdentity normalize(String value) {
        return tryNormalize(value).orElseThrow(() -> new InvalidIdentityException(value));
    }

    /**
     * Normalizes the input, returning empty instead of throwing.
     *
     * <p>Used on hyperlink targets, where most values are ordinary external URLs.
     *
     * @param value URL or id, may be null
     * @return canonical identity, or empty if none is present
     */
    public static Optional<NodeIdentity> tryNormalize(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.strip();

        Matcher hyphenated = HYPHENATED.matcher(trimmed);
        if (hyphenated.find()) {
            return Optional.of(new NodeIdentity(hyphenated.group(1).toLowerCase(Locale.ROOT)));
        }

        Matcher compact = COMPACT.matcher(trimmed.replace("-", ""));
        if (!compact.find()) {
            return Optional.empty();
        }
        String run = compact.group();
        String raw = run.substring(run.length() - 32).toLowerCase(Locale.ROOT);
        return Optional.of(new NodeIdentity(
            raw.substring(0, 8) + "-"
                + raw.substring(8, 12) + "-"
                + raw.substring(12, 16) + "-"
                + raw.substring(16, 20) + "-"
                + raw.substring(20, 32)));
    }
}
