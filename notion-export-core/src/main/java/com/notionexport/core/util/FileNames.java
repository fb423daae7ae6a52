package com.notionexport.core.util;

import com.notionexport.core.model.NodeIdentity;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utility class for output file names.
 */
public final class FileNames {

    public static final String MARKDOWN_EXTENSION = ".md";

    private static final int SHORT_ID_LENGTH = 10;
    private static final String UNTITLED = "untitled";
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern QUOTES = Pattern.compile("['\"`‘’“”]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private FileNames() {
        // Utility class
    }

    /**
     * Converts a title to a lower-case, hyphen-separated ASCII slug.
     *
     * <p>Accents are folded ({@code "Café"} becomes {@code "cafe"}), quotes are dropped, and any
     * other run of non-alphanumeric characters becomes a single hyphen.
     *
     * @param title page title, may be null
     * @return slug, empty if the title has no ASCII letters or digits
     */
    public static String slugify(String title) {
        if (title == null) {
            return "";
        }
        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(title, Normalizer.Form.NFKD)).replaceAll("");
        String unquoted = QUOTES.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll("");
        String slug = NON_ALPHANUMERIC.matcher(unquoted).replaceAll("-");
        return trimHyphens(slug);
    }

    /**
     * Builds the file name for a page: {@code <slug>--<first 10 hex of id>.md}.
     *
     * <p>The short id keeps names readable but is not collision-proof. When the name is already
     * in {@code taken}, the full 32-hex id is used instead.
     *
     * @param title page title
     * @param id page id
     * @param taken file names already assigned in this export
     * @return unique file name
     */
    public static String forPage(String title, NodeIdentity id, Set<String> taken) {
        String base = slugify(title);
        if (base.isEmpty()) {
            base = UNTITLED;
        }
        String compact = id.compact();
        String shortName = base + "--" + compact.substring(0, SHORT_ID_LENGTH) + MARKDOWN_EXTENSION;
        if (!taken.contains(shortName)) {
            return shortName;
        }
        return base + "--" + compact + MARKDOWN_EXTENSION;
    }

    private static String trimHyphens(String slug) {
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }
}
