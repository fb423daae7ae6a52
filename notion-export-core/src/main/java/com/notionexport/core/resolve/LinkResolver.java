package com.notionexport.core.resolve;

import com.notionexport.core.markdown.LinkPlaceholder;
import com.notionexport.core.model.NodeIdentity;

import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Second pass of an export: rewrites link placeholders in rendered Markdown.
 *
 * <p>A placeholder whose page was exported becomes {@code ./<filename>}. Any other placeholder,
 * for a skipped page or when local rewriting is disabled, becomes the page's notion.so URL.
 * The text is otherwise left untouched; nothing is re-rendered or re-fetched.
 */
public class LinkResolver {

    public static final String REMOTE_BASE_URL = "https://www.notion.so/";

    private final LinkMap linkMap;
    private final boolean rewriteLocal;

    /**
     * Creates a resolver.
     *
     * @param linkMap filenames of exported pages
     * @param rewriteLocal whether exported pages are linked locally; when false every link
     *                     points at notion.so
     */
    public LinkResolver(LinkMap linkMap, boolean rewriteLocal) {
        this.linkMap = Objects.requireNonNull(linkMap, "linkMap must not be null");
        this.rewriteLocal = rewriteLocal;
    }

    /**
     * Replaces every placeholder in the text.
     *
     * @param markdown rendered Markdown
     * @return Markdown without placeholders
     */
    public String resolve(String markdown) {
        Matcher matcher = LinkPlaceholder.PATTERN.matcher(markdown);
        StringBuilder out = new StringBuilder(markdown.length());
        while (matcher.find()) {
            NodeIdentity id = new NodeIdentity(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(target(id)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Returns the link target for a page.
     *
     * @param id page id
     * @return relative local path or remote URL
     */
    public String target(NodeIdentity id) {
        if (rewriteLocal) {
            return linkMap.filenameOf(id)
                .map(filename -> "./" + filename)
                .orElseGet(() -> remoteUrl(id));
        }
        return remoteUrl(id);
    }

    public static String remoteUrl(NodeIdentity id) {
        return REMOTE_BASE_URL + id.compact();
    }
}
