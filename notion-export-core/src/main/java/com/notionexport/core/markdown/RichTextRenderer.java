package com.notionexport.core.markdown;

import com.notionexport.core.identity.IdentityNormalizer;
import com.notionexport.core.model.Annotations;
import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts rich text spans to inline Markdown.
 *
 * <p>Per span:
 * <ol>
 *   <li>a page mention records the mentioned page as linked</li>
 *   <li>an href that contains a page id becomes {@code [text]({PAGE:id})} and records the page;
 *       any other href becomes {@code [text](href)}. Linked spans are not styled.</li>
 *   <li>otherwise styles wrap the text, outermost first: code, bold, italic, strikethrough,
 *       underline. Bold code "hi" therefore renders as {@code `**hi**`}.</li>
 * </ol>
 */
public class RichTextRenderer {

    private static final String CODE = "`";
    private static final String BOLD = "**";
    private static final String ITALIC = "*";
    private static final String STRIKE = "~~";
    private static final String UNDERLINE_OPEN = "<u>";
    private static final String UNDERLINE_CLOSE = "</u>";

    /**
     * Renders spans and records every page they reference.
     *
     * @param spans rich text
     * @param linkedPages collector for referenced pages
     * @return inline Markdown
     */
    public String render(List<RichSpan> spans, Set<NodeIdentity> linkedPages) {
        StringBuilder out = new StringBuilder();
        for (RichSpan span : spans) {
            out.append(renderSpan(span, linkedPages));
        }
        return out.toString();
    }

    private String renderSpan(RichSpan span, Set<NodeIdentity> linkedPages) {
        String plain = span.plainText();

        if (span.mentionedPage() != null) {
            linkedPages.add(span.mentionedPage());
        }

        if (span.href() != null && !span.href().isEmpty()) {
            Optional<NodeIdentity> page = IdentityNormalizer.tryNormalize(span.href());
            if (page.isPresent()) {
                linkedPages.add(page.get());
                return "[" + plain + "](" + LinkPlaceholder.of(page.get()) + ")";
            }
            return "[" + plain + "](" + span.href() + ")";
        }

        if (plain.isEmpty()) {
            return plain;
        }
        return applyStyles(plain, span.annotations());
    }

    private String applyStyles(String text, Annotations annotations) {
        String styled = text;
        if (annotations.underline()) {
            styled = UNDERLINE_OPEN + styled + UNDERLINE_CLOSE;
        }
        if (annotations.strikethrough()) {
            styled = STRIKE + styled + STRIKE;
        }
        if (annotations.italic()) {
            styled = ITALIC + styled + ITALIC;
        }
        if (annotations.bold()) {
            styled = BOLD + styled + BOLD;
        }
        if (annotations.code()) {
            styled = CODE + styled + CODE;
        }
        return styled;
    }
}
