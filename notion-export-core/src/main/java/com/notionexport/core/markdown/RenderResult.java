package com.notionexport.core.markdown;

import com.notionexport.core.model.NodeIdentity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Output of rendering a block list.
 *
 * @param markdown rendered text, ending with a single newline
 * @param linkedPages pages referenced by the rendered blocks, in discovery order
 */
public record RenderResult(
    String markdown,
    Set<NodeIdentity> linkedPages
) {
    /**
     * Compact constructor with validation.
     */
    public RenderResult {
        Objects.requireNonNull(markdown, "markdown must not be null");
        linkedPages = linkedPages == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(linkedPages));
    }
}
