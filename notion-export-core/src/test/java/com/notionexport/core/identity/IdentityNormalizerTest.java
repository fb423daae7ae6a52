package com.notionexport.core.identity;

import com.notionexport.core.exception.InvalidIdentityException;
import com.notionexport.core.model.NodeIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link IdentityNormalizer}.
 */
class IdentityNormalizerTest {

    private static final String CANONICAL = "0123abcd-ef01-2345-6789-abcdef012345";

    @ParameterizedTest
    @ValueSource(strings = {
        "0123abcdef0123456789abcdef012345",
        "0123ABCDEF0123456789ABCDEF012345",
        "0123abcd-ef01-2345-6789-abcdef012345",
        "0123ABCD-EF01-2345-6789-ABCDEF012345",
        "https://www.notion.so/0123abcdef0123456789abcdef012345",
        "https://www.notion.so/acme/Roadmap-0123abcdef0123456789abcdef012345",
        "https://www.notion.so/acme/0123abcdef0123456789abcdef012345?pvs=4",
        "  0123abcdef0123456789abcdef012345  "
    })
    void normalize_acceptedForms_returnCanonicalId(String input) {
        assertThat(IdentityNormalizer.normalize(input).value()).isEqualTo(CANONICAL);
    }

    @Test
    void normalize_slugEndingInHexLetters_doesNotLeakIntoId() {
        // "Page" ends in "a", "e": both hex
        NodeIdentity id = IdentityNormalizer.normalize("https://www.notion.so/My-Page-0123abcdef0123456789abcdef012345");

        assertThat(id.value()).isEqualTo(CANONICAL);
    }

    @Test
    void normalize_hyphenatedIdInsideUrl_preferred() {
        NodeIdentity id = IdentityNormalizer.normalize("https://example.com/p/0123abcd-ef01-2345-6789-abcdef012345");

        assertThat(id.value()).isEqualTo(CANONICAL);
    }

    @Test
    void normalize_ownOutput_isIdempotent() {
        NodeIdentity once = IdentityNormalizer.normalize("https://www.notion.so/Roadmap-0123abcdef0123456789abcdef012345");
        NodeIdentity twice = IdentityNormalizer.normalize(once.value());

        assertThat(twice).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not-an-id", "0123abcdef", "https://www.notion.so/acme/Roadmap", "0123abcdef0123456789abcdef01234g"})
    void normalize_noId_throwsInvalidIdentity(String input) {
        assertThatThrownBy(() -> IdentityNormalizer.normalize(input))
            .isInstanceOf(InvalidIdentityException.class)
            .hasMessageContaining(input);
    }

    @Test
    void tryNormalize_externalUrl_returnsEmpty() {
        assertThat(IdentityNormalizer.tryNormalize("https://example.com/docs")).isEmpty();
        assertThat(IdentityNormalizer.tryNormalize(null)).isEmpty();
    }
}
