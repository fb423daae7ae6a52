package com.notionexport.core.remote.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for {@link NotionHttpClient}.
 *
 * @param baseUrl API root, e.g. {@code https://api.notion.com/v1}
 * @param token integration token sent as bearer credentials
 * @param version value of the {@code Notion-Version} header
 * @param timeout per-request timeout
 * @param pageSize page size for paginated listings (max 100)
 */
public record NotionApiSettings(
    String baseUrl,
    String token,
    String version,
    Duration timeout,
    int pageSize
) {
    public static final String DEFAULT_BASE_URL = "https://api.notion.com/v1";
    public static final String DEFAULT_VERSION = "2022-06-28";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_PAGE_SIZE = 100;

    /**
     * Compact constructor with validation.
     */
    public NotionApiSettings {
        Objects.requireNonNull(token, "token must not be null");
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (version == null || version.isBlank()) {
            version = DEFAULT_VERSION;
        }
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (pageSize < 1 || pageSize > 100) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
    }

    @Override
    public String toString() {
        return "NotionApiSettings[baseUrl=" + baseUrl + ", version=" + version
            + ", timeout=" + timeout + ", pageSize=" + pageSize + "]";
    }
}
