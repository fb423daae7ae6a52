package com.notionexport.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.notionexport.core.export.ExportOptions;
import com.notionexport.core.remote.http.NotionApiSettings;
import com.notionexport.core.retry.RetryPolicy;

import java.time.Duration;

/**
 * Root configuration for an export.
 *
 * <p>Loaded from {@code notion-export.yaml}. Every section and value is optional; missing
 * entries fall back to the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * api:
 *   baseUrl: "https://api.notion.com/v1"
 *   version: "2022-06-28"
 *   timeoutSeconds: 30
 *   pageSize: 100
 *
 * retry:
 *   maxAttempts: 6
 *   baseDelayMillis: 600
 *
 * output:
 *   directory: "./notion_export"
 *   indexFile: "_INDEX.md"
 *   rewriteLinks: true
 *   renderer: filesystem
 * }</pre>
 *
 * @param api remote API settings
 * @param retry retry settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportConfig(
    @JsonProperty("api") ApiConfig api,
    @JsonProperty("retry") RetryConfig retry,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ExportConfig {
        if (api == null) {
            api = ApiConfig.defaults();
        }
        if (retry == null) {
            retry = RetryConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    public static ExportConfig defaults() {
        return new ExportConfig(ApiConfig.defaults(), RetryConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * Remote API settings; the token is never read from the file.
     *
     * @param baseUrl API root
     * @param version {@code Notion-Version} header value
     * @param timeoutSeconds per-request timeout
     * @param pageSize listing page size
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiConfig(
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("version") String version,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("pageSize") Integer pageSize
    ) {
        public ApiConfig {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = NotionApiSettings.DEFAULT_BASE_URL;
            }
            if (version == null || version.isBlank()) {
                version = NotionApiSettings.DEFAULT_VERSION;
            }
            if (timeoutSeconds == null || timeoutSeconds < 1) {
                timeoutSeconds = (int) NotionApiSettings.DEFAULT_TIMEOUT.getSeconds();
            }
            if (pageSize == null) {
                pageSize = NotionApiSettings.DEFAULT_PAGE_SIZE;
            }
        }

        public static ApiConfig defaults() {
            return new ApiConfig(null, null, null, null);
        }

        /**
         * Builds client settings with the given token and optional version override.
         *
         * @param token integration token
         * @param versionOverride version taken from the command line, or null
         * @return client settings
         */
        public NotionApiSettings toSettings(String token, String versionOverride) {
            String effectiveVersion = versionOverride == null || versionOverride.isBlank() ? version : versionOverride;
            return new NotionApiSettings(baseUrl, token, effectiveVersion, Duration.ofSeconds(timeoutSeconds), pageSize);
        }
    }

    /**
     * Retry settings.
     *
     * @param maxAttempts total attempts per call
     * @param baseDelayMillis delay before the first retry
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetryConfig(
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("baseDelayMillis") Long baseDelayMillis
    ) {
        public RetryConfig {
            if (maxAttempts == null || maxAttempts < 1) {
                maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
            }
            if (baseDelayMillis == null || baseDelayMillis < 1) {
                baseDelayMillis = RetryPolicy.DEFAULT_BASE_DELAY.toMillis();
            }
        }

        public static RetryConfig defaults() {
            return new RetryConfig(null, null);
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMillis), RetryPolicy.DEFAULT_MULTIPLIER);
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory
     * @param indexFile index file name
     * @param rewriteLinks link exported pages locally
     * @param renderer output renderer id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("indexFile") String indexFile,
        @JsonProperty("rewriteLinks") Boolean rewriteLinks,
        @JsonProperty("renderer") String renderer
    ) {
        public static final String DEFAULT_RENDERER = "filesystem";

        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = ExportOptions.DEFAULT_OUTPUT_DIRECTORY;
            }
            if (indexFile == null || indexFile.isBlank()) {
                indexFile = ExportOptions.DEFAULT_INDEX_FILE;
            }
            if (rewriteLinks == null) {
                rewriteLinks = Boolean.TRUE;
            }
            if (renderer == null || renderer.isBlank()) {
                renderer = DEFAULT_RENDERER;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null, null, null);
        }
    }
}
