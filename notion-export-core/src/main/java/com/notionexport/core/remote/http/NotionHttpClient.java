package com.notionexport.core.remote.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.notionexport.core.exception.ExportException;
import com.notionexport.core.exception.RemoteApiException;
import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.block.ContentNode;
import com.notionexport.core.remote.ContentApi;
import com.notionexport.core.remote.RemoteDocument;
import com.notionexport.core.remote.ResultPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * {@link ContentApi} backed by the Notion REST API.
 *
 * <p>Every call is a single HTTP exchange; retries are the caller's concern. Non-2xx answers
 * are turned into {@link RemoteApiException} using the {@code status}, {@code code} and
 * {@code message} of the error body, and transport failures into a status-less
 * {@link RemoteApiException} so they count as transient.
 */
public class NotionHttpClient implements ContentApi {

    private static final Logger log = LoggerFactory.getLogger(NotionHttpClient.class);

    private final NotionApiSettings settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BlockJsonParser parser;

    public NotionHttpClient(NotionApiSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(settings.timeout()).build());
    }

    public NotionHttpClient(NotionApiSettings settings, HttpClient httpClient) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.parser = new BlockJsonParser();
    }

    @Override
    public RemoteDocument retrieveDocument(NodeIdentity id) {
        return parser.parseDocument(send(request("/pages/" + id).GET().build()));
    }

    @Override
    public RemoteDocument retrieveCollection(NodeIdentity id) {
        return parser.parseDocument(send(request("/databases/" + id).GET().build()));
    }

    @Override
    public ResultPage<ContentNode> listChildren(NodeIdentity id, String cursor) {
        StringBuilder path = new StringBuilder("/blocks/").append(id).append("/children?page_size=")
            .append(settings.pageSize());
        if (cursor != null) {
            path.append("&start_cursor=").append(URLEncoder.encode(cursor, StandardCharsets.UTF_8));
        }
        return parser.parseBlockList(send(request(path.toString()).GET().build()));
    }

    @Override
    public ResultPage<RemoteDocument> queryCollectionMembers(NodeIdentity id, String cursor) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("page_size", settings.pageSize());
        if (cursor != null) {
            body.put("start_cursor", cursor);
        }
        HttpRequest request = request("/databases/" + id + "/query")
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(body.toString()))
            .build();
        return parser.parseDocumentList(send(request));
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(settings.baseUrl() + path))
            .timeout(settings.timeout())
            .header("Authorization", "Bearer " + settings.token())
            .header("Notion-Version", settings.version())
            .header("Accept", "application/json");
    }

    private JsonNode send(HttpRequest request) {
        log.debug("{} {}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteApiException(request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExportException("Interrupted during " + request.method() + " " + request.uri(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw toApiException(status, response.body());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RemoteApiException("Unparseable response from " + request.uri() + ": " + e.getOriginalMessage(), e);
        }
    }

    private RemoteApiException toApiException(int status, String body) {
        String code = null;
        String message = "HTTP " + status;
        try {
            JsonNode error = objectMapper.readTree(body);
            code = error.path("code").asText(null);
            message = error.path("message").asText(message);
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON (status {}): {}", status, e.getOriginalMessage());
        }
        return new RemoteApiException(status, code, message);
    }
}
