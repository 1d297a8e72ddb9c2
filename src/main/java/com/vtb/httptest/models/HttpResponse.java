package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executed response. Owned by the execution that produced it and treated as read-only afterwards.
 */
@Data
@Builder
public class HttpResponse {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private int statusCode;
    private String statusText;

    /**
     * Header multimap in arrival order, names in their original case.
     */
    @Builder.Default
    private Map<String, List<String>> headers = new LinkedHashMap<>();

    @Builder.Default
    private byte[] body = new byte[0];

    @Builder.Default
    private String contentType = DEFAULT_CONTENT_TYPE;

    private long contentLength;
    private Duration duration;
    private Instant timestamp;
    private HttpRequest request;
    private String requestId;

    /**
     * Number of transport attempts, 1 when the first attempt succeeded.
     */
    @Builder.Default
    private int attempts = 1;

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    /**
     * First value of the named header (case-insensitive), or {@code null}.
     */
    public String header(String name) {
        List<String> values = headerValues(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public List<String> headerValues(String name) {
        if (name == null || headers == null) {
            return Collections.emptyList();
        }
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue() != null ? entry.getValue() : Collections.emptyList();
            }
        }
        return Collections.emptyList();
    }

    /**
     * Media type without parameters, lower-cased ({@code application/json; charset=utf-8} gives {@code application/json}).
     */
    public String mediaType() {
        return mediaTypeOf(contentType);
    }

    public static String mediaTypeOf(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return DEFAULT_CONTENT_TYPE;
        }
        int semicolon = contentType.indexOf(';');
        String bare = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return bare.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
