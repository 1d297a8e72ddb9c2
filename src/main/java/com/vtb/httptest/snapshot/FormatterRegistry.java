package com.vtb.httptest.snapshot;

import com.vtb.httptest.models.HttpResponse;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks a formatter for a content type: exact media type first, then {@code type/*}, then binary.
 * The order decides whether a body is treated as structured or opaque and must not change.
 */
public class FormatterRegistry {

    private final Map<String, ResponseFormatter> formatters = new ConcurrentHashMap<>();
    private final ResponseFormatter fallback;

    public FormatterRegistry(ResponseFormatter fallback) {
        this.fallback = fallback;
    }

    public static FormatterRegistry withDefaults() {
        FormatterRegistry registry = new FormatterRegistry(new BinaryFormatter());
        JsonFormatter json = new JsonFormatter();
        registry.register("application/json", json);
        registry.register("application/problem+json", json);
        registry.register("text/json", json);
        TextFormatter xml = TextFormatter.xml();
        registry.register("application/xml", xml);
        registry.register("text/xml", xml);
        registry.register("text/html", TextFormatter.html());
        registry.register("text/plain", TextFormatter.text());
        registry.register("text/*", TextFormatter.text());
        return registry;
    }

    /**
     * Registers a formatter for an exact media type or a {@code type/*} wildcard.
     */
    public void register(String contentType, ResponseFormatter formatter) {
        formatters.put(HttpResponse.mediaTypeOf(contentType), formatter);
    }

    public ResponseFormatter forContentType(String contentType) {
        String mediaType = HttpResponse.mediaTypeOf(contentType);
        ResponseFormatter exact = formatters.get(mediaType);
        if (exact != null) {
            return exact;
        }
        int slash = mediaType.indexOf('/');
        if (slash > 0) {
            ResponseFormatter wildcard = formatters.get(mediaType.substring(0, slash) + "/*");
            if (wildcard != null) {
                return wildcard;
            }
        }
        return fallback;
    }
}
