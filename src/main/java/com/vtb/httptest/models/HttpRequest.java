package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP request template as it comes from a collection file.
 * <p>
 * Instances are immutable: the executor produces substituted copies through {@link #toBuilder()}
 * and never touches the original.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class HttpRequest {

    @Builder.Default
    String method = "GET";

    String url;

    @Singular
    List<HttpHeader> headers;

    String body;

    AuthDescriptor auth;

    String name;

    String tag;

    /**
     * API path template (for example {@code /users/{id}}); used as the snapshot identifier.
     */
    String path;

    @Builder.Default
    List<VariableExtraction> extract = List.of();

    @Builder.Default
    List<TestAssertion> assertions = List.of();

    /**
     * First value of the header with the given name, compared case-insensitively.
     */
    @JsonIgnore
    public String headerValue(String headerName) {
        if (headerName == null || headers == null) {
            return null;
        }
        for (HttpHeader header : headers) {
            if (header.getName() != null && header.getName().equalsIgnoreCase(headerName)) {
                return header.getValue();
            }
        }
        return null;
    }

    /**
     * Copy with the header replaced (all same-name headers removed first).
     */
    public HttpRequest withHeader(String headerName, String headerValue) {
        List<HttpHeader> updated = new ArrayList<>();
        if (headers != null) {
            for (HttpHeader header : headers) {
                if (header.getName() == null || !header.getName().equalsIgnoreCase(headerName)) {
                    updated.add(header);
                }
            }
        }
        updated.add(new HttpHeader(headerName, headerValue));
        return toBuilder().clearHeaders().headers(updated).build();
    }

    /**
     * Human readable label: name, otherwise {@code METHOD url}.
     */
    @JsonIgnore
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return method + " " + url;
    }
}
