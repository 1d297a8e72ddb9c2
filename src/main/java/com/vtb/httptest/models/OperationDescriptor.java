package com.vtb.httptest.models;

/**
 * Identifies the API operation a response belongs to.
 *
 * @param method HTTP method
 * @param path   path template ({@code /users/{id}}) or a concrete path
 */
public record OperationDescriptor(String method, String path) {

    public static OperationDescriptor of(HttpRequest request) {
        String path = request.getPath();
        if (path == null || path.isBlank()) {
            okhttp3.HttpUrl url = request.getUrl() != null ? okhttp3.HttpUrl.parse(request.getUrl()) : null;
            path = url != null ? url.encodedPath() : request.getUrl();
        }
        return new OperationDescriptor(request.getMethod(), path);
    }
}
