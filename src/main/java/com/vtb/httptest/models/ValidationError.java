package com.vtb.httptest.models;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Single schema violation; {@code path} points into the body ({@code items[0].id}, empty for the root).
 * {@code keyword} names the failed JSON Schema keyword ({@code required}, {@code format}), or is
 * {@code null} for checks outside the body schema such as an undocumented status.
 */
@Data
@AllArgsConstructor
public class ValidationError {
    private String path;
    private String message;
    private String keyword;

    public ValidationError(String path, String message) {
        this(path, message, null);
    }

    @Override
    public String toString() {
        return (path == null || path.isEmpty() ? "$" : path) + ": " + message;
    }
}
