package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request filter. Each non-empty criterion must match; within a criterion any entry may match.
 */
@Data
@Builder
public class TestFilter {
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    @Builder.Default
    private List<String> methods = new ArrayList<>();
    /** Substrings of the request path or URL. */
    @Builder.Default
    private List<String> paths = new ArrayList<>();
    /** Substrings of the request name. */
    @Builder.Default
    private List<String> names = new ArrayList<>();
    /** Exact key/value pairs; only sequences carry metadata. */
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    public boolean isEmpty() {
        return tags.isEmpty() && methods.isEmpty() && paths.isEmpty() && names.isEmpty() && metadata.isEmpty();
    }
}
