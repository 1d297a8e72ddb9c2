package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header differences keyed by lower-cased header name.
 */
@Data
@Builder
public class HeaderDiff {
    @Builder.Default
    private Map<String, List<String>> missing = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, List<String>> extra = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, HeaderValueDiff> differentValues = new LinkedHashMap<>();
    private boolean equal;
}
