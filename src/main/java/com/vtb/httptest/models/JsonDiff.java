package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structural JSON differences, keyed by paths such as {@code user.roles[2].name}.
 */
@Data
@Builder
public class JsonDiff {
    @Builder.Default
    private Map<String, Object> missingFields = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> extraFields = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, TypeDiff> differentTypes = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, ValueDiff> differentValues = new LinkedHashMap<>();
    private boolean equal;

    public boolean hasDifferences() {
        return !missingFields.isEmpty() || !extraFields.isEmpty()
            || !differentTypes.isEmpty() || !differentValues.isEmpty();
    }
}
