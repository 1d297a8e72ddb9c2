package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class ValidationOptions {
    private boolean ignoreAdditionalProperties;
    private boolean ignoreFormats;
    private boolean ignorePatterns;
    /** Validate only required properties; optional ones are not inspected. */
    private boolean requiredPropertiesOnly;
    /** Accept {@code null} for every property regardless of {@code nullable}. */
    private boolean ignoreNullable;
    @Builder.Default
    private List<String> ignoredProperties = new ArrayList<>();
}
