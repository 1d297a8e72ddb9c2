package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered steps sharing one variable scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestSequence {
    private String name;
    private String description;
    @Builder.Default
    private List<TestStep> steps = new ArrayList<>();
    @Builder.Default
    private Map<String, String> variables = new LinkedHashMap<>();
    private Instant createdAt;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();
    private String filePath;
}
