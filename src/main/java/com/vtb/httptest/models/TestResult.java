package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one test. {@link #status} decides how the result is counted.
 */
@Data
@Builder
public class TestResult {
    private String name;
    private String filePath;

    /**
     * Position of the request in the run (file order, then request order).
     * Parallel runs return results in completion order; sort by this to restore it.
     */
    private int ordinal;

    private HttpRequest request;
    private HttpResponse response;
    private SnapshotResult snapshotResult;
    private SchemaValidationResult schemaResult;
    private Duration duration;
    private TestStatus status;
    private String error;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> extractedVariables = new LinkedHashMap<>();
    @Builder.Default
    private List<AssertionResult> assertionResults = new ArrayList<>();
}
