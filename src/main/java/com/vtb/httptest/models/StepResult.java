package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class StepResult {
    private String name;
    private TestStatus status;
    private HttpRequest request;
    private HttpResponse response;
    @Builder.Default
    private Map<String, String> variables = new LinkedHashMap<>();
    private Duration executionTime;
    private String error;
    private String validationError;
    private SchemaValidationResult schemaResult;
    @Builder.Default
    private List<AssertionResult> assertionResults = new ArrayList<>();
    /** Skipped because {@code skipCondition} held, as opposed to an unconditional skip. */
    private boolean conditionallySkipped;

    public boolean isSuccess() {
        return status == TestStatus.PASSED || status == TestStatus.SKIPPED;
    }
}
