package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One request in a sequence. Waits are in milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestStep {
    private String name;
    private String description;
    private HttpRequest request;
    /** 0 means "do not check". */
    private int expectedStatus;
    /** Variables extracted from the response. */
    @Builder.Default
    private List<VariableExtraction> variables = new ArrayList<>();
    private long waitBeforeMs;
    private long waitAfterMs;
    private boolean skip;
    /** {@code left == right} or {@code left != right}, evaluated after substitution. */
    private String skipCondition;
    private boolean stopOnFail;
    private boolean schemaValidate;
    @Builder.Default
    private List<TestAssertion> assertions = new ArrayList<>();
}
