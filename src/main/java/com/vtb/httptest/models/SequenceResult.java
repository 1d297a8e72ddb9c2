package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class SequenceResult {
    private String name;
    private String filePath;
    private boolean success;
    @Builder.Default
    private List<StepResult> stepResults = new ArrayList<>();
    private Duration executionTime;
    /** Variable scope after the last executed step. */
    @Builder.Default
    private Map<String, String> variables = new LinkedHashMap<>();
    private Instant startTime;
    private Instant endTime;
    private String error;
    private boolean cancelled;
}
