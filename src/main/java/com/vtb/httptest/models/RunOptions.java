package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options for one orchestrated run.
 */
@Data
@Builder(toBuilder = true)
public class RunOptions {

    /** Headers that change on every response and never take part in snapshot comparison. */
    public static final List<String> DEFAULT_IGNORED_HEADERS = List.of("Date", "Set-Cookie", "X-Request-Id");

    @Builder.Default
    private UpdateMode updateMode = UpdateMode.NONE;
    private boolean failOnMissing;

    /** Header names skipped by snapshot comparison (case-insensitive). */
    @Builder.Default
    private List<String> ignoredHeaders = new ArrayList<>(DEFAULT_IGNORED_HEADERS);

    /** Per-request timeout; {@code null} keeps the client default. */
    private Duration timeout;

    private boolean parallel;
    @Builder.Default
    private int maxConcurrency = 4;

    private boolean stopOnFailure;
    private TestFilter filter;

    /** Run-supplied variables, layered above environment variables. */
    @Builder.Default
    private Map<String, String> variables = new LinkedHashMap<>();

    private boolean validateSchema;
    @Builder.Default
    private ValidationOptions schemaOptions = ValidationOptions.builder().build();

    /** Evaluate request-level assertions after the snapshot check. */
    @Builder.Default
    private boolean runAssertions = true;
    /** Extract request-level variables after the snapshot check. */
    @Builder.Default
    private boolean extractVariables = true;

    private boolean saveVariables;
    private String variablesFile;
    private boolean failFast;
}
