package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a single test or step. The only input for pass/fail counting.
 */
public enum TestStatus {
    PASSED,
    FAILED,
    SKIPPED,
    ERROR;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }
}
