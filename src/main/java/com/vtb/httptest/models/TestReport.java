package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything a reporter needs to render a run.
 */
@Data
public class TestReport {
    private TestSummary summary = new TestSummary();
    private List<TestResult> results = new ArrayList<>();
    private List<SequenceResult> sequences = new ArrayList<>();
    private Instant startTime;
    private Instant endTime;
    private boolean cancelled;

    /**
     * A run is unsuccessful when any test failed or errored; callers map this to the exit code.
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return summary.getFailed() == 0 && summary.getErrors() == 0;
    }

    @JsonIgnore
    public int exitCode() {
        return isSuccessful() ? 0 : 1;
    }
}
