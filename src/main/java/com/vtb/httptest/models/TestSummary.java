package com.vtb.httptest.models;

import lombok.Data;

/**
 * Aggregated counts for a run.
 */
@Data
public class TestSummary {
    private int total;
    private int passed;
    private int failed;
    private int skipped;
    private int errors;
    private long durationMs;

    private int snapshotsTotal;
    private int snapshotsCreated;
    private int snapshotsUpdated;

    private int schemaValidated;
    private int schemaFailed;

    private int sequencesTotal;
    private int sequencesPassed;
    private int sequencesFailed;

    /**
     * Adds one result to the counters.
     */
    public void count(TestResult result) {
        total++;
        switch (result.getStatus()) {
            case PASSED -> passed++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
            case ERROR -> errors++;
        }
        SnapshotResult snapshot = result.getSnapshotResult();
        if (snapshot != null) {
            snapshotsTotal++;
            if (snapshot.isCreated()) {
                snapshotsCreated++;
            }
            if (snapshot.isUpdated()) {
                snapshotsUpdated++;
            }
        }
        SchemaValidationResult schema = result.getSchemaResult();
        if (schema != null) {
            schemaValidated++;
            if (!schema.isValid()) {
                schemaFailed++;
            }
        }
    }
}
