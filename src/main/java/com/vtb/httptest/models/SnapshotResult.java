package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

/**
 * What the snapshot store did for one test.
 */
@Data
@Builder
public class SnapshotResult {
    private String snapshotPath;
    private boolean exists;
    private boolean equal;
    private boolean created;
    private boolean updated;
    private SnapshotDiff diff;
    private String message;
}
