package com.vtb.httptest.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Point-in-time copy of the snapshot store counters.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public class SnapshotStats {
    private int total;
    private int passed;
    private int failed;
    private int created;
    private int updated;
    private int errors;
    private Instant startTime;
}
