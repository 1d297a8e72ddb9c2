package com.vtb.httptest.models;

import java.util.Locale;

/**
 * When the snapshot store is allowed to write during a test run.
 */
public enum UpdateMode {
    /** Compare only. */
    NONE,
    /** Overwrite every snapshot. */
    ALL,
    /** Overwrite snapshots that no longer match. */
    FAILED,
    /** Create snapshots that do not exist yet. */
    MISSING;

    public static UpdateMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return UpdateMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown update mode: " + value, e);
        }
    }
}
