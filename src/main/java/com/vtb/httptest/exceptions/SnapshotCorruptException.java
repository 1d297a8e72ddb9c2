package com.vtb.httptest.exceptions;

/**
 * A snapshot exists but cannot be parsed.
 */
public class SnapshotCorruptException extends HttpTestException {

    public SnapshotCorruptException(String message) {
        super(ErrorKind.SNAPSHOT_CORRUPT, message);
    }

    public SnapshotCorruptException(String message, Throwable cause) {
        super(ErrorKind.SNAPSHOT_CORRUPT, message, cause);
    }
}
