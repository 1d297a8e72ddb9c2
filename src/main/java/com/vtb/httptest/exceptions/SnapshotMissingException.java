package com.vtb.httptest.exceptions;

/**
 * No snapshot is stored under the requested path.
 */
public class SnapshotMissingException extends HttpTestException {

    public SnapshotMissingException(String message) {
        super(ErrorKind.SNAPSHOT_MISSING, message);
    }

    public SnapshotMissingException(String message, Throwable cause) {
        super(ErrorKind.SNAPSHOT_MISSING, message, cause);
    }
}
