package com.vtb.httptest.exceptions;

public enum ErrorKind {
    REQUEST_CONSTRUCTION,
    AUTHENTICATION,
    TRANSPORT,
    CANCELLED,
    SNAPSHOT_MISSING,
    SNAPSHOT_CORRUPT,
    SCHEMA_VALIDATION,
    ASSERTION_EVALUATION,
    VARIABLE_EXTRACTION
}
