package com.vtb.httptest.exceptions;

/**
 * The validator could not run (no schema, unreadable document). Violations are reported
 * through {@link com.vtb.httptest.models.SchemaValidationResult} instead.
 */
public class SchemaValidationException extends HttpTestException {

    public SchemaValidationException(String message) {
        super(ErrorKind.SCHEMA_VALIDATION, message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(ErrorKind.SCHEMA_VALIDATION, message, cause);
    }
}
