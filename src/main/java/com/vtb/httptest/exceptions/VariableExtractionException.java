package com.vtb.httptest.exceptions;

/**
 * A required variable could not be extracted from the response.
 */
public class VariableExtractionException extends HttpTestException {

    public VariableExtractionException(String message) {
        super(ErrorKind.VARIABLE_EXTRACTION, message);
    }

    public VariableExtractionException(String message, Throwable cause) {
        super(ErrorKind.VARIABLE_EXTRACTION, message, cause);
    }
}
