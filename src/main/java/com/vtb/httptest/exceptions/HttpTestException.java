package com.vtb.httptest.exceptions;

/**
 * Base for all failures raised by the execution engine. Callers branch on {@link #getKind()}
 * or on the concrete subclass.
 */
public abstract class HttpTestException extends Exception {

    private final ErrorKind kind;

    protected HttpTestException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected HttpTestException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
