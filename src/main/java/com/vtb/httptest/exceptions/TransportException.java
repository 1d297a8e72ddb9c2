package com.vtb.httptest.exceptions;

/**
 * Network failure that survived every retry.
 */
public class TransportException extends HttpTestException {

    private final int attempts;

    public TransportException(String message, int attempts, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
