package com.vtb.httptest.exceptions;

public class CancelledException extends HttpTestException {

    public CancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }

    public CancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
