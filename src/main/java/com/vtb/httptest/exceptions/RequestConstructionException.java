package com.vtb.httptest.exceptions;

/**
 * Malformed method, URL or body; nothing was sent.
 */
public class RequestConstructionException extends HttpTestException {

    public RequestConstructionException(String message) {
        super(ErrorKind.REQUEST_CONSTRUCTION, message);
    }

    public RequestConstructionException(String message, Throwable cause) {
        super(ErrorKind.REQUEST_CONSTRUCTION, message, cause);
    }
}
