package com.vtb.httptest.exceptions;

/**
 * Token endpoint rejected the request or returned a body that could not be parsed.
 */
public class AuthenticationException extends HttpTestException {

    public AuthenticationException(String message) {
        super(ErrorKind.AUTHENTICATION, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
    }
}
