package com.vtb.httptest.exceptions;

/**
 * The assertion could not be evaluated (unknown type, bad regular expression, non-numeric operand).
 * A failed assertion is not an exception.
 */
public class AssertionEvaluationException extends HttpTestException {

    public AssertionEvaluationException(String message) {
        super(ErrorKind.ASSERTION_EVALUATION, message);
    }

    public AssertionEvaluationException(String message, Throwable cause) {
        super(ErrorKind.ASSERTION_EVALUATION, message, cause);
    }
}
