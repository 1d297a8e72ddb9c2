package com.vtb.httptest.execution;

import okhttp3.Response;

/**
 * Final response of a retried send and the number of attempts it took. The caller closes the response.
 */
public record TransportResult(Response response, int attempts) {
}
