package com.vtb.httptest.execution.auth;

import com.vtb.httptest.execution.CancellationSignal;
import com.vtb.httptest.models.HttpRequest;

public class BearerTokenProvider implements AuthProvider {

    private final String token;

    public BearerTokenProvider(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Bearer token must not be empty");
        }
        this.token = token;
    }

    @Override
    public HttpRequest applyAuth(HttpRequest request, CancellationSignal cancellation) {
        return request.withHeader("Authorization", "Bearer " + token);
    }

    @Override
    public void refreshAuth(CancellationSignal cancellation) {
        // static token
    }

    @Override
    public AuthKind kind() {
        return AuthKind.BEARER;
    }
}
