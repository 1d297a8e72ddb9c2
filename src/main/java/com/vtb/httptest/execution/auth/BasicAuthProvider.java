package com.vtb.httptest.execution.auth;

import com.vtb.httptest.execution.CancellationSignal;
import com.vtb.httptest.models.HttpRequest;
import okhttp3.Credentials;

import java.nio.charset.StandardCharsets;

public class BasicAuthProvider implements AuthProvider {

    private final String headerValue;

    public BasicAuthProvider(String username, String password) {
        this.headerValue = Credentials.basic(username, password, StandardCharsets.UTF_8);
    }

    @Override
    public HttpRequest applyAuth(HttpRequest request, CancellationSignal cancellation) {
        return request.withHeader("Authorization", headerValue);
    }

    @Override
    public void refreshAuth(CancellationSignal cancellation) {
        // static credentials
    }

    @Override
    public AuthKind kind() {
        return AuthKind.BASIC;
    }
}
