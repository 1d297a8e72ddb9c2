package com.vtb.httptest.execution.auth;

public enum AuthKind {
    BASIC,
    BEARER,
    OAUTH2
}
