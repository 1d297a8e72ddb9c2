package com.vtb.httptest.execution.auth;

import com.vtb.httptest.exceptions.AuthenticationException;
import com.vtb.httptest.exceptions.CancelledException;
import com.vtb.httptest.execution.CancellationSignal;
import com.vtb.httptest.models.HttpRequest;

/**
 * Adds credentials to outgoing requests.
 */
public interface AuthProvider {

    /**
     * Returns a copy of the request carrying the credentials, refreshing them first when needed.
     */
    HttpRequest applyAuth(HttpRequest request, CancellationSignal cancellation)
        throws AuthenticationException, CancelledException;

    /**
     * Forces a credential refresh. A no-op for static credentials.
     */
    void refreshAuth(CancellationSignal cancellation) throws AuthenticationException, CancelledException;

    AuthKind kind();
}
