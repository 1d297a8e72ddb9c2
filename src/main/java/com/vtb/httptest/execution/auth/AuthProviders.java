package com.vtb.httptest.execution.auth;

import com.vtb.httptest.exceptions.RequestConstructionException;
import com.vtb.httptest.models.AuthDescriptor;

import java.util.Locale;

/**
 * Builds providers for per-request auth descriptors.
 */
public final class AuthProviders {

    private AuthProviders() {
    }

    public static AuthProvider fromDescriptor(AuthDescriptor descriptor) throws RequestConstructionException {
        if (descriptor == null || descriptor.getType() == null) {
            throw new RequestConstructionException("Auth descriptor has no type");
        }
        String value = descriptor.getValue() != null ? descriptor.getValue() : "";
        switch (descriptor.getType().toLowerCase(Locale.ROOT)) {
            case "basic" -> {
                int colon = value.indexOf(':');
                if (colon < 0) {
                    throw new RequestConstructionException("Basic auth value must be user:password");
                }
                return new BasicAuthProvider(value.substring(0, colon), value.substring(colon + 1));
            }
            case "bearer" -> {
                if (value.isBlank()) {
                    throw new RequestConstructionException("Bearer auth value is empty");
                }
                return new BearerTokenProvider(value);
            }
            default -> throw new RequestConstructionException("Unsupported auth type: " + descriptor.getType());
        }
    }
}
