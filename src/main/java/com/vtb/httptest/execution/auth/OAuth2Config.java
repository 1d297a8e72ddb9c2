package com.vtb.httptest.execution.auth;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Token endpoint settings for {@link OAuth2Provider}.
 * <p>
 * {@code grantType} is {@code client_credentials} or {@code password}; a stored refresh token always
 * takes priority over it.
 */
@Value
@Builder
public class OAuth2Config {
    String tokenUrl;
    String clientId;
    String clientSecret;
    String username;
    String password;
    @Builder.Default
    List<String> scopes = List.of();
    @Builder.Default
    String grantType = "client_credentials";
    /** Token is refreshed this long before it expires. */
    @Builder.Default
    Duration refreshMargin = Duration.ofSeconds(60);
    /** Optional refresh token known up front. */
    String refreshToken;
}
