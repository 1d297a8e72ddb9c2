package com.vtb.httptest.execution.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.httptest.exceptions.AuthenticationException;
import com.vtb.httptest.exceptions.CancelledException;
import com.vtb.httptest.execution.CancellationSignal;
import com.vtb.httptest.models.HttpRequest;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * OAuth2 access tokens with automatic refresh.
 * <p>
 * Token state belongs to this instance. Refreshes are serialised by a lock and re-checked after it is
 * acquired, so concurrent callers that find an expired token trigger a single token request.
 */
@Slf4j
public class OAuth2Provider implements AuthProvider {

    private record TokenState(String accessToken, String tokenType, String refreshToken, Instant expiresAt) {
    }

    private final OAuth2Config config;
    private final OkHttpClient client;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicInteger refreshCount = new AtomicInteger();

    private volatile TokenState state;

    public OAuth2Provider(OAuth2Config config, OkHttpClient client, Clock clock) {
        if (config.getTokenUrl() == null || config.getTokenUrl().isBlank()) {
            throw new IllegalArgumentException("OAuth2 token URL is required");
        }
        this.config = config;
        this.client = client;
        this.clock = clock;
        if (config.getRefreshToken() != null) {
            this.state = new TokenState(null, "Bearer", config.getRefreshToken(), null);
        }
    }

    @Override
    public HttpRequest applyAuth(HttpRequest request, CancellationSignal cancellation)
        throws AuthenticationException, CancelledException {
        TokenState current = state;
        if (needsRefresh(current)) {
            refreshLock.lock();
            try {
                current = state;
                if (needsRefresh(current)) {
                    current = requestToken(current, cancellation);
                }
            } finally {
                refreshLock.unlock();
            }
        }
        return request.withHeader("Authorization", current.tokenType() + " " + current.accessToken());
    }

    @Override
    public void refreshAuth(CancellationSignal cancellation) throws AuthenticationException, CancelledException {
        refreshLock.lock();
        try {
            requestToken(state, cancellation);
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public AuthKind kind() {
        return AuthKind.OAUTH2;
    }

    /**
     * Number of token requests sent so far.
     */
    public int getRefreshCount() {
        return refreshCount.get();
    }

    public Instant getExpiresAt() {
        TokenState current = state;
        return current != null ? current.expiresAt() : null;
    }

    private boolean needsRefresh(TokenState current) {
        if (current == null || current.accessToken() == null) {
            return true;
        }
        if (current.expiresAt() == null) {
            return false;
        }
        return !clock.instant().isBefore(current.expiresAt().minus(config.getRefreshMargin()));
    }

    private TokenState requestToken(TokenState previous, CancellationSignal cancellation)
        throws AuthenticationException, CancelledException {
        cancellation.throwIfCancelled("token refresh cancelled");

        FormBody.Builder form = new FormBody.Builder();
        String storedRefresh = previous != null ? previous.refreshToken() : null;
        if (storedRefresh != null && !storedRefresh.isBlank()) {
            form.add("grant_type", "refresh_token");
            form.add("refresh_token", storedRefresh);
        } else if ("password".equals(config.getGrantType())) {
            form.add("grant_type", "password");
            form.add("username", nullToEmpty(config.getUsername()));
            form.add("password", nullToEmpty(config.getPassword()));
        } else if ("client_credentials".equals(config.getGrantType())) {
            form.add("grant_type", "client_credentials");
        } else {
            throw new AuthenticationException("Unsupported grant type: " + config.getGrantType());
        }
        if (config.getClientId() != null && !config.getClientId().isEmpty()) {
            form.add("client_id", config.getClientId());
        }
        if (config.getClientSecret() != null && !config.getClientSecret().isEmpty()) {
            form.add("client_secret", config.getClientSecret());
        }
        if (config.getScopes() != null && !config.getScopes().isEmpty()) {
            form.add("scope", String.join(" ", config.getScopes()));
        }

        Request tokenRequest = new Request.Builder()
            .url(config.getTokenUrl())
            .header("Accept", "application/json")
            .post(form.build())
            .build();

        refreshCount.incrementAndGet();
        try (Response response = client.newCall(tokenRequest).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (response.code() != 200) {
                throw new AuthenticationException("Token endpoint returned " + response.code() + ": " + truncate(text));
            }
            TokenState next = parse(text, storedRefresh);
            state = next;
            log.debug("OAuth2 token refreshed, expires at {}", next.expiresAt());
            return next;
        } catch (IOException e) {
            throw new AuthenticationException("Token request failed: " + e.getMessage(), e);
        }
    }

    private TokenState parse(String text, String previousRefresh) throws AuthenticationException {
        JsonNode json;
        try {
            json = mapper.readTree(text);
        } catch (IOException e) {
            throw new AuthenticationException("Token response is not valid JSON", e);
        }
        if (json == null || !json.hasNonNull("access_token") || json.get("access_token").asText().isEmpty()) {
            throw new AuthenticationException("Token response has no access_token");
        }
        String tokenType = json.hasNonNull("token_type") ? json.get("token_type").asText() : "Bearer";
        if (tokenType.equalsIgnoreCase("bearer")) {
            tokenType = "Bearer";
        }
        String refreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : previousRefresh;
        Instant expiresAt = null;
        long expiresIn = json.path("expires_in").asLong(0);
        if (expiresIn > 0) {
            expiresAt = clock.instant().plusSeconds(expiresIn);
        }
        return new TokenState(json.get("access_token").asText(), tokenType, refreshToken, expiresAt);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String truncate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
