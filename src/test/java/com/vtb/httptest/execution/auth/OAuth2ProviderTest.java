package com.vtb.httptest.execution.auth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.vtb.httptest.exceptions.AuthenticationException;
import com.vtb.httptest.execution.CancellationSignal;
import com.vtb.httptest.models.HttpRequest;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OAuth2ProviderTest {

    private HttpServer server;
    private ExecutorService serverThreads;
    private String tokenUrl;
    private final List<String> forms = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger issued = new AtomicInteger();
    private volatile int tokenStatus = 200;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverThreads = Executors.newFixedThreadPool(4);
        server.setExecutor(serverThreads);
        server.createContext("/token", this::token);
        server.start();
        tokenUrl = "http://localhost:" + server.getAddress().getPort() + "/token";
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
        if (serverThreads != null) {
            serverThreads.shutdownNow();
        }
    }

    private void token(HttpExchange exchange) throws IOException {
        forms.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        String body;
        if (tokenStatus != 200) {
            body = "{\"error\":\"invalid_client\"}";
        } else {
            int n = issued.incrementAndGet();
            body = "{\"access_token\":\"token-" + n + "\",\"token_type\":\"bearer\",\"expires_in\":3600,"
                + "\"refresh_token\":\"refresh-" + n + "\"}";
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(tokenStatus, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now = Instant.parse("2024-01-01T00:00:00Z");

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }
    }

    private OAuth2Config.OAuth2ConfigBuilder config() {
        return OAuth2Config.builder()
            .tokenUrl(tokenUrl)
            .clientId("client")
            .clientSecret("secret")
            .scopes(List.of("read", "write"));
    }

    @Test
    void fetchesTokenOnceAndReusesIt() throws Exception {
        OAuth2Provider provider = new OAuth2Provider(config().build(), new OkHttpClient(), new MutableClock());
        CancellationSignal signal = new CancellationSignal();

        HttpRequest first = provider.applyAuth(HttpRequest.builder().url("http://api/x").build(), signal);
        HttpRequest second = provider.applyAuth(HttpRequest.builder().url("http://api/y").build(), signal);

        assertEquals("Bearer token-1", first.headerValue("Authorization"));
        assertEquals("Bearer token-1", second.headerValue("Authorization"));
        assertEquals(1, provider.getRefreshCount());
        String form = forms.get(0);
        assertTrue(form.contains("grant_type=client_credentials"), form);
        assertTrue(form.contains("client_id=client"), form);
        assertTrue(form.contains("scope=read%20write"), form);
    }

    @Test
    void refreshesWithinMarginUsingRefreshToken() throws Exception {
        MutableClock clock = new MutableClock();
        OAuth2Provider provider = new OAuth2Provider(config().build(), new OkHttpClient(), clock);
        CancellationSignal signal = new CancellationSignal();
        provider.applyAuth(HttpRequest.builder().url("http://api/x").build(), signal);

        clock.advance(Duration.ofSeconds(3600 - 30));
        HttpRequest refreshed = provider.applyAuth(HttpRequest.builder().url("http://api/x").build(), signal);

        assertEquals("Bearer token-2", refreshed.headerValue("Authorization"));
        assertEquals(2, provider.getRefreshCount());
        assertTrue(forms.get(1).contains("grant_type=refresh_token"), forms.get(1));
        assertTrue(forms.get(1).contains("refresh_token=refresh-1"), forms.get(1));
    }

    @Test
    void usesPasswordGrantWhenConfigured() throws Exception {
        OAuth2Provider provider = new OAuth2Provider(
            config().grantType("password").username("alice").password("pw").build(), new OkHttpClient(), new MutableClock());

        provider.applyAuth(HttpRequest.builder().url("http://api/x").build(), new CancellationSignal());

        String form = forms.get(0);
        assertTrue(form.contains("grant_type=password"), form);
        assertTrue(form.contains("username=alice"), form);
    }

    @Test
    void concurrentCallersShareOneRefresh() throws Exception {
        OAuth2Provider provider = new OAuth2Provider(config().build(), new OkHttpClient(), new MutableClock());
        CancellationSignal signal = new CancellationSignal();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<HttpRequest>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return provider.applyAuth(HttpRequest.builder().url("http://api/x").build(), signal);
                }));
            }
            start.countDown();
            for (Future<HttpRequest> future : futures) {
                assertEquals("Bearer token-1", future.get().headerValue("Authorization"));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, provider.getRefreshCount());
    }

    @Test
    void tokenEndpointErrorIsAuthenticationFailure() {
        tokenStatus = 401;
        OAuth2Provider provider = new OAuth2Provider(config().build(), new OkHttpClient(), new MutableClock());

        AuthenticationException error = assertThrows(AuthenticationException.class,
            () -> provider.applyAuth(HttpRequest.builder().url("http://api/x").build(), new CancellationSignal()));
        assertTrue(error.getMessage().contains("401"));
    }

    @Test
    void unsupportedGrantTypeFails() {
        OAuth2Provider provider = new OAuth2Provider(config().grantType("implicit").build(), new OkHttpClient(),
            new MutableClock());

        assertThrows(AuthenticationException.class,
            () -> provider.refreshAuth(new CancellationSignal()));
        assertEquals(0, provider.getRefreshCount());
    }
}
