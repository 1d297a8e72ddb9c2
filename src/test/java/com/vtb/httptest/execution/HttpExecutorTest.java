package com.vtb.httptest.execution;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.vtb.httptest.exceptions.RequestConstructionException;
import com.vtb.httptest.exceptions.TransportException;
import com.vtb.httptest.execution.auth.BearerTokenProvider;
import com.vtb.httptest.models.AuthDescriptor;
import com.vtb.httptest.models.HttpFile;
import com.vtb.httptest.models.HttpHeader;
import com.vtb.httptest.models.HttpRequest;
import com.vtb.httptest.models.HttpResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HttpExecutorTest {

    private HttpServer server;
    private String baseUrl;
    private HttpExecutor executor;
    private final AtomicInteger flakyCalls = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/login", exchange -> {
            exchange.getResponseHeaders().add("Set-Cookie", "session=abc123; Path=/");
            send(exchange, 200, "application/json", "{\"ok\":true}");
        });
        server.createContext("/me", exchange -> {
            String cookie = exchange.getRequestHeaders().getFirst("Cookie");
            send(exchange, 200, "text/plain", cookie != null ? cookie : "none");
        });
        server.createContext("/echo", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            String trace = exchange.getRequestHeaders().getFirst("X-Trace");
            send(exchange, 200, "text/plain",
                exchange.getRequestMethod() + "|" + exchange.getRequestURI() + "|" + body + "|" + trace + "|" + auth);
        });
        server.createContext("/flaky", exchange -> {
            if (flakyCalls.incrementAndGet() == 1) {
                send(exchange, 503, "text/plain", "busy");
            } else {
                send(exchange, 200, "text/plain", "ready");
            }
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();

        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .build();
        RetryingTransport transport = new RetryingTransport(
            HttpClientFactory.create(Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(2), true, "test-agent"),
            policy);
        VariableStore variables = new VariableStore();
        variables.set("base", baseUrl);
        executor = new HttpExecutor(transport, new InMemorySessionStore(), variables, new VariableSubstitutor(), null,
            Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private static void send(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void substitutesVariablesFromStoreAndCall() throws Exception {
        HttpRequest request = HttpRequest.builder()
            .method("POST")
            .url("{{base}}/echo?id=${id}")
            .header(new HttpHeader("X-Trace", "{{trace}}"))
            .header(new HttpHeader("Content-Type", "application/json"))
            .body("{\"id\":\"${id}\"}")
            .build();

        HttpResponse response = executor.execute(request, Map.of("id", "42", "trace", "t-9"), new CancellationSignal());

        assertEquals(200, response.getStatusCode());
        assertEquals("POST|/echo?id=42|{\"id\":\"42\"}|t-9|null", response.bodyAsString());
        assertEquals(baseUrl + "/echo?id=42", response.getRequest().getUrl());
        assertEquals("text/plain", response.mediaType());
        assertNotNull(response.getRequestId());
        assertEquals(1, response.getAttempts());
    }

    @Test
    void callVariablesWinOverStore() throws Exception {
        HttpRequest request = HttpRequest.builder().url("{{base}}/echo").build();

        HttpResponse response = executor.execute(request, Map.of("base", baseUrl), new CancellationSignal());
        assertEquals(200, response.getStatusCode());

        assertThrows(RequestConstructionException.class,
            () -> executor.execute(request, Map.of("base", "not a url"), new CancellationSignal()));
    }

    @Test
    void carriesSessionCookiesBetweenRequests() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        executor.execute(HttpRequest.builder().url(baseUrl + "/login").build(), Map.of(), signal);

        HttpResponse me = executor.execute(HttpRequest.builder().url(baseUrl + "/me").build(), Map.of(), signal);

        assertEquals("session=abc123", me.bodyAsString());
        assertFalse(executor.getSessionStore().hosts().isEmpty());
    }

    @Test
    void appliesBasicAuthDescriptor() throws Exception {
        HttpRequest request = HttpRequest.builder()
            .url(baseUrl + "/echo")
            .auth(new AuthDescriptor("basic", "user:pass"))
            .build();

        HttpResponse response = executor.execute(request, Map.of(), new CancellationSignal());

        assertTrue(response.bodyAsString().endsWith("|Basic dXNlcjpwYXNz"));
    }

    @Test
    void appliesBearerAuthDescriptorWithSubstitutedToken() throws Exception {
        HttpRequest request = HttpRequest.builder()
            .url("{{base}}/echo")
            .header(new HttpHeader("authorization", "stale"))
            .auth(new AuthDescriptor("Bearer", "{{token}}-${suffix}"))
            .build();

        HttpResponse response = executor.execute(request, Map.of("token", "tok-7", "suffix", "x"),
            new CancellationSignal());

        assertTrue(response.bodyAsString().endsWith("|Bearer tok-7-x"), response.bodyAsString());
        List<String> sent = response.getRequest().getHeaders().stream()
            .filter(h -> "Authorization".equalsIgnoreCase(h.getName()))
            .map(HttpHeader::getValue)
            .collect(Collectors.toList());
        assertEquals(List.of("Bearer tok-7-x"), sent);
    }

    @Test
    void defaultBearerProviderYieldsToRequestDescriptor() throws Exception {
        RetryingTransport transport = new RetryingTransport(
            HttpClientFactory.create(Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(2), true, null),
            RetryPolicy.noRetries());
        HttpExecutor withDefault = new HttpExecutor(transport, new InMemorySessionStore(), new VariableStore(),
            new VariableSubstitutor(), new BearerTokenProvider("service-token"), Clock.systemUTC());
        CancellationSignal signal = new CancellationSignal();

        HttpResponse plain = withDefault.execute(HttpRequest.builder().url(baseUrl + "/echo").build(), Map.of(), signal);
        HttpResponse own = withDefault.execute(HttpRequest.builder()
            .url(baseUrl + "/echo")
            .auth(new AuthDescriptor("bearer", "own"))
            .build(), Map.of(), signal);

        assertTrue(plain.bodyAsString().endsWith("|Bearer service-token"), plain.bodyAsString());
        assertTrue(own.bodyAsString().endsWith("|Bearer own"), own.bodyAsString());
        assertThrows(RequestConstructionException.class, () -> withDefault.execute(HttpRequest.builder()
            .url(baseUrl + "/echo")
            .auth(new AuthDescriptor("bearer", "${blank}"))
            .build(), Map.of("blank", ""), signal));
    }

    @Test
    void retriesServiceUnavailable() throws Exception {
        HttpResponse response = executor.execute(HttpRequest.builder().url(baseUrl + "/flaky").build(), Map.of(),
            new CancellationSignal());

        assertEquals(200, response.getStatusCode());
        assertEquals(2, response.getAttempts());
        assertEquals("ready", response.bodyAsString());
    }

    @Test
    void rejectsMalformedRequests() {
        CancellationSignal signal = new CancellationSignal();
        assertThrows(RequestConstructionException.class,
            () -> executor.execute(HttpRequest.builder().url("::not-a-url").build(), Map.of(), signal));
        assertThrows(RequestConstructionException.class,
            () -> executor.execute(HttpRequest.builder()
                .url(baseUrl + "/echo")
                .header(new HttpHeader("Bad Header", "x"))
                .build(), Map.of(), signal));
        assertThrows(RequestConstructionException.class,
            () -> executor.execute(HttpRequest.builder()
                .url(baseUrl + "/echo")
                .auth(new AuthDescriptor("digest", "x"))
                .build(), Map.of(), signal));
    }

    @Test
    void reportsTransportFailure() {
        RetryingTransport transport = new RetryingTransport(
            HttpClientFactory.create(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1), true, null),
            RetryPolicy.noRetries());
        HttpExecutor unreachable = new HttpExecutor(transport);

        TransportException error = assertThrows(TransportException.class,
            () -> unreachable.execute(HttpRequest.builder().url("http://localhost:1/down").build(), Map.of(),
                new CancellationSignal()));
        assertEquals(1, error.getAttempts());
    }

    @Test
    void batchContinuesPastFailingRequest() {
        HttpFile file = HttpFile.builder()
            .path("collection.http")
            .request(HttpRequest.builder().url(baseUrl + "/echo").name("first").build())
            .request(HttpRequest.builder().url("{{undefined}}/echo").name("broken").build())
            .request(HttpRequest.builder().url(baseUrl + "/me").name("third").build())
            .build();

        List<HttpResponse> responses = executor.executeFile(file, Map.of(), new CancellationSignal());

        assertEquals(2, responses.size());
        assertEquals("first", responses.get(0).getRequest().getName());
        assertEquals("third", responses.get(1).getRequest().getName());
    }

    @Test
    void cancelledBatchReturnsNothing() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        List<HttpResponse> responses = executor.executeBatch(
            List.of(HttpRequest.builder().url(baseUrl + "/echo").build()), Map.of(), signal);

        assertTrue(responses.isEmpty());
    }
}
