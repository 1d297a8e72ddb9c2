package com.vtb.httptest.execution;

import com.vtb.httptest.exceptions.CancelledException;
import com.vtb.httptest.exceptions.HttpTestException;
import com.vtb.httptest.exceptions.RequestConstructionException;
import com.vtb.httptest.exceptions.TransportException;
import com.vtb.httptest.execution.auth.AuthProvider;
import com.vtb.httptest.execution.auth.AuthProviders;
import com.vtb.httptest.models.HttpFile;
import com.vtb.httptest.models.HttpHeader;
import com.vtb.httptest.models.HttpRequest;
import com.vtb.httptest.models.HttpResponse;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Cookie;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Executes request templates: substitutes variables, applies auth and session cookies, sends through
 * the {@link RetryingTransport} and turns the result into an {@link HttpResponse}.
 */
@Slf4j
public class HttpExecutor {

    private final RetryingTransport transport;
    private final SessionStore sessionStore;
    private final VariableStore variables;
    private final VariableSubstitutor substitutor;
    private final AuthProvider authProvider;
    private final Clock clock;
    private final AtomicLong requestCounter = new AtomicLong();

    public HttpExecutor(RetryingTransport transport) {
        this(transport, new InMemorySessionStore(), new VariableStore(), new VariableSubstitutor(), null,
            Clock.systemUTC());
    }

    /**
     * @param authProvider default provider for requests without their own auth descriptor; may be {@code null}
     */
    public HttpExecutor(RetryingTransport transport,
                        SessionStore sessionStore,
                        VariableStore variables,
                        VariableSubstitutor substitutor,
                        AuthProvider authProvider,
                        Clock clock) {
        this.transport = transport;
        this.sessionStore = sessionStore;
        this.variables = variables;
        this.substitutor = substitutor;
        this.authProvider = authProvider;
        this.clock = clock;
    }

    public SessionStore getSessionStore() {
        return sessionStore;
    }

    public VariableStore getVariables() {
        return variables;
    }

    public VariableSubstitutor getSubstitutor() {
        return substitutor;
    }

    public HttpResponse execute(HttpRequest request, Map<String, String> callVariables,
                                CancellationSignal cancellation) throws HttpTestException {
        return execute(request, callVariables, null, cancellation);
    }

    /**
     * Executes one request.
     *
     * @param callVariables values for this call; they win over the run-scoped store
     * @param timeout       per-request timeout, {@code null} for the client default
     */
    public HttpResponse execute(HttpRequest request, Map<String, String> callVariables, Duration timeout,
                                CancellationSignal cancellation) throws HttpTestException {
        cancellation.throwIfCancelled("request cancelled before execution");
        if (request == null) {
            throw new RequestConstructionException("request is null");
        }

        HttpRequest resolved = substitutor.substitute(request, variables.mergedWith(callVariables));
        AuthProvider auth = resolved.getAuth() != null
            ? AuthProviders.fromDescriptor(resolved.getAuth())
            : authProvider;
        if (auth != null) {
            resolved = auth.applyAuth(resolved, cancellation);
        }

        Request outbound = buildRequest(resolved, timeout);
        String host = SessionStore.hostKey(outbound.url());
        outbound = attachCookies(outbound, host);
        String requestId = "req-" + requestCounter.incrementAndGet();

        log.debug("[{}] {} {}", requestId, outbound.method(), outbound.url());
        long started = System.nanoTime();
        TransportResult result = transport.send(outbound, cancellation);
        HttpResponse response;
        try (Response raw = result.response()) {
            ResponseBody body = raw.body();
            byte[] bytes = body != null ? body.bytes() : new byte[0];
            Duration duration = Duration.ofNanos(System.nanoTime() - started);
            storeCookies(outbound.url(), raw.headers(), host);

            String contentType = raw.header("Content-Type");
            response = HttpResponse.builder()
                .statusCode(raw.code())
                .statusText(raw.message())
                .headers(toMultimap(raw.headers()))
                .body(bytes)
                .contentType(contentType != null && !contentType.isBlank()
                    ? contentType : HttpResponse.DEFAULT_CONTENT_TYPE)
                .contentLength(bytes.length)
                .duration(duration)
                .timestamp(clock.instant())
                .request(resolved)
                .requestId(requestId)
                .attempts(result.attempts())
                .build();
        } catch (IOException e) {
            throw new TransportException("Failed to read response body from " + outbound.url() + ": "
                + e.getMessage(), result.attempts(), e);
        }

        log.debug("[{}] {} {} bytes in {} ms ({} attempt(s))", requestId, response.getStatusCode(),
            response.getContentLength(), TimeUnit.NANOSECONDS.toMillis(response.getDuration().toNanos()),
            response.getAttempts());
        return response;
    }

    /**
     * Executes every request of the file in order. A failing request is logged and skipped;
     * cancellation stops the batch and returns what completed so far.
     */
    public List<HttpResponse> executeFile(HttpFile file, Map<String, String> callVariables,
                                          CancellationSignal cancellation) {
        log.info("Executing {} request(s) from {}", file.getRequests().size(), file.getPath());
        return executeBatch(file.getRequests(), callVariables, cancellation);
    }

    public List<HttpResponse> executeBatch(List<HttpRequest> requests, Map<String, String> callVariables,
                                           CancellationSignal cancellation) {
        List<HttpResponse> responses = new ArrayList<>();
        for (HttpRequest request : requests) {
            try {
                responses.add(execute(request, callVariables, cancellation));
            } catch (CancelledException e) {
                log.info("Batch cancelled after {} of {} request(s)", responses.size(), requests.size());
                break;
            } catch (HttpTestException e) {
                log.warn("Skipping {}: {}", request.displayName(), e.getMessage());
            }
        }
        return responses;
    }

    private Request buildRequest(HttpRequest request, Duration timeout) throws RequestConstructionException {
        String method = request.getMethod() != null ? request.getMethod().trim().toUpperCase(Locale.ROOT) : "GET";
        HttpUrl url = request.getUrl() != null ? HttpUrl.parse(request.getUrl().trim()) : null;
        if (url == null) {
            throw new RequestConstructionException("Invalid URL: " + request.getUrl());
        }
        try {
            Request.Builder builder = new Request.Builder().url(url);
            if (request.getHeaders() != null) {
                for (HttpHeader header : request.getHeaders()) {
                    if (header.getName() != null && !header.getName().isBlank()) {
                        builder.addHeader(header.getName().trim(), header.getValue() != null ? header.getValue() : "");
                    }
                }
            }
            builder.method(method, requestBody(method, request));
            if (timeout != null) {
                builder.tag(RequestTimeout.class, new RequestTimeout(timeout));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new RequestConstructionException("Cannot build " + method + " " + url + ": " + e.getMessage(), e);
        }
    }

    private RequestBody requestBody(String method, HttpRequest request) {
        String body = request.getBody();
        boolean hasBody = body != null && !body.isEmpty();
        if ("GET".equals(method) || "HEAD".equals(method)) {
            if (hasBody) {
                log.debug("Ignoring body of {} request {}", method, request.getUrl());
            }
            return null;
        }
        String contentType = request.headerValue("Content-Type");
        MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
        if (hasBody) {
            return RequestBody.create(body.getBytes(StandardCharsets.UTF_8), mediaType);
        }
        if ("POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method)) {
            return RequestBody.create(new byte[0], mediaType);
        }
        return null;
    }

    private Request attachCookies(Request request, String host) {
        List<Cookie> cookies = sessionStore.getCookies(host).stream()
            .filter(cookie -> cookie.expiresAt() > clock.millis())
            .filter(cookie -> cookie.matches(request.url()))
            .collect(Collectors.toList());
        if (cookies.isEmpty()) {
            return request;
        }
        String header = cookies.stream()
            .map(cookie -> cookie.name() + "=" + cookie.value())
            .collect(Collectors.joining("; "));
        String existing = request.header("Cookie");
        if (existing != null && !existing.isBlank()) {
            header = existing + "; " + header;
        }
        return request.newBuilder().header("Cookie", header).build();
    }

    private void storeCookies(HttpUrl url, Headers headers, String host) {
        for (Cookie cookie : Cookie.parseAll(url, headers)) {
            sessionStore.setCookie(host, cookie);
        }
    }

    private static Map<String, List<String>> toMultimap(Headers headers) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String name = headers.name(i);
            String key = result.keySet().stream()
                .filter(existing -> existing.equalsIgnoreCase(name))
                .findFirst()
                .orElse(name);
            result.computeIfAbsent(key, k -> new ArrayList<>()).add(headers.value(i));
        }
        return result;
    }
}
