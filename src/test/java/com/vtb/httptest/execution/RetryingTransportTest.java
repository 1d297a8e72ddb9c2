package com.vtb.httptest.execution;

import com.vtb.httptest.exceptions.CancelledException;
import com.vtb.httptest.exceptions.TransportException;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryingTransportTest {

    private static final Request GET = new Request.Builder().url("http://localhost/items").build();
    private static final Request POST = new Request.Builder()
        .url("http://localhost/items")
        .post(RequestBody.create("{}", MediaType.get("application/json")))
        .build();

    private static RetryPolicy noWait() {
        return RetryPolicy.builder()
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .build();
    }

    private static Response response(Request request, int code) {
        return new Response.Builder()
            .request(request)
            .protocol(Protocol.HTTP_1_1)
            .code(code)
            .message("status " + code)
            .body(ResponseBody.create("", MediaType.get("text/plain")))
            .build();
    }

    @Test
    void backoffGrowsExponentiallyAndIsCapped() {
        RetryingTransport transport = new RetryingTransport(r -> response(r, 200), RetryPolicy.defaults(), () -> 0.5);

        assertEquals(Duration.ofMillis(500), transport.backoff(0));
        assertEquals(Duration.ofMillis(1000), transport.backoff(1));
        assertEquals(Duration.ofMillis(4000), transport.backoff(3));
        assertEquals(Duration.ofSeconds(30), transport.backoff(10));
    }

    @Test
    void jitterStaysWithinBounds() {
        RetryingTransport low = new RetryingTransport(r -> response(r, 200), RetryPolicy.defaults(), () -> 0.0);
        RetryingTransport high = new RetryingTransport(r -> response(r, 200), RetryPolicy.defaults(), () -> 0.999);

        assertEquals(Duration.ofMillis(400), low.backoff(0));
        long upper = high.backoff(0).toMillis();
        assertTrue(upper > 500 && upper <= 600, "upper bound was " + upper);
        assertEquals(Duration.ofMillis(24_000), low.backoff(20));
    }

    @Test
    void retriesRetryableStatusUntilSuccess() throws Exception {
        Deque<Integer> codes = new ArrayDeque<>(List.of(503, 502, 200));
        AtomicInteger calls = new AtomicInteger();
        RetryingTransport transport = new RetryingTransport(r -> {
            calls.incrementAndGet();
            return response(r, codes.poll());
        }, noWait(), () -> 0.5);

        TransportResult result = transport.send(GET, new CancellationSignal());

        assertEquals(200, result.response().code());
        assertEquals(3, result.attempts());
        assertEquals(3, calls.get());
        result.response().close();
    }

    @Test
    void returnsLastRetryableStatusWhenRetriesAreExhausted() throws Exception {
        RetryingTransport transport = new RetryingTransport(r -> response(r, 503), noWait(), () -> 0.5);

        TransportResult result = transport.send(GET, new CancellationSignal());

        assertEquals(503, result.response().code());
        assertEquals(4, result.attempts());
        result.response().close();
    }

    @Test
    void transientErrorsExhaustIntoTransportException() {
        AtomicInteger calls = new AtomicInteger();
        RetryingTransport transport = new RetryingTransport(r -> {
            calls.incrementAndGet();
            throw new ConnectException("Connection refused");
        }, noWait(), () -> 0.5);

        TransportException error = assertThrows(TransportException.class,
            () -> transport.send(GET, new CancellationSignal()));
        assertEquals(4, error.getAttempts());
        assertEquals(4, calls.get());
    }

    @Test
    void permanentErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        RetryingTransport transport = new RetryingTransport(r -> {
            calls.incrementAndGet();
            throw new IOException("certificate rejected");
        }, noWait(), () -> 0.5);

        TransportException error = assertThrows(TransportException.class,
            () -> transport.send(GET, new CancellationSignal()));
        assertEquals(1, error.getAttempts());
        assertEquals(1, calls.get());
    }

    @Test
    void decidesRetriesPerPolicy() {
        RetryingTransport transport = new RetryingTransport(r -> response(r, 200), RetryPolicy.defaults(), () -> 0.5);
        CancellationSignal signal = new CancellationSignal();

        assertTrue(transport.shouldRetry(GET, response(GET, 429), null, 0, signal));
        assertFalse(transport.shouldRetry(GET, response(GET, 404), null, 0, signal));
        assertFalse(transport.shouldRetry(GET, response(GET, 503), null, 3, signal));
        assertTrue(transport.shouldRetry(GET, null, new IOException("wrapped", new SocketTimeoutException("read")), 0, signal));
        assertTrue(transport.shouldRetry(POST, response(POST, 503), null, 0, signal));

        signal.cancel();
        assertFalse(transport.shouldRetry(GET, response(GET, 503), null, 0, signal));
    }

    @Test
    void idempotentOnlyPolicySkipsPost() {
        RetryPolicy policy = noWait().toBuilder().idempotentOnly(true).build();
        RetryingTransport transport = new RetryingTransport(r -> response(r, 503), policy, () -> 0.5);
        CancellationSignal signal = new CancellationSignal();

        assertFalse(transport.shouldRetry(POST, response(POST, 503), null, 0, signal));
        assertTrue(transport.shouldRetry(GET, response(GET, 503), null, 0, signal));
    }

    @Test
    void cancelledSignalStopsBeforeSending() {
        AtomicInteger calls = new AtomicInteger();
        RetryingTransport transport = new RetryingTransport(r -> {
            calls.incrementAndGet();
            return response(r, 200);
        }, noWait(), () -> 0.5);
        CancellationSignal signal = new CancellationSignal();
        signal.cancel("user abort");

        assertThrows(CancelledException.class, () -> transport.send(GET, signal));
        assertEquals(0, calls.get());
    }

    @Test
    void cancellationAbortsBackoffWait() {
        RetryPolicy slow = RetryPolicy.builder()
            .initialBackoff(Duration.ofSeconds(20))
            .maxBackoff(Duration.ofSeconds(20))
            .build();
        CancellationSignal signal = new CancellationSignal();
        RetryingTransport transport = new RetryingTransport(r -> response(r, 503), slow, () -> 0.5);
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel("stop");
        });
        canceller.start();

        long started = System.nanoTime();
        assertThrows(CancelledException.class, () -> transport.send(GET, signal));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(5)) < 0);
    }

    @Test
    void rejectsInvalidPolicy() {
        RetryPolicy bad = RetryPolicy.builder().jitter(1.5).build();
        assertThrows(IllegalArgumentException.class, () -> new RetryingTransport(r -> response(r, 200), bad, () -> 0.5));
    }
}
