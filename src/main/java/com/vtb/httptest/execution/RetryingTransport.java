package com.vtb.httptest.execution;

import com.vtb.httptest.exceptions.CancelledException;
import com.vtb.httptest.exceptions.TransportException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Sends a request and retries timeouts, transient network errors and retryable status codes
 * with exponential backoff and jitter.
 * <p>
 * Request bodies built from strings or byte arrays are re-readable, so every attempt re-sends the
 * full body. Backoff waits observe the cancellation signal.
 */
@Slf4j
public class RetryingTransport {

    private static final Set<String> IDEMPOTENT_METHODS = Set.of("GET", "HEAD", "OPTIONS", "PUT", "DELETE", "TRACE");

    /**
     * One network round trip without any retry logic.
     */
    @FunctionalInterface
    public interface RawSender {
        Response send(Request request) throws IOException;
    }

    private final RawSender sender;
    private final RetryPolicy policy;
    private final DoubleSupplier random;

    public RetryingTransport(OkHttpClient client, RetryPolicy policy) {
        this(request -> client.newCall(request).execute(), policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in {@code [0, 1)} used for jitter
     */
    public RetryingTransport(RawSender sender, RetryPolicy policy, DoubleSupplier random) {
        policy.validate();
        this.sender = sender;
        this.policy = policy;
        this.random = random;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public TransportResult send(Request request, CancellationSignal cancellation)
        throws TransportException, CancelledException {
        int attempt = 0;
        while (true) {
            cancellation.throwIfCancelled("request cancelled");

            Response response = null;
            IOException error = null;
            try {
                response = sender.send(request);
            } catch (IOException e) {
                error = e;
            }

            if (!shouldRetry(request, response, error, attempt, cancellation)) {
                if (error == null) {
                    return new TransportResult(response, attempt + 1);
                }
                if (cancellation.isCancelled()) {
                    throw new CancelledException("request cancelled after " + (attempt + 1) + " attempt(s)", error);
                }
                if (attempt > 0) {
                    log.error("Giving up on {} {} after {} attempt(s): {}",
                        request.method(), request.url(), attempt + 1, error.getMessage());
                }
                throw new TransportException(request.method() + " " + request.url() + " failed after "
                    + (attempt + 1) + " attempt(s): " + error.getMessage(), attempt + 1, error);
            }

            Duration delay = backoff(attempt);
            log.debug("Retrying {} {} (attempt {}, {}), waiting {} ms",
                request.method(), request.url(), attempt + 1,
                response != null ? "status " + response.code() : String.valueOf(error),
                delay.toMillis());
            if (response != null) {
                response.close();
            }
            cancellation.await(delay);
            attempt++;
        }
    }

    /**
     * Decides whether the outcome of attempt {@code attempt} (0-based) warrants another try.
     */
    public boolean shouldRetry(Request request, Response response, Throwable error, int attempt,
                               CancellationSignal cancellation) {
        if (attempt >= policy.getMaxRetries()) {
            return false;
        }
        if (cancellation != null && cancellation.isCancelled()) {
            return false;
        }
        if (policy.isIdempotentOnly() && request != null
            && !IDEMPOTENT_METHODS.contains(request.method().toUpperCase(Locale.ROOT))) {
            return false;
        }
        if (error != null) {
            return isRetryableError(error);
        }
        return response != null && policy.isRetryableStatus(response.code());
    }

    /**
     * Jittered delay before the retry that follows attempt {@code attempt}.
     */
    public Duration backoff(int attempt) {
        Duration base = policy.baseBackoff(attempt);
        double jitter = policy.getJitter();
        if (jitter <= 0.0) {
            return base;
        }
        double factor = 1.0 - jitter + 2.0 * jitter * random.getAsDouble();
        return Duration.ofMillis(Math.round(base.toMillis() * factor));
    }

    boolean isRetryableError(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (isTransient(current)) {
                return true;
            }
            for (Class<? extends Throwable> type : policy.getRetryableErrors()) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static boolean isTransient(Throwable error) {
        if (error instanceof SocketTimeoutException
            || error instanceof ConnectException
            || error instanceof NoRouteToHostException) {
            return true;
        }
        String message = error.getMessage() != null ? error.getMessage().toLowerCase(Locale.ROOT) : "";
        // OkHttp reports call timeouts as InterruptedIOException("timeout")
        if (error instanceof InterruptedIOException && message.contains("timeout")) {
            return true;
        }
        if (error instanceof SocketException
            && (message.contains("connection reset") || message.contains("broken pipe"))) {
            return true;
        }
        return error instanceof IOException && message.contains("unexpected end of stream");
    }
}
