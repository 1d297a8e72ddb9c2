package com.vtb.httptest.execution;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Retry settings for {@link RetryingTransport}.
 * <p>
 * Attempt numbers start at 0, so {@code maxRetries = 3} allows four sends in total.
 * By default every method is retried, POST included; set {@code idempotentOnly} to restrict retries
 * to GET, HEAD, OPTIONS, PUT and DELETE.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);

    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    Duration initialBackoff = Duration.ofMillis(500);
    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(30);
    @Builder.Default
    double backoffFactor = 2.0;
    /** Fraction in {@code [0, 1]}; the delay is scaled by a factor drawn from {@code [1 - jitter, 1 + jitter]}. */
    @Builder.Default
    double jitter = 0.2;
    @Builder.Default
    Set<Integer> retryableStatusCodes = DEFAULT_RETRYABLE_STATUS_CODES;
    /** Extra exception types treated as transient, matched anywhere in the cause chain. */
    @Builder.Default
    List<Class<? extends Throwable>> retryableErrors = List.of();
    @Builder.Default
    boolean idempotentOnly = false;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy noRetries() {
        return RetryPolicy.builder().maxRetries(0).build();
    }

    public boolean isRetryableStatus(int statusCode) {
        return retryableStatusCodes != null && retryableStatusCodes.contains(statusCode);
    }

    /**
     * Delay before jitter: {@code min(maxBackoff, initialBackoff * backoffFactor^attempt)}.
     */
    public Duration baseBackoff(int attempt) {
        double initialMs = initialBackoff.toMillis();
        double maxMs = maxBackoff.toMillis();
        double delay = initialMs * Math.pow(backoffFactor, Math.max(0, attempt));
        if (Double.isNaN(delay) || delay > maxMs) {
            delay = maxMs;
        }
        return Duration.ofMillis(Math.round(delay));
    }

    void validate() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]: " + jitter);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1: " + backoffFactor);
        }
        if (initialBackoff == null || maxBackoff == null || initialBackoff.isNegative()
            || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff bounds are invalid");
        }
    }
}
