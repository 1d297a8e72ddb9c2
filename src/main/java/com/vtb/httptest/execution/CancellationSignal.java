package com.vtb.httptest.execution;

import com.vtb.httptest.exceptions.CancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Run-wide cancellation flag shared by the executor, the retry waits, the worker loop and step waits.
 * <p>
 * Waits return as soon as {@link #cancel()} is called. Requests already on the wire are not aborted.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile String reason = "cancelled";

    public void cancel() {
        cancel("cancelled");
    }

    public void cancel(String reason) {
        if (latch.getCount() > 0) {
            this.reason = reason;
            latch.countDown();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled(String context) throws CancelledException {
        if (isCancelled()) {
            throw new CancelledException(context + ": " + reason);
        }
    }

    /**
     * Blocks for the given duration unless cancelled first.
     *
     * @throws CancelledException when the signal fires during the wait or the thread is interrupted
     */
    public void await(Duration duration) throws CancelledException {
        throwIfCancelled("wait aborted");
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            if (latch.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new CancelledException("wait aborted: " + reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("wait interrupted", e);
        }
    }
}
