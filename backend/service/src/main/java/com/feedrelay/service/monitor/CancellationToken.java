package com.feedrelay.service.monitor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop signal shared by the registry (which cancels) and a polling worker
 * (which checks and waits on it). Once cancelled it stays cancelled.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return {@code true} if the token was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
