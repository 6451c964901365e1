package com.bank.aml.monitor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot shutdown signal. The monitoring loop checks it between passes and waits on it
 * while sleeping, so cancelling cuts the sleep short but never a pass.
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
     * Sleep for up to {@code timeout}, returning early on cancellation.
     *
     * @return true if cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
