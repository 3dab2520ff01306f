package io.pgbackup.kubernetes.services;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Lets the caller of a run stop the wait for completion from another thread.
 * A cancelled run still deletes its job before returning.
 */
public class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Blocks up to {@code duration}, returning early when cancelled.
     *
     * @return {@code true} if the token was cancelled
     */
    public boolean await(Duration duration) throws InterruptedException {
        return cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }
}
