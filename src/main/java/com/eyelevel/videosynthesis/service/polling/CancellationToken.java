package com.eyelevel.videosynthesis.service.polling;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared between a job's owner and the thread running it. Once
 * cancelled it stays cancelled.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if cancellation was requested before the timeout elapsed
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
