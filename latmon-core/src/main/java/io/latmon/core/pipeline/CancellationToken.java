package io.latmon.core.pipeline;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared stop signal observed by every pipeline task at the top of its loop and while
 * it is suspended. The first {@link #cancel(ShutdownMode)} wins, except that a forced
 * request escalates an earlier graceful one.
 */
public final class CancellationToken {
    private final AtomicReference<ShutdownMode> mode = new AtomicReference<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CountDownLatch forced = new CountDownLatch(1);

    public void cancel(ShutdownMode requested) {
        ShutdownMode target = requested == null ? ShutdownMode.GRACEFUL : requested;
        if (target == ShutdownMode.FORCED) {
            mode.set(ShutdownMode.FORCED);
            forced.countDown();
        } else {
            mode.compareAndSet(null, ShutdownMode.GRACEFUL);
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return mode.get() != null;
    }

    public boolean isForced() {
        return mode.get() == ShutdownMode.FORCED;
    }

    public Optional<ShutdownMode> mode() {
        return Optional.ofNullable(mode.get());
    }

    /**
     * Sleeps for up to {@code timeout}, returning early when the token is cancelled.
     *
     * @return {@code true} if the token was cancelled before or during the wait
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Like {@link #await(Duration)} but only a forced stop cuts the wait short.
     */
    public boolean awaitForced(Duration timeout) throws InterruptedException {
        return forced.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
