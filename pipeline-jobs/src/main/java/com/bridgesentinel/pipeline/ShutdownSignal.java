package com.bridgesentinel.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative shutdown request passed explicitly to long-running work.
 *
 * <p>
 * Work loops check {@link #isShutdownRequested()} at their own unit
 * boundaries and use {@link #sleep(Duration)} between units so a request
 * wakes them without interrupting a unit in progress.
 * </p>
 *
 * <h3>JVM integration</h3>
 * <p>
 * {@link #installShutdownHook(Duration)} registers a hook that requests
 * shutdown on SIGINT/SIGTERM and then waits for {@link #markFinished()} so
 * the current unit of work can complete before the JVM exits.
 * </p>
 *
 * @since 1.0.0
 */
public final class ShutdownSignal {

    private static final Logger LOG = LoggerFactory.getLogger(ShutdownSignal.class);

    private final CountDownLatch requested = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    public void requestShutdown() {
        if (requested.getCount() > 0) {
            LOG.info("Shutdown requested, finishing current unit of work...");
        }
        requested.countDown();
    }

    public boolean isShutdownRequested() {
        return requested.getCount() == 0;
    }

    /**
     * Sleep for {@code duration} or until shutdown is requested.
     *
     * @return {@code true} if shutdown was requested
     */
    public boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return isShutdownRequested();
        }
        try {
            return requested.await(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestShutdown();
            return true;
        }
    }

    /**
     * Signal that the owning thread has stopped and released its resources.
     */
    public void markFinished() {
        finished.countDown();
    }

    /**
     * Request shutdown on JVM termination and wait up to {@code grace} for the
     * worker to finish.
     */
    public void installShutdownHook(Duration grace) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            requestShutdown();
            try {
                if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Worker did not finish within {} ms", grace.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-signal"));
    }
}
