package org.netpreserve.archivescope.util;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared admission control for remote requests. Bounds the number of requests in flight and
 * paces successive requests so that each one starts at least {@code 1 / requestsPerSecond}
 * after the previous request finished.
 * <p>
 * Use with try-with-resources:
 * <pre>{@code
 * try (var permit = gate.acquire()) {
 *     ...
 * }
 * }</pre>
 */
public class RequestGate {
    private final Semaphore permits;
    private final int maxConcurrent;
    private final long minIntervalNanos;
    private final Object paceLock = new Object();
    private long lastFinishedNanos;
    private boolean finishedAny;

    public RequestGate(int maxConcurrent, double requestsPerSecond) {
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be at least 1");
        if (requestsPerSecond <= 0) throw new IllegalArgumentException("requestsPerSecond must be positive");
        this.maxConcurrent = maxConcurrent;
        this.permits = new Semaphore(maxConcurrent, true);
        this.minIntervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / requestsPerSecond);
    }

    /**
     * Blocks until a slot is free and the pacing interval has elapsed.
     */
    public Permit acquire() throws InterruptedException {
        permits.acquire();
        try {
            pace();
        } catch (InterruptedException e) {
            permits.release();
            throw e;
        }
        return new Permit();
    }

    private void pace() throws InterruptedException {
        synchronized (paceLock) {
            if (!finishedAny) return;
            long waitNanos = lastFinishedNanos + minIntervalNanos - System.nanoTime();
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        }
    }

    private void finished() {
        synchronized (paceLock) {
            lastFinishedNanos = System.nanoTime();
            finishedAny = true;
        }
        permits.release();
    }

    public int inFlight() {
        return maxConcurrent - permits.availablePermits();
    }

    public Duration minInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }

    public class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                finished();
            }
        }
    }
}
