package com.rinkstats.infrastructure.scraper;

import java.util.concurrent.TimeUnit;

/**
 * Keeps a minimum interval between the starts of consecutive requests across all fetch threads.
 */
public class RequestThrottle {

    private final long minIntervalNanos;
    private long nextSlotNanos;

    public RequestThrottle(long minIntervalMs) {
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, minIntervalMs));
        this.nextSlotNanos = System.nanoTime();
    }

    /**
     * Blocks until the caller may start its request.
     */
    public void acquire() throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = Math.max(now, nextSlotNanos);
            nextSlotNanos = slot + minIntervalNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }
}
