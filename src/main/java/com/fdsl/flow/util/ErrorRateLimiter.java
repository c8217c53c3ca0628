package com.fdsl.flow.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging so that a persistently failing source or
 * expression does not flood the log. Safe to share between threads.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was written */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if ((last == 0 || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.warn("{} ({} similar messages suppressed)", message, dropped, t);
            else
                logger.warn(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
