package com.obseq.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a recurring failure is written to the log.
 *
 * A solve that fails on every batch would otherwise log one stack trace per
 * batch. At most one report is written per interval; the reports in between
 * are counted and the count is carried by the next written report.
 */
public final class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs {@code message} at error level unless another report was written
     * within the interval.
     *
     * @return true if the report was written, false if it was suppressed.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last != Long.MIN_VALUE && now - last <= minIntervalNanos) {
            suppressed.incrementAndGet();
            return false;
        }
        // Only one thread reports per interval
        if (!lastLogTime.compareAndSet(last, now)) {
            suppressed.incrementAndGet();
            return false;
        }
        long skipped = suppressed.getAndSet(0);
        if (skipped > 0)
            logger.error("{} ({} similar errors suppressed)", message, skipped, t);
        else
            logger.error(message, t);
        return true;
    }

    /** Reports suppressed since the last written one. */
    public long suppressed() {
        return suppressed.get();
    }
}
