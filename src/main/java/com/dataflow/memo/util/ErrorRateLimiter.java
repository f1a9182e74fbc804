package com.dataflow.memo.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 *
 * A query loop that keeps hitting the same broken node function would
 * otherwise log one stack trace per call. At most one message is logged per
 * interval; messages dropped in between are counted and the count is reported
 * with the next message that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /**
     * Logs at error level unless another message was logged within the interval.
     *
     * @return true if the message was logged, false if it was suppressed.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.error("{} ({} similar message(s) suppressed)", message, dropped, t);
            else
                logger.error(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    /** Number of messages dropped since the last one that was logged. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
