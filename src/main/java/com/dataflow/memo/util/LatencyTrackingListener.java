package com.dataflow.memo.util;

import com.dataflow.memo.api.EvaluationListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks wall-clock latency of compute calls.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> min, max and average time per compute call.</li>
 * <li><b>Workload:</b> nodes evaluated by the last call, and how many calls
 * were answered entirely from cache.</li>
 * </ul>
 *
 * Node failures are logged, throttled to one message per second.
 */
public final class LatencyTrackingListener implements EvaluationListener {
    private static final Logger log = LogManager.getLogger(LatencyTrackingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long computeStartNanos, lastLatencyNanos;
    private long totalComputes, totalLatencyNanos, cacheHits;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastNodesEvaluated;

    @Override
    public void onComputeStart(long epoch, int targetIndex) {
        computeStartNanos = System.nanoTime();
    }

    @Override
    public void onNodeEvaluated(long epoch, int nodeIndex, long durationNanos) {
        // Per-node timing is NodeProfileListener's job.
    }

    @Override
    public void onNodeError(long epoch, int nodeIndex, Throwable error) {
        errLimiter.log(String.format("Compute #%d failed at node #%d: %s", epoch, nodeIndex, error.getMessage()),
                null);
    }

    @Override
    public void onComputeEnd(long epoch, int nodesEvaluated) {
        lastLatencyNanos = System.nanoTime() - computeStartNanos;
        lastNodesEvaluated = nodesEvaluated;
        totalComputes++;
        totalLatencyNanos += lastLatencyNanos;
        if (nodesEvaluated == 0)
            cacheHits++;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    @Override
    public void onInvalidated(int originIndex, int staleCount) {
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public int lastNodesEvaluated() {
        return lastNodesEvaluated;
    }

    public long totalComputes() {
        return totalComputes;
    }

    /** Compute calls that evaluated no node at all. */
    public long cacheHits() {
        return cacheHits;
    }

    public double avgLatencyNanos() {
        return totalComputes > 0 ? (double) totalLatencyNanos / totalComputes : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalComputes = 0;
        totalLatencyNanos = 0;
        cacheHits = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        return String.format("%-16s | %10s | %10s | %10s | %10s | %10s%n", "Metric", "Count", "Cached", "Avg (us)",
                "Min (us)", "Max (us)")
                + String.format("%-16s | %10d | %10d | %10.2f | %10.2f | %10.2f%n",
                        "Compute calls",
                        totalComputes,
                        cacheHits,
                        avgLatencyNanos() / 1000.0,
                        minLatencyNanos() / 1000.0,
                        maxLatencyNanos() / 1000.0);
    }
}
