package com.dataflow.memo.util;

import com.dataflow.memo.api.EvaluationListener;

import java.util.Arrays;

/** Aggregates evaluation statistics per node to find expensive or hot nodes. */
public class NodeProfileListener implements EvaluationListener {

    public static class NodeStats {
        public final int nodeIndex;
        public long evaluations;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;

        NodeStats(int nodeIndex) {
            this.nodeIndex = nodeIndex;
        }

        void record(long duration) {
            evaluations++;
            totalDurationNanos += duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return evaluations == 0 ? 0 : totalDurationNanos / (double) evaluations / 1000.0;
        }
    }

    // Indexed by node index; grown lazily as nodes show up.
    private NodeStats[] statsArray = new NodeStats[0];
    private long invalidations;
    private long staleMarks;

    /** Stats for a node, or null if nothing was reported for it. */
    public NodeStats stats(int nodeIndex) {
        return nodeIndex < statsArray.length ? statsArray[nodeIndex] : null;
    }

    public long evaluations(int nodeIndex) {
        NodeStats s = stats(nodeIndex);
        return s == null ? 0 : s.evaluations;
    }

    public long invalidations() {
        return invalidations;
    }

    /** Total nodes marked stale across all invalidation passes. */
    public long staleMarks() {
        return staleMarks;
    }

    @Override
    public void onComputeStart(long epoch, int targetIndex) {
    }

    @Override
    public void onNodeEvaluated(long epoch, int nodeIndex, long durationNanos) {
        slot(nodeIndex).record(durationNanos);
    }

    @Override
    public void onNodeError(long epoch, int nodeIndex, Throwable error) {
        slot(nodeIndex).errors++;
    }

    @Override
    public void onComputeEnd(long epoch, int nodesEvaluated) {
    }

    @Override
    public void onInvalidated(int originIndex, int staleCount) {
        invalidations++;
        staleMarks += staleCount;
    }

    private NodeStats slot(int nodeIndex) {
        if (nodeIndex >= statsArray.length)
            statsArray = Arrays.copyOf(statsArray, Math.max(nodeIndex + 1, statsArray.length * 2));
        NodeStats s = statsArray[nodeIndex];
        if (s == null)
            statsArray[nodeIndex] = s = new NodeStats(nodeIndex);
        return s;
    }

    public void reset() {
        statsArray = new NodeStats[0];
        invalidations = 0;
        staleMarks = 0;
    }

    /** Formatted table of node statistics, most expensive first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-8s | %10s | %8s | %10s | %10s | %10s%n",
                "Node", "Evals", "Errors", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("------------------------------------------------------------------------------\n");

        NodeStats[] valid = Arrays.stream(statsArray)
                .filter(s -> s != null)
                .sorted((a, b) -> Long.compare(b.totalDurationNanos, a.totalDurationNanos))
                .toArray(NodeStats[]::new);

        for (NodeStats s : valid) {
            sb.append(String.format("%-8s | %10d | %8d | %10.2f | %10.2f | %10.2f%n",
                    "#" + s.nodeIndex,
                    s.evaluations,
                    s.errors,
                    s.avgMicros(),
                    s.evaluations == 0 ? 0.0 : s.minDurationNanos / 1000.0,
                    s.evaluations == 0 ? 0.0 : s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }
}
