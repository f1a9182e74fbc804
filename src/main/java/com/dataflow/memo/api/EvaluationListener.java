package com.dataflow.memo.api;

/**
 * Observability interface for monitoring graph evaluation and invalidation.
 *
 * Implementations can be registered with the ComputationGraph to receive
 * callbacks during compute calls. This is the hook for:
 *
 * - Profiling: per-node evaluation time and counts.
 * - Debugging: tracing which nodes a query actually recomputed.
 * - Metrics: measuring how far an input change spreads through the graph.
 *
 * Performance Warning:
 * Callbacks run inside the evaluation loop. Keep them lightweight; blocking
 * I/O here directly slows every query.
 */
public interface EvaluationListener {

    /**
     * Called before a compute call starts resolving its target.
     *
     * @param epoch       The sequence number of this compute call.
     * @param targetIndex Construction index of the queried node.
     */
    void onComputeStart(long epoch, int targetIndex);

    /**
     * Called after an operation node was evaluated and its value cached.
     *
     * Nodes served from cache do not trigger this callback.
     *
     * @param epoch         Current compute epoch.
     * @param nodeIndex     Construction index of the evaluated node.
     * @param durationNanos Time spent in the node function.
     */
    void onNodeEvaluated(long epoch, int nodeIndex, long durationNanos);

    /**
     * Called when a node function fails or an unset input is reached.
     *
     * @param epoch     Current compute epoch.
     * @param nodeIndex The failing node.
     * @param error     The failure that will be thrown to the caller.
     */
    void onNodeError(long epoch, int nodeIndex, Throwable error);

    /**
     * Called when a compute call finishes, successfully or not.
     *
     * @param epoch          Current compute epoch.
     * @param nodesEvaluated Number of nodes evaluated by this call.
     */
    void onComputeEnd(long epoch, int nodesEvaluated);

    /**
     * Called after an invalidation pass.
     *
     * @param originIndex The node the invalidation started from.
     * @param staleCount  Number of nodes visited and marked stale, origin
     *                    included.
     */
    void onInvalidated(int originIndex, int staleCount);
}
