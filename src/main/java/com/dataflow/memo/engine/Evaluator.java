package com.dataflow.memo.engine;

import com.dataflow.memo.api.EvaluationListener;
import com.dataflow.memo.api.NodeEvaluationException;
import com.dataflow.memo.api.UnsetInputException;
import com.dataflow.memo.util.ErrorRateLimiter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Memoized, demand-driven evaluation of a single node.
 *
 * Algorithm:
 * The evaluator keeps an explicit work stack of node indices instead of
 * recursing, so the depth of the dependency chain is bounded by heap, not by
 * the thread's call stack.
 *
 * 1. Peek the top index. If its node has a cached value, pop it.
 * 2. An input node without a value is an error: the caller asked for a value
 * that was never supplied.
 * 3. Otherwise push every stale input (last input first, so inputs resolve in
 * declared order). If none were pushed, all inputs are fresh: pop the node,
 * apply its function to the ordered input values and cache the result.
 *
 * A node reachable over several paths may be pushed more than once, but only
 * the first copy to reach the top is evaluated; later copies find the cache
 * populated and are popped. Every node is therefore evaluated at most once per
 * call, and every input is evaluated before any of its dependents read it.
 *
 * Failure:
 * A failing function leaves its node stale and propagates as a
 * NodeEvaluationException. Nodes evaluated earlier in the same call keep
 * their values; those values are consistent with the current inputs.
 */
@Log4j2
final class Evaluator<T> {
    private final NodeArena<T> arena;
    private final InputRegistry registry;
    private final ErrorRateLimiter errorLimiter = new ErrorRateLimiter(log, 1000);

    private int[] stack = new int[16];
    private int lastEvaluatedCount;

    Evaluator(NodeArena<T> arena, InputRegistry registry) {
        this.arena = arena;
        this.registry = registry;
    }

    /**
     * Returns the up-to-date value of the node at {@code target}, evaluating
     * stale ancestors as needed.
     *
     * @param target   Validated index of the queried node.
     * @param epoch    Epoch passed through to the listener.
     * @param listener Optional listener, may be null.
     * @throws UnsetInputException     if an input without a value is reached.
     * @throws NodeEvaluationException if a node function fails.
     */
    T compute(int target, long epoch, EvaluationListener listener) {
        lastEvaluatedCount = 0;
        Node<T> targetNode = arena.node(target);
        if (!targetNode.isStale())
            return targetNode.cache();

        final boolean hasListener = listener != null;
        int top = 0;
        stack[top++] = target;

        while (top > 0) {
            int index = stack[top - 1];
            Node<T> node = arena.node(index);
            if (!node.isStale()) {
                top--;
                continue;
            }
            if (node.isInput()) {
                UnsetInputException e = new UnsetInputException(index, registry.nameOf(index));
                if (hasListener)
                    listener.onNodeError(epoch, index, e);
                throw e;
            }

            boolean ready = true;
            for (int i = node.inputCount() - 1; i >= 0; i--) {
                int input = node.input(i);
                if (arena.node(input).isStale()) {
                    if (top == stack.length)
                        stack = Arrays.copyOf(stack, stack.length * 2);
                    stack[top++] = input;
                    ready = false;
                }
            }
            if (!ready)
                continue;

            top--;
            evaluate(index, node, epoch, listener);
        }
        return targetNode.cache();
    }

    private void evaluate(int index, Node<T> node, long epoch, EvaluationListener listener) {
        final int n = node.inputCount();
        List<T> args = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            args.add(arena.node(node.input(i)).cache());

        long start = listener != null ? System.nanoTime() : 0L;
        T value;
        try {
            value = node.fn().apply(Collections.unmodifiableList(args));
        } catch (RuntimeException e) {
            throw fail(new NodeEvaluationException(index, e), epoch, listener);
        }
        if (value == null)
            throw fail(new NodeEvaluationException(index, "function returned null"), epoch, listener);

        node.store(value);
        lastEvaluatedCount++;
        if (listener != null)
            listener.onNodeEvaluated(epoch, index, System.nanoTime() - start);
    }

    private NodeEvaluationException fail(NodeEvaluationException e, long epoch, EvaluationListener listener) {
        errorLimiter.log(e.getMessage(), e.getCause());
        if (listener != null)
            listener.onNodeError(epoch, e.getNodeIndex(), e);
        return e;
    }

    /** Number of nodes evaluated by the most recent compute call. */
    int lastEvaluatedCount() {
        return lastEvaluatedCount;
    }
}
