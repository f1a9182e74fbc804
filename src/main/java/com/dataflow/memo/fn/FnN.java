package com.dataflow.memo.fn;

import java.util.List;

/**
 * Pure function computing a node's value from its inputs' values.
 *
 * The list holds the input values in the order the inputs were declared when
 * the node was added. It is read-only and only valid for the duration of the
 * call; implementations must not keep a reference to it.
 *
 * Purity Contract:
 * The result must depend on the input values only. The graph caches the
 * result and will not call the function again until an upstream input
 * changes.
 *
 * @param <T> The value type of the graph.
 */
@FunctionalInterface
public interface FnN<T> {
    /**
     * Computes a result from the ordered input values.
     *
     * @param inputs The input values (read-only, transient).
     * @return The result; must not be null.
     */
    T apply(List<T> inputs);
}
