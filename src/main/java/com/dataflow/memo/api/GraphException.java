package com.dataflow.memo.api;

/**
 * Base class of every failure reported by a computation graph.
 *
 * All graph failures are unchecked: they signal either misuse of the API
 * (unknown names, foreign ids, unset inputs) or a failing node function, never
 * a transient condition that a retry would fix. A graph that reported one of
 * these exceptions remains usable.
 */
public class GraphException extends RuntimeException {

    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
