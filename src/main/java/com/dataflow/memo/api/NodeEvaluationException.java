package com.dataflow.memo.api;

import lombok.Getter;

/**
 * Thrown when a node function fails, either by throwing or by producing no
 * value. The failing node stays stale; nodes evaluated before it keep their
 * cached values.
 */
@Getter
public class NodeEvaluationException extends GraphException {
    private final int nodeIndex;

    public NodeEvaluationException(int nodeIndex, String message) {
        super("Evaluation of node #" + nodeIndex + " failed: " + message);
        this.nodeIndex = nodeIndex;
    }

    public NodeEvaluationException(int nodeIndex, Throwable cause) {
        super("Evaluation of node #" + nodeIndex + " failed: " + cause, cause);
        this.nodeIndex = nodeIndex;
    }
}
