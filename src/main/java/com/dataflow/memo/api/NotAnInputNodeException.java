package com.dataflow.memo.api;

import lombok.Getter;

/** Thrown when an operation node is used where an input node is required. */
@Getter
public class NotAnInputNodeException extends GraphException {
    private final int nodeIndex;

    public NotAnInputNodeException(int nodeIndex) {
        super("Node #" + nodeIndex + " is an operation node, not an input");
        this.nodeIndex = nodeIndex;
    }
}
