package com.dataflow.memo.api;

import lombok.Getter;

/**
 * Thrown when a node id does not belong to the graph it is used with, either
 * because another graph minted it or because it is out of range.
 */
@Getter
public class InvalidReferenceException extends GraphException {
    private final int nodeIndex;

    public InvalidReferenceException(int nodeIndex, String reason) {
        super("Invalid node reference #" + nodeIndex + ": " + reason);
        this.nodeIndex = nodeIndex;
    }
}
