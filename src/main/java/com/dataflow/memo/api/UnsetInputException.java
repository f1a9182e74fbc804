package com.dataflow.memo.api;

import lombok.Getter;

/**
 * Thrown by an evaluation that reached an input node whose value was never
 * supplied.
 *
 * The input is identified by its construction index and, when it was
 * registered, by its name. Callers can supply the value and retry.
 */
@Getter
public class UnsetInputException extends GraphException {
    private final int nodeIndex;
    private final String inputName;

    public UnsetInputException(int nodeIndex, String inputName) {
        super(inputName == null
                ? "Input node #" + nodeIndex + " has no value"
                : "Input '" + inputName + "' (node #" + nodeIndex + ") has no value");
        this.nodeIndex = nodeIndex;
        this.inputName = inputName;
    }
}
