package com.dataflow.memo.api;

import lombok.Getter;

/**
 * Thrown when a name is registered for a second input node.
 * Names are bound once; re-binding is never silently accepted.
 */
@Getter
public class DuplicateInputNameException extends GraphException {
    private final String inputName;
    private final int existingIndex;

    public DuplicateInputNameException(String inputName, int existingIndex) {
        super("Duplicate input name: " + inputName + " (already bound to node #" + existingIndex + ")");
        this.inputName = inputName;
        this.existingIndex = existingIndex;
    }
}
