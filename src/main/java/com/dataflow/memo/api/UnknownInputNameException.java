package com.dataflow.memo.api;

import lombok.Getter;

/** Thrown when an input is addressed by a name that was never registered. */
@Getter
public class UnknownInputNameException extends GraphException {
    private final String inputName;

    public UnknownInputNameException(String inputName) {
        super("Unknown input: " + inputName);
        this.inputName = inputName;
    }
}
