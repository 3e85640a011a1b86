package com.linearproblem;

/** Malformed variable token, such as {@code x} without an index. */
public class UnknownVariableException extends LpParseException {
    private static final long serialVersionUID = 1L;

    public UnknownVariableException(String reason, Token at) {
        super(reason, at);
    }
}
