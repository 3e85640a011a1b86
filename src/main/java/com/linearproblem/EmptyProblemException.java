package com.linearproblem;

/** No objective, an objective without variable terms, or no constraints. */
public class EmptyProblemException extends LpParseException {
    private static final long serialVersionUID = 1L;

    public EmptyProblemException(String reason, Token at) {
        super(reason, at);
    }
}
