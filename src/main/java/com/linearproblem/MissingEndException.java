package com.linearproblem;

/** The description has no terminating {@code end} keyword. */
public class MissingEndException extends LpParseException {
    private static final long serialVersionUID = 1L;

    public MissingEndException(String reason, String fragment, int line, int column) {
        super(reason, fragment, line, column);
    }

    public MissingEndException(String reason) {
        super(reason);
    }
}
