package com.linearproblem;

/** A recognised construct that matches no production of the grammar. */
public class LpSyntaxException extends LpParseException {
    private static final long serialVersionUID = 1L;

    public LpSyntaxException(String reason, String fragment, int line, int column) {
        super(reason, fragment, line, column);
    }

    public LpSyntaxException(String reason, Token at) {
        super(reason, at);
    }
}
