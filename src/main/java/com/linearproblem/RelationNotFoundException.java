package com.linearproblem;

/** A constraint statement without a relational operator. */
public class RelationNotFoundException extends LpParseException {
    private static final long serialVersionUID = 1L;

    public RelationNotFoundException(String reason, String fragment, int line, int column) {
        super(reason, fragment, line, column);
    }
}
