package com.linearproblem;

/** A variable declared twice in the with-section with different restrictions. */
public class ConflictingRestrictionException extends LpParseException {
    private static final long serialVersionUID = 1L;

    private final int variable;
    private final SignRestriction first;
    private final SignRestriction second;

    public ConflictingRestrictionException(int variable, SignRestriction first, SignRestriction second, Token at) {
        super("x" + variable + " declared both '" + first.text() + "' and '" + second.text() + "'", at);
        this.variable = variable;
        this.first = first;
        this.second = second;
    }

    public int getVariable() { return variable; }
    public SignRestriction getFirst() { return first; }
    public SignRestriction getSecond() { return second; }
}
