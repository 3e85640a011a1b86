package com.linearproblem;

/** Relation between the left side of a constraint and its constant right side. */
public enum Relation {
    LE("<=", -1),
    GE(">=", 1),
    EQ("=", 0);

    private final String symbol;
    private final int code;       // Eqin code of the matrix report

    Relation(String symbol, int code) {
        this.symbol = symbol;
        this.code = code;
    }

    public String symbol() { return symbol; }

    /** -1 for <=, 0 for =, 1 for >=. */
    public int code() { return code; }

    @Override
    public String toString() { return symbol; }
}
