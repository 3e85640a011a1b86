package com.linearproblem;

public enum TokenType {
    NUMBER,
    VARIABLE,
    PLUS,
    MINUS,
    TIMES,
    LE,
    GE,
    EQ,
    MIN,
    MAX,
    SUBJECT_TO,
    WITH,
    FREE,
    END,
    BAD_VARIABLE,   // "x" without a usable index
    BAD_SYMBOL;     // strict "<" or ">"

    public boolean isRelation() { return this == LE || this == GE || this == EQ; }

    public boolean isSign() { return this == PLUS || this == MINUS; }

    public boolean isKeyword() {
        switch (this) {
            case MIN: case MAX: case SUBJECT_TO: case WITH: case FREE: case END:
                return true;
            default:
                return false;
        }
    }

    public boolean isInvalid() { return this == BAD_VARIABLE || this == BAD_SYMBOL; }

    public Relation relation() {
        switch (this) {
            case LE: return Relation.LE;
            case GE: return Relation.GE;
            case EQ: return Relation.EQ;
            default: throw new IllegalStateException(this + " is not a relation");
        }
    }
}
