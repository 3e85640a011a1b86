package com.linearproblem;

/** Domain of a single variable. Undeclared variables are {@link #NONNEG}. */
public enum SignRestriction {
    FREE(0, "free"),
    NONNEG(1, ">= 0"),
    NONPOS(-1, "<= 0");

    public static final SignRestriction DEFAULT = NONNEG;

    private final int code;
    private final String text;

    SignRestriction(int code, String text) {
        this.code = code;
        this.text = text;
    }

    /** 1 for x >= 0, -1 for x <= 0, 0 for free. */
    public int code() { return code; }

    /** How the restriction is written in a with-section. */
    public String text() { return text; }
}
