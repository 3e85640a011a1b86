package com.linearproblem;

import java.util.Locale;

/** Optimisation direction of an objective. */
public enum Direction {
    MIN(-1),
    MAX(1);

    private final int code;     // MinMax code of the matrix report

    Direction(int code) { this.code = code; }

    public int code() { return code; }

    public Direction opposite() { return this == MAX ? MIN : MAX; }

    public String keyword() { return name().toLowerCase(Locale.ROOT); }
}
