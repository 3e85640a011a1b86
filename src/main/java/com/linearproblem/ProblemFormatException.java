package com.linearproblem;

import java.io.IOException;

/** A saved problem that cannot be turned back into a valid {@link Problem}. */
public class ProblemFormatException extends IOException {
    private static final long serialVersionUID = 1L;

    public ProblemFormatException(String message) {
        super(message);
    }

    public ProblemFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
