package com.linearproblem;

import java.util.Collections;
import java.util.List;

/** Tokens of one constraint as cut out of the constraint section. */
public final class Statement {
    private final List<Token> tokens;

    Statement(List<Token> tokens) {
        if (tokens.isEmpty()) throw new IllegalArgumentException("empty statement");
        this.tokens = Collections.unmodifiableList(tokens);
    }

    public List<Token> tokens() { return tokens; }
    public Token first() { return tokens.get(0); }

    /** Source-like rendering for diagnostics, tokens joined by single spaces. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(t.text());
        }
        return sb.toString();
    }

    @Override public String toString() { return text(); }
}
