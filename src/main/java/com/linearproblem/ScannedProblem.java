package com.linearproblem;

import java.util.Collections;
import java.util.List;

/** Sections of an LP description as found by {@link LpScanner}. */
public final class ScannedProblem {
    private final Token direction;
    private final List<Token> objective;
    private final List<Statement> constraints;
    private final List<Token> restrictions;
    private final Token end;

    ScannedProblem(Token direction, List<Token> objective, List<Statement> constraints,
                   List<Token> restrictions, Token end) {
        this.direction = direction;
        this.objective = Collections.unmodifiableList(objective);
        this.constraints = Collections.unmodifiableList(constraints);
        this.restrictions = Collections.unmodifiableList(restrictions);
        this.end = end;
    }

    /** The {@code min}/{@code max} keyword the objective is anchored at. */
    public Token directionToken() { return direction; }

    public Direction direction() {
        return direction.is(TokenType.MAX) ? Direction.MAX : Direction.MIN;
    }

    public List<Token> objective() { return objective; }
    public List<Statement> constraints() { return constraints; }

    /** Tokens of the with-section, empty when there is none. */
    public List<Token> restrictions() { return restrictions; }

    public Token endToken() { return end; }
}
