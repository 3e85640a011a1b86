package com.linearproblem;

import java.util.Objects;

public final class Objective {
    private final Direction direction;
    private final LinearExpression expression;

    public Objective(Direction direction, LinearExpression expression) {
        this.direction = Objects.requireNonNull(direction, "direction");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Direction direction() { return direction; }
    public LinearExpression expression() { return expression; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Objective)) return false;
        Objective o = (Objective) obj;
        return direction == o.direction && expression.equals(o.expression);
    }

    @Override public int hashCode() { return Objects.hash(direction, expression); }

    @Override public String toString() { return direction.keyword() + " " + expression; }
}
