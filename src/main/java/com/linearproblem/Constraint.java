package com.linearproblem;

import java.util.Objects;

/**
 * A constraint in canonical form: every variable term on the left, a single
 * constant on the right.
 */
public final class Constraint {
    private final LinearExpression expression;
    private final Relation relation;
    private final double rhs;

    public Constraint(LinearExpression expression, Relation relation, double rhs) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.relation = Objects.requireNonNull(relation, "relation");
        this.rhs = rhs + 0.0;   // -0.0 -> 0.0
    }

    public LinearExpression expression() { return expression; }
    public Relation relation() { return relation; }
    public double rhs() { return rhs; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constraint)) return false;
        Constraint o = (Constraint) obj;
        return relation == o.relation
                && Double.compare(rhs, o.rhs) == 0
                && expression.equals(o.expression);
    }

    @Override public int hashCode() { return Objects.hash(expression, relation, rhs); }

    @Override public String toString() {
        return expression + " " + relation.symbol() + " " + Term.format(rhs);
    }
}
