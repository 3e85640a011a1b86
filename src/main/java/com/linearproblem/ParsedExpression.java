package com.linearproblem;

/** A parsed sum of terms: the variable part plus whatever constants were written. */
public final class ParsedExpression {
    private final LinearExpression expression;
    private final double constant;
    private final int termCount;

    ParsedExpression(LinearExpression expression, double constant, int termCount) {
        this.expression = expression;
        this.constant = constant;
        this.termCount = termCount;
    }

    public LinearExpression expression() { return expression; }
    public double constant() { return constant; }

    /** Number of terms as written, before merging; 0 for an empty side. */
    public int termCount() { return termCount; }

    public boolean isBlank() { return termCount == 0; }

    @Override public String toString() {
        if (constant == 0.0) return expression.toString();
        return expression + (constant < 0 ? " - " : " + ") + Term.format(Math.abs(constant));
    }
}
