package com.linearproblem;

import java.math.BigDecimal;
import java.util.Objects;

/** Immutable (coefficient, variable index) pair. */
public final class Term {
    private final double coefficient;
    private final int variable;

    public Term(double coefficient, int variable) {
        if (variable < 1) throw new IllegalArgumentException("Variable index must be >= 1, got " + variable);
        this.coefficient = coefficient;
        this.variable = variable;
    }

    public double coefficient() { return coefficient; }
    public int variable() { return variable; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Term)) return false;
        Term o = (Term) obj;
        return variable == o.variable && Double.compare(coefficient, o.coefficient) == 0;
    }

    @Override public int hashCode() { return Objects.hash(coefficient, variable); }

    @Override public String toString() { return format(coefficient) + "x" + variable; }

    /** Plain decimal notation, integers without a fraction part ("3", "-0.25", never "1.0E-5"). */
    static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return Double.toString(value);
        if (value == 0.0) return "0";
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
