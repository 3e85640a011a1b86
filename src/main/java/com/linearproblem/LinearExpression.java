package com.linearproblem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable sparse linear form {@code sum c_j x_j}. Keys are variable indices
 * in ascending order; each index occurs once and zero coefficients are never
 * stored, so two expressions are equal iff they denote the same form.
 */
public final class LinearExpression {
    public static final LinearExpression EMPTY = new LinearExpression(new TreeMap<>());

    private final SortedMap<Integer, Double> coefficients;

    private LinearExpression(TreeMap<Integer, Double> coefficients) {
        this.coefficients = Collections.unmodifiableSortedMap(coefficients);
    }

    public static Builder builder() { return new Builder(); }

    /** Builds an expression from terms, summing repeated variables. */
    public static LinearExpression of(List<Term> terms) {
        Builder b = new Builder();
        for (Term t : terms) b.add(t.coefficient(), t.variable());
        return b.build();
    }

    /** Coefficient of {@code x_variable}, 0 when absent. */
    public double coefficient(int variable) {
        Double c = coefficients.get(variable);
        return c == null ? 0.0 : c;
    }

    public boolean contains(int variable) { return coefficients.containsKey(variable); }
    public boolean isEmpty() { return coefficients.isEmpty(); }
    public int size() { return coefficients.size(); }

    /** Highest referenced index, 0 for the empty expression. */
    public int maxVariable() { return coefficients.isEmpty() ? 0 : coefficients.lastKey(); }

    public SortedSet<Integer> variables() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(coefficients.keySet()));
    }

    public SortedMap<Integer, Double> asMap() { return coefficients; }

    /** Terms in ascending variable order. */
    public List<Term> terms() {
        List<Term> out = new ArrayList<>(coefficients.size());
        for (Map.Entry<Integer, Double> e : coefficients.entrySet()) {
            out.add(new Term(e.getValue(), e.getKey()));
        }
        return out;
    }

    public LinearExpression negate() {
        Builder b = new Builder();
        for (Map.Entry<Integer, Double> e : coefficients.entrySet()) b.add(-e.getValue(), e.getKey());
        return b.build();
    }

    public LinearExpression plus(LinearExpression other) {
        Builder b = new Builder();
        b.addAll(this);
        b.addAll(other);
        return b.build();
    }

    public LinearExpression minus(LinearExpression other) {
        return plus(other.negate());
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LinearExpression)) return false;
        return coefficients.equals(((LinearExpression) obj).coefficients);
    }

    @Override public int hashCode() { return coefficients.hashCode(); }

    /** Written the way the parser reads it back: {@code 3x1 - x2 + 0.5x4}. */
    @Override public String toString() {
        if (coefficients.isEmpty()) return "0";
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Double> e : coefficients.entrySet()) {
            double c = e.getValue();
            if (sb.length() == 0) {
                if (c < 0) sb.append('-');
            } else {
                sb.append(c < 0 ? " - " : " + ");
            }
            double abs = Math.abs(c);
            if (abs != 1.0) sb.append(Term.format(abs));
            sb.append('x').append(e.getKey());
        }
        return sb.toString();
    }

    /** Accumulates terms; repeated variables are summed and zero sums dropped on build. */
    public static final class Builder {
        private final TreeMap<Integer, Double> acc = new TreeMap<>();

        public Builder add(double coefficient, int variable) {
            if (variable < 1) throw new IllegalArgumentException("Variable index must be >= 1, got " + variable);
            acc.merge(variable, coefficient, Double::sum);
            return this;
        }

        public Builder addAll(LinearExpression e) {
            for (Map.Entry<Integer, Double> t : e.coefficients.entrySet()) add(t.getValue(), t.getKey());
            return this;
        }

        public LinearExpression build() {
            TreeMap<Integer, Double> out = new TreeMap<>();
            for (Map.Entry<Integer, Double> e : acc.entrySet()) {
                // == also catches -0.0
                if (e.getValue() != 0.0) out.put(e.getKey(), e.getValue());
            }
            return out.isEmpty() ? EMPTY : new LinearExpression(out);
        }
    }
}
