package com.linearproblem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable linear problem: one objective, an ordered list of constraints and
 * a sign restriction for each variable {@code x_1 .. x_n}.
 *
 * <p>The constraint order is significant: constraint {@code i} (1-based)
 * becomes variable {@code y_i} of the dual.
 */
public final class Problem {
    private final Objective objective;
    private final List<Constraint> constraints;
    private final SortedMap<Integer, SignRestriction> restrictions;
    private final int variableCount;

    /**
     * @param restrictions must hold exactly the keys {@code 1..variableCount}
     * @throws IllegalArgumentException if there are no constraints, no
     *         variables, or an index outside {@code 1..variableCount} is used
     */
    public Problem(Objective objective, List<Constraint> constraints,
                   Map<Integer, SignRestriction> restrictions, int variableCount) {
        Objects.requireNonNull(objective, "objective");
        Objects.requireNonNull(constraints, "constraints");
        Objects.requireNonNull(restrictions, "restrictions");
        if (variableCount < 1) throw new IllegalArgumentException("Problem needs at least one variable");
        if (constraints.isEmpty()) throw new IllegalArgumentException("Problem needs at least one constraint");

        checkRange(objective.expression(), variableCount, "objective");
        for (int i = 0; i < constraints.size(); i++) {
            Constraint c = Objects.requireNonNull(constraints.get(i), "constraint " + (i + 1));
            checkRange(c.expression(), variableCount, "constraint " + (i + 1));
        }
        TreeMap<Integer, SignRestriction> r = new TreeMap<>();
        for (int j = 1; j <= variableCount; j++) {
            SignRestriction s = restrictions.get(j);
            if (s == null) throw new IllegalArgumentException("No sign restriction for x" + j);
            r.put(j, s);
        }
        if (restrictions.size() != variableCount) {
            throw new IllegalArgumentException("Sign restrictions given for indices outside 1.." + variableCount);
        }

        this.objective = objective;
        this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
        this.restrictions = Collections.unmodifiableSortedMap(r);
        this.variableCount = variableCount;
    }

    private static void checkRange(LinearExpression e, int n, String where) {
        if (e.maxVariable() > n) {
            throw new IllegalArgumentException(where + " references x" + e.maxVariable() + " but n = " + n);
        }
    }

    public Objective objective() { return objective; }
    public Direction direction() { return objective.direction(); }
    public List<Constraint> constraints() { return constraints; }
    public int constraintCount() { return constraints.size(); }
    public int variableCount() { return variableCount; }

    /** Constraint {@code i}, 1-based. */
    public Constraint constraint(int i) { return constraints.get(i - 1); }

    /** Restriction of {@code x_j}, 1-based. */
    public SignRestriction restriction(int j) {
        SignRestriction s = restrictions.get(j);
        if (s == null) throw new IndexOutOfBoundsException("x" + j + " is outside 1.." + variableCount);
        return s;
    }

    public SortedMap<Integer, SignRestriction> restrictions() { return restrictions; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Problem)) return false;
        Problem o = (Problem) obj;
        return variableCount == o.variableCount
                && objective.equals(o.objective)
                && constraints.equals(o.constraints)
                && restrictions.equals(o.restrictions);
    }

    @Override public int hashCode() { return Objects.hash(objective, constraints, restrictions, variableCount); }

    @Override public String toString() {
        return "Problem{" + objective + ", constraints=" + constraints
                + ", restrictions=" + restrictions + ", n=" + variableCount + "}";
    }
}
