package com.linearproblem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Primal to dual conversion.
 *
 * <p>For a primal with {@code n} variables and {@code m} constraints the dual
 * has one variable {@code y_i} per primal constraint and one constraint per
 * primal variable. The dual objective takes the primal right-hand sides, the
 * dual right-hand sides are the primal objective coefficients and the
 * coefficient matrix is transposed. Relations and sign restrictions follow
 * the usual correspondence:
 *
 * <pre>
 *   primal max                          primal min
 *   constraint  &lt;=  -> y_i &gt;= 0          constraint  &lt;=  -> y_i &lt;= 0
 *   constraint  &gt;=  -> y_i &lt;= 0          constraint  &gt;=  -> y_i &gt;= 0
 *   constraint  =   -> y_i free          constraint  =   -> y_i free
 *   x_j &gt;= 0       -> dual row &gt;=         x_j &gt;= 0       -> dual row &lt;=
 *   x_j &lt;= 0       -> dual row &lt;=         x_j &lt;= 0       -> dual row &gt;=
 *   x_j free        -> dual row =          x_j free        -> dual row =
 * </pre>
 *
 * Applying the transformation twice gives back a problem equal to the input.
 */
public final class DualTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(DualTransformer.class);

    private DualTransformer() {}

    public static Problem dual(Problem primal) {
        final Direction dir = primal.direction();
        final int m = primal.constraintCount();
        final int n = primal.variableCount();

        // dual objective: b
        LinearExpression.Builder obj = LinearExpression.builder();
        for (int i = 1; i <= m; i++) obj.add(primal.constraint(i).rhs(), i);

        // dual rows: column j of A, in one pass over the sparse rows
        List<LinearExpression.Builder> rows = new ArrayList<>(n);
        for (int j = 0; j < n; j++) rows.add(LinearExpression.builder());
        for (int i = 1; i <= m; i++) {
            for (Map.Entry<Integer, Double> e : primal.constraint(i).expression().asMap().entrySet()) {
                rows.get(e.getKey() - 1).add(e.getValue(), i);
            }
        }

        List<Constraint> constraints = new ArrayList<>(n);
        for (int j = 1; j <= n; j++) {
            Relation rel = dualRelation(dir, primal.restriction(j));
            constraints.add(new Constraint(rows.get(j - 1).build(), rel,
                    primal.objective().expression().coefficient(j)));
        }

        SortedMap<Integer, SignRestriction> restrictions = new TreeMap<>();
        for (int i = 1; i <= m; i++) {
            restrictions.put(i, dualRestriction(dir, primal.constraint(i).relation()));
        }

        Problem dual = new Problem(new Objective(dir.opposite(), obj.build()), constraints, restrictions, m);
        LOG.debug("Dual of {} problem ({} x {}) is a {} problem ({} x {})",
                dir, m, n, dual.direction(), dual.constraintCount(), dual.variableCount());
        return dual;
    }

    /** Sign restriction of the dual variable belonging to a primal constraint. */
    static SignRestriction dualRestriction(Direction primal, Relation relation) {
        switch (relation) {
            case LE: return primal == Direction.MAX ? SignRestriction.NONNEG : SignRestriction.NONPOS;
            case GE: return primal == Direction.MAX ? SignRestriction.NONPOS : SignRestriction.NONNEG;
            case EQ: return SignRestriction.FREE;
            default: throw new IllegalArgumentException("Unknown relation " + relation);
        }
    }

    /** Relation of the dual constraint belonging to a primal variable. */
    static Relation dualRelation(Direction primal, SignRestriction restriction) {
        switch (restriction) {
            case NONNEG: return primal == Direction.MAX ? Relation.GE : Relation.LE;
            case NONPOS: return primal == Direction.MAX ? Relation.LE : Relation.GE;
            case FREE: return Relation.EQ;
            default: throw new IllegalArgumentException("Unknown restriction " + restriction);
        }
    }
}
