package com.linearproblem;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns the sections found by {@link LpScanner} into a {@link Problem}. */
public final class ModelBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ModelBuilder.class);

    private ModelBuilder() {}

    public static Problem build(ScannedProblem scanned) throws LpParseException {
        Objective objective = new Objective(scanned.direction(), objectiveExpression(scanned));

        if (scanned.constraints().isEmpty()) {
            throw new EmptyProblemException("no constraints, expected 's.t.' followed by at least one constraint",
                    scanned.endToken());
        }
        List<Constraint> constraints = new ArrayList<>(scanned.constraints().size());
        for (Statement s : scanned.constraints()) {
            constraints.add(ConstraintClassifier.classify(s));
        }

        SortedMap<Integer, SignRestriction> declared = RestrictionResolver.declared(scanned.restrictions());

        // every written index counts, also one whose coefficients sum to zero
        int n = highestIndex(scanned.objective());
        for (Statement s : scanned.constraints()) n = Math.max(n, highestIndex(s.tokens()));
        n = Math.max(n, highestIndex(scanned.restrictions()));

        Problem p = new Problem(objective, constraints, RestrictionResolver.resolve(declared, n), n);
        LOG.debug("Built {} problem with {} variables and {} constraints",
                p.direction(), p.variableCount(), p.constraintCount());
        return p;
    }

    /**
     * Parses the objective. A leading {@code name =} as in {@code max z = 3x1 + 5x2}
     * is accepted because the name itself is noise; any other relation is an error.
     */
    private static LinearExpression objectiveExpression(ScannedProblem scanned) throws LpParseException {
        List<Token> tokens = scanned.objective();
        if (!tokens.isEmpty() && tokens.get(0).is(TokenType.EQ)) {
            tokens = tokens.subList(1, tokens.size());
        }
        for (Token t : tokens) {
            if (t.type().isRelation()) throw new LpSyntaxException("relation in objective", t);
        }

        ParsedExpression parsed = ExpressionParser.parse(tokens);
        if (parsed.constant() != 0.0) {
            throw new LpSyntaxException("constant term in objective", objectiveText(scanned),
                    scanned.directionToken().line(), scanned.directionToken().column());
        }
        if (parsed.expression().isEmpty()) {
            throw new EmptyProblemException("objective has no variable terms", scanned.directionToken());
        }
        return parsed.expression();
    }

    private static int highestIndex(List<Token> tokens) {
        int n = 0;
        for (Token t : tokens) {
            if (t.is(TokenType.VARIABLE)) n = Math.max(n, t.variable());
        }
        return n;
    }

    private static String objectiveText(ScannedProblem scanned) {
        StringBuilder sb = new StringBuilder(scanned.directionToken().text());
        for (Token t : scanned.objective()) sb.append(' ').append(t.text());
        return sb.toString();
    }
}
