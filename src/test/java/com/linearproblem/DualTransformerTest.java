package com.linearproblem;

import static com.linearproblem.LpParserTest.expr;
import static com.linearproblem.LpParserTest.resource;
import static com.linearproblem.LpParserTest.restrictions;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class DualTransformerTest {

    @Test
    public void dualOfProductionProblem() {
        Problem expected = new Problem(new Objective(Direction.MIN, expr("4x1+6x2")),
                Arrays.asList(new Constraint(expr("x1+3x2"), Relation.GE, 3),
                        new Constraint(expr("2x1+2x2"), Relation.GE, 5)),
                restrictions(SignRestriction.NONNEG, SignRestriction.NONNEG), 2);
        assertEquals(expected, DualTransformer.dual(LpParserTest.production()));
    }

    @Test
    public void dualOfMinimisationWithFreeVariable() throws IOException, LpParseException {
        Problem dual = DualTransformer.dual(LpParser.parseFile(resource("mixed.lp")));
        Problem expected = new Problem(new Objective(Direction.MAX, expr("4x1 + x2 + 6x3")),
                Arrays.asList(new Constraint(expr("x1 + x2 + x3"), Relation.LE, 2),
                        new Constraint(expr("x1 - x2 + 2x3"), Relation.EQ, 3)),
                restrictions(SignRestriction.NONNEG, SignRestriction.NONPOS, SignRestriction.FREE), 3);
        assertEquals(expected, dual);
    }

    @Test
    public void dualOfMaximisationWithNonPositiveVariable() throws LpParseException {
        Problem dual = DualTransformer.dual(LpParser.parse("max x1 - x2 s.t. x1 + x2 >= 1 x1 <= 3 with x2 <= 0 end"));
        assertEquals(Direction.MIN, dual.direction());
        assertEquals(expr("x1 + 3x2"), dual.objective().expression());
        assertEquals(new Constraint(expr("x1 + x2"), Relation.GE, 1), dual.constraint(1));
        assertEquals(new Constraint(expr("x1"), Relation.LE, -1), dual.constraint(2));
        assertEquals(SignRestriction.NONPOS, dual.restriction(1));
        assertEquals(SignRestriction.NONNEG, dual.restriction(2));
    }

    @Test
    public void shapeIsTransposed() throws IOException, LpParseException {
        Problem primal = LpParser.parseFile(resource("noisy.lp"));
        Problem dual = DualTransformer.dual(primal);
        assertEquals(primal.constraintCount(), dual.variableCount());
        assertEquals(primal.variableCount(), dual.constraintCount());
        for (int i = 1; i <= primal.constraintCount(); i++) {
            for (int j = 1; j <= primal.variableCount(); j++) {
                assertEquals(primal.constraint(i).expression().coefficient(j),
                        dual.constraint(j).expression().coefficient(i));
            }
        }
    }

    @Test
    public void variableWithoutCoefficientsGivesEmptyRow() throws LpParseException {
        Problem primal = LpParser.parse("max x1 s.t. x1 <= 1 with x2 free end");
        Problem dual = DualTransformer.dual(primal);
        assertEquals(2, dual.constraintCount());
        assertTrue(dual.constraint(2).expression().isEmpty());
        assertEquals(Relation.EQ, dual.constraint(2).relation());
        assertEquals(0.0, dual.constraint(2).rhs());
        assertEquals(primal, DualTransformer.dual(dual));
    }

    @Test
    public void zeroRightHandSidesGiveEmptyObjective() throws LpParseException {
        Problem primal = LpParser.parse("max x1 + x2 s.t. x1 - x2 <= 0 x1 + x2 >= 0 end");
        Problem dual = DualTransformer.dual(primal);
        assertTrue(dual.objective().expression().isEmpty());
        assertEquals(primal, DualTransformer.dual(dual));
    }

    @Test
    public void dualOfDualIsThePrimal() throws IOException, LpParseException {
        Problem[] problems = {
                LpParserTest.production(),
                LpParser.parseFile(resource("mixed.lp")),
                LpParser.parseFile(resource("noisy.lp")),
                LpParser.parse("min -x1 + 0.5x3 s.t. x1 - x3 = -2 x2 >= 1.25 with x1 <= 0 x3 free end"),
        };
        for (Problem p : problems) {
            assertEquals(p, DualTransformer.dual(DualTransformer.dual(p)));
        }
    }

    @Test
    public void correspondenceTable() {
        assertEquals(SignRestriction.NONNEG, DualTransformer.dualRestriction(Direction.MAX, Relation.LE));
        assertEquals(SignRestriction.NONPOS, DualTransformer.dualRestriction(Direction.MAX, Relation.GE));
        assertEquals(SignRestriction.FREE, DualTransformer.dualRestriction(Direction.MAX, Relation.EQ));
        assertEquals(SignRestriction.NONPOS, DualTransformer.dualRestriction(Direction.MIN, Relation.LE));
        assertEquals(SignRestriction.NONNEG, DualTransformer.dualRestriction(Direction.MIN, Relation.GE));
        assertEquals(SignRestriction.FREE, DualTransformer.dualRestriction(Direction.MIN, Relation.EQ));

        assertEquals(Relation.GE, DualTransformer.dualRelation(Direction.MAX, SignRestriction.NONNEG));
        assertEquals(Relation.LE, DualTransformer.dualRelation(Direction.MAX, SignRestriction.NONPOS));
        assertEquals(Relation.EQ, DualTransformer.dualRelation(Direction.MAX, SignRestriction.FREE));
        assertEquals(Relation.LE, DualTransformer.dualRelation(Direction.MIN, SignRestriction.NONNEG));
        assertEquals(Relation.GE, DualTransformer.dualRelation(Direction.MIN, SignRestriction.NONPOS));
        assertEquals(Relation.EQ, DualTransformer.dualRelation(Direction.MIN, SignRestriction.FREE));
    }
}
