package com.linearproblem;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

public class LpParserTest {

    static Path resource(String name) {
        try {
            return Paths.get(LpParserTest.class.getResource("/problems/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static LinearExpression expr(String text) {
        try {
            return ExpressionParser.parse(text).expression();
        } catch (LpParseException e) {
            throw new IllegalStateException(e);
        }
    }

    static Map<Integer, SignRestriction> restrictions(SignRestriction... r) {
        Map<Integer, SignRestriction> out = new TreeMap<>();
        for (int j = 0; j < r.length; j++) out.put(j + 1, r[j]);
        return out;
    }

    /** The two-variable production problem used across the tests. */
    static Problem production() {
        return new Problem(new Objective(Direction.MAX, expr("3x1+5x2")),
                Arrays.asList(new Constraint(expr("x1+2x2"), Relation.LE, 4),
                        new Constraint(expr("3x1+2x2"), Relation.LE, 6)),
                restrictions(SignRestriction.NONNEG, SignRestriction.NONNEG), 2);
    }

    @Test
    public void productionProblem() throws LpParseException {
        Problem p = LpParser.parse("max 3x1+5x2 s.t. x1+2x2<=4 3x1+2x2<=6 end");
        assertEquals(production(), p);
        assertEquals(Direction.MAX, p.direction());
        assertEquals(2, p.variableCount());
        assertEquals(2, p.constraintCount());
        assertEquals(6.0, p.constraint(2).rhs());
    }

    @Test
    public void caseAndWhitespaceDoNotMatter() throws LpParseException {
        Problem a = LpParser.parse("max 3x1+5x2 s.t. x1+2x2<=4 3x1+2x2<=6 end");
        Problem b = LpParser.parse("MAXIMIZE\n  3 X1 + 5 x2\nSUBJECT TO\n  x1 + 2 x2 <= 4\n  3x1 + 2x2 <= 6\nEND");
        assertEquals(a, b);
    }

    @Test
    public void readsFromReaderAndFile() throws IOException, LpParseException {
        assertEquals(production(), LpParser.parse(new StringReader("max 3x1+5x2 s.t. x1+2x2<=4 3x1+2x2<=6 end")));
        assertEquals(production(), LpParser.parseFile(resource("production.lp")));
    }

    @Test
    public void undeclaredVariablesAreNonNegative() throws LpParseException {
        Problem p = LpParser.parse("min x1 + x2 s.t. x1 + x2 >= 1 with x2 free end");
        assertEquals(SignRestriction.NONNEG, p.restriction(1));
        assertEquals(SignRestriction.FREE, p.restriction(2));
    }

    @Test
    public void variableOnlyDeclaredInWithSectionCounts() throws LpParseException {
        Problem p = LpParser.parse("max x1 s.t. x1 <= 1 with x5 <= 0 end");
        assertEquals(5, p.variableCount());
        assertEquals(SignRestriction.NONPOS, p.restriction(5));
        assertEquals(SignRestriction.NONNEG, p.restriction(3));
    }

    @Test
    public void indexGapsAreFilled() throws LpParseException {
        Problem p = LpParser.parse("max x1 + x4 s.t. x1 + x4 <= 2 end");
        assertEquals(4, p.variableCount());
        assertEquals(0.0, p.objective().expression().coefficient(2));
        assertEquals(4, p.restrictions().size());
    }

    @Test
    public void namedObjectiveIsAccepted() throws LpParseException {
        Problem p = LpParser.parse("max z = 3x1 + 5x2 s.t. x1 + 2x2 <= 4 3x1 + 2x2 <= 6 end");
        assertEquals(production(), p);
    }

    @Test
    public void duplicateConstraintsAreKept() throws LpParseException {
        Problem p = LpParser.parse("min x1 s.t. x1 >= 1 x1 >= 1 end");
        assertEquals(2, p.constraintCount());
        assertEquals(p.constraint(1), p.constraint(2));
    }

    @Test
    public void noisyDescription() throws IOException, LpParseException {
        Problem expected = new Problem(new Objective(Direction.MAX, expr("3x1 + 2x2 - x3")),
                Arrays.asList(new Constraint(expr("x1 + x2 + x3"), Relation.LE, 40),
                        new Constraint(expr("2x1 + x2 + x3"), Relation.LE, 60),
                        new Constraint(expr("x1"), Relation.GE, 5),
                        new Constraint(expr("x2 - 3x3"), Relation.EQ, 0)),
                restrictions(SignRestriction.NONNEG, SignRestriction.NONNEG, SignRestriction.FREE), 3);
        assertEquals(expected, LpParser.parseFile(resource("noisy.lp")));
    }

    @Test
    public void constantInObjective() {
        assertThrows(LpSyntaxException.class, () -> LpParser.parse("max 3x1 + 5 s.t. x1 <= 1 end"));
        assertThrows(LpSyntaxException.class, () -> LpParser.parse("max 3x1 <= 5 s.t. x1 <= 1 end"));
    }

    @Test
    public void emptyProblems() {
        assertThrows(EmptyProblemException.class, () -> LpParser.parse("end"));
        assertThrows(EmptyProblemException.class, () -> LpParser.parse("max s.t. x1 <= 1 end"));
        assertThrows(EmptyProblemException.class, () -> LpParser.parse("max x1 end"));
        assertThrows(EmptyProblemException.class, () -> LpParser.parse("max x1 s.t. end"));
        assertThrows(EmptyProblemException.class, () -> LpParser.parse("max x1 s.t. with x1 free end"));
    }

    @Test
    public void missingEndWinsOverOtherErrors() {
        assertThrows(MissingEndException.class, () -> LpParser.parse("max 3x1 s.t. x1 <= 4 x + y < 2"));
        assertThrows(MissingEndException.class, () -> LpParser.parseFile(resource("unterminated.lp")));
    }

    @Test
    public void errorsCarryTheirPosition() {
        UnknownVariableException e = assertThrows(UnknownVariableException.class,
                () -> LpParser.parse("max x1\ns.t.\n  x1 + 2x <= 4\nend"));
        assertEquals(3, e.getLine());
        assertEquals(9, e.getColumn());
        assertTrue(e.getMessage().startsWith("line 3, column 9: "));

        RelationNotFoundException r = assertThrows(RelationNotFoundException.class,
                () -> LpParser.parse("max x1\ns.t.\n  x1 + 2\nend"));
        assertEquals(3, r.getLine());
        assertEquals(3, r.getColumn());
    }

    @Test
    public void strictInequalityIsRejected() {
        assertThrows(LpSyntaxException.class, () -> LpParser.parse("max x1 s.t. x1 < 4 end"));
    }

    @Test
    public void keywordsMayTouchVariables() throws LpParseException {
        Problem spaced = LpParser.parse("max x1 + x2 s.t. x1 <= 4 with x1 free end");
        assertEquals(spaced, LpParser.parse("maxx1+x2s.t.x1<=4withx1freeend"));
        assertEquals(spaced, LpParser.parse("max x1+x2 s.t. x1<=4 withx1free end"));
        assertEquals(spaced, LpParser.parse("MAXx1 + x2 stx1 <= 4 WITH x1FREE END"));
        assertEquals(LpParser.parse("max 3x1 s.t. x1 <= 4 end"), LpParser.parse("max 3x1 subject tox1<=4 end"));
        assertEquals(Direction.MIN, LpParser.parse("minx1 s.t. x1 >= 2 end").direction());
    }

    @Test
    public void zeroCoefficientStillCountsTheVariable() throws LpParseException {
        Problem p = LpParser.parse("max x1 + 0x3 s.t. x1 <= 4 end");
        assertEquals(3, p.variableCount());
        assertFalse(p.objective().expression().contains(3));
        assertEquals(3, DualTransformer.dual(p).constraintCount());

        assertEquals(2, LpParser.parse("max x1 s.t. x1 + x2 - x2 <= 4 end").variableCount());
    }

    @Test
    public void exponentNumbers() throws LpParseException {
        assertEquals(100000.0, LpParser.parse("max x1 s.t. x1 <= 1e5 end").constraint(1).rhs());
        assertEquals(0.25, LpParser.parse("max 2.5E-1x1 s.t. x1 <= 1 end").objective().expression().coefficient(1));
    }

    @Test
    public void strayNumberIsNotDropped() {
        assertThrows(RelationNotFoundException.class, () -> LpParser.parse("max x1 s.t. x1 <= 4 5 end"));
    }
}
