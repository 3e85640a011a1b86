package com.linearproblem;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link LinearExpression} and {@link Term}: merging, zero
 * elimination, arithmetic and the textual form the parser reads back.
 */
public class LinearExpressionTest {

    @Test
    public void testMergingAndZeroElimination() {
        LinearExpression e = LinearExpression.of(Arrays.asList(
                new Term(2, 3), new Term(1, 1), new Term(-2, 3), new Term(0.5, 1)));
        assertEquals(1, e.size());
        assertEquals(1.5, e.coefficient(1));
        assertFalse(e.contains(3));
        assertEquals(1, e.maxVariable());
        assertEquals(LinearExpression.EMPTY, LinearExpression.builder().add(0, 4).build());
        assertEquals(0, LinearExpression.EMPTY.maxVariable());
    }

    @Test
    public void testArithmetic() {
        LinearExpression a = LinearExpression.builder().add(1, 1).add(2, 2).build();
        LinearExpression b = LinearExpression.builder().add(1, 1).add(-1, 3).build();
        assertEquals(LinearExpression.builder().add(2, 2).add(1, 3).build(), a.minus(b));
        assertEquals(LinearExpression.builder().add(2, 1).add(2, 2).add(-1, 3).build(), a.plus(b));
        assertEquals(LinearExpression.EMPTY, a.minus(a));
        assertEquals(-2.0, a.negate().coefficient(2));
    }

    @Test
    public void testTermsAreOrderedByIndex() {
        LinearExpression e = LinearExpression.builder().add(4, 7).add(-1, 2).add(3, 5).build();
        assertEquals(Arrays.asList(new Term(-1, 2), new Term(3, 5), new Term(4, 7)), e.terms());
        assertEquals(Arrays.asList(2, 5, 7), Arrays.asList(e.variables().toArray(new Integer[0])));
    }

    @Test
    public void testTextualForm() {
        assertEquals("3x1 - x2 + 0.5x4",
                LinearExpression.builder().add(3, 1).add(-1, 2).add(0.5, 4).build().toString());
        assertEquals("-x1 + 10x2", LinearExpression.builder().add(-1, 1).add(10, 2).build().toString());
        assertEquals("0", LinearExpression.EMPTY.toString());
        assertEquals("-0.25x3", new Term(-0.25, 3).toString());
        assertEquals("0.00001", Term.format(1e-5));
        assertEquals("0", Term.format(-0.0));
    }

    @Test
    public void testInvalidIndex() {
        assertThrows(IllegalArgumentException.class, () -> new Term(1, 0));
        assertThrows(IllegalArgumentException.class, () -> LinearExpression.builder().add(1, -2));
    }
}
