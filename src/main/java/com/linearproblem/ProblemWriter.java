package com.linearproblem;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Text renderings of a {@link Problem}.
 *
 * <ul>
 *   <li>{@link #writeMatrix} prints the dense report {@code MinMax, c, A, Eqin, b, naturalConstraints}
 *       with the integer codes of {@link Direction#code()}, {@link Relation#code()} and
 *       {@link SignRestriction#code()}. Meant for reading, not for parsing.</li>
 *   <li>{@link #writeLp} prints the problem in the input grammar. The output
 *       parses back to an equal problem as long as every constraint has at least
 *       one variable term.</li>
 * </ul>
 */
public final class ProblemWriter {

    public enum Format { LP, MATRIX }

    private ProblemWriter() {}

    public static void write(Problem p, Format format, PrintWriter out) {
        if (format == Format.LP) writeLp(p, out);
        else writeMatrix(p, out);
    }

    public static String toString(Problem p, Format format) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        write(p, format, pw);
        pw.flush();
        return sw.toString();
    }

    public static void writeMatrix(Problem p, PrintWriter out) {
        final int n = p.variableCount();

        out.println("MinMax = " + p.direction().code());
        out.println();

        out.println("c =");
        out.println(row(p.objective().expression(), n));
        out.println();

        out.println("A =");
        for (Constraint c : p.constraints()) out.println(row(c.expression(), n));
        out.println();

        out.println("Eqin =");
        for (Constraint c : p.constraints()) out.println(c.relation().code());
        out.println();

        out.println("b =");
        for (Constraint c : p.constraints()) out.println(Term.format(c.rhs()));
        out.println();

        out.println("naturalConstraints =");
        StringBuilder sb = new StringBuilder();
        for (int j = 1; j <= n; j++) {
            if (j > 1) sb.append(' ');
            sb.append(p.restriction(j).code());
        }
        out.println(sb);
        out.flush();
    }

    public static void writeLp(Problem p, PrintWriter out) {
        out.println(p.direction().keyword() + " " + p.objective().expression());
        out.println("s.t.");
        for (Constraint c : p.constraints()) out.println("  " + c);

        // x_n is declared when nothing else mentions it, so the variable count survives a reparse
        int referenced = p.objective().expression().maxVariable();
        for (Constraint c : p.constraints()) referenced = Math.max(referenced, c.expression().maxVariable());

        boolean header = false;
        for (int j = 1; j <= p.variableCount(); j++) {
            SignRestriction r = p.restriction(j);
            if (r == SignRestriction.DEFAULT && !(j == p.variableCount() && j > referenced)) continue;
            if (!header) { out.println("with"); header = true; }
            out.println("  x" + j + " " + r.text());
        }
        out.println("end");
        out.flush();
    }

    private static String row(LinearExpression e, int n) {
        StringBuilder sb = new StringBuilder();
        for (int j = 1; j <= n; j++) {
            if (j > 1) sb.append(' ');
            sb.append(Term.format(e.coefficient(j)));
        }
        return sb.toString();
    }
}
