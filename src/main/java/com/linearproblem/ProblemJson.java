package com.linearproblem;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * JSON form of a {@link Problem}. Terms are stored sparsely as
 * (coefficient, variable) pairs, so loading a saved problem gives back an
 * equal one:
 *
 * <pre>
 * {
 *   "direction": "MAX",
 *   "variableCount": 2,
 *   "objective": [ {"coefficient": 3.0, "variable": 1}, {"coefficient": 5.0, "variable": 2} ],
 *   "constraints": [ {"terms": [ ... ], "relation": "LE", "rhs": 4.0} ],
 *   "restrictions": {"1": "NONNEG", "2": "FREE"}
 * }
 * </pre>
 */
public final class ProblemJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private ProblemJson() {}

    // ---- structs mirroring the JSON layout ----

    static final class TermStruct {
        double coefficient;
        int variable;

        TermStruct() {}

        TermStruct(double coefficient, int variable) {
            this.coefficient = coefficient;
            this.variable = variable;
        }
    }

    static final class ConstraintStruct {
        List<TermStruct> terms;
        Relation relation;
        double rhs;
    }

    static final class ProblemStruct {
        Direction direction;
        int variableCount;
        List<TermStruct> objective;
        List<ConstraintStruct> constraints;
        Map<Integer, SignRestriction> restrictions;
    }

    // ---- write ----

    public static String toJson(Problem p) {
        return GSON.toJson(toStruct(p));
    }

    public static void write(Problem p, Writer out) throws IOException {
        out.write(toJson(p));
        out.write(System.lineSeparator());
        out.flush();
    }

    public static void save(Problem p, Path file) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(p, w);
        }
    }

    // ---- read ----

    public static Problem fromJson(String json) throws ProblemFormatException {
        ProblemStruct s;
        try {
            s = GSON.fromJson(json, ProblemStruct.class);
        } catch (JsonParseException e) {
            throw new ProblemFormatException("Malformed problem JSON: " + e.getMessage(), e);
        }
        return fromStruct(s);
    }

    public static Problem read(Reader in) throws IOException {
        ProblemStruct s;
        try {
            s = GSON.fromJson(in, ProblemStruct.class);
        } catch (JsonParseException e) {
            throw new ProblemFormatException("Malformed problem JSON: " + e.getMessage(), e);
        }
        return fromStruct(s);
    }

    public static Problem load(Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        }
    }

    // ---- conversion ----

    private static ProblemStruct toStruct(Problem p) {
        ProblemStruct s = new ProblemStruct();
        s.direction = p.direction();
        s.variableCount = p.variableCount();
        s.objective = terms(p.objective().expression());
        s.constraints = new ArrayList<>();
        for (Constraint c : p.constraints()) {
            ConstraintStruct cs = new ConstraintStruct();
            cs.terms = terms(c.expression());
            cs.relation = c.relation();
            cs.rhs = c.rhs();
            s.constraints.add(cs);
        }
        s.restrictions = new TreeMap<>(p.restrictions());
        return s;
    }

    private static List<TermStruct> terms(LinearExpression e) {
        List<TermStruct> out = new ArrayList<>(e.size());
        for (Term t : e.terms()) out.add(new TermStruct(t.coefficient(), t.variable()));
        return out;
    }

    private static Problem fromStruct(ProblemStruct s) throws ProblemFormatException {
        if (s == null) throw new ProblemFormatException("Empty problem JSON");
        require(s.direction, "direction");
        require(s.objective, "objective");
        require(s.constraints, "constraints");
        require(s.restrictions, "restrictions");
        try {
            List<Constraint> constraints = new ArrayList<>(s.constraints.size());
            for (int i = 0; i < s.constraints.size(); i++) {
                ConstraintStruct cs = s.constraints.get(i);
                require(cs, "constraints[" + i + "]");
                require(cs.terms, "constraints[" + i + "].terms");
                require(cs.relation, "constraints[" + i + "].relation");
                constraints.add(new Constraint(expression(cs.terms), cs.relation, cs.rhs));
            }
            Objective objective = new Objective(s.direction, expression(s.objective));
            return new Problem(objective, constraints, s.restrictions, s.variableCount);
        } catch (IllegalArgumentException e) {
            throw new ProblemFormatException("Invalid problem: " + e.getMessage(), e);
        }
    }

    private static LinearExpression expression(List<TermStruct> terms) throws ProblemFormatException {
        LinearExpression.Builder b = LinearExpression.builder();
        for (TermStruct t : terms) {
            require(t, "term");
            b.add(t.coefficient, t.variable);
        }
        return b.build();
    }

    private static void require(Object value, String field) throws ProblemFormatException {
        if (value == null) throw new ProblemFormatException("Missing field '" + field + "'");
    }
}
