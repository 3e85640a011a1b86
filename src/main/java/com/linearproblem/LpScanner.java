package com.linearproblem;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a token stream into the sections of an LP description:
 *
 * <pre>
 *   ... noise ...  min|max  objective  s.t.  constraints  [ with  restrictions ]  end  ... ignored ...
 * </pre>
 *
 * Line breaks carry no meaning. The constraint section is split into
 * statements where a term follows a finished term without an operator
 * ({@code x1 <= 4  3x1 + x2 <= 6}), and a statement holding two relations is
 * split in front of the term that starts the second one.
 */
public final class LpScanner {

    private static final Logger LOG = LoggerFactory.getLogger(LpScanner.class);

    private LpScanner() {}

    public static ScannedProblem scan(String text) throws LpParseException {
        return scan(LpLexer.tokenize(text));
    }

    public static ScannedProblem scan(List<Token> tokens) throws LpParseException {
        int anchor = indexOf(tokens, 0, TokenType.MIN, TokenType.MAX);
        int end = indexOf(tokens, Math.max(anchor, 0), TokenType.END);
        if (end < 0) {
            Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            if (last == null) throw new MissingEndException("missing terminating 'end'");
            throw new MissingEndException("missing terminating 'end'", "", last.line(), last.column());
        }
        if (anchor < 0) {
            throw new EmptyProblemException("no objective, expected 'min' or 'max' before 'end'", tokens.get(end));
        }
        if (anchor > 0) LOG.debug("Skipped {} tokens before '{}'", anchor, tokens.get(anchor).text());

        // ---- objective ----
        int i = anchor + 1;
        List<Token> objective = new ArrayList<>();
        while (i < end && !tokens.get(i).is(TokenType.SUBJECT_TO) && !tokens.get(i).is(TokenType.WITH)) {
            Token t = tokens.get(i++);
            if (t.type().isKeyword()) throw misplaced(t, "objective");
            objective.add(t);
        }
        LOG.debug("Objective section: {} tokens", objective.size());

        // ---- constraints ----
        List<Statement> constraints = new ArrayList<>();
        if (i < end && tokens.get(i).is(TokenType.SUBJECT_TO)) {
            i++;
            List<Token> section = new ArrayList<>();
            while (i < end && !tokens.get(i).is(TokenType.WITH)) {
                Token t = tokens.get(i++);
                if (t.type().isKeyword()) throw misplaced(t, "constraints");
                section.add(t);
            }
            constraints = splitStatements(section);
            LOG.debug("Constraint section: {} statements", constraints.size());
        }

        // ---- with ----
        List<Token> restrictions = new ArrayList<>();
        if (i < end && tokens.get(i).is(TokenType.WITH)) {
            i++;
            while (i < end) {
                Token t = tokens.get(i++);
                if (t.type().isKeyword() && !t.is(TokenType.FREE)) throw misplaced(t, "with-section");
                restrictions.add(t);
            }
            LOG.debug("With section: {} tokens", restrictions.size());
        }

        return new ScannedProblem(tokens.get(anchor), objective, constraints, restrictions, tokens.get(end));
    }

    /** Splits a constraint section into statements, see the class comment. */
    static List<Statement> splitStatements(List<Token> section) {
        List<List<Token>> pieces = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        Token prev = null;
        for (Token t : section) {
            if (prev != null && startsNewTerm(t) && !continuesTerm(prev, t) && endsTerm(prev)) {
                pieces.add(current);
                current = new ArrayList<>();
            }
            current.add(t);
            prev = t;
        }
        if (!current.isEmpty()) pieces.add(current);

        List<Statement> out = new ArrayList<>();
        for (int k = 0; k < pieces.size(); k++) {
            List<Token> piece = pieces.get(k);
            Token before = k > 0 ? last(pieces.get(k - 1)) : null;
            Token after = k + 1 < pieces.size() ? pieces.get(k + 1).get(0) : null;
            if (isLabel(piece, before, after)) {
                LOG.trace("Dropping label '{}'", piece.get(0).text());
                continue;
            }
            List<Token> rest = piece;
            int cut;
            while ((cut = secondStatementStart(rest)) > 0) {
                out.add(new Statement(new ArrayList<>(rest.subList(0, cut))));
                rest = rest.subList(cut, rest.size());
            }
            out.add(new Statement(new ArrayList<>(rest)));
        }
        for (Statement s : out) LOG.trace("Statement: {}", s);
        return out;
    }

    /**
     * Where the second of two relations in one piece starts, or -1. The cut
     * goes in front of a signed term, or of a variable that was bound to the
     * number before it ({@code x1 <= 4 x2 <= 3}), somewhere after the first
     * right-hand term. A cut at the start of a line wins.
     */
    private static int secondStatementStart(List<Token> piece) {
        int first = -1, second = -1;
        for (int k = 0; k < piece.size(); k++) {
            if (piece.get(k).type().isRelation()) {
                if (first < 0) first = k;
                else { second = k; break; }
            }
        }
        if (second < 0) return -1;

        int candidate = -1;
        for (int k = first + 2; k < second; k++) {
            Token t = piece.get(k);
            Token prev = piece.get(k - 1);
            boolean opens = (t.type().isSign() && endsTerm(prev))
                    || (t.is(TokenType.VARIABLE) && prev.is(TokenType.NUMBER));
            if (!opens) continue;
            if (t.line() > prev.line()) return k;
            if (candidate < 0) candidate = k;
        }
        return candidate;
    }

    /**
     * A lone number that opens a line or is followed by punctuation, e.g. the
     * "1" of "1) x1 + x2 <= 4". Any other stray number stays a statement and
     * fails as one.
     */
    private static boolean isLabel(List<Token> piece, Token before, Token after) {
        if (piece.size() != 1 || !piece.get(0).is(TokenType.NUMBER)) return false;
        Token n = piece.get(0);
        boolean startsLine = before == null || before.line() < n.line();
        return startsLine || (after != null && after.afterNoise());
    }

    private static Token last(List<Token> piece) {
        return piece.get(piece.size() - 1);
    }

    private static boolean startsNewTerm(Token t) {
        return t.is(TokenType.NUMBER) || t.is(TokenType.VARIABLE) || t.is(TokenType.BAD_VARIABLE);
    }

    private static boolean continuesTerm(Token prev, Token t) {
        if (prev.is(TokenType.TIMES)) return true;
        return prev.is(TokenType.NUMBER) && !t.afterNoise() && !t.is(TokenType.NUMBER);
    }

    private static boolean endsTerm(Token t) {
        return t.is(TokenType.NUMBER) || t.is(TokenType.VARIABLE) || t.is(TokenType.BAD_VARIABLE);
    }

    private static int indexOf(List<Token> tokens, int from, TokenType... types) {
        for (int k = from; k < tokens.size(); k++) {
            for (TokenType type : types) {
                if (tokens.get(k).is(type)) return k;
            }
        }
        return -1;
    }

    private static LpSyntaxException misplaced(Token t, String section) {
        return new LpSyntaxException("keyword '" + t.text() + "' is not allowed in the " + section, t);
    }
}
