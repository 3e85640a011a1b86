package com.linearproblem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the with-section ({@code x1 free  x2 <= 0  x3, x4 >= 0}) and assigns
 * every variable its sign restriction. Undeclared variables are non-negative.
 */
public final class RestrictionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RestrictionResolver.class);

    private RestrictionResolver() {}

    /** Restrictions written in the with-section, keyed by variable index. */
    public static SortedMap<Integer, SignRestriction> declared(List<Token> section) throws LpParseException {
        SortedMap<Integer, SignRestriction> out = new TreeMap<>();
        List<Token> pending = new ArrayList<>();
        int i = 0;
        while (i < section.size()) {
            Token t = section.get(i++);
            if (t.type().isInvalid()) throw t.error();
            switch (t.type()) {
                case VARIABLE:
                    pending.add(t);
                    break;
                case FREE:
                    assign(out, pending, SignRestriction.FREE, t);
                    break;
                case GE:
                case LE: {
                    i = expectZero(section, i, t);
                    assign(out, pending, t.is(TokenType.GE) ? SignRestriction.NONNEG : SignRestriction.NONPOS, t);
                    break;
                }
                case EQ:
                    throw new LpSyntaxException("'=' is not a sign restriction, use 'free', '>= 0' or '<= 0'", t);
                default:
                    throw new LpSyntaxException("unexpected " + t.describe() + " in with-section", t);
            }
        }
        if (!pending.isEmpty()) {
            throw new LpSyntaxException("no restriction given for " + pending.get(0).text(), pending.get(0));
        }
        LOG.debug("Declared restrictions: {}", out);
        return out;
    }

    /** Restriction of every index 1..n, declared ones first, {@link SignRestriction#DEFAULT} otherwise. */
    public static SortedMap<Integer, SignRestriction> resolve(Map<Integer, SignRestriction> declared, int n) {
        SortedMap<Integer, SignRestriction> out = new TreeMap<>();
        for (int j = 1; j <= n; j++) {
            SignRestriction s = declared.get(j);
            out.put(j, s == null ? SignRestriction.DEFAULT : s);
        }
        return out;
    }

    /** Consumes the "0" after a relation, optionally signed; returns the next position. */
    private static int expectZero(List<Token> section, int i, Token relation) throws LpParseException {
        while (i < section.size() && section.get(i).type().isSign()) i++;
        if (i >= section.size() || !section.get(i).is(TokenType.NUMBER)) {
            throw new LpSyntaxException("expected 0 after '" + relation.text() + "'", relation);
        }
        Token bound = section.get(i);
        if (bound.number() != 0.0) {
            throw new LpSyntaxException("only 0 is allowed as a sign bound", bound);
        }
        return i + 1;
    }

    private static void assign(SortedMap<Integer, SignRestriction> out, List<Token> pending,
                               SignRestriction restriction, Token at) throws LpParseException {
        if (pending.isEmpty()) {
            throw new LpSyntaxException("restriction '" + at.text() + "' without a variable", at);
        }
        for (Token v : pending) {
            SignRestriction prior = out.putIfAbsent(v.variable(), restriction);
            if (prior != null && prior != restriction) {
                throw new ConflictingRestrictionException(v.variable(), prior, restriction, v);
            }
        }
        pending.clear();
    }
}
