package com.linearproblem;

import java.util.List;

/**
 * Reduces one constraint statement to canonical form. Both sides are parsed
 * separately, then variables are collected on the left and constants on the
 * right: {@code lhs REL rhs} becomes {@code (lhs.vars - rhs.vars) REL (rhs.const - lhs.const)}.
 */
public final class ConstraintClassifier {

    private ConstraintClassifier() {}

    public static Constraint classify(String text) throws LpParseException {
        List<Token> tokens = LpLexer.tokenize(text);
        if (tokens.isEmpty()) throw new RelationNotFoundException("empty constraint", text.trim(), 0, 0);
        return classify(new Statement(tokens));
    }

    public static Constraint classify(Statement statement) throws LpParseException {
        List<Token> tokens = statement.tokens();
        int at = -1;
        for (int k = 0; k < tokens.size(); k++) {
            Token t = tokens.get(k);
            if (t.is(TokenType.BAD_SYMBOL)) throw t.error();
            if (!t.type().isRelation()) continue;
            if (at >= 0) {
                throw new LpSyntaxException("more than one relation in constraint '" + statement.text() + "'", t);
            }
            at = k;
        }
        if (at < 0) {
            Token first = statement.first();
            throw new RelationNotFoundException("no '<=', '>=' or '=' in constraint",
                    statement.text(), first.line(), first.column());
        }

        Token rel = tokens.get(at);
        ParsedExpression left = ExpressionParser.parse(tokens.subList(0, at));
        if (at + 1 == tokens.size()) {
            throw new LpSyntaxException("constraint has no right-hand side", rel);
        }
        ParsedExpression right = ExpressionParser.parse(tokens.subList(at + 1, tokens.size()));

        LinearExpression lhs = left.expression().minus(right.expression());
        double rhs = right.constant() - left.constant();
        if (lhs.isEmpty()) {
            String reason = mentionsVariable(tokens)
                    ? "all variable terms of the constraint cancel" : "constraint has no variable terms";
            throw new LpSyntaxException(reason, statement.text(),
                    statement.first().line(), statement.first().column());
        }
        return new Constraint(lhs, rel.type().relation(), rhs);
    }

    private static boolean mentionsVariable(List<Token> tokens) {
        for (Token t : tokens) {
            if (t.is(TokenType.VARIABLE)) return true;
        }
        return false;
    }
}
