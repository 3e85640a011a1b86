package com.linearproblem;

import java.util.List;

/**
 * Parses a sum of signed terms into a {@link ParsedExpression}.
 *
 * <pre>
 *   expression := term ( sign+ term )*
 *   term       := sign* ( NUMBER [ '*' ] VARIABLE | NUMBER | VARIABLE )
 * </pre>
 *
 * A run of signs folds to one ({@code --x1} is {@code +x1}); a variable
 * without a coefficient has coefficient 1; a number only binds to a
 * following variable when nothing but whitespace (or {@code *}) separates
 * them. Repeated variables are summed.
 */
public final class ExpressionParser {

    private ExpressionParser() {}

    public static ParsedExpression parse(String text) throws LpParseException {
        return parse(LpLexer.tokenize(text));
    }

    public static ParsedExpression parse(List<Token> tokens) throws LpParseException {
        LinearExpression.Builder vars = LinearExpression.builder();
        double constant = 0.0;
        int terms = 0;
        final int n = tokens.size();
        int i = 0;

        while (i < n) {
            int sign = 1;
            boolean signed = false;
            while (i < n && tokens.get(i).type().isSign()) {
                if (tokens.get(i).is(TokenType.MINUS)) sign = -sign;
                signed = true;
                i++;
            }
            if (i == n) throw new LpSyntaxException("sign without a term", tokens.get(n - 1));

            Token t = tokens.get(i);
            if (t.type().isInvalid()) throw t.error();
            if (terms > 0 && !signed) throw new LpSyntaxException("missing '+' or '-' before " + t.describe(), t);

            switch (t.type()) {
                case NUMBER: {
                    i++;
                    Token next = i < n ? tokens.get(i) : null;
                    if (next != null && next.is(TokenType.TIMES)) {
                        i++;
                        if (i == n || !tokens.get(i).is(TokenType.VARIABLE)) {
                            if (i < n && tokens.get(i).type().isInvalid()) throw tokens.get(i).error();
                            throw new LpSyntaxException("'*' must be followed by a variable", next);
                        }
                        vars.add(sign * t.number(), tokens.get(i).variable());
                        i++;
                    } else if (next != null && !next.afterNoise() && next.is(TokenType.VARIABLE)) {
                        vars.add(sign * t.number(), next.variable());
                        i++;
                    } else if (next != null && !next.afterNoise() && next.is(TokenType.BAD_VARIABLE)) {
                        throw next.error();
                    } else {
                        constant += sign * t.number();
                    }
                    break;
                }
                case VARIABLE:
                    vars.add(sign, t.variable());
                    i++;
                    break;
                case TIMES:
                    throw new LpSyntaxException("'*' must follow a coefficient", t);
                default:
                    throw new LpSyntaxException("unexpected " + t.describe() + " in expression", t);
            }
            terms++;
        }
        return new ParsedExpression(vars.build(), constant, terms);
    }
}
