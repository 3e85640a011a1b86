package com.linearproblem;

/**
 * One lexical unit of an LP description, with its position in the source.
 * Noise between tokens is not kept; {@link #afterNoise()} only records that
 * some was skipped.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int offset;
    private final int line;
    private final int column;
    private final boolean afterNoise;
    private final double number;    // NUMBER only
    private final int variable;     // VARIABLE only

    Token(TokenType type, String text, int offset, int line, int column,
          boolean afterNoise, double number, int variable) {
        this.type = type;
        this.text = text;
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.afterNoise = afterNoise;
        this.number = number;
        this.variable = variable;
    }

    public TokenType type() { return type; }
    public String text() { return text; }
    public int offset() { return offset; }
    public int line() { return line; }
    public int column() { return column; }
    public boolean afterNoise() { return afterNoise; }
    public double number() { return number; }
    public int variable() { return variable; }

    public boolean is(TokenType t) { return type == t; }

    /** The deferred error of a {@link TokenType#BAD_VARIABLE} or {@link TokenType#BAD_SYMBOL} token. */
    LpParseException error() {
        if (type == TokenType.BAD_VARIABLE) {
            return new UnknownVariableException("malformed variable, expected 'x' followed by an index >= 1", this);
        }
        if (type == TokenType.BAD_SYMBOL) {
            return new LpSyntaxException("strict inequality is not supported, use '<=' or '>='", this);
        }
        return new LpSyntaxException("unexpected " + describe(), this);
    }

    String describe() {
        if (type.isKeyword()) return "keyword '" + text + "'";
        switch (type) {
            case NUMBER: return "number " + text;
            case VARIABLE: return "variable " + text;
            case LE: case GE: case EQ: return "relation '" + text + "'";
            default: return "'" + text + "'";
        }
    }

    @Override public String toString() { return type + "(" + text + ")@" + line + ":" + column; }
}
