package com.linearproblem;

/**
 * Base class of every error raised while reading an LP description. Parsing
 * is all-or-nothing, so one of these always means no {@link Problem} was built.
 */
public class LpParseException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String reason;
    private final String fragment;   // offending source text, may be empty
    private final int line;          // 1-based, 0 when unknown
    private final int column;        // 1-based, 0 when unknown

    public LpParseException(String reason, String fragment, int line, int column) {
        super(describe(reason, fragment, line, column));
        this.reason = reason;
        this.fragment = fragment == null ? "" : fragment;
        this.line = line;
        this.column = column;
    }

    public LpParseException(String reason, Token at) {
        this(reason, at.text(), at.line(), at.column());
    }

    public LpParseException(String reason) {
        this(reason, "", 0, 0);
    }

    public String getReason() { return reason; }
    public String getFragment() { return fragment; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    private static String describe(String reason, String fragment, int line, int column) {
        StringBuilder sb = new StringBuilder();
        if (line > 0) sb.append("line ").append(line).append(", column ").append(column).append(": ");
        sb.append(reason);
        if (fragment != null && !fragment.isEmpty()) sb.append(" near '").append(fragment).append('\'');
        return sb.toString();
    }
}
