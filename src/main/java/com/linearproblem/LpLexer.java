package com.linearproblem;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits raw LP text into tokens. Keywords are matched case-insensitively and
 * whitespace only separates tokens, so {@code 2x1+3x2} and {@code 2 x1 + 3 x2}
 * lex the same. Anything that is not part of the grammar (commentary, labels,
 * punctuation) is dropped.
 *
 * <p>The lexer never fails. Malformed constructs become
 * {@link TokenType#BAD_VARIABLE} / {@link TokenType#BAD_SYMBOL} tokens and are
 * reported by whichever stage consumes them, so that text outside the parsed
 * sections can never cause an error.
 */
public final class LpLexer {

    private static final Logger LOG = LoggerFactory.getLogger(LpLexer.class);

    // a keyword may run straight into a variable: "s.t.x1", "subject tox1"
    private static final String WORD_END = "(?!(?![xX]\\d)\\p{L})";
    private static final Pattern S_DOT_T = Pattern.compile("s\\s*\\.\\s*t" + WORD_END + "\\s*\\.?", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBJECT_TO = Pattern.compile(
            "subject\\s*to" + WORD_END + "|such\\s*that" + WORD_END, Pattern.CASE_INSENSITIVE);

    /** Keywords that may be written without a separator, longest spelling first. */
    private static final String[] JOINABLE = {
            "minimize", "minimise", "maximize", "maximise", "with", "free", "end", "min", "max", "st"
    };

    private final String src;
    private final int[] lineStarts;
    private final List<Token> out = new ArrayList<>();
    private int pos;
    private boolean noise;

    private LpLexer(String src) {
        this.src = src;
        this.lineStarts = lineStarts(src);
    }

    public static List<Token> tokenize(String text) {
        LpLexer lx = new LpLexer(text);
        lx.run();
        LOG.trace("Lexed {} tokens from {} characters", lx.out.size(), text.length());
        return lx.out;
    }

    private void run() {
        final int len = src.length();
        while (pos < len) {
            char ch = src.charAt(pos);
            if (Character.isWhitespace(ch)) { pos++; continue; }

            if (isDigit(ch) || (ch == '.' && pos + 1 < len && isDigit(src.charAt(pos + 1)))) {
                lexNumber();
            } else if (Character.isLetter(ch)) {
                lexWord();
            } else {
                lexSymbol(ch);
            }
        }
    }

    // ---- numbers ----

    private void lexNumber() {
        int start = pos;
        while (pos < src.length() && isDigit(src.charAt(pos))) pos++;
        if (pos < src.length() && src.charAt(pos) == '.') {
            pos++;
            while (pos < src.length() && isDigit(src.charAt(pos))) pos++;
        }
        exponent();
        String text = src.substring(start, pos);
        emit(TokenType.NUMBER, start, Double.parseDouble(text), 0);
    }

    /** Consumes {@code e5}, {@code E-3}, ... after a mantissa; leaves {@code end} or {@code ex1} alone. */
    private void exponent() {
        if (pos >= src.length() || (src.charAt(pos) != 'e' && src.charAt(pos) != 'E')) return;
        int q = pos + 1;
        if (q < src.length() && (src.charAt(q) == '+' || src.charAt(q) == '-')) q++;
        if (q >= src.length() || !isDigit(src.charAt(q))) return;
        pos = q;
        while (pos < src.length() && isDigit(src.charAt(pos))) pos++;
    }

    // ---- words: keywords, variables, noise ----

    private void lexWord() {
        int start = pos;
        if (lookingAt(SUBJECT_TO) || lookingAt(S_DOT_T)) {
            emit(TokenType.SUBJECT_TO, start, 0, 0);
            return;
        }
        List<int[]> pieces = new ArrayList<>();
        if (split(start, pieces) && pieces.size() > 1) {
            for (int[] piece : pieces) emitPiece(piece[0], piece[1]);
            return;
        }
        while (pos < src.length() && Character.isLetter(src.charAt(pos))) pos++;
        String word = src.substring(start, pos).toLowerCase(Locale.ROOT);

        if (word.equals("x")) {
            lexVariable(start);
            return;
        }
        TokenType kw = keyword(word);
        if (kw != null) {
            emit(kw, start, 0, 0);
        } else {
            noise = true;
        }
    }

    /**
     * Splits the letters at {@code p} into joined keywords and variables
     * ({@code maxx1}, {@code x1freex2}, {@code freeend}). Each piece is a
     * {start, end} pair; false when some part of the run is neither.
     */
    private boolean split(int p, List<int[]> pieces) {
        if (p >= src.length() || !Character.isLetter(src.charAt(p))) return true;
        for (String kw : JOINABLE) {
            if (!src.regionMatches(true, p, kw, 0, kw.length())) continue;
            pieces.add(new int[]{p, p + kw.length()});
            if (split(p + kw.length(), pieces)) return true;
            pieces.remove(pieces.size() - 1);
        }
        char c = src.charAt(p);
        if (c != 'x' && c != 'X') return false;
        int q = p + 1;
        while (q < src.length() && isDigit(src.charAt(q))) q++;
        if (q == p + 1 && q < src.length() && Character.isLetter(src.charAt(q))) return false;
        pieces.add(new int[]{p, q});
        if (split(q, pieces)) return true;
        pieces.remove(pieces.size() - 1);
        return false;
    }

    private void emitPiece(int start, int end) {
        char c = src.charAt(start);
        if (c == 'x' || c == 'X') {
            pos = start + 1;
            lexVariable(start);
            return;
        }
        pos = end;
        emit(keyword(src.substring(start, end).toLowerCase(Locale.ROOT)), start, 0, 0);
    }

    private void lexVariable(int start) {
        int digits = pos;
        while (pos < src.length() && isDigit(src.charAt(pos))) pos++;
        if (pos == digits) {
            emit(TokenType.BAD_VARIABLE, start, 0, 0);
            return;
        }
        int index;
        try {
            index = Integer.parseInt(src.substring(digits, pos));
        } catch (NumberFormatException e) {
            index = 0;  // too large to be an index
        }
        emit(index >= 1 ? TokenType.VARIABLE : TokenType.BAD_VARIABLE, start, 0, index);
    }

    private static TokenType keyword(String word) {
        switch (word) {
            case "min": case "minimize": case "minimise": return TokenType.MIN;
            case "max": case "maximize": case "maximise": return TokenType.MAX;
            case "st": return TokenType.SUBJECT_TO;
            case "with": return TokenType.WITH;
            case "free": return TokenType.FREE;
            case "end": return TokenType.END;
            default: return null;
        }
    }

    // ---- operators ----

    private void lexSymbol(char ch) {
        int start = pos;
        char next = pos + 1 < src.length() ? src.charAt(pos + 1) : '\0';
        switch (ch) {
            case '+': pos++; emit(TokenType.PLUS, start, 0, 0); break;
            case '-': case '−': pos++; emit(TokenType.MINUS, start, 0, 0); break;
            case '*': pos++; emit(TokenType.TIMES, start, 0, 0); break;
            case '≤': pos++; emit(TokenType.LE, start, 0, 0); break;
            case '≥': pos++; emit(TokenType.GE, start, 0, 0); break;
            case '<':
                pos += next == '=' ? 2 : 1;
                emit(next == '=' ? TokenType.LE : TokenType.BAD_SYMBOL, start, 0, 0);
                break;
            case '>':
                pos += next == '=' ? 2 : 1;
                emit(next == '=' ? TokenType.GE : TokenType.BAD_SYMBOL, start, 0, 0);
                break;
            case '=':
                if (next == '<') { pos += 2; emit(TokenType.LE, start, 0, 0); }
                else if (next == '>') { pos += 2; emit(TokenType.GE, start, 0, 0); }
                else { pos += next == '=' ? 2 : 1; emit(TokenType.EQ, start, 0, 0); }
                break;
            default:
                pos++;
                noise = true;
        }
    }

    // ---- helpers ----

    private boolean lookingAt(Pattern p) {
        Matcher m = p.matcher(src);
        m.region(pos, src.length());
        if (!m.lookingAt()) return false;
        pos = m.end();
        return true;
    }

    private void emit(TokenType type, int start, double number, int variable) {
        int line = lineOf(start);
        int column = start - lineStarts[line - 1] + 1;
        out.add(new Token(type, src.substring(start, pos), start, line, column, noise, number, variable));
        noise = false;
    }

    private int lineOf(int offset) {
        int i = Arrays.binarySearch(lineStarts, offset);
        return i >= 0 ? i + 1 : -i - 1;
    }

    private static int[] lineStarts(String s) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') starts.add(i + 1);
        }
        int[] a = new int[starts.size()];
        for (int i = 0; i < a.length; i++) a[i] = starts.get(i);
        return a;
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
}
