package com.linearproblem;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading LP descriptions such as
 *
 * <pre>
 *   max 3x1 + 5x2
 *   s.t.
 *     x1 + 2x2 &lt;= 4
 *     3x1 + 2x2 &lt;= 6
 *   with
 *     x2 free
 *   end
 * </pre>
 *
 * Parsing either yields a complete {@link Problem} or throws; there is no
 * partial result.
 */
public final class LpParser {

    private static final Logger LOG = LoggerFactory.getLogger(LpParser.class);

    private LpParser() {}

    public static Problem parse(String text) throws LpParseException {
        return ModelBuilder.build(LpScanner.scan(LpLexer.tokenize(text)));
    }

    public static Problem parse(Reader reader) throws IOException, LpParseException {
        StringBuilder sb = new StringBuilder();
        try (BufferedReader br = new BufferedReader(reader)) {
            char[] buf = new char[8192];
            int k;
            while ((k = br.read(buf)) != -1) sb.append(buf, 0, k);
        }
        return parse(sb.toString());
    }

    public static Problem parseFile(Path file) throws IOException, LpParseException {
        LOG.debug("Reading LP description from {}", file);
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(r);
        }
    }
}
