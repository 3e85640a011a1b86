package com.linearproblem;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int BAD_ARGS = 2;

    private static void usage(PrintStream err) {
        err.println(
                "Usage: lpp -i <inputFile> [options]\n" +
                        "Input:\n" +
                        "  -i, --input  <file>    LP description to parse\n" +
                        "  -l, --load   <file>    problem saved with --json (excludes -i)\n" +
                        "Output:\n" +
                        "  -o, --output <file>    output file (default: '(LP-2) <inputFile>')\n" +
                        "  -j, --json             write JSON\n" +
                        "  -f, --format lp|matrix text layout when not writing JSON (default: matrix)\n" +
                        "  -p, --print            print to the console instead of a file\n" +
                        "Transform:\n" +
                        "  -d, --dual             convert the problem from primal to dual form\n" +
                        "  -h, --help             this text\n"
        );
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        LppOptions opts;
        try {
            opts = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            return BAD_ARGS;
        }
        if (opts.help) {
            usage(out);
            return OK;
        }
        return run(opts, out, err);
    }

    static int run(LppOptions opts, PrintStream out, PrintStream err) {
        long t0 = System.nanoTime();
        String filename = opts.inputPath;
        try {
            // read
            Problem problem = opts.source == LppOptions.Source.JSON
                    ? ProblemJson.load(Paths.get(filename))
                    : LpParser.parseFile(Paths.get(filename));
            LOG.info("Read {} problem: {} variables, {} constraints",
                    problem.direction(), problem.variableCount(), problem.constraintCount());

            // transform
            if (opts.dual) {
                problem = DualTransformer.dual(problem);
                LOG.info("Converted to dual: {} variables, {} constraints",
                        problem.variableCount(), problem.constraintCount());
            }

            // write
            if (opts.print) {
                Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                emit(problem, opts, w);
            } else {
                Path target = Paths.get(opts.resolvedOutputPath());
                try (Writer w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                    emit(problem, opts, w);
                }
                LOG.info("Wrote {}", target);
            }

            LOG.debug("Finished in {} ms", (System.nanoTime() - t0) / 1_000_000);
            return OK;

        } catch (LpParseException e) {
            LOG.error("Could not parse {}", filename);
            err.println(filename + ": " + e.getMessage());
            return FAILED;
        } catch (ProblemFormatException e) {
            LOG.error("Could not load {}", filename);
            err.println(filename + ": " + e.getMessage());
            return FAILED;
        } catch (NoSuchFileException e) {
            err.println("File not found: " + e.getFile());
            return FAILED;
        } catch (IOException e) {
            LOG.error("I/O error on {}", filename, e);
            err.println("I/O error: " + e.getMessage());
            return FAILED;
        }
    }

    private static void emit(Problem problem, LppOptions opts, Writer w) throws IOException {
        if (opts.json) {
            ProblemJson.write(problem, w);
        } else {
            PrintWriter pw = new PrintWriter(w);
            ProblemWriter.write(problem, opts.format, pw);
            pw.flush();
        }
    }
}
