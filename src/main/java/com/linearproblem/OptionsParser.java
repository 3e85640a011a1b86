package com.linearproblem;

import java.util.Locale;

public final class OptionsParser {

    private OptionsParser() {}

    public static LppOptions parse(String[] args){
        LppOptions.Builder b = new LppOptions.Builder();
        String input = null;
        boolean text = false, load = false;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h": case "--help": b.help(true); break;
                case "-i": case "--input": input = value(args, ++i, a); text = true; break;
                case "-l": case "--load": input = value(args, ++i, a); load = true; break;
                case "-o": case "--output": b.outputPath(value(args, ++i, a)); break;
                case "-j": case "--json": b.json(true); break;
                case "-d": case "--dual": b.dual(true); break;
                case "-p": case "--print": b.print(true); break;
                case "-f": case "--format": b.format(format(value(args, ++i, a))); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    throw new IllegalArgumentException("Unexpected argument: " + a);
            }
        }
        LppOptions help = b.build();
        if (help.help) return help;

        if (text && load) throw new IllegalArgumentException("-i and -l are mutually exclusive");
        if (input == null) throw new IllegalArgumentException("Missing input file (-i or -l)");
        return b.inputPath(input).source(load ? LppOptions.Source.JSON : LppOptions.Source.TEXT).build();
    }

    private static String value(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Option " + option + " needs a value");
        return args[i];
    }

    private static ProblemWriter.Format format(String s){
        switch (s.toLowerCase(Locale.ROOT)) {
            case "lp": return ProblemWriter.Format.LP;
            case "matrix": return ProblemWriter.Format.MATRIX;
            default: throw new IllegalArgumentException("Unknown format: " + s + " (expected lp or matrix)");
        }
    }
}
