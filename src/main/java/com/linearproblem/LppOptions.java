package com.linearproblem;

import java.nio.file.Path;
import java.nio.file.Paths;

/** Immutable run configuration assembled from the command line. */
public final class LppOptions {
    public enum Source { TEXT, JSON }        // -i / -l

    public final Source source;
    public final String inputPath;
    public final String outputPath;          // null = default name derived from input
    public final boolean json;               // write JSON instead of text
    public final boolean dual;               // convert to the dual before output
    public final boolean print;              // stdout instead of a file
    public final ProblemWriter.Format format;
    public final boolean help;

    private LppOptions(Builder b) {
        this.source = b.source;
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.json = b.json;
        this.dual = b.dual;
        this.print = b.print;
        this.format = b.format;
        this.help = b.help;
    }

    /** Output file: the explicit {@code -o} name or {@code "(LP-2) <input>[.json]"}. */
    public String resolvedOutputPath() {
        if (outputPath != null) return outputPath;
        Path in = Paths.get(inputPath);
        String name = "(LP-2) " + in.getFileName() + (json ? ".json" : "");
        Path parent = in.getParent();
        return parent == null ? name : parent.resolve(name).toString();
    }

    public static final class Builder {
        private Source source = Source.TEXT;
        private String inputPath;
        private String outputPath;
        private boolean json, dual, print, help;
        private ProblemWriter.Format format = ProblemWriter.Format.MATRIX;

        public Builder source(Source s){ this.source=s; return this; }
        public Builder inputPath(String p){ this.inputPath=p; return this; }
        public Builder outputPath(String p){ this.outputPath=p; return this; }
        public Builder json(boolean v){ this.json=v; return this; }
        public Builder dual(boolean v){ this.dual=v; return this; }
        public Builder print(boolean v){ this.print=v; return this; }
        public Builder format(ProblemWriter.Format f){ this.format=f; return this; }
        public Builder help(boolean v){ this.help=v; return this; }
        public LppOptions build(){ return new LppOptions(this); }
    }
}
