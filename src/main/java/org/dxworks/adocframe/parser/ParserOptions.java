package org.dxworks.adocframe.parser;

import java.nio.file.Path;

public class ParserOptions {

    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 64;

    private final Path basePath;
    private final int maxIncludeDepth;

    private ParserOptions(Path basePath, int maxIncludeDepth) {
        this.basePath = basePath;
        this.maxIncludeDepth = maxIncludeDepth;
    }

    public static ParserOptions defaults() {
        return new ParserOptions(null, DEFAULT_MAX_INCLUDE_DEPTH);
    }

    public static ParserOptions withBasePath(Path basePath) {
        return defaults().basePath(basePath);
    }

    public ParserOptions basePath(Path basePath) {
        return new ParserOptions(basePath, maxIncludeDepth);
    }

    public ParserOptions maxIncludeDepth(int maxIncludeDepth) {
        if (maxIncludeDepth < 1) {
            throw new IllegalArgumentException("maxIncludeDepth must be at least 1: " + maxIncludeDepth);
        }
        return new ParserOptions(basePath, maxIncludeDepth);
    }

    /** Directory include paths are resolved against; null means the working directory. */
    public Path getBasePath() {
        return basePath;
    }

    public int getMaxIncludeDepth() {
        return maxIncludeDepth;
    }
}
