package com.foodgraph.hierarchy.service;

import java.nio.file.Path;

/** A required input file is not where the run expects it. */
public class MissingInputException extends ConsolidationException {
    private final Path path;

    public MissingInputException(Path path, String hint) {
        super("Required input " + path + " not found. " + hint);
        this.path = path;
    }

    public Path getPath() { return path; }
}
