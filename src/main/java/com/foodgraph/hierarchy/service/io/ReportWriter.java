package com.foodgraph.hierarchy.service.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.foodgraph.hierarchy.service.ConsolidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Persists run reports as pretty-printed JSON. */
public class ReportWriter {
    private final ObjectMapper objectMapper;

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Object report, Path file) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), report);
        } catch (IOException e) {
            throw new ConsolidationException("Failed to write report " + file, e);
        }
    }
}
