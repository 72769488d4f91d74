package com.foodgraph.hierarchy.cli;

import com.foodgraph.hierarchy.service.ConsolidationException;
import com.foodgraph.hierarchy.service.ConsolidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;

/**
 * Dispatches {@code analyze} and {@code finalize} to {@link ConsolidationService}.
 * Exit code 0 on success, 1 when the run aborts, 2 on a usage error.
 */
@Component
public class ConsolidationCommand implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationCommand.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private final ConsolidationService service;
    private int exitCode = OK;

    public ConsolidationCommand(ConsolidationService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) {
        String command = Arrays.stream(args)
            .filter(a -> !a.startsWith("--"))
            .findFirst()
            .map(a -> a.toLowerCase(Locale.ROOT))
            .orElse("");
        try {
            switch (command) {
                case "analyze" -> service.analyze();
                case "finalize" -> service.finalizeHierarchy();
                default -> {
                    log.error("Usage: (analyze | finalize) [--app.seed-dir=<dir>] [--consolidation.<setting>=<value>]");
                    exitCode = USAGE;
                }
            }
        } catch (ConsolidationException e) {
            log.error("Error: {}", e.getMessage(), e);
            exitCode = FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
