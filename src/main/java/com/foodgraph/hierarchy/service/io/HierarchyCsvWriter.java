package com.foodgraph.hierarchy.service.io;

import com.foodgraph.hierarchy.model.Alias;
import com.foodgraph.hierarchy.model.Hierarchy;
import com.foodgraph.hierarchy.model.HierarchyNode;
import com.foodgraph.hierarchy.model.ParentChildEdge;
import com.foodgraph.hierarchy.service.ConsolidationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the finalized hierarchy as the four seeding files: food groups,
 * ingredients with depth, parent/child relations and aliases.
 */
public class HierarchyCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(HierarchyCsvWriter.class);

    public static final class Targets {
        private final Path foodGroups;
        private final Path ingredients;
        private final Path parents;
        private final Path aliases;

        public Targets(Path foodGroups, Path ingredients, Path parents, Path aliases) {
            this.foodGroups = foodGroups;
            this.ingredients = ingredients;
            this.parents = parents;
            this.aliases = aliases;
        }

        public Path getFoodGroups() { return foodGroups; }
        public Path getIngredients() { return ingredients; }
        public Path getParents() { return parents; }
        public Path getAliases() { return aliases; }
    }

    /**
     * Writes all four files; an empty section still gets its header line. Each
     * file is first written next to its target and only moved into place once all
     * four are complete, so a failed write leaves the previous files as they were.
     */
    public void write(Hierarchy hierarchy, Targets targets) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            try (CSVPrinter p = printer(stage(staged, targets.getFoodGroups()), "name")) {
                for (String fg : hierarchy.getFoodGroups()) p.printRecord(fg);
            }
            try (CSVPrinter p = printer(stage(staged, targets.getIngredients()), "name", "food_group", "hierarchy_depth")) {
                for (HierarchyNode n : hierarchy.getNodes()) p.printRecord(n.getName(), n.getFoodGroup(), n.getDepth());
            }
            try (CSVPrinter p = printer(stage(staged, targets.getParents()), "parent_name", "child_name")) {
                for (ParentChildEdge e : hierarchy.getEdges()) p.printRecord(e.getParentName(), e.getChildName());
            }
            try (CSVPrinter p = printer(stage(staged, targets.getAliases()), "alias_name", "ingredient_name")) {
                for (Alias a : hierarchy.getAliases()) p.printRecord(a.getAliasName(), a.getIngredientName());
            }
            for (Map.Entry<Path, Path> e : staged.entrySet()) {
                Files.move(e.getValue(), e.getKey(), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            discard(staged.values());
            throw new ConsolidationException("Failed to write hierarchy files", e);
        }
        log.info("Created {} with {} food groups", targets.getFoodGroups(), hierarchy.getFoodGroups().size());
        log.info("Created {} with {} ingredients", targets.getIngredients(), hierarchy.getNodes().size());
        log.info("Created {} with {} parent-child relationships", targets.getParents(), hierarchy.getEdges().size());
        log.info("Created {} with {} aliases", targets.getAliases(), hierarchy.getAliases().size());
    }

    private static Path stage(Map<Path, Path> staged, Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        staged.put(target, tmp);
        return tmp;
    }

    private static void discard(Collection<Path> staged) {
        for (Path tmp : staged) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
            }
        }
    }

    private static CSVPrinter printer(Path file, String... header) throws IOException {
        Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new CSVPrinter(w, CSVFormat.DEFAULT.builder().setHeader(header).setRecordSeparator('\n').build());
    }
}
