package com.foodgraph.hierarchy.service;

import com.foodgraph.hierarchy.config.AppProperties;
import com.foodgraph.hierarchy.model.GroupMember;
import com.foodgraph.hierarchy.model.Hierarchy;
import com.foodgraph.hierarchy.model.Ingredient;
import com.foodgraph.hierarchy.model.Synonym;
import com.foodgraph.hierarchy.model.Warn;
import com.foodgraph.hierarchy.service.analysis.AnalysisReport;
import com.foodgraph.hierarchy.service.analysis.ConsolidationAnalyzer;
import com.foodgraph.hierarchy.service.hierarchy.HierarchyBuilder;
import com.foodgraph.hierarchy.service.hierarchy.HierarchyReport;
import com.foodgraph.hierarchy.service.io.HierarchyCsvWriter;
import com.foodgraph.hierarchy.service.io.IngredientCsvReader;
import com.foodgraph.hierarchy.service.io.ReportWriter;
import com.foodgraph.hierarchy.service.proposal.ProposalCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the two batch phases against the seed directory.
 *
 * <ul>
 *   <li><strong>analyze</strong> - ingredient export to consolidation proposal</li>
 *   <li><strong>finalize</strong> - edited proposal plus exports to hierarchy seeding files</li>
 * </ul>
 *
 * <p>Required inputs are checked before anything is read, and every output is
 * computed in memory before the first file is written, so a missing or
 * malformed input leaves the seed directory untouched. The four hierarchy files
 * are replaced together; the JSON report is written after them.
 */
@Service
public class ConsolidationService {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationService.class);

    private final AppProperties appProperties;
    private final ConsolidationAnalyzer analyzer;
    private final ProposalCodec proposalCodec;
    private final HierarchyBuilder hierarchyBuilder;
    private final IngredientCsvReader csvReader;
    private final HierarchyCsvWriter csvWriter;
    private final ReportWriter reportWriter;

    public ConsolidationService(AppProperties appProperties,
                                ConsolidationAnalyzer analyzer,
                                ProposalCodec proposalCodec,
                                HierarchyBuilder hierarchyBuilder,
                                IngredientCsvReader csvReader,
                                HierarchyCsvWriter csvWriter,
                                ReportWriter reportWriter) {
        this.appProperties = appProperties;
        this.analyzer = analyzer;
        this.proposalCodec = proposalCodec;
        this.hierarchyBuilder = hierarchyBuilder;
        this.csvReader = csvReader;
        this.csvWriter = csvWriter;
        this.reportWriter = reportWriter;
    }

    public AnalysisReport analyze() {
        Path ingredientsPath = appProperties.resolve(appProperties.getIngredientsFile());
        requireInput(ingredientsPath, "Generate the filtered ingredient export first.");

        List<Ingredient> ingredients = csvReader.readIngredients(ingredientsPath);
        ConsolidationAnalyzer.Result result = analyzer.analyze(ingredients);
        AnalysisReport report = result.getReport();
        if (result.getGroups().isEmpty()) {
            log.info("No consolidation opportunities found.");
            return report;
        }
        logTopGroups(report);

        List<Warn> warnings = new ArrayList<>();
        String proposal = proposalCodec.serialize(result.getGroups(), warnings);
        report.setWarnings(warnings);
        if (!warnings.isEmpty()) {
            log.warn("{} proposal line(s) commented out, see {}", warnings.size(), appProperties.getAnalysisReport());
        }
        Path proposalPath = appProperties.resolve(appProperties.getProposalFile());
        try {
            Files.createDirectories(proposalPath.toAbsolutePath().getParent());
            Files.writeString(proposalPath, proposal, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConsolidationException("Failed to write proposal " + proposalPath, e);
        }
        reportWriter.write(report, appProperties.resolve(appProperties.getAnalysisReport()));
        log.info("Proposal saved to {}. After editing, run the finalize command to generate the hierarchy files.",
            proposalPath);
        return report;
    }

    public HierarchyReport finalizeHierarchy() {
        Path proposalPath = appProperties.resolve(appProperties.getProposalFile());
        Path ingredientsPath = appProperties.resolve(appProperties.getIngredientsFile());
        Path synonymsPath = appProperties.resolve(appProperties.getSynonymsFile());
        requireInput(proposalPath, "Run the analyze command first to generate the proposal.");
        requireInput(ingredientsPath, "Generate the filtered ingredient export first.");

        Map<String, List<GroupMember>> groups;
        try (Reader r = Files.newBufferedReader(proposalPath, StandardCharsets.UTF_8)) {
            groups = proposalCodec.parse(r);
        } catch (IOException e) {
            throw new ConsolidationException("Failed to read proposal " + proposalPath, e);
        }
        if (groups.isEmpty()) {
            log.info("No consolidations found in proposal file. All ingredients will be treated as standalone.");
        } else {
            int children = groups.values().stream().mapToInt(List::size).sum();
            log.info("Found {} consolidation groups with {} children", groups.size(), children);
        }

        List<Ingredient> ingredients = csvReader.readIngredients(ingredientsPath);
        List<Warn> runWarnings = new ArrayList<>();
        List<Synonym> synonyms;
        if (Files.exists(synonymsPath)) {
            synonyms = csvReader.readSynonyms(synonymsPath);
        } else {
            log.warn("{} not found, skipping alias generation", synonymsPath);
            runWarnings.add(Warn.synonymsMissing(synonymsPath.toString()));
            synonyms = List.of();
        }

        Hierarchy hierarchy = hierarchyBuilder.build(groups, ingredients, synonyms);
        HierarchyReport report = HierarchyReport.of(groups.size(), hierarchy, runWarnings);

        csvWriter.write(hierarchy, new HierarchyCsvWriter.Targets(
            appProperties.resolve(appProperties.getFoodGroupsOutput()),
            appProperties.resolve(appProperties.getIngredientsOutput()),
            appProperties.resolve(appProperties.getParentsOutput()),
            appProperties.resolve(appProperties.getAliasesOutput())));
        reportWriter.write(report, appProperties.resolve(appProperties.getHierarchyReport()));

        log.info("Hierarchy generation complete: {} food groups, {} ingredients, {} relationships, {} aliases, {} warnings",
            report.getFoodGroups(), report.getIngredients(), report.getRelations(), report.getAliases(),
            report.getWarnings().size());
        report.getDepthHistogram().forEach((depth, count) -> log.info("  Depth {}: {} ingredients", depth, count));
        return report;
    }

    private static void requireInput(Path path, String hint) {
        if (!Files.isRegularFile(path)) {
            throw new MissingInputException(path, hint);
        }
    }

    private static void logTopGroups(AnalysisReport report) {
        log.info("Top {} groups by size:", report.getTopGroups().size());
        int i = 1;
        for (AnalysisReport.TopGroup g : report.getTopGroups()) {
            log.info("{}. {}: {} ingredients, e.g. {}", i++, g.getParent(), g.getSize(), g.getExamples());
        }
    }
}
