package com.foodgraph.hierarchy.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodgraph.hierarchy.IngredientFixtures;
import com.foodgraph.hierarchy.config.AppProperties;
import com.foodgraph.hierarchy.model.Ingredient;
import com.foodgraph.hierarchy.model.Warn;
import com.foodgraph.hierarchy.service.analysis.AnalysisReport;
import com.foodgraph.hierarchy.service.analysis.ConsolidationAnalyzer;
import com.foodgraph.hierarchy.service.analysis.ScoringConfig;
import com.foodgraph.hierarchy.service.hierarchy.HierarchyBuilder;
import com.foodgraph.hierarchy.service.hierarchy.HierarchyReport;
import com.foodgraph.hierarchy.service.io.HierarchyCsvWriter;
import com.foodgraph.hierarchy.service.io.IngredientCsvReader;
import com.foodgraph.hierarchy.service.io.ReportWriter;
import com.foodgraph.hierarchy.service.proposal.ProposalCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class ConsolidationServiceTest {

    @TempDir
    Path seed;

    private AppProperties props;
    private ConsolidationService service;

    @BeforeEach
    public void setUp() {
        props = new AppProperties();
        props.setSeedDir(seed.toString());
        service = new ConsolidationService(props,
            new ConsolidationAnalyzer(ScoringConfig.defaults()),
            new ProposalCodec(),
            new HierarchyBuilder(2, 3),
            new IngredientCsvReader(),
            new HierarchyCsvWriter(),
            new ReportWriter(new ObjectMapper()));
    }

    private void writeIngredients(List<Ingredient> ingredients) throws Exception {
        StringBuilder sb = new StringBuilder("pd_name,food_group\n");
        for (Ingredient i : ingredients) sb.append(i.getName()).append(',').append(i.getFoodGroup()).append('\n');
        Files.writeString(seed.resolve(props.getIngredientsFile()), sb.toString(), StandardCharsets.UTF_8);
    }

    private List<String> seedFiles() throws Exception {
        try (Stream<Path> s = Files.list(seed)) {
            return s.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private String read(String name) throws Exception {
        return Files.readString(seed.resolve(name), StandardCharsets.UTF_8);
    }

    @Test
    public void analyzeThenFinalizeProducesSeedFiles() throws Exception {
        writeIngredients(IngredientFixtures.cheeseAndJuicePadded());
        Files.writeString(seed.resolve(props.getSynonymsFile()),
            "pd_name,alias_name\nCHEDDAR CHEESE,CHEDDAR\nGOUDA,GOUDA CHEESE\n", StandardCharsets.UTF_8);

        AnalysisReport analysis = service.analyze();
        assertEquals(1, analysis.getGroups());
        String proposal = read(props.getProposalFile());
        assertTrue(proposal.contains("[CHEESE]\nCHEDDAR CHEESE,Dairy\nCOTTAGE CHEESE,Dairy\nSWISS CHEESE,Dairy\n"));
        assertTrue(Files.exists(seed.resolve(props.getAnalysisReport())));

        // reviewer drops one child
        Files.writeString(seed.resolve(props.getProposalFile()),
            proposal.replace("COTTAGE CHEESE,Dairy", "#COTTAGE CHEESE,Dairy"), StandardCharsets.UTF_8);

        HierarchyReport report = service.finalizeHierarchy();

        assertEquals(1, report.getGroups());
        assertEquals(41, report.getIngredients());
        assertEquals(2, report.getRelations());
        assertEquals(1, report.getAliases());
        assertTrue(report.getWarnings().isEmpty());
        assertEquals(List.of("Dairy", "Fruit", "Produce"), read(props.getFoodGroupsOutput()).lines().skip(1)
            .collect(Collectors.toList()));
        List<String> rows = read(props.getIngredientsOutput()).lines().collect(Collectors.toList());
        assertEquals(List.of("name,food_group,hierarchy_depth", "CHEESE,Dairy,0", "CHEDDAR CHEESE,Dairy,1",
            "SWISS CHEESE,Dairy,1", "COTTAGE CHEESE,Dairy,0"), rows.subList(0, 5));
        assertEquals("parent_name,child_name\nCHEESE,CHEDDAR CHEESE\nCHEESE,SWISS CHEESE\n",
            read(props.getParentsOutput()));
        assertEquals("alias_name,ingredient_name\nCHEDDAR,CHEDDAR CHEESE\n", read(props.getAliasesOutput()));
    }

    @Test
    public void commaNamesAreCommentedOutOfProposal() throws Exception {
        List<Ingredient> ingredients = new ArrayList<>(List.of(
            new Ingredient("RICE, BROWN", "Grains"),
            new Ingredient("BEANS, BROWN", "Legumes")));
        for (String f : IngredientFixtures.FILLER) ingredients.add(new Ingredient(f, "Produce"));
        StringBuilder csv = new StringBuilder("pd_name,food_group\n");
        for (Ingredient i : ingredients) csv.append('"').append(i.getName()).append("\",").append(i.getFoodGroup()).append('\n');
        Files.writeString(seed.resolve(props.getIngredientsFile()), csv.toString(), StandardCharsets.UTF_8);

        AnalysisReport report = service.analyze();

        assertEquals(1, report.getGroups());
        assertEquals(2, report.getWarnings().size());
        assertEquals(Warn.UNREPRESENTABLE_NAME, report.getWarnings().get(0).getCode());
        String proposal = read(props.getProposalFile());
        assertTrue(proposal.contains("[BROWN]\n#BEANS, BROWN,Legumes\n#RICE, BROWN,Grains\n"));
    }

    @Test
    public void analyzeWithoutGroupsWritesNothing() throws Exception {
        writeIngredients(List.of(new Ingredient("ORANGE JUICE", "Fruit"), new Ingredient("KALE", "Produce")));

        AnalysisReport report = service.analyze();

        assertEquals(0, report.getGroups());
        assertEquals(List.of(props.getIngredientsFile()), seedFiles());
    }

    @Test
    public void analyzeNeedsIngredientExport() {
        MissingInputException e = assertThrows(MissingInputException.class, () -> service.analyze());
        assertEquals(seed.resolve(props.getIngredientsFile()), e.getPath());
    }

    @Test
    public void finalizeWithoutProposalFailsBeforeWriting() throws Exception {
        writeIngredients(IngredientFixtures.cheeseAndJuice());

        MissingInputException e = assertThrows(MissingInputException.class, () -> service.finalizeHierarchy());

        assertEquals(seed.resolve(props.getProposalFile()), e.getPath());
        assertEquals(List.of(props.getIngredientsFile()), seedFiles());
    }

    @Test
    public void finalizeWithoutSynonymsWarnsAndWritesEmptyAliases() throws Exception {
        writeIngredients(IngredientFixtures.cheeseAndJuice());
        Files.writeString(seed.resolve(props.getProposalFile()),
            "[CHEESE]\nCHEDDAR CHEESE,Dairy\nSWISS CHEESE,Dairy\n", StandardCharsets.UTF_8);

        HierarchyReport report = service.finalizeHierarchy();

        assertEquals(Warn.SYNONYMS_MISSING, report.getWarnings().get(0).getCode());
        assertEquals("alias_name,ingredient_name\n", read(props.getAliasesOutput()));
        assertEquals(Integer.valueOf(3), report.getDepthHistogram().get(0));
        assertEquals(Integer.valueOf(2), report.getDepthHistogram().get(1));
    }

    @Test
    public void emptyProposalLeavesEveryIngredientStandalone() throws Exception {
        writeIngredients(IngredientFixtures.cheeseAndJuice());
        Files.writeString(seed.resolve(props.getProposalFile()), "# nothing approved\n", StandardCharsets.UTF_8);
        Files.writeString(seed.resolve(props.getSynonymsFile()), "pd_name,alias_name\n", StandardCharsets.UTF_8);

        HierarchyReport report = service.finalizeHierarchy();

        assertEquals(0, report.getGroups());
        assertEquals(4, report.getIngredients());
        assertEquals(0, report.getRelations());
        assertEquals("parent_name,child_name\n", read(props.getParentsOutput()));
    }
}
