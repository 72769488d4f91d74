package com.foodgraph.hierarchy.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Directory holding the thesaurus exports, the proposal and all generated files.
     */
    @NotBlank
    private String seedDir = "seed";
    /**
     * Filtered ingredient export with pd_name and food_group columns.
     */
    @NotBlank
    private String ingredientsFile = "ingid_pd.csv";
    /**
     * Optional synonym export with pd_name and alias_name columns.
     */
    @NotBlank
    private String synonymsFile = "ingid_synonyms.csv";
    @NotBlank
    private String proposalFile = "consolidation_proposal.txt";
    // Finalization outputs
    @NotBlank
    private String foodGroupsOutput = "food_groups.csv";
    @NotBlank
    private String ingredientsOutput = "ingredients.csv";
    @NotBlank
    private String parentsOutput = "ingredient_parents.csv";
    @NotBlank
    private String aliasesOutput = "final_aliases.csv";
    @NotBlank
    private String analysisReport = "analysis_report.json";
    @NotBlank
    private String hierarchyReport = "hierarchy_report.json";
    /**
     * Deepest hierarchy level the ingredient schema accepts. Deeper nodes are
     * reported, not rewritten.
     */
    @Min(0)
    private int maxHierarchyDepth = 3;

    public Path resolve(String fileName) {
        return Path.of(seedDir).resolve(fileName);
    }

    public String getSeedDir() {
        return seedDir;
    }

    public void setSeedDir(String seedDir) {
        this.seedDir = seedDir;
    }

    public String getIngredientsFile() {
        return ingredientsFile;
    }

    public void setIngredientsFile(String ingredientsFile) {
        this.ingredientsFile = ingredientsFile;
    }

    public String getSynonymsFile() {
        return synonymsFile;
    }

    public void setSynonymsFile(String synonymsFile) {
        this.synonymsFile = synonymsFile;
    }

    public String getProposalFile() {
        return proposalFile;
    }

    public void setProposalFile(String proposalFile) {
        this.proposalFile = proposalFile;
    }

    public String getFoodGroupsOutput() {
        return foodGroupsOutput;
    }

    public void setFoodGroupsOutput(String foodGroupsOutput) {
        this.foodGroupsOutput = foodGroupsOutput;
    }

    public String getIngredientsOutput() {
        return ingredientsOutput;
    }

    public void setIngredientsOutput(String ingredientsOutput) {
        this.ingredientsOutput = ingredientsOutput;
    }

    public String getParentsOutput() {
        return parentsOutput;
    }

    public void setParentsOutput(String parentsOutput) {
        this.parentsOutput = parentsOutput;
    }

    public String getAliasesOutput() {
        return aliasesOutput;
    }

    public void setAliasesOutput(String aliasesOutput) {
        this.aliasesOutput = aliasesOutput;
    }

    public String getAnalysisReport() {
        return analysisReport;
    }

    public void setAnalysisReport(String analysisReport) {
        this.analysisReport = analysisReport;
    }

    public String getHierarchyReport() {
        return hierarchyReport;
    }

    public void setHierarchyReport(String hierarchyReport) {
        this.hierarchyReport = hierarchyReport;
    }

    public int getMaxHierarchyDepth() {
        return maxHierarchyDepth;
    }

    public void setMaxHierarchyDepth(int maxHierarchyDepth) {
        this.maxHierarchyDepth = maxHierarchyDepth;
    }
}
