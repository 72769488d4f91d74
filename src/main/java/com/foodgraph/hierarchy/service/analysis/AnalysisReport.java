package com.foodgraph.hierarchy.service.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.foodgraph.hierarchy.model.GroupMember;
import com.foodgraph.hierarchy.model.Warn;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Summary of one analysis run, written next to the proposal so the reviewer
 * knows what the heuristic did before editing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisReport {
    private int ingredients;
    private int distinctWords;
    private List<String> processingTerms;
    private int candidateWords;
    private int groups;
    private int uniqueIngredients;
    private int relations;
    private int multiParentIngredients;
    private double averageGroupSize;
    private List<TopGroup> topGroups;
    private List<Warn> warnings;

    public static AnalysisReport of(WordIndex index, Set<String> processingTerms, int candidateWords,
                                    Map<String, List<GroupMember>> groups, int topGroupCount, int exampleCount) {
        AnalysisReport r = new AnalysisReport();
        r.ingredients = index.ingredientCount();
        r.distinctWords = index.distinctWordCount();
        r.processingTerms = new ArrayList<>(processingTerms);
        r.candidateWords = candidateWords;
        r.groups = groups.size();

        Set<String> unique = new LinkedHashSet<>();
        Map<String, Integer> parentCounts = new HashMap<>();
        int relations = 0;
        for (List<GroupMember> children : groups.values()) {
            for (GroupMember child : children) {
                unique.add(child.getName());
                parentCounts.merge(child.getName(), 1, Integer::sum);
                relations++;
            }
        }
        r.uniqueIngredients = unique.size();
        r.relations = relations;
        r.multiParentIngredients = (int) parentCounts.values().stream().filter(c -> c > 1).count();
        r.averageGroupSize = groups.isEmpty() ? 0 : (double) relations / groups.size();

        List<Map.Entry<String, List<GroupMember>>> bySize = new ArrayList<>(groups.entrySet());
        bySize.sort(Comparator.<Map.Entry<String, List<GroupMember>>>comparingInt(e -> e.getValue().size()).reversed());
        List<TopGroup> top = new ArrayList<>();
        for (Map.Entry<String, List<GroupMember>> e : bySize.subList(0, Math.min(topGroupCount, bySize.size()))) {
            List<String> examples = new ArrayList<>();
            for (GroupMember m : e.getValue().subList(0, Math.min(exampleCount, e.getValue().size()))) {
                examples.add(m.getName());
            }
            top.add(new TopGroup(e.getKey(), e.getValue().size(), examples));
        }
        r.topGroups = top;
        return r;
    }

    public List<Warn> getWarnings() { return warnings; }
    public void setWarnings(List<Warn> warnings) { this.warnings = warnings; }
    public int getIngredients() { return ingredients; }
    public void setIngredients(int ingredients) { this.ingredients = ingredients; }
    public int getDistinctWords() { return distinctWords; }
    public void setDistinctWords(int distinctWords) { this.distinctWords = distinctWords; }
    public List<String> getProcessingTerms() { return processingTerms; }
    public void setProcessingTerms(List<String> processingTerms) { this.processingTerms = processingTerms; }
    public int getCandidateWords() { return candidateWords; }
    public void setCandidateWords(int candidateWords) { this.candidateWords = candidateWords; }
    public int getGroups() { return groups; }
    public void setGroups(int groups) { this.groups = groups; }
    public int getUniqueIngredients() { return uniqueIngredients; }
    public void setUniqueIngredients(int uniqueIngredients) { this.uniqueIngredients = uniqueIngredients; }
    public int getRelations() { return relations; }
    public void setRelations(int relations) { this.relations = relations; }
    public int getMultiParentIngredients() { return multiParentIngredients; }
    public void setMultiParentIngredients(int multiParentIngredients) { this.multiParentIngredients = multiParentIngredients; }
    public double getAverageGroupSize() { return averageGroupSize; }
    public void setAverageGroupSize(double averageGroupSize) { this.averageGroupSize = averageGroupSize; }
    public List<TopGroup> getTopGroups() { return topGroups; }
    public void setTopGroups(List<TopGroup> topGroups) { this.topGroups = topGroups; }

    public static class TopGroup {
        private String parent;
        private int size;
        private List<String> examples;

        public TopGroup() {}

        public TopGroup(String parent, int size, List<String> examples) {
            this.parent = parent;
            this.size = size;
            this.examples = examples;
        }

        public String getParent() { return parent; }
        public void setParent(String parent) { this.parent = parent; }
        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }
        public List<String> getExamples() { return examples; }
        public void setExamples(List<String> examples) { this.examples = examples; }
    }
}
