package com.foodgraph.hierarchy.service.hierarchy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.foodgraph.hierarchy.model.Hierarchy;
import com.foodgraph.hierarchy.model.HierarchyNode;
import com.foodgraph.hierarchy.model.Warn;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of a finalization run: output sizes, how ingredients spread over
 * hierarchy depths, and every warning raised on the way.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HierarchyReport {
    private int groups;
    private int foodGroups;
    private int ingredients;
    private int relations;
    private int aliases;
    private Map<Integer, Integer> depthHistogram;
    private List<Warn> warnings;

    public static HierarchyReport of(int groups, Hierarchy hierarchy, List<Warn> extraWarnings) {
        HierarchyReport r = new HierarchyReport();
        r.groups = groups;
        r.foodGroups = hierarchy.getFoodGroups().size();
        r.ingredients = hierarchy.getNodes().size();
        r.relations = hierarchy.getEdges().size();
        r.aliases = hierarchy.getAliases().size();
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (HierarchyNode n : hierarchy.getNodes()) {
            histogram.merge(n.getDepth(), 1, Integer::sum);
        }
        r.depthHistogram = histogram;
        List<Warn> all = new ArrayList<>(extraWarnings);
        all.addAll(hierarchy.getWarnings());
        r.warnings = all;
        return r;
    }

    public int getGroups() { return groups; }
    public void setGroups(int groups) { this.groups = groups; }
    public int getFoodGroups() { return foodGroups; }
    public void setFoodGroups(int foodGroups) { this.foodGroups = foodGroups; }
    public int getIngredients() { return ingredients; }
    public void setIngredients(int ingredients) { this.ingredients = ingredients; }
    public int getRelations() { return relations; }
    public void setRelations(int relations) { this.relations = relations; }
    public int getAliases() { return aliases; }
    public void setAliases(int aliases) { this.aliases = aliases; }
    public Map<Integer, Integer> getDepthHistogram() { return depthHistogram; }
    public void setDepthHistogram(Map<Integer, Integer> depthHistogram) { this.depthHistogram = depthHistogram; }
    public List<Warn> getWarnings() { return warnings; }
    public void setWarnings(List<Warn> warnings) { this.warnings = warnings; }
}
