package com.foodgraph.hierarchy.service.hierarchy;

import com.foodgraph.hierarchy.model.Alias;
import com.foodgraph.hierarchy.model.GroupMember;
import com.foodgraph.hierarchy.model.Hierarchy;
import com.foodgraph.hierarchy.model.HierarchyNode;
import com.foodgraph.hierarchy.model.Ingredient;
import com.foodgraph.hierarchy.model.ParentChildEdge;
import com.foodgraph.hierarchy.model.Synonym;
import com.foodgraph.hierarchy.model.Warn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns an approved consolidation proposal into the finalized ingredient
 * hierarchy.
 *
 * <h3>Build Steps</h3>
 * <ol>
 *   <li>Drop groups that kept fewer than {@code minGroupSize} children after editing</li>
 *   <li>Collect every food group of the original ingredients and of the proposal children</li>
 *   <li>Register each parent with the most frequent food group of its children, then its
 *       children; a child named like its parent gets no edge</li>
 *   <li>Register every remaining original ingredient as a standalone node</li>
 *   <li>Resolve depths over the retained edges with {@link DepthResolver}</li>
 *   <li>Remap synonyms onto nodes that still exist</li>
 * </ol>
 *
 * <p>Nothing here is fatal: self-references, cycles, undersized groups and
 * over-deep nodes are reported as {@link Warn} entries and the build continues.
 */
public class HierarchyBuilder {
    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final int minGroupSize;
    private final int maxDepth;
    private final DepthResolver depthResolver;

    public HierarchyBuilder(int minGroupSize, int maxDepth) {
        this(minGroupSize, maxDepth, new DepthResolver());
    }

    public HierarchyBuilder(int minGroupSize, int maxDepth, DepthResolver depthResolver) {
        this.minGroupSize = minGroupSize;
        this.maxDepth = maxDepth;
        this.depthResolver = depthResolver;
    }

    /**
     * Builds the hierarchy.
     *
     * @param groups approved parent name to children, in proposal order
     * @param ingredients full original ingredient collection
     * @param synonyms original synonym rows; empty when the export is unavailable
     * @return nodes with resolved depths, edges, aliases, food groups and warnings
     */
    public Hierarchy build(Map<String, List<GroupMember>> groups, List<Ingredient> ingredients, List<Synonym> synonyms) {
        List<Warn> warnings = new ArrayList<>();

        Map<String, List<GroupMember>> approved = new LinkedHashMap<>();
        for (Map.Entry<String, List<GroupMember>> g : groups.entrySet()) {
            if (g.getValue().size() < minGroupSize) {
                log.warn("Dropping group {} with {} child(ren)", g.getKey(), g.getValue().size());
                warnings.add(Warn.groupTooSmall(g.getKey(), g.getValue().size(), minGroupSize));
                continue;
            }
            approved.put(g.getKey(), g.getValue());
        }

        List<String> foodGroups = collectFoodGroups(approved, ingredients);

        Map<String, String> nodeFoodGroups = new LinkedHashMap<>();
        Set<ParentChildEdge> edges = new LinkedHashSet<>();
        for (Map.Entry<String, List<GroupMember>> g : approved.entrySet()) {
            String parent = g.getKey();
            nodeFoodGroups.putIfAbsent(parent, dominantFoodGroup(g.getValue()));
            for (GroupMember child : g.getValue()) {
                if (child.getName().equals(parent)) {
                    log.info("Note: skipping self-reference for '{}' (same as parent)", parent);
                    warnings.add(Warn.selfReference(parent));
                    continue;
                }
                nodeFoodGroups.putIfAbsent(child.getName(), child.getFoodGroup());
                edges.add(new ParentChildEdge(parent, child.getName()));
            }
        }
        int consolidated = nodeFoodGroups.size();
        for (Ingredient ingredient : ingredients) {
            nodeFoodGroups.putIfAbsent(ingredient.getName(), ingredient.getFoodGroup());
        }
        log.debug("{} nodes from groups, {} standalone, {} edges",
            consolidated, nodeFoodGroups.size() - consolidated, edges.size());

        Map<String, List<String>> childToParents = new LinkedHashMap<>();
        for (ParentChildEdge e : edges) {
            childToParents.computeIfAbsent(e.getChildName(), k -> new ArrayList<>()).add(e.getParentName());
        }
        DepthResolver.Result depths = depthResolver.resolve(new ArrayList<>(nodeFoodGroups.keySet()), childToParents);
        warnings.addAll(depths.getWarnings());

        List<HierarchyNode> nodes = new ArrayList<>(nodeFoodGroups.size());
        for (Map.Entry<String, String> n : nodeFoodGroups.entrySet()) {
            int depth = depths.depthOf(n.getKey());
            if (depth > maxDepth) {
                log.warn("Hierarchy depth {} of {} exceeds limit {}", depth, n.getKey(), maxDepth);
                warnings.add(Warn.depthLimitExceeded(n.getKey(), depth, maxDepth));
            }
            nodes.add(new HierarchyNode(n.getKey(), n.getValue(), depth));
        }

        List<Alias> aliases = new ArrayList<>();
        for (Synonym s : synonyms) {
            if (nodeFoodGroups.containsKey(s.getPdName())) {
                aliases.add(new Alias(s.getAliasName(), s.getPdName()));
            }
        }

        return new Hierarchy(foodGroups, nodes, new ArrayList<>(edges), aliases, warnings);
    }

    static List<String> collectFoodGroups(Map<String, List<GroupMember>> groups, List<Ingredient> ingredients) {
        Set<String> all = new TreeSet<>();
        for (Ingredient i : ingredients) {
            if (i.getFoodGroup() != null) all.add(i.getFoodGroup());
        }
        for (List<GroupMember> children : groups.values()) {
            for (GroupMember c : children) {
                if (c.getFoodGroup() != null) all.add(c.getFoodGroup());
            }
        }
        return new ArrayList<>(all);
    }

    /** Most frequent food group among the children; ties go to the one seen first. */
    static String dominantFoodGroup(List<GroupMember> children) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GroupMember c : children) {
            counts.merge(String.valueOf(c.getFoodGroup()), 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }
}
