package com.foodgraph.hierarchy.model;

import java.util.List;

/**
 * Finalized ingredient hierarchy: everything the seeding step persists, plus the
 * warnings raised while building it.
 *
 * <p>Node order is registration order (parents, then their children, then
 * standalone ingredients); edge order is proposal order. Both are stable for a
 * given input so that repeated runs produce identical output files.
 */
public class Hierarchy {
    private final List<String> foodGroups;
    private final List<HierarchyNode> nodes;
    private final List<ParentChildEdge> edges;
    private final List<Alias> aliases;
    private final List<Warn> warnings;

    public Hierarchy(List<String> foodGroups, List<HierarchyNode> nodes, List<ParentChildEdge> edges,
                     List<Alias> aliases, List<Warn> warnings) {
        this.foodGroups = List.copyOf(foodGroups);
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.aliases = List.copyOf(aliases);
        this.warnings = List.copyOf(warnings);
    }

    public List<String> getFoodGroups() { return foodGroups; }
    public List<HierarchyNode> getNodes() { return nodes; }
    public List<ParentChildEdge> getEdges() { return edges; }
    public List<Alias> getAliases() { return aliases; }
    public List<Warn> getWarnings() { return warnings; }

    public HierarchyNode node(String name) {
        for (HierarchyNode n : nodes) {
            if (n.getName().equals(name)) return n;
        }
        return null;
    }
}
