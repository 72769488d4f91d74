package com.foodgraph.hierarchy.model;

import java.util.Objects;

/**
 * Ingredient row of the finalized hierarchy. {@code depth} is the length of the
 * longest parent chain above the node, 0 for roots and standalone ingredients.
 */
public class HierarchyNode {
    private final String name;
    private final String foodGroup;
    private final int depth;

    public HierarchyNode(String name, String foodGroup, int depth) {
        this.name = Objects.requireNonNull(name, "name");
        this.foodGroup = foodGroup;
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0: " + depth);
        this.depth = depth;
    }

    public String getName() { return name; }
    public String getFoodGroup() { return foodGroup; }
    public int getDepth() { return depth; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HierarchyNode other)) return false;
        return depth == other.depth && name.equals(other.name) && Objects.equals(foodGroup, other.foodGroup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, foodGroup, depth);
    }

    @Override
    public String toString() {
        return name + "," + foodGroup + "," + depth;
    }
}
