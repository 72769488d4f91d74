package com.foodgraph.hierarchy.model;

import java.util.Objects;

/**
 * Directed parent to child relation of the finalized hierarchy. Self-edges are
 * rejected at construction.
 */
public class ParentChildEdge {
    private final String parentName;
    private final String childName;

    public ParentChildEdge(String parentName, String childName) {
        this.parentName = Objects.requireNonNull(parentName, "parentName");
        this.childName = Objects.requireNonNull(childName, "childName");
        if (parentName.equals(childName)) {
            throw new IllegalArgumentException("Self-referencing edge for '" + parentName + "'");
        }
    }

    public String getParentName() { return parentName; }
    public String getChildName() { return childName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParentChildEdge other)) return false;
        return parentName.equals(other.parentName) && childName.equals(other.childName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentName, childName);
    }

    @Override
    public String toString() {
        return parentName + " -> " + childName;
    }
}
