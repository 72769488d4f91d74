package com.foodgraph.hierarchy.model;

import java.util.Objects;

/**
 * One child line of a consolidation group: the child ingredient name and the
 * food group carried along with it in the proposal.
 */
public class GroupMember {
    private final String name;
    private final String foodGroup;

    public GroupMember(String name, String foodGroup) {
        this.name = Objects.requireNonNull(name, "name");
        this.foodGroup = foodGroup;
    }

    public String getName() { return name; }
    public String getFoodGroup() { return foodGroup; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupMember other)) return false;
        return name.equals(other.name) && Objects.equals(foodGroup, other.foodGroup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, foodGroup);
    }

    @Override
    public String toString() {
        return name + "," + foodGroup;
    }
}
