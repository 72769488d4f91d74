package com.foodgraph.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A preferred descriptor together with its food group, as delivered by the
 * upstream thesaurus export. The name is the identity key and is expected to be
 * unique within one input set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Ingredient {
    private final String name;
    private final String foodGroup;

    public Ingredient(String name, String foodGroup) {
        this.name = Objects.requireNonNull(name, "name");
        this.foodGroup = foodGroup;
    }

    public String getName() { return name; }
    public String getFoodGroup() { return foodGroup; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ingredient other)) return false;
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
