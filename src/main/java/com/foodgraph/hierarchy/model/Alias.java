package com.foodgraph.hierarchy.model;

import java.util.Objects;

/** Alternate name resolved onto a final ingredient identity. */
public class Alias {
    private final String aliasName;
    private final String ingredientName;

    public Alias(String aliasName, String ingredientName) {
        this.aliasName = Objects.requireNonNull(aliasName, "aliasName");
        this.ingredientName = Objects.requireNonNull(ingredientName, "ingredientName");
    }

    public String getAliasName() { return aliasName; }
    public String getIngredientName() { return ingredientName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alias other)) return false;
        return aliasName.equals(other.aliasName) && ingredientName.equals(other.ingredientName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aliasName, ingredientName);
    }

    @Override
    public String toString() {
        return aliasName + " -> " + ingredientName;
    }
}
