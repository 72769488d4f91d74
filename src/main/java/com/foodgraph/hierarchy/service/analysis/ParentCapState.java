package com.foodgraph.hierarchy.service.analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Number of groups each ingredient has joined so far during assignment.
 *
 * <p>Instances are immutable: {@link #join(Collection)} returns the next state
 * and leaves the receiver untouched, so an assignment step can be replayed or
 * tested from any intermediate state. No count ever exceeds {@code maxParents}.
 */
public final class ParentCapState {
    private final int maxParents;
    private final Map<String, Integer> counts;

    private ParentCapState(int maxParents, Map<String, Integer> counts) {
        this.maxParents = maxParents;
        this.counts = counts;
    }

    public static ParentCapState empty(int maxParents) {
        return new ParentCapState(maxParents, Map.of());
    }

    public int count(String ingredient) {
        return counts.getOrDefault(ingredient, 0);
    }

    public boolean hasCapacity(String ingredient) {
        return count(ingredient) < maxParents;
    }

    public int getMaxParents() { return maxParents; }

    /**
     * Records one more parent for each ingredient.
     *
     * @throws IllegalStateException if an ingredient is already at the cap
     */
    public ParentCapState join(Collection<String> ingredients) {
        Map<String, Integer> next = new HashMap<>(counts);
        for (String ingredient : ingredients) {
            int c = next.getOrDefault(ingredient, 0);
            if (c >= maxParents) {
                throw new IllegalStateException("Ingredient '" + ingredient + "' already has " + c + " parents");
            }
            next.put(ingredient, c + 1);
        }
        return new ParentCapState(maxParents, Collections.unmodifiableMap(next));
    }

    public Map<String, Integer> counts() {
        return counts;
    }
}
