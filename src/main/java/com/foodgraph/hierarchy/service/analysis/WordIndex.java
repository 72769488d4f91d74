package com.foodgraph.hierarchy.service.analysis;

import com.foodgraph.hierarchy.model.Ingredient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Inverted index from meaningful word to the ingredients whose names contain it.
 *
 * <p>Frequencies count ingredients, not raw token occurrences: a word repeated
 * inside one name counts once for that ingredient. Postings and the word table
 * are kept sorted so that every consumer iterates them in a stable order.
 */
public class WordIndex {
    private final Tokenizer tokenizer;
    private final SortedMap<String, NavigableSet<String>> postings;
    private final SortedMap<String, Integer> frequencies;
    private final Map<String, Set<String>> wordsByIngredient;
    private final Map<String, String> foodGroups;

    private WordIndex(Tokenizer tokenizer,
                      SortedMap<String, NavigableSet<String>> postings,
                      SortedMap<String, Integer> frequencies,
                      Map<String, Set<String>> wordsByIngredient,
                      Map<String, String> foodGroups) {
        this.tokenizer = tokenizer;
        this.postings = postings;
        this.frequencies = frequencies;
        this.wordsByIngredient = wordsByIngredient;
        this.foodGroups = foodGroups;
    }

    public static WordIndex build(List<Ingredient> ingredients, Tokenizer tokenizer) {
        SortedMap<String, NavigableSet<String>> postings = new TreeMap<>();
        SortedMap<String, Integer> frequencies = new TreeMap<>();
        Map<String, Set<String>> wordsByIngredient = new LinkedHashMap<>();
        Map<String, String> foodGroups = new LinkedHashMap<>();

        for (Ingredient ingredient : ingredients) {
            String name = ingredient.getName();
            // first row wins if the upstream export ever repeats a name
            if (foodGroups.containsKey(name)) continue;
            foodGroups.put(name, ingredient.getFoodGroup());

            Set<String> words = new LinkedHashSet<>(tokenizer.tokenize(name));
            wordsByIngredient.put(name, Collections.unmodifiableSet(words));
            for (String word : words) {
                postings.computeIfAbsent(word, w -> new TreeSet<>()).add(name);
                frequencies.merge(word, 1, Integer::sum);
            }
        }
        return new WordIndex(tokenizer, postings, frequencies, wordsByIngredient, foodGroups);
    }

    public Tokenizer getTokenizer() { return tokenizer; }

    /** Sorted set of ingredient names containing the word, empty when unknown. */
    public NavigableSet<String> postings(String word) {
        NavigableSet<String> p = postings.get(word);
        return p == null ? Collections.emptyNavigableSet() : Collections.unmodifiableNavigableSet(p);
    }

    public int frequency(String word) {
        return frequencies.getOrDefault(word, 0);
    }

    /** All indexed words in alphabetical order. */
    public Set<String> words() {
        return Collections.unmodifiableSet(postings.keySet());
    }

    public int distinctWordCount() {
        return postings.size();
    }

    public int ingredientCount() {
        return foodGroups.size();
    }

    /** Distinct meaningful words of an indexed ingredient, in name order. */
    public Set<String> wordsOf(String ingredientName) {
        Set<String> w = wordsByIngredient.get(ingredientName);
        return w == null ? Set.of() : w;
    }

    public String foodGroupOf(String ingredientName) {
        return foodGroups.get(ingredientName);
    }
}
