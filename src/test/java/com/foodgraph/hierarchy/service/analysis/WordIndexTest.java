package com.foodgraph.hierarchy.service.analysis;

import com.foodgraph.hierarchy.model.Ingredient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class WordIndexTest {

    private WordIndex index(Ingredient... ingredients) {
        return WordIndex.build(List.of(ingredients), new Tokenizer(ScoringConfig.defaults()));
    }

    @Test
    public void countsIngredientsNotTokenOccurrences() {
        WordIndex idx = index(
            new Ingredient("MANGO MANGO CHUTNEY", "Condiments"),
            new Ingredient("MANGO", "Fruit"));

        assertEquals(2, idx.frequency("MANGO"));
        assertEquals(1, idx.frequency("CHUTNEY"));
        assertEquals(0, idx.frequency("PAPAYA"));
        assertEquals(Set.of("MANGO", "MANGO MANGO CHUTNEY"), idx.postings("MANGO"));
    }

    @Test
    public void postingsAndWordsAreSorted() {
        WordIndex idx = index(
            new Ingredient("SWISS CHEESE", "Dairy"),
            new Ingredient("CHEDDAR CHEESE", "Dairy"),
            new Ingredient("COTTAGE CHEESE", "Dairy"));

        assertEquals(List.of("CHEDDAR CHEESE", "COTTAGE CHEESE", "SWISS CHEESE"), List.copyOf(idx.postings("CHEESE")));
        assertEquals(List.of("CHEDDAR", "CHEESE", "COTTAGE", "SWISS"), List.copyOf(idx.words()));
        assertEquals(4, idx.distinctWordCount());
        assertEquals(3, idx.ingredientCount());
    }

    @Test
    public void keepsFoodGroupAndWordsPerIngredient() {
        WordIndex idx = index(new Ingredient("PEAS AND CARROTS", "Vegetables"));

        assertEquals("Vegetables", idx.foodGroupOf("PEAS AND CARROTS"));
        assertEquals(List.of("PEAS", "CARROTS"), List.copyOf(idx.wordsOf("PEAS AND CARROTS")));
        assertTrue(idx.wordsOf("UNKNOWN").isEmpty());
        assertNull(idx.foodGroupOf("UNKNOWN"));
    }

    @Test
    public void ingredientWithoutMeaningfulWordsIsStillCounted() {
        WordIndex idx = index(new Ingredient("OF", "Misc"), new Ingredient("TEA", "Beverages"));

        assertEquals(2, idx.ingredientCount());
        assertEquals(1, idx.distinctWordCount());
    }
}
