package com.foodgraph.hierarchy.service.analysis;

import com.foodgraph.hierarchy.IngredientFixtures;
import com.foodgraph.hierarchy.model.Ingredient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessingTermFilterTest {

    private List<Ingredient> cannedCorpus() {
        List<Ingredient> out = new ArrayList<>(List.of(
            new Ingredient("CANNED APRICOTS", "Fruit"),
            new Ingredient("CANNED BEETS", "Vegetables"),
            new Ingredient("CANNED CARROTS", "Vegetables"),
            new Ingredient("CANNED PEACHES", "Fruit"),
            new Ingredient("CANNED PEARS", "Fruit"),
            new Ingredient("CHEDDAR CHEESE", "Dairy"),
            new Ingredient("SWISS CHEESE", "Dairy")));
        for (String f : IngredientFixtures.FILLER.subList(0, 10)) {
            out.add(new Ingredient(f, "Produce"));
        }
        return out;
    }

    private Set<String> identify(List<Ingredient> ingredients, ScoringConfig config) {
        WordIndex idx = WordIndex.build(ingredients, new Tokenizer(config));
        return new ProcessingTermFilter(config).identify(idx);
    }

    @Test
    public void flagsWordSpreadAcrossUnrelatedBases() {
        Set<String> terms = identify(cannedCorpus(), ScoringConfig.defaults());
        assertTrue(terms.contains("CANNED"), "CANNED co-occurs with five different base words");
    }

    @Test
    public void ignoresWordsBelowFrequencyFloor() {
        // 19 distinct words * 0.15 = 2.85, CHEESE occurs twice
        Set<String> terms = identify(cannedCorpus(), ScoringConfig.defaults());
        assertFalse(terms.contains("CHEESE"));
        assertEquals(Set.of("CANNED"), terms);
    }

    @Test
    public void diversityRatioControlsClassification() {
        ScoringConfig lenient = ScoringConfig.builder().baseWordDiversityRatio(2.0).build();
        assertTrue(identify(cannedCorpus(), lenient).isEmpty());
    }

    @Test
    public void cheeseIsNotAProcessingTermInRealisticCorpus() {
        assertFalse(identify(IngredientFixtures.cheeseAndJuicePadded(), ScoringConfig.defaults()).contains("CHEESE"));
    }
}
