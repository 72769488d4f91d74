package com.foodgraph.hierarchy.service.analysis;

import com.foodgraph.hierarchy.IngredientFixtures;
import com.foodgraph.hierarchy.model.Ingredient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GroupScorerTest {

    private static final double EPS = 1e-9;

    private WordIndex index(List<Ingredient> ingredients, ScoringConfig config) {
        return WordIndex.build(ingredients, new Tokenizer(config));
    }

    private List<Ingredient> padded(Ingredient... ingredients) {
        List<Ingredient> out = new ArrayList<>(List.of(ingredients));
        for (String f : IngredientFixtures.FILLER) out.add(new Ingredient(f, "Produce"));
        return out;
    }

    @Test
    public void cheeseScoresFrequencyPlusLengthBonus() {
        ScoringConfig config = ScoringConfig.defaults();
        WordIndex idx = index(IngredientFixtures.cheeseAndJuicePadded(), config);

        // 3 postings * 10 + long word bonus; no shared words, never leading
        assertEquals(50.0, new GroupScorer(config).score("CHEESE", idx), EPS);
    }

    @Test
    public void rejectsRareAndOverlyGenericWords() {
        ScoringConfig config = ScoringConfig.defaults();
        GroupScorer scorer = new GroupScorer(config);

        WordIndex padded = index(IngredientFixtures.cheeseAndJuicePadded(), config);
        assertEquals(0.0, scorer.score("CHEDDAR", padded), EPS);

        // 3 of 4 ingredients exceeds 10% of the set
        WordIndex small = index(IngredientFixtures.cheeseAndJuice(), config);
        assertEquals(0.0, scorer.score("CHEESE", small), EPS);
    }

    @Test
    public void coherenceRewardsSharedNeighbourWords() {
        ScoringConfig config = ScoringConfig.defaults();
        WordIndex idx = index(padded(
            new Ingredient("GREEN BELL PEPPER", "Vegetables"),
            new Ingredient("RED BELL PEPPER", "Vegetables"),
            new Ingredient("BLACK PEPPER", "Spices")), config);
        GroupScorer scorer = new GroupScorer(config);

        // BELL recurs, GREEN/RED/BLACK do not: 1 of 4 other words shared
        assertEquals(10.0, scorer.coherence("PEPPER", idx.postings("PEPPER"), idx), EPS);
        assertEquals(30 + 10 + 20, scorer.score("PEPPER", idx), EPS);
    }

    @Test
    public void coherenceIsZeroWithoutOtherWords() {
        ScoringConfig config = ScoringConfig.defaults();
        WordIndex idx = index(padded(
            new Ingredient("MISO", "Legumes"),
            new Ingredient("MISO MISO", "Legumes")), config);
        GroupScorer scorer = new GroupScorer(config);

        assertEquals(0.0, scorer.coherence("MISO", idx.postings("MISO"), idx), EPS);
        assertEquals(0.0, scorer.coherence("ZUCCHINI", idx.postings("ZUCCHINI"), idx), EPS);
    }

    @Test
    public void positionalBonusIsShareOfLeadingPostings() {
        ScoringConfig config = ScoringConfig.defaults();
        WordIndex idx = index(padded(
            new Ingredient("RICE FLOUR", "Grains"),
            new Ingredient("BROWN RICE", "Grains")), config);
        GroupScorer scorer = new GroupScorer(config);

        assertEquals(15.0, scorer.positional("RICE", idx.postings("RICE"), idx), EPS);
        // 2 * 10 + 15 positional + 10 medium length
        assertEquals(45.0, scorer.score("RICE", idx), EPS);
    }

    @Test
    public void lengthBonusTiers() {
        GroupScorer scorer = new GroupScorer(ScoringConfig.defaults());
        assertEquals(0.0, scorer.lengthBonus("OIL"), EPS);
        assertEquals(10.0, scorer.lengthBonus("CORN"), EPS);
        assertEquals(10.0, scorer.lengthBonus("BEANS"), EPS);
        assertEquals(20.0, scorer.lengthBonus("CHEESE"), EPS);
    }

    @Test
    public void frequencyScoreIsCapped() {
        ScoringConfig config = ScoringConfig.builder().maxIngredientFraction(1.0).build();
        List<Ingredient> beans = new ArrayList<>();
        for (String kind : List.of("BLACK", "PINTO", "NAVY", "KIDNEY", "LIMA", "MUNG", "FAVA", "ADZUKI",
                "CRANBERRY", "GREAT NORTHERN", "CANNELLINI", "RUNNER")) {
            beans.add(new Ingredient(kind + " BEANS", "Legumes"));
        }
        WordIndex idx = index(beans, config);
        GroupScorer scorer = new GroupScorer(config);

        // 12 postings would be 120 uncapped
        double expected = 100 + scorer.coherence("BEANS", idx.postings("BEANS"), idx) + 0 + 10;
        assertEquals(expected, scorer.score("BEANS", idx), EPS);
    }

    @Test
    public void candidatesSkipProcessingTermsAndLowScores() {
        ScoringConfig config = ScoringConfig.defaults();
        WordIndex idx = index(padded(
            new Ingredient("CHEDDAR CHEESE", "Dairy"),
            new Ingredient("SWISS CHEESE", "Dairy"),
            new Ingredient("COTTAGE CHEESE", "Dairy"),
            new Ingredient("RICE FLOUR", "Grains"),
            new Ingredient("BROWN RICE", "Grains"),
            new Ingredient("OAT BRAN", "Grains"),
            new Ingredient("OAT MILK", "Beverages")), config);
        GroupScorer scorer = new GroupScorer(config);

        Map<String, Double> all = scorer.scoreCandidates(idx, Set.of());
        assertEquals(Set.of("CHEESE", "RICE", "OAT"), all.keySet());

        Map<String, Double> filtered = scorer.scoreCandidates(idx, Set.of("CHEESE"));
        assertEquals(Set.of("RICE", "OAT"), filtered.keySet());

        ScoringConfig strict = config.toBuilder().minScoreThreshold(50).build();
        assertEquals(Set.of("CHEESE", "OAT"), new GroupScorer(strict).scoreCandidates(idx, Set.of()).keySet());
    }
}
