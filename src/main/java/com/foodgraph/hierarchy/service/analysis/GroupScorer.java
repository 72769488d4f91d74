package com.foodgraph.hierarchy.service.analysis;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Scores a word as a potential parent concept for the ingredients containing it.
 *
 * <p>The score adds up four parts:
 * <ol>
 *   <li><strong>Frequency</strong> - posting count times the frequency weight, capped</li>
 *   <li><strong>Coherence</strong> - share of the other words that recur in more than one posting</li>
 *   <li><strong>Position</strong> - share of postings whose cleaned name starts with the word</li>
 *   <li><strong>Length</strong> - flat bonus for medium and long words</li>
 * </ol>
 * Words in fewer than {@code minGroupSize} or more than {@code maxIngredientFraction}
 * of all ingredients score 0. Scores only rank candidates and are not persisted.
 */
public class GroupScorer {
    private final ScoringConfig config;

    public GroupScorer(ScoringConfig config) {
        this.config = config;
    }

    /**
     * Scores every indexed word that is not a processing term and keeps the ones
     * reaching the minimum score threshold.
     *
     * @param index word index over the full ingredient set
     * @param processingTerms words excluded from candidacy
     * @return candidate word to score, alphabetical by word
     */
    public SortedMap<String, Double> scoreCandidates(WordIndex index, Set<String> processingTerms) {
        SortedMap<String, Double> scores = new TreeMap<>();
        for (String word : index.words()) {
            if (processingTerms.contains(word)) continue;
            double score = score(word, index);
            if (score >= config.getMinScoreThreshold()) {
                scores.put(word, score);
            }
        }
        return Collections.unmodifiableSortedMap(scores);
    }

    public double score(String word, WordIndex index) {
        NavigableSet<String> postings = index.postings(word);
        int n = postings.size();
        if (n < config.getMinGroupSize()) return 0;
        if (n > index.ingredientCount() * config.getMaxIngredientFraction()) return 0;

        double score = Math.min(n * config.getFrequencyWeight(), config.getMaxFrequencyScore());
        score += coherence(word, postings, index);
        score += positional(word, postings, index);
        score += lengthBonus(word);
        return score;
    }

    double coherence(String word, NavigableSet<String> postings, WordIndex index) {
        Map<String, Integer> otherWords = new HashMap<>();
        for (String ingredient : postings) {
            for (String w : index.wordsOf(ingredient)) {
                if (!w.equals(word)) otherWords.merge(w, 1, Integer::sum);
            }
        }
        if (otherWords.isEmpty()) return 0;
        long shared = otherWords.values().stream().filter(c -> c > 1).count();
        return ((double) shared / otherWords.size()) * config.getCoherenceMultiplier();
    }

    double positional(String word, NavigableSet<String> postings, WordIndex index) {
        Tokenizer tokenizer = index.getTokenizer();
        long leading = postings.stream().filter(i -> word.equals(tokenizer.firstToken(i))).count();
        return ((double) leading / postings.size()) * config.getBeginningWordBonus();
    }

    double lengthBonus(String word) {
        if (word.length() >= config.getLongWordLength()) return config.getLongWordBonus();
        if (word.length() >= config.getMediumWordLength()) return config.getMediumWordBonus();
        return 0;
    }
}
