package com.foodgraph.hierarchy.service.analysis;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tunable thresholds and bonuses of the consolidation heuristic.
 *
 * <p>One immutable value is handed to every analysis step so that tests and
 * alternate runs can change a threshold without touching shared state.
 * {@link #defaults()} reproduces the values the curated seed proposals were
 * produced with.
 *
 * <h3>Groups of settings</h3>
 * <ul>
 *   <li><strong>Tokenizing</strong> - minimum word length and stop-words</li>
 *   <li><strong>Scoring</strong> - frequency weight and cap, coherence multiplier, positional and length bonuses, minimum score</li>
 *   <li><strong>Assignment</strong> - minimum group size, per-ingredient parent cap, secondary parent score</li>
 *   <li><strong>Processing terms</strong> - frequency threshold and base-word diversity ratio</li>
 * </ul>
 */
public final class ScoringConfig {
    public static final Set<String> DEFAULT_STOP_WORDS = Collections.unmodifiableSet(new LinkedHashSet<>(
        List.of("THE", "AND", "OR", "OF", "IN", "ON", "AT", "TO", "FOR", "WITH")));

    private final int minWordLength;
    private final Set<String> stopWords;
    private final int minGroupSize;
    private final double maxIngredientFraction;
    private final double minScoreThreshold;
    private final double frequencyWeight;
    private final double maxFrequencyScore;
    private final double coherenceMultiplier;
    private final double beginningWordBonus;
    private final int mediumWordLength;
    private final double mediumWordBonus;
    private final int longWordLength;
    private final double longWordBonus;
    private final int maxParentsPerIngredient;
    private final double secondaryParentMinScore;
    private final double processingTermThreshold;
    private final double baseWordDiversityRatio;
    private final int baseWordMinLength;

    private ScoringConfig(Builder b) {
        this.minWordLength = b.minWordLength;
        this.stopWords = Collections.unmodifiableSet(new LinkedHashSet<>(b.stopWords));
        this.minGroupSize = b.minGroupSize;
        this.maxIngredientFraction = b.maxIngredientFraction;
        this.minScoreThreshold = b.minScoreThreshold;
        this.frequencyWeight = b.frequencyWeight;
        this.maxFrequencyScore = b.maxFrequencyScore;
        this.coherenceMultiplier = b.coherenceMultiplier;
        this.beginningWordBonus = b.beginningWordBonus;
        this.mediumWordLength = b.mediumWordLength;
        this.mediumWordBonus = b.mediumWordBonus;
        this.longWordLength = b.longWordLength;
        this.longWordBonus = b.longWordBonus;
        this.maxParentsPerIngredient = b.maxParentsPerIngredient;
        this.secondaryParentMinScore = b.secondaryParentMinScore;
        this.processingTermThreshold = b.processingTermThreshold;
        this.baseWordDiversityRatio = b.baseWordDiversityRatio;
        this.baseWordMinLength = b.baseWordMinLength;
        if (minGroupSize < 2) {
            throw new IllegalArgumentException("minGroupSize must be >= 2: " + minGroupSize);
        }
        if (maxParentsPerIngredient < 1) {
            throw new IllegalArgumentException("maxParentsPerIngredient must be >= 1: " + maxParentsPerIngredient);
        }
    }

    public static ScoringConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .minWordLength(minWordLength)
            .stopWords(stopWords)
            .minGroupSize(minGroupSize)
            .maxIngredientFraction(maxIngredientFraction)
            .minScoreThreshold(minScoreThreshold)
            .frequencyWeight(frequencyWeight)
            .maxFrequencyScore(maxFrequencyScore)
            .coherenceMultiplier(coherenceMultiplier)
            .beginningWordBonus(beginningWordBonus)
            .mediumWordLength(mediumWordLength)
            .mediumWordBonus(mediumWordBonus)
            .longWordLength(longWordLength)
            .longWordBonus(longWordBonus)
            .maxParentsPerIngredient(maxParentsPerIngredient)
            .secondaryParentMinScore(secondaryParentMinScore)
            .processingTermThreshold(processingTermThreshold)
            .baseWordDiversityRatio(baseWordDiversityRatio)
            .baseWordMinLength(baseWordMinLength);
    }

    public int getMinWordLength() { return minWordLength; }
    public Set<String> getStopWords() { return stopWords; }
    public int getMinGroupSize() { return minGroupSize; }
    public double getMaxIngredientFraction() { return maxIngredientFraction; }
    public double getMinScoreThreshold() { return minScoreThreshold; }
    public double getFrequencyWeight() { return frequencyWeight; }
    public double getMaxFrequencyScore() { return maxFrequencyScore; }
    public double getCoherenceMultiplier() { return coherenceMultiplier; }
    public double getBeginningWordBonus() { return beginningWordBonus; }
    public int getMediumWordLength() { return mediumWordLength; }
    public double getMediumWordBonus() { return mediumWordBonus; }
    public int getLongWordLength() { return longWordLength; }
    public double getLongWordBonus() { return longWordBonus; }
    public int getMaxParentsPerIngredient() { return maxParentsPerIngredient; }
    public double getSecondaryParentMinScore() { return secondaryParentMinScore; }
    public double getProcessingTermThreshold() { return processingTermThreshold; }
    public double getBaseWordDiversityRatio() { return baseWordDiversityRatio; }
    public int getBaseWordMinLength() { return baseWordMinLength; }

    public static final class Builder {
        private int minWordLength = 3;
        private Set<String> stopWords = DEFAULT_STOP_WORDS;
        private int minGroupSize = 2;
        private double maxIngredientFraction = 0.1;
        private double minScoreThreshold = 30;
        private double frequencyWeight = 10;
        private double maxFrequencyScore = 100;
        private double coherenceMultiplier = 40;
        private double beginningWordBonus = 30;
        private int mediumWordLength = 4;
        private double mediumWordBonus = 10;
        private int longWordLength = 6;
        private double longWordBonus = 20;
        private int maxParentsPerIngredient = 3;
        private double secondaryParentMinScore = 50;
        private double processingTermThreshold = 0.15;
        private double baseWordDiversityRatio = 0.3;
        private int baseWordMinLength = 4;

        private Builder() {}

        public Builder minWordLength(int v) { this.minWordLength = v; return this; }
        public Builder stopWords(Set<String> v) { this.stopWords = v; return this; }
        public Builder minGroupSize(int v) { this.minGroupSize = v; return this; }
        public Builder maxIngredientFraction(double v) { this.maxIngredientFraction = v; return this; }
        public Builder minScoreThreshold(double v) { this.minScoreThreshold = v; return this; }
        public Builder frequencyWeight(double v) { this.frequencyWeight = v; return this; }
        public Builder maxFrequencyScore(double v) { this.maxFrequencyScore = v; return this; }
        public Builder coherenceMultiplier(double v) { this.coherenceMultiplier = v; return this; }
        public Builder beginningWordBonus(double v) { this.beginningWordBonus = v; return this; }
        public Builder mediumWordLength(int v) { this.mediumWordLength = v; return this; }
        public Builder mediumWordBonus(double v) { this.mediumWordBonus = v; return this; }
        public Builder longWordLength(int v) { this.longWordLength = v; return this; }
        public Builder longWordBonus(double v) { this.longWordBonus = v; return this; }
        public Builder maxParentsPerIngredient(int v) { this.maxParentsPerIngredient = v; return this; }
        public Builder secondaryParentMinScore(double v) { this.secondaryParentMinScore = v; return this; }
        public Builder processingTermThreshold(double v) { this.processingTermThreshold = v; return this; }
        public Builder baseWordDiversityRatio(double v) { this.baseWordDiversityRatio = v; return this; }
        public Builder baseWordMinLength(int v) { this.baseWordMinLength = v; return this; }

        public ScoringConfig build() {
            return new ScoringConfig(this);
        }
    }
}
