package com.foodgraph.hierarchy.config;

import com.foodgraph.hierarchy.service.analysis.ScoringConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Externalized thresholds of the consolidation heuristic. Unset values keep the
 * {@link ScoringConfig#defaults()} value.
 */
@Validated
@ConfigurationProperties(prefix = "consolidation")
public class ConsolidationProperties {
    private static final ScoringConfig DEFAULTS = ScoringConfig.defaults();

    @Min(1)
    private int minWordLength = DEFAULTS.getMinWordLength();
    @NotNull
    private List<String> stopWords = List.copyOf(DEFAULTS.getStopWords());
    @Min(2)
    private int minGroupSize = DEFAULTS.getMinGroupSize();
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double maxIngredientFraction = DEFAULTS.getMaxIngredientFraction();
    @DecimalMin("0.0")
    private double minScoreThreshold = DEFAULTS.getMinScoreThreshold();
    @DecimalMin("0.0")
    private double frequencyWeight = DEFAULTS.getFrequencyWeight();
    @DecimalMin("0.0")
    private double maxFrequencyScore = DEFAULTS.getMaxFrequencyScore();
    @DecimalMin("0.0")
    private double coherenceMultiplier = DEFAULTS.getCoherenceMultiplier();
    @DecimalMin("0.0")
    private double beginningWordBonus = DEFAULTS.getBeginningWordBonus();
    @DecimalMin("0.0")
    private double mediumWordBonus = DEFAULTS.getMediumWordBonus();
    @DecimalMin("0.0")
    private double longWordBonus = DEFAULTS.getLongWordBonus();
    /** Hard cap on the number of groups one ingredient may join. */
    @Min(1)
    private int maxParentsPerIngredient = DEFAULTS.getMaxParentsPerIngredient();
    /** Candidates below this score cannot give an ingredient a third parent. 0 disables the rule. */
    @DecimalMin("0.0")
    private double secondaryParentMinScore = DEFAULTS.getSecondaryParentMinScore();
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double processingTermThreshold = DEFAULTS.getProcessingTermThreshold();
    @DecimalMin("0.0")
    private double baseWordDiversityRatio = DEFAULTS.getBaseWordDiversityRatio();

    public ScoringConfig toScoringConfig() {
        Set<String> stop = new LinkedHashSet<>();
        for (String w : stopWords) stop.add(w.trim().toUpperCase(Locale.ROOT));
        return ScoringConfig.builder()
            .minWordLength(minWordLength)
            .stopWords(stop)
            .minGroupSize(minGroupSize)
            .maxIngredientFraction(maxIngredientFraction)
            .minScoreThreshold(minScoreThreshold)
            .frequencyWeight(frequencyWeight)
            .maxFrequencyScore(maxFrequencyScore)
            .coherenceMultiplier(coherenceMultiplier)
            .beginningWordBonus(beginningWordBonus)
            .mediumWordBonus(mediumWordBonus)
            .longWordBonus(longWordBonus)
            .maxParentsPerIngredient(maxParentsPerIngredient)
            .secondaryParentMinScore(secondaryParentMinScore)
            .processingTermThreshold(processingTermThreshold)
            .baseWordDiversityRatio(baseWordDiversityRatio)
            .build();
    }

    public int getMinWordLength() { return minWordLength; }
    public void setMinWordLength(int minWordLength) { this.minWordLength = minWordLength; }
    public List<String> getStopWords() { return stopWords; }
    public void setStopWords(List<String> stopWords) { this.stopWords = stopWords; }
    public int getMinGroupSize() { return minGroupSize; }
    public void setMinGroupSize(int minGroupSize) { this.minGroupSize = minGroupSize; }
    public double getMaxIngredientFraction() { return maxIngredientFraction; }
    public void setMaxIngredientFraction(double maxIngredientFraction) { this.maxIngredientFraction = maxIngredientFraction; }
    public double getMinScoreThreshold() { return minScoreThreshold; }
    public void setMinScoreThreshold(double minScoreThreshold) { this.minScoreThreshold = minScoreThreshold; }
    public double getFrequencyWeight() { return frequencyWeight; }
    public void setFrequencyWeight(double frequencyWeight) { this.frequencyWeight = frequencyWeight; }
    public double getMaxFrequencyScore() { return maxFrequencyScore; }
    public void setMaxFrequencyScore(double maxFrequencyScore) { this.maxFrequencyScore = maxFrequencyScore; }
    public double getCoherenceMultiplier() { return coherenceMultiplier; }
    public void setCoherenceMultiplier(double coherenceMultiplier) { this.coherenceMultiplier = coherenceMultiplier; }
    public double getBeginningWordBonus() { return beginningWordBonus; }
    public void setBeginningWordBonus(double beginningWordBonus) { this.beginningWordBonus = beginningWordBonus; }
    public double getMediumWordBonus() { return mediumWordBonus; }
    public void setMediumWordBonus(double mediumWordBonus) { this.mediumWordBonus = mediumWordBonus; }
    public double getLongWordBonus() { return longWordBonus; }
    public void setLongWordBonus(double longWordBonus) { this.longWordBonus = longWordBonus; }
    public int getMaxParentsPerIngredient() { return maxParentsPerIngredient; }
    public void setMaxParentsPerIngredient(int maxParentsPerIngredient) { this.maxParentsPerIngredient = maxParentsPerIngredient; }
    public double getSecondaryParentMinScore() { return secondaryParentMinScore; }
    public void setSecondaryParentMinScore(double secondaryParentMinScore) { this.secondaryParentMinScore = secondaryParentMinScore; }
    public double getProcessingTermThreshold() { return processingTermThreshold; }
    public void setProcessingTermThreshold(double processingTermThreshold) { this.processingTermThreshold = processingTermThreshold; }
    public double getBaseWordDiversityRatio() { return baseWordDiversityRatio; }
    public void setBaseWordDiversityRatio(double baseWordDiversityRatio) { this.baseWordDiversityRatio = baseWordDiversityRatio; }
}
