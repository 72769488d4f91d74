package com.foodgraph.hierarchy.service.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags words that describe preparation rather than identity ("POWDERED",
 * "CANNED"). A word qualifies when it is frequent relative to the vocabulary
 * and co-occurs with many distinct base words relative to its own frequency.
 *
 * <p>This is a heuristic; false positives and negatives are expected and later
 * stages must tolerate either.
 */
public class ProcessingTermFilter {
    private static final Logger log = LoggerFactory.getLogger(ProcessingTermFilter.class);

    private final ScoringConfig config;

    public ProcessingTermFilter(ScoringConfig config) {
        this.config = config;
    }

    public Set<String> identify(WordIndex index) {
        double frequencyFloor = index.distinctWordCount() * config.getProcessingTermThreshold();
        Set<String> terms = new TreeSet<>();

        for (String word : index.words()) {
            int frequency = index.frequency(word);
            if (frequency <= frequencyFloor) continue;

            Set<String> baseWords = new HashSet<>();
            for (String ingredient : index.postings(word)) {
                for (String other : index.wordsOf(ingredient)) {
                    if (!other.equals(word) && other.length() >= config.getBaseWordMinLength()) {
                        baseWords.add(other);
                    }
                }
            }
            if (baseWords.size() > frequency * config.getBaseWordDiversityRatio()) {
                terms.add(word);
                log.debug("Processing term {} (frequency {}, {} base words)", word, frequency, baseWords.size());
            }
        }
        return Collections.unmodifiableSet(terms);
    }
}
