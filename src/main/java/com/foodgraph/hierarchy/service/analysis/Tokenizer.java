package com.foodgraph.hierarchy.service.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits an ingredient descriptor into the words that may act as grouping keys.
 *
 * <p>Cleaning uppercases the name, replaces everything except word characters,
 * whitespace, hyphen, comma and period with a space, and collapses whitespace.
 * Tokens shorter than the configured minimum length or listed as stop-words are
 * dropped. Tokenizing an already-cleaned name yields the same words.
 */
public class Tokenizer {
    private static final Pattern NON_ESSENTIAL = Pattern.compile("[^\\w\\s\\-,.]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final int minWordLength;
    private final Set<String> stopWords;

    public Tokenizer(ScoringConfig config) {
        this(config.getMinWordLength(), config.getStopWords());
    }

    public Tokenizer(int minWordLength, Set<String> stopWords) {
        this.minWordLength = minWordLength;
        this.stopWords = Objects.requireNonNull(stopWords, "stopWords");
    }

    public String clean(String raw) {
        if (raw == null) return "";
        String upper = raw.toUpperCase(Locale.ROOT).trim();
        String stripped = NON_ESSENTIAL.matcher(upper).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Returns the meaningful words of a descriptor in their original order.
     * Duplicates are kept; callers that count per ingredient deduplicate.
     */
    public List<String> tokenize(String raw) {
        String cleaned = clean(raw);
        if (cleaned.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        for (String word : cleaned.split(" ")) {
            if (word.length() < minWordLength) continue;
            if (stopWords.contains(word)) continue;
            out.add(word);
        }
        return out;
    }

    /** First whitespace-separated token of the cleaned name, before any filtering. */
    public String firstToken(String raw) {
        String cleaned = clean(raw);
        if (cleaned.isEmpty()) return "";
        int space = cleaned.indexOf(' ');
        return space < 0 ? cleaned : cleaned.substring(0, space);
    }
}
