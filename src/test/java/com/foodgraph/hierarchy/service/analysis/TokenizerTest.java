package com.foodgraph.hierarchy.service.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer(ScoringConfig.defaults());

    @Test
    public void uppercasesAndStripsPunctuation() {
        assertEquals("CHEDDAR CHEESE SHARP", tokenizer.clean("  Cheddar cheese (sharp)! "));
        assertEquals(List.of("CHEDDAR", "CHEESE", "SHARP"), tokenizer.tokenize("Cheddar cheese (sharp)!"));
    }

    @Test
    public void dropsStopWordsAndShortTokens() {
        assertEquals(List.of("PEAS", "CARROTS", "WATER"), tokenizer.tokenize("PEAS AND CARROTS IN WATER"));
        assertEquals(List.of("OIL"), tokenizer.tokenize("OIL OF A"));
    }

    @Test
    public void keepsHyphensCommasAndPeriods() {
        assertEquals(List.of("SEMI-SWEET", "CHOCOLATE"), tokenizer.tokenize("semi-sweet chocolate"));
        assertEquals("SALT, SEA", tokenizer.clean("salt, sea"));
        assertEquals("ST. JOHN S BREAD", tokenizer.clean("St. John's bread"));
    }

    @Test
    public void emptyInputYieldsNoWords() {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("   ").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertEquals("", tokenizer.firstToken("!!"));
    }

    @Test
    public void tokenizingCleanedNameIsIdempotent() {
        for (String raw : List.of("Cheddar cheese (sharp)!", "PEAS & CARROTS, canned", "  oil of   olive  ",
                "Beans, kidney; red", "jalapeño pepper")) {
            String cleaned = tokenizer.clean(raw);
            assertEquals(tokenizer.tokenize(raw), tokenizer.tokenize(cleaned), raw);
            assertEquals(cleaned, tokenizer.clean(cleaned), raw);
        }
    }

    @Test
    public void keepsRepeatedWordsInOrder() {
        assertEquals(List.of("MANGO", "MANGO", "CHUTNEY"), tokenizer.tokenize("mango mango chutney"));
    }

    @Test
    public void firstTokenIgnoresWordFiltering() {
        assertEquals("THE", tokenizer.firstToken("the best cheese"));
        assertEquals("RICE", tokenizer.firstToken("rice brown"));
        assertEquals("RICE,", tokenizer.firstToken("rice, brown"));
    }

    @Test
    public void honoursAlternateMinimumLength() {
        Tokenizer strict = new Tokenizer(ScoringConfig.builder().minWordLength(5).build());
        assertEquals(List.of("CHEESE"), strict.tokenize("BRIE CHEESE"));
    }
}
