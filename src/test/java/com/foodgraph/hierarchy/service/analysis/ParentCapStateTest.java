package com.foodgraph.hierarchy.service.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParentCapStateTest {

    @Test
    public void joinReturnsNewStateAndKeepsOldOne() {
        ParentCapState empty = ParentCapState.empty(2);
        ParentCapState one = empty.join(List.of("KALE", "CHARD"));
        ParentCapState two = one.join(List.of("KALE"));

        assertEquals(0, empty.count("KALE"));
        assertEquals(1, one.count("KALE"));
        assertEquals(2, two.count("KALE"));
        assertEquals(1, two.count("CHARD"));
        assertFalse(two.hasCapacity("KALE"));
        assertTrue(two.hasCapacity("CHARD"));
    }

    @Test
    public void refusesToExceedCap() {
        ParentCapState full = ParentCapState.empty(1).join(List.of("KALE"));

        assertThrows(IllegalStateException.class, () -> full.join(List.of("CHARD", "KALE")));
        assertEquals(0, full.count("CHARD"));
    }

    @Test
    public void countsAreReadOnly() {
        ParentCapState state = ParentCapState.empty(3).join(List.of("KALE"));

        assertThrows(UnsupportedOperationException.class, () -> state.counts().put("KALE", 3));
    }
}
