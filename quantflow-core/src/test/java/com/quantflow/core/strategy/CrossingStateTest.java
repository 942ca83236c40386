package com.quantflow.core.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Crossing State Tests")
class CrossingStateTest {

    private static BigDecimal d(String v) {
        return new BigDecimal(v);
    }

    @Test
    @DisplayName("First observation never reports a crossing")
    void testFirstObservation() {
        CrossingState state = new CrossingState();
        assertEquals(Crossing.NONE, state.update("pair", d("2"), d("1")));
        assertTrue(state.isAbove("pair"));
    }

    @Test
    @DisplayName("Should report each flip exactly once")
    void testFlips() {
        CrossingState state = new CrossingState();
        state.update("pair", d("1"), d("2"));
        assertEquals(Crossing.UP, state.update("pair", d("3"), d("2")));
        assertEquals(Crossing.NONE, state.update("pair", d("4"), d("2")));
        assertEquals(Crossing.DOWN, state.update("pair", d("1"), d("2")));
        assertEquals(Crossing.NONE, state.update("pair", d("1"), d("2")));
    }

    @Test
    @DisplayName("Touching keeps the prior relation")
    void testEqualityKeepsRelation() {
        CrossingState state = new CrossingState();
        state.update("pair", d("1"), d("2"));
        assertEquals(Crossing.NONE, state.update("pair", d("2"), d("2")));
        assertFalse(state.isAbove("pair"));
        assertEquals(Crossing.UP, state.update("pair", d("2.1"), d("2")));
    }

    @Test
    @DisplayName("Pairs are tracked independently and can be cleared")
    void testIndependentPairs() {
        CrossingState state = new CrossingState();
        state.update("a", d("1"), d("2"));
        state.update("b", d("3"), d("2"));
        assertEquals(Crossing.UP, state.update("a", d("3"), d("2")));
        assertEquals(Crossing.NONE, state.update("b", d("3"), d("2")));

        state.clear("a");
        assertFalse(state.isKnown("a"));
        assertEquals(Crossing.NONE, state.update("a", d("1"), d("2")));
    }

    @Test
    @DisplayName("A condition activates once until it lapses")
    void testActivation() {
        CrossingState state = new CrossingState();
        assertFalse(state.activates("regime", false));
        assertTrue(state.activates("regime", true));
        assertFalse(state.activates("regime", true));
        assertFalse(state.activates("regime", false));
        assertTrue(state.activates("regime", true));
    }
}
