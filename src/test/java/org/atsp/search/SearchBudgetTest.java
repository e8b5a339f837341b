package org.atsp.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Search Budget Tests")
class SearchBudgetTest {

    @Test
    @DisplayName("Non-positive bounds mean unbounded")
    void testNormalization() {
        SearchBudget budget = SearchBudget.of(0, -5L);
        assertEquals(SearchBudget.UNBOUNDED_ITERATIONS, budget.maxIterations());
        assertEquals(SearchBudget.UNBOUNDED_MILLIS, budget.timeBudgetMillis());
        assertFalse(budget.isBounded());
        assertTrue(SearchBudget.ofIterations(3).isBounded());
        assertTrue(SearchBudget.ofMillis(10L).isBounded());
    }

    @Test
    @DisplayName("Runs are exhausted after the iteration bound")
    void testIterationBound() {
        SearchBudget.Run run = SearchBudget.ofIterations(3).start();
        for (int i = 0; i < 3; i++) {
            assertFalse(run.isExhausted());
            run.completeIteration();
        }
        assertTrue(run.isExhausted());
        assertEquals(3, run.iterations());
    }

    @Test
    @DisplayName("Runs are exhausted after the time bound")
    @Timeout(5)
    void testTimeBound() throws InterruptedException {
        SearchBudget.Run run = SearchBudget.ofMillis(20L).start();
        Thread.sleep(40L);
        assertTrue(run.isExhausted());
        assertTrue(run.elapsedMillis() >= 20L);
    }

    @Test
    @DisplayName("Defaults read system properties and ignore malformed values")
    void testDefaults() {
        try {
            System.setProperty("atsp.search.maxIterations", "12");
            System.setProperty("atsp.search.timeBudgetMillis", "soon");
            SearchBudget budget = SearchBudget.defaults();
            assertEquals(12, budget.maxIterations());
            assertEquals(SearchBudget.UNBOUNDED_MILLIS, budget.timeBudgetMillis());
        } finally {
            System.clearProperty("atsp.search.maxIterations");
            System.clearProperty("atsp.search.timeBudgetMillis");
        }
        assertFalse(SearchBudget.defaults().isBounded());
    }
}
