package com.funcplan;

import com.funcplan.syntax.FunctionCandidate;
import com.funcplan.syntax.ScoringFunctionSelector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoringFunctionSelectorTest {

    private static FunctionCandidate candidate(String name, int statements, int controlFlow, int order) {
        return new FunctionCandidate(name, "Owner", List.of(), order + 1, order + 5,
                statements, controlFlow, order, null);
    }

    private final ScoringFunctionSelector selector = new ScoringFunctionSelector();

    @Test
    void scoreWeighsControlFlowTwice() {
        assertEquals(10, ScoringFunctionSelector.score(candidate("f", 4, 3, 0)));
    }

    @Test
    void preferredNameWinsOverHigherScore() {
        List<FunctionCandidate> candidates = List.of(
                candidate("busy", 50, 10, 0),
                candidate("plan", 1, 0, 1));
        assertEquals("plan", selector.select(candidates).orElseThrow().name());
    }

    @Test
    void highestScoreWins() {
        List<FunctionCandidate> candidates = List.of(
                candidate("small", 2, 0, 0),
                candidate("branchy", 3, 2, 1),
                candidate("long", 6, 0, 2));
        assertEquals("branchy", selector.select(candidates).orElseThrow().name());
    }

    @Test
    void tiesGoToEarlierDeclaration() {
        List<FunctionCandidate> candidates = List.of(
                candidate("first", 4, 1, 0),
                candidate("second", 2, 2, 1));
        assertEquals("first", selector.select(candidates).orElseThrow().name());
    }

    @Test
    void noCandidatesSelectsNothing() {
        assertTrue(selector.select(List.of()).isEmpty());
    }
}
