package com.stockpipe.jp.recommend;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecommendationMergeEngineTest {
    private final RecommendationMergeEngine engine = new RecommendationMergeEngine(
            ActionBands.parse("SELL:HIGH:-inf:-30,SELL:MEDIUM:-30:-15,HOLD:MEDIUM:-15:20,BUY:MEDIUM:20:40,BUY:HIGH:40:inf"),
            List.of("quick", "deep"),
            Confidence.HIGH
    );

    @Test
    void merge_shouldKeepBaseWhenNoRefinementExists() {
        RecommendationRecord base = engine.baseFromScore("7203", 25.0);

        RecommendationRecord merged = engine.merge(base, List.of());

        assertFalse(merged.hasRefinement);
        assertEquals(Action.BUY, merged.finalAction);
        assertEquals(Confidence.MEDIUM, merged.confidence);
        assertEquals(25.0, merged.finalScore, 1e-9);
        assertNull(merged.refinedScore);
    }

    @Test
    void merge_shouldLetRefinementDecideAndKeepBaseFields() {
        RecommendationRecord base = engine.baseFromScore("7203", 0.0);

        RecommendationRecord merged = engine.merge(base, List.of(refinement("deep", "7203", 45.0)));

        assertTrue(merged.hasRefinement);
        assertEquals("deep", merged.refinementSource);
        assertEquals(Action.BUY, merged.finalAction);
        assertEquals(Confidence.HIGH, merged.confidence);
        assertEquals(45.0, merged.refinedScore, 1e-9);
        assertEquals(Action.HOLD, merged.baseAction);
        assertEquals(0.0, merged.baseScore, 1e-9);
        assertFalse(merged.overrideFlag);
    }

    @Test
    void merge_shouldPreferExplicitRefinementActionAndConfidence() {
        RecommendationRecord base = engine.baseFromScore("6758", 5.0);
        Refinement explicit = new Refinement("quick", "6758", 5.0, Action.SELL, Confidence.LOW, "guidance cut");

        RecommendationRecord merged = engine.merge(base, List.of(explicit));

        assertEquals(Action.SELL, merged.finalAction);
        assertEquals(Confidence.LOW, merged.confidence);
    }

    @Test
    void merge_shouldFlagReversalOfHighConfidenceBase() {
        RecommendationRecord strongSell = engine.baseFromScore("9984", -45.0);
        RecommendationRecord mildSell = engine.baseFromScore("9983", -20.0);

        RecommendationRecord reversed = engine.merge(strongSell, List.of(refinement("deep", "9984", 30.0)));
        RecommendationRecord mild = engine.merge(mildSell, List.of(refinement("deep", "9983", 30.0)));

        assertTrue(reversed.overrideFlag);
        assertEquals(Action.BUY, reversed.finalAction);
        assertFalse(mild.overrideFlag);
    }

    @Test
    void merge_shouldApplyLayersInConfiguredOrder() {
        RecommendationRecord base = engine.baseFromScore("7203", 0.0);

        RecommendationRecord merged = engine.merge(base, List.of(
                refinement("deep", "7203", -50.0),
                refinement("quick", "7203", 50.0)
        ));

        assertEquals("deep", merged.refinementSource);
        assertEquals(Action.SELL, merged.finalAction);
    }

    @Test
    void merge_shouldBeDeterministicAndIgnorePriorRefinement() {
        RecommendationRecord base = engine.baseFromScore("7203", 0.0);
        List<Refinement> refinements = List.of(refinement("quick", "7203", 30.0));

        RecommendationRecord once = engine.merge(base, refinements);
        RecommendationRecord twice = engine.merge(once, refinements);

        assertEquals(once, twice);
    }

    @Test
    void merge_shouldRejectForeignOrUnknownRefinements() {
        RecommendationRecord base = engine.baseFromScore("7203", 0.0);

        assertThrows(IllegalArgumentException.class,
                () -> engine.merge(base, List.of(refinement("deep", "6758", 10.0))));
        assertThrows(IllegalArgumentException.class,
                () -> engine.merge(base, List.of(refinement("manual", "7203", 10.0))));
    }

    @Test
    void mergeAll_shouldIgnoreRefinementsWithoutBase() {
        List<RecommendationRecord> merged = engine.mergeAll(
                List.of(engine.baseFromScore("7203", 10.0), engine.baseFromScore("6758", -10.0)),
                List.of(refinement("deep", "6758", 50.0), refinement("deep", "0000", 50.0)));

        assertEquals(2, merged.size());
        assertFalse(merged.get(0).hasRefinement);
        assertTrue(merged.get(1).hasRefinement);
    }

    private static Refinement refinement(String layer, String instrumentId, double score) {
        return new Refinement(layer, instrumentId, score, null, null, "");
    }
}
