package com.stockpipe.jp.recommend;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-instrument decision. {@code final*} equals {@code refined*} when {@code hasRefinement},
 * otherwise {@code base*}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RecommendationRecord {
    public final String instrumentId;
    public final double baseScore;
    public final Action baseAction;
    public final Confidence baseConfidence;
    public final Double refinedScore;
    public final Action refinedAction;
    public final String refinementSource;
    public final double finalScore;
    public final Action finalAction;
    public final Confidence confidence;
    public final boolean hasRefinement;
    public final boolean overrideFlag;

    public static RecommendationRecord base(String instrumentId, double score, Action action, Confidence confidence) {
        if (instrumentId == null || instrumentId.isBlank()) {
            throw new IllegalArgumentException("instrumentId is required");
        }
        if (action == null || confidence == null) {
            throw new IllegalArgumentException("base action and confidence are required for " + instrumentId);
        }
        return RecommendationRecord.builder()
                .instrumentId(instrumentId)
                .baseScore(score)
                .baseAction(action)
                .baseConfidence(confidence)
                .finalScore(score)
                .finalAction(action)
                .confidence(confidence)
                .hasRefinement(false)
                .overrideFlag(false)
                .build();
    }

    /**
     * Drops any refinement, returning the record as the base pass produced it.
     */
    public RecommendationRecord baseOnly() {
        return base(instrumentId, baseScore, baseAction, baseConfidence);
    }
}
