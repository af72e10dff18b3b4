package com.stockpipe.jp.recommend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure reducer from a base record and the refinement layers to one final decision.
 *
 * <p>Layers are applied in the configured order; a later layer that has an entry for the
 * instrument replaces whatever an earlier one said. The override flag marks a refinement that
 * reverses (BUY against SELL) a base decision held with at least the configured confidence. The
 * refinement still wins.
 */
public final class RecommendationMergeEngine {
    private final ActionBands bands;
    private final List<String> layerOrder;
    private final Confidence overrideThreshold;

    public RecommendationMergeEngine(ActionBands bands, List<String> layerOrder, Confidence overrideThreshold) {
        if (bands == null) {
            throw new IllegalArgumentException("action bands are required");
        }
        this.bands = bands;
        this.layerOrder = layerOrder == null ? List.of() : List.copyOf(layerOrder);
        this.overrideThreshold = overrideThreshold == null ? Confidence.HIGH : overrideThreshold;
    }

    public ActionBands bands() {
        return bands;
    }

    public List<String> layerOrder() {
        return layerOrder;
    }

    /**
     * Base record for a raw score, classified through the action bands.
     */
    public RecommendationRecord baseFromScore(String instrumentId, double score) {
        Classification c = bands.classify(score);
        return RecommendationRecord.base(instrumentId, score, c.action(), c.confidence());
    }

    public RecommendationRecord merge(RecommendationRecord base, List<Refinement> refinements) {
        if (base == null) {
            throw new IllegalArgumentException("base record is required");
        }
        RecommendationRecord start = base.baseOnly();
        Refinement winner = null;
        if (refinements != null) {
            Map<String, Refinement> byLayer = new HashMap<>();
            for (Refinement refinement : refinements) {
                if (refinement == null) {
                    continue;
                }
                if (!base.instrumentId.equals(refinement.instrumentId)) {
                    throw new IllegalArgumentException("refinement for " + refinement.instrumentId
                            + " passed to merge of " + base.instrumentId);
                }
                if (!layerOrder.contains(refinement.layer)) {
                    throw new IllegalArgumentException("unknown refinement layer: " + refinement.layer);
                }
                byLayer.put(refinement.layer, refinement);
            }
            for (String layer : layerOrder) {
                Refinement candidate = byLayer.get(layer);
                if (candidate != null) {
                    winner = candidate;
                }
            }
        }
        if (winner == null) {
            return start;
        }
        return applyRefinement(start, winner);
    }

    /**
     * Merges every base record. Refinements for instruments without a base record are ignored.
     */
    public List<RecommendationRecord> mergeAll(List<RecommendationRecord> bases, List<Refinement> refinements) {
        Map<String, List<Refinement>> byInstrument = new LinkedHashMap<>();
        if (refinements != null) {
            for (Refinement refinement : refinements) {
                if (refinement != null && refinement.instrumentId != null) {
                    byInstrument.computeIfAbsent(refinement.instrumentId, k -> new ArrayList<>()).add(refinement);
                }
            }
        }
        List<RecommendationRecord> out = new ArrayList<>();
        if (bases == null) {
            return out;
        }
        for (RecommendationRecord base : bases) {
            out.add(merge(base, byInstrument.getOrDefault(base.instrumentId, List.of())));
        }
        return out;
    }

    private RecommendationRecord applyRefinement(RecommendationRecord base, Refinement refinement) {
        if (!Double.isFinite(refinement.score)) {
            throw new IllegalArgumentException("refinement score must be finite for " + refinement.instrumentId);
        }
        Classification c = bands.classify(refinement.score);
        Action refinedAction = refinement.action != null ? refinement.action : c.action();
        Confidence refinedConfidence = refinement.confidence != null ? refinement.confidence : c.confidence();
        boolean reversal = base.baseAction.isOpposite(refinedAction)
                && base.baseConfidence.atLeast(overrideThreshold);
        return base.toBuilder()
                .refinedScore(refinement.score)
                .refinedAction(refinedAction)
                .refinementSource(refinement.layer)
                .finalScore(refinement.score)
                .finalAction(refinedAction)
                .confidence(refinedConfidence)
                .hasRefinement(true)
                .overrideFlag(reversal)
                .build();
    }
}
