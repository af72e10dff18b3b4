package com.stockpipe.jp.recommend;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A later re-scoring of one instrument by a named layer. {@code action} and {@code confidence}
 * are optional; when absent they come from the action bands.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Refinement {
    public final String layer;
    public final String instrumentId;
    public final double score;
    public final Action action;
    public final Confidence confidence;
    public final String rationale;
}
