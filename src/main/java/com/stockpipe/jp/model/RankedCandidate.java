package com.stockpipe.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One item of the external ranking service's answer. Score, category and rationale are opaque.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RankedCandidate {
    public final String instrumentId;
    public final double score;
    public final String category;
    public final String rationale;
}
