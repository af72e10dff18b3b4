package com.stockpipe.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SelectionPick {
    public final String instrumentId;
    public final int rank;
    public final double score;
    public final String category;
    public final String rationale;
    public final Double close;
}
