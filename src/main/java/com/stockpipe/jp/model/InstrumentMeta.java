package com.stockpipe.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class InstrumentMeta {
    public final String instrumentId;
    public final String name;
    public final String market;
}
