package com.stockpipe.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PriceSeries {
    public final String instrumentId;
    public final String period;
    public final String interval;
    public final List<PriceBar> bars;
    public final Instant fetchedAt;

    public Double lastClose() {
        if (bars == null || bars.isEmpty()) {
            return null;
        }
        return bars.get(bars.size() - 1).close;
    }
}
