package com.stockpipe.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * One archived pick. Immutable and unique by (selectionDate, instrumentId).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ArchiveEntry {
    public final LocalDate selectionDate;
    public final String instrumentId;
    public final Map<String, Double> metricsSnapshot;
    public final Instant createdAt;

    public Key key() {
        return new Key(selectionDate, instrumentId);
    }

    public record Key(LocalDate selectionDate, String instrumentId) {
        @Override
        public String toString() {
            return selectionDate + "/" + instrumentId;
        }
    }
}
