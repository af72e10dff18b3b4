package com.stockpipe.jp.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 模块说明：SelectionSnapshot（class）。
 * 主要职责：表示某个选股日期的一整份选股结果，既用于当前可覆盖的实时产物，也用于按日期归档的快照。
 * 使用建议：实时产物只能经由 SelectionSnapshotStore 在备份校验通过后覆盖。
 */
public final class SelectionSnapshot {
    public final LocalDate selectionDate;
    public final Instant createdAt;
    public final List<SelectionPick> picks;

    public SelectionSnapshot(LocalDate selectionDate, Instant createdAt, List<SelectionPick> picks) {
        if (selectionDate == null) {
            throw new IllegalArgumentException("selectionDate is required");
        }
        this.selectionDate = selectionDate;
        this.createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        this.picks = picks == null ? List.of() : List.copyOf(picks);
    }

    public boolean isEmpty() {
        return picks.isEmpty();
    }
}
