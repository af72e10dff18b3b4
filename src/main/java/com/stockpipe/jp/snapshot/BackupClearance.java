package com.stockpipe.jp.snapshot;

import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof that the live selection artifact dated {@link #protectedDate()} is durably archived.
 * Only {@link BackupVerifier} can issue one and {@link SelectionSnapshotStore} accepts each token once.
 */
public final class BackupClearance {
    private final LocalDate protectedDate;
    private final Instant verifiedAt;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    BackupClearance(LocalDate protectedDate, Instant verifiedAt) {
        this.protectedDate = protectedDate;
        this.verifiedAt = verifiedAt;
    }

    /**
     * @return date of the artifact that may be superseded, or null when there was no live artifact
     */
    public LocalDate protectedDate() {
        return protectedDate;
    }

    public Instant verifiedAt() {
        return verifiedAt;
    }

    public boolean coversEmptyArtifact() {
        return protectedDate == null;
    }

    boolean consume() {
        return consumed.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "BackupClearance{" + (protectedDate == null ? "empty" : protectedDate) + " @" + verifiedAt + "}";
    }
}
