package com.stockpipe.jp.snapshot;

import com.stockpipe.jp.archive.ArchiveCodec;
import com.stockpipe.jp.error.BackupMissingException;
import com.stockpipe.jp.model.ArchiveEntry;
import com.stockpipe.jp.model.SelectionPick;
import com.stockpipe.jp.model.SelectionSnapshot;
import com.stockpipe.jp.store.InMemoryObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackupVerifierTest {
    private static final LocalDate DAY = LocalDate.of(2024, 5, 9);
    private static final Instant NOW = Instant.parse("2024-05-10T14:30:00Z");

    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private final StoreLayout layout = StoreLayout.defaults();
    private final BackupVerifier verifier = new BackupVerifier(store, layout, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void verify_shouldPassWhenSnapshotAndArchiveRowExist() throws Exception {
        putSnapshot(DAY);
        putArchiveRow(DAY);

        BackupClearance clearance = verifier.verify(DAY);

        assertEquals(DAY, clearance.protectedDate());
        assertEquals(NOW, clearance.verifiedAt());
        assertFalse(clearance.coversEmptyArtifact());
    }

    @Test
    void verify_shouldRejectWhenArchiveRowIsMissing() throws Exception {
        putSnapshot(DAY);
        putArchiveRow(DAY.minusDays(1));

        BackupMissingException e = assertThrows(BackupMissingException.class, () -> verifier.verify(DAY));

        assertEquals(DAY, e.date());
        assertTrue(e.snapshotPresent());
        assertFalse(e.archiveRowPresent());
    }

    @Test
    void verify_shouldRejectWhenSnapshotIsMissing() throws Exception {
        putArchiveRow(DAY);

        BackupMissingException e = assertThrows(BackupMissingException.class, () -> verifier.verify(DAY));

        assertFalse(e.snapshotPresent());
        assertTrue(e.archiveRowPresent());
    }

    @Test
    void verifyLive_shouldIssueEmptyClearanceWithoutLiveArtifact() throws Exception {
        BackupClearance clearance = verifier.verifyLive();

        assertTrue(clearance.coversEmptyArtifact());
        assertNull(clearance.protectedDate());
    }

    @Test
    void verifyLive_shouldCheckTheLiveArtifactsDate() throws Exception {
        store.put(layout.selectionKey(), SelectionCodec.encode(selection(DAY)));

        assertThrows(BackupMissingException.class, verifier::verifyLive);

        putSnapshot(DAY);
        putArchiveRow(DAY);
        assertEquals(DAY, verifier.verifyLive().protectedDate());
    }

    @Test
    void verifyLive_shouldRejectUnreadableArtifacts() throws Exception {
        store.put(layout.selectionKey(), "not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(BackupMissingException.class, verifier::verifyLive);

        store.put(layout.selectionKey(), SelectionCodec.encode(selection(DAY)));
        putSnapshot(DAY);
        store.put(layout.archiveKey(), "{broken".getBytes(StandardCharsets.UTF_8));
        assertThrows(BackupMissingException.class, verifier::verifyLive);
    }

    private void putSnapshot(LocalDate date) throws Exception {
        store.put(layout.snapshotKey(date), SelectionCodec.encode(selection(date)));
    }

    private void putArchiveRow(LocalDate date) throws Exception {
        store.put(layout.archiveKey(), ArchiveCodec.encode(List.of(
                new ArchiveEntry(date, "7203", Map.of("rank", 1.0), NOW))));
    }

    private static SelectionSnapshot selection(LocalDate date) {
        return new SelectionSnapshot(date, NOW, List.of(new SelectionPick("7203", 1, 55.0, "core", "", 2040.0)));
    }
}
