package com.stockpipe.jp.snapshot;

import com.stockpipe.jp.archive.ArchiveCodec;
import com.stockpipe.jp.error.BackupMissingException;
import com.stockpipe.jp.model.ArchiveEntry;
import com.stockpipe.jp.model.SelectionSnapshot;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 模块说明：BackupVerifier（class）。
 * 主要职责：覆盖实时选股产物之前，确认其日期的按日快照对象与滚动归档中的对应行同时存在。
 * 使用建议：任一标记缺失即拒绝（抛出 BackupMissingException），不允许"警告后继续"。
 */
public final class BackupVerifier {
    private static final Logger LOG = LogManager.getLogger(BackupVerifier.class);

    private final ObjectStore store;
    private final StoreLayout layout;
    private final Clock clock;

    public BackupVerifier(ObjectStore store, StoreLayout layout, Clock clock) {
        this.store = store;
        this.layout = layout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Verifies the date of whatever is currently live.
     */
    public BackupClearance verifyLive() throws BackupMissingException {
        Optional<byte[]> live;
        try {
            live = store.get(layout.selectionKey());
        } catch (IOException e) {
            throw new BackupMissingException(null, "cannot read live selection artifact: " + e.getMessage(), e);
        }
        if (live.isEmpty()) {
            LOG.info("no live selection artifact at {}, nothing to protect", layout.selectionKey());
            return new BackupClearance(null, clock.instant());
        }
        SelectionSnapshot snapshot;
        try {
            snapshot = SelectionCodec.decode(live.get());
        } catch (IOException e) {
            throw new BackupMissingException(null, "live selection artifact is unreadable, refusing to overwrite: "
                    + e.getMessage(), e);
        }
        return verify(snapshot.selectionDate);
    }

    public BackupClearance verify(LocalDate date) throws BackupMissingException {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        boolean snapshot;
        boolean archived;
        try {
            snapshot = snapshotExists(date);
            archived = archiveContains(date);
        } catch (IOException e) {
            throw new BackupMissingException(date, "backup markers unreadable for " + date + ": " + e.getMessage(), e);
        }
        if (!snapshot || !archived) {
            String message = "backup missing for " + date
                    + " (snapshot=" + snapshot + ", archive_row=" + archived + "); aborting to prevent data loss";
            LOG.error(message);
            throw new BackupMissingException(date, snapshot, archived, message);
        }
        LOG.info("backup verified for {}", date);
        return new BackupClearance(date, clock.instant());
    }

    public boolean snapshotExists(LocalDate date) throws IOException {
        return store.head(layout.snapshotKey(date)).isPresent();
    }

    public boolean archiveContains(LocalDate date) throws IOException {
        Optional<byte[]> bytes = store.get(layout.archiveKey());
        if (bytes.isEmpty()) {
            return false;
        }
        List<ArchiveEntry> rows = ArchiveCodec.decode(bytes.get());
        for (ArchiveEntry row : rows) {
            if (date.equals(row.selectionDate)) {
                return true;
            }
        }
        return false;
    }
}
