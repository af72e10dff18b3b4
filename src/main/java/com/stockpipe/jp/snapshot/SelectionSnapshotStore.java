package com.stockpipe.jp.snapshot;

import com.stockpipe.jp.error.BackupMissingException;
import com.stockpipe.jp.model.SelectionSnapshot;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * The live selection artifact. Reading is free; replacing it is a state transition that needs a
 * {@link BackupClearance} matching the artifact that is live at the moment of the write.
 */
public final class SelectionSnapshotStore {
    private static final Logger LOG = LogManager.getLogger(SelectionSnapshotStore.class);

    private final ObjectStore store;
    private final StoreLayout layout;

    public SelectionSnapshotStore(ObjectStore store, StoreLayout layout) {
        this.store = store;
        this.layout = layout;
    }

    public Optional<SelectionSnapshot> readLive() throws IOException {
        Optional<byte[]> bytes = store.get(layout.selectionKey());
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SelectionCodec.decode(bytes.get()));
    }

    public void overwrite(BackupClearance clearance, SelectionSnapshot next) throws IOException, BackupMissingException {
        if (clearance == null) {
            throw new IllegalStateException("overwrite of the live selection requires a backup clearance");
        }
        if (next == null) {
            throw new IllegalArgumentException("next selection is required");
        }
        LocalDate liveDate = readLive().map(s -> s.selectionDate).orElse(null);
        if (!Objects.equals(liveDate, clearance.protectedDate())) {
            throw new BackupMissingException(liveDate, false, false,
                    "live selection changed since verification (cleared=" + describe(clearance.protectedDate())
                            + ", live=" + describe(liveDate) + "); re-verify before overwriting");
        }
        if (liveDate != null && next.selectionDate.isBefore(liveDate)) {
            throw new IllegalArgumentException("refusing to replace selection " + liveDate
                    + " with older selection " + next.selectionDate);
        }
        if (next.selectionDate.equals(liveDate)) {
            throw new IllegalStateException("selection for " + liveDate + " is already live and archived");
        }
        if (!clearance.consume()) {
            throw new IllegalStateException("backup clearance already used: " + clearance);
        }
        store.put(layout.selectionKey(), SelectionCodec.encode(next));
        LOG.info("live selection replaced: {} -> {} ({} picks)", describe(liveDate), next.selectionDate, next.picks.size());
    }

    private static String describe(LocalDate date) {
        return date == null ? "empty" : date.toString();
    }
}
