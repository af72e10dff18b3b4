package com.stockpipe.jp.archive;

import com.stockpipe.jp.model.ArchiveEntry;
import com.stockpipe.jp.model.SelectionPick;
import com.stockpipe.jp.model.SelectionSnapshot;
import com.stockpipe.jp.snapshot.SelectionCodec;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 模块说明：ArchiveWriter（class）。
 * 主要职责：以 (selectionDate, instrumentId) 为唯一键向滚动归档追加行，并一次性写入按日快照对象。
 * 使用建议：已存在的键只跳过不修改；写后重读校验，若被并发写入覆盖丢失则重新合并，归档只增不减。
 */
public final class ArchiveWriter {
    private static final Logger LOG = LogManager.getLogger(ArchiveWriter.class);

    private final ObjectStore store;
    private final StoreLayout layout;
    private final Clock clock;
    private final int maxAttempts;

    public ArchiveWriter(ObjectStore store, StoreLayout layout, Clock clock, int maxAttempts) {
        this.store = store;
        this.layout = layout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Archives a whole selection: the per-date snapshot object first, then one row per pick.
     */
    public ArchiveWriteResult archiveSelection(SelectionSnapshot selection) throws IOException {
        if (selection == null || selection.isEmpty()) {
            return ArchiveWriteResult.empty();
        }
        boolean snapshotWritten = writeSnapshotOnce(selection);
        Instant now = clock.instant();
        List<ArchiveEntry> batch = new ArrayList<>();
        for (SelectionPick pick : selection.picks) {
            batch.add(new ArchiveEntry(selection.selectionDate, pick.instrumentId, metricsOf(pick), now));
        }
        return append(batch).withSnapshotWritten(snapshotWritten);
    }

    public ArchiveWriteResult append(List<ArchiveEntry> batch) throws IOException {
        Map<ArchiveEntry.Key, ArchiveEntry> wanted = new LinkedHashMap<>();
        if (batch != null) {
            for (ArchiveEntry entry : batch) {
                if (entry == null || entry.selectionDate == null || entry.instrumentId == null) {
                    throw new IllegalArgumentException("archive entry needs selectionDate and instrumentId: " + entry);
                }
                wanted.putIfAbsent(entry.key(), entry);
            }
        }
        if (wanted.isEmpty()) {
            return ArchiveWriteResult.empty();
        }

        Set<ArchiveEntry.Key> preexisting = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            List<ArchiveEntry> current = readAll();
            Set<ArchiveEntry.Key> present = keysOf(current);
            if (preexisting == null) {
                preexisting = new HashSet<>(present);
                preexisting.retainAll(wanted.keySet());
                for (ArchiveEntry.Key key : preexisting) {
                    LOG.info("archive row exists, skipping {}", key);
                }
            }
            List<ArchiveEntry> missing = new ArrayList<>();
            for (Map.Entry<ArchiveEntry.Key, ArchiveEntry> entry : wanted.entrySet()) {
                if (!present.contains(entry.getKey())) {
                    missing.add(entry.getValue());
                }
            }
            if (missing.isEmpty()) {
                return result(wanted.size(), preexisting.size(), attempt);
            }

            List<ArchiveEntry> merged = new ArrayList<>(current.size() + missing.size());
            merged.addAll(current);
            merged.addAll(missing);
            store.put(layout.archiveKey(), ArchiveCodec.encode(merged));

            Set<ArchiveEntry.Key> after = keysOf(readAll());
            if (after.containsAll(wanted.keySet())) {
                return result(wanted.size(), preexisting.size(), attempt);
            }
            LOG.warn("archive lost rows to a concurrent writer (attempt {}/{}), re-merging", attempt, maxAttempts);
        }
        throw new IOException("archive write did not converge after " + maxAttempts + " attempts");
    }

    public List<ArchiveEntry> readAll() throws IOException {
        Optional<byte[]> bytes = store.get(layout.archiveKey());
        if (bytes.isEmpty()) {
            return new ArrayList<>();
        }
        return ArchiveCodec.decode(bytes.get());
    }

    private boolean writeSnapshotOnce(SelectionSnapshot selection) throws IOException {
        String key = layout.snapshotKey(selection.selectionDate);
        if (store.head(key).isPresent()) {
            LOG.info("per-date snapshot already archived: {}", key);
            return false;
        }
        store.put(key, SelectionCodec.encode(selection));
        LOG.info("per-date snapshot archived: {}", key);
        return true;
    }

    private ArchiveWriteResult result(int wanted, int skipped, int attempts) {
        ArchiveWriteResult result = new ArchiveWriteResult(wanted - skipped, skipped, false, attempts);
        LOG.info("archive write appended={} skipped={} attempts={}", result.appended(), result.skipped(), attempts);
        return result;
    }

    private static Set<ArchiveEntry.Key> keysOf(List<ArchiveEntry> rows) {
        Set<ArchiveEntry.Key> out = new HashSet<>();
        for (ArchiveEntry row : rows) {
            out.add(row.key());
        }
        return out;
    }

    private static Map<String, Double> metricsOf(SelectionPick pick) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("rank", (double) pick.rank);
        metrics.put("score", pick.score);
        if (pick.close != null) {
            metrics.put("close", pick.close);
        }
        return metrics;
    }
}
