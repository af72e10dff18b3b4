package com.stockpipe.jp.manifest;

import com.stockpipe.jp.error.ManifestDriftException;
import com.stockpipe.jp.store.InMemoryObjectStore;
import com.stockpipe.jp.store.ObjectMeta;
import com.stockpipe.jp.store.StoreLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestReconcilerTest {
    private static final String A = "parquet/a.json";
    private static final String B = "parquet/b.json";
    private static final String C = "parquet/c.json";

    private final StoreLayout layout = StoreLayout.defaults();
    private InMemoryObjectStore store;

    @BeforeEach
    void seed() throws IOException {
        store = new InMemoryObjectStore();
        put(A);
        put(B);
        new ManifestPublisher(store, layout, Clock.fixed(Instant.parse("2024-05-10T15:00:00Z"), ZoneOffset.UTC), List.of())
                .publish(List.of(A, B));
        put(C);
        put(layout.archiveKey());
        put(layout.snapshotKey(LocalDate.of(2024, 5, 9)));
        put("parquet/backtest/");
        put("other/outside.json");
    }

    @Test
    void dryRun_shouldListOrphansAndDeleteNothing() throws Exception {
        int before = store.size();

        ReconcileResult result = new ManifestReconciler(store, layout, 50).dryRun();

        assertTrue(result.dryRun());
        assertEquals(List.of(C), result.plan().toDelete());
        assertTrue(result.deleted().isEmpty());
        assertEquals(before, store.size());
    }

    @Test
    void apply_shouldDeleteExactlyTheOrphans() throws Exception {
        ReconcileResult result = new ManifestReconciler(store, layout, 50).apply(false);

        assertEquals(List.of(C), result.deleted());
        assertFalse(store.exists(C));
        assertTrue(store.exists(A));
        assertTrue(store.exists(B));
        assertTrue(store.exists(layout.manifestKey()));
        assertTrue(store.exists(layout.archiveKey()));
        assertTrue(store.exists("parquet/backtest/"));
        assertTrue(store.exists("other/outside.json"));
        assertTrue(new ManifestReconciler(store, layout, 50).plan().inSync());
    }

    @Test
    void plan_shouldReportMissingDeclaredObjects() throws Exception {
        store.delete(B);

        ReconcilePlan plan = new ManifestReconciler(store, layout, 50).plan();

        assertEquals(List.of(B), plan.missing());
        assertEquals(2, plan.desiredCount());
    }

    @Test
    void reconcile_shouldRefuseWithoutManifest() throws Exception {
        store.delete(layout.manifestKey());
        ManifestReconciler reconciler = new ManifestReconciler(store, layout, 50);

        assertThrows(IllegalStateException.class, reconciler::dryRun);
        assertThrows(IllegalStateException.class, () -> reconciler.apply(true));
        assertTrue(store.exists(C));
    }

    @Test
    void apply_shouldRespectDeleteCapUnlessForced() throws Exception {
        put("parquet/d.json");
        ManifestReconciler reconciler = new ManifestReconciler(store, layout, 1);

        assertThrows(IllegalStateException.class, () -> reconciler.apply(false));
        assertTrue(store.exists(C));

        ReconcileResult forced = reconciler.apply(true);
        assertEquals(List.of(C, "parquet/d.json"), forced.deleted());
    }

    @Test
    void apply_shouldCollectPerKeyFailures() throws Exception {
        put("parquet/d.json");
        InMemoryObjectStore failing = new InMemoryObjectStore() {
            @Override
            public boolean delete(String key) throws IOException {
                if (key.equals(C)) {
                    throw new IOException("permission denied");
                }
                return store.delete(key);
            }

            @Override
            public Optional<byte[]> get(String key) throws IOException {
                return store.get(key);
            }

            @Override
            public List<ObjectMeta> list(String prefix) throws IOException {
                return store.list(prefix);
            }
        };

        ReconcileResult result = new ManifestReconciler(failing, layout, 50).apply(false);

        assertTrue(result.hasFailures());
        assertEquals("permission denied", result.failed().get(C));
        assertEquals(List.of("parquet/d.json"), result.deleted());
        assertTrue(store.exists(C));
    }

    @Test
    void check_shouldRaiseDrift() throws Exception {
        ManifestReconciler reconciler = new ManifestReconciler(store, layout, 50);

        ManifestDriftException drift = assertThrows(ManifestDriftException.class, reconciler::check);
        assertEquals(List.of(C), drift.orphanKeys());

        reconciler.apply(false);
        reconciler.check();
    }

    private void put(String key) throws IOException {
        store.put(key, key.getBytes(StandardCharsets.UTF_8));
    }
}
