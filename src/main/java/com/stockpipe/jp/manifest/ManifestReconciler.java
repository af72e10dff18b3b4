package com.stockpipe.jp.manifest;

import com.stockpipe.jp.error.ManifestDriftException;
import com.stockpipe.jp.model.Manifest;
import com.stockpipe.jp.store.ObjectMeta;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 模块说明：ManifestReconciler（class）。
 * 主要职责：比较 manifest 声明的期望对象集合与存储中可变前缀下的实际对象，找出并（仅在 apply 时）删除孤儿对象。
 * 使用建议：默认 dry-run；manifest 本身、归档前缀与目录占位对象永远不会成为删除候选。由运维手动触发，不随刷新流程执行。
 */
public final class ManifestReconciler {
    private static final Logger LOG = LogManager.getLogger(ManifestReconciler.class);

    private final ObjectStore store;
    private final StoreLayout layout;
    private final int maxDelete;

    public ManifestReconciler(ObjectStore store, StoreLayout layout, int maxDelete) {
        this.store = store;
        this.layout = layout;
        this.maxDelete = Math.max(0, maxDelete);
    }

    public ReconcilePlan plan() throws IOException {
        Manifest manifest = requireManifest();
        Set<String> desired = manifest.keys();
        List<ObjectMeta> actual = store.list(layout.mutablePrefix());

        List<String> toDelete = new ArrayList<>();
        List<String> protectedKeys = new ArrayList<>();
        Set<String> present = new TreeSet<>();
        for (ObjectMeta meta : actual) {
            String key = meta.key();
            present.add(key);
            if (isProtected(key)) {
                protectedKeys.add(key);
                continue;
            }
            if (!desired.contains(key)) {
                toDelete.add(key);
            }
        }
        List<String> missing = new ArrayList<>();
        for (String key : desired) {
            if (!present.contains(key)) {
                missing.add(key);
            }
        }
        toDelete.sort(String::compareTo);
        return new ReconcilePlan(manifest.generatedAt, desired.size(), actual.size(), toDelete, protectedKeys, missing);
    }

    /**
     * Dry run. Never deletes.
     */
    public ReconcileResult dryRun() throws IOException {
        ReconcilePlan plan = plan();
        for (String key : plan.toDelete()) {
            LOG.info("[dry-run] would delete {}", key);
        }
        return new ReconcileResult(true, plan, List.of(), Map.of());
    }

    /**
     * Deletes exactly the orphans found by a fresh plan. Per-key failures are collected, not fatal.
     *
     * @param force allow more deletions than {@code reconcile.max_delete}
     */
    public ReconcileResult apply(boolean force) throws IOException {
        ReconcilePlan plan = plan();
        if (!force && plan.toDelete().size() > maxDelete) {
            throw new IllegalStateException("refusing to delete " + plan.toDelete().size()
                    + " objects (limit " + maxDelete + "); re-run with force after reviewing the dry run");
        }
        List<String> deleted = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String key : plan.toDelete()) {
            try {
                if (store.delete(key)) {
                    deleted.add(key);
                    LOG.info("deleted orphan {}", key);
                } else {
                    LOG.info("orphan already gone {}", key);
                }
            } catch (IOException | RuntimeException e) {
                failed.put(key, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                LOG.warn("failed to delete {}: {}", key, e.getMessage());
            }
        }
        return new ReconcileResult(false, plan, deleted, failed);
    }

    /**
     * @throws ManifestDriftException when undeclared objects exist under the mutable prefix
     */
    public void check() throws IOException, ManifestDriftException {
        ReconcilePlan plan = plan();
        if (!plan.inSync()) {
            throw new ManifestDriftException(plan.toDelete());
        }
    }

    private boolean isProtected(String key) {
        return key.equals(layout.manifestKey())
                || layout.isArchival(key)
                || key.endsWith("/");
    }

    private Manifest requireManifest() throws IOException {
        Optional<byte[]> bytes = store.get(layout.manifestKey());
        if (bytes.isEmpty()) {
            throw new IllegalStateException("manifest " + layout.manifestKey()
                    + " not found; refusing to reconcile without a declared desired state");
        }
        return ManifestCodec.decode(bytes.get());
    }
}
