package com.stockpipe.jp.manifest;

import java.time.Instant;
import java.util.List;

/**
 * @param toDelete   undeclared objects under the mutable prefix, sorted
 * @param protectedKeys objects under the prefix that are never candidates (manifest, archive, placeholders)
 * @param missing    declared objects not present in the store
 */
public record ReconcilePlan(
        Instant manifestGeneratedAt,
        int desiredCount,
        int actualCount,
        List<String> toDelete,
        List<String> protectedKeys,
        List<String> missing
) {
    public ReconcilePlan {
        toDelete = toDelete == null ? List.of() : List.copyOf(toDelete);
        protectedKeys = protectedKeys == null ? List.of() : List.copyOf(protectedKeys);
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public boolean inSync() {
        return toDelete.isEmpty();
    }
}
