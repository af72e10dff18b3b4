package com.stockpipe.jp.manifest;

import java.util.List;
import java.util.Map;

public record ReconcileResult(
        boolean dryRun,
        ReconcilePlan plan,
        List<String> deleted,
        Map<String, String> failed
) {
    public ReconcileResult {
        deleted = deleted == null ? List.of() : List.copyOf(deleted);
        failed = failed == null ? Map.of() : Map.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
