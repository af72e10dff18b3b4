package com.stockpipe.jp.store;

import java.time.Instant;

public record ObjectMeta(String key, long sizeBytes, Instant lastModified) {
    public ObjectMeta {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
        sizeBytes = Math.max(0L, sizeBytes);
        lastModified = lastModified == null ? Instant.EPOCH : lastModified;
    }
}
