package com.stockpipe.jp.model;

import java.time.Instant;

public record ManifestItem(String key, long sizeBytes, String checksum, Instant mtime) {
    public ManifestItem {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("manifest item key is required");
        }
        sizeBytes = Math.max(0L, sizeBytes);
        checksum = checksum == null ? "" : checksum;
        mtime = mtime == null ? Instant.EPOCH : mtime;
    }
}
