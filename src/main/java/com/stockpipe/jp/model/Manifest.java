package com.stockpipe.jp.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Desired state of the mutable prefix. Items are kept sorted by key.
 */
public final class Manifest {
    public final Instant generatedAt;
    public final List<ManifestItem> items;
    public final String note;

    public Manifest(Instant generatedAt, List<ManifestItem> items, String note) {
        this.generatedAt = generatedAt == null ? Instant.EPOCH : generatedAt;
        List<ManifestItem> sorted = new ArrayList<>(items == null ? List.of() : items);
        sorted.sort(Comparator.comparing(ManifestItem::key));
        this.items = List.copyOf(sorted);
        this.note = note == null ? "" : note;
    }

    public Set<String> keys() {
        Set<String> out = new LinkedHashSet<>();
        for (ManifestItem item : items) {
            out.add(item.key());
        }
        return out;
    }
}
