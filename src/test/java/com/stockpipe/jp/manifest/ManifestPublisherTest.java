package com.stockpipe.jp.manifest;

import com.stockpipe.jp.model.Manifest;
import com.stockpipe.jp.model.ManifestItem;
import com.stockpipe.jp.store.InMemoryObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import com.stockpipe.utils.Checksums;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ManifestPublisherTest {
    private static final Instant NOW = Instant.parse("2024-05-10T15:00:00Z");

    @Test
    void publish_shouldDeclarePresentMutableObjectsOnly() throws Exception {
        InMemoryObjectStore store = new InMemoryObjectStore(Clock.fixed(NOW, ZoneOffset.UTC));
        StoreLayout layout = StoreLayout.defaults();
        byte[] selection = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
        store.put(layout.selectionKey(), selection);
        store.put(layout.metadataKey(), "{}".getBytes(StandardCharsets.UTF_8));
        store.put("parquet/extra.json", "x".getBytes(StandardCharsets.UTF_8));
        ManifestPublisher publisher = new ManifestPublisher(store, layout, Clock.fixed(NOW, ZoneOffset.UTC),
                List.of("parquet/extra.json"));

        Manifest manifest = publisher.publish(List.of(
                layout.selectionKey(),
                layout.metadataKey(),
                layout.pricesKey(),
                layout.archiveKey(),
                layout.manifestKey(),
                "runs/2024-05-10/x.json"
        ));

        assertEquals(List.of("parquet/extra.json", "parquet/meta.json", "parquet/selection_current.json"),
                List.copyOf(manifest.keys()));
        ManifestItem item = manifest.items.get(2);
        assertEquals(selection.length, item.sizeBytes());
        assertEquals(Checksums.sha256Hex(selection), item.checksum());
        assertEquals(NOW, item.mtime());
        assertEquals(NOW, manifest.generatedAt);

        Manifest stored = publisher.read().orElseThrow();
        assertEquals(manifest.keys(), stored.keys());
        assertEquals(ManifestPublisher.NOTE, stored.note);
    }
}
