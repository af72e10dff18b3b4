package com.stockpipe.jp.manifest;

import com.stockpipe.jp.model.Manifest;
import com.stockpipe.jp.model.ManifestItem;
import com.stockpipe.jp.store.ObjectMeta;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import com.stockpipe.utils.Checksums;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Regenerates the manifest from the objects a run declares as the desired mutable state.
 */
public final class ManifestPublisher {
    private static final Logger LOG = LogManager.getLogger(ManifestPublisher.class);
    static final String NOTE = "desired objects under the mutable prefix; archival prefix and this file are never reconciled";

    private final ObjectStore store;
    private final StoreLayout layout;
    private final Clock clock;
    private final List<String> extraKeys;

    public ManifestPublisher(ObjectStore store, StoreLayout layout, Clock clock, List<String> extraKeys) {
        this.store = store;
        this.layout = layout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.extraKeys = extraKeys == null ? List.of() : List.copyOf(extraKeys);
    }

    public Manifest publish(Collection<String> declaredKeys) throws IOException {
        Set<String> keys = new LinkedHashSet<>();
        if (declaredKeys != null) {
            keys.addAll(declaredKeys);
        }
        keys.addAll(extraKeys);

        List<ManifestItem> items = new ArrayList<>();
        for (String key : keys) {
            if (key == null || key.isBlank()) {
                continue;
            }
            if (key.equals(layout.manifestKey()) || !layout.isMutable(key)) {
                LOG.warn("not declaring {} in manifest: outside the reconcilable prefix", key);
                continue;
            }
            Optional<byte[]> bytes = store.get(key);
            if (bytes.isEmpty()) {
                LOG.debug("declared object absent, omitted from manifest: {}", key);
                continue;
            }
            Optional<ObjectMeta> meta = store.head(key);
            items.add(new ManifestItem(
                    key,
                    bytes.get().length,
                    Checksums.sha256Hex(bytes.get()),
                    meta.map(ObjectMeta::lastModified).orElse(clock.instant())
            ));
        }
        Manifest manifest = new Manifest(clock.instant(), items, NOTE);
        store.put(layout.manifestKey(), ManifestCodec.encode(manifest));
        LOG.info("manifest published: {} item(s) at {}", manifest.items.size(), layout.manifestKey());
        return manifest;
    }

    public Optional<Manifest> read() throws IOException {
        Optional<byte[]> bytes = store.get(layout.manifestKey());
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ManifestCodec.decode(bytes.get()));
    }
}
