package com.stockpipe.jp.store;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local store used by tests and dry runs.
 */
public class InMemoryObjectStore implements ObjectStore {
    private final ConcurrentSkipListMap<String, StoredObject> objects = new ConcurrentSkipListMap<>();
    private final Clock clock;

    public InMemoryObjectStore() {
        this(Clock.systemUTC());
    }

    public InMemoryObjectStore(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Optional<byte[]> get(String key) throws IOException {
        StoredObject object = objects.get(requireKey(key));
        return object == null ? Optional.empty() : Optional.of(object.bytes.clone());
    }

    @Override
    public void put(String key, byte[] bytes) throws IOException {
        byte[] copy = bytes == null ? new byte[0] : bytes.clone();
        objects.put(requireKey(key), new StoredObject(copy, clock.instant()));
    }

    @Override
    public boolean delete(String key) throws IOException {
        return objects.remove(requireKey(key)) != null;
    }

    @Override
    public List<ObjectMeta> list(String prefix) throws IOException {
        String p = prefix == null ? "" : prefix;
        List<ObjectMeta> out = new ArrayList<>();
        for (Map.Entry<String, StoredObject> entry : objects.tailMap(p, true).entrySet()) {
            if (!entry.getKey().startsWith(p)) {
                break;
            }
            out.add(meta(entry.getKey(), entry.getValue()));
        }
        return out;
    }

    @Override
    public Optional<ObjectMeta> head(String key) throws IOException {
        StoredObject object = objects.get(requireKey(key));
        return object == null ? Optional.empty() : Optional.of(meta(key, object));
    }

    public int size() {
        return objects.size();
    }

    private ObjectMeta meta(String key, StoredObject object) {
        return new ObjectMeta(key, object.bytes.length, object.modifiedAt);
    }

    private String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("object key is required");
        }
        return key;
    }

    private static final class StoredObject {
        private final byte[] bytes;
        private final Instant modifiedAt;

        private StoredObject(byte[] bytes, Instant modifiedAt) {
            this.bytes = bytes;
            this.modifiedAt = modifiedAt;
        }
    }
}
