package com.stockpipe.jp.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Minimal durable key/value object store. No transactions and no locks: callers must keep their
 * own writes safe under duplicate or overlapping execution.
 */
public interface ObjectStore {

    Optional<byte[]> get(String key) throws IOException;

    /**
     * Replaces the whole object. Readers never observe a partially written value.
     */
    void put(String key, byte[] bytes) throws IOException;

    /**
     * @return true when an object was removed
     */
    boolean delete(String key) throws IOException;

    /**
     * Lists every object whose key starts with {@code prefix}, sorted by key.
     */
    List<ObjectMeta> list(String prefix) throws IOException;

    /**
     * Existence and size check without downloading the object.
     */
    Optional<ObjectMeta> head(String key) throws IOException;

    default Optional<String> getText(String key) throws IOException {
        Optional<byte[]> bytes = get(key);
        return bytes.map(b -> new String(b, StandardCharsets.UTF_8));
    }

    default void putText(String key, String text) throws IOException {
        put(key, (text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
    }

    default boolean exists(String key) throws IOException {
        return head(key).isPresent();
    }
}
