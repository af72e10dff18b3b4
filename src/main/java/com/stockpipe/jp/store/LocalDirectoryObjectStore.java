package com.stockpipe.jp.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 模块说明：LocalDirectoryObjectStore（class）。
 * 主要职责：以本地目录模拟对象存储，key 中的 "/" 映射为子目录，写入采用临时文件加原子替换。
 * 使用建议：只用于单机部署与测试；多个进程共享同一目录时仍然没有锁。
 */
public final class LocalDirectoryObjectStore implements ObjectStore {
    private static final Logger LOG = LogManager.getLogger(LocalDirectoryObjectStore.class);
    private static final String TMP_PREFIX = ".tmp-";

    private final Path root;

    public LocalDirectoryObjectStore(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("store root is required");
        }
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public Optional<byte[]> get(String key) throws IOException {
        Path file = resolve(key);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, byte[] bytes) throws IOException {
        Path target = resolve(key);
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, TMP_PREFIX, ".part");
        try {
            Files.write(tmp, bytes == null ? new byte[0] : bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("atomic move not supported under {}, falling back to replace", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public boolean delete(String key) throws IOException {
        return Files.deleteIfExists(resolve(key));
    }

    @Override
    public List<ObjectMeta> list(String prefix) throws IOException {
        String p = prefix == null ? "" : prefix;
        List<ObjectMeta> out = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return out;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> files = walk.filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().startsWith(TMP_PREFIX))
                    .sorted(Comparator.comparing(this::toKey))
                    .toList();
            for (Path file : files) {
                String key = toKey(file);
                if (!key.startsWith(p)) {
                    continue;
                }
                try {
                    out.add(meta(key, file));
                } catch (NoSuchFileException e) {
                    LOG.debug("object vanished while listing: {}", key);
                }
            }
        }
        return out;
    }

    @Override
    public Optional<ObjectMeta> head(String key) throws IOException {
        Path file = resolve(key);
        try {
            return Optional.of(meta(key, file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    private ObjectMeta meta(String key, Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        if (!attrs.isRegularFile()) {
            throw new NoSuchFileException(file.toString());
        }
        return new ObjectMeta(key, attrs.size(), attrs.lastModifiedTime().toInstant());
    }

    private String toKey(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank() || key.startsWith("/") || key.endsWith("/")) {
            throw new IllegalArgumentException("invalid object key: " + key);
        }
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("object key escapes store root: " + key);
        }
        return resolved;
    }
}
