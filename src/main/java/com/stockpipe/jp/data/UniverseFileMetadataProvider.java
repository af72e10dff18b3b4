package com.stockpipe.jp.data;

import com.stockpipe.jp.error.PermanentProviderException;
import com.stockpipe.jp.error.ProviderException;
import com.stockpipe.jp.error.TransientProviderException;
import com.stockpipe.jp.model.InstrumentMeta;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the instrument universe from a text file: one {@code code[,name[,market]]} per line,
 * {@code #} starts a comment.
 */
public final class UniverseFileMetadataProvider implements MetadataProvider {
    private final Path path;

    public UniverseFileMetadataProvider(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("universe path is required");
        }
        this.path = path;
    }

    @Override
    public List<InstrumentMeta> fetchUniverse() throws ProviderException {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new PermanentProviderException("universe file not found: " + path, e);
        } catch (IOException e) {
            throw new TransientProviderException("failed to read universe file " + path + ": " + e.getMessage(), e);
        }
        Map<String, InstrumentMeta> byId = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = stripComment(raw);
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split(",", -1);
            String id = parts[0].trim();
            if (id.isEmpty()) {
                continue;
            }
            String name = parts.length > 1 ? parts[1].trim() : "";
            String market = parts.length > 2 ? parts[2].trim() : "";
            byId.putIfAbsent(id, new InstrumentMeta(id, name, market));
        }
        return new ArrayList<>(byId.values());
    }

    private static String stripComment(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.replace("\uFEFF", "");
        int hash = text.indexOf('#');
        if (hash >= 0) {
            text = text.substring(0, hash);
        }
        return text.trim();
    }
}
