package com.stockpipe.jp.manifest;

import com.stockpipe.jp.model.Manifest;
import com.stockpipe.jp.model.ManifestItem;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class ManifestCodec {
    private ManifestCodec() {
    }

    public static byte[] encode(Manifest manifest) {
        JSONObject root = new JSONObject();
        root.put("generated_at", manifest.generatedAt.toString());
        JSONArray items = new JSONArray();
        for (ManifestItem item : manifest.items) {
            JSONObject row = new JSONObject();
            row.put("key", item.key());
            row.put("bytes", item.sizeBytes());
            row.put("sha256", item.checksum());
            row.put("mtime", item.mtime().toString());
            items.put(row);
        }
        root.put("items", items);
        root.put("note", manifest.note);
        return root.toString(2).getBytes(StandardCharsets.UTF_8);
    }

    public static Manifest decode(byte[] bytes) throws IOException {
        try {
            JSONObject root = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            JSONArray rows = root.getJSONArray("items");
            List<ManifestItem> items = new ArrayList<>(rows.length());
            for (int i = 0; i < rows.length(); i++) {
                JSONObject row = rows.getJSONObject(i);
                String mtime = row.optString("mtime", "");
                items.add(new ManifestItem(
                        row.getString("key"),
                        row.optLong("bytes", 0L),
                        row.optString("sha256", ""),
                        mtime.isEmpty() ? Instant.EPOCH : Instant.parse(mtime)
                ));
            }
            String generated = root.optString("generated_at", "");
            return new Manifest(
                    generated.isEmpty() ? Instant.EPOCH : Instant.parse(generated),
                    items,
                    root.optString("note", "")
            );
        } catch (JSONException | DateTimeParseException | IllegalArgumentException e) {
            throw new IOException("unreadable manifest: " + e.getMessage(), e);
        }
    }
}
