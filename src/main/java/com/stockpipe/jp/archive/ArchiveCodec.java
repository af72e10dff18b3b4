package com.stockpipe.jp.archive;

import com.stockpipe.jp.model.ArchiveEntry;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of the rolling archive: {@code {"rows": [...]}} ordered by date then instrument.
 */
public final class ArchiveCodec {
    static final Comparator<ArchiveEntry> ROW_ORDER = Comparator
            .comparing((ArchiveEntry e) -> e.selectionDate)
            .thenComparing(e -> e.instrumentId);

    private ArchiveCodec() {
    }

    public static byte[] encode(List<ArchiveEntry> rows) {
        List<ArchiveEntry> sorted = new ArrayList<>(rows);
        sorted.sort(ROW_ORDER);
        JSONArray out = new JSONArray();
        for (ArchiveEntry entry : sorted) {
            JSONObject row = new JSONObject();
            row.put("selection_date", entry.selectionDate.toString());
            row.put("instrument_id", entry.instrumentId);
            JSONObject metrics = new JSONObject();
            if (entry.metricsSnapshot != null) {
                entry.metricsSnapshot.forEach((k, v) -> {
                    if (v != null && Double.isFinite(v)) {
                        metrics.put(k, v.doubleValue());
                    }
                });
            }
            row.put("metrics", metrics);
            row.put("created_at", entry.createdAt == null ? Instant.EPOCH.toString() : entry.createdAt.toString());
            out.put(row);
        }
        JSONObject root = new JSONObject();
        root.put("rows", out);
        return root.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws IOException on any unreadable row; callers must not rewrite an archive they could not read
     */
    public static List<ArchiveEntry> decode(byte[] bytes) throws IOException {
        try {
            JSONObject root = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            JSONArray rows = root.getJSONArray("rows");
            List<ArchiveEntry> out = new ArrayList<>(rows.length());
            for (int i = 0; i < rows.length(); i++) {
                JSONObject row = rows.getJSONObject(i);
                Map<String, Double> metrics = new LinkedHashMap<>();
                JSONObject rawMetrics = row.optJSONObject("metrics");
                if (rawMetrics != null) {
                    for (String key : rawMetrics.keySet()) {
                        double value = rawMetrics.optDouble(key, Double.NaN);
                        if (Double.isFinite(value)) {
                            metrics.put(key, value);
                        }
                    }
                }
                String createdRaw = row.optString("created_at", "");
                out.add(new ArchiveEntry(
                        LocalDate.parse(row.getString("selection_date")),
                        row.getString("instrument_id"),
                        Map.copyOf(metrics),
                        createdRaw.isEmpty() ? Instant.EPOCH : Instant.parse(createdRaw)
                ));
            }
            return out;
        } catch (JSONException | DateTimeParseException e) {
            throw new IOException("unreadable archive: " + e.getMessage(), e);
        }
    }
}
