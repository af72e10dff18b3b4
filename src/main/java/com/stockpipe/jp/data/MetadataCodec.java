package com.stockpipe.jp.data;

import com.stockpipe.jp.model.InstrumentMeta;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class MetadataCodec {
    private MetadataCodec() {
    }

    public static byte[] encode(List<InstrumentMeta> universe, Instant updatedAt) {
        JSONArray rows = new JSONArray();
        for (InstrumentMeta meta : universe) {
            JSONObject row = new JSONObject();
            row.put("instrument_id", meta.instrumentId);
            row.put("name", meta.name == null ? "" : meta.name);
            row.put("market", meta.market == null ? "" : meta.market);
            rows.put(row);
        }
        JSONObject root = new JSONObject();
        root.put("updated_at", updatedAt == null ? Instant.EPOCH.toString() : updatedAt.toString());
        root.put("instruments", rows);
        return root.toString(2).getBytes(StandardCharsets.UTF_8);
    }

    public static List<InstrumentMeta> decode(byte[] bytes) throws IOException {
        try {
            JSONObject root = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            JSONArray rows = root.getJSONArray("instruments");
            List<InstrumentMeta> out = new ArrayList<>(rows.length());
            for (int i = 0; i < rows.length(); i++) {
                JSONObject row = rows.getJSONObject(i);
                out.add(new InstrumentMeta(
                        row.getString("instrument_id"),
                        row.optString("name", ""),
                        row.optString("market", "")
                ));
            }
            return out;
        } catch (JSONException e) {
            throw new IOException("unreadable metadata: " + e.getMessage(), e);
        }
    }
}
