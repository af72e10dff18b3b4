package com.stockpipe.jp.data;

import com.stockpipe.jp.model.PriceBar;
import com.stockpipe.jp.model.PriceSeries;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stored price book: last good series per instrument.
 */
public final class PriceBookCodec {
    private PriceBookCodec() {
    }

    public static byte[] encode(Map<String, PriceSeries> book, Instant updatedAt) {
        JSONObject series = new JSONObject();
        for (Map.Entry<String, PriceSeries> entry : new TreeMap<>(book).entrySet()) {
            PriceSeries value = entry.getValue();
            JSONObject row = new JSONObject();
            row.put("period", value.period == null ? "" : value.period);
            row.put("interval", value.interval == null ? "" : value.interval);
            row.put("fetched_at", value.fetchedAt == null ? Instant.EPOCH.toString() : value.fetchedAt.toString());
            JSONArray bars = new JSONArray();
            if (value.bars != null) {
                for (PriceBar bar : value.bars) {
                    JSONObject b = new JSONObject();
                    b.put("date", bar.date.toString());
                    b.put("open", bar.open);
                    b.put("high", bar.high);
                    b.put("low", bar.low);
                    b.put("close", bar.close);
                    b.put("volume", bar.volume);
                    bars.put(b);
                }
            }
            row.put("bars", bars);
            series.put(entry.getKey(), row);
        }
        JSONObject root = new JSONObject();
        root.put("updated_at", updatedAt == null ? Instant.EPOCH.toString() : updatedAt.toString());
        root.put("series", series);
        return root.toString().getBytes(StandardCharsets.UTF_8);
    }

    public static Map<String, PriceSeries> decode(byte[] bytes) throws IOException {
        try {
            JSONObject root = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            JSONObject series = root.getJSONObject("series");
            Map<String, PriceSeries> out = new TreeMap<>();
            for (String id : series.keySet()) {
                JSONObject row = series.getJSONObject(id);
                JSONArray rawBars = row.optJSONArray("bars");
                List<PriceBar> bars = new ArrayList<>();
                if (rawBars != null) {
                    for (int i = 0; i < rawBars.length(); i++) {
                        JSONObject b = rawBars.getJSONObject(i);
                        bars.add(new PriceBar(
                                LocalDate.parse(b.getString("date")),
                                b.optDouble("open", Double.NaN),
                                b.optDouble("high", Double.NaN),
                                b.optDouble("low", Double.NaN),
                                b.getDouble("close"),
                                b.optDouble("volume", 0.0)
                        ));
                    }
                }
                String fetched = row.optString("fetched_at", "");
                out.put(id, new PriceSeries(
                        id,
                        row.optString("period", ""),
                        row.optString("interval", ""),
                        List.copyOf(bars),
                        fetched.isEmpty() ? Instant.EPOCH : Instant.parse(fetched)
                ));
            }
            return out;
        } catch (JSONException | DateTimeParseException e) {
            throw new IOException("unreadable price book: " + e.getMessage(), e);
        }
    }
}
