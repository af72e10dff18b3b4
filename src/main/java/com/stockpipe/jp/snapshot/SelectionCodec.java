package com.stockpipe.jp.snapshot;

import com.stockpipe.jp.model.SelectionPick;
import com.stockpipe.jp.model.SelectionSnapshot;
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

public final class SelectionCodec {
    private SelectionCodec() {
    }

    public static byte[] encode(SelectionSnapshot snapshot) {
        JSONObject root = new JSONObject();
        root.put("selection_date", snapshot.selectionDate.toString());
        root.put("created_at", snapshot.createdAt.toString());
        JSONArray picks = new JSONArray();
        for (SelectionPick pick : snapshot.picks) {
            JSONObject row = new JSONObject();
            row.put("instrument_id", pick.instrumentId);
            row.put("rank", pick.rank);
            row.put("score", pick.score);
            row.put("category", pick.category == null ? "" : pick.category);
            row.put("rationale", pick.rationale == null ? "" : pick.rationale);
            if (pick.close != null) {
                row.put("close", pick.close.doubleValue());
            }
            picks.put(row);
        }
        root.put("picks", picks);
        return root.toString(2).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws IOException when the payload is not a readable selection snapshot
     */
    public static SelectionSnapshot decode(byte[] bytes) throws IOException {
        try {
            JSONObject root = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            LocalDate date = LocalDate.parse(root.getString("selection_date"));
            String createdRaw = root.optString("created_at", "");
            Instant createdAt = createdRaw.isEmpty() ? Instant.EPOCH : Instant.parse(createdRaw);
            List<SelectionPick> picks = new ArrayList<>();
            JSONArray rows = root.optJSONArray("picks");
            if (rows != null) {
                for (int i = 0; i < rows.length(); i++) {
                    JSONObject row = rows.getJSONObject(i);
                    Double close = row.has("close") && !row.isNull("close") ? row.getDouble("close") : null;
                    picks.add(new SelectionPick(
                            row.getString("instrument_id"),
                            row.optInt("rank", i + 1),
                            row.optDouble("score", 0.0),
                            row.optString("category", ""),
                            row.optString("rationale", ""),
                            close
                    ));
                }
            }
            return new SelectionSnapshot(date, createdAt, picks);
        } catch (JSONException | DateTimeParseException e) {
            throw new IOException("unreadable selection snapshot: " + e.getMessage(), e);
        }
    }
}
