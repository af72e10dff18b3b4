package com.stockpipe.jp.data;

import com.stockpipe.jp.error.PermanentProviderException;
import com.stockpipe.jp.error.ProviderException;
import com.stockpipe.jp.error.TransientProviderException;
import com.stockpipe.jp.model.InstrumentMeta;
import com.stockpipe.jp.model.PriceSeries;
import com.stockpipe.jp.model.RankedCandidate;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ranking answer dropped into the store inbox by the external ranking job for the reference date.
 * Items are returned in inbox order; the ranking job writes them best first.
 */
public final class StoredRankingProvider implements RankingProvider {
    private final ObjectStore store;
    private final StoreLayout layout;

    public StoredRankingProvider(ObjectStore store, StoreLayout layout) {
        this.store = store;
        this.layout = layout;
    }

    @Override
    public List<RankedCandidate> rank(
            LocalDate referenceDate,
            List<InstrumentMeta> universe,
            Map<String, PriceSeries> prices
    ) throws ProviderException {
        String key = layout.rankingInboxKey(referenceDate);
        Optional<byte[]> bytes;
        try {
            bytes = store.get(key);
        } catch (IOException e) {
            throw new TransientProviderException("failed to read ranking inbox " + key + ": " + e.getMessage(), e);
        }
        if (bytes.isEmpty()) {
            throw new PermanentProviderException("no ranking available at " + key);
        }
        try {
            return decode(new String(bytes.get(), StandardCharsets.UTF_8));
        } catch (JSONException e) {
            throw new PermanentProviderException("unreadable ranking at " + key + ": " + e.getMessage(), e);
        }
    }

    static List<RankedCandidate> decode(String body) {
        String text = body == null ? "" : body.trim();
        JSONArray items = text.startsWith("[")
                ? new JSONArray(text)
                : new JSONObject(text).getJSONArray("items");
        List<RankedCandidate> out = new ArrayList<>(items.length());
        for (int i = 0; i < items.length(); i++) {
            JSONObject row = items.getJSONObject(i);
            out.add(new RankedCandidate(
                    row.getString("instrument_id"),
                    row.getDouble("score"),
                    row.optString("category", ""),
                    row.optString("rationale", "")
            ));
        }
        return out;
    }
}
