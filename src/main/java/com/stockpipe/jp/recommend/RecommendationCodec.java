package com.stockpipe.jp.recommend;

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

public final class RecommendationCodec {
    private RecommendationCodec() {
    }

    public static final class Document {
        public final LocalDate referenceDate;
        public final Instant generatedAt;
        public final List<RecommendationRecord> items;

        public Document(LocalDate referenceDate, Instant generatedAt, List<RecommendationRecord> items) {
            this.referenceDate = referenceDate;
            this.generatedAt = generatedAt == null ? Instant.EPOCH : generatedAt;
            this.items = items == null ? List.of() : List.copyOf(items);
        }
    }

    public static byte[] encode(Document document) {
        JSONObject root = new JSONObject();
        root.put("reference_date", document.referenceDate.toString());
        root.put("generated_at", document.generatedAt.toString());
        root.put("items", itemsToJson(document.items));
        return root.toString(2).getBytes(StandardCharsets.UTF_8);
    }

    static JSONArray itemsToJson(List<RecommendationRecord> items) {
        JSONArray out = new JSONArray();
        for (RecommendationRecord r : items) {
            JSONObject row = new JSONObject();
            row.put("instrument_id", r.instrumentId);
            row.put("base_score", r.baseScore);
            row.put("base_action", r.baseAction.name());
            row.put("base_confidence", r.baseConfidence.name());
            if (r.hasRefinement) {
                row.put("refined_score", r.refinedScore.doubleValue());
                row.put("refined_action", r.refinedAction.name());
                row.put("refinement_source", r.refinementSource);
            }
            row.put("final_score", r.finalScore);
            row.put("final_action", r.finalAction.name());
            row.put("confidence", r.confidence.name());
            row.put("has_refinement", r.hasRefinement);
            row.put("override_flag", r.overrideFlag);
            out.put(row);
        }
        return out;
    }

    /**
     * Reads base or final documents. Only the base fields are required.
     */
    public static Document decode(byte[] bytes) throws IOException {
        try {
            JSONObject root = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            JSONArray rows = root.getJSONArray("items");
            List<RecommendationRecord> items = new ArrayList<>(rows.length());
            for (int i = 0; i < rows.length(); i++) {
                JSONObject row = rows.getJSONObject(i);
                String id = row.getString("instrument_id");
                double baseScore = row.getDouble("base_score");
                Action baseAction = Action.parse(row.getString("base_action"));
                Confidence baseConfidence = Confidence.parse(row.getString("base_confidence"));
                RecommendationRecord base = RecommendationRecord.base(id, baseScore, baseAction, baseConfidence);
                if (row.optBoolean("has_refinement", false)) {
                    base = base.toBuilder()
                            .refinedScore(row.getDouble("refined_score"))
                            .refinedAction(Action.parse(row.getString("refined_action")))
                            .refinementSource(row.optString("refinement_source", ""))
                            .finalScore(row.getDouble("final_score"))
                            .finalAction(Action.parse(row.getString("final_action")))
                            .confidence(Confidence.parse(row.getString("confidence")))
                            .hasRefinement(true)
                            .overrideFlag(row.optBoolean("override_flag", false))
                            .build();
                }
                items.add(base);
            }
            String generated = root.optString("generated_at", "");
            return new Document(
                    LocalDate.parse(root.getString("reference_date")),
                    generated.isEmpty() ? Instant.EPOCH : Instant.parse(generated),
                    items
            );
        } catch (JSONException | DateTimeParseException | IllegalArgumentException e) {
            throw new IOException("unreadable recommendations: " + e.getMessage(), e);
        }
    }

    /**
     * Refinement inbox object: {@code {"layer": "...", "items": [{"instrument_id", "score", "action"?, "confidence"?}]}}.
     */
    public static List<Refinement> decodeRefinements(String expectedLayer, byte[] bytes) throws IOException {
        try {
            JSONObject root = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            String layer = root.optString("layer", expectedLayer);
            if (!expectedLayer.equals(layer)) {
                throw new IOException("refinement object declares layer '" + layer + "', expected '" + expectedLayer + "'");
            }
            JSONArray rows = root.getJSONArray("items");
            List<Refinement> out = new ArrayList<>(rows.length());
            for (int i = 0; i < rows.length(); i++) {
                JSONObject row = rows.getJSONObject(i);
                String action = row.optString("action", "");
                String confidence = row.optString("confidence", "");
                out.add(new Refinement(
                        layer,
                        row.getString("instrument_id"),
                        row.getDouble("score"),
                        action.isEmpty() ? null : Action.parse(action),
                        confidence.isEmpty() ? null : Confidence.parse(confidence),
                        row.optString("rationale", "")
                ));
            }
            return out;
        } catch (JSONException | IllegalArgumentException e) {
            throw new IOException("unreadable refinement layer " + expectedLayer + ": " + e.getMessage(), e);
        }
    }
}
