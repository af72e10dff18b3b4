package com.stockpipe.jp.recommend;

import com.stockpipe.jp.manifest.ManifestPublisher;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 模块说明：RecommendationMergeJob（class）。
 * 主要职责：读取基础推荐与各精炼层的收件箱对象，交给 RecommendationMergeEngine 合并后发布最终推荐。
 * 使用建议：与刷新周期无关，精炼结果到达时即可运行；输入不变时重复运行不会改写最终对象。
 */
public final class RecommendationMergeJob {
    private static final Logger LOG = LogManager.getLogger(RecommendationMergeJob.class);

    private final ObjectStore store;
    private final StoreLayout layout;
    private final RecommendationMergeEngine engine;
    private final ManifestPublisher manifestPublisher;
    private final Clock clock;

    /**
     * @param manifestPublisher republishes the manifest after a rewrite so reconcile keeps the final
     *                          recommendations; null leaves the manifest to the next pipeline run
     */
    public RecommendationMergeJob(ObjectStore store, StoreLayout layout, RecommendationMergeEngine engine,
                                  ManifestPublisher manifestPublisher, Clock clock) {
        this.store = store;
        this.layout = layout;
        this.engine = engine;
        this.manifestPublisher = manifestPublisher;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public MergeJobResult run() throws IOException {
        return run(null);
    }

    /**
     * @param referenceDate expected date of the base recommendations, or null to take whatever is current
     */
    public MergeJobResult run(LocalDate referenceDate) throws IOException {
        Optional<byte[]> baseBytes = store.get(layout.recommendationKey());
        if (baseBytes.isEmpty()) {
            throw new IllegalStateException("no base recommendations at " + layout.recommendationKey());
        }
        RecommendationCodec.Document base = RecommendationCodec.decode(baseBytes.get());
        if (referenceDate != null && !referenceDate.equals(base.referenceDate)) {
            throw new IllegalStateException("base recommendations are for " + base.referenceDate
                    + ", not " + referenceDate);
        }
        LocalDate date = base.referenceDate;

        List<Refinement> refinements = new ArrayList<>();
        List<String> layersFound = new ArrayList<>();
        for (String layer : engine.layerOrder()) {
            String key = layout.refinementInboxKey(layer, date);
            Optional<byte[]> bytes = store.get(key);
            if (bytes.isEmpty()) {
                LOG.info("refinement layer {} not available yet ({})", layer, key);
                continue;
            }
            refinements.addAll(RecommendationCodec.decodeRefinements(layer, bytes.get()));
            layersFound.add(layer);
        }

        List<RecommendationRecord> merged = engine.mergeAll(base.items, refinements);
        int refined = 0;
        int overrides = 0;
        for (RecommendationRecord record : merged) {
            if (record.hasRefinement) {
                refined++;
            }
            if (record.overrideFlag) {
                overrides++;
                LOG.warn("refinement reverses high-confidence base decision: {} {} -> {} ({})",
                        record.instrumentId, record.baseAction, record.finalAction, record.refinementSource);
            }
        }

        boolean written = false;
        if (unchanged(date, merged)) {
            LOG.info("final recommendations for {} unchanged, not rewriting", date);
        } else {
            RecommendationCodec.Document out = new RecommendationCodec.Document(date, clock.instant(), merged);
            store.put(layout.recommendationFinalKey(), RecommendationCodec.encode(out));
            written = true;
            if (manifestPublisher != null) {
                manifestPublisher.publish(layout.declaredKeys());
            }
        }
        LOG.info("merge {}: total={} refined={} overrides={} layers={}", date, merged.size(), refined, overrides, layersFound);
        return new MergeJobResult(date, merged.size(), refined, overrides, layersFound, written);
    }

    private boolean unchanged(LocalDate date, List<RecommendationRecord> merged) throws IOException {
        Optional<byte[]> existing = store.get(layout.recommendationFinalKey());
        if (existing.isEmpty()) {
            return false;
        }
        JSONObject current;
        try {
            current = new JSONObject(new String(existing.get(), StandardCharsets.UTF_8));
        } catch (JSONException e) {
            LOG.warn("existing final recommendations unreadable, rewriting: {}", e.getMessage());
            return false;
        }
        if (!date.toString().equals(current.optString("reference_date", ""))) {
            return false;
        }
        return RecommendationCodec.itemsToJson(merged).similar(current.optJSONArray("items"));
    }
}
