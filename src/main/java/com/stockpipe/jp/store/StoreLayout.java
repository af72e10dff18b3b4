package com.stockpipe.jp.store;

import com.stockpipe.jp.config.Config;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Key layout of the shared object store.
 */
public final class StoreLayout {
    private static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;

    private final String mutablePrefix;
    private final String archivePrefix;
    private final String manifestKey;
    private final String selectionKey;
    private final String snapshotKeyPattern;
    private final String archiveKey;
    private final String metadataKey;
    private final String pricesKey;
    private final String recommendationKey;
    private final String recommendationFinalKey;
    private final String runsPrefix;
    private final String rankingInboxPattern;
    private final String refinementInboxPattern;

    public StoreLayout(Config config) {
        this.mutablePrefix = asPrefix(config.requireString("store.mutable_prefix"));
        this.archivePrefix = asPrefix(config.requireString("store.archive_prefix"));
        this.manifestKey = config.requireString("store.manifest_key");
        this.selectionKey = config.requireString("store.selection_key");
        this.snapshotKeyPattern = config.requireString("store.snapshot_key_pattern");
        this.archiveKey = config.requireString("store.archive_key");
        this.metadataKey = config.requireString("store.metadata_key");
        this.pricesKey = config.requireString("store.prices_key");
        this.recommendationKey = config.requireString("store.recommendation_key");
        this.recommendationFinalKey = config.requireString("store.recommendation_final_key");
        this.runsPrefix = asPrefix(config.requireString("store.runs_prefix"));
        this.rankingInboxPattern = config.requireString("store.ranking_inbox_pattern");
        this.refinementInboxPattern = config.requireString("store.refinement_inbox_pattern");
        validate();
    }

    public static StoreLayout defaults() {
        return new StoreLayout(Config.of(Map.of()));
    }

    public String mutablePrefix() {
        return mutablePrefix;
    }

    public String archivePrefix() {
        return archivePrefix;
    }

    public String manifestKey() {
        return manifestKey;
    }

    public String selectionKey() {
        return selectionKey;
    }

    public String archiveKey() {
        return archiveKey;
    }

    public String metadataKey() {
        return metadataKey;
    }

    public String pricesKey() {
        return pricesKey;
    }

    public String recommendationKey() {
        return recommendationKey;
    }

    public String recommendationFinalKey() {
        return recommendationFinalKey;
    }

    public String runsPrefix() {
        return runsPrefix;
    }

    /**
     * Mutable artifacts a published manifest declares as desired state.
     */
    public List<String> declaredKeys() {
        return List.of(selectionKey, metadataKey, pricesKey, recommendationKey, recommendationFinalKey);
    }

    public String snapshotKey(LocalDate selectionDate) {
        return snapshotKeyPattern.replace("{yyyyMMdd}", COMPACT.format(requireDate(selectionDate)));
    }

    public String rankingInboxKey(LocalDate referenceDate) {
        return rankingInboxPattern.replace("{yyyyMMdd}", COMPACT.format(requireDate(referenceDate)));
    }

    public String refinementInboxKey(String layer, LocalDate referenceDate) {
        return refinementInboxPattern
                .replace("{layer}", layer == null ? "" : layer.trim())
                .replace("{yyyyMMdd}", COMPACT.format(requireDate(referenceDate)));
    }

    public String runReportKey(LocalDate referenceDate, String runId) {
        return runsPrefix + requireDate(referenceDate) + "/" + runId + ".json";
    }

    public boolean isMutable(String key) {
        return key != null && key.startsWith(mutablePrefix) && !isArchival(key);
    }

    public boolean isArchival(String key) {
        return key != null && key.startsWith(archivePrefix);
    }

    private void validate() {
        if (archivePrefix.equals(mutablePrefix)) {
            throw new IllegalArgumentException("archive prefix must differ from mutable prefix: " + archivePrefix);
        }
        if (isArchival(selectionKey) || isArchival(manifestKey)) {
            throw new IllegalArgumentException("live selection and manifest keys must sit outside the archive prefix");
        }
        if (!isArchival(archiveKey) || !isArchival(snapshotKeyPattern)) {
            throw new IllegalArgumentException("archive and snapshot keys must sit under the archive prefix " + archivePrefix);
        }
    }

    private static LocalDate requireDate(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        return date;
    }

    private static String asPrefix(String raw) {
        String text = raw.trim();
        return text.endsWith("/") ? text : text + "/";
    }
}
