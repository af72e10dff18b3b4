package com.stockpipe.jp.runner;

import com.stockpipe.core.RunTelemetry;
import com.stockpipe.core.StepResult;
import com.stockpipe.core.StepStatus;
import com.stockpipe.core.diagnostics.Outcome;
import com.stockpipe.jp.archive.ArchiveWriteResult;
import com.stockpipe.jp.archive.ArchiveWriter;
import com.stockpipe.jp.data.MarketDataProvider;
import com.stockpipe.jp.data.MetadataCodec;
import com.stockpipe.jp.data.MetadataProvider;
import com.stockpipe.jp.data.PriceBookCodec;
import com.stockpipe.jp.data.RankingProvider;
import com.stockpipe.jp.error.BackupMissingException;
import com.stockpipe.jp.error.ProviderException;
import com.stockpipe.jp.fetch.BoundedFetcher;
import com.stockpipe.jp.manifest.ManifestPublisher;
import com.stockpipe.jp.model.InstrumentMeta;
import com.stockpipe.jp.model.Manifest;
import com.stockpipe.jp.model.PipelineRunReport;
import com.stockpipe.jp.model.PriceSeries;
import com.stockpipe.jp.model.RankedCandidate;
import com.stockpipe.jp.model.RunStatus;
import com.stockpipe.jp.model.SelectionPick;
import com.stockpipe.jp.model.SelectionSnapshot;
import com.stockpipe.jp.recommend.RecommendationCodec;
import com.stockpipe.jp.recommend.RecommendationMergeEngine;
import com.stockpipe.jp.recommend.RecommendationRecord;
import com.stockpipe.jp.schedule.ExecutionMode;
import com.stockpipe.jp.schedule.ExecutionModeSelector;
import com.stockpipe.jp.schedule.ExecutionWindow;
import com.stockpipe.jp.schedule.GuardDecision;
import com.stockpipe.jp.schedule.ModeOverrides;
import com.stockpipe.jp.schedule.WindowGuard;
import com.stockpipe.jp.snapshot.BackupClearance;
import com.stockpipe.jp.snapshot.BackupVerifier;
import com.stockpipe.jp.snapshot.SelectionSnapshotStore;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import lombok.Builder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 模块说明：PipelineRunner（class）。
 * 主要职责：按固定顺序执行 verify-window → fetch-metadata → fetch-prices → backup-verify → score/select
 * → archive-write → publish-manifest，并对每一步做失败隔离，汇总 SUCCESS/PARTIAL/ABORTED。
 * 使用建议：所有只读与校验步骤都排在第一次破坏性写入之前；日历或备份校验失败只中止破坏性尾段。
 */
public final class PipelineRunner {
    private static final Logger LOG = LogManager.getLogger(PipelineRunner.class);
    private static final DateTimeFormatter RUN_ID_TS = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
            .withZone(ZoneOffset.UTC);

    static final List<String> STEP_ORDER = List.of(
            RunTelemetry.STEP_VERIFY_WINDOW,
            RunTelemetry.STEP_FETCH_METADATA,
            RunTelemetry.STEP_FETCH_PRICES,
            RunTelemetry.STEP_BACKUP_VERIFY,
            RunTelemetry.STEP_SCORE_SELECT,
            RunTelemetry.STEP_ARCHIVE_WRITE,
            RunTelemetry.STEP_PUBLISH_MANIFEST
    );

    private final ExecutionModeSelector selector;
    private final WindowGuard guard;
    private final ObjectStore store;
    private final StoreLayout layout;
    private final MetadataProvider metadataProvider;
    private final MarketDataProvider marketDataProvider;
    private final RankingProvider rankingProvider;
    private final BoundedFetcher fetcher;
    private final BackupVerifier backupVerifier;
    private final SelectionSnapshotStore snapshotStore;
    private final ArchiveWriter archiveWriter;
    private final ManifestPublisher manifestPublisher;
    private final RecommendationMergeEngine mergeEngine;
    private final RunJournal journal;
    private final Clock clock;
    private final String fetchPeriod;
    private final String fetchInterval;
    private final int selectTopN;

    @Builder
    private PipelineRunner(
            ExecutionModeSelector selector,
            WindowGuard guard,
            ObjectStore store,
            StoreLayout layout,
            MetadataProvider metadataProvider,
            MarketDataProvider marketDataProvider,
            RankingProvider rankingProvider,
            BoundedFetcher fetcher,
            BackupVerifier backupVerifier,
            SelectionSnapshotStore snapshotStore,
            ArchiveWriter archiveWriter,
            ManifestPublisher manifestPublisher,
            RecommendationMergeEngine mergeEngine,
            RunJournal journal,
            Clock clock,
            String fetchPeriod,
            String fetchInterval,
            int selectTopN
    ) {
        this.selector = require(selector, "selector");
        this.guard = require(guard, "guard");
        this.store = require(store, "store");
        this.layout = require(layout, "layout");
        this.metadataProvider = require(metadataProvider, "metadataProvider");
        this.marketDataProvider = require(marketDataProvider, "marketDataProvider");
        this.rankingProvider = require(rankingProvider, "rankingProvider");
        this.fetcher = require(fetcher, "fetcher");
        this.backupVerifier = require(backupVerifier, "backupVerifier");
        this.snapshotStore = require(snapshotStore, "snapshotStore");
        this.archiveWriter = require(archiveWriter, "archiveWriter");
        this.manifestPublisher = require(manifestPublisher, "manifestPublisher");
        this.mergeEngine = require(mergeEngine, "mergeEngine");
        this.journal = journal;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.fetchPeriod = blankTo(fetchPeriod, "max");
        this.fetchInterval = blankTo(fetchInterval, "1d");
        this.selectTopN = selectTopN <= 0 ? 10 : selectTopN;
    }

    public PipelineRunReport run(ModeOverrides overrides, RunOptions options) {
        return run(clock.instant(), overrides, options);
    }

    public PipelineRunReport run(Instant now, ModeOverrides overrides, RunOptions options) {
        RunOptions opts = options == null ? RunOptions.defaults() : options;
        ExecutionWindow window = selector.select(now, overrides);
        String runId = newRunId(now, window.mode());
        RunTelemetry telemetry = new RunTelemetry(runId, window.mode().name(), opts.trigger(), clock.instant());
        RunState state = new RunState(window);

        LOG.info("run {} mode={} reference_date={} window=[{} .. {}] forced={}",
                runId, window.mode(), window.referenceDate(), window.windowStart(), window.windowEnd(), window.forced());

        StepResult verify = timed(telemetry, RunTelemetry.STEP_VERIFY_WINDOW, () -> verifyWindow(window, opts));
        state.add(verify);
        if (verify.status() != StepStatus.SUCCESS) {
            state.fillRemaining(StepStatus.SKIPPED, "window denied");
            telemetry.finish();
            PipelineRunReport report = state.report(runId, telemetry, clock.instant(), verify.reason());
            LOG.info("run {} not executed: {}", runId, verify.reason());
            return report;
        }

        state.add(timed(telemetry, RunTelemetry.STEP_FETCH_METADATA, () -> fetchMetadata(state)));
        state.add(timed(telemetry, RunTelemetry.STEP_FETCH_PRICES, () -> fetchPrices(state)));
        if (state.interrupted) {
            state.fillRemaining(StepStatus.ABORTED, "interrupted");
            return finish(state, runId, telemetry, "interrupted");
        }

        if (window.mode().isDestructive()) {
            StepResult backup = timed(telemetry, RunTelemetry.STEP_BACKUP_VERIFY, () -> verifyBackup(state));
            state.add(backup);
            if (backup.status() == StepStatus.ABORTED) {
                state.fillRemaining(StepStatus.ABORTED, "backup verification failed");
                return finish(state, runId, telemetry, backup.reason());
            }
            StepResult select = timed(telemetry, RunTelemetry.STEP_SCORE_SELECT, () -> scoreAndSelect(state));
            state.add(select);
            if (select.status() == StepStatus.ABORTED) {
                state.fillRemaining(StepStatus.ABORTED, "selection aborted");
                return finish(state, runId, telemetry, select.reason());
            }
        } else {
            state.add(StepResult.skipped(RunTelemetry.STEP_BACKUP_VERIFY, "not a selection run"));
            state.add(StepResult.skipped(RunTelemetry.STEP_SCORE_SELECT, "not a selection run"));
        }

        state.add(timed(telemetry, RunTelemetry.STEP_ARCHIVE_WRITE, () -> archiveLive()));
        state.add(timed(telemetry, RunTelemetry.STEP_PUBLISH_MANIFEST, () -> publishManifest()));
        return finish(state, runId, telemetry, "");
    }

    private PipelineRunReport finish(RunState state, String runId, RunTelemetry telemetry, String abortReason) {
        telemetry.finish();
        PipelineRunReport report = state.report(runId, telemetry, clock.instant(), abortReason);
        if (journal != null) {
            journal.record(report, telemetry);
        }
        return report;
    }

    private StepResult verifyWindow(ExecutionWindow window, RunOptions opts) {
        GuardDecision decision = guard.evaluate(window, opts.skipCalendarCheck());
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("mode", window.mode().name());
        evidence.put("reference_date", window.referenceDate().toString());
        if (decision.checkedDate() != null) {
            evidence.put("checked_date", decision.checkedDate().toString());
        }
        evidence.put("holiday_class", decision.holidayClass().name());
        evidence.put("guard_reason", decision.reason().name());
        if (decision.allowed()) {
            return StepResult.success(RunTelemetry.STEP_VERIFY_WINDOW, decision.describe(), evidence);
        }
        return new StepResult(RunTelemetry.STEP_VERIFY_WINDOW, StepStatus.ABORTED, decision.describe(), evidence, 0L);
    }

    private StepResult fetchMetadata(RunState state) {
        String step = RunTelemetry.STEP_FETCH_METADATA;
        String failure;
        try {
            List<InstrumentMeta> universe = metadataProvider.fetchUniverse();
            if (universe != null && !universe.isEmpty()) {
                state.universe = List.copyOf(universe);
                try {
                    store.put(layout.metadataKey(), MetadataCodec.encode(state.universe, clock.instant()));
                } catch (IOException e) {
                    LOG.warn("fresh metadata fetched but not cached: {}", e.getMessage());
                    return StepResult.degraded(step, "metadata cache write failed: " + e.getMessage(),
                            Map.of("instruments", state.universe.size(), "source", "provider"));
                }
                return StepResult.success(step, "fetched", Map.of("instruments", state.universe.size(), "source", "provider"));
            }
            failure = "provider returned an empty universe";
        } catch (ProviderException | RuntimeException e) {
            failure = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        LOG.warn("metadata provider failed ({}), falling back to last known good", failure);
        try {
            Optional<byte[]> cached = store.get(layout.metadataKey());
            if (cached.isPresent()) {
                state.universe = MetadataCodec.decode(cached.get());
                return StepResult.degraded(step, "provider failed, using cached metadata: " + failure,
                        Map.of("instruments", state.universe.size(), "source", "cache"));
            }
        } catch (IOException e) {
            LOG.warn("cached metadata unreadable: {}", e.getMessage());
            failure = failure + "; cache unreadable: " + e.getMessage();
        }
        state.universe = List.of();
        return StepResult.degraded(step, "provider failed and no cache, continuing with empty universe: " + failure,
                Map.of("instruments", 0, "source", "empty"));
    }

    private StepResult fetchPrices(RunState state) {
        String step = RunTelemetry.STEP_FETCH_PRICES;
        Map<String, PriceSeries> prior;
        try {
            Optional<byte[]> bytes = store.get(layout.pricesKey());
            prior = bytes.isPresent() ? PriceBookCodec.decode(bytes.get()) : new TreeMap<>();
        } catch (IOException e) {
            LOG.error("stored price book unreadable, refusing to rewrite it: {}", e.getMessage());
            return StepResult.failed(step, "stored price book unreadable: " + e.getMessage(), Map.of());
        }
        state.prices = new TreeMap<>(prior);

        List<String> ids = new ArrayList<>();
        for (InstrumentMeta meta : state.universe) {
            ids.add(meta.instrumentId);
        }
        if (ids.isEmpty()) {
            return StepResult.success(step, "no instruments to fetch", Map.of("requested", 0));
        }

        Map<String, Outcome<PriceSeries>> outcomes;
        try {
            outcomes = fetcher.fetchAll(ids, id -> marketDataProvider.fetch(id, fetchPeriod, fetchInterval));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.interrupted = true;
            return StepResult.failed(step, "interrupted", Map.of("requested", ids.size()));
        }

        int updated = 0;
        Map<String, String> failed = new TreeMap<>();
        for (Map.Entry<String, Outcome<PriceSeries>> entry : outcomes.entrySet()) {
            Outcome<PriceSeries> outcome = entry.getValue();
            if (outcome.success && outcome.value != null) {
                state.prices.put(entry.getKey(), outcome.value);
                updated++;
            } else {
                failed.put(entry.getKey(), outcome.causeCode.name()
                        + (outcome.detail("error").isEmpty() ? "" : " " + outcome.detail("error")));
            }
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("requested", ids.size());
        evidence.put("updated", updated);
        evidence.put("failed", failed.size());
        if (!failed.isEmpty()) {
            evidence.put("failed_instruments", new ArrayList<>(failed.keySet()));
            evidence.put("kept_prior", countPresent(prior, failed.keySet()));
        }
        if (updated > 0) {
            try {
                store.put(layout.pricesKey(), PriceBookCodec.encode(state.prices, clock.instant()));
            } catch (IOException e) {
                LOG.error("price book write failed: {}", e.getMessage());
                return StepResult.failed(step, "price book write failed: " + e.getMessage(), evidence);
            }
        }
        if (failed.isEmpty()) {
            return StepResult.success(step, "all instruments updated", evidence);
        }
        LOG.warn("{} of {} instruments failed, prior values kept: {}", failed.size(), ids.size(), failed);
        return StepResult.partial(step, failed.size() + " of " + ids.size() + " instruments kept prior values", evidence);
    }

    private StepResult verifyBackup(RunState state) {
        String step = RunTelemetry.STEP_BACKUP_VERIFY;
        try {
            state.clearance = backupVerifier.verifyLive();
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("protected_date", state.clearance.coversEmptyArtifact()
                    ? "none"
                    : state.clearance.protectedDate().toString());
            return StepResult.success(step, "live selection is archived", evidence);
        } catch (BackupMissingException e) {
            Map<String, Object> evidence = new LinkedHashMap<>();
            if (e.date() != null) {
                evidence.put("date", e.date().toString());
            }
            evidence.put("snapshot_present", e.snapshotPresent());
            evidence.put("archive_row_present", e.archiveRowPresent());
            return new StepResult(step, StepStatus.ABORTED, e.getMessage(), evidence, 0L);
        }
    }

    private StepResult scoreAndSelect(RunState state) {
        String step = RunTelemetry.STEP_SCORE_SELECT;
        ExecutionWindow window = state.window;
        if (window.referenceDate().equals(state.clearance.protectedDate())) {
            LOG.info("live selection already dated {}, keeping it", window.referenceDate());
            return StepResult.skipped(step, "already selected for " + window.referenceDate());
        }
        List<RankedCandidate> ranked;
        try {
            ranked = rankingProvider.rank(window.referenceDate(), state.universe, Map.copyOf(state.prices));
        } catch (ProviderException | RuntimeException e) {
            LOG.warn("ranking failed, live selection left untouched: {}", e.getMessage());
            return StepResult.failed(step, "ranking failed: " + e.getMessage(), Map.of());
        }

        List<SelectionPick> picks = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RankedCandidate candidate : ranked == null ? List.<RankedCandidate>of() : ranked) {
            if (picks.size() >= selectTopN) {
                break;
            }
            if (candidate == null || candidate.instrumentId == null || candidate.instrumentId.isBlank()
                    || !Double.isFinite(candidate.score) || !seen.add(candidate.instrumentId)) {
                continue;
            }
            PriceSeries series = state.prices.get(candidate.instrumentId);
            picks.add(new SelectionPick(
                    candidate.instrumentId,
                    picks.size() + 1,
                    candidate.score,
                    candidate.category,
                    candidate.rationale,
                    series == null ? null : series.lastClose()
            ));
        }
        if (picks.isEmpty()) {
            return StepResult.failed(step, "ranking returned no usable candidates", Map.of("ranked", ranked == null ? 0 : ranked.size()));
        }

        SelectionSnapshot next = new SelectionSnapshot(window.referenceDate(), clock.instant(), picks);
        try {
            snapshotStore.overwrite(state.clearance, next);
        } catch (BackupMissingException e) {
            return new StepResult(step, StepStatus.ABORTED, e.getMessage(), Map.of(), 0L);
        } catch (IOException | RuntimeException e) {
            return StepResult.failed(step, "live selection write failed: " + e.getMessage(), Map.of());
        }

        List<RecommendationRecord> base = new ArrayList<>();
        for (SelectionPick pick : picks) {
            base.add(mergeEngine.baseFromScore(pick.instrumentId, pick.score));
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("ranked", ranked.size());
        evidence.put("picks", picks.size());
        evidence.put("selection_date", window.referenceDate().toString());
        Instant generatedAt = clock.instant();
        try {
            store.put(layout.recommendationKey(), RecommendationCodec.encode(
                    new RecommendationCodec.Document(window.referenceDate(), generatedAt, base)));
            // refinements belong to the previous selection
            store.put(layout.recommendationFinalKey(), RecommendationCodec.encode(
                    new RecommendationCodec.Document(window.referenceDate(), generatedAt, mergeEngine.mergeAll(base, List.of()))));
        } catch (IOException e) {
            return StepResult.failed(step, "selection written but base recommendations failed: " + e.getMessage(), evidence);
        }
        return StepResult.success(step, "selected " + picks.size(), evidence);
    }

    private StepResult archiveLive() {
        String step = RunTelemetry.STEP_ARCHIVE_WRITE;
        try {
            Optional<SelectionSnapshot> live = snapshotStore.readLive();
            if (live.isEmpty()) {
                return StepResult.skipped(step, "no live selection");
            }
            ArchiveWriteResult result = archiveWriter.archiveSelection(live.get());
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("selection_date", live.get().selectionDate.toString());
            evidence.put("appended", result.appended());
            evidence.put("skipped", result.skipped());
            evidence.put("snapshot_written", result.snapshotWritten());
            evidence.put("attempts", result.attempts());
            return StepResult.success(step, "archived " + live.get().selectionDate, evidence);
        } catch (IOException | RuntimeException e) {
            LOG.error("archive write failed: {}", e.getMessage());
            return StepResult.failed(step, "archive write failed: " + e.getMessage(), Map.of());
        }
    }

    private StepResult publishManifest() {
        String step = RunTelemetry.STEP_PUBLISH_MANIFEST;
        try {
            Manifest manifest = manifestPublisher.publish(layout.declaredKeys());
            return StepResult.success(step, "published", Map.of("items", manifest.items.size()));
        } catch (IOException | RuntimeException e) {
            LOG.error("manifest publish failed: {}", e.getMessage());
            return StepResult.failed(step, "manifest publish failed: " + e.getMessage(), Map.of());
        }
    }

    private StepResult timed(RunTelemetry telemetry, String step, StepBody body) {
        telemetry.startStep(step);
        StepResult result;
        try {
            result = body.run();
        } catch (RuntimeException e) {
            LOG.error("step {} crashed", step, e);
            result = StepResult.failed(step, "unexpected: " + e, Map.of());
        }
        long errors = result.status() == StepStatus.SUCCESS || result.status() == StepStatus.SKIPPED ? 0L : 1L;
        long itemsIn = count(result.evidence(), "requested", "ranked");
        long itemsOut = count(result.evidence(), "updated", "picks", "appended", "items", "instruments");
        long elapsed = telemetry.endStep(step, itemsIn, itemsOut, errors, result.status().name());
        return result.withElapsedMs(elapsed);
    }

    private static long count(Map<String, Object> evidence, String... keys) {
        for (String key : keys) {
            Object value = evidence.get(key);
            if (value instanceof Number) {
                return ((Number) value).longValue();
            }
        }
        return 0L;
    }

    private static int countPresent(Map<String, PriceSeries> prior, Set<String> ids) {
        int count = 0;
        for (String id : ids) {
            if (prior.containsKey(id)) {
                count++;
            }
        }
        return count;
    }

    private static String newRunId(Instant now, ExecutionMode mode) {
        return RUN_ID_TS.format(now) + "-" + mode.name().toLowerCase(Locale.ROOT)
                + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    @FunctionalInterface
    private interface StepBody {
        StepResult run();
    }

    private static final class RunState {
        private final ExecutionWindow window;
        private final List<StepResult> steps = new ArrayList<>();
        private List<InstrumentMeta> universe = List.of();
        private Map<String, PriceSeries> prices = new TreeMap<>();
        private BackupClearance clearance;
        private boolean interrupted;

        private RunState(ExecutionWindow window) {
            this.window = window;
        }

        private void add(StepResult result) {
            steps.add(result);
        }

        private void fillRemaining(StepStatus status, String reason) {
            Set<String> done = new HashSet<>();
            for (StepResult step : steps) {
                done.add(step.step());
            }
            for (String name : STEP_ORDER) {
                if (!done.contains(name)) {
                    steps.add(new StepResult(name, status, reason, Map.of(), 0L));
                }
            }
        }

        private RunStatus status() {
            boolean partial = false;
            for (StepResult step : steps) {
                if (step.status() == StepStatus.ABORTED) {
                    return RunStatus.ABORTED;
                }
                if (step.status() != StepStatus.SUCCESS && step.status() != StepStatus.SKIPPED) {
                    partial = true;
                }
            }
            return partial ? RunStatus.PARTIAL : RunStatus.SUCCESS;
        }

        private PipelineRunReport report(String runId, RunTelemetry telemetry, Instant finishedAt, String abortReason) {
            RunStatus status = status();
            return new PipelineRunReport(
                    runId,
                    window.mode(),
                    window.referenceDate(),
                    telemetry.startedAt(),
                    finishedAt,
                    status,
                    status == RunStatus.ABORTED ? abortReason : "",
                    List.copyOf(steps)
            );
        }
    }
}
