package com.stockpipe.jp.runner;

import com.stockpipe.core.RunTelemetry;
import com.stockpipe.core.StepResult;
import com.stockpipe.core.StepStatus;
import com.stockpipe.jp.archive.ArchiveWriter;
import com.stockpipe.jp.calendar.HolidayClass;
import com.stockpipe.jp.calendar.TradingDayRecord;
import com.stockpipe.jp.data.MarketDataProvider;
import com.stockpipe.jp.data.MetadataCodec;
import com.stockpipe.jp.data.MetadataProvider;
import com.stockpipe.jp.data.PriceBookCodec;
import com.stockpipe.jp.data.RankingProvider;
import com.stockpipe.jp.error.PermanentProviderException;
import com.stockpipe.jp.error.TransientProviderException;
import com.stockpipe.jp.fetch.BoundedFetcher;
import com.stockpipe.jp.fetch.FetchPolicy;
import com.stockpipe.jp.manifest.ManifestPublisher;
import com.stockpipe.jp.model.InstrumentMeta;
import com.stockpipe.jp.model.PipelineRunReport;
import com.stockpipe.jp.model.PriceBar;
import com.stockpipe.jp.model.PriceSeries;
import com.stockpipe.jp.model.RankedCandidate;
import com.stockpipe.jp.model.RunStatus;
import com.stockpipe.jp.model.SelectionPick;
import com.stockpipe.jp.model.SelectionSnapshot;
import com.stockpipe.jp.recommend.ActionBands;
import com.stockpipe.jp.recommend.Confidence;
import com.stockpipe.jp.recommend.RecommendationCodec;
import com.stockpipe.jp.recommend.RecommendationMergeEngine;
import com.stockpipe.jp.schedule.ExecutionMode;
import com.stockpipe.jp.schedule.ExecutionModeSelector;
import com.stockpipe.jp.schedule.ModeOverrides;
import com.stockpipe.jp.schedule.WindowGuard;
import com.stockpipe.jp.snapshot.BackupVerifier;
import com.stockpipe.jp.snapshot.SelectionCodec;
import com.stockpipe.jp.snapshot.SelectionSnapshotStore;
import com.stockpipe.jp.store.InMemoryObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineRunnerTest {
    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
    private static final LocalDate THURSDAY = LocalDate.of(2024, 5, 9);
    private static final LocalDate FRIDAY = LocalDate.of(2024, 5, 10);
    private static final Instant FRIDAY_AFTERNOON = at(FRIDAY, 16, 30);
    private static final Instant THURSDAY_EVENING = at(THURSDAY, 23, 30);
    private static final Instant FRIDAY_EVENING = at(FRIDAY, 23, 30);

    private final StoreLayout layout = StoreLayout.defaults();
    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private final StubMetadata metadata = new StubMetadata();
    private final StubMarket market = new StubMarket();
    private final StubRanking ranking = new StubRanking();

    @Test
    void afternoonRefresh_shouldKeepPriorValuesForFailedInstruments() throws Exception {
        metadata.universe = universe(50);
        Map<String, PriceSeries> prior = new TreeMap<>();
        for (InstrumentMeta meta : metadata.universe) {
            prior.put(meta.instrumentId, series(meta.instrumentId, THURSDAY, 100.0));
        }
        store.put(layout.pricesKey(), PriceBookCodec.encode(prior, THURSDAY_EVENING));
        market.failing.addAll(List.of("1003", "1017", "1042"));

        PipelineRunReport report = runner(FRIDAY_AFTERNOON).run(ModeOverrides.none(), RunOptions.defaults());

        assertEquals(ExecutionMode.AFTERNOON_REFRESH, report.mode);
        assertEquals(RunStatus.PARTIAL, report.status);
        assertEquals(StepStatus.SUCCESS, report.stepStatus(RunTelemetry.STEP_FETCH_METADATA));
        StepResult prices = report.step(RunTelemetry.STEP_FETCH_PRICES);
        assertEquals(StepStatus.PARTIAL, prices.status());
        assertEquals(47, prices.evidence().get("updated"));
        assertEquals(3, prices.evidence().get("failed"));
        assertEquals(StepStatus.SKIPPED, report.stepStatus(RunTelemetry.STEP_BACKUP_VERIFY));
        assertEquals(StepStatus.SKIPPED, report.stepStatus(RunTelemetry.STEP_SCORE_SELECT));
        assertEquals(StepStatus.SUCCESS, report.stepStatus(RunTelemetry.STEP_PUBLISH_MANIFEST));

        Map<String, PriceSeries> book = PriceBookCodec.decode(store.get(layout.pricesKey()).orElseThrow());
        assertEquals(50, book.size());
        assertEquals(100.0, book.get("1003").lastClose(), 1e-9);
        assertEquals(THURSDAY, book.get("1042").bars.get(0).date);
        assertEquals(200.0, book.get("1000").lastClose(), 1e-9);
        assertEquals(1, store.list(layout.runsPrefix()).size());
        String journal = store.getText(store.list(layout.runsPrefix()).get(0).key()).orElseThrow();
        assertTrue(journal.contains("in=50 out=47 err=1"));
    }

    @Test
    void metadataFailure_shouldDegradeToCachedUniverse() throws Exception {
        store.put(layout.metadataKey(), MetadataCodec.encode(universe(3), THURSDAY_EVENING));
        metadata.failure = new TransientProviderException("HTTP 500");

        PipelineRunReport report = runner(FRIDAY_AFTERNOON).run(ModeOverrides.none(), RunOptions.defaults());

        StepResult step = report.step(RunTelemetry.STEP_FETCH_METADATA);
        assertEquals(StepStatus.DEGRADED, step.status());
        assertEquals("cache", step.evidence().get("source"));
        assertEquals(StepStatus.SUCCESS, report.stepStatus(RunTelemetry.STEP_FETCH_PRICES));
        assertEquals(3, market.calls.size());
        assertEquals(RunStatus.PARTIAL, report.status);
    }

    @Test
    void emptyUniverse_shouldNotReplaceCachedMetadata() throws Exception {
        byte[] cached = MetadataCodec.encode(universe(2), THURSDAY_EVENING);
        store.put(layout.metadataKey(), cached);
        metadata.universe = List.of();

        PipelineRunReport report = runner(FRIDAY_AFTERNOON).run(ModeOverrides.none(), RunOptions.defaults());

        assertEquals(StepStatus.DEGRADED, report.stepStatus(RunTelemetry.STEP_FETCH_METADATA));
        assertArrayEquals(cached, store.get(layout.metadataKey()).orElseThrow());
    }

    @Test
    void eveningSelect_shouldSelectArchiveAndPublish() throws Exception {
        metadata.universe = universe(8);
        store.put(layout.recommendationFinalKey(), RecommendationCodec.encode(new RecommendationCodec.Document(
                THURSDAY.minusDays(1), THURSDAY_EVENING, List.of())));

        PipelineRunReport report = runner(THURSDAY_EVENING).run(ModeOverrides.none(), RunOptions.defaults());

        assertEquals(ExecutionMode.EVENING_SELECT, report.mode);
        assertEquals(THURSDAY, report.referenceDate);
        assertEquals(RunStatus.SUCCESS, report.status);
        SelectionSnapshot live = SelectionCodec.decode(store.get(layout.selectionKey()).orElseThrow());
        assertEquals(THURSDAY, live.selectionDate);
        assertEquals(5, live.picks.size());
        assertEquals(1, live.picks.get(0).rank);
        assertEquals(200.0, live.picks.get(0).close, 1e-9);
        assertTrue(new BackupVerifier(store, layout, Clock.systemUTC()).archiveContains(THURSDAY));
        assertTrue(store.exists(layout.snapshotKey(THURSDAY)));
        RecommendationCodec.Document base = RecommendationCodec.decode(store.get(layout.recommendationKey()).orElseThrow());
        assertEquals(5, base.items.size());
        RecommendationCodec.Document merged = RecommendationCodec.decode(store.get(layout.recommendationFinalKey()).orElseThrow());
        assertEquals(THURSDAY, merged.referenceDate);
        assertEquals(5, merged.items.size());
        assertEquals(base.items.get(0).instrumentId, merged.items.get(0).instrumentId);
        assertEquals(base.items.get(0).baseAction, merged.items.get(0).finalAction);
        assertFalse(merged.items.get(0).hasRefinement);
        Set<String> declared = new ManifestPublisher(store, layout, Clock.systemUTC(), List.of()).read().orElseThrow().keys();
        assertTrue(declared.contains(layout.selectionKey()));
        assertTrue(declared.contains(layout.recommendationKey()));
    }

    @Test
    void eveningSelect_shouldReplaceArchivedSelectionNextDay() throws Exception {
        metadata.universe = universe(8);
        runner(THURSDAY_EVENING).run(ModeOverrides.none(), RunOptions.defaults());

        ModeOverrides forceFriday = ModeOverrides.force(ExecutionMode.EVENING_SELECT, FRIDAY);
        PipelineRunReport report = runner(FRIDAY_EVENING).run(forceFriday, new RunOptions(true, "manual"));

        assertEquals(RunStatus.SUCCESS, report.status);
        assertEquals("2024-05-09", report.step(RunTelemetry.STEP_BACKUP_VERIFY).evidence().get("protected_date"));
        assertEquals(FRIDAY, SelectionCodec.decode(store.get(layout.selectionKey()).orElseThrow()).selectionDate);
        assertTrue(store.exists(layout.snapshotKey(FRIDAY)));
    }

    @Test
    void eveningSelect_shouldKeepSelectionWhenSameEveningRunsAgain() throws Exception {
        metadata.universe = universe(10);
        runner(THURSDAY_EVENING).run(ModeOverrides.none(), RunOptions.defaults());
        byte[] liveBefore = store.get(layout.selectionKey()).orElseThrow();
        byte[] baseBefore = store.get(layout.recommendationKey()).orElseThrow();
        ranking.reversed = true;

        PipelineRunReport report = runner(THURSDAY_EVENING.plus(Duration.ofMinutes(10)))
                .run(ModeOverrides.none(), RunOptions.defaults());

        assertEquals(RunStatus.SUCCESS, report.status);
        assertEquals(StepStatus.SUCCESS, report.stepStatus(RunTelemetry.STEP_BACKUP_VERIFY));
        StepResult select = report.step(RunTelemetry.STEP_SCORE_SELECT);
        assertEquals(StepStatus.SKIPPED, select.status());
        assertTrue(select.reason().contains("already selected"));
        assertEquals(1, ranking.calls);
        assertArrayEquals(liveBefore, store.get(layout.selectionKey()).orElseThrow());
        assertArrayEquals(baseBefore, store.get(layout.recommendationKey()).orElseThrow());
        SelectionSnapshot archived = SelectionCodec.decode(store.get(layout.snapshotKey(THURSDAY)).orElseThrow());
        assertEquals("1000", archived.picks.get(0).instrumentId);
        assertEquals(5, new ArchiveWriter(store, layout, Clock.systemUTC(), 3).readAll().size());
    }

    @Test
    void missingBackup_shouldAbortWithoutTouchingLiveSelection() throws Exception {
        metadata.universe = universe(8);
        SelectionSnapshot unarchived = new SelectionSnapshot(THURSDAY.minusDays(1), THURSDAY_EVENING,
                List.of(new SelectionPick("1001", 1, 80.0, "core", "", 100.0)));
        byte[] liveBefore = SelectionCodec.encode(unarchived);
        store.put(layout.selectionKey(), liveBefore);

        PipelineRunReport report = runner(THURSDAY_EVENING).run(ModeOverrides.none(), RunOptions.defaults());

        assertEquals(RunStatus.ABORTED, report.status);
        assertEquals(StepStatus.SUCCESS, report.stepStatus(RunTelemetry.STEP_FETCH_PRICES));
        assertEquals(StepStatus.ABORTED, report.stepStatus(RunTelemetry.STEP_BACKUP_VERIFY));
        assertEquals(StepStatus.ABORTED, report.stepStatus(RunTelemetry.STEP_SCORE_SELECT));
        assertEquals(StepStatus.ABORTED, report.stepStatus(RunTelemetry.STEP_ARCHIVE_WRITE));
        assertEquals(StepStatus.ABORTED, report.stepStatus(RunTelemetry.STEP_PUBLISH_MANIFEST));
        assertTrue(report.abortReason.contains("backup missing"));
        assertArrayEquals(liveBefore, store.get(layout.selectionKey()).orElseThrow());
        assertFalse(store.exists(layout.manifestKey()));
        assertEquals(0, ranking.calls);
        assertEquals(1, store.list(layout.runsPrefix()).size());
    }

    @Test
    void deniedWindow_shouldNotTouchTheStore() throws Exception {
        metadata.universe = universe(8);

        PipelineRunReport report = runner(FRIDAY_EVENING).run(ModeOverrides.none(), RunOptions.defaults());

        assertEquals(RunStatus.ABORTED, report.status);
        assertEquals(StepStatus.ABORTED, report.stepStatus(RunTelemetry.STEP_VERIFY_WINDOW));
        assertEquals(StepStatus.SKIPPED, report.stepStatus(RunTelemetry.STEP_FETCH_PRICES));
        assertEquals("2024-05-11", report.step(RunTelemetry.STEP_VERIFY_WINDOW).evidence().get("checked_date"));
        assertEquals(0, store.size());
        assertEquals(0, metadata.calls);
        assertTrue(market.calls.isEmpty());
    }

    @Test
    void rankingFailure_shouldLeaveLiveSelectionAndStillPublish() throws Exception {
        metadata.universe = universe(4);
        ranking.failure = new PermanentProviderException("ranking inbox empty");

        PipelineRunReport report = runner(THURSDAY_EVENING).run(ModeOverrides.none(), RunOptions.defaults());

        assertEquals(RunStatus.PARTIAL, report.status);
        assertEquals(StepStatus.SUCCESS, report.stepStatus(RunTelemetry.STEP_BACKUP_VERIFY));
        assertEquals(StepStatus.FAILED, report.stepStatus(RunTelemetry.STEP_SCORE_SELECT));
        assertEquals(StepStatus.SKIPPED, report.stepStatus(RunTelemetry.STEP_ARCHIVE_WRITE));
        assertEquals(StepStatus.SUCCESS, report.stepStatus(RunTelemetry.STEP_PUBLISH_MANIFEST));
        assertFalse(store.exists(layout.selectionKey()));
    }

    @Test
    void corruptPriceBook_shouldFailStepWithoutRewritingIt() throws Exception {
        metadata.universe = universe(2);
        store.putText(layout.pricesKey(), "{not a book");

        PipelineRunReport report = runner(FRIDAY_AFTERNOON).run(ModeOverrides.none(), RunOptions.defaults());

        assertEquals(StepStatus.FAILED, report.stepStatus(RunTelemetry.STEP_FETCH_PRICES));
        assertEquals("{not a book", store.getText(layout.pricesKey()).orElseThrow());
        assertTrue(market.calls.isEmpty());
    }

    private PipelineRunner runner(Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        RecommendationMergeEngine engine = new RecommendationMergeEngine(
                ActionBands.parse("SELL:HIGH:-inf:-30,SELL:MEDIUM:-30:-15,HOLD:MEDIUM:-15:20,BUY:MEDIUM:20:40,BUY:HIGH:40:inf"),
                List.of("deep"),
                Confidence.HIGH
        );
        return PipelineRunner.builder()
                .selector(new ExecutionModeSelector(TOKYO, LocalTime.of(16, 0), LocalTime.of(23, 0), LocalTime.of(3, 0)))
                .guard(new WindowGuard(date -> TradingDayRecord.of(date, isWeekend(date)
                        ? HolidayClass.NON_TRADING
                        : HolidayClass.TRADING), List.of()))
                .store(store)
                .layout(layout)
                .metadataProvider(metadata)
                .marketDataProvider(market)
                .rankingProvider(ranking)
                .fetcher(new BoundedFetcher(new FetchPolicy(4, Duration.ofSeconds(5), 0, 0L)))
                .backupVerifier(new BackupVerifier(store, layout, clock))
                .snapshotStore(new SelectionSnapshotStore(store, layout))
                .archiveWriter(new ArchiveWriter(store, layout, clock, 3))
                .manifestPublisher(new ManifestPublisher(store, layout, clock, List.of()))
                .mergeEngine(engine)
                .journal(new RunJournal(store, layout))
                .clock(clock)
                .fetchPeriod("max")
                .fetchInterval("1d")
                .selectTopN(5)
                .build();
    }

    private static boolean isWeekend(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
    }

    private static List<InstrumentMeta> universe(int size) {
        List<InstrumentMeta> out = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            out.add(new InstrumentMeta(String.valueOf(1000 + i), "Name " + i, "Prime"));
        }
        return out;
    }

    private static PriceSeries series(String id, LocalDate date, double close) {
        return new PriceSeries(id, "max", "1d", List.of(new PriceBar(date, close, close, close, close, 1000.0)),
                Instant.parse("2024-05-09T08:00:00Z"));
    }

    private static Instant at(LocalDate date, int hour, int minute) {
        return ZonedDateTime.of(date, LocalTime.of(hour, minute), TOKYO).toInstant();
    }

    private static final class StubMetadata implements MetadataProvider {
        List<InstrumentMeta> universe = List.of();
        TransientProviderException failure;
        int calls;

        @Override
        public List<InstrumentMeta> fetchUniverse() throws TransientProviderException {
            calls++;
            if (failure != null) {
                throw failure;
            }
            return universe;
        }
    }

    private static final class StubMarket implements MarketDataProvider {
        final Set<String> failing = new HashSet<>();
        final List<String> calls = Collections.synchronizedList(new ArrayList<>());

        @Override
        public PriceSeries fetch(String instrumentId, String period, String interval) throws TransientProviderException {
            calls.add(instrumentId);
            if (failing.contains(instrumentId)) {
                throw new TransientProviderException("HTTP 503 for " + instrumentId);
            }
            return series(instrumentId, FRIDAY, 200.0);
        }
    }

    private static final class StubRanking implements RankingProvider {
        PermanentProviderException failure;
        boolean reversed;
        int calls;

        @Override
        public List<RankedCandidate> rank(LocalDate referenceDate, List<InstrumentMeta> universe,
                                          Map<String, PriceSeries> prices) throws PermanentProviderException {
            calls++;
            if (failure != null) {
                throw failure;
            }
            List<RankedCandidate> out = new ArrayList<>();
            for (int i = 0; i < universe.size(); i++) {
                out.add(new RankedCandidate(universe.get(i).instrumentId, 60.0 - i * 10.0, "core", "stub"));
            }
            if (reversed) {
                Collections.reverse(out);
            }
            return out;
        }
    }
}
