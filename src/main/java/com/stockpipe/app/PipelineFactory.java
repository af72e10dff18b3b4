package com.stockpipe.app;

import com.stockpipe.data.http.HttpClientEx;
import com.stockpipe.jp.archive.ArchiveWriter;
import com.stockpipe.jp.calendar.JQuantsCalendarOracle;
import com.stockpipe.jp.calendar.TradingCalendarOracle;
import com.stockpipe.jp.config.Config;
import com.stockpipe.jp.data.MarketDataProvider;
import com.stockpipe.jp.data.MetadataProvider;
import com.stockpipe.jp.data.RankingProvider;
import com.stockpipe.jp.data.StoredRankingProvider;
import com.stockpipe.jp.data.UniverseFileMetadataProvider;
import com.stockpipe.jp.data.YahooChartPriceProvider;
import com.stockpipe.jp.fetch.BoundedFetcher;
import com.stockpipe.jp.fetch.FetchPolicy;
import com.stockpipe.jp.manifest.ManifestPublisher;
import com.stockpipe.jp.manifest.ManifestReconciler;
import com.stockpipe.jp.recommend.ActionBands;
import com.stockpipe.jp.recommend.Confidence;
import com.stockpipe.jp.recommend.RecommendationMergeEngine;
import com.stockpipe.jp.recommend.RecommendationMergeJob;
import com.stockpipe.jp.runner.PipelineRunner;
import com.stockpipe.jp.runner.RunJournal;
import com.stockpipe.jp.schedule.ExecutionModeSelector;
import com.stockpipe.jp.schedule.WindowGuard;
import com.stockpipe.jp.snapshot.BackupVerifier;
import com.stockpipe.jp.snapshot.SelectionSnapshotStore;
import com.stockpipe.jp.store.InMemoryObjectStore;
import com.stockpipe.jp.store.LocalDirectoryObjectStore;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;

import java.time.Clock;
import java.util.Locale;

/**
 * Builds the pipeline components from one {@link Config}. External providers are overridable
 * so embedded callers can swap the network-backed defaults.
 */
public class PipelineFactory {
    private final Config config;
    private final ObjectStore store;
    private final StoreLayout layout;
    private final Clock clock;
    private final HttpClientEx http;

    public PipelineFactory(Config config) {
        this(config, openStore(config), Clock.systemUTC(), new HttpClientEx());
    }

    public PipelineFactory(Config config, ObjectStore store, Clock clock, HttpClientEx http) {
        if (config == null) {
            throw new IllegalArgumentException("config is required");
        }
        this.config = config;
        this.store = store == null ? openStore(config) : store;
        this.layout = new StoreLayout(config);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.http = http == null ? new HttpClientEx() : http;
    }

    public static ObjectStore openStore(Config config) {
        String type = config.getString("store.type", "local").toLowerCase(Locale.ROOT);
        switch (type) {
            case "local":
                return new LocalDirectoryObjectStore(config.getPath("store.root"));
            case "memory":
                return new InMemoryObjectStore();
            default:
                throw new IllegalArgumentException("unsupported store.type: " + type);
        }
    }

    public Config config() {
        return config;
    }

    public ObjectStore store() {
        return store;
    }

    public StoreLayout layout() {
        return layout;
    }

    public Clock clock() {
        return clock;
    }

    public ExecutionModeSelector modeSelector() {
        return ExecutionModeSelector.fromConfig(config);
    }

    public TradingCalendarOracle calendarOracle() {
        return new JQuantsCalendarOracle(http, config);
    }

    public WindowGuard windowGuard() {
        return new WindowGuard(calendarOracle(), config.getDateList("calendar.skip_dates"));
    }

    public MetadataProvider metadataProvider() {
        return new UniverseFileMetadataProvider(config.getPath("universe.path"));
    }

    public MarketDataProvider marketDataProvider() {
        return new YahooChartPriceProvider(
                http,
                config.getString("fetch.base_url"),
                config.getString("fetch.symbol_suffix"),
                config.getInt("fetch.timeout_sec", 30),
                config.getZone("app.zone"),
                clock
        );
    }

    public RankingProvider rankingProvider() {
        return new StoredRankingProvider(store, layout);
    }

    public FetchPolicy fetchPolicy() {
        return FetchPolicy.fromConfig(config);
    }

    public BackupVerifier backupVerifier() {
        return new BackupVerifier(store, layout, clock);
    }

    public SelectionSnapshotStore snapshotStore() {
        return new SelectionSnapshotStore(store, layout);
    }

    public ArchiveWriter archiveWriter() {
        return new ArchiveWriter(store, layout, clock, config.getInt("archive.write.max_attempts", 3));
    }

    public ManifestPublisher manifestPublisher() {
        return new ManifestPublisher(store, layout, clock, config.getList("manifest.extra_keys"));
    }

    public ManifestReconciler manifestReconciler() {
        return new ManifestReconciler(store, layout, config.getInt("reconcile.max_delete", 50));
    }

    public RecommendationMergeEngine mergeEngine() {
        return new RecommendationMergeEngine(
                ActionBands.parse(config.requireString("recommend.bands")),
                config.getList("recommend.layers"),
                Confidence.parse(config.getString("recommend.override.min_confidence", "HIGH"))
        );
    }

    public RecommendationMergeJob mergeJob() {
        return new RecommendationMergeJob(store, layout, mergeEngine(), manifestPublisher(), clock);
    }

    public RunJournal runJournal() {
        return new RunJournal(store, layout);
    }

    public PipelineRunner pipelineRunner() {
        return PipelineRunner.builder()
                .selector(modeSelector())
                .guard(windowGuard())
                .store(store)
                .layout(layout)
                .metadataProvider(metadataProvider())
                .marketDataProvider(marketDataProvider())
                .rankingProvider(rankingProvider())
                .fetcher(new BoundedFetcher(fetchPolicy()))
                .backupVerifier(backupVerifier())
                .snapshotStore(snapshotStore())
                .archiveWriter(archiveWriter())
                .manifestPublisher(manifestPublisher())
                .mergeEngine(mergeEngine())
                .journal(runJournal())
                .clock(clock)
                .fetchPeriod(config.getString("fetch.period"))
                .fetchInterval(config.getString("fetch.interval"))
                .selectTopN(config.getInt("select.top_n", 10))
                .build();
    }
}
