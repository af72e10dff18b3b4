package com.stockpipe.app;

import com.stockpipe.app.properties.CalendarProperties;
import com.stockpipe.app.properties.FetchProperties;
import com.stockpipe.app.properties.StoreProperties;
import com.stockpipe.data.http.HttpClientEx;
import com.stockpipe.jp.calendar.JQuantsCalendarOracle;
import com.stockpipe.jp.calendar.TradingCalendarOracle;
import com.stockpipe.jp.config.Config;
import com.stockpipe.jp.fetch.FetchPolicy;
import com.stockpipe.jp.manifest.ManifestReconciler;
import com.stockpipe.jp.recommend.RecommendationMergeJob;
import com.stockpipe.jp.runner.PipelineRunner;
import com.stockpipe.jp.store.InMemoryObjectStore;
import com.stockpipe.jp.store.LocalDirectoryObjectStore;
import com.stockpipe.jp.store.ObjectStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({StoreProperties.class, CalendarProperties.class, FetchProperties.class})
public class StockPipeBootstrapConfig {
    @Bean
    public Config stockPipeConfig(Environment environment) {
        Map<String, Object> stockPipeRawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, stockPipeRawProperties);
    }

    @Bean
    public ObjectStore objectStore(StoreProperties storeProperties) {
        String type = firstNonBlank(
                storeProperties == null ? null : storeProperties.getType(),
                "local"
        ).toLowerCase(Locale.ROOT);
        if (type.equals("memory")) {
            return new InMemoryObjectStore();
        }
        if (!type.equals("local")) {
            throw new IllegalStateException("unsupported store.type: " + type);
        }
        String root = firstNonBlank(
                System.getenv("STOCKPIPE_STORE_ROOT"),
                storeProperties == null ? null : storeProperties.getRoot(),
                "outputs/store"
        );
        return new LocalDirectoryObjectStore(Path.of(root).toAbsolutePath().normalize());
    }

    @Bean
    public HttpClientEx httpClient() {
        return new HttpClientEx();
    }

    @Bean
    @Lazy
    public TradingCalendarOracle tradingCalendarOracle(HttpClientEx httpClient, CalendarProperties calendarProperties) {
        return new JQuantsCalendarOracle(
                httpClient,
                calendarProperties.getBaseUrl(),
                firstNonBlank(System.getenv("STOCKPIPE_JQUANTS_TOKEN"), calendarProperties.getIdToken()),
                calendarProperties.getLookaroundDays(),
                calendarProperties.getRequestTimeoutSec()
        );
    }

    @Bean
    public FetchPolicy fetchPolicy(FetchProperties fetchProperties) {
        FetchProperties.Retry retry = fetchProperties.getRetry() == null
                ? new FetchProperties.Retry()
                : fetchProperties.getRetry();
        return new FetchPolicy(
                fetchProperties.getConcurrent(),
                Duration.ofSeconds(Math.max(1, fetchProperties.getTimeoutSec())),
                retry.getMax(),
                retry.getBackoffMs()
        );
    }

    @Bean
    public PipelineFactory pipelineFactory(
            Config stockPipeConfig,
            ObjectStore objectStore,
            HttpClientEx httpClient,
            FetchPolicy fetchPolicy,
            @Lazy TradingCalendarOracle tradingCalendarOracle
    ) {
        return new PipelineFactory(stockPipeConfig, objectStore, Clock.systemUTC(), httpClient) {
            @Override
            public TradingCalendarOracle calendarOracle() {
                return tradingCalendarOracle;
            }

            @Override
            public FetchPolicy fetchPolicy() {
                return fetchPolicy;
            }
        };
    }

    @Bean
    @Lazy
    public PipelineRunner pipelineRunner(PipelineFactory pipelineFactory) {
        return pipelineFactory.pipelineRunner();
    }

    @Bean
    @Lazy
    public ManifestReconciler manifestReconciler(PipelineFactory pipelineFactory) {
        return pipelineFactory.manifestReconciler();
    }

    @Bean
    @Lazy
    public RecommendationMergeJob recommendationMergeJob(PipelineFactory pipelineFactory) {
        return pipelineFactory.mergeJob();
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
