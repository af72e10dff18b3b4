package com.stockpipe.jp.recommend;

import com.stockpipe.jp.manifest.ManifestPublisher;
import com.stockpipe.jp.manifest.ManifestReconciler;
import com.stockpipe.jp.store.InMemoryObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecommendationMergeJobTest {
    private static final LocalDate DAY = LocalDate.of(2024, 5, 10);

    private final StoreLayout layout = StoreLayout.defaults();
    private final RecommendationMergeEngine engine = new RecommendationMergeEngine(
            ActionBands.parse("SELL:HIGH:-inf:-30,SELL:MEDIUM:-30:-15,HOLD:MEDIUM:-15:20,BUY:MEDIUM:20:40,BUY:HIGH:40:inf"),
            List.of("deep"),
            Confidence.HIGH
    );
    private InMemoryObjectStore store;
    private RecommendationMergeJob job;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryObjectStore();
        Clock clock = Clock.fixed(Instant.parse("2024-05-10T15:30:00Z"), ZoneOffset.UTC);
        job = new RecommendationMergeJob(store, layout, engine,
                new ManifestPublisher(store, layout, clock, List.of()), clock);
        store.put(layout.recommendationKey(), RecommendationCodec.encode(new RecommendationCodec.Document(
                DAY,
                Instant.parse("2024-05-10T15:00:00Z"),
                List.of(engine.baseFromScore("7203", 45.0), engine.baseFromScore("6758", 5.0))
        )));
    }

    @Test
    void run_shouldPublishBaseOnlyWhenNoLayerArrived() throws Exception {
        MergeJobResult result = job.run();

        assertTrue(result.written());
        assertEquals(2, result.total());
        assertEquals(0, result.refined());
        assertTrue(result.layersFound().isEmpty());
        RecommendationCodec.Document out = RecommendationCodec.decode(store.get(layout.recommendationFinalKey()).orElseThrow());
        assertEquals(Action.BUY, out.items.get(0).finalAction);
        assertTrue(new ManifestReconciler(store, layout, 10).plan().inSync());
    }

    @Test
    void run_shouldMergeArrivedLayerAndCountOverrides() throws Exception {
        store.putText(layout.refinementInboxKey("deep", DAY), "{\"layer\":\"deep\",\"items\":["
                + "{\"instrument_id\":\"7203\",\"score\":-40.0,\"rationale\":\"recall\"},"
                + "{\"instrument_id\":\"1111\",\"score\":10.0}"
                + "]}");

        MergeJobResult result = job.run(DAY);

        assertEquals(1, result.refined());
        assertEquals(1, result.overrides());
        assertEquals(List.of("deep"), result.layersFound());
        RecommendationCodec.Document out = RecommendationCodec.decode(store.get(layout.recommendationFinalKey()).orElseThrow());
        RecommendationRecord first = out.items.get(0);
        assertEquals("7203", first.instrumentId);
        assertEquals(Action.SELL, first.finalAction);
        assertEquals(Action.BUY, first.baseAction);
        assertTrue(first.overrideFlag);
        assertFalse(out.items.get(1).hasRefinement);
    }

    @Test
    void run_shouldBeIdempotent() throws Exception {
        store.putText(layout.refinementInboxKey("deep", DAY),
                "{\"layer\":\"deep\",\"items\":[{\"instrument_id\":\"6758\",\"score\":25.5,\"action\":\"BUY\"}]}");
        job.run();
        byte[] first = store.get(layout.recommendationFinalKey()).orElseThrow();

        MergeJobResult again = job.run();

        assertFalse(again.written());
        assertArrayEquals(first, store.get(layout.recommendationFinalKey()).orElseThrow());
    }

    @Test
    void run_shouldRefuseWithoutOrMismatchedBase() throws Exception {
        assertThrows(IllegalStateException.class, () -> job.run(DAY.plusDays(1)));

        store.delete(layout.recommendationKey());
        assertThrows(IllegalStateException.class, job::run);
    }
}
