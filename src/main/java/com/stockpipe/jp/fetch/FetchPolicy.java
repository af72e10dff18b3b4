package com.stockpipe.jp.fetch;

import com.stockpipe.jp.config.Config;

import java.time.Duration;

/**
 * Parallelism, per-attempt timeout and retry budget for one batch of fetches.
 */
public record FetchPolicy(int concurrency, Duration attemptTimeout, int maxRetries, long backoffMs) {
    public FetchPolicy {
        concurrency = Math.max(1, concurrency);
        attemptTimeout = attemptTimeout == null || attemptTimeout.isNegative() || attemptTimeout.isZero()
                ? Duration.ofSeconds(30)
                : attemptTimeout;
        maxRetries = Math.max(0, maxRetries);
        backoffMs = Math.max(0L, backoffMs);
    }

    public static FetchPolicy fromConfig(Config config) {
        return new FetchPolicy(
                config.getInt("fetch.concurrent", 4),
                Duration.ofSeconds(Math.max(1, config.getInt("fetch.timeout_sec", 30))),
                config.getInt("fetch.retry.max", 2),
                config.getLong("fetch.retry.backoff_ms", 400L)
        );
    }

    long backoffBeforeRetry(int attempt) {
        long waitMs = backoffMs * (1L << Math.min(20, attempt));
        return Math.max(50L, waitMs);
    }
}
