package com.stockpipe.jp.fetch;

import com.stockpipe.core.diagnostics.CauseCode;
import com.stockpipe.core.diagnostics.Outcome;
import com.stockpipe.jp.error.PermanentProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 模块说明：BoundedFetcher（class）。
 * 主要职责：以固定并发度逐个单元执行抓取，每次尝试独立超时，失败按指数退避有限次重试。
 * 使用建议：重试耗尽的单元降级为 STALE，永久性错误不重试；单个单元的失败不会阻塞整批。
 */
public final class BoundedFetcher {
    private static final Logger LOG = LogManager.getLogger(BoundedFetcher.class);

    private final FetchPolicy policy;

    public BoundedFetcher(FetchPolicy policy) {
        this.policy = policy == null ? new FetchPolicy(1, null, 0, 0L) : policy;
    }

    @FunctionalInterface
    public interface UnitTask<T> {
        T fetch(String unit) throws Exception;
    }

    /**
     * Runs {@code task} for every distinct unit and returns one outcome per unit, in input order.
     */
    public <T> Map<String, Outcome<T>> fetchAll(List<String> units, UnitTask<T> task) throws InterruptedException {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(units == null ? List.of() : units));
        Map<String, Outcome<T>> results = new LinkedHashMap<>();
        if (distinct.isEmpty()) {
            return results;
        }
        int threads = Math.min(policy.concurrency(), distinct.size());
        ExecutorService workers = Executors.newFixedThreadPool(threads, daemonThreads("fetch-unit"));
        ExecutorService attempts = Executors.newFixedThreadPool(threads, daemonThreads("fetch-attempt"));
        CompletionService<UnitResult<T>> completion = new ExecutorCompletionService<>(workers);
        for (String unit : distinct) {
            completion.submit(() -> new UnitResult<>(unit, runUnit(unit, task, attempts)));
        }

        Map<String, Outcome<T>> byUnit = new LinkedHashMap<>();
        try {
            for (int i = 0; i < distinct.size(); i++) {
                Future<UnitResult<T>> future = completion.take();
                try {
                    UnitResult<T> done = future.get();
                    byUnit.put(done.unit, done.outcome);
                } catch (ExecutionException e) {
                    LOG.error("fetch worker crashed: {}", e.getCause() == null ? e.getMessage() : e.getCause().toString());
                }
            }
        } finally {
            workers.shutdownNow();
            attempts.shutdownNow();
        }
        for (String unit : distinct) {
            Outcome<T> outcome = byUnit.get(unit);
            results.put(unit, outcome != null
                    ? outcome
                    : Outcome.failure(CauseCode.RUNTIME_ERROR, unit, Map.of("error", "worker crashed")));
        }
        return results;
    }

    private <T> Outcome<T> runUnit(String unit, UnitTask<T> task, ExecutorService attempts) {
        int maxRetries = policy.maxRetries();
        CauseCode lastCause = CauseCode.FETCH_FAILED;
        String lastError = "";
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            Callable<T> call = () -> task.fetch(unit);
            Future<T> future = attempts.submit(call);
            try {
                T value = future.get(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("attempts", attempt + 1);
                return Outcome.success(value, unit, details);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastCause = CauseCode.TIMEOUT;
                lastError = "timed out after " + policy.attemptTimeout().toMillis() + "ms";
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return Outcome.failure(CauseCode.INTERRUPTED, unit, Map.of("attempts", attempt + 1));
            } catch (CancellationException e) {
                lastCause = CauseCode.FETCH_FAILED;
                lastError = "cancelled";
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                lastError = cause.getClass().getSimpleName() + ": " + cause.getMessage();
                if (cause instanceof PermanentProviderException) {
                    LOG.warn("fetch {} failed permanently: {}", unit, cause.getMessage());
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("attempts", attempt + 1);
                    details.put("error", lastError);
                    return Outcome.failure(CauseCode.PERMANENT, unit, details);
                }
                lastCause = CauseCode.TRANSIENT;
            }
            if (attempt < maxRetries) {
                long waitMs = policy.backoffBeforeRetry(attempt);
                LOG.debug("fetch {} attempt {} failed ({}), retrying in {}ms", unit, attempt + 1, lastError, waitMs);
                try {
                    Thread.sleep(waitMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return Outcome.failure(CauseCode.INTERRUPTED, unit, Map.of("attempts", attempt + 1));
                }
            }
        }
        LOG.warn("fetch {} exhausted {} attempt(s), marking stale: {}", unit, maxRetries + 1, lastError);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempts", maxRetries + 1);
        details.put("last_cause", lastCause.name());
        details.put("error", lastError);
        return Outcome.failure(CauseCode.STALE, unit, details);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class UnitResult<T> {
        private final String unit;
        private final Outcome<T> outcome;

        private UnitResult(String unit, Outcome<T> outcome) {
            this.unit = unit;
            this.outcome = outcome;
        }
    }
}
