package com.stockpipe.jp.runner;

import com.stockpipe.core.RunTelemetry;
import com.stockpipe.core.StepResult;
import com.stockpipe.jp.model.PipelineRunReport;
import com.stockpipe.jp.store.ObjectStore;
import com.stockpipe.jp.store.StoreLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Persists each run's report under the runs prefix and logs its summary.
 */
public class RunJournal {
    private static final Logger LOG = LogManager.getLogger(RunJournal.class);

    private final ObjectStore store;
    private final StoreLayout layout;

    public RunJournal(ObjectStore store, StoreLayout layout) {
        this.store = store;
        this.layout = layout;
    }

    /**
     * @return the key the report was written to, or empty when the write failed
     */
    public String record(PipelineRunReport report, RunTelemetry telemetry) {
        String summary = telemetry == null ? "" : telemetry.getSummary();
        LOG.info("run {} finished status={} mode={} reference_date={} elapsed_ms={}{}",
                report.runId, report.status, report.mode, report.referenceDate,
                telemetry == null ? 0L : telemetry.totalElapsedMs(),
                report.abortReason == null || report.abortReason.isEmpty() ? "" : " abort_reason=" + report.abortReason);
        for (StepResult step : report.steps) {
            LOG.info("  {} {} {}", step.step(), step.status(), step.reason());
        }
        LOG.debug("telemetry\n{}", summary);
        String key = layout.runReportKey(report.referenceDate, report.runId);
        try {
            store.put(key, RunReportCodec.encode(report, summary));
            return key;
        } catch (IOException e) {
            LOG.error("failed to journal run {} at {}: {}", report.runId, key, e.getMessage());
            return "";
        }
    }
}
