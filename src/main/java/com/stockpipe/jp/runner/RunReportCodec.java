package com.stockpipe.jp.runner;

import com.stockpipe.core.StepResult;
import com.stockpipe.jp.model.PipelineRunReport;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.Map;

final class RunReportCodec {
    private RunReportCodec() {
    }

    static byte[] encode(PipelineRunReport report, String telemetrySummary) {
        JSONObject root = new JSONObject();
        root.put("run_id", report.runId);
        root.put("mode", report.mode.name());
        root.put("reference_date", report.referenceDate.toString());
        root.put("started_at", report.startedAt.toString());
        root.put("finished_at", report.finishedAt.toString());
        root.put("status", report.status.name());
        if (report.abortReason != null && !report.abortReason.isEmpty()) {
            root.put("abort_reason", report.abortReason);
        }
        JSONArray steps = new JSONArray();
        for (StepResult step : report.steps) {
            JSONObject row = new JSONObject();
            row.put("step", step.step());
            row.put("status", step.status().name());
            row.put("reason", step.reason());
            row.put("elapsed_ms", step.elapsedMs());
            JSONObject evidence = new JSONObject();
            for (Map.Entry<String, Object> entry : step.evidence().entrySet()) {
                evidence.put(entry.getKey(), JSONObject.wrap(entry.getValue()));
            }
            row.put("evidence", evidence);
            steps.put(row);
        }
        root.put("steps", steps);
        root.put("telemetry", telemetrySummary == null ? "" : telemetrySummary);
        return root.toString(2).getBytes(StandardCharsets.UTF_8);
    }
}
