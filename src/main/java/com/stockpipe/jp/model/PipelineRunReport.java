package com.stockpipe.jp.model;

import com.stockpipe.core.StepResult;
import com.stockpipe.core.StepStatus;
import com.stockpipe.jp.schedule.ExecutionMode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PipelineRunReport {
    public final String runId;
    public final ExecutionMode mode;
    public final LocalDate referenceDate;
    public final Instant startedAt;
    public final Instant finishedAt;
    public final RunStatus status;
    public final String abortReason;
    public final List<StepResult> steps;

    public StepResult step(String name) {
        if (steps == null) {
            return null;
        }
        for (StepResult step : steps) {
            if (step.step().equals(name)) {
                return step;
            }
        }
        return null;
    }

    public StepStatus stepStatus(String name) {
        StepResult step = step(name);
        return step == null ? null : step.status();
    }
}
