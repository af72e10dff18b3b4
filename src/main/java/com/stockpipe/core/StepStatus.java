package com.stockpipe.core;

public enum StepStatus {
    SUCCESS,
    DEGRADED,
    PARTIAL,
    FAILED,
    SKIPPED,
    ABORTED
}
