package com.stockpipe.jp.model;

public enum RunStatus {
    SUCCESS,
    PARTIAL,
    ABORTED
}
