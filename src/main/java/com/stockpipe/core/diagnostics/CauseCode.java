package com.stockpipe.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：统一描述单个抓取单元失败或降级的原因，供 Outcome 与运行报告引用。
 * 使用建议：新增枚举值时同步检查 BoundedFetcher 的重试判定。
 */
public enum CauseCode {
    NONE,
    STALE,
    FETCH_FAILED,
    TRANSIENT,
    PERMANENT,
    TIMEOUT,
    INTERRUPTED,
    RUNTIME_ERROR
}
