package com.stockpipe.jp.recommend;

public record Classification(Action action, Confidence confidence, boolean onBoundary) {
}
