package com.stockpipe.jp.recommend;

/**
 * Open score interval {@code (lower, upper)} mapped to an action and confidence.
 */
public record ActionBand(Action action, Confidence confidence, double lower, double upper) {
    public ActionBand {
        if (action == null || confidence == null) {
            throw new IllegalArgumentException("band action and confidence are required");
        }
        if (Double.isNaN(lower) || Double.isNaN(upper) || !(lower < upper)) {
            throw new IllegalArgumentException("band bounds must satisfy lower < upper: " + lower + ", " + upper);
        }
    }

    public boolean containsStrictly(double score) {
        return score > lower && score < upper;
    }
}
