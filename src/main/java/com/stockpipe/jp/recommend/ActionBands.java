package com.stockpipe.jp.recommend;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 模块说明：ActionBands（class）。
 * 主要职责：把连续得分映射为动作与置信度，区间以配置数据给出（形如 SELL:HIGH:-inf:-30,...），不写死在分支里。
 * 使用建议：区间必须首尾相接覆盖整个实数轴；得分恰好落在边界上时取保守的一侧。
 */
public final class ActionBands {
    private final List<ActionBand> bands;

    public ActionBands(List<ActionBand> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("at least one action band is required");
        }
        List<ActionBand> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(ActionBand::lower));
        if (sorted.get(0).lower() != Double.NEGATIVE_INFINITY
                || sorted.get(sorted.size() - 1).upper() != Double.POSITIVE_INFINITY) {
            throw new IllegalArgumentException("action bands must cover (-inf, inf)");
        }
        for (int i = 1; i < sorted.size(); i++) {
            if (Double.compare(sorted.get(i - 1).upper(), sorted.get(i).lower()) != 0) {
                throw new IllegalArgumentException("action bands must be contiguous at "
                        + sorted.get(i - 1).upper() + " / " + sorted.get(i).lower());
            }
        }
        this.bands = List.copyOf(sorted);
    }

    /**
     * Parses {@code ACTION:CONFIDENCE:LOWER:UPPER} entries separated by commas or semicolons.
     */
    public static ActionBands parse(String definition) {
        String text = definition == null ? "" : definition.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("action band definition is empty");
        }
        List<ActionBand> out = new ArrayList<>();
        for (String token : text.split("[,;]")) {
            String entry = token.trim();
            if (entry.isEmpty()) {
                continue;
            }
            String[] parts = entry.split(":");
            if (parts.length != 4) {
                throw new IllegalArgumentException("action band must be ACTION:CONFIDENCE:LOWER:UPPER, got " + entry);
            }
            out.add(new ActionBand(
                    Action.parse(parts[0]),
                    Confidence.parse(parts[1]),
                    bound(parts[2]),
                    bound(parts[3])
            ));
        }
        return new ActionBands(out);
    }

    public List<ActionBand> bands() {
        return bands;
    }

    public Classification classify(double score) {
        if (!Double.isFinite(score)) {
            throw new IllegalArgumentException("score must be finite: " + score);
        }
        for (int i = 0; i < bands.size(); i++) {
            ActionBand band = bands.get(i);
            if (band.containsStrictly(score)) {
                return new Classification(band.action(), band.confidence(), false);
            }
            if (i + 1 < bands.size() && score == band.upper()) {
                return onBoundary(band, bands.get(i + 1));
            }
        }
        throw new IllegalStateException("score not covered by action bands: " + score);
    }

    private static Classification onBoundary(ActionBand below, ActionBand above) {
        if (below.action() == Action.HOLD && above.action() == Action.HOLD) {
            return new Classification(Action.HOLD, Confidence.lower(below.confidence(), above.confidence()), true);
        }
        if (below.action() == Action.HOLD) {
            return new Classification(Action.HOLD, below.confidence(), true);
        }
        if (above.action() == Action.HOLD) {
            return new Classification(Action.HOLD, above.confidence(), true);
        }
        if (below.action() != above.action()) {
            return new Classification(Action.HOLD, Confidence.LOW, true);
        }
        return new Classification(below.action(), Confidence.lower(below.confidence(), above.confidence()), true);
    }

    private static double bound(String raw) {
        String text = raw.trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "-inf":
            case "-infinity":
                return Double.NEGATIVE_INFINITY;
            case "inf":
            case "+inf":
            case "infinity":
                return Double.POSITIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid band bound: " + raw, e);
                }
        }
    }
}
