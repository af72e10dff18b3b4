package com.stockpipe.jp.recommend;

import java.util.Locale;

public enum Action {
    BUY(1),
    HOLD(0),
    SELL(-1);

    private final int sign;

    Action(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    /**
     * BUY against SELL. HOLD is never a reversal.
     */
    public boolean isOpposite(Action other) {
        return other != null && sign != 0 && other.sign != 0 && sign != other.sign;
    }

    public static Action parse(String raw) {
        String text = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        switch (text) {
            case "BUY":
            case "LONG":
                return BUY;
            case "SELL":
            case "SHORT":
                return SELL;
            case "HOLD":
            case "NEUTRAL":
                return HOLD;
            default:
                throw new IllegalArgumentException("unknown action: " + raw);
        }
    }
}
