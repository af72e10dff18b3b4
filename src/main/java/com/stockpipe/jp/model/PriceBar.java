package com.stockpipe.jp.model;

import java.time.LocalDate;

public final class PriceBar {
    public final LocalDate date;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public PriceBar(LocalDate date, double open, double high, double low, double close, double volume) {
        this.date = date;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }
}
