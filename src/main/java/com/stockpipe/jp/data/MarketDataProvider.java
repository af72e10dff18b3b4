package com.stockpipe.jp.data;

import com.stockpipe.jp.error.ProviderException;
import com.stockpipe.jp.model.PriceSeries;

public interface MarketDataProvider {
    PriceSeries fetch(String instrumentId, String period, String interval) throws ProviderException;
}
