package com.stockpipe.jp.data;

import com.stockpipe.data.http.HttpClientEx;
import com.stockpipe.data.http.HttpStatusException;
import com.stockpipe.jp.error.PermanentProviderException;
import com.stockpipe.jp.error.ProviderException;
import com.stockpipe.jp.error.TransientProviderException;
import com.stockpipe.jp.model.PriceBar;
import com.stockpipe.jp.model.PriceSeries;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 模块说明：YahooChartPriceProvider（class）。
 * 主要职责：调用 Yahoo chart 接口抓取日线，把 429/5xx/网络错误归为可重试，把 404/解析失败/空数据归为永久失败。
 * 使用建议：纯数字代码自动补交易所后缀（默认 .T）。
 */
public final class YahooChartPriceProvider implements MarketDataProvider {
    private final HttpClientEx http;
    private final String baseUrl;
    private final String symbolSuffix;
    private final int timeoutSec;
    private final ZoneId exchangeZone;
    private final Clock clock;

    public YahooChartPriceProvider(HttpClientEx http, String baseUrl, String symbolSuffix, int timeoutSec,
                                   ZoneId exchangeZone, Clock clock) {
        this.http = http == null ? new HttpClientEx() : http;
        this.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
        this.symbolSuffix = symbolSuffix == null ? "" : symbolSuffix.trim();
        this.timeoutSec = Math.max(1, timeoutSec);
        this.exchangeZone = exchangeZone == null ? ZoneId.of("Asia/Tokyo") : exchangeZone;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public PriceSeries fetch(String instrumentId, String period, String interval) throws ProviderException {
        String symbol = toSymbol(instrumentId);
        String url = baseUrl + "/v8/finance/chart/" + URLEncoder.encode(symbol, StandardCharsets.UTF_8)
                + "?range=" + period + "&interval=" + interval;
        String body;
        try {
            body = http.getText(url, timeoutSec);
        } catch (HttpStatusException e) {
            if (e.isRetryable()) {
                throw new TransientProviderException(e.getMessage(), e);
            }
            throw new PermanentProviderException(e.getMessage(), e);
        } catch (IOException e) {
            throw new TransientProviderException("request failed for " + symbol + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProviderException("interrupted while fetching " + symbol, e);
        }

        List<PriceBar> bars;
        try {
            bars = parseBars(body, exchangeZone);
        } catch (JSONException e) {
            throw new PermanentProviderException("unreadable chart payload for " + symbol + ": " + e.getMessage(), e);
        }
        if (bars.isEmpty()) {
            throw new PermanentProviderException("no bars returned for " + symbol);
        }
        return new PriceSeries(instrumentId, period, interval, List.copyOf(bars), clock.instant());
    }

    String toSymbol(String instrumentId) {
        String id = instrumentId == null ? "" : instrumentId.trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("instrumentId is required");
        }
        if (!symbolSuffix.isEmpty() && id.matches("\\d{4,5}[A-Z]?")) {
            return id + symbolSuffix;
        }
        return id;
    }

    static List<PriceBar> parseBars(String body, ZoneId zone) {
        List<PriceBar> out = new ArrayList<>();
        JSONObject root = new JSONObject(body);
        JSONObject chart = root.optJSONObject("chart");
        if (chart == null) return out;
        JSONArray result = chart.optJSONArray("result");
        if (result == null || result.length() == 0) return out;
        JSONObject r0 = result.optJSONObject(0);
        if (r0 == null) return out;

        JSONArray timestamps = r0.optJSONArray("timestamp");
        JSONObject indicators = r0.optJSONObject("indicators");
        JSONArray quoteArr = indicators == null ? null : indicators.optJSONArray("quote");
        JSONObject quote0 = (quoteArr == null || quoteArr.length() == 0) ? null : quoteArr.optJSONObject(0);
        if (timestamps == null || quote0 == null) return out;

        JSONArray opens = quote0.optJSONArray("open");
        JSONArray highs = quote0.optJSONArray("high");
        JSONArray lows = quote0.optJSONArray("low");
        JSONArray closes = quote0.optJSONArray("close");
        JSONArray volumes = quote0.optJSONArray("volume");
        if (closes == null) return out;

        int n = Math.min(timestamps.length(), closes.length());
        for (int i = 0; i < n; i++) {
            if (closes.isNull(i)) continue;
            long epoch = timestamps.optLong(i, 0L);
            double close = closes.optDouble(i, Double.NaN);
            if (epoch <= 0 || !Double.isFinite(close) || close <= 0.0) continue;

            double open = valueOrFallback(opens, i, close);
            double high = valueOrFallback(highs, i, Math.max(open, close));
            double low = valueOrFallback(lows, i, Math.min(open, close));
            if (high < Math.max(open, close)) high = Math.max(open, close);
            if (low > Math.min(open, close)) low = Math.min(open, close);

            double volume = valueOrFallback(volumes, i, 0.0);
            if (!Double.isFinite(volume) || volume < 0.0) {
                volume = 0.0;
            }

            LocalDate d = Instant.ofEpochSecond(epoch).atZone(zone).toLocalDate();
            out.add(new PriceBar(d, open, high, low, close, volume));
        }
        out.sort(Comparator.comparing(bar -> bar.date));
        return out;
    }

    private static double valueOrFallback(JSONArray arr, int index, double fallback) {
        if (arr == null || index < 0 || index >= arr.length() || arr.isNull(index)) {
            return fallback;
        }
        double value = arr.optDouble(index, Double.NaN);
        if (!Double.isFinite(value)) {
            return fallback;
        }
        return value;
    }
}
