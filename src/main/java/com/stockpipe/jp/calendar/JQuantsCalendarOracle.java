package com.stockpipe.jp.calendar;

import com.stockpipe.data.http.HttpClientEx;
import com.stockpipe.jp.config.Config;
import com.stockpipe.jp.error.CalendarUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模块说明：JQuantsCalendarOracle（class）。
 * 主要职责：调用 J-Quants 交易日历接口，按查询日期前后若干天批量拉取并缓存 HolidayDivision。
 * 使用建议：接口不可用或返回中缺少目标日期时一律抛出 CalendarUnavailableException，不做默认推断。
 */
public final class JQuantsCalendarOracle implements TradingCalendarOracle {
    private static final Logger LOG = LogManager.getLogger(JQuantsCalendarOracle.class);
    private static final String ENDPOINT = "/markets/trading_calendar";

    private final HttpClientEx http;
    private final String baseUrl;
    private final String idToken;
    private final int lookaroundDays;
    private final int timeoutSec;
    private final Map<LocalDate, HolidayClass> cache = new ConcurrentHashMap<>();

    public JQuantsCalendarOracle(HttpClientEx http, Config config) {
        this(
                http,
                config.getString("calendar.base_url"),
                firstNonBlank(System.getenv("STOCKPIPE_JQUANTS_TOKEN"), config.getString("calendar.id_token")),
                config.getInt("calendar.lookaround_days", 10),
                config.getInt("calendar.request_timeout_sec", 20)
        );
    }

    public JQuantsCalendarOracle(HttpClientEx http, String baseUrl, String idToken, int lookaroundDays, int timeoutSec) {
        this.http = http == null ? new HttpClientEx() : http;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.idToken = idToken == null ? "" : idToken.trim();
        this.lookaroundDays = Math.max(0, lookaroundDays);
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    @Override
    public TradingDayRecord query(LocalDate date) throws CalendarUnavailableException {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        HolidayClass cached = cache.get(date);
        if (cached != null) {
            return TradingDayRecord.of(date, cached);
        }
        Map<LocalDate, HolidayClass> fetched = fetchRange(date.minusDays(lookaroundDays), date.plusDays(lookaroundDays), date);
        fetched.forEach((day, value) -> {
            if (value != HolidayClass.UNKNOWN) {
                cache.put(day, value);
            }
        });
        HolidayClass holidayClass = fetched.get(date);
        if (holidayClass == null || holidayClass == HolidayClass.UNKNOWN) {
            throw new CalendarUnavailableException(date, "calendar has no usable entry for " + date);
        }
        return TradingDayRecord.of(date, holidayClass);
    }

    private Map<LocalDate, HolidayClass> fetchRange(LocalDate from, LocalDate to, LocalDate target)
            throws CalendarUnavailableException {
        if (baseUrl.isEmpty()) {
            throw new CalendarUnavailableException(target, "calendar.base_url is not configured");
        }
        String url = baseUrl + ENDPOINT + "?from=" + from + "&to=" + to;
        Map<String, String> headers = new HashMap<>();
        if (!idToken.isEmpty()) {
            headers.put("Authorization", "Bearer " + idToken);
        }
        String body;
        try {
            body = http.getText(url, headers, timeoutSec);
        } catch (IOException e) {
            throw new CalendarUnavailableException(target, "calendar request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalendarUnavailableException(target, "calendar request interrupted", e);
        }
        try {
            return parse(body);
        } catch (JSONException | DateTimeParseException e) {
            throw new CalendarUnavailableException(target, "calendar response unreadable: " + e.getMessage(), e);
        }
    }

    static Map<LocalDate, HolidayClass> parse(String body) {
        JSONObject root = new JSONObject(body);
        JSONArray rows = root.optJSONArray("trading_calendar");
        if (rows == null) {
            rows = root.optJSONArray("data");
        }
        Map<LocalDate, HolidayClass> out = new HashMap<>();
        if (rows == null) {
            return out;
        }
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.optJSONObject(i);
            if (row == null) {
                continue;
            }
            String rawDate = row.optString("Date", "").trim();
            if (rawDate.isEmpty()) {
                continue;
            }
            String division = row.has("HolidayDivision")
                    ? row.optString("HolidayDivision", "")
                    : row.optString("HolDiv", "");
            HolidayClass holidayClass = HolidayClass.fromCode(division);
            if (holidayClass == HolidayClass.UNKNOWN) {
                LOG.warn("unknown holiday division '{}' for {}", division, rawDate);
            }
            out.put(LocalDate.parse(rawDate), holidayClass);
        }
        return out;
    }

    private static String trimTrailingSlash(String raw) {
        String text = raw == null ? "" : raw.trim();
        while (text.endsWith("/")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return "";
    }
}
