package com.stockpipe.jp.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：合并内置默认值、classpath 下的 config.properties 与工作目录下的覆盖文件，提供按类型读取的入口。
 * 使用建议：新增配置项时同步更新 buildDefaults 与 resources/config.properties。
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir == null ? Path.of(".").toAbsolutePath().normalize() : workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("broken classpath config.properties, continuing with defaults: {}", e.getMessage());
        }

        Path local = config.workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    /**
     * Config made only of defaults plus the given overrides. Used by tests and embedded callers.
     */
    public static Config of(Map<String, String> overrides) {
        Config config = new Config(null);
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                putBoundValue(config, entry.getKey(), entry.getValue());
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public ZoneId getZone(String key) {
        String value = getString(key, "Asia/Tokyo");
        try {
            return ZoneId.of(value);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid zone for " + key + ": " + value, e);
        }
    }

    public LocalTime getLocalTime(String key) {
        String value = requireString(key);
        try {
            return LocalTime.parse(value.length() == 4 ? "0" + value : value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid time for " + key + ": " + value, e);
        }
    }

    public List<LocalDate> getDateList(String key) {
        List<LocalDate> out = new ArrayList<>();
        for (String token : getList(key)) {
            try {
                out.add(LocalDate.parse(token));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid date in " + key + ": " + token, e);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("app.zone", "Asia/Tokyo");

        defaults.put("schedule.refresh.start", "16:00");
        defaults.put("schedule.select.start", "23:00");
        defaults.put("schedule.select.end", "03:00");

        defaults.put("store.type", "local");
        defaults.put("store.root", "outputs/store");
        defaults.put("store.mutable_prefix", "parquet/");
        defaults.put("store.archive_prefix", "parquet/backtest/");
        defaults.put("store.manifest_key", "parquet/manifest.json");
        defaults.put("store.selection_key", "parquet/selection_current.json");
        defaults.put("store.snapshot_key_pattern", "parquet/backtest/selection_{yyyyMMdd}.json");
        defaults.put("store.archive_key", "parquet/backtest/selection_archive.json");
        defaults.put("store.metadata_key", "parquet/meta.json");
        defaults.put("store.prices_key", "parquet/prices_max_1d.json");
        defaults.put("store.recommendation_key", "parquet/recommendations.json");
        defaults.put("store.recommendation_final_key", "parquet/recommendations_final.json");
        defaults.put("store.runs_prefix", "runs/");
        defaults.put("store.ranking_inbox_pattern", "inbox/ranking_{yyyyMMdd}.json");
        defaults.put("store.refinement_inbox_pattern", "inbox/refinement/{layer}_{yyyyMMdd}.json");

        defaults.put("calendar.base_url", "https://api.jquants.com/v1");
        defaults.put("calendar.id_token", "");
        defaults.put("calendar.lookaround_days", "10");
        defaults.put("calendar.request_timeout_sec", "20");
        defaults.put("calendar.skip_dates", "");
        defaults.put("calendar.skip_check", "false");

        defaults.put("universe.path", "universe.txt");
        defaults.put("fetch.base_url", "https://query1.finance.yahoo.com");
        defaults.put("fetch.period", "max");
        defaults.put("fetch.interval", "1d");
        defaults.put("fetch.symbol_suffix", ".T");
        defaults.put("fetch.concurrent", "4");
        defaults.put("fetch.timeout_sec", "30");
        defaults.put("fetch.retry.max", "2");
        defaults.put("fetch.retry.backoff_ms", "400");

        defaults.put("select.top_n", "10");
        defaults.put("archive.write.max_attempts", "3");
        defaults.put("manifest.extra_keys", "");
        defaults.put("reconcile.max_delete", "50");

        defaults.put("recommend.bands",
                "SELL:HIGH:-inf:-30,SELL:MEDIUM:-30:-15,HOLD:MEDIUM:-15:20,BUY:MEDIUM:20:40,BUY:HIGH:40:inf");
        defaults.put("recommend.layers", "deep");
        defaults.put("recommend.override.min_confidence", "HIGH");
        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
