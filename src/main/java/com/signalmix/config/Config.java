package com.signalmix.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：按 默认值 -> classpath config.properties -> 工作目录 config.properties 的顺序合并配置。
 * 使用建议：新增配置项时同步补充 buildDefaults()，保证缺省运行可用。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
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

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

/**
 * 方法说明：getPath，按工作目录解析相对路径。
 * 维护提示：空值返回工作目录本身，调用方需自行判断是否为目录。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    /**
     * Command line flags win over every file-based source.
     */
    public void override(String key, String value) {
        putBoundValue(this, key, value);
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        String local = nonBlank(overrideProps.getProperty(key));
        if (!local.isEmpty()) {
            return "override";
        }
        String resource = nonBlank(resourceProps.getProperty(key));
        if (!resource.isEmpty()) {
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
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("universe.valid_path", "data/nextday_universe_valid.csv");
        defaults.put("universe.seed_path", "universe_ax.txt");
        defaults.put("universe.price_cache_dir", ".");
        defaults.put("universe.price_cache_pattern", "cache_([A-Z0-9]+)\\.AX_ohlc\\.csv");

        defaults.put("swing.plan_dir", "out");
        defaults.put("swing.plan_glob", "trade_plan*.csv");
        defaults.put("swing.report_path", "artifacts/nextday_report.csv");

        defaults.put("microcap.candidates_path", "artifacts/microcap_candidates.csv");
        defaults.put("microcap.top_n", "50");

        defaults.put("combine.out_path", "artifacts/nextday_combined.csv");
        defaults.put("combine.tickers_path", "artifacts/combined_tickers.csv");

        defaults.put("caps.path", "data/universe_caps.csv");
        defaults.put("caps.fetch_max", "10000");
        defaults.put("caps.cache_path", "data/fundamentals_cache.json");

        defaults.put("news.window_hours", "96");
        defaults.put("news.retention_hours", "720");
        defaults.put("news.api_path", "data/news_api.csv");
        defaults.put("news.rss_path", "data/news_rss.csv");
        defaults.put("news.events_path", "data/events.csv");

        defaults.put("report.swing_rows", "12");
        defaults.put("report.headline_max_chars", "90");

        defaults.put("collaborator.workers", "8");
        defaults.put("collaborator.commands.swing-model", "");
        defaults.put("collaborator.commands.microcap-scanner", "");
        defaults.put("collaborator.commands.market-caps", "");
        defaults.put("collaborator.commands.news-api", "");
        defaults.put("collaborator.commands.news-rss", "");

        return Collections.unmodifiableMap(defaults);
    }
}
