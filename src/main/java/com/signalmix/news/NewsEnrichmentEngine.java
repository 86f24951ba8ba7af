package com.signalmix.news;

import com.signalmix.combine.SignalTableCodec;
import com.signalmix.config.Config;
import com.signalmix.core.diagnostics.CauseCode;
import com.signalmix.core.diagnostics.StageOutcome;
import com.signalmix.model.CombinedRow;
import com.signalmix.model.NewsEvent;
import com.signalmix.model.SignalRow;
import com.signalmix.table.Cells;
import com.signalmix.table.ColumnAliases;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import com.signalmix.ticker.TickerNormalizer;
import com.signalmix.utils.TextFormatter;
import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 模块说明：NewsEnrichmentEngine（class）。
 * 主要职责：合并 API / RSS / 历史事件表为统一事件日志，按时间窗口为每个 ticker 选出最新标题并写回合并报表。
 * 使用建议：时间戳无法解析的事件只保留在日志里，不参与匹配；同一时间戳按原始行号先到先得。
 */
public final class NewsEnrichmentEngine {
    public static final String OWNER = "news.enrich";

    public static final String COL_TICKER = "ticker";
    public static final String COL_HEADLINE = "headline";
    public static final String COL_SOURCE = "source";
    public static final String COL_TS = "ts";
    public static final List<String> LOG_COLUMNS = List.of(COL_TICKER, COL_HEADLINE, COL_SOURCE, COL_TS);

    public static final String SOURCE_API = "api";
    public static final String SOURCE_RSS = "rss";
    public static final String SOURCE_LOG = "events";

    static final ColumnAliases HEADLINE = ColumnAliases.of("headline", "title", "Headline", "Title");
    static final ColumnAliases SOURCE = ColumnAliases.of("source", "Source", "publisher");
    static final ColumnAliases TIMESTAMP = ColumnAliases.of(
            "ts", "ts_utc", "timestamp", "published_at", "publishedAt", "date", "Date"
    );

    private static final String LEGACY_TS = "ts_utc";
    private static final String LEGACY_TITLE = "title";
    private static final String LEGACY_TICKERS = "tickers";

    private final Config config;
    private final Clock clock;

    public NewsEnrichmentEngine(Config config, Clock clock) {
        this.config = config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Builds the canonical event log. Keys of {@code tables} are the fallback source for rows
     * without a source column; iteration order is precedence order (API, RSS, previous log).
     * Parseable events older than the retention horizon are dropped.
     */
    public static Table mergeEventLogs(Map<String, Table> tables, Instant now, int retentionHours) {
        Table log = Table.empty(LOG_COLUMNS);
        Set<List<String>> seen = new HashSet<>();
        Instant horizon = retentionHours > 0 ? now.minus(Duration.ofHours(retentionHours)) : null;
        for (Map.Entry<String, Table> entry : tables.entrySet()) {
            Table table = entry.getValue();
            if (table == null) {
                continue;
            }
            for (Map<String, String> row : canonicalRows(table, entry.getKey())) {
                Instant ts = TimestampParser.parse(row.get(COL_TS));
                if (ts != null && horizon != null && ts.isBefore(horizon)) {
                    continue;
                }
                List<String> key = List.of(
                        nz(row.get(COL_TICKER)), nz(row.get(COL_HEADLINE)), nz(row.get(COL_SOURCE)), nz(row.get(COL_TS))
                );
                if (seen.add(key)) {
                    log.addRow(row);
                }
            }
        }
        return log;
    }

    /**
     * Freshest event per ticker with {@code now - windowHours <= ts <= now}.
     */
    public static Map<String, NewsEvent> latestByTicker(Table log, Instant now, int windowHours) {
        Instant windowStart = now.minus(Duration.ofHours(Math.max(0, windowHours)));
        List<NewsEvent> candidates = new ArrayList<>();
        for (int i = 0; i < log.size(); i++) {
            String ticker = TickerNormalizer.normalize(log.get(i, COL_TICKER));
            String headline = Cells.text(log.get(i, COL_HEADLINE));
            Instant ts = TimestampParser.parse(log.get(i, COL_TS));
            if (ticker.isEmpty() || headline == null || ts == null || ts.isBefore(windowStart)
                    || ts.isAfter(now)) {
                continue;
            }
            candidates.add(new NewsEvent(ticker, headline, Cells.text(log.get(i, COL_SOURCE)), ts));
        }
        // List.sort is stable, so equal timestamps keep their log order.
        candidates.sort(Comparator.comparing(NewsEvent::getTimestamp).reversed());

        Map<String, NewsEvent> out = new LinkedHashMap<>();
        for (NewsEvent event : candidates) {
            out.putIfAbsent(event.getTicker(), event);
        }
        return out;
    }

    public static List<CombinedRow> enrich(List<CombinedRow> rows, Map<String, NewsEvent> latest) {
        List<CombinedRow> out = new ArrayList<>(rows.size());
        for (CombinedRow row : rows) {
            NewsEvent event = row.getSignal() == null ? null : latest.get(row.getTicker());
            if (event == null) {
                out.add(row);
                continue;
            }
            SignalRow signal = row.getSignal().toBuilder()
                    .headline(TextFormatter.toPlainText(event.getHeadline()))
                    .source(markSource(row.getSignal().getSource(), event.getSource()))
                    .build();
            out.add(row.toBuilder().signal(signal).build());
        }
        return out;
    }

    static String markSource(String original, String eventSource) {
        String marker = "news:" + (eventSource == null ? "" : eventSource);
        if (original == null || original.isBlank()) {
            return marker;
        }
        return original + "+" + marker;
    }

    public StageOutcome<List<CombinedRow>> run(List<CombinedRow> rows) throws IOException {
        Instant now = clock.instant();
        Path eventsPath = config.getPath("news.events_path");

        Map<String, Table> sources = new LinkedHashMap<>();
        int available = 0;
        for (Map.Entry<String, Path> input : inputs(eventsPath).entrySet()) {
            Optional<Table> table = readQuietly(input.getValue());
            if (table.isPresent()) {
                available++;
            }
            sources.put(input.getKey(), table.orElse(null));
        }

        Table log = mergeEventLogs(sources, now, config.getInt("news.retention_hours", 720));
        CsvTables.write(eventsPath, log);

        int windowHours = config.getInt("news.window_hours", 96);
        Map<String, NewsEvent> latest = latestByTicker(log, now, windowHours);
        List<CombinedRow> enriched = enrich(rows, latest);
        CsvTables.write(config.getPath("combine.out_path"), SignalTableCodec.toCombinedTable(enriched));

        long unparseable = log.column(COL_TS).stream().filter(ts -> TimestampParser.parse(ts) == null).count();
        long attached = 0;
        for (int i = 0; i < rows.size(); i++) {
            if (enriched.get(i) != rows.get(i)) {
                attached++;
            }
        }
        System.out.println("News enrichment: events=" + log.size()
                + ", in_window_tickers=" + latest.size()
                + ", attached=" + attached
                + ", unparseable_ts=" + unparseable
                + ", window_hours=" + windowHours);
        if (unparseable > 0) {
            System.err.println("WARN: news events with unparseable timestamps ignored, count=" + unparseable);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("events", log.size());
        details.put("attached", attached);
        details.put("unparseable_ts", unparseable);
        if (available == 0) {
            return StageOutcome.degraded(enriched, CauseCode.MISSING_INPUT, OWNER, "no event tables found", details);
        }
        if (unparseable > 0) {
            return StageOutcome.degraded(
                    enriched,
                    CauseCode.MALFORMED_ROW,
                    OWNER,
                    unparseable + " events with unparseable timestamps",
                    details
            );
        }
        return StageOutcome.ok(enriched, OWNER, details);
    }

    private Map<String, Path> inputs(Path eventsPath) {
        Map<String, Path> out = new LinkedHashMap<>();
        out.put(SOURCE_API, config.getPath("news.api_path"));
        out.put(SOURCE_RSS, config.getPath("news.rss_path"));
        out.put(SOURCE_LOG, eventsPath);
        return out;
    }

    private Optional<Table> readQuietly(Path path) {
        try {
            return CsvTables.read(path);
        } catch (IOException e) {
            System.err.println("WARN: news table unreadable, path=" + path + ", err=" + e.getMessage());
            return Optional.empty();
        }
    }

    private static List<Map<String, String>> canonicalRows(Table table, String fallbackSource) {
        if (isLegacyLayout(table)) {
            return expandLegacy(table);
        }
        List<Map<String, String>> out = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            String source = Cells.text(SOURCE.valueOf(table, i));
            out.add(logRow(
                    TickerNormalizer.normalize(ColumnAliases.TICKER.valueOf(table, i)),
                    Cells.text(HEADLINE.valueOf(table, i)),
                    source == null ? fallbackSource : source,
                    canonicalTs(TIMESTAMP.valueOf(table, i))
            ));
        }
        return out;
    }

    private static boolean isLegacyLayout(Table table) {
        return table.hasColumn(LEGACY_TS)
                && table.hasColumn(LEGACY_TITLE)
                && table.hasColumn(LEGACY_TICKERS)
                && ColumnAliases.TICKER.resolve(table).isEmpty();
    }

    // One event per listed ticker.
    private static List<Map<String, String>> expandLegacy(Table table) {
        List<Map<String, String>> out = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            String ts = canonicalTs(table.get(i, LEGACY_TS));
            String title = Cells.text(table.get(i, LEGACY_TITLE));
            for (String raw : legacyTickers(table.get(i, LEGACY_TICKERS))) {
                String ticker = TickerNormalizer.normalize(raw);
                if (!ticker.isEmpty()) {
                    out.add(logRow(ticker, title, SOURCE_RSS, ts));
                }
            }
        }
        return out;
    }

    static List<String> legacyTickers(String cell) {
        List<String> out = new ArrayList<>();
        String text = Cells.text(cell);
        if (text == null) {
            return out;
        }
        if (!text.startsWith("[")) {
            for (String part : text.split("[,;\\s]+")) {
                if (!part.isBlank()) {
                    out.add(part);
                }
            }
            return out;
        }
        try {
            JSONArray array = new JSONArray(text);
            for (int i = 0; i < array.length(); i++) {
                String value = array.optString(i, "");
                if (!value.isBlank()) {
                    out.add(value);
                }
            }
        } catch (JSONException e) {
            System.err.println("WARN: malformed tickers array in news row, value=" + text);
        }
        return out;
    }

    private static Map<String, String> logRow(String ticker, String headline, String source, String ts) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(COL_TICKER, ticker == null || ticker.isEmpty() ? null : ticker);
        row.put(COL_HEADLINE, headline);
        row.put(COL_SOURCE, source);
        row.put(COL_TS, ts);
        return row;
    }

    // Parseable timestamps are stored as ISO instants so duplicates across feeds line up.
    private static String canonicalTs(String raw) {
        Instant parsed = TimestampParser.parse(raw);
        if (parsed != null) {
            return parsed.toString();
        }
        return Cells.text(raw);
    }

    private static String nz(String value) {
        return value == null ? "" : value;
    }
}
