package com.signalmix.news;

import com.signalmix.config.Config;
import com.signalmix.core.diagnostics.CauseCode;
import com.signalmix.core.diagnostics.StageOutcome;
import com.signalmix.core.diagnostics.StageStatus;
import com.signalmix.model.CombinedRow;
import com.signalmix.model.NewsEvent;
import com.signalmix.model.SignalRow;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewsEnrichmentEngineTest {
    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Test
    void newerInWindowEventShouldWin() {
        Table log = log(
                event("BHP", "Older BHP story", "rss", hoursAgo(10)),
                event("BHP", "Newer BHP story", "api", hoursAgo(2))
        );

        Map<String, NewsEvent> latest = NewsEnrichmentEngine.latestByTicker(log, NOW, 96);

        assertEquals("Newer BHP story", latest.get("BHP").getHeadline());
    }

    @Test
    void eventOlderThanWindowShouldBeIgnoredEvenWhenAlone() {
        Table log = log(event("RIO", "Stale", "rss", hoursAgo(97)));

        assertTrue(NewsEnrichmentEngine.latestByTicker(log, NOW, 96).isEmpty());
    }

    @Test
    void equalTimestampsShouldKeepEarliestLogRowAndSkipBlankHeadlines() {
        String ts = hoursAgo(1);
        Table log = log(
                event("WES", "", "api", hoursAgo(0)),
                event("WES", "First at tie", "api", ts),
                event("WES", "Second at tie", "rss", ts)
        );

        Map<String, NewsEvent> latest = NewsEnrichmentEngine.latestByTicker(log, NOW, 96);

        assertEquals("First at tie", latest.get("WES").getHeadline());
    }

    @Test
    void futureDatedEventShouldNotBeatRecentEvent() {
        Table log = log(
                event("BHP", "Real recent", "api", hoursAgo(1)),
                event("BHP", "Stamped a month ahead", "rss", NOW.plus(Duration.ofDays(30)).toString()),
                event("FMG", "Tomorrow", "api", NOW.plus(Duration.ofHours(3)).toString())
        );

        Map<String, NewsEvent> latest = NewsEnrichmentEngine.latestByTicker(log, NOW, 96);

        assertEquals("Real recent", latest.get("BHP").getHeadline());
        assertFalse(latest.containsKey("FMG"));
    }

    @Test
    void enrichShouldReplaceHeadlineAndMarkSource() {
        CombinedRow bhp = CombinedRow.unenriched(signal("BHP", "model"));
        CombinedRow cba = CombinedRow.unenriched(signal("CBA", "model"));
        CombinedRow blank = CombinedRow.unenriched(signal("RIO", null));
        Map<String, NewsEvent> latest = Map.of(
                "BHP", new NewsEvent("BHP", "<b>BHP</b> lifts &amp; guidance", "reuters", NOW),
                "RIO", new NewsEvent("RIO", "Rio update", "rss", NOW)
        );

        List<CombinedRow> out = NewsEnrichmentEngine.enrich(List.of(bhp, cba, blank), latest);

        assertEquals("BHP lifts & guidance", out.get(0).getSignal().getHeadline());
        assertEquals("model+news:reuters", out.get(0).getSignal().getSource());
        assertSame(cba, out.get(1));
        assertEquals("news:rss", out.get(2).getSignal().getSource());
    }

    @Test
    void mergeShouldOrderSourcesDedupeAndExpandLegacyLayout() {
        Table api = log(event("BHP", "Same story", "api", hoursAgo(1)));
        Table previous = log(
                event("BHP", "Same story", "api", hoursAgo(1)),
                event("OLD", "Beyond retention", "api", hoursAgo(800))
        );
        Table legacy = Table.empty(List.of("ts_utc", "title", "tickers"));
        legacy.addRow(Map.of("ts_utc", "2026-03-10 08:00:00", "title", "Miners rally", "tickers", "[\"BHP.AX\",\"rio\"]"));
        Map<String, Table> sources = new LinkedHashMap<>();
        sources.put(NewsEnrichmentEngine.SOURCE_API, api);
        sources.put(NewsEnrichmentEngine.SOURCE_RSS, legacy);
        sources.put(NewsEnrichmentEngine.SOURCE_LOG, previous);

        Table merged = NewsEnrichmentEngine.mergeEventLogs(sources, NOW, 720);

        assertEquals(NewsEnrichmentEngine.LOG_COLUMNS, merged.columns());
        assertEquals(3, merged.size());
        assertEquals("Same story", merged.get(0, "headline"));
        assertEquals("BHP", merged.get(1, "ticker"));
        assertEquals("RIO", merged.get(2, "ticker"));
        assertEquals("rss", merged.get(2, "source"));
        assertEquals("2026-03-10T08:00:00Z", merged.get(2, "ts"));
    }

    @Test
    void rowsWithoutSourceColumnShouldTakeTheFeedName() {
        Table feed = CsvTables.parse("symbol,title,published_at\nANZ,ANZ result,2026-03-10T10:00:00Z\n");

        Table merged = NewsEnrichmentEngine.mergeEventLogs(Map.of(NewsEnrichmentEngine.SOURCE_API, feed), NOW, 720);

        assertEquals("api", merged.get(0, "source"));
        assertEquals("ANZ result", merged.get(0, "headline"));
    }

    @Test
    void runShouldPersistLogAndEnrichCombinedArtifact(@TempDir Path tempDir) throws Exception {
        Path api = tempDir.resolve("data/news_api.csv");
        Files.createDirectories(api.getParent());
        Files.writeString(api,
                "ticker,headline,source,ts\n"
                        + "BHP,Older,api," + hoursAgo(20) + "\n"
                        + "BHP,Latest BHP,api," + hoursAgo(3) + "\n"
                        + "CBA,Bad time,api,not-a-date\n",
                StandardCharsets.UTF_8);
        NewsEnrichmentEngine engine = new NewsEnrichmentEngine(
                Config.fromConfigurationProperties(tempDir, Map.of()),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );

        StageOutcome<List<CombinedRow>> outcome = engine.run(List.of(
                CombinedRow.unenriched(signal("BHP", "model")),
                CombinedRow.unenriched(signal("CBA", "model"))
        ));

        assertEquals(StageStatus.DEGRADED, outcome.status);
        assertEquals(CauseCode.MALFORMED_ROW, outcome.causeCode);
        assertEquals("Latest BHP", outcome.value.get(0).getSignal().getHeadline());
        assertEquals("Model swing pick", outcome.value.get(1).getSignal().getHeadline());
        Table events = CsvTables.read(tempDir.resolve("data/events.csv")).orElseThrow();
        assertEquals(3, events.size());
        Table combined = CsvTables.read(tempDir.resolve("artifacts/nextday_combined.csv")).orElseThrow();
        assertEquals("model+news:api", combined.get(0, "source"));
    }

    @Test
    void runWithoutAnyEventTableShouldDegrade(@TempDir Path tempDir) throws Exception {
        NewsEnrichmentEngine engine = new NewsEnrichmentEngine(
                Config.fromConfigurationProperties(tempDir, Map.of()),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );

        StageOutcome<List<CombinedRow>> outcome = engine.run(List.of(CombinedRow.unenriched(signal("BHP", "model"))));

        assertEquals(CauseCode.MISSING_INPUT, outcome.causeCode);
        assertEquals("model", outcome.value.get(0).getSignal().getSource());
        assertTrue(Files.exists(tempDir.resolve("data/events.csv")));
        assertFalse(outcome.isFailed());
    }

    private static String hoursAgo(int hours) {
        return NOW.minus(Duration.ofHours(hours)).toString();
    }

    private static Map<String, String> event(String ticker, String headline, String source, String ts) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("ticker", ticker);
        row.put("headline", headline);
        row.put("source", source);
        row.put("ts", ts);
        return row;
    }

    @SafeVarargs
    private static Table log(Map<String, String>... rows) {
        Table table = Table.empty(NewsEnrichmentEngine.LOG_COLUMNS);
        for (Map<String, String> row : rows) {
            table.addRow(row);
        }
        return table;
    }

    private static SignalRow signal(String ticker, String source) {
        return SignalRow.builder()
                .group(SignalRow.GROUP_SWING)
                .ticker(ticker)
                .headline("Model swing pick")
                .source(source)
                .build();
    }
}
