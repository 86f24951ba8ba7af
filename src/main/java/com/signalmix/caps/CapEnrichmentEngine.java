package com.signalmix.caps;

import com.signalmix.combine.SignalTableCodec;
import com.signalmix.config.Config;
import com.signalmix.core.diagnostics.CauseCode;
import com.signalmix.core.diagnostics.StageOutcome;
import com.signalmix.model.CapBand;
import com.signalmix.model.CapRecord;
import com.signalmix.model.CombinedRow;
import com.signalmix.model.SignalRow;
import com.signalmix.table.Cells;
import com.signalmix.table.ColumnAliases;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import com.signalmix.ticker.TickerNormalizer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * 模块说明：CapEnrichmentEngine（class）。
 * 主要职责：读取市值表，推断单位（原始货币 or 百万），按 ticker 左连接到合并结果并划分 cap band。
 * 使用建议：市值表缺失或列名无法识别时所有行为 Unclassified，阶段结果为 DEGRADED 而不是失败。
 */
public final class CapEnrichmentEngine {
    public static final String OWNER = "caps.enrich";

    private final Config config;

    public CapEnrichmentEngine(Config config) {
        this.config = config;
    }

    public static CapLookup buildLookup(Table capTable) {
        if (capTable == null) {
            return CapLookup.empty();
        }
        Optional<String> tickerColumn = ColumnAliases.TICKER.resolve(capTable);
        Optional<String> capColumn = ColumnAliases.MARKET_CAP.resolve(capTable);
        if (tickerColumn.isEmpty() || capColumn.isEmpty()) {
            return new CapLookup(
                    Map.of(),
                    tickerColumn.orElse(null),
                    capColumn.orElse(null),
                    null,
                    false,
                    null
            );
        }
        Optional<String> sectorColumn = ColumnAliases.SECTOR.resolve(capTable);

        List<Double> raw = new ArrayList<>(capTable.size());
        for (String cell : capTable.column(capColumn.get())) {
            raw.add(Cells.toDouble(cell));
        }
        boolean convert = MarketCapUnits.looksLikeRawUnits(raw);
        List<Double> millions = MarketCapUnits.toMillions(raw);

        Map<String, CapRecord> byTicker = new LinkedHashMap<>();
        for (int i = 0; i < capTable.size(); i++) {
            String ticker = TickerNormalizer.normalize(capTable.get(i, tickerColumn.get()));
            if (ticker.isEmpty() || byTicker.containsKey(ticker)) {
                continue;
            }
            String sector = sectorColumn.isPresent() ? Cells.text(capTable.get(i, sectorColumn.get())) : null;
            byTicker.put(ticker, new CapRecord(ticker, millions.get(i), sector));
        }
        return new CapLookup(
                Collections.unmodifiableMap(byTicker),
                tickerColumn.get(),
                capColumn.get(),
                sectorColumn.orElse(null),
                convert,
                MarketCapUnits.median(raw)
        );
    }

    public static List<CombinedRow> enrich(List<SignalRow> rows, CapLookup lookup) {
        List<CombinedRow> out = new ArrayList<>(rows.size());
        for (SignalRow row : rows) {
            SignalRow signal = row.toBuilder().ticker(TickerNormalizer.normalize(row.getTicker())).build();
            CapRecord record = lookup.find(signal.getTicker());
            if (record == null) {
                out.add(CombinedRow.unenriched(signal));
                continue;
            }
            out.add(new CombinedRow(
                    signal,
                    record.getMarketCapM(),
                    record.getSector(),
                    CapBand.of(record.getMarketCapM())
            ));
        }
        return out;
    }

    /**
     * Joinable tickers with no cap entry yet, sorted. These are the only ones worth fetching.
     */
    public static List<String> missingTickers(List<SignalRow> rows, CapLookup lookup) {
        TreeSet<String> out = new TreeSet<>();
        for (SignalRow row : rows) {
            String ticker = TickerNormalizer.normalize(row.getTicker());
            if (!ticker.isEmpty() && lookup.find(ticker) == null) {
                out.add(ticker);
            }
        }
        return new ArrayList<>(out);
    }

    public static final List<String> CANONICAL_CAP_COLUMNS = List.of(
            SignalTableCodec.COL_TICKER,
            SignalTableCodec.COL_MARKET_CAP_M,
            SignalTableCodec.COL_SECTOR
    );

    /**
     * Each side is resolved and unit-converted on its own, then written as ticker,market_cap_m,sector
     * in millions. Fetched entries win; cached entries fill in the tickers the fetch did not return.
     * A side whose columns cannot be resolved contributes nothing.
     */
    public static Table mergeFetched(Table existing, Table fetched) {
        Map<String, CapRecord> merged = new LinkedHashMap<>();
        for (Table side : Arrays.asList(fetched, existing)) {
            if (side == null) {
                continue;
            }
            CapLookup lookup = buildLookup(side);
            if (lookup.getTickerColumn() == null || lookup.getCapColumn() == null) {
                System.err.println("WARN: cap rows skipped in merge, unrecognized columns=" + side.columns());
                continue;
            }
            for (CapRecord record : lookup.getByTicker().values()) {
                merged.putIfAbsent(record.getTicker(), record);
            }
        }
        return toCanonicalTable(merged.values());
    }

    static Table toCanonicalTable(Iterable<CapRecord> records) {
        Table table = Table.empty(CANONICAL_CAP_COLUMNS);
        for (CapRecord record : records) {
            Map<String, String> cells = new LinkedHashMap<>();
            cells.put(SignalTableCodec.COL_TICKER, record.getTicker());
            cells.put(SignalTableCodec.COL_MARKET_CAP_M, Cells.format(record.getMarketCapM()));
            cells.put(SignalTableCodec.COL_SECTOR, record.getSector());
            table.addRow(cells);
        }
        return table;
    }

    public Optional<Table> readCapTable() throws IOException {
        return CsvTables.read(config.getPath("caps.path"));
    }

    public void mergeIntoCapTable(Path fetchedPath) throws IOException {
        Optional<Table> fetched = CsvTables.read(fetchedPath);
        if (fetched.isEmpty() || fetched.get().isEmpty()) {
            return;
        }
        Path capsPath = config.getPath("caps.path");
        Table merged = mergeFetched(CsvTables.read(capsPath).orElse(null), fetched.get());
        CsvTables.write(capsPath, merged);
        System.out.println("Cap table merged: fetched=" + fetched.get().size() + ", total=" + merged.size());
    }

    public StageOutcome<List<CombinedRow>> run(List<SignalRow> rows) throws IOException {
        Optional<Table> capTable;
        try {
            capTable = readCapTable();
        } catch (IOException e) {
            System.err.println("WARN: cap table unreadable, err=" + e.getMessage());
            capTable = Optional.empty();
        }
        CapLookup lookup = buildLookup(capTable.orElse(null));
        List<CombinedRow> enriched = enrich(rows, lookup);
        CsvTables.write(config.getPath("combine.out_path"), SignalTableCodec.toCombinedTable(enriched));

        long matched = enriched.stream().filter(row -> row.getMarketCapM() != null).count();
        System.out.println("Cap enrichment: rows=" + enriched.size()
                + ", matched=" + matched
                + ", lookup=" + lookup.size()
                + ", cap_column=" + lookup.getCapColumn()
                + ", converted_from_raw=" + lookup.isConvertedFromRawUnits());

        if (capTable.isEmpty()) {
            return StageOutcome.degraded(enriched, CauseCode.MISSING_INPUT, OWNER, "cap table absent");
        }
        if (lookup.getTickerColumn() == null || lookup.getCapColumn() == null) {
            return StageOutcome.degraded(
                    enriched,
                    CauseCode.SCHEMA_AMBIGUITY,
                    OWNER,
                    "cap table has no recognizable "
                            + (lookup.getTickerColumn() == null ? "ticker" : "market cap") + " column"
            );
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("matched", matched);
        details.put("converted", lookup.isConvertedFromRawUnits());
        return StageOutcome.ok(enriched, OWNER, details);
    }
}
