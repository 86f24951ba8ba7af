package com.signalmix.microcap;

import com.signalmix.combine.SignalTableCodec;
import com.signalmix.config.Config;
import com.signalmix.core.diagnostics.CauseCode;
import com.signalmix.core.diagnostics.StageOutcome;
import com.signalmix.model.SignalRow;
import com.signalmix.table.Cells;
import com.signalmix.table.ColumnAliases;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import com.signalmix.ticker.TickerNormalizer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps scanner candidates onto the canonical signal schema.
 */
public final class MicrocapAdapter {
    public static final String OWNER = "microcap.adapt";

    static final String LABEL = "momentum";
    static final String SIDE = "long";
    static final String DEFAULT_HEADLINE = "Momentum (no news)";
    static final String SOURCE = "microcap_scanner";

    static final String COL_GAP_PCT = "gap_%";
    static final String COL_PRICE = "price";

    private static final ColumnAliases HEADLINE = ColumnAliases.of("headline", "Headline", "title");
    // Scanner cap columns belong to the cap engine.
    private static final Set<String> DROPPED = Set.of(
            COL_GAP_PCT,
            SignalTableCodec.COL_MARKET_CAP_M,
            SignalTableCodec.COL_SECTOR,
            SignalTableCodec.COL_CAP_BAND,
            "Headline",
            "title"
    );

    private final Config config;

    public MicrocapAdapter(Config config) {
        this.config = config;
    }

    public static List<SignalRow> adapt(Table candidates, int topN) {
        List<SignalRow> out = new ArrayList<>();
        if (candidates == null) {
            return out;
        }
        List<String> extraColumns = new ArrayList<>();
        for (String column : candidates.columns()) {
            if (!SignalTableCodec.CANONICAL_COLUMNS.contains(column) && !DROPPED.contains(column)) {
                extraColumns.add(column);
            }
        }

        int limit = Math.min(candidates.size(), Math.max(0, topN));
        for (int i = 0; i < limit; i++) {
            Double entry = Cells.toDouble(candidates.get(i, SignalTableCodec.COL_ENTRY));
            if (entry == null) {
                entry = Cells.toDouble(candidates.get(i, COL_PRICE));
            }
            String headline = Cells.text(HEADLINE.valueOf(candidates, i));
            Map<String, String> extras = new LinkedHashMap<>();
            for (String column : extraColumns) {
                extras.put(column, candidates.get(i, column));
            }
            out.add(SignalRow.builder()
                    .group(SignalRow.GROUP_MICROCAP)
                    .ticker(TickerNormalizer.normalize(ColumnAliases.TICKER.valueOf(candidates, i)))
                    .label(LABEL)
                    .probPct(null)
                    .expMovePct(Cells.toDouble(candidates.get(i, COL_GAP_PCT)))
                    .side(SIDE)
                    .entry(entry)
                    .tp(Cells.toDouble(candidates.get(i, SignalTableCodec.COL_TP)))
                    .sl(Cells.toDouble(candidates.get(i, SignalTableCodec.COL_SL)))
                    .headline(headline == null ? DEFAULT_HEADLINE : headline)
                    .source(SOURCE)
                    .extras(extras)
                    .build());
        }
        return out;
    }

    public StageOutcome<List<SignalRow>> run() {
        Path path = config.getPath("microcap.candidates_path");
        int topN = config.getInt("microcap.top_n", 50);
        Optional<Table> candidates;
        try {
            candidates = CsvTables.read(path);
        } catch (IOException e) {
            System.err.println("WARN: microcap candidates unreadable, path=" + path + ", err=" + e.getMessage());
            return StageOutcome.degraded(List.of(), CauseCode.IO_ERROR, OWNER, "unreadable " + path.getFileName());
        }
        if (candidates.isEmpty()) {
            return StageOutcome.degraded(List.of(), CauseCode.MISSING_INPUT, OWNER, "no candidates at " + path);
        }
        List<SignalRow> rows = adapt(candidates.get(), topN);
        System.out.println("Microcap adapted: candidates=" + candidates.get().size() + ", kept=" + rows.size());
        return StageOutcome.ok(rows, OWNER);
    }
}
