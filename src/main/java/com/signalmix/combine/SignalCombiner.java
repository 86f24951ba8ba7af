package com.signalmix.combine;

import com.signalmix.config.Config;
import com.signalmix.core.diagnostics.StageOutcome;
import com.signalmix.model.SignalRow;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Concatenates swing rows then microcap rows into the combined artifact.
 */
public final class SignalCombiner {
    public static final String OWNER = "combine";

    private final Config config;

    public SignalCombiner(Config config) {
        this.config = config;
    }

    public static List<SignalRow> combine(List<SignalRow> swing, List<SignalRow> microcap) {
        List<SignalRow> out = new ArrayList<>();
        if (swing != null) {
            out.addAll(swing);
        }
        if (microcap != null) {
            out.addAll(microcap);
        }
        return out;
    }

    /**
     * Distinct joinable tickers, sorted.
     */
    public static List<String> tickers(List<SignalRow> rows) {
        TreeSet<String> out = new TreeSet<>();
        for (SignalRow row : rows) {
            if (row.isJoinable()) {
                out.add(row.getTicker());
            }
        }
        return new ArrayList<>(out);
    }

    public StageOutcome<List<SignalRow>> run(List<SignalRow> swing, List<SignalRow> microcap) throws IOException {
        List<SignalRow> combined = combine(swing, microcap);
        Path outPath = config.getPath("combine.out_path");
        CsvTables.write(outPath, SignalTableCodec.toSignalTable(combined));

        List<String> tickers = tickers(combined);
        Table tickerTable = Table.empty(List.of(SignalTableCodec.COL_TICKER));
        for (String ticker : tickers) {
            tickerTable.addRow(Map.of(SignalTableCodec.COL_TICKER, ticker));
        }
        CsvTables.write(config.getPath("combine.tickers_path"), tickerTable);

        System.out.println("Combined: swing=" + sizeOf(swing) + ", microcap=" + sizeOf(microcap)
                + ", rows=" + combined.size() + ", tickers=" + tickers.size());
        return StageOutcome.ok(combined, OWNER, Map.of("tickers", tickers.size()));
    }

    private static int sizeOf(List<SignalRow> rows) {
        return rows == null ? 0 : rows.size();
    }
}
