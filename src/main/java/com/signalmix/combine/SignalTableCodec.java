package com.signalmix.combine;

import com.signalmix.model.CapBand;
import com.signalmix.model.CombinedRow;
import com.signalmix.model.SignalRow;
import com.signalmix.table.Cells;
import com.signalmix.table.Table;
import com.signalmix.ticker.TickerNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps typed rows to the canonical CSV layout and back.
 */
public final class SignalTableCodec {
    public static final String COL_GROUP = "group";
    public static final String COL_TICKER = "ticker";
    public static final String COL_LABEL = "label";
    public static final String COL_PROB_PCT = "prob_pct";
    public static final String COL_EXP_MOVE_PCT = "exp_move_pct";
    public static final String COL_SIDE = "side";
    public static final String COL_ENTRY = "entry";
    public static final String COL_TP = "tp";
    public static final String COL_SL = "sl";
    public static final String COL_HEADLINE = "headline";
    public static final String COL_SOURCE = "source";
    public static final String COL_MARKET_CAP_M = "market_cap_m";
    public static final String COL_SECTOR = "sector";
    public static final String COL_CAP_BAND = "cap_band";

    public static final List<String> CANONICAL_COLUMNS = List.of(
            COL_GROUP,
            COL_TICKER,
            COL_LABEL,
            COL_PROB_PCT,
            COL_EXP_MOVE_PCT,
            COL_SIDE,
            COL_ENTRY,
            COL_TP,
            COL_SL,
            COL_HEADLINE,
            COL_SOURCE
    );
    public static final List<String> CAP_COLUMNS = List.of(COL_MARKET_CAP_M, COL_SECTOR, COL_CAP_BAND);

    private SignalTableCodec() {
    }

    public static Table toSignalTable(List<SignalRow> rows) {
        List<String> header = new ArrayList<>(CANONICAL_COLUMNS);
        header.addAll(extraColumns(rows));
        Table table = Table.empty(header);
        for (SignalRow row : rows) {
            table.addRow(signalCells(row));
        }
        return table;
    }

    public static Table toCombinedTable(List<CombinedRow> rows) {
        List<SignalRow> signals = new ArrayList<>(rows.size());
        for (CombinedRow row : rows) {
            signals.add(row.getSignal());
        }
        List<String> header = new ArrayList<>(CANONICAL_COLUMNS);
        header.addAll(CAP_COLUMNS);
        header.addAll(extraColumns(signals));
        Table table = Table.empty(header);
        for (CombinedRow row : rows) {
            Map<String, String> cells = signalCells(row.getSignal());
            cells.put(COL_MARKET_CAP_M, Cells.format(row.getMarketCapM()));
            cells.put(COL_SECTOR, row.getSector());
            cells.put(COL_CAP_BAND, row.getCapBand() == null ? CapBand.UNCLASSIFIED.label() : row.getCapBand().label());
            table.addRow(cells);
        }
        return table;
    }

    /**
     * Reads signal rows from a canonical or combined table. Cap columns are discarded,
     * every other non-canonical column is carried as an extra.
     */
    public static List<SignalRow> signalsFrom(Table table) {
        List<SignalRow> out = new ArrayList<>(table.size());
        List<String> extras = new ArrayList<>();
        for (String column : table.columns()) {
            if (!CANONICAL_COLUMNS.contains(column) && !CAP_COLUMNS.contains(column)) {
                extras.add(column);
            }
        }
        for (int i = 0; i < table.size(); i++) {
            Map<String, String> extraValues = new LinkedHashMap<>();
            for (String column : extras) {
                extraValues.put(column, table.get(i, column));
            }
            out.add(SignalRow.builder()
                    .group(Cells.text(table.get(i, COL_GROUP)))
                    .ticker(TickerNormalizer.normalize(table.get(i, COL_TICKER)))
                    .label(Cells.text(table.get(i, COL_LABEL)))
                    .probPct(Cells.toDouble(table.get(i, COL_PROB_PCT)))
                    .expMovePct(Cells.toDouble(table.get(i, COL_EXP_MOVE_PCT)))
                    .side(Cells.text(table.get(i, COL_SIDE)))
                    .entry(Cells.toDouble(table.get(i, COL_ENTRY)))
                    .tp(Cells.toDouble(table.get(i, COL_TP)))
                    .sl(Cells.toDouble(table.get(i, COL_SL)))
                    .headline(table.get(i, COL_HEADLINE))
                    .source(Cells.text(table.get(i, COL_SOURCE)))
                    .extras(extraValues)
                    .build());
        }
        return out;
    }

    public static List<CombinedRow> combinedFrom(Table table) {
        List<SignalRow> signals = signalsFrom(table);
        List<CombinedRow> out = new ArrayList<>(signals.size());
        for (int i = 0; i < signals.size(); i++) {
            Double cap = Cells.toDouble(table.get(i, COL_MARKET_CAP_M));
            String band = table.get(i, COL_CAP_BAND);
            out.add(new CombinedRow(
                    signals.get(i),
                    cap,
                    Cells.text(table.get(i, COL_SECTOR)),
                    band == null ? CapBand.of(cap) : CapBand.fromLabel(band)
            ));
        }
        return out;
    }

    private static Map<String, String> signalCells(SignalRow row) {
        Map<String, String> cells = new LinkedHashMap<>();
        cells.put(COL_GROUP, row.getGroup());
        cells.put(COL_TICKER, row.getTicker());
        cells.put(COL_LABEL, row.getLabel());
        cells.put(COL_PROB_PCT, Cells.format(row.getProbPct()));
        cells.put(COL_EXP_MOVE_PCT, Cells.format(row.getExpMovePct()));
        cells.put(COL_SIDE, row.getSide());
        cells.put(COL_ENTRY, Cells.format(row.getEntry()));
        cells.put(COL_TP, Cells.format(row.getTp()));
        cells.put(COL_SL, Cells.format(row.getSl()));
        cells.put(COL_HEADLINE, row.getHeadline());
        cells.put(COL_SOURCE, row.getSource());
        if (row.getExtras() != null) {
            for (Map.Entry<String, String> extra : row.getExtras().entrySet()) {
                cells.putIfAbsent(extra.getKey(), extra.getValue());
            }
        }
        return cells;
    }

    private static List<String> extraColumns(List<SignalRow> rows) {
        Set<String> out = new LinkedHashSet<>();
        for (SignalRow row : rows) {
            if (row.getExtras() == null) {
                continue;
            }
            for (String column : row.getExtras().keySet()) {
                if (!CANONICAL_COLUMNS.contains(column) && !CAP_COLUMNS.contains(column)) {
                    out.add(column);
                }
            }
        }
        return new ArrayList<>(out);
    }
}
