package com.signalmix.output;

import com.signalmix.combine.SignalTableCodec;
import com.signalmix.config.Config;
import com.signalmix.model.CapBand;
import com.signalmix.model.CombinedRow;
import com.signalmix.model.SignalRow;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import com.signalmix.utils.TextFormatter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * 模块说明：ReportEmitter（class）。
 * 主要职责：把合并后的结果渲染为两段固定宽度的文本报表（swing / microcap）。
 * 使用建议：只读不写，排序与截断都在副本上完成，持久化的 CSV 不会被修改。
 */
public final class ReportEmitter {
    static final List<String> DISPLAY_COLUMNS = List.of(
            "ticker",
            "cap_band",
            "label",
            "prob_pct",
            "exp_move_pct",
            "entry",
            "tp",
            "sl",
            "market_cap_m",
            "headline"
    );
    static final String NONE = "None";

    private final Config config;

    public ReportEmitter(Config config) {
        this.config = config;
    }

    public String emitFromArtifact() throws MissingArtifactException, IOException {
        Path path = config.getPath("combine.out_path");
        Optional<Table> table = CsvTables.read(path);
        if (table.isEmpty()) {
            throw new MissingArtifactException(path);
        }
        return render(SignalTableCodec.combinedFrom(table.get()));
    }

    public String render(List<CombinedRow> rows) {
        int swingRows = config.getInt("report.swing_rows", 12);
        int microRows = config.getInt("microcap.top_n", 50);

        List<CombinedRow> swing = new ArrayList<>();
        List<CombinedRow> micro = new ArrayList<>();
        Set<String> unknownGroups = new TreeSet<>();
        int skipped = 0;
        for (CombinedRow row : rows) {
            String group = row.getSignal() == null ? null : row.getSignal().getGroup();
            if (SignalRow.GROUP_SWING.equals(group)) {
                swing.add(row);
            } else if (SignalRow.GROUP_MICROCAP.equals(group)) {
                micro.add(row);
            } else {
                skipped++;
                unknownGroups.add(String.valueOf(group));
            }
        }
        if (skipped > 0) {
            System.err.println("WARN: report skipped rows with unknown group, rows=" + skipped + ", groups=" + unknownGroups);
        }
        swing.sort(descNullsLast(r -> r.getSignal().getProbPct())
                .thenComparing(descNullsLast(r -> r.getSignal().getExpMovePct())));
        micro.sort(descNullsLast(r -> r.getSignal().getExpMovePct()));

        StringBuilder sb = new StringBuilder();
        appendSection(sb, SignalRow.GROUP_SWING, limit(swing, swingRows));
        sb.append('\n');
        appendSection(sb, SignalRow.GROUP_MICROCAP, limit(micro, microRows));
        return sb.toString();
    }

    private void appendSection(StringBuilder sb, String title, List<CombinedRow> rows) {
        sb.append("=== ").append(title).append(" (rows=").append(rows.size()).append(") ===\n");
        if (rows.isEmpty()) {
            sb.append(NONE).append('\n');
            return;
        }
        List<List<String>> cells = new ArrayList<>();
        for (CombinedRow row : rows) {
            cells.add(displayCells(row));
        }
        int[] widths = new int[DISPLAY_COLUMNS.size()];
        for (int c = 0; c < widths.length; c++) {
            widths[c] = DISPLAY_COLUMNS.get(c).length();
            for (List<String> line : cells) {
                widths[c] = Math.max(widths[c], line.get(c).length());
            }
        }
        appendLine(sb, DISPLAY_COLUMNS, widths);
        for (List<String> line : cells) {
            appendLine(sb, line, widths);
        }
    }

    private List<String> displayCells(CombinedRow row) {
        SignalRow signal = row.getSignal();
        int maxChars = config.getInt("report.headline_max_chars", 90);
        CapBand band = row.getCapBand() == null ? CapBand.UNCLASSIFIED : row.getCapBand();
        List<String> out = new ArrayList<>(DISPLAY_COLUMNS.size());
        out.add(text(signal.getTicker(), maxChars));
        out.add(band.label());
        out.add(text(signal.getLabel(), maxChars));
        out.add(fmt(signal.getProbPct(), 1));
        out.add(fmt(signal.getExpMovePct(), 1));
        out.add(fmt(signal.getEntry(), 2));
        out.add(fmt(signal.getTp(), 2));
        out.add(fmt(signal.getSl(), 2));
        out.add(fmt(row.getMarketCapM(), 0));
        out.add(text(signal.getHeadline(), maxChars));
        return out;
    }

    private static void appendLine(StringBuilder sb, List<String> values, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int c = 0; c < values.size(); c++) {
            if (c > 0) {
                line.append("  ");
            }
            String value = values.get(c);
            line.append(value);
            if (c < values.size() - 1) {
                line.append(" ".repeat(widths[c] - value.length()));
            }
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }

    static String fmt(Double value, int decimals) {
        if (value == null || !Double.isFinite(value)) {
            return "";
        }
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    static String text(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        return TextFormatter.truncate(value, maxChars);
    }

    private static List<CombinedRow> limit(List<CombinedRow> rows, int max) {
        if (max < 0 || rows.size() <= max) {
            return rows;
        }
        return new ArrayList<>(rows.subList(0, max));
    }

    private static Comparator<CombinedRow> descNullsLast(Function<CombinedRow, Double> key) {
        return Comparator.comparing(key, Comparator.nullsLast(Comparator.<Double>reverseOrder()));
    }
}
