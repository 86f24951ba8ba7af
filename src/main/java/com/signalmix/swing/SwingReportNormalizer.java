package com.signalmix.swing;

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
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：SwingReportNormalizer（class）。
 * 主要职责：读取最新的 swing 模型 trade plan，映射为规范 SignalRow 并写出 nextday_report.csv。
 * 使用建议：没有 plan 文件时写出只有表头的报表，下游照常运行。
 */
public final class SwingReportNormalizer {
    public static final String OWNER = "swing.normalize";

    static final String LABEL = "bullish";
    static final String SIDE = "long";
    static final String HEADLINE = "Model swing pick";
    static final String SOURCE = "model";

    static final ColumnAliases TICKER = ColumnAliases.of("Ticker", "ticker");
    static final ColumnAliases PROBABILITY = ColumnAliases.of("MLProb", "prob", "probability");
    static final ColumnAliases ENTRY = ColumnAliases.of("BuyPrice", "Close", "close", "entry");
    static final ColumnAliases TAKE_PROFIT = ColumnAliases.of("Target1", "tp");
    static final ColumnAliases STOP_LOSS = ColumnAliases.of("Stop", "sl");
    static final ColumnAliases EXP_MOVE = ColumnAliases.of("exp_move_%", "exp_move_pct", "ExpMovePct");

    private final Config config;

    public SwingReportNormalizer(Config config) {
        this.config = config;
    }

    public Optional<Path> findLatestPlan() throws IOException {
        Path dir = config.getPath("swing.plan_dir");
        if (dir == null || !Files.isDirectory(dir)) {
            return Optional.empty();
        }
        String glob = config.getString("swing.plan_glob", "trade_plan*.csv");
        Path latest = null;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path entry : stream) {
                if (!Files.isRegularFile(entry)) {
                    continue;
                }
                if (latest == null
                        || entry.getFileName().toString().compareTo(latest.getFileName().toString()) > 0) {
                    latest = entry;
                }
            }
        }
        return Optional.ofNullable(latest);
    }

    public static List<SignalRow> normalize(Table plan) {
        List<SignalRow> out = new ArrayList<>(plan.size());
        for (int i = 0; i < plan.size(); i++) {
            Double probability = Cells.toDouble(PROBABILITY.valueOf(plan, i));
            out.add(SignalRow.builder()
                    .group(SignalRow.GROUP_SWING)
                    .ticker(TickerNormalizer.normalize(TICKER.valueOf(plan, i)))
                    .label(LABEL)
                    .probPct(probability == null ? null : toPercent(probability))
                    .expMovePct(Cells.toDouble(EXP_MOVE.valueOf(plan, i)))
                    .side(SIDE)
                    .entry(Cells.toDouble(ENTRY.valueOf(plan, i)))
                    .tp(Cells.toDouble(TAKE_PROFIT.valueOf(plan, i)))
                    .sl(Cells.toDouble(STOP_LOSS.valueOf(plan, i)))
                    .headline(HEADLINE)
                    .source(SOURCE)
                    .build());
        }
        return out;
    }

    public StageOutcome<List<SignalRow>> run() throws IOException {
        Path reportPath = config.getPath("swing.report_path");
        Optional<Path> plan = findLatestPlan();
        if (plan.isEmpty()) {
            CsvTables.write(reportPath, SignalTableCodec.toSignalTable(List.of()));
            return StageOutcome.degraded(
                    List.of(),
                    CauseCode.MISSING_INPUT,
                    OWNER,
                    "no trade plan in " + config.getPath("swing.plan_dir")
            );
        }

        Table table;
        try {
            table = CsvTables.read(plan.get()).orElse(Table.empty(List.of()));
        } catch (IOException e) {
            System.err.println("WARN: swing plan unreadable, path=" + plan.get() + ", err=" + e.getMessage());
            CsvTables.write(reportPath, SignalTableCodec.toSignalTable(List.of()));
            return StageOutcome.degraded(
                    List.of(),
                    CauseCode.IO_ERROR,
                    OWNER,
                    "unreadable trade plan " + plan.get().getFileName()
            );
        }

        List<SignalRow> rows = normalize(table);
        CsvTables.write(reportPath, SignalTableCodec.toSignalTable(rows));
        System.out.println("Swing report normalized: plan=" + plan.get().getFileName()
                + ", rows=" + rows.size() + ", out=" + reportPath);
        if (TICKER.resolve(table).isEmpty() && !table.isEmpty()) {
            return StageOutcome.degraded(
                    rows,
                    CauseCode.SCHEMA_AMBIGUITY,
                    OWNER,
                    "no ticker column in " + plan.get().getFileName(),
                    Map.of("plan", plan.get().toString())
            );
        }
        return StageOutcome.ok(rows, OWNER, Map.of("plan", plan.get().toString()));
    }

    static double toPercent(double probability) {
        return Math.round(probability * 1000.0) / 10.0;
    }
}
