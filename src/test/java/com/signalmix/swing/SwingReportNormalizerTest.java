package com.signalmix.swing;

import com.signalmix.config.Config;
import com.signalmix.core.diagnostics.CauseCode;
import com.signalmix.core.diagnostics.StageOutcome;
import com.signalmix.core.diagnostics.StageStatus;
import com.signalmix.model.SignalRow;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SwingReportNormalizerTest {

    @Test
    void missingPlanShouldWriteHeaderOnlyReport(@TempDir Path tempDir) throws Exception {
        SwingReportNormalizer normalizer = new SwingReportNormalizer(config(tempDir));

        StageOutcome<List<SignalRow>> outcome = normalizer.run();

        assertEquals(StageStatus.DEGRADED, outcome.status);
        assertEquals(CauseCode.MISSING_INPUT, outcome.causeCode);
        assertTrue(outcome.value.isEmpty());
        Table report = CsvTables.read(tempDir.resolve("artifacts/nextday_report.csv")).orElseThrow();
        assertTrue(report.isEmpty());
        assertEquals(
                List.of("group", "ticker", "label", "prob_pct", "exp_move_pct", "side", "entry", "tp", "sl", "headline", "source"),
                report.columns()
        );
    }

    @Test
    void latestPlanByFilenameShouldWin(@TempDir Path tempDir) throws Exception {
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve("trade_plan_20260309.csv"), "Ticker,MLProb\nOLD,0.5\n", StandardCharsets.UTF_8);
        Files.writeString(out.resolve("trade_plan_20260310.csv"), "Ticker,MLProb\nNEW.AX,0.8\n", StandardCharsets.UTF_8);
        Files.writeString(out.resolve("other.csv"), "Ticker,MLProb\nZZZ,0.9\n", StandardCharsets.UTF_8);

        StageOutcome<List<SignalRow>> outcome = new SwingReportNormalizer(config(tempDir)).run();

        assertEquals(StageStatus.OK, outcome.status);
        assertEquals(1, outcome.value.size());
        assertEquals("NEW", outcome.value.get(0).getTicker());
        Table report = CsvTables.read(tempDir.resolve("artifacts/nextday_report.csv")).orElseThrow();
        assertEquals("NEW", report.get(0, "ticker"));
        assertEquals("80.0", report.get(0, "prob_pct"));
    }

    @Test
    void aliasesShouldMapToCanonicalFields() {
        Table plan = Table.empty(List.of("Ticker", "MLProb", "BuyPrice", "Close", "Target1", "Stop"));
        plan.addRow(Map.of("Ticker", "bhp.ax", "MLProb", "0.6543", "BuyPrice", "45.1", "Close", "44", "Target1", "48", "Stop", "43"));

        SignalRow row = SwingReportNormalizer.normalize(plan).get(0);

        assertEquals(SignalRow.GROUP_SWING, row.getGroup());
        assertEquals("BHP", row.getTicker());
        assertEquals("bullish", row.getLabel());
        assertEquals(65.4, row.getProbPct());
        assertEquals(45.1, row.getEntry());
        assertEquals(48.0, row.getTp());
        assertEquals(43.0, row.getSl());
        assertNull(row.getExpMovePct());
        assertEquals("long", row.getSide());
        assertEquals("Model swing pick", row.getHeadline());
        assertEquals("model", row.getSource());
    }

    @Test
    void closeShouldFillEntryAndBadProbabilityShouldBeMissing() {
        Table plan = Table.empty(List.of("ticker", "prob", "Close"));
        plan.addRow(Map.of("ticker", "WES", "prob", "abc", "Close", "61.2"));

        SignalRow row = SwingReportNormalizer.normalize(plan).get(0);

        assertEquals(61.2, row.getEntry());
        assertNull(row.getProbPct());
        assertNull(row.getTp());
    }

    private Config config(Path workingDir) {
        return Config.fromConfigurationProperties(workingDir, Map.of());
    }
}
