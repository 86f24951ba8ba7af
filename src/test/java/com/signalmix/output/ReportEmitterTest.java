package com.signalmix.output;

import com.signalmix.config.Config;
import com.signalmix.model.CapBand;
import com.signalmix.model.CombinedRow;
import com.signalmix.model.SignalRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportEmitterTest {

    @Test
    void swingSectionShouldSortByProbabilityAndHonorRowLimit(@TempDir Path tempDir) {
        ReportEmitter emitter = new ReportEmitter(Config.fromConfigurationProperties(
                tempDir,
                Map.of("report", Map.of("swing_rows", 2))
        ));
        List<CombinedRow> rows = new ArrayList<>(List.of(
                swing("LOW", 51.0, null),
                swing("TOP", 88.0, 1.0),
                swing("MID", 70.0, null)
        ));
        List<CombinedRow> before = new ArrayList<>(rows);

        String text = emitter.render(rows);

        assertTrue(text.contains("=== Daily Swing (Large/Mid) (rows=2) ==="));
        assertTrue(text.indexOf("TOP") < text.indexOf("MID"));
        assertFalse(text.contains("LOW"));
        assertEquals(before, rows);
    }

    @Test
    void emptySectionShouldPrintNone(@TempDir Path tempDir) {
        ReportEmitter emitter = new ReportEmitter(Config.fromConfigurationProperties(tempDir, Map.of()));

        String text = emitter.render(List.of(swing("CBA", 60.0, null)));

        assertTrue(text.contains("=== Intraday Spikes (Microcap) (rows=0) ===\nNone\n"));
    }

    @Test
    void microcapSectionShouldSortByExpectedMoveWithMissingLast(@TempDir Path tempDir) {
        ReportEmitter emitter = new ReportEmitter(Config.fromConfigurationProperties(tempDir, Map.of()));

        String text = emitter.render(List.of(micro("NOMOVE", null), micro("SMALL", 2.0), micro("BIG", 12.5)));

        assertTrue(text.indexOf("BIG") < text.indexOf("SMALL"));
        assertTrue(text.indexOf("SMALL") < text.indexOf("NOMOVE"));
    }

    @Test
    void cellsShouldBeFormattedAndHeadlineTruncated(@TempDir Path tempDir) {
        ReportEmitter emitter = new ReportEmitter(Config.fromConfigurationProperties(tempDir, Map.of()));
        String longHeadline = "x".repeat(120);
        SignalRow signal = SignalRow.builder()
                .group(SignalRow.GROUP_SWING)
                .ticker("CBA")
                .label("bullish")
                .probPct(71.04)
                .entry(100.0)
                .tp(108.456)
                .headline(longHeadline)
                .build();

        String text = emitter.render(List.of(new CombinedRow(signal, 120000.4, "Financials", CapBand.LARGE_CAP)));

        assertTrue(text.contains("Large-cap"));
        assertTrue(text.contains("71.0"));
        assertTrue(text.contains("100.00"));
        assertTrue(text.contains("108.46"));
        assertTrue(text.contains("120000"));
        assertFalse(text.contains("120000.4"));
        assertTrue(text.contains("x".repeat(89) + "…"));
        assertFalse(text.contains("x".repeat(90)));
    }

    @Test
    void emitFromMissingArtifactShouldThrowWithoutCreatingFiles(@TempDir Path tempDir) {
        ReportEmitter emitter = new ReportEmitter(Config.fromConfigurationProperties(tempDir, Map.of()));

        assertThrows(MissingArtifactException.class, emitter::emitFromArtifact);
        assertFalse(Files.exists(tempDir.resolve("artifacts")));
    }

    @Test
    void unknownGroupRowsShouldBeLeftOutWithWarning(@TempDir Path tempDir) {
        ReportEmitter emitter = new ReportEmitter(Config.fromConfigurationProperties(tempDir, Map.of()));
        CombinedRow stray = CombinedRow.unenriched(SignalRow.builder().group("Watchlist").ticker("ODD").build());
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        String text;
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            text = emitter.render(List.of(swing("CBA", 60.0, null), stray));
        } finally {
            System.setErr(originalErr);
        }

        assertFalse(text.contains("ODD"));
        assertTrue(text.contains("(rows=1)"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("rows=1, groups=[Watchlist]"));
    }

    @Test
    void fixedPrecisionHelpersShouldLeaveMissingBlank() {
        assertEquals("", ReportEmitter.fmt(null, 2));
        assertEquals("3.14", ReportEmitter.fmt(3.14159, 2));
        assertEquals("", ReportEmitter.text(null, 90));
    }

    private CombinedRow swing(String ticker, Double prob, Double move) {
        SignalRow signal = SignalRow.builder()
                .group(SignalRow.GROUP_SWING)
                .ticker(ticker)
                .label("bullish")
                .probPct(prob)
                .expMovePct(move)
                .headline("Model swing pick")
                .build();
        return CombinedRow.unenriched(signal);
    }

    private CombinedRow micro(String ticker, Double move) {
        SignalRow signal = SignalRow.builder()
                .group(SignalRow.GROUP_MICROCAP)
                .ticker(ticker)
                .label("momentum")
                .expMovePct(move)
                .headline("Momentum (no news)")
                .build();
        return CombinedRow.unenriched(signal);
    }
}
