package com.signalmix.combine;

import com.signalmix.config.Config;
import com.signalmix.model.SignalRow;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalCombinerTest {

    @Test
    void rowCountShouldBeSumOfBothSidesEvenWhenOneIsEmpty() {
        List<SignalRow> swing = List.of(swing("CBA"), swing("BHP"));
        List<SignalRow> micro = List.of(micro("ABC"), micro("XYZ"), micro("QQQ"));

        assertEquals(5, SignalCombiner.combine(swing, micro).size());
        assertEquals(2, SignalCombiner.combine(swing, List.of()).size());
        assertEquals(3, SignalCombiner.combine(List.of(), micro).size());
        assertEquals(0, SignalCombiner.combine(List.of(), List.of()).size());
    }

    @Test
    void swingRowsShouldPrecedeMicrocapRows() {
        List<SignalRow> combined = SignalCombiner.combine(List.of(swing("CBA")), List.of(micro("ABC")));

        assertEquals("CBA", combined.get(0).getTicker());
        assertEquals("ABC", combined.get(1).getTicker());
    }

    @Test
    void tickerListShouldBeDistinctSortedAndSkipUnjoinable() {
        List<SignalRow> rows = List.of(swing("WES"), micro("ABC"), swing("WES"), micro(""));

        assertEquals(List.of("ABC", "WES"), SignalCombiner.tickers(rows));
    }

    @Test
    void runShouldWriteArtifactsWhenBothSidesAreEmpty(@TempDir Path tempDir) throws Exception {
        SignalCombiner combiner = new SignalCombiner(Config.fromConfigurationProperties(tempDir, Map.of()));

        combiner.run(List.of(), List.of());

        Table combined = CsvTables.read(tempDir.resolve("artifacts/nextday_combined.csv")).orElseThrow();
        assertTrue(combined.isEmpty());
        assertEquals(SignalTableCodec.CANONICAL_COLUMNS, combined.columns());
        Table tickers = CsvTables.read(tempDir.resolve("artifacts/combined_tickers.csv")).orElseThrow();
        assertEquals(List.of("ticker"), tickers.columns());
        assertTrue(tickers.isEmpty());
    }

    @Test
    void extraColumnsShouldFollowCanonicalColumnsWithMissingCells(@TempDir Path tempDir) throws Exception {
        SignalRow scanner = micro("ABC").toBuilder().extras(Map.of("rel_vol", "2.5")).build();
        SignalCombiner combiner = new SignalCombiner(Config.fromConfigurationProperties(tempDir, Map.of()));

        combiner.run(List.of(swing("CBA")), List.of(scanner));

        Table combined = CsvTables.read(tempDir.resolve("artifacts/nextday_combined.csv")).orElseThrow();
        assertEquals("rel_vol", combined.columns().get(SignalTableCodec.CANONICAL_COLUMNS.size()));
        assertNull(combined.get(0, "rel_vol"));
        assertEquals("2.5", combined.get(1, "rel_vol"));
    }

    private SignalRow swing(String ticker) {
        return SignalRow.builder().group(SignalRow.GROUP_SWING).ticker(ticker).label("bullish").probPct(60.0).build();
    }

    private SignalRow micro(String ticker) {
        return SignalRow.builder().group(SignalRow.GROUP_MICROCAP).ticker(ticker).label("momentum").expMovePct(5.0).build();
    }
}
