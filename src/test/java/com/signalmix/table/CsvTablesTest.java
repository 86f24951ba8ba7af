package com.signalmix.table;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvTablesTest {

    @Test
    void parseShouldHandleBomQuotesBlankLinesAndDuplicateHeaders() {
        String text = "\uFEFFticker,name,name\n"
                + "CBA,\"Bank, Commonwealth\",x\n"
                + "\n"
                + "   \n"
                + "BHP,,y\n";

        Table table = CsvTables.parse(text);

        assertEquals(List.of("ticker", "name", "name.1"), table.columns());
        assertEquals(2, table.size());
        assertEquals("Bank, Commonwealth", table.get(0, "name"));
        assertNull(table.get(1, "name"));
        assertEquals("y", table.get(1, "name.1"));
    }

    @Test
    void quotedFieldMaySpanLines() {
        Table table = CsvTables.parse("ticker,headline\nBHP,\"line one\nline two\"\n");

        assertEquals(1, table.size());
        assertEquals("line one\nline two", table.get(0, "headline"));
    }

    @Test
    void writeThenReadShouldPreserveAwkwardCells(@TempDir Path tempDir) throws Exception {
        Table table = Table.empty(List.of("ticker", "headline"));
        table.addRow(Map.of("ticker", "RIO", "headline", "Says \"record\", output up"));
        table.addRow(Map.of("ticker", "WES"));
        Path path = tempDir.resolve("nested/out.csv");

        CsvTables.write(path, table);
        Table read = CsvTables.read(path).orElseThrow();

        assertEquals("Says \"record\", output up", read.get(0, "headline"));
        assertNull(read.get(1, "headline"));
        assertFalse(Files.exists(tempDir.resolve("nested/out.csv.tmp")));
    }

    @Test
    void headerOnlyFileShouldYieldEmptyTable(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("empty.csv");
        Files.writeString(path, "ticker,label\n", StandardCharsets.UTF_8);

        Table table = CsvTables.read(path).orElseThrow();

        assertTrue(table.isEmpty());
        assertEquals(List.of("ticker", "label"), table.columns());
    }

    @Test
    void missingFileShouldReadAsAbsent(@TempDir Path tempDir) throws Exception {
        Optional<Table> table = CsvTables.read(tempDir.resolve("nope.csv"));
        assertTrue(table.isEmpty());
    }
}
