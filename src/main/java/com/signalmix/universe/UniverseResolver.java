package com.signalmix.universe;

import com.signalmix.config.Config;
import com.signalmix.table.ColumnAliases;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import com.signalmix.ticker.TickerNormalizer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the tradable-ticker list from the best available source:
 * existing artifact, then seed list, then price-cache filenames, then an empty universe.
 */
public final class UniverseResolver {
    private static final String COL_TICKER = "ticker";

    private final Config config;

    public UniverseResolver(Config config) {
        this.config = config;
    }

    public UniverseResolution resolve() throws IOException {
        Path validPath = config.getPath("universe.valid_path");

        Optional<Table> existing = CsvTables.read(validPath);
        if (existing.isPresent()) {
            List<String> tickers = tickersOf(existing.get());
            return new UniverseResolution(
                    UniverseResolution.Source.EXISTING,
                    tickers,
                    validPath,
                    "universe already present"
            );
        }

        Path seedPath = config.getPath("universe.seed_path");
        if (Files.isRegularFile(seedPath)) {
            List<String> tickers = fromSeedList(Files.readAllLines(seedPath, StandardCharsets.UTF_8));
            write(validPath, tickers);
            return new UniverseResolution(
                    UniverseResolution.Source.SEED_LIST,
                    tickers,
                    validPath,
                    "built from " + seedPath.getFileName()
            );
        }

        List<String> cached = fromPriceCache(
                config.getPath("universe.price_cache_dir"),
                Pattern.compile(config.getString("universe.price_cache_pattern"))
        );
        if (!cached.isEmpty()) {
            write(validPath, cached);
            return new UniverseResolution(
                    UniverseResolution.Source.PRICE_CACHE,
                    cached,
                    validPath,
                    "derived from cached price files"
            );
        }

        write(validPath, List.of());
        return new UniverseResolution(
                UniverseResolution.Source.EMPTY,
                List.of(),
                validPath,
                "no universe source found"
        );
    }

    static List<String> fromSeedList(List<String> lines) {
        List<String> out = new ArrayList<>();
        for (String line : lines) {
            String ticker = TickerNormalizer.normalize(line);
            if (!ticker.isEmpty()) {
                out.add(ticker);
            }
        }
        return out;
    }

    static List<String> fromPriceCache(Path dir, Pattern fileNamePattern) throws IOException {
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                names.add(entry.getFileName().toString());
            }
        }
        names.sort(null);
        List<String> out = new ArrayList<>();
        for (String name : names) {
            Matcher matcher = fileNamePattern.matcher(name);
            if (matcher.matches()) {
                String ticker = TickerNormalizer.normalize(matcher.group(1));
                if (!ticker.isEmpty()) {
                    out.add(ticker);
                }
            }
        }
        return out;
    }

    private List<String> tickersOf(Table table) {
        Optional<String> column = ColumnAliases.TICKER.resolve(table);
        if (column.isEmpty() && !table.columns().isEmpty()) {
            column = Optional.of(table.columns().get(0));
        }
        List<String> out = new ArrayList<>();
        if (column.isEmpty()) {
            return out;
        }
        for (String raw : table.column(column.get())) {
            if (raw != null && !raw.isBlank()) {
                out.add(raw.trim());
            }
        }
        return out;
    }

    private void write(Path path, List<String> tickers) throws IOException {
        Table table = Table.empty(List.of(COL_TICKER));
        for (String ticker : tickers) {
            table.addRow(Map.of(COL_TICKER, ticker));
        }
        CsvTables.write(path, table);
    }
}
