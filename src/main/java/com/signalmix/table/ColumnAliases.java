package com.signalmix.table;

import java.util.List;
import java.util.Optional;

/**
 * Ordered candidate source columns for one canonical field; the first candidate present wins.
 */
public final class ColumnAliases {
    public static final ColumnAliases TICKER = of("ticker", "Ticker", "symbol", "Symbol", "code", "Code");
    public static final ColumnAliases MARKET_CAP = of(
            "market_cap_m",
            "market_cap",
            "marketCap",
            "MarketCap",
            "mktcap",
            "cap_m",
            "market_capitalization",
            "market_capitalisation",
            "MarketCapitalisation"
    );
    public static final ColumnAliases SECTOR = of("sector", "Sector", "industry", "Industry", "GICS_Sector", "GICS Sector");

    private final String field;
    private final List<String> candidates;

    private ColumnAliases(String field, List<String> candidates) {
        this.field = field;
        this.candidates = List.copyOf(candidates);
    }

    public static ColumnAliases of(String... candidates) {
        List<String> list = List.of(candidates);
        return new ColumnAliases(list.isEmpty() ? "" : list.get(0), list);
    }

    public String field() {
        return field;
    }

    public List<String> candidates() {
        return candidates;
    }

    public Optional<String> resolve(Table table) {
        if (table == null) {
            return Optional.empty();
        }
        for (String candidate : candidates) {
            if (table.hasColumn(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Value of the first candidate column present in the table, for one row.
     */
    public String valueOf(Table table, int rowIndex) {
        return resolve(table).map(column -> table.get(rowIndex, column)).orElse(null);
    }
}
