package com.signalmix.model;

import com.signalmix.table.Cells;

/**
 * Coarse market-capitalization bucket. Thresholds are in millions.
 */
public enum CapBand {
    LARGE_CAP("Large-cap"),
    MID_CAP("Mid-cap"),
    MICRO_CAP("Micro-cap"),
    UNCLASSIFIED("Unclassified");

    public static final double LARGE_CAP_MIN_M = 5000.0;
    public static final double MID_CAP_MIN_M = 500.0;

    private final String label;

    CapBand(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CapBand of(Double marketCapM) {
        if (marketCapM == null || !Double.isFinite(marketCapM)) {
            return UNCLASSIFIED;
        }
        if (marketCapM >= LARGE_CAP_MIN_M) {
            return LARGE_CAP;
        }
        if (marketCapM >= MID_CAP_MIN_M) {
            return MID_CAP;
        }
        return MICRO_CAP;
    }

    public static CapBand of(String rawMarketCapM) {
        return of(Cells.toDouble(rawMarketCapM));
    }

    public static CapBand fromLabel(String label) {
        if (label != null) {
            String trimmed = label.trim();
            for (CapBand band : values()) {
                if (band.label.equalsIgnoreCase(trimmed) || band.name().equalsIgnoreCase(trimmed)) {
                    return band;
                }
            }
        }
        return UNCLASSIFIED;
    }
}
