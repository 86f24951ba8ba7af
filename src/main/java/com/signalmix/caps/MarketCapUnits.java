package com.signalmix.caps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Detects whether a cap column holds raw currency units or millions.
 * The median test is kept as is: a table of genuinely small companies reported in raw currency
 * can have a median at or below the threshold and is then left unconverted.
 */
public final class MarketCapUnits {
    public static final double RAW_UNITS_MEDIAN_THRESHOLD = 1_000_000.0;
    public static final double MILLION = 1_000_000.0;

    private MarketCapUnits() {
    }

    public static Double median(List<Double> values) {
        List<Double> present = new ArrayList<>();
        for (Double value : values) {
            if (value != null && Double.isFinite(value)) {
                present.add(value);
            }
        }
        if (present.isEmpty()) {
            return null;
        }
        Collections.sort(present);
        int mid = present.size() / 2;
        if (present.size() % 2 == 1) {
            return present.get(mid);
        }
        return (present.get(mid - 1) + present.get(mid)) / 2.0;
    }

    public static boolean looksLikeRawUnits(List<Double> values) {
        Double median = median(values);
        return median != null && median > RAW_UNITS_MEDIAN_THRESHOLD;
    }

    /**
     * @return values in millions; nulls stay null
     */
    public static List<Double> toMillions(List<Double> values) {
        boolean divide = looksLikeRawUnits(values);
        List<Double> out = new ArrayList<>(values.size());
        for (Double value : values) {
            if (value == null) {
                out.add(null);
            } else {
                out.add(divide ? value / MILLION : value);
            }
        }
        return out;
    }
}
