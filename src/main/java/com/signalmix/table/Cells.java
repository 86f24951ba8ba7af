package com.signalmix.table;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Tolerant conversions between CSV cells and typed values.
 */
public final class Cells {
    private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "na", "n/a", "none", "null", "<na>", "-");

    private Cells() {
    }

    public static boolean isMissing(String raw) {
        return raw == null || MISSING_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @return null for missing or unparseable input, never NaN or infinity
     */
    public static Double toDouble(String raw) {
        if (isMissing(raw)) {
            return null;
        }
        String cleaned = raw.trim().replace(",", "").replaceAll("\\s+", "");
        try {
            double value = Double.parseDouble(cleaned);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String text(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static String format(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).toPlainString();
    }
}
