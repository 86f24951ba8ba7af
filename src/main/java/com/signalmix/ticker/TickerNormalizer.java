package com.signalmix.ticker;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical, exchange-agnostic ticker used as the join key between tables.
 * An empty result marks the row as unjoinable; it is not an error.
 */
public final class TickerNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ASX_SUFFIX = Pattern.compile("\\.(AX|ASX)$");
    private static final Pattern NON_ALNUM = Pattern.compile("[^0-9A-Z]+");

    private TickerNormalizer() {
    }

    public static String normalize(String rawInput) {
        if (rawInput == null) {
            return "";
        }
        String upper = WHITESPACE.matcher(rawInput.toUpperCase(Locale.ROOT)).replaceAll("");
        if (upper.isEmpty()) {
            return "";
        }
        String noSuffix = ASX_SUFFIX.matcher(upper).replaceFirst("");
        return NON_ALNUM.matcher(noSuffix).replaceAll("");
    }

    public static boolean isJoinable(String ticker) {
        return ticker != null && !ticker.isEmpty();
    }
}
