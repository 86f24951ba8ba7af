package com.signalmix.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A signal row augmented with cap data. Headline and source live on the wrapped signal
 * and may be replaced by news enrichment.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class CombinedRow {
    SignalRow signal;
    Double marketCapM;
    String sector;
    @Builder.Default
    CapBand capBand = CapBand.UNCLASSIFIED;

    public static CombinedRow unenriched(SignalRow signal) {
        return new CombinedRow(signal, null, null, CapBand.UNCLASSIFIED);
    }

    public String getTicker() {
        return signal == null ? "" : signal.getTicker();
    }
}
