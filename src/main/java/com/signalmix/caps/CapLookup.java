package com.signalmix.caps;

import com.signalmix.model.CapRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class CapLookup {
    Map<String, CapRecord> byTicker;
    String tickerColumn;
    String capColumn;
    String sectorColumn;
    boolean convertedFromRawUnits;
    Double median;

    public static CapLookup empty() {
        return new CapLookup(Map.of(), null, null, null, false, null);
    }

    public CapRecord find(String ticker) {
        if (ticker == null || ticker.isEmpty()) {
            return null;
        }
        return byTicker.get(ticker);
    }

    public int size() {
        return byTicker.size();
    }
}
