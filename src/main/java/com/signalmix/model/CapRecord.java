package com.signalmix.model;

import lombok.Value;

/**
 * One cap-lookup entry after ingestion; marketCapM is always in millions.
 */
@Value
public class CapRecord {
    String ticker;
    Double marketCapM;
    String sector;
}
