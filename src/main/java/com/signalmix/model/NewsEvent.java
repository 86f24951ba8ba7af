package com.signalmix.model;

import lombok.Value;

import java.time.Instant;

@Value
public class NewsEvent {
    String ticker;
    String headline;
    String source;
    Instant timestamp;
}
