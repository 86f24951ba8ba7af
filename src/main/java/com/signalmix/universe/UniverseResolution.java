package com.signalmix.universe;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class UniverseResolution {
    public enum Source {
        EXISTING,
        SEED_LIST,
        PRICE_CACHE,
        EMPTY
    }

    Source source;
    List<String> tickers;
    Path path;
    String message;
}
