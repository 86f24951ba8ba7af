package com.signalmix.core.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one pipeline stage. OK and DEGRADED always carry a usable value;
 * FAILED carries whatever fallback the stage could offer (possibly null).
 */
public final class StageOutcome<T> {
    public final StageStatus status;
    public final T value;
    public final CauseCode causeCode;
    public final String owner;
    public final String reason;
    public final Map<String, Object> details;

    private StageOutcome(
            StageStatus status,
            T value,
            CauseCode causeCode,
            String owner,
            String reason,
            Map<String, Object> details
    ) {
        this.status = status == null ? StageStatus.FAILED : status;
        this.value = value;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.owner = owner == null ? "" : owner;
        this.reason = reason == null ? "" : reason;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static <T> StageOutcome<T> ok(T value, String owner) {
        return new StageOutcome<>(StageStatus.OK, value, CauseCode.NONE, owner, "", Map.of());
    }

    public static <T> StageOutcome<T> ok(T value, String owner, Map<String, Object> details) {
        return new StageOutcome<>(StageStatus.OK, value, CauseCode.NONE, owner, "", copy(details));
    }

    public static <T> StageOutcome<T> degraded(T value, CauseCode causeCode, String owner, String reason) {
        return new StageOutcome<>(StageStatus.DEGRADED, value, causeCode, owner, reason, Map.of());
    }

    public static <T> StageOutcome<T> degraded(
            T value,
            CauseCode causeCode,
            String owner,
            String reason,
            Map<String, Object> details
    ) {
        return new StageOutcome<>(StageStatus.DEGRADED, value, causeCode, owner, reason, copy(details));
    }

    public static <T> StageOutcome<T> failed(T fallback, CauseCode causeCode, String owner, String reason) {
        return new StageOutcome<>(StageStatus.FAILED, fallback, causeCode, owner, reason, Map.of());
    }

    public boolean isOk() {
        return status == StageStatus.OK;
    }

    public boolean isFailed() {
        return status == StageStatus.FAILED;
    }

    public T valueOr(T fallback) {
        return value == null ? fallback : value;
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : in.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }
}
