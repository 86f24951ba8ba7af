package com.signalmix.core;

import com.signalmix.core.diagnostics.StageOutcome;
import com.signalmix.core.diagnostics.StageStatus;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single run's step timings and stage outcomes.
 */
public final class RunTelemetry {
    public static final String STEP_UNIVERSE = "UNIVERSE";
    public static final String STEP_SWING_MODEL = "SWING_MODEL";
    public static final String STEP_SWING_NORMALIZE = "SWING_NORMALIZE";
    public static final String STEP_MICROCAP_SCAN = "MICROCAP_SCAN";
    public static final String STEP_MICROCAP_ADAPT = "MICROCAP_ADAPT";
    public static final String STEP_COMBINE = "COMBINE";
    public static final String STEP_CAP_FETCH = "CAP_FETCH";
    public static final String STEP_CAP_ENRICH = "CAP_ENRICH";
    public static final String STEP_NEWS_API_FETCH = "NEWS_API_FETCH";
    public static final String STEP_NEWS_RSS_FETCH = "NEWS_RSS_FETCH";
    public static final String STEP_NEWS_ENRICH = "NEWS_ENRICH";
    public static final String STEP_EMIT = "EMIT";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final long runId;
    private final String runMode;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();
    private final Map<String, StageRecord> stages = new LinkedHashMap<>();

    public RunTelemetry(long runId, String runMode, String trigger, Instant startedAt) {
        this.runId = runId;
        this.runMode = blankTo(runMode, "PIPELINE");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.finishedAt = null;
        this.errorsTotal = 0;
    }

    public synchronized long runId() {
        return runId;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(
            String name,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        if (optionalNote != null && !optionalNote.trim().isEmpty()) {
            if (stat.optionalNote.isEmpty()) {
                stat.optionalNote = optionalNote.trim();
            } else if (!stat.optionalNote.contains(optionalNote.trim())) {
                stat.optionalNote = stat.optionalNote + "; " + optionalNote.trim();
            }
        }
        if (errorCount > 0L) {
            errorsTotal += (int) Math.max(0L, errorCount);
        }
    }

    public synchronized void recordOutcome(String stage, StageOutcome<?> outcome) {
        if (outcome == null) {
            return;
        }
        String key = sanitizeStepName(stage);
        stages.put(key, new StageRecord(key, outcome.status, outcome.causeCode.name(), outcome.reason));
        if (outcome.isFailed()) {
            errorsTotal++;
        }
    }

    public synchronized List<StageRecord> stageRecords() {
        return new ArrayList<>(stages.values());
    }

    public synchronized long countStages(StageStatus status) {
        return stages.values().stream().filter(r -> r.status() == status).count();
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("stages_ok=").append(countStages(StageStatus.OK))
                .append(" stages_degraded=").append(countStages(StageStatus.DEGRADED))
                .append(" stages_failed=").append(countStages(StageStatus.FAILED)).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            StageRecord stage = stages.get(stat.name);
            if (stage != null) {
                sb.append(" status=").append(stage.status());
                if (stage.status() != StageStatus.OK) {
                    sb.append(" cause=").append(stage.causeCode());
                    if (!stage.reason().isBlank()) {
                        sb.append(" reason=").append(stage.reason().trim());
                    }
                }
            }
            if (stat.optionalNote != null && !stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.elapsedMs = 0L;
            this.itemsIn = 0L;
            this.itemsOut = 0L;
            this.errorCount = 0L;
            this.optionalNote = "";
        }
    }

    public record StageRecord(
            String name,
            StageStatus status,
            String causeCode,
            String reason
    ) {
    }
}
