package com.signalmix.model;

import com.signalmix.universe.UniverseResolution;

import java.time.Instant;
import java.util.List;

/**
 * 模块说明：PipelineRunOutcome（class）。
 * 主要职责：一次完整流水线运行的结果快照，供入口打印与测试断言。
 */
public final class PipelineRunOutcome {
    public final long runId;
    public final Instant startedAt;
    public final UniverseResolution universe;
    public final int swingSize;
    public final int microcapSize;
    public final List<CombinedRow> rows;
    public final String report;
    public final String summary;
    public final long stagesFailed;

    public PipelineRunOutcome(
            long runId,
            Instant startedAt,
            UniverseResolution universe,
            int swingSize,
            int microcapSize,
            List<CombinedRow> rows,
            String report,
            String summary,
            long stagesFailed
    ) {
        this.runId = runId;
        this.startedAt = startedAt;
        this.universe = universe;
        this.swingSize = swingSize;
        this.microcapSize = microcapSize;
        this.rows = rows == null ? List.of() : List.copyOf(rows);
        this.report = report == null ? "" : report;
        this.summary = summary == null ? "" : summary;
        this.stagesFailed = stagesFailed;
    }
}
