package com.signalmix.runner;

import com.signalmix.caps.CapEnrichmentEngine;
import com.signalmix.caps.CapLookup;
import com.signalmix.combine.SignalCombiner;
import com.signalmix.combine.SignalTableCodec;
import com.signalmix.config.Config;
import com.signalmix.core.RunTelemetry;
import com.signalmix.core.diagnostics.CauseCode;
import com.signalmix.core.diagnostics.StageOutcome;
import com.signalmix.core.diagnostics.StageStatus;
import com.signalmix.external.CollaboratorRequest;
import com.signalmix.external.CollaboratorStep;
import com.signalmix.external.Collaborators;
import com.signalmix.microcap.MicrocapAdapter;
import com.signalmix.model.CombinedRow;
import com.signalmix.model.PipelineRunOutcome;
import com.signalmix.model.SignalRow;
import com.signalmix.news.NewsEnrichmentEngine;
import com.signalmix.output.MissingArtifactException;
import com.signalmix.output.ReportEmitter;
import com.signalmix.swing.SwingReportNormalizer;
import com.signalmix.table.CsvTables;
import com.signalmix.table.Table;
import com.signalmix.universe.UniverseResolution;
import com.signalmix.universe.UniverseResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * 模块说明：PipelineRunner（class）。
 * 主要职责：按固定顺序执行 universe → swing → microcap → combine → caps → news → emit，
 * 每个阶段的结果记录到 RunTelemetry。
 * 使用建议：阶段失败只降级，不中断；唯一不可恢复的情况是 emit-only 时合并文件不存在。
 */
public final class PipelineRunner {
    public static final String RUN_MODE_PIPELINE = "PIPELINE";
    public static final String RUN_MODE_EMIT_ONLY = "EMIT_ONLY";

    private final Config config;
    private final Collaborators collaborators;
    private final Clock clock;

    public PipelineRunner(Config config, Collaborators collaborators, Clock clock) {
        this.config = config;
        this.collaborators = collaborators == null ? Collaborators.none() : collaborators;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public PipelineRunOutcome run(boolean skipExternal) {
        Instant startedAt = clock.instant();
        RunTelemetry telemetry = new RunTelemetry(startedAt.getEpochSecond(), RUN_MODE_PIPELINE, "cli", startedAt);
        System.out.println("Pipeline start: run_id=" + telemetry.runId()
                + ", skip_external=" + skipExternal
                + ", collaborators=" + collaborators.size());

        UniverseResolution emptyUniverse = new UniverseResolution(
                UniverseResolution.Source.EMPTY,
                List.of(),
                config.getPath("universe.valid_path"),
                "universe stage failed"
        );
        StageOutcome<UniverseResolution> universe = stage(
                telemetry, RunTelemetry.STEP_UNIVERSE, 0, emptyUniverse, r -> r.getTickers().size(),
                () -> {
                    UniverseResolution resolution = new UniverseResolver(config).resolve();
                    System.out.println("Universe: source=" + resolution.getSource()
                            + ", size=" + resolution.getTickers().size()
                            + ", path=" + resolution.getPath());
                    if (resolution.getSource() == UniverseResolution.Source.EMPTY) {
                        return StageOutcome.degraded(
                                resolution, CauseCode.MISSING_INPUT, "universe", resolution.getMessage()
                        );
                    }
                    return StageOutcome.ok(resolution, "universe");
                }
        );

        Path validPath = config.getPath("universe.valid_path");
        if (!skipExternal) {
            external(telemetry, RunTelemetry.STEP_SWING_MODEL, Collaborators.SWING_MODEL, CollaboratorRequest.of(
                    "--universe_csv", validPath.toString(),
                    "--out_dir", config.getPath("swing.plan_dir").toString()
            ));
        }
        StageOutcome<List<SignalRow>> swing = stage(
                telemetry, RunTelemetry.STEP_SWING_NORMALIZE, 0, List.of(), List::size,
                () -> new SwingReportNormalizer(config).run()
        );

        if (!skipExternal) {
            external(telemetry, RunTelemetry.STEP_MICROCAP_SCAN, Collaborators.MICROCAP_SCANNER, CollaboratorRequest.of(
                    "--universe", validPath.toString(),
                    "--caps", config.getPath("caps.path").toString(),
                    "--events_csv", config.getPath("news.events_path").toString(),
                    "--top", String.valueOf(config.getInt("microcap.top_n", 50)),
                    "--out_csv", config.getPath("microcap.candidates_path").toString()
            ));
        }
        StageOutcome<List<SignalRow>> microcap = stage(
                telemetry, RunTelemetry.STEP_MICROCAP_ADAPT, 0, List.of(), List::size,
                () -> new MicrocapAdapter(config).run()
        );

        List<SignalRow> swingRows = swing.valueOr(List.of());
        List<SignalRow> microRows = microcap.valueOr(List.of());
        StageOutcome<List<SignalRow>> combined = stage(
                telemetry, RunTelemetry.STEP_COMBINE, swingRows.size() + microRows.size(),
                SignalCombiner.combine(swingRows, microRows), List::size,
                () -> new SignalCombiner(config).run(swingRows, microRows)
        );
        List<SignalRow> combinedRows = combined.valueOr(List.of());

        CapEnrichmentEngine capEngine = new CapEnrichmentEngine(config);
        if (!skipExternal) {
            fetchMissingCaps(telemetry, capEngine, combinedRows);
        }
        List<CombinedRow> unenriched = new ArrayList<>(combinedRows.size());
        for (SignalRow row : combinedRows) {
            unenriched.add(CombinedRow.unenriched(row));
        }
        StageOutcome<List<CombinedRow>> capped = stage(
                telemetry, RunTelemetry.STEP_CAP_ENRICH, combinedRows.size(), unenriched, List::size,
                () -> capEngine.run(combinedRows)
        );

        if (!skipExternal) {
            String hours = String.valueOf(config.getInt("news.window_hours", 96));
            external(telemetry, RunTelemetry.STEP_NEWS_API_FETCH, Collaborators.NEWS_API, CollaboratorRequest.of(
                    "--universe_csv", config.getPath("combine.tickers_path").toString(),
                    "--out_csv", config.getPath("news.api_path").toString(),
                    "--hours", hours
            ));
            external(telemetry, RunTelemetry.STEP_NEWS_RSS_FETCH, Collaborators.NEWS_RSS, CollaboratorRequest.of(
                    "--out_csv", config.getPath("news.rss_path").toString(),
                    "--hours", hours
            ));
        }
        List<CombinedRow> cappedRows = capped.valueOr(unenriched);
        StageOutcome<List<CombinedRow>> news = stage(
                telemetry, RunTelemetry.STEP_NEWS_ENRICH, cappedRows.size(), cappedRows, List::size,
                () -> new NewsEnrichmentEngine(config, clock).run(cappedRows)
        );
        List<CombinedRow> finalRows = news.valueOr(cappedRows);

        StageOutcome<String> emitted = stage(
                telemetry, RunTelemetry.STEP_EMIT, finalRows.size(), "", report -> finalRows.size(),
                () -> StageOutcome.ok(new ReportEmitter(config).render(finalRows), "emit")
        );
        String report = emitted.valueOr("");
        System.out.println(report);

        telemetry.finish();
        String summary = telemetry.getSummary();
        System.out.println(summary);
        UniverseResolution resolution = universe.valueOr(emptyUniverse);
        return new PipelineRunOutcome(
                telemetry.runId(),
                startedAt,
                resolution,
                swingRows.size(),
                microRows.size(),
                finalRows,
                report,
                summary,
                telemetry.countStages(StageStatus.FAILED)
        );
    }

    /**
     * Renders the persisted combined artifact without running any stage.
     */
    public String emitOnly() throws MissingArtifactException, IOException {
        String report = new ReportEmitter(config).emitFromArtifact();
        System.out.println(report);
        return report;
    }

    // Only tickers absent from the cap table are sent to the fetcher; results are merged back.
    private void fetchMissingCaps(RunTelemetry telemetry, CapEnrichmentEngine capEngine, List<SignalRow> rows) {
        stage(telemetry, RunTelemetry.STEP_CAP_FETCH, rows.size(), 0, Integer::longValue, () -> {
            CapLookup lookup = CapEnrichmentEngine.buildLookup(capEngine.readCapTable().orElse(null));
            List<String> missing = CapEnrichmentEngine.missingTickers(rows, lookup);
            if (missing.isEmpty()) {
                return StageOutcome.ok(0, "caps.fetch", Map.of("missing", 0));
            }
            if (collaborators.find(Collaborators.MARKET_CAPS).isEmpty()) {
                return StageOutcome.degraded(
                        0, CauseCode.MISSING_INPUT, "caps.fetch", "collaborator not configured",
                        Map.of("missing", missing.size())
                );
            }

            Path capsPath = config.getPath("caps.path");
            Files.createDirectories(capsPath.toAbsolutePath().getParent());
            Path tickerFile = Files.createTempFile(capsPath.toAbsolutePath().getParent(), "caps_missing_", ".csv");
            Path fetchedFile = Files.createTempFile(capsPath.toAbsolutePath().getParent(), "caps_fetched_", ".csv");
            try {
                Table tickers = Table.empty(List.of(SignalTableCodec.COL_TICKER));
                for (String ticker : missing) {
                    tickers.addRow(Map.of(SignalTableCodec.COL_TICKER, ticker));
                }
                CsvTables.write(tickerFile, tickers);
                Files.deleteIfExists(fetchedFile);

                StageOutcome<Integer> call = CollaboratorStep.invoke(
                        collaborators,
                        Collaborators.MARKET_CAPS,
                        CollaboratorRequest.of(
                                "--universe_csv", tickerFile.toString(),
                                "--out_csv", fetchedFile.toString(),
                                "--cache", config.getPath("caps.cache_path").toString(),
                                "--workers", String.valueOf(collaborators.workers()),
                                "--max", String.valueOf(config.getInt("caps.fetch_max", 10000))
                        )
                );
                if (call.isFailed()) {
                    return StageOutcome.failed(missing.size(), call.causeCode, "caps.fetch", call.reason);
                }
                capEngine.mergeIntoCapTable(fetchedFile);
                return StageOutcome.ok(missing.size(), "caps.fetch", Map.of("missing", missing.size()));
            } finally {
                Files.deleteIfExists(tickerFile);
                Files.deleteIfExists(fetchedFile);
            }
        });
    }

    private void external(RunTelemetry telemetry, String step, String name, CollaboratorRequest request) {
        telemetry.startStep(step);
        StageOutcome<Integer> outcome = CollaboratorStep.invoke(collaborators, name, request);
        telemetry.recordOutcome(step, outcome);
        telemetry.endStep(step, 1, outcome.isOk() ? 1 : 0, 0, "collaborator=" + name);
    }

    private <T> StageOutcome<T> stage(
            RunTelemetry telemetry,
            String step,
            long itemsIn,
            T fallback,
            ToLongFunction<T> sizer,
            StageCall<T> call
    ) {
        telemetry.startStep(step);
        StageOutcome<T> outcome;
        try {
            outcome = call.call();
        } catch (IOException e) {
            System.err.println("WARN: stage failed, step=" + step + ", err=" + e.getMessage());
            outcome = StageOutcome.failed(fallback, CauseCode.IO_ERROR, step, String.valueOf(e.getMessage()));
        } catch (Exception e) {
            System.err.println("WARN: stage failed, step=" + step + ", err=" + e.getClass().getSimpleName()
                    + ": " + e.getMessage());
            outcome = StageOutcome.failed(fallback, CauseCode.RUNTIME_ERROR, step, e.getClass().getSimpleName());
        }
        telemetry.recordOutcome(step, outcome);
        T value = outcome.valueOr(fallback);
        telemetry.endStep(step, itemsIn, value == null ? 0 : sizer.applyAsLong(value), 0, outcome.reason);
        return outcome;
    }

    @FunctionalInterface
    private interface StageCall<T> {
        StageOutcome<T> call() throws Exception;
    }
}
