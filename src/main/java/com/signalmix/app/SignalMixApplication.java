package com.signalmix.app;

import com.signalmix.config.Config;
import com.signalmix.core.diagnostics.CauseCode;
import com.signalmix.external.Collaborators;
import com.signalmix.model.PipelineRunOutcome;
import com.signalmix.output.MissingArtifactException;
import com.signalmix.runner.PipelineRunner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * 模块说明：SignalMixApplication（class）。
 * 主要职责：命令行入口，解析参数、加载配置、安装日志路由并执行流水线或仅渲染报表。
 * 使用建议：退出码 0 表示成功（允许降级），1 表示不可恢复错误，2 表示参数错误。
 */
public final class SignalMixApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

public static void main(String[] args) {
        int exit = new SignalMixApplication().run(args);
        System.exit(exit);
    }

public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("signalmix", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("signalmix", options);
            return 0;
        }
        if (cmd.hasOption("run") && cmd.hasOption("emit-only")) {
            System.err.println("ERROR: --run and --emit-only are mutually exclusive.");
            return 2;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        if (!applyOverrides(cmd, config)) {
            return 2;
        }
        installLogRoutingIfNeeded(config);
        return execute(cmd, config, Collaborators.fromConfig(config));
    }

    int execute(CommandLine cmd, Config config, Collaborators collaborators) {
        logRuntimeConfigSummary(config);
        PipelineRunner runner = new PipelineRunner(config, collaborators, Clock.systemUTC());
        try {
            if (cmd.hasOption("emit-only")) {
                runner.emitOnly();
                return 0;
            }
            PipelineRunOutcome outcome = runner.run(cmd.hasOption("skip-external"));
            System.out.println("PIPELINE completed. run_id=" + outcome.runId
                    + ", rows=" + outcome.rows.size()
                    + ", swing=" + outcome.swingSize
                    + ", microcap=" + outcome.microcapSize
                    + ", stages_failed=" + outcome.stagesFailed);
            return 0;
        } catch (MissingArtifactException e) {
            System.err.println("ERROR: cause=" + CauseCode.MISSING_ARTIFACT + ", " + e.getMessage() + ". Run the pipeline first (--run).");
            return 1;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    static boolean applyOverrides(CommandLine cmd, Config config) {
        if (cmd.hasOption("swing-rows")) {
            Integer rows = parsePositive(cmd.getOptionValue("swing-rows"));
            if (rows == null) {
                System.err.println("ERROR: --swing-rows must be a positive integer.");
                return false;
            }
            config.override("report.swing_rows", String.valueOf(rows));
        }
        if (cmd.hasOption("window-hours")) {
            Integer hours = parsePositive(cmd.getOptionValue("window-hours"));
            if (hours == null) {
                System.err.println("ERROR: --window-hours must be a positive integer.");
                return false;
            }
            config.override("news.window_hours", String.valueOf(hours));
        }
        return true;
    }

    private static Integer parsePositive(String raw) {
        try {
            int value = Integer.parseInt(raw == null ? "" : raw.trim());
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (SignalMixApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("signalmix.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must initialize before the swap so the console appender keeps the real streams.
                LogManager.getLogger(SignalMixApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private void logRuntimeConfigSummary(Config config) {
        System.out.println("Config: working_dir=" + config.workingDir()
                + ", swing_rows=" + config.getInt("report.swing_rows", 12) + "(" + config.sourceOf("report.swing_rows") + ")"
                + ", micro_top_n=" + config.getInt("microcap.top_n", 50) + "(" + config.sourceOf("microcap.top_n") + ")"
                + ", news_window_hours=" + config.getInt("news.window_hours", 96) + "(" + config.sourceOf("news.window_hours") + ")"
                + ", combined=" + config.getPath("combine.out_path"));
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("run").desc("run the full pipeline (default)").build());
        options.addOption(Option.builder().longOpt("emit-only").desc("render the existing combined artifact without running any stage").build());
        options.addOption(Option.builder().longOpt("swing-rows").hasArg().argName("n").desc("number of swing rows to print").build());
        options.addOption(Option.builder().longOpt("window-hours").hasArg().argName("h").desc("news recency window in hours").build());
        options.addOption(Option.builder().longOpt("skip-external").desc("do not invoke model, scanner or fetcher commands").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
