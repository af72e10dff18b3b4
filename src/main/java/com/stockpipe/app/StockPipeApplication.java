package com.stockpipe.app;

import com.stockpipe.core.StepResult;
import com.stockpipe.core.StepStatus;
import com.stockpipe.core.RunTelemetry;
import com.stockpipe.jp.archive.ArchiveWriteResult;
import com.stockpipe.jp.config.Config;
import com.stockpipe.jp.error.BackupMissingException;
import com.stockpipe.jp.error.ManifestDriftException;
import com.stockpipe.jp.manifest.ManifestReconciler;
import com.stockpipe.jp.manifest.ReconcilePlan;
import com.stockpipe.jp.manifest.ReconcileResult;
import com.stockpipe.jp.model.PipelineRunReport;
import com.stockpipe.jp.model.RunStatus;
import com.stockpipe.jp.model.SelectionSnapshot;
import com.stockpipe.jp.recommend.MergeJobResult;
import com.stockpipe.jp.runner.RunOptions;
import com.stockpipe.jp.schedule.ExecutionMode;
import com.stockpipe.jp.schedule.ExecutionWindow;
import com.stockpipe.jp.schedule.GuardDecision;
import com.stockpipe.jp.schedule.ModeOverrides;
import com.stockpipe.jp.snapshot.BackupClearance;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * 模块说明：StockPipeApplication（class）。
 * 主要职责：命令行入口，解析子命令（run / reconcile / verify-backup / merge / check-window / archive）并映射退出码。
 * 使用建议：退出码 0=成功，1=中止或失败，2=参数错误，3=检测到清单漂移；调度器应据此判断是否告警。
 */
public final class StockPipeApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_DRIFT = 3;

    private static final String APP_NAME = "stockpipe";
    private static final String USAGE = APP_NAME + " <run|reconcile|verify-backup|merge|check-window|archive> [options]";
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Function<Path, Config> configLoader;
    private final Function<Config, PipelineFactory> factoryProvider;
    private final boolean routeLogs;

    public StockPipeApplication() {
        this(Config::load, PipelineFactory::new, true);
    }

    StockPipeApplication(Function<Path, Config> configLoader, Function<Config, PipelineFactory> factoryProvider, boolean routeLogs) {
        this.configLoader = configLoader;
        this.factoryProvider = factoryProvider;
        this.routeLogs = routeLogs;
    }

    public static void main(String[] args) {
        int exit = new StockPipeApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args == null ? new String[0] : args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp(USAGE, options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp(USAGE, options);
            return EXIT_OK;
        }

        List<String> positional = cmd.getArgList();
        if (positional.size() != 1) {
            new HelpFormatter().printHelp(USAGE, options);
            System.err.println("ERROR: exactly one command is required, got " + positional);
            return EXIT_USAGE;
        }
        String command = positional.get(0).trim().toLowerCase(Locale.ROOT);

        ModeOverrides overrides;
        LocalDate date;
        try {
            date = parseDate(cmd.getOptionValue("date"));
            overrides = cmd.hasOption("mode")
                    ? ModeOverrides.force(ExecutionMode.parse(cmd.getOptionValue("mode")), date)
                    : ModeOverrides.none();
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = configLoader.apply(workingDir);
            if (routeLogs) {
                installLogRoutingIfNeeded(config);
            }
            PipelineFactory factory = factoryProvider.apply(config);
            switch (command) {
                case "run":
                    return runPipeline(factory, overrides, new RunOptions(
                            cmd.hasOption("skip-calendar-check") || config.getBoolean("calendar.skip_check", false),
                            cmd.getOptionValue("trigger", "manual")));
                case "check-window":
                    return checkWindow(factory, overrides, cmd.hasOption("skip-calendar-check"));
                case "verify-backup":
                    return verifyBackup(factory, date);
                case "reconcile":
                    return reconcile(factory, cmd.hasOption("apply"), cmd.hasOption("force"), cmd.hasOption("check"));
                case "merge":
                    return merge(factory, date);
                case "archive":
                    return archiveLive(factory);
                default:
                    new HelpFormatter().printHelp(USAGE, options);
                    System.err.println("ERROR: unknown command: " + command);
                    return EXIT_USAGE;
            }
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            LogManager.getLogger(StockPipeApplication.class).error("command {} failed", command, e);
            return EXIT_FAILED;
        }
    }

    private int runPipeline(PipelineFactory factory, ModeOverrides overrides, RunOptions options) {
        PipelineRunReport report = factory.pipelineRunner().run(overrides, options);
        System.out.println("run_id=" + report.runId
                + " mode=" + report.mode
                + " reference_date=" + report.referenceDate
                + " status=" + report.status);
        for (StepResult step : report.steps) {
            System.out.println("  " + step.step() + " " + step.status()
                    + (step.reason().isEmpty() ? "" : " " + step.reason()));
        }
        if (report.status != RunStatus.ABORTED) {
            return EXIT_OK;
        }
        if (report.stepStatus(RunTelemetry.STEP_VERIFY_WINDOW) == StepStatus.ABORTED) {
            // Outside a trading window nothing is expected to happen.
            System.out.println("not executed: " + report.abortReason);
            return EXIT_OK;
        }
        System.err.println("ERROR: run aborted: " + report.abortReason);
        return EXIT_FAILED;
    }

    private int checkWindow(PipelineFactory factory, ModeOverrides overrides, boolean skipCalendarCheck) {
        ExecutionWindow window = factory.modeSelector().select(factory.clock().instant(), overrides);
        GuardDecision decision = factory.windowGuard().evaluate(window,
                skipCalendarCheck || factory.config().getBoolean("calendar.skip_check", false));
        System.out.println("mode=" + window.mode()
                + " reference_date=" + window.referenceDate()
                + " window=[" + window.windowStart() + " .. " + window.windowEnd() + "]");
        System.out.println(decision.describe());
        return decision.allowed() ? EXIT_OK : EXIT_FAILED;
    }

    private int verifyBackup(PipelineFactory factory, LocalDate date) {
        try {
            BackupClearance clearance = date == null
                    ? factory.backupVerifier().verifyLive()
                    : factory.backupVerifier().verify(date);
            System.out.println(clearance.coversEmptyArtifact()
                    ? "no live selection, nothing to protect"
                    : "backup ok for " + clearance.protectedDate());
            return EXIT_OK;
        } catch (BackupMissingException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int reconcile(PipelineFactory factory, boolean apply, boolean force, boolean checkOnly) throws IOException {
        ManifestReconciler reconciler = factory.manifestReconciler();
        if (checkOnly) {
            try {
                reconciler.check();
                System.out.println("manifest in sync");
                return EXIT_OK;
            } catch (ManifestDriftException e) {
                System.err.println("DRIFT: " + e.getMessage());
                return EXIT_DRIFT;
            }
        }
        ReconcileResult result = apply ? reconciler.apply(force) : reconciler.dryRun();
        ReconcilePlan plan = result.plan();
        System.out.println((result.dryRun() ? "dry-run" : "apply")
                + " manifest_generated_at=" + plan.manifestGeneratedAt()
                + " desired=" + plan.desiredCount()
                + " actual=" + plan.actualCount()
                + " orphans=" + plan.toDelete().size()
                + " missing=" + plan.missing().size());
        for (String key : plan.toDelete()) {
            System.out.println((result.dryRun() ? "  would delete " : "  delete ") + key);
        }
        for (String key : plan.missing()) {
            System.out.println("  missing " + key);
        }
        if (result.hasFailures()) {
            result.failed().forEach((key, error) -> System.err.println("ERROR: delete failed " + key + ": " + error));
            return EXIT_FAILED;
        }
        if (result.dryRun() && !plan.inSync()) {
            return EXIT_DRIFT;
        }
        return EXIT_OK;
    }

    private int merge(PipelineFactory factory, LocalDate date) throws IOException {
        MergeJobResult result = date == null ? factory.mergeJob().run() : factory.mergeJob().run(date);
        System.out.println("merge reference_date=" + result.referenceDate()
                + " total=" + result.total()
                + " refined=" + result.refined()
                + " overrides=" + result.overrides()
                + " layers=" + result.layersFound()
                + " written=" + result.written());
        return EXIT_OK;
    }

    private int archiveLive(PipelineFactory factory) throws IOException {
        Optional<SelectionSnapshot> live = factory.snapshotStore().readLive();
        if (live.isEmpty()) {
            System.out.println("no live selection to archive");
            return EXIT_OK;
        }
        ArchiveWriteResult result = factory.archiveWriter().archiveSelection(live.get());
        System.out.println("archived " + live.get().selectionDate
                + " appended=" + result.appended()
                + " skipped=" + result.skipped()
                + " snapshot_written=" + result.snapshotWritten());
        return EXIT_OK;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (StockPipeApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("stockpipe.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must be initialized before the swap so the console appender keeps the real streams.
                LogManager.getLogger(StockPipeApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private static LocalDate parseDate(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--date must be yyyy-MM-dd: " + raw);
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("mode").hasArg().argName("mode")
                .desc("force execution mode: afternoon | evening | idle").build());
        options.addOption(Option.builder().longOpt("date").hasArg().argName("yyyy-MM-dd")
                .desc("reference date (with --mode), selection date (verify-backup) or merge date").build());
        options.addOption(Option.builder().longOpt("skip-calendar-check")
                .desc("allow the window without consulting the trading calendar").build());
        options.addOption(Option.builder().longOpt("trigger").hasArg().argName("label")
                .desc("label recorded in the run report (default manual)").build());
        options.addOption(Option.builder().longOpt("apply").desc("reconcile: delete orphans instead of a dry run").build());
        options.addOption(Option.builder().longOpt("force").desc("reconcile: allow deleting more than reconcile.max_delete objects").build());
        options.addOption(Option.builder().longOpt("check").desc("reconcile: exit 3 when orphans exist, delete nothing").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
