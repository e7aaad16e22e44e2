package com.marketdw.app;

import com.marketdw.app.properties.EtlProperties;
import com.marketdw.etl.calendar.TradeDates;
import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.error.ChunkFailureException;
import com.marketdw.etl.error.ConfigurationException;
import com.marketdw.etl.guard.GuardOutcome;
import com.marketdw.etl.guard.IdempotencyGuard;
import com.marketdw.etl.guard.ProcessGuardCommand;
import com.marketdw.etl.guard.ReapReport;
import com.marketdw.etl.guard.ZombieReaper;
import com.marketdw.etl.health.HealthAuditor;
import com.marketdw.etl.health.PipelineStatus;
import com.marketdw.etl.health.StatusReportFormatter;
import com.marketdw.etl.layer.BaseLayerJob;
import com.marketdw.etl.layer.Layers;
import com.marketdw.etl.model.RunLogRecord;
import com.marketdw.etl.model.RunType;
import com.marketdw.etl.runner.ChunkDispatcher;
import com.marketdw.etl.runner.ChunkGranularity;
import com.marketdw.etl.runner.LayerRunner;
import com.marketdw.etl.runner.ProcessChunkLauncher;
import com.marketdw.etl.runner.RunSummary;
import com.marketdw.etl.store.RunLedger;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;
import org.springframework.beans.BeansException;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point. Exit codes: 0 success or skip, 1 failure, 2 usage or configuration error.
 */
public final class MarketDwApplication {
    private static final Logger LOG = LogManager.getLogger(MarketDwApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int exit = new MarketDwApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("marketdw", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help") || args == null || args.length == 0) {
            new HelpFormatter().printHelp("marketdw", options);
            return EXIT_OK;
        }

        installLogRoutingIfNeeded();
        try (ConfigurableApplicationContext context = startContext()) {
            return dispatch(cmd, context);
        } catch (ConfigurationException | IllegalArgumentException e) {
            LOG.error("configuration error: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (BeansException e) {
            Throwable root = rootCause(e);
            if (root instanceof ConfigurationException) {
                LOG.error("configuration error: {}", root.getMessage());
                return EXIT_USAGE;
            }
            LOG.error("FATAL: startup failed: {}", root.getMessage(), e);
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("interrupted");
            return EXIT_FAILED;
        } catch (Exception e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    private int dispatch(CommandLine cmd, ConfigurableApplicationContext context) throws Exception {
        EtlProperties etl = context.getBean(EtlProperties.class);
        if (cmd.hasOption("reap-zombies")) {
            return reapZombies(cmd, context.getBean(ZombieReaper.class), etl);
        }
        if (cmd.hasOption("guard")) {
            return runGuarded(cmd, context.getBean(IdempotencyGuard.class), etl);
        }
        if (cmd.hasOption("status")) {
            return reportStatus(cmd, context.getBean(HealthAuditor.class));
        }
        if (cmd.hasOption("list-runs")) {
            return listRuns(cmd, context.getBean(RunLedger.class));
        }
        if (cmd.hasOption("daily")) {
            PipelineStatus status = context.getBean(DailyPipeline.class).run();
            return cmd.hasOption("fail-on-issues") && !status.healthy ? EXIT_FAILED : EXIT_OK;
        }
        if (cmd.hasOption("layer")) {
            return runLayer(cmd, context, etl);
        }
        System.err.println("ERROR: nothing to do; pass --layer, --daily, --status, --list-runs, --guard or --reap-zombies");
        return EXIT_USAGE;
    }

    private int runLayer(CommandLine cmd, ConfigurableApplicationContext context, EtlProperties etl) throws Exception {
        String layer = Layers.normalize(cmd.getOptionValue("layer"));
        RunType mode = parseMode(cmd.getOptionValue("mode", "incremental"));
        Integer start = optionalDate(cmd, "start-date");
        Integer end = optionalDate(cmd, "end-date");

        if (BaseLayerJob.NAME.equals(layer)) {
            int mark = context.getBean(BaseLayerJob.class).run(mode, start == null ? etl.getStartDate() : start);
            System.out.println("base done watermark=" + mark);
            return EXIT_OK;
        }

        LayerRunner runner;
        if (Layers.ODS.equals(layer)) {
            runner = context.getBean("odsRunner", LayerRunner.class);
        } else if (Layers.DWD.equals(layer)) {
            runner = context.getBean("dwdRunner", LayerRunner.class);
        } else {
            throw new IllegalArgumentException("unknown layer: " + layer + " (base|ods|dwd)");
        }
        boolean watermarkEnabled = !cmd.hasOption("disable-watermark");
        if (!watermarkEnabled) {
            runner = runner.withWatermarkDisabled();
        }

        if (cmd.hasOption("init-watermark")) {
            int initStart = start == null ? etl.getStartDate() : start;
            boolean created = runner.initializeWatermark(initStart);
            System.out.println("watermark " + (created ? "initialized" : "already present")
                    + " layer=" + layer + " at=" + TradeDates.previousDay(initStart));
            return EXIT_OK;
        }

        ChunkGranularity chunkBy = ChunkGranularity.fromText(cmd.getOptionValue("chunk-by", "none"));
        if (chunkBy != ChunkGranularity.NONE) {
            if (mode != RunType.INCREMENTAL || start == null || end == null) {
                throw new IllegalArgumentException("--chunk-by requires --mode incremental with --start-date and --end-date");
            }
            int workers = parseInt(cmd.getOptionValue("workers", "1"), "workers");
            ChunkDispatcher dispatcher = new ChunkDispatcher(
                    runner,
                    ProcessChunkLauncher.forCurrentJvm(MarketDwApplication.class.getName(), List.of()),
                    context.getBean(UnitSequencer.class));
            try {
                Integer mark = dispatcher.dispatch(start, end, chunkBy, workers, watermarkEnabled);
                System.out.println("chunked backfill done layer=" + layer + " watermark=" + mark);
                return EXIT_OK;
            } catch (ChunkFailureException e) {
                System.err.println("ERROR: " + e.getMessage());
                return EXIT_FAILED;
            }
        }

        RunSummary summary;
        if (mode == RunType.FULL) {
            summary = runner.runFull(start == null ? etl.getStartDate() : start, end);
        } else {
            summary = runner.runIncremental(start, end);
        }
        System.out.println(summary);
        return EXIT_OK;
    }

    private int reportStatus(CommandLine cmd, HealthAuditor auditor) throws Exception {
        PipelineStatus status = auditor.checkPipeline(optionalDate(cmd, "expected-date"));
        System.out.println(StatusReportFormatter.format(status));
        if (cmd.hasOption("fail-on-issues") && !status.healthy) {
            return EXIT_FAILED;
        }
        return EXIT_OK;
    }

    private int listRuns(CommandLine cmd, RunLedger ledger) throws Exception {
        int limit = parseInt(cmd.getOptionValue("list-runs", "20"), "list-runs");
        List<RunLogRecord> runs = ledger.listRecent(limit);
        System.out.println(String.format(Locale.ROOT, "%-6s %-14s %-11s %-8s %-25s %-25s %5s %5s %s",
                "id", "stream", "type", "status", "start_at", "end_at", "req", "fail", "err"));
        for (RunLogRecord run : runs) {
            System.out.println(String.format(Locale.ROOT, "%-6d %-14s %-11s %-8s %-25s %-25s %5d %5d %s",
                    run.id, run.streamName, run.runType.label(), run.status,
                    run.startAt, run.endAt == null ? "-" : run.endAt,
                    run.requestCount, run.failCount, run.errMsg == null ? "" : run.errMsg));
        }
        return EXIT_OK;
    }

    private int reapZombies(CommandLine cmd, ZombieReaper reaper, EtlProperties etl) throws Exception {
        int minutes = parseInt(cmd.getOptionValue("threshold-minutes",
                Integer.toString(etl.getReaper().getThresholdMinutes())), "threshold-minutes");
        int limit = parseInt(cmd.getOptionValue("limit", "0"), "limit");
        boolean dryRun = !cmd.hasOption("apply");
        ReapReport report = reaper.sweep(Duration.ofMinutes(minutes), dryRun, limit);
        System.out.println((dryRun ? "[DRY-RUN] " : "") + "stale RUNNING rows older than " + minutes + "m: "
                + report.candidateCount() + ", updated=" + report.updated);
        for (ReapReport.Candidate row : report.runLogRows) {
            System.out.println("  run_log " + row);
        }
        for (ReapReport.Candidate row : report.guardRows) {
            System.out.println("  retry_guard " + row);
        }
        return EXIT_OK;
    }

    private int runGuarded(CommandLine cmd, IdempotencyGuard guard, EtlProperties etl) throws Exception {
        String taskName = cmd.getOptionValue("task-name");
        String key = cmd.getOptionValue("idempotency-key");
        List<String> command = cmd.getArgList();
        if (taskName == null || key == null || command.isEmpty()) {
            throw new IllegalArgumentException("--guard requires --task-name, --idempotency-key and a command after --");
        }
        EtlProperties.Guard defaults = etl.getGuard();
        int retries = parseInt(cmd.getOptionValue("retries", Integer.toString(defaults.getRetries())), "retries");
        int delaySec = parseInt(cmd.getOptionValue("retry-delay", Integer.toString(defaults.getRetryDelaySec())), "retry-delay");
        int timeoutSec = parseInt(cmd.getOptionValue("timeout", Integer.toString(defaults.getTimeoutSec())), "timeout");
        GuardOutcome outcome = guard.execute(taskName, key, new ProcessGuardCommand(command),
                retries, Duration.ofSeconds(delaySec), Duration.ofSeconds(timeoutSec));
        System.out.println(outcome);
        return outcome.ok() ? EXIT_OK : EXIT_FAILED;
    }

    private ConfigurableApplicationContext startContext() {
        // keep log4j2.xml in charge instead of Spring Boot's logging setup
        System.setProperty("org.springframework.boot.logging.LoggingSystem", "none");
        return new SpringApplicationBuilder(MarketDwBootstrapConfig.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .run();
    }

    private void installLogRoutingIfNeeded() {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (MarketDwApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = Path.of(System.getProperty("marketdw.log.dir", "logs")).toAbsolutePath().normalize();
                Files.createDirectories(logDir);
                System.setProperty("marketdw.log.dir", logDir.toString());

                // Log4j must be initialized before stdout is swapped so the console appender keeps the real stream.
                LogManager.getLogger(MarketDwApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());
                LOG_ROUTE_INSTALLED = true;
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    static RunType parseMode(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "full":
                return RunType.FULL;
            case "incremental":
            case "inc":
                return RunType.INCREMENTAL;
            default:
                throw new IllegalArgumentException("--mode must be full or incremental, got: " + raw);
        }
    }

    private static Integer optionalDate(CommandLine cmd, String option) {
        String raw = cmd.getOptionValue(option);
        return raw == null ? null : TradeDates.parse(raw);
    }

    private static int parseInt(String raw, String option) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("--" + option + " must be an integer, got: " + raw);
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("layer").hasArg().argName("name").desc("layer to run: base, ods or dwd").build());
        options.addOption(Option.builder().longOpt("mode").hasArg().argName("mode").desc("full or incremental (default incremental)").build());
        options.addOption(Option.builder().longOpt("start-date").hasArg().argName("yyyyMMdd").desc("first trade date to process").build());
        options.addOption(Option.builder().longOpt("end-date").hasArg().argName("yyyyMMdd").desc("last trade date to process").build());
        options.addOption(Option.builder().longOpt("init-watermark").desc("initialize the layer's watermarks to start-date - 1 where absent").build());
        options.addOption(Option.builder().longOpt("disable-watermark").desc("process units without moving any watermark").build());
        options.addOption(Option.builder().longOpt("chunk-by").hasArg().argName("none|year|month").desc("split a backfill range into chunks").build());
        options.addOption(Option.builder().longOpt("workers").hasArg().argName("n").desc("parallel chunk processes (default 1, in-process)").build());
        options.addOption(Option.builder().longOpt("daily").desc("run base, ods and dwd incrementally, then the health audit").build());
        options.addOption(Option.builder().longOpt("status").desc("print the pipeline health report").build());
        options.addOption(Option.builder().longOpt("expected-date").hasArg().argName("yyyyMMdd").desc("trade date the data should reach (default latest open date)").build());
        options.addOption(Option.builder().longOpt("fail-on-issues").desc("exit 1 when the pipeline is unhealthy").build());
        options.addOption(Option.builder().longOpt("list-runs").hasArg().optionalArg(true).argName("n").desc("show the most recent run log rows").build());
        options.addOption(Option.builder().longOpt("reap-zombies").desc("fail RUNNING rows older than the threshold (dry run unless --apply)").build());
        options.addOption(Option.builder().longOpt("threshold-minutes").hasArg().argName("n").desc("age after which RUNNING rows are stale").build());
        options.addOption(Option.builder().longOpt("apply").desc("apply reaper changes instead of a dry run").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("max rows per table the reaper touches").build());
        options.addOption(Option.builder().longOpt("guard").desc("run the command after -- at most once to success per idempotency key").build());
        options.addOption(Option.builder().longOpt("task-name").hasArg().argName("name").desc("guarded task name").build());
        options.addOption(Option.builder().longOpt("idempotency-key").hasArg().argName("key").desc("guarded task key, e.g. the business date").build());
        options.addOption(Option.builder().longOpt("retries").hasArg().argName("n").desc("guard retries after the first attempt").build());
        options.addOption(Option.builder().longOpt("retry-delay").hasArg().argName("sec").desc("seconds between guard attempts").build());
        options.addOption(Option.builder().longOpt("timeout").hasArg().argName("sec").desc("hard timeout per guard attempt").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
