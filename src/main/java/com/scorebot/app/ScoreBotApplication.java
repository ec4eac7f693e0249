package com.scorebot.app;

import com.scorebot.core.error.ConfigurationException;
import com.scorebot.engine.config.Config;
import com.scorebot.engine.model.AnalysisResult;
import com.scorebot.engine.model.DecisionOutcome;
import com.scorebot.engine.model.FeedbackReport;
import com.scorebot.engine.model.RunReport;
import com.scorebot.engine.model.RunState;
import com.scorebot.engine.model.TickerOutcome;
import com.scorebot.engine.query.AnalysisQueryService;
import com.scorebot.engine.query.SearchCriteria;
import com.scorebot.engine.query.TopSummary;
import com.scorebot.engine.runner.ScoreBotEngine;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertiesPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

public final class ScoreBotApplication {
    private static final DateTimeFormatter SCHEDULE_TIME_FMT = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter DISPLAY_TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    enum Job {
        ANALYSIS,
        FEEDBACK
    }

    public static void main(String[] args) {
        int exit = new ScoreBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("scorebot", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("scorebot", options);
            return 0;
        }
        int commands = countCommands(cmd);
        if (commands != 1) {
            new HelpFormatter().printHelp("scorebot", options);
            System.err.println("ERROR: choose exactly one of --analyze, --re-evaluate, --top, --search, --schedule.");
            return 2;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config fileConfig = Config.load(workingDir);
        installLogRoutingIfNeeded(fileConfig);
        logRuntimeConfigSummary(fileConfig, cmd.hasOption("dry-run"));

        try (AnnotationConfigApplicationContext context = createContext(fileConfig, cmd.hasOption("dry-run"))) {
            Config config = context.getBean(Config.class);
            if (cmd.hasOption("analyze")) {
                return runAnalysis(context.getBean(ScoreBotEngine.class));
            }
            if (cmd.hasOption("re-evaluate")) {
                return runFeedback(context.getBean(ScoreBotEngine.class));
            }
            if (cmd.hasOption("top")) {
                return printTop(context.getBean(AnalysisQueryService.class), parsePositiveInt(cmd.getOptionValue("top"), "--top"));
            }
            if (cmd.hasOption("search")) {
                return printSearch(context.getBean(AnalysisQueryService.class), buildCriteria(cmd));
            }
            return runSchedule(config, context.getBean(ScoreBotEngine.class));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (ConfigurationException e) {
            System.err.println("ERROR: configuration problem: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    static AnnotationConfigApplicationContext createContext(Config fileConfig, boolean dryRun) {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        MutablePropertySources sources = context.getEnvironment().getPropertySources();
        sources.addLast(new PropertiesPropertySource("scorebotConfig", fileConfig.asProperties()));
        if (dryRun) {
            sources.addFirst(new MapPropertySource("scorebotCli", Map.of(ScoreBotBootstrapConfig.DRY_RUN_KEY, "true")));
        }
        context.register(ScoreBotBootstrapConfig.class);
        context.refresh();
        return context;
    }

    private int runAnalysis(ScoreBotEngine engine) {
        System.out.println("ANALYSIS start universe=" + engine.universe().size());
        RunReport report = engine.runScheduledAnalysis();
        logRunReport(report);
        return report.state == RunState.DONE ? 0 : 1;
    }

    private int runFeedback(ScoreBotEngine engine) {
        FeedbackReport report = engine.triggerReEvaluation();
        logFeedbackReport(report);
        return 0;
    }

    private void logRunReport(RunReport report) {
        System.out.println("ANALYSIS run_id=" + report.runId
                + ", state=" + report.state
                + ", scored=" + report.scoredCount()
                + ", skipped=" + report.skippedCount()
                + ", gated=" + report.gatedCount()
                + ", notified=" + report.notifiedCount()
                + (report.error.isEmpty() ? "" : ", error=" + report.error));
        for (TickerOutcome outcome : report.outcomes) {
            if (outcome.isScored()) {
                AnalysisResult r = outcome.result;
                System.out.println(String.format(Locale.US,
                        "  %-8s buy=%d short=%d gated=%s notified=%s risk=%s",
                        r.ticker, r.buyScore, r.shortScore, outcome.gated, outcome.notified,
                        r.riskFlag == null ? "-" : r.riskFlag.label()));
            } else {
                System.out.println(String.format(Locale.US,
                        "  %-8s skipped=%s %s", outcome.ticker, outcome.skipReason.label(), outcome.detail));
            }
        }
    }

    private void logFeedbackReport(FeedbackReport report) {
        System.out.println("FEEDBACK date=" + report.tuningDate
                + ", evaluated=" + report.count(DecisionOutcome.Status.EVALUATED)
                + ", already=" + report.count(DecisionOutcome.Status.ALREADY_EVALUATED)
                + ", failed=" + report.count(DecisionOutcome.Status.FAILED)
                + ", applied=" + report.appliedCount());
        for (DecisionOutcome outcome : report.outcomes) {
            System.out.println(String.format(Locale.US,
                    "  run_id=%d %-8s status=%s realized=%s applied=%s rejected=%s discarded=%s%s",
                    outcome.runId,
                    outcome.ticker,
                    outcome.status,
                    Double.isNaN(outcome.realizedPct) ? "-" : String.format(Locale.US, "%.2f%%", outcome.realizedPct),
                    outcome.applied,
                    outcome.rejected,
                    outcome.discarded,
                    outcome.detail.isEmpty() ? "" : " detail=" + outcome.detail));
        }
    }

    private int printTop(AnalysisQueryService queryService, int n) throws Exception {
        TopSummary summary = queryService.topSummary(n);
        if (summary.isEmpty()) {
            System.out.println("No analysis runs stored yet.");
            return 0;
        }
        System.out.println("Latest run_id=" + summary.run.id + " analyzed_at=" + summary.run.analyzedAt);
        System.out.println("Parameters used: " + summary.run.parametersUsed.asMap());
        System.out.println("Top " + n + " by buy_score:");
        summary.topBuy.forEach(r -> System.out.println(formatRow(r)));
        System.out.println("Top " + n + " by short_score:");
        summary.topShort.forEach(r -> System.out.println(formatRow(r)));
        return 0;
    }

    private int printSearch(AnalysisQueryService queryService, SearchCriteria criteria) throws Exception {
        List<AnalysisResult> rows = queryService.search(criteria);
        System.out.println("Search " + criteria + " matches=" + rows.size());
        rows.forEach(r -> System.out.println(formatRow(r)));
        return 0;
    }

    private String formatRow(AnalysisResult r) {
        return String.format(Locale.US,
                "  %-8s price=%.2f rsi=%.1f dev=%.2f trend=%s buy=%d short=%d%s",
                r.ticker, r.price, r.rsi, r.deviationRate, r.trend, r.buyScore, r.shortScore,
                r.hasRationale() ? " rationale=" + r.rationale : "");
    }

    static SearchCriteria buildCriteria(CommandLine cmd) {
        SearchCriteria.SearchCriteriaBuilder builder = SearchCriteria.builder();
        if (cmd.hasOption("min-buy")) {
            builder.minBuyScore(parseInt(cmd.getOptionValue("min-buy"), "--min-buy"));
        }
        if (cmd.hasOption("min-short")) {
            builder.minShortScore(parseInt(cmd.getOptionValue("min-short"), "--min-short"));
        }
        if (cmd.hasOption("sort-by")) {
            builder.sortBy(SearchCriteria.SortBy.parse(cmd.getOptionValue("sort-by")));
        }
        if (cmd.hasOption("order")) {
            String order = cmd.getOptionValue("order").trim().toLowerCase(Locale.ROOT);
            if (!order.equals("asc") && !order.equals("desc")) {
                throw new IllegalArgumentException("--order must be asc or desc");
            }
            builder.descending(order.equals("desc"));
        }
        if (cmd.hasOption("limit")) {
            builder.limit(parsePositiveInt(cmd.getOptionValue("limit"), "--limit"));
        }
        return builder.build();
    }

    private int runSchedule(Config config, ScoreBotEngine engine) {
        ZoneId zoneId = ScoreBotBootstrapConfig.scheduleZone(config);
        Map<LocalTime, List<Job>> slots = buildSlots(
                parseTimes(config.getString("schedule.analysis_times", "")),
                parseTimes(config.getString("schedule.feedback_times", ""))
        );
        if (slots.isEmpty()) {
            System.err.println("ERROR: invalid schedule config. Use schedule.analysis_times=06:00 and schedule.feedback_times=07:00");
            return 2;
        }

        ReentrantLock runLock = new ReentrantLock();
        System.out.println("Schedule mode started. zone=" + zoneId + ", slots=" + formatSlots(slots));
        while (true) {
            ZonedDateTime now = ZonedDateTime.now(zoneId);
            ZonedDateTime next = nextRunTime(now, new ArrayList<>(slots.keySet()));
            List<Job> jobs = slots.get(next.toLocalTime());
            System.out.println("Next run at " + DISPLAY_TS_FMT.format(next) + " jobs=" + jobs);
            if (!sleepUntil(next)) {
                return 130;
            }

            boolean locked = false;
            try {
                runLock.lockInterruptibly();
                locked = true;
                for (Job job : jobs) {
                    runScheduledJob(job, engine);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 130;
            } finally {
                if (locked) {
                    runLock.unlock();
                }
            }
        }
    }

    private void runScheduledJob(Job job, ScoreBotEngine engine) {
        try {
            if (job == Job.ANALYSIS) {
                runAnalysis(engine);
            } else {
                runFeedback(engine);
            }
        } catch (RuntimeException e) {
            System.err.println("WARN: scheduled " + job + " failed: " + e.getMessage());
        }
    }

    static Map<LocalTime, List<Job>> buildSlots(List<LocalTime> analysisTimes, List<LocalTime> feedbackTimes) {
        Map<LocalTime, List<Job>> slots = new TreeMap<>();
        for (LocalTime t : analysisTimes) {
            slots.computeIfAbsent(t, k -> new ArrayList<>()).add(Job.ANALYSIS);
        }
        for (LocalTime t : feedbackTimes) {
            slots.computeIfAbsent(t, k -> new ArrayList<>()).add(Job.FEEDBACK);
        }
        return slots;
    }

    static List<LocalTime> parseTimes(String value) {
        if (value == null || value.trim().isEmpty()) {
            return List.of();
        }
        List<LocalTime> out = new ArrayList<>();
        for (String token : value.split(",")) {
            LocalTime parsed = parseTime(token.trim());
            if (parsed != null && !out.contains(parsed)) {
                out.add(parsed);
            }
        }
        Collections.sort(out);
        return out;
    }

    private static LocalTime parseTime(String value) {
        try {
            return LocalTime.parse(value, SCHEDULE_TIME_FMT);
        } catch (DateTimeParseException e) {
            System.err.println("WARN: ignoring schedule time '" + value + "'");
            return null;
        }
    }

    static ZonedDateTime nextRunTime(ZonedDateTime now, List<LocalTime> runTimes) {
        for (LocalTime t : runTimes) {
            ZonedDateTime candidate = now.toLocalDate().atTime(t).atZone(now.getZone());
            if (candidate.isAfter(now)) {
                return candidate;
            }
        }
        return now.toLocalDate().plusDays(1).atTime(runTimes.get(0)).atZone(now.getZone());
    }

    private boolean sleepUntil(ZonedDateTime next) {
        while (true) {
            long millis = Duration.between(ZonedDateTime.now(next.getZone()), next).toMillis();
            if (millis <= 0) {
                return true;
            }
            try {
                Thread.sleep(Math.min(30_000L, millis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private String formatSlots(Map<LocalTime, List<Job>> slots) {
        return slots.entrySet().stream()
                .map(e -> SCHEDULE_TIME_FMT.format(e.getKey()) + e.getValue())
                .collect(Collectors.joining(","));
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (ScoreBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("scorebot.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must be initialized before the swap so the console appender keeps the real streams.
                LogManager.getLogger(ScoreBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private void logRuntimeConfigSummary(Config config, boolean dryRun) {
        StringBuilder sb = new StringBuilder("RUN_CONFIG dry_run=").append(dryRun);
        for (String key : List.of("analysis.threads", "analysis.universe_file", "feedback.maturity_days", "ai.model", "schedule.zone")) {
            sb.append(' ').append(key).append('=').append(config.getString(key))
                    .append('(').append(config.sourceOf(key)).append(')');
        }
        System.out.println(sb);
    }

    private static int countCommands(CommandLine cmd) {
        int count = 0;
        for (String name : List.of("analyze", "re-evaluate", "top", "search", "schedule")) {
            if (cmd.hasOption(name)) {
                count++;
            }
        }
        return count;
    }

    static int parseInt(String raw, String flag) {
        if (raw == null) {
            throw new IllegalArgumentException(flag + " expects an integer");
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects an integer, got '" + raw + "'");
        }
    }

    private static int parsePositiveInt(String raw, String flag) {
        int value = parseInt(raw, flag);
        if (value <= 0) {
            throw new IllegalArgumentException(flag + " must be positive");
        }
        return value;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("analyze").desc("run one analysis over the ticker universe").build());
        options.addOption(Option.builder().longOpt("re-evaluate").desc("re-evaluate matured decisions and apply tuning suggestions").build());
        options.addOption(Option.builder().longOpt("top").hasArg().argName("n").desc("show top n tickers by buy and short score from the latest run").build());
        options.addOption(Option.builder().longOpt("search").desc("filter and sort results of the latest run").build());
        options.addOption(Option.builder().longOpt("min-buy").hasArg().argName("score").desc("search: minimum buy score").build());
        options.addOption(Option.builder().longOpt("min-short").hasArg().argName("score").desc("search: minimum short score").build());
        options.addOption(Option.builder().longOpt("sort-by").hasArg().argName("field").desc("search: buy_score or short_score").build());
        options.addOption(Option.builder().longOpt("order").hasArg().argName("asc|desc").desc("search: sort order, default desc").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("search: maximum rows, default 20").build());
        options.addOption(Option.builder().longOpt("schedule").desc("run analysis and feedback at the configured times until interrupted").build());
        options.addOption(Option.builder().longOpt("dry-run").desc("use in-memory stores and write mail to files instead of sending").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
